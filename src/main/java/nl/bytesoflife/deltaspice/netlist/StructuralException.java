package nl.bytesoflife.deltaspice.netlist;

/**
 * The line structure of a netlist is broken: a scope without its terminator,
 * a continuation line with nothing to continue, a subcircuit without its
 * {@code .SUBCKT} clause.
 */
public class StructuralException extends NetlistException {

    public StructuralException(String message) {
        super(message);
    }
}
