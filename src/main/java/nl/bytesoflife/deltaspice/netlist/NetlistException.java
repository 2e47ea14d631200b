package nl.bytesoflife.deltaspice.netlist;

/**
 * Base class of all errors raised while interpreting or editing a netlist.
 */
public class NetlistException extends RuntimeException {

    public NetlistException(String message) {
        super(message);
    }

    public NetlistException(String message, Throwable cause) {
        super(message, cause);
    }
}
