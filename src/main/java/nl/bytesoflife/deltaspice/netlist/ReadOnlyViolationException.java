package nl.bytesoflife.deltaspice.netlist;

public class ReadOnlyViolationException extends NetlistException {

    public ReadOnlyViolationException(String message) {
        super(message);
    }
}
