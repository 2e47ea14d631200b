package nl.bytesoflife.deltaspice.netlist;

/**
 * A component, parameter or subcircuit could not be found in the scope, its
 * ancestors or the libraries they include.
 */
public class ReferenceNotFoundException extends NetlistException {

    private final String reference;

    public ReferenceNotFoundException(String reference, String message) {
        super(message);
        this.reference = reference;
    }

    public String getReference() {
        return reference;
    }
}
