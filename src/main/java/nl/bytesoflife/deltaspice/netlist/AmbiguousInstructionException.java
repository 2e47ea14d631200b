package nl.bytesoflife.deltaspice.netlist;

/**
 * Raised when parameter directives are given to the generic instruction API.
 * Parameters are unique per name and must go through the parameter methods.
 */
public class AmbiguousInstructionException extends NetlistException {

    private final String instruction;

    public AmbiguousInstructionException(String instruction) {
        super("The .PARAM instruction should be added using the setParameter method: \""
                + instruction.strip() + "\"");
        this.instruction = instruction;
    }

    public String getInstruction() {
        return instruction;
    }
}
