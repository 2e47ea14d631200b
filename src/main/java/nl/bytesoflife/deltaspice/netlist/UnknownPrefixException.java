package nl.bytesoflife.deltaspice.netlist;

public class UnknownPrefixException extends NetlistException {

    private final String line;

    public UnknownPrefixException(String line) {
        super("Unrecognized command in line: \"" + line.strip() + "\"");
        this.line = line;
    }

    public String getLine() {
        return line;
    }
}
