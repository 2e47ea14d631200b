package nl.bytesoflife.deltaspice.netlist;

import java.util.regex.Pattern;

/**
 * A component line does not follow the grammar of its own prefix.
 */
public class GrammarMismatchException extends NetlistException {

    private final String line;
    private final String pattern;

    public GrammarMismatchException(String line, Pattern pattern) {
        this("Line: \"" + line.strip() + "\" doesn't match regular expression \"" + pattern.pattern() + "\"",
                line, pattern);
    }

    public GrammarMismatchException(String message, String line, Pattern pattern) {
        super(message);
        this.line = line;
        this.pattern = pattern != null ? pattern.pattern() : null;
    }

    public String getLine() {
        return line;
    }

    public String getPattern() {
        return pattern;
    }
}
