package nl.bytesoflife.deltaspice.netlist.grammar;

import java.util.regex.Pattern;

/**
 * Regular expression fragments shared by the grammar table and the directive
 * patterns used by the editor.
 */
public final class SpiceSyntax {

    static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE
            | Pattern.UNICODE_CHARACTER_CLASS | Pattern.DOTALL;

    // A '+' right after a line break is a merged continuation marker and counts as whitespace
    static final String WS = "(?:\\s|(?<=\\n)\\+)+";

    static final String FLOAT = "[-+]?[0-9]*\\.?[0-9]+(?:[eE][-+]?[0-9]+)?";

    // Brace formulas are captured whole, up to a closing brace followed by whitespace or the end
    static final String FORMULA = "\\{.*?\\}(?=\\s|$)";

    private static final String PARAM_VALUE = "[\\w{}()\\-+*/%.]+";

    // key[=value] tokens, flags without a value are tolerated by the pattern
    static final String PARAMS = "(?<params>(?:" + WS + "\\w+\\s*(?:=\\s*" + PARAM_VALUE + ")?)*)";

    // key=value tokens only
    static final String STRICT_PARAMS = "(?<params>(?:" + WS + "\\w+\\s*=\\s*" + PARAM_VALUE + ")*)";

    // A bare model name; must not be the key of a key=value token
    static final String MODEL_NAME = "(?<value>\\w+)(?!\\w|\\s*=)";

    /** {@code .SUBCKT <name> ...} */
    public static final Pattern SUBCKT_NAME = Pattern.compile("^\\s*\\.SUBCKT\\s+(?<name>[\\w.]+)", FLAGS);

    /** {@code .ENDS [<name>]} */
    public static final Pattern ENDS_NAME = Pattern.compile("^\\s*\\.ENDS(?:[ \\t]+(?<name>[\\w.]+))?", FLAGS);

    /** {@code .LIB file}, {@code .INC file} and {@code .INCLUDE file} */
    public static final Pattern LIBRARY_INCLUDE = Pattern.compile("^\\s*\\.(?:LIB|INC|INCLUDE)\\s+(?<file>.*)$", FLAGS);

    /** One {@code name=value} assignment inside a {@code .PARAM} directive. */
    public static final Pattern PARAM_ASSIGNMENT = Pattern.compile(
            "(?<![\\w.])(?<name>\\w+)\\s*=\\s*(?<value>\\{[^}]*\\}|[^\\s=;{}]+)", FLAGS);

    /** One {@code key=value} token of a component parameter list. */
    public static final Pattern PARAM_TOKEN = Pattern.compile("(?<name>\\w+)\\s*=\\s*(?<value>[^\\s=]+)", FLAGS);

    private SpiceSyntax() {
    }

    static String designator(String prefix) {
        return "^(?<designator>" + prefix + "\\w+)";
    }

    static String escapedDesignator(String prefix) {
        return designator(prefix + "§?");
    }

    static String nodes(int count) {
        return "(?<nodes>(?:" + WS + "\\S+){" + count + "})";
    }

    static String nodes(int min, int max) {
        return "(?<nodes>(?:" + WS + "\\S+){" + min + "," + max + "})";
    }

    static String value(String numberRegex) {
        return "(?<value>(?<formula>" + FORMULA + ")|" + numberRegex + ")";
    }
}
