package nl.bytesoflife.deltaspice.netlist.grammar;

import nl.bytesoflife.deltaspice.netlist.UnknownPrefixException;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Tells what kind of command a netlist line holds.
 * <p>
 * The command is the upper-cased component prefix for instance lines,
 * {@value #COMMENT} for comments and blank lines, {@value #CONTINUATION} for
 * continuation lines and the upper-cased keyword (dot included) for
 * directives.
 */
public final class LineClassifier {

    public static final String COMMENT = "*";
    public static final String CONTINUATION = "+";

    public static final String SUBCKT = ".SUBCKT";
    public static final String ENDS = ".ENDS";
    public static final String END = ".END";
    public static final String PARAM = ".PARAM";
    public static final String PARAMS = ".PARAMS";
    public static final String BACKANNO = ".BACKANNO";

    // A netlist runs a single analysis
    private static final Set<String> UNIQUE_INSTRUCTIONS = Set.of(".AC", ".DC", ".TRAN", ".NOISE", ".TF");

    private static final String COMMENT_CHARS = "#;*\n\r";

    private LineClassifier() {
    }

    /**
     * @throws UnknownPrefixException if the first non-blank character starts
     *                                no known command
     */
    public static String classify(String line) {
        return tryClassify(line).orElseThrow(() -> new UnknownPrefixException(line));
    }

    /**
     * Same as {@link #classify(String)} but empty for unrecognized lines.
     */
    public static Optional<String> tryClassify(String line) {
        int i = firstNonBlank(line);
        if (i < 0) {
            return Optional.of(COMMENT);
        }
        char ch = Character.toUpperCase(line.charAt(i));
        if (ComponentKind.isPrefix(ch)) {
            return Optional.of(String.valueOf(ch));
        }
        if (ch == '+') {
            return Optional.of(CONTINUATION);
        }
        if (COMMENT_CHARS.indexOf(ch) >= 0) {
            return Optional.of(COMMENT);
        }
        if (ch == '.') {
            int j = i + 1;
            while (j < line.length() && !isSeparator(line.charAt(j))) {
                j++;
            }
            return Optional.of(line.substring(i, j).toUpperCase(Locale.ROOT));
        }
        return Optional.empty();
    }

    public static boolean isComponent(String command) {
        return command.length() == 1 && ComponentKind.isPrefix(command.charAt(0));
    }

    public static boolean isUniqueInstruction(String command) {
        return UNIQUE_INSTRUCTIONS.contains(command);
    }

    public static boolean isParameterDirective(String command) {
        return PARAM.equals(command) || PARAMS.equals(command);
    }

    /**
     * The first whitespace-delimited token of the line, upper-cased.
     */
    public static String firstTokenUpper(String line) {
        int i = firstNonBlank(line);
        if (i < 0) {
            return "";
        }
        int j = i;
        while (j < line.length() && !Character.isWhitespace(line.charAt(j))) {
            j++;
        }
        return line.substring(i, j).toUpperCase(Locale.ROOT);
    }

    /**
     * Index of the first character that is neither a space nor a tab, or -1.
     */
    public static int firstNonBlank(String line) {
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c != ' ' && c != '\t') {
                return i;
            }
        }
        return -1;
    }

    /**
     * Length of the line without its trailing line terminator.
     */
    public static int contentEnd(String line) {
        int end = line.length();
        if (end > 0 && line.charAt(end - 1) == '\n') {
            end--;
        }
        if (end > 0 && line.charAt(end - 1) == '\r') {
            end--;
        }
        return end;
    }

    public static String stripTerminator(String line) {
        return line.substring(0, contentEnd(line));
    }

    private static boolean isSeparator(char c) {
        return c == ' ' || c == '\t' || c == '\r' || c == '\n';
    }
}
