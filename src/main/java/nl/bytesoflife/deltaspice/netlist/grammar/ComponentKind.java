package nl.bytesoflife.deltaspice.netlist.grammar;

import nl.bytesoflife.deltaspice.netlist.GrammarMismatchException;
import nl.bytesoflife.deltaspice.netlist.UnknownPrefixException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static nl.bytesoflife.deltaspice.netlist.grammar.SpiceSyntax.FLOAT;
import static nl.bytesoflife.deltaspice.netlist.grammar.SpiceSyntax.MODEL_NAME;
import static nl.bytesoflife.deltaspice.netlist.grammar.SpiceSyntax.PARAMS;
import static nl.bytesoflife.deltaspice.netlist.grammar.SpiceSyntax.STRICT_PARAMS;
import static nl.bytesoflife.deltaspice.netlist.grammar.SpiceSyntax.WS;
import static nl.bytesoflife.deltaspice.netlist.grammar.SpiceSyntax.designator;
import static nl.bytesoflife.deltaspice.netlist.grammar.SpiceSyntax.escapedDesignator;
import static nl.bytesoflife.deltaspice.netlist.grammar.SpiceSyntax.nodes;
import static nl.bytesoflife.deltaspice.netlist.grammar.SpiceSyntax.value;

/**
 * The grammar table: one component family per designator prefix, each with
 * the compiled pattern of its instance line.
 * <p>
 * Patterns expose the named groups {@code designator}, {@code nodes} and,
 * depending on the family, {@code value}, {@code formula}, {@code model} and
 * {@code params}. Only resistors and capacitors carry a {@code model} token of
 * their own; every other family stores its model in the {@code value} span.
 */
public enum ComponentKind {

    // LTspice special functions: 8 pins and a model name
    SPECIAL_FUNCTION('A', escapedDesignator("A") + nodes(8) + WS + MODEL_NAME + PARAMS + ".*?$"),
    BEHAVIORAL_SOURCE('B', escapedDesignator("B") + nodes(2) + WS + "(?<value>.*)$"),
    CAPACITOR('C', escapedDesignator("C") + nodes(2) + "(?:" + WS + "(?<model>\\w+))?" + WS
            + value(FLOAT + "[muµnpfgt]?F?") + PARAMS + ".*?$"),
    DIODE('D', escapedDesignator("D") + nodes(2) + WS + MODEL_NAME + PARAMS + ".*?$"),
    // Only the gain is editable
    VOLTAGE_CONTROLLED_VOLTAGE_SOURCE('E', escapedDesignator("E") + nodes(2, 4) + WS + "(?<value>.*)$"),
    // Everything after the two output nodes is the value
    CURRENT_CONTROLLED_CURRENT_SOURCE('F', escapedDesignator("F") + nodes(2) + WS + "(?<value>.*)$"),
    VOLTAGE_CONTROLLED_CURRENT_SOURCE('G', escapedDesignator("G") + nodes(2, 4) + WS + "(?<value>.*)$"),
    CURRENT_CONTROLLED_VOLTAGE_SOURCE('H', escapedDesignator("H") + nodes(2) + WS + "(?<value>.*)$"),
    CURRENT_SOURCE('I', escapedDesignator("I") + nodes(2) + WS + "(?<value>.*?)" + STRICT_PARAMS + "$"),
    JFET('J', escapedDesignator("J") + nodes(3) + WS + MODEL_NAME + PARAMS + ".*?$"),
    MUTUAL_INDUCTANCE('K', escapedDesignator("K") + nodes(2, 4) + WS
            + "(?<value>[+\\-]?[0-9.E+\\-]+[kmuµnpgt]?).*$"),
    INDUCTOR('L', escapedDesignator("L") + nodes(2) + WS
            + value("[0-9.E+\\-]+(?:Meg|[kmuµnpgt])?H?") + ".*$"),
    MOSFET('M', escapedDesignator("M") + nodes(3, 4) + WS + MODEL_NAME + PARAMS + ".*?$"),
    LOSSY_TRANSMISSION_LINE('O', escapedDesignator("O") + nodes(4) + WS + MODEL_NAME + PARAMS + ".*?$"),
    BIPOLAR_TRANSISTOR('Q', escapedDesignator("Q") + nodes(3, 4) + WS + MODEL_NAME + PARAMS + ".*?$"),
    RESISTOR('R', escapedDesignator("R") + nodes(2) + "(?:" + WS + "(?<model>\\w+))?" + WS + "(?:R=)?"
            + value(FLOAT + "(?:Meg|[kRmuµnpfgt])?\\d*") + PARAMS + ".*?$"),
    VOLTAGE_CONTROLLED_SWITCH('S', escapedDesignator("S") + nodes(4) + WS + "(?<value>.*)$"),
    LOSSLESS_TRANSMISSION_LINE('T', escapedDesignator("T") + nodes(4) + WS + "(?<value>.*)$"),
    UNIFORM_RC_LINE('U', escapedDesignator("U") + nodes(3) + WS + "(?<value>.*)$"),
    // ex: V1 in 0 PWL(1u 0 +2n 1 +1m 1) AC 1 Rser=3 Cpar=4
    VOLTAGE_SOURCE('V', escapedDesignator("V") + nodes(2) + WS + "(?<value>.*?)" + STRICT_PARAMS + "$"),
    CURRENT_CONTROLLED_SWITCH('W', escapedDesignator("W") + nodes(2) + WS + "(?<value>.*)$"),
    // Any number of nodes, then the subcircuit name, then optional key=value parameters
    SUBCIRCUIT('X', escapedDesignator("X") + nodes(1, 99) + WS + "(?<value>[\\w.]+)(?![\\w.]|\\s*=)"
            + "(?:" + WS + "params:)?" + PARAMS + "\\s*\\\\?$"),
    // MESFET and IGBT, parameters not editable
    MESFET('Z', escapedDesignator("Z") + nodes(3) + WS + MODEL_NAME + ".*$"),
    // Frequency response analysis wiggler
    FRA_WIGGLER('@', "^(?<designator>@§?\\d+)" + nodes(2) + "\\s?(?<params>.*)$"),
    QSPICE_ATILDE('Ã', designator("Ã") + nodes(16) + WS + "(?<value>.*)" + PARAMS + ".*?$"),
    QSPICE_YEN('¥', designator("¥") + nodes(16) + WS + "(?<value>.*)" + PARAMS + ".*?$"),
    QSPICE_EURO('€', designator("€") + nodes(32) + WS + "(?<value>.*)" + PARAMS + ".*?$"),
    QSPICE_POUND('£', designator("£") + nodes(64) + WS + "(?<value>.*)" + PARAMS + ".*?$"),
    QSPICE_OSLASH('Ø', designator("Ø") + nodes(1, 99) + WS + "(?<value>.*)" + PARAMS + ".*?$"),
    QSPICE_MULTIPLY('×', designator("×") + nodes(4, 16) + WS
            + "(?<value>.*)(?<params>(?:\\w+\\s+){1,8})\\s*\\\\?$"),
    LTSPICE_OUMLAUT('Ö', designator("Ö") + nodes(5) + WS + "(?<params>.*?)\\s*\\\\?$");

    private static final Map<Character, ComponentKind> BY_PREFIX;

    static {
        Map<Character, ComponentKind> map = new LinkedHashMap<>();
        for (ComponentKind kind : values()) {
            map.put(kind.prefix, kind);
        }
        BY_PREFIX = Collections.unmodifiableMap(map);
    }

    private final char prefix;
    private final Pattern pattern;
    private final boolean hasValue;
    private final boolean hasModel;
    private final boolean hasParams;
    private final boolean hasFormula;

    ComponentKind(char prefix, String regex) {
        this.prefix = prefix;
        this.pattern = Pattern.compile(regex, SpiceSyntax.FLAGS);
        this.hasValue = regex.contains("(?<value>");
        this.hasModel = regex.contains("(?<model>");
        this.hasParams = regex.contains("(?<params>");
        this.hasFormula = regex.contains("(?<formula>");
    }

    public char getPrefix() {
        return prefix;
    }

    public Pattern getPattern() {
        return pattern;
    }

    public boolean hasValue() {
        return hasValue;
    }

    public boolean hasParams() {
        return hasParams;
    }

    /**
     * Whether the value may be a brace formula captured in a group of its own.
     */
    public boolean hasFormula() {
        return hasFormula;
    }

    /**
     * Whether the model has a span of its own. When false, the model and the
     * value are the same text.
     */
    public boolean hasSeparateModel() {
        return hasModel;
    }

    /**
     * Name of the capture group holding the model, or {@code null} when the
     * family has neither a model nor a value.
     */
    public String modelGroup() {
        if (hasModel) {
            return "model";
        }
        return hasValue ? "value" : null;
    }

    /**
     * Matches the grammar against a line, ignoring leading blanks and the line
     * terminator. Group offsets are relative to the full line.
     *
     * @throws GrammarMismatchException if the line does not follow this grammar
     */
    public Matcher match(String line) {
        Matcher matcher = matcher(line);
        if (!matcher.lookingAt()) {
            throw new GrammarMismatchException(line, pattern);
        }
        return matcher;
    }

    public boolean matches(String line) {
        return matcher(line).lookingAt();
    }

    private Matcher matcher(String line) {
        int start = Math.max(LineClassifier.firstNonBlank(line), 0);
        int end = Math.max(LineClassifier.contentEnd(line), start);
        return pattern.matcher(line).region(start, end);
    }

    public static boolean isPrefix(char c) {
        return BY_PREFIX.containsKey(Character.toUpperCase(c));
    }

    public static Optional<ComponentKind> find(char prefix) {
        return Optional.ofNullable(BY_PREFIX.get(Character.toUpperCase(prefix)));
    }

    /**
     * @throws UnknownPrefixException if no family uses the first non-blank
     *                                character of the line
     */
    public static ComponentKind forLine(String line) {
        int start = LineClassifier.firstNonBlank(line);
        if (start < 0) {
            throw new UnknownPrefixException(line);
        }
        return find(line.charAt(start)).orElseThrow(() -> new UnknownPrefixException(line));
    }

    public static String allPrefixes() {
        StringBuilder sb = new StringBuilder();
        for (char c : BY_PREFIX.keySet()) {
            sb.append(c);
        }
        return sb.toString();
    }
}
