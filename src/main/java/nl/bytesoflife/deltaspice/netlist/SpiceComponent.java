package nl.bytesoflife.deltaspice.netlist;

import nl.bytesoflife.deltaspice.netlist.grammar.ComponentKind;
import nl.bytesoflife.deltaspice.netlist.grammar.SpiceSyntax;
import nl.bytesoflife.deltaspice.util.EngineeringNotation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;

/**
 * A view over one component line of a circuit.
 * <p>
 * Fields are read from the line when the view is created. Setters locate the
 * line again by designator, splice the new text into the matched span and
 * leave the rest of the line untouched. Views are meant to be short-lived:
 * once the circuit is edited through another path, get a new one.
 */
public class SpiceComponent {

    private final SpiceCircuit parent;
    private final ComponentKind kind;
    private String line;
    private String reference;
    private List<String> nodes;
    private String value;
    private String model;
    private String paramsText;
    private boolean formula;

    /**
     * @throws UnknownPrefixException   if the line has no grammar entry
     * @throws GrammarMismatchException if the line does not follow it
     */
    SpiceComponent(SpiceCircuit parent, int lineIndex) {
        this.parent = parent;
        String text = parent.getTextLine(lineIndex);
        this.kind = ComponentKind.forLine(text);
        load(text);
    }

    private void load(String text) {
        Matcher m = kind.match(text);
        this.line = text;
        this.reference = m.group("designator");
        this.nodes = splitNodes(m.group("nodes"));
        this.value = kind.hasValue() ? m.group("value") : null;
        this.formula = kind.hasFormula() && m.start("formula") >= 0;
        String modelGroup = kind.modelGroup();
        this.model = modelGroup != null ? m.group(modelGroup) : null;
        this.paramsText = kind.hasParams() ? m.group("params") : null;
    }

    public SpiceCircuit getParent() {
        return parent;
    }

    public ComponentKind getKind() {
        return kind;
    }

    public String getReference() {
        return reference;
    }

    public List<String> getNodes() {
        return Collections.unmodifiableList(nodes);
    }

    /**
     * The value text, or the formula with its braces when the value is one.
     */
    public String getValue() {
        if (!kind.hasValue()) {
            throw new GrammarMismatchException(reference + " has no value field", line, kind.getPattern());
        }
        return value;
    }

    public boolean isFormula() {
        return formula;
    }

    /**
     * @throws NumberFormatException if the value is not a number, e.g. a
     *                               formula or a model name
     */
    public double getFloatValue() {
        return EngineeringNotation.parse(getValue());
    }

    /**
     * The model name, or an empty string for a resistor or capacitor without
     * one. For families without a separate model token this is the value.
     */
    public String getModel() {
        if (kind.modelGroup() == null) {
            throw new GrammarMismatchException(reference + " has no model field", line, kind.getPattern());
        }
        return model != null ? model : "";
    }

    public Map<String, String> getParameters() {
        if (paramsText == null) {
            return new LinkedHashMap<>();
        }
        return parseParameters(paramsText, line, kind);
    }

    public String getParameter(String name) {
        for (Map.Entry<String, String> entry : getParameters().entrySet()) {
            if (entry.getKey().equalsIgnoreCase(name)) {
                return entry.getValue();
            }
        }
        throw new ReferenceNotFoundException(name, "Parameter '" + name + "' not found in " + reference);
    }

    public void setValue(String newValue) {
        if (!kind.hasValue()) {
            throw new GrammarMismatchException(reference + " has no value field", line, kind.getPattern());
        }
        splice("value", newValue);
    }

    /**
     * Sets a numeric value, written in engineering notation.
     */
    public void setValue(double newValue) {
        setValue(EngineeringNotation.format(newValue));
    }

    public void setModel(String newModel) {
        String group = kind.modelGroup();
        if (group == null) {
            throw new GrammarMismatchException(reference + " has no model field", line, kind.getPattern());
        }
        splice(group, newModel);
    }

    /**
     * Merges parameters into the component's parameter list. A {@code null}
     * value removes the key; strings are trimmed; numbers are written with six
     * significant digits. Existing keys keep their position, new keys are
     * appended.
     */
    public void setParameters(Map<String, ?> updates) {
        if (!kind.hasParams()) {
            throw new GrammarMismatchException(reference + " does not accept parameters", line, kind.getPattern());
        }
        Map<String, String> params = getParameters();
        for (Map.Entry<String, ?> update : updates.entrySet()) {
            String key = existingKey(params, update.getKey());
            Object newValue = update.getValue();
            if (newValue == null) {
                params.remove(key);
            } else if (newValue instanceof Number n) {
                params.put(key, EngineeringNotation.formatGeneral(n.doubleValue()));
            } else {
                params.put(key, newValue.toString().strip());
            }
        }
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, String> entry : params.entrySet()) {
            sb.append(' ').append(entry.getKey()).append('=').append(entry.getValue());
        }
        splice("params", sb.toString());
    }

    public void setParameter(String name, Object newValue) {
        setParameters(Collections.singletonMap(name, newValue));
    }

    private void splice(String group, String replacement) {
        parent.checkWritable();
        int index = parent.getLineStartingWith(reference);
        String current = parent.getTextLine(index);
        Matcher m = kind.match(current);
        int start = m.start(group);
        int end = m.end(group);
        String updated;
        if (start >= 0) {
            updated = current.substring(0, start) + replacement + current.substring(end);
        } else if ("model".equals(group)) {
            // optional model token not written yet: it goes right after the nodes
            int at = m.end("nodes");
            updated = current.substring(0, at) + " " + replacement + current.substring(at);
        } else {
            throw new GrammarMismatchException(reference + " has no " + group + " field", current, kind.getPattern());
        }
        parent.replaceLine(index, updated);
        load(updated);
    }

    private static String existingKey(Map<String, String> params, String key) {
        for (String existing : params.keySet()) {
            if (existing.equalsIgnoreCase(key)) {
                return existing;
            }
        }
        return key;
    }

    static List<String> splitNodes(String nodesText) {
        List<String> result = new ArrayList<>();
        for (String token : nodesText.strip().split("\\s+")) {
            if (!token.isEmpty() && !token.equals("+")) {
                result.add(token);
            }
        }
        return result;
    }

    static Map<String, String> parseParameters(String text, String line, ComponentKind kind) {
        Map<String, String> params = new LinkedHashMap<>();
        Matcher m = SpiceSyntax.PARAM_TOKEN.matcher(text);
        int pos = 0;
        while (m.find()) {
            if (!isBlank(text, pos, m.start())) {
                throw malformed(text, line, kind);
            }
            params.put(m.group("name"), m.group("value"));
            pos = m.end();
        }
        if (!isBlank(text, pos, text.length())) {
            throw malformed(text, line, kind);
        }
        return params;
    }

    private static boolean isBlank(String text, int from, int to) {
        for (int i = from; i < to; i++) {
            char c = text.charAt(i);
            if (!Character.isWhitespace(c) && c != '+') {
                return false;
            }
        }
        return true;
    }

    private static GrammarMismatchException malformed(String text, String line, ComponentKind kind) {
        return new GrammarMismatchException("Malformed parameter list \"" + text.strip() + "\"", line, kind.getPattern());
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "%s %s %s", reference, String.join(" ", nodes), value != null ? value : "");
    }
}
