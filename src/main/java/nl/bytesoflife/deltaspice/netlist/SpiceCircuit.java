package nl.bytesoflife.deltaspice.netlist;

import nl.bytesoflife.deltaspice.netlist.NetlistLine.Nested;
import nl.bytesoflife.deltaspice.netlist.NetlistLine.Text;
import nl.bytesoflife.deltaspice.netlist.grammar.ComponentKind;
import nl.bytesoflife.deltaspice.netlist.grammar.LineClassifier;
import nl.bytesoflife.deltaspice.netlist.grammar.SpiceSyntax;
import nl.bytesoflife.deltaspice.util.EncodingDetectException;
import nl.bytesoflife.deltaspice.util.EncodingDetector;
import nl.bytesoflife.deltaspice.util.EngineeringNotation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * An ordered list of netlist lines, each either raw text or a nested
 * subcircuit definition.
 * <p>
 * The root scope of a netlist ends at {@code .END}; subcircuit scopes run from
 * their {@code .SUBCKT} line to the matching {@code .ENDS}. Lines are kept
 * with their terminators and written back unchanged unless an operation edits
 * them.
 * <p>
 * Components inside subcircuit instances are addressed with hierarchical
 * references such as {@code X1:R1}. Editing through such a reference never
 * touches the shared definition: the first edit clones it under the name
 * {@code <definition>_<instance>}, points the instance line at the clone and
 * registers the clone so later edits on the same instance reuse it. Clones are
 * written just before the terminator of the scope that registered them.
 */
public class SpiceCircuit {

    private static final Logger log = LoggerFactory.getLogger(SpiceCircuit.class);

    public static final char HIERARCHY_SEPARATOR = ':';

    private static final String LIBRARY_PROBE = "(?i)^\\s*\\.SUBCKT";

    private final List<NetlistLine> lines = new ArrayList<>();
    private final Map<String, SpiceCircuit> modifiedSubcircuits = new LinkedHashMap<>();
    private final SpiceCircuit parent;
    private final String terminator;
    private final boolean readOnly;
    private LibraryPaths libraryPaths;

    /**
     * An empty, standalone subcircuit scope. Give it a name with
     * {@link #rename(String)} to get a {@code .SUBCKT}/{@code .ENDS} skeleton.
     */
    public SpiceCircuit() {
        this(null, LineClassifier.ENDS, false);
    }

    protected SpiceCircuit(SpiceCircuit parent, String terminator, boolean readOnly) {
        this.parent = parent;
        this.terminator = terminator;
        this.readOnly = readOnly;
    }

    // ---- building and writing ----

    /**
     * Consumes lines until this scope's terminator.
     *
     * @return whether the terminator was found before the input ran out
     */
    boolean collect(Iterator<String> source) {
        while (source.hasNext()) {
            String line = source.next();
            String command = LineClassifier.tryClassify(line).orElse(null);
            if (LineClassifier.SUBCKT.equals(command)) {
                SpiceCircuit child = new SpiceCircuit(this, LineClassifier.ENDS, readOnly);
                child.lines.add(new Text(line));
                if (!child.collect(source)) {
                    throw new StructuralException("Missing " + LineClassifier.ENDS + " for subcircuit: "
                            + LineClassifier.stripTerminator(line).strip());
                }
                lines.add(new Nested(child));
            } else if (LineClassifier.CONTINUATION.equals(command)) {
                appendContinuation(line);
            } else {
                if (command != null && LineClassifier.isComponent(command)) {
                    line = stripEscape(line);
                }
                lines.add(new Text(line));
                if (terminator.equals(command)) {
                    return true;
                }
            }
        }
        return false;
    }

    private void appendContinuation(String line) {
        if (lines.isEmpty() || !(lines.get(lines.size() - 1) instanceof Text previous)) {
            throw new StructuralException("Continuation line without a line to continue: "
                    + LineClassifier.stripTerminator(line));
        }
        lines.set(lines.size() - 1, new Text(previous.text() + line));
    }

    // R§1 is written by some schematic editors to escape the designator
    private static String stripEscape(String line) {
        int i = LineClassifier.firstNonBlank(line);
        if (i + 1 < line.length() && line.charAt(i + 1) == '§') {
            return line.substring(0, i + 1) + line.substring(i + 2);
        }
        return line;
    }

    static List<String> splitLines(String text) {
        List<String> result = new ArrayList<>();
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                result.add(text.substring(start, i + 1));
                start = i + 1;
            }
        }
        if (start < text.length()) {
            result.add(text.substring(start));
        }
        return result;
    }

    void writeLines(StringBuilder out) {
        boolean flushed = false;
        for (NetlistLine line : lines) {
            if (line instanceof Nested nested) {
                nested.circuit().writeLines(out);
            } else if (line instanceof Text text) {
                if (!flushed && isTerminator(text.text())) {
                    writeClones(out);
                    flushed = true;
                }
                out.append(text.text());
            }
        }
        if (!flushed) {
            writeClones(out);
        }
    }

    private void writeClones(StringBuilder out) {
        for (SpiceCircuit clone : modifiedSubcircuits.values()) {
            if (out.length() > 0 && out.charAt(out.length() - 1) != '\n') {
                out.append(getLineTerminator());
            }
            clone.writeLines(out);
        }
    }

    void clear() {
        lines.clear();
        modifiedSubcircuits.clear();
    }

    void appendText(String text) {
        lines.add(new Text(text));
    }

    // ---- line access ----

    String getTextLine(int index) {
        if (lines.get(index) instanceof Text text) {
            return text.text();
        }
        throw new StructuralException("Line " + index + " of " + describe() + " is a subcircuit definition");
    }

    void replaceLine(int index, String text) {
        lines.set(index, new Text(text));
    }

    void checkWritable() {
        if (readOnly) {
            throw new ReadOnlyViolationException("Subcircuit " + describe() + " was loaded from a library and is read-only");
        }
    }

    /**
     * Index of the direct line whose first token is {@code token}, compared
     * case-insensitively. Nested subcircuit definitions are not searched.
     *
     * @throws ReferenceNotFoundException if there is no such line
     */
    public int getLineStartingWith(String token) {
        return findLineStartingWith(token).orElseThrow(() ->
                new ReferenceNotFoundException(token, "Reference '" + token + "' not found in " + describe()));
    }

    private OptionalInt findLineStartingWith(String token) {
        String wanted = token.toUpperCase(Locale.ROOT);
        for (int i = 0; i < lines.size(); i++) {
            if (lines.get(i) instanceof Text text && LineClassifier.firstTokenUpper(text.text()).equals(wanted)) {
                return OptionalInt.of(i);
            }
        }
        return OptionalInt.empty();
    }

    public List<NetlistLine> getLines() {
        return Collections.unmodifiableList(lines);
    }

    // ---- components ----

    /**
     * A view over the component {@code reference}, which may be hierarchical.
     * The view reads the shared definition unless the instance was already
     * cloned.
     */
    public SpiceComponent getComponent(String reference) {
        int sep = reference.indexOf(HIERARCHY_SEPARATOR);
        if (sep < 0) {
            return new SpiceComponent(this, getLineStartingWith(reference));
        }
        return resolveInstance(reference.substring(0, sep)).getComponent(reference.substring(sep + 1));
    }

    /**
     * Designators of the components of this scope whose prefix is one of
     * {@code prefixes}, or of all components when none is given.
     */
    public List<String> getComponents(String prefixes) {
        Set<Character> wanted = new HashSet<>();
        for (char c : prefixes.toUpperCase(Locale.ROOT).toCharArray()) {
            wanted.add(c);
        }
        List<String> result = new ArrayList<>();
        for (NetlistLine line : lines) {
            if (!(line instanceof Text text)) {
                continue;
            }
            Optional<String> command = LineClassifier.tryClassify(text.text());
            if (command.isPresent() && LineClassifier.isComponent(command.get())
                    && (wanted.isEmpty() || wanted.contains(command.get().charAt(0)))) {
                result.add(text.text().strip().split("\\s+", 2)[0]);
            }
        }
        return result;
    }

    public List<String> getComponents() {
        return getComponents("");
    }

    public String getComponentValue(String reference) {
        return getComponent(reference).getValue();
    }

    public double getComponentFloatValue(String reference) {
        return getComponent(reference).getFloatValue();
    }

    public String getComponentModel(String reference) {
        return getComponent(reference).getModel();
    }

    public List<String> getComponentNodes(String reference) {
        return getComponent(reference).getNodes();
    }

    public Map<String, String> getComponentParameters(String reference) {
        return getComponent(reference).getParameters();
    }

    public void setComponentValue(String reference, String value) {
        writableComponent(reference).setValue(value);
    }

    public void setComponentValue(String reference, double value) {
        writableComponent(reference).setValue(value);
    }

    /**
     * Sets several values at once. Numbers are written in engineering
     * notation, anything else with {@code toString()}.
     */
    public void setComponentValues(Map<String, ?> values) {
        for (Map.Entry<String, ?> entry : values.entrySet()) {
            if (entry.getValue() instanceof Number number) {
                setComponentValue(entry.getKey(), number.doubleValue());
            } else {
                setComponentValue(entry.getKey(), String.valueOf(entry.getValue()));
            }
        }
    }

    public void setComponentModel(String reference, String model) {
        writableComponent(reference).setModel(model);
    }

    public void setComponentParameters(String reference, Map<String, ?> parameters) {
        writableComponent(reference).setParameters(parameters);
    }

    /**
     * Adds a component line. A component with the same designator is replaced
     * in place; otherwise the line is inserted before {@code .BACKANNO} or the
     * scope terminator.
     *
     * @throws UnknownPrefixException   if the line starts with no known prefix
     * @throws GrammarMismatchException if the line does not follow its grammar
     */
    public void addComponent(String componentLine) {
        checkWritable();
        String text = withTerminator(componentLine);
        ComponentKind kind = ComponentKind.forLine(text);
        String reference = kind.match(text).group("designator");
        OptionalInt existing = findLineStartingWith(reference);
        if (existing.isPresent()) {
            replaceLine(existing.getAsInt(), text);
        } else {
            lines.add(insertionPoint(), new Text(text));
        }
    }

    public void removeComponent(String reference) {
        int sep = reference.indexOf(HIERARCHY_SEPARATOR);
        if (sep >= 0) {
            writableSubcircuit(reference.substring(0, sep)).removeComponent(reference.substring(sep + 1));
            return;
        }
        checkWritable();
        lines.remove(getLineStartingWith(reference));
    }

    /**
     * Node names of every component line of this scope that follows its
     * grammar, in order of first appearance.
     */
    public Set<String> getAllNodes() {
        Set<String> nodes = new LinkedHashSet<>();
        for (NetlistLine line : lines) {
            if (!(line instanceof Text text)) {
                continue;
            }
            Optional<ComponentKind> kind = LineClassifier.tryClassify(text.text())
                    .filter(LineClassifier::isComponent)
                    .flatMap(command -> ComponentKind.find(command.charAt(0)));
            if (kind.isPresent() && kind.get().matches(text.text())) {
                nodes.addAll(SpiceComponent.splitNodes(kind.get().match(text.text()).group("nodes")));
            }
        }
        return nodes;
    }

    private SpiceComponent writableComponent(String reference) {
        int sep = reference.indexOf(HIERARCHY_SEPARATOR);
        if (sep < 0) {
            checkWritable();
            return getComponent(reference);
        }
        return writableSubcircuit(reference.substring(0, sep)).writableComponent(reference.substring(sep + 1));
    }

    // ---- subcircuits ----

    /**
     * The definition used by the instance {@code reference}. For a
     * hierarchical reference the path is followed one instance at a time.
     *
     * @throws ReferenceNotFoundException if the instance or its definition
     *                                    cannot be found
     */
    public SpiceCircuit getSubcircuit(String reference) {
        int sep = reference.indexOf(HIERARCHY_SEPARATOR);
        if (sep < 0) {
            return resolveInstance(reference);
        }
        return resolveInstance(reference.substring(0, sep)).getSubcircuit(reference.substring(sep + 1));
    }

    private SpiceCircuit resolveInstance(String instance) {
        SpiceCircuit clone = modifiedSubcircuits.get(registryKey(instance));
        if (clone != null) {
            return clone;
        }
        SpiceComponent call = new SpiceComponent(this, getLineStartingWith(instance));
        if (call.getKind() != ComponentKind.SUBCIRCUIT) {
            throw new ReferenceNotFoundException(instance, "'" + instance + "' is not a subcircuit instance");
        }
        String definition = call.getValue();
        return findDefinition(definition).orElseThrow(() -> new ReferenceNotFoundException(definition,
                "Subcircuit '" + definition + "' used by " + instance + " not found"));
    }

    // Copy-on-write: one clone per instance, registered in the scope holding the instance line
    private SpiceCircuit writableSubcircuit(String instance) {
        checkWritable();
        String key = registryKey(instance);
        SpiceCircuit clone = modifiedSubcircuits.get(key);
        if (clone != null) {
            return clone;
        }
        SpiceCircuit shared = resolveInstance(instance);
        SpiceComponent call = new SpiceComponent(this, getLineStartingWith(instance));
        String cloneName = freeSubcircuitName(shared.name() + "_" + call.getReference());
        clone = shared.copyAs(cloneName, this);
        modifiedSubcircuits.put(key, clone);
        call.setModel(cloneName);
        log.debug("Cloned subcircuit {} as {} for instance {}", shared.name(), cloneName, call.getReference());
        return clone;
    }

    private String freeSubcircuitName(String base) {
        String candidate = base;
        for (int n = 1; getSubcircuitNamed(candidate).isPresent(); n++) {
            candidate = base + "_" + n;
        }
        return candidate;
    }

    private static String registryKey(String instance) {
        return instance.toUpperCase(Locale.ROOT);
    }

    /**
     * A subcircuit defined in this scope, among its clones or in one of its
     * ancestors, matched case-insensitively.
     */
    public Optional<SpiceCircuit> getSubcircuitNamed(String name) {
        for (NetlistLine line : lines) {
            if (line instanceof Nested nested && name.equalsIgnoreCase(nested.circuit().nameOrNull())) {
                return Optional.of(nested.circuit());
            }
        }
        for (SpiceCircuit clone : modifiedSubcircuits.values()) {
            if (name.equalsIgnoreCase(clone.nameOrNull())) {
                return Optional.of(clone);
            }
        }
        return parent != null ? parent.getSubcircuitNamed(name) : Optional.empty();
    }

    public List<String> getSubcircuitNames() {
        List<String> names = new ArrayList<>();
        for (NetlistLine line : lines) {
            if (line instanceof Nested nested) {
                names.add(nested.circuit().name());
            }
        }
        return names;
    }

    private Optional<SpiceCircuit> findDefinition(String name) {
        Optional<SpiceCircuit> local = getSubcircuitNamed(name);
        if (local.isPresent()) {
            return local;
        }
        for (SpiceCircuit scope = this; scope != null; scope = scope.parent) {
            for (String library : scope.includedLibraries()) {
                Optional<SpiceCircuit> found = loadFromLibrary(library, name);
                if (found.isPresent()) {
                    return found;
                }
            }
        }
        return Optional.empty();
    }

    private List<String> includedLibraries() {
        List<String> libraries = new ArrayList<>();
        for (NetlistLine line : lines) {
            if (line instanceof Text text) {
                Matcher m = SpiceSyntax.LIBRARY_INCLUDE.matcher(LineClassifier.stripTerminator(text.text()));
                if (m.lookingAt()) {
                    libraries.add(libraryFileName(m.group("file")));
                }
            }
        }
        return libraries;
    }

    static String libraryFileName(String argument) {
        String s = argument.strip();
        if (s.startsWith("\"")) {
            int close = s.indexOf('"', 1);
            return close > 0 ? s.substring(1, close) : s.substring(1);
        }
        return s.split("\\s+", 2)[0];
    }

    private Optional<SpiceCircuit> loadFromLibrary(String library, String name) {
        Optional<Path> file = getLibraryPaths().find(library, getCircuitDirectory());
        if (file.isEmpty()) {
            log.debug("Library {} not found in the library paths", library);
            return Optional.empty();
        }
        log.debug("Looking for subcircuit {} in {}", name, file.get());
        String content;
        try {
            Charset charset = EncodingDetector.detect(file.get(), LIBRARY_PROBE);
            content = Files.readString(file.get(), charset);
        } catch (EncodingDetectException e) {
            log.warn("Skipping library {}: {}", file.get(), e.getMessage());
            return Optional.empty();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read library " + file.get(), e);
        }
        Iterator<String> source = splitLines(content).iterator();
        while (source.hasNext()) {
            String line = source.next();
            Matcher m = SpiceSyntax.SUBCKT_NAME.matcher(line);
            if (m.lookingAt() && m.group("name").equalsIgnoreCase(name)) {
                SpiceCircuit definition = new SpiceCircuit(this, LineClassifier.ENDS, true);
                definition.lines.add(new Text(line));
                if (!definition.collect(source)) {
                    throw new StructuralException("Missing " + LineClassifier.ENDS + " for subcircuit " + name
                            + " in library " + file.get());
                }
                return Optional.of(definition);
            }
        }
        return Optional.empty();
    }

    SpiceCircuit copyAs(String newName, SpiceCircuit owner) {
        SpiceCircuit copy = deepCopy(owner);
        copy.rename(newName);
        return copy;
    }

    private SpiceCircuit deepCopy(SpiceCircuit owner) {
        SpiceCircuit copy = new SpiceCircuit(owner, terminator, false);
        for (NetlistLine line : lines) {
            if (line instanceof Nested nested) {
                copy.lines.add(new Nested(nested.circuit().deepCopy(copy)));
            } else {
                copy.lines.add(line);
            }
        }
        for (Map.Entry<String, SpiceCircuit> entry : modifiedSubcircuits.entrySet()) {
            copy.modifiedSubcircuits.put(entry.getKey(), entry.getValue().deepCopy(copy));
        }
        return copy;
    }

    // ---- parameters ----

    private record ParameterSpan(int index, int start, int end, String value) {
    }

    private Optional<ParameterSpan> findParameter(String name) {
        for (int i = 0; i < lines.size(); i++) {
            if (!(lines.get(i) instanceof Text text)) {
                continue;
            }
            Matcher m = parameterMatcher(text.text());
            if (m == null) {
                continue;
            }
            while (m.find()) {
                if (m.group("name").equalsIgnoreCase(name)) {
                    return Optional.of(new ParameterSpan(i, m.start("value"), m.end("value"), m.group("value")));
                }
            }
        }
        return Optional.empty();
    }

    // Scans the assignments after the .PARAM keyword, or null when the line is no parameter directive
    private static Matcher parameterMatcher(String line) {
        Optional<String> command = LineClassifier.tryClassify(line);
        if (command.isEmpty() || !LineClassifier.isParameterDirective(command.get())) {
            return null;
        }
        int from = LineClassifier.firstNonBlank(line) + command.get().length();
        return SpiceSyntax.PARAM_ASSIGNMENT.matcher(line).region(from, LineClassifier.contentEnd(line));
    }

    /**
     * @throws ReferenceNotFoundException if no {@code .PARAM} line of this
     *                                    scope assigns {@code name}
     */
    public String getParameter(String name) {
        return findParameter(name).map(ParameterSpan::value).orElseThrow(() ->
                new ReferenceNotFoundException(name, "Parameter '" + name + "' not found in " + describe()));
    }

    /**
     * Updates the assignment of {@code name} in place, or adds a new
     * {@code .PARAM} line when the scope has none.
     */
    public void setParameter(String name, String value) {
        checkWritable();
        Optional<ParameterSpan> span = findParameter(name);
        if (span.isPresent()) {
            ParameterSpan p = span.get();
            String text = getTextLine(p.index());
            replaceLine(p.index(), text.substring(0, p.start()) + value + text.substring(p.end()));
        } else {
            lines.add(insertionPoint(), new Text(LineClassifier.PARAM + " " + name + "=" + value + getLineTerminator()));
        }
    }

    public void setParameter(String name, double value) {
        setParameter(name, EngineeringNotation.format(value));
    }

    public void setParameters(Map<String, ?> parameters) {
        for (Map.Entry<String, ?> entry : parameters.entrySet()) {
            if (entry.getValue() instanceof Number number) {
                setParameter(entry.getKey(), number.doubleValue());
            } else {
                setParameter(entry.getKey(), String.valueOf(entry.getValue()));
            }
        }
    }

    public Set<String> getAllParameterNames() {
        Set<String> names = new TreeSet<>();
        for (NetlistLine line : lines) {
            if (line instanceof Text text) {
                Matcher m = parameterMatcher(text.text());
                while (m != null && m.find()) {
                    names.add(m.group("name").toUpperCase(Locale.ROOT));
                }
            }
        }
        return names;
    }

    // ---- instructions ----

    /**
     * Adds a directive. An analysis directive replaces the analysis already
     * present; any other directive is inserted before {@code .BACKANNO} or the
     * scope terminator, unless the same line is already there.
     *
     * @throws AmbiguousInstructionException for {@code .PARAM} lines, which go
     *                                       through {@link #setParameter}
     * @throws UnknownPrefixException        if the text is no netlist line
     */
    public void addInstruction(String instruction) {
        checkWritable();
        String text = withTerminator(instruction);
        String command = LineClassifier.classify(text);
        if (LineClassifier.isParameterDirective(command)) {
            throw new AmbiguousInstructionException(instruction);
        }
        if (LineClassifier.isUniqueInstruction(command)) {
            for (int i = 0; i < lines.size(); i++) {
                if (lines.get(i) instanceof Text line
                        && LineClassifier.tryClassify(line.text()).filter(LineClassifier::isUniqueInstruction).isPresent()) {
                    replaceLine(i, text);
                    return;
                }
            }
        } else if (findInstruction(instruction).isPresent()) {
            return;
        }
        lines.add(insertionPoint(), new Text(text));
    }

    public void addInstructions(String... instructions) {
        for (String instruction : instructions) {
            addInstruction(instruction);
        }
    }

    /**
     * Removes the first line equal to {@code instruction}, ignoring
     * surrounding blanks and the line terminator.
     *
     * @return whether a line was removed
     */
    public boolean removeInstruction(String instruction) {
        checkWritable();
        OptionalInt index = findInstruction(instruction);
        if (index.isEmpty()) {
            log.warn("Instruction \"{}\" not found", instruction.strip());
            return false;
        }
        lines.remove(index.getAsInt());
        log.info("Instruction \"{}\" removed", instruction.strip());
        return true;
    }

    /**
     * Removes every text line that starts with a match of {@code regex},
     * ignoring case.
     *
     * @return the number of removed lines
     */
    public int removeInstructions(String regex) {
        checkWritable();
        Pattern pattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
        int removed = 0;
        Iterator<NetlistLine> it = lines.iterator();
        while (it.hasNext()) {
            if (it.next() instanceof Text text && pattern.matcher(LineClassifier.stripTerminator(text.text())).lookingAt()) {
                it.remove();
                removed++;
            }
        }
        log.info("{} line(s) matching \"{}\" removed", removed, regex);
        return removed;
    }

    private OptionalInt findInstruction(String instruction) {
        String wanted = LineClassifier.stripTerminator(instruction).strip();
        for (int i = 0; i < lines.size(); i++) {
            if (lines.get(i) instanceof Text text && LineClassifier.stripTerminator(text.text()).strip().equals(wanted)) {
                return OptionalInt.of(i);
            }
        }
        return OptionalInt.empty();
    }

    private int insertionPoint() {
        for (int i = 0; i < lines.size(); i++) {
            if (lines.get(i) instanceof Text text
                    && LineClassifier.BACKANNO.equals(LineClassifier.tryClassify(text.text()).orElse(null))) {
                return i;
            }
        }
        for (int i = 0; i < lines.size(); i++) {
            if (lines.get(i) instanceof Text text && isTerminator(text.text())) {
                return i;
            }
        }
        return lines.size();
    }

    private boolean isTerminator(String line) {
        return terminator.equals(LineClassifier.tryClassify(line).orElse(null));
    }

    private String withTerminator(String line) {
        return line.endsWith("\n") ? line : line + getLineTerminator();
    }

    // ---- naming ----

    /**
     * The name given by the {@code .SUBCKT} line.
     *
     * @throws StructuralException if the scope has no {@code .SUBCKT} line
     */
    public String name() {
        String name = nameOrNull();
        if (name == null) {
            throw new StructuralException("Scope has no " + LineClassifier.SUBCKT + " clause");
        }
        return name;
    }

    private String nameOrNull() {
        int index = subcktLine();
        if (index < 0) {
            return null;
        }
        Matcher m = SpiceSyntax.SUBCKT_NAME.matcher(getTextLine(index));
        return m.lookingAt() ? m.group("name") : null;
    }

    String describe() {
        String name = nameOrNull();
        return name != null ? name : parent == null ? "the netlist" : "an unnamed subcircuit";
    }

    /**
     * Renames the subcircuit on its {@code .SUBCKT} and {@code .ENDS} lines.
     * An empty scope gets a {@code .SUBCKT}/{@code .ENDS} pair.
     */
    public void rename(String newName) {
        checkWritable();
        if (lines.isEmpty()) {
            lines.add(new Text(LineClassifier.SUBCKT + " " + newName + getLineTerminator()));
            lines.add(new Text(LineClassifier.ENDS + " " + newName + getLineTerminator()));
            return;
        }
        int open = subcktLine();
        if (open < 0) {
            throw new StructuralException("Scope has no " + LineClassifier.SUBCKT + " clause");
        }
        String openText = getTextLine(open);
        Matcher m = SpiceSyntax.SUBCKT_NAME.matcher(openText);
        if (!m.lookingAt()) {
            throw new StructuralException("Malformed " + LineClassifier.SUBCKT + " clause: "
                    + LineClassifier.stripTerminator(openText));
        }
        replaceLine(open, openText.substring(0, m.start("name")) + newName + openText.substring(m.end("name")));

        for (int i = lines.size() - 1; i > open; i--) {
            if (lines.get(i) instanceof Text text && isTerminator(text.text())) {
                Matcher ends = SpiceSyntax.ENDS_NAME.matcher(text.text());
                if (ends.lookingAt() && ends.start("name") >= 0) {
                    replaceLine(i, text.text().substring(0, ends.start("name")) + newName
                            + text.text().substring(ends.end("name")));
                }
                return;
            }
        }
        throw new StructuralException("Subcircuit " + newName + " has no " + LineClassifier.ENDS + " clause");
    }

    private int subcktLine() {
        for (int i = 0; i < lines.size(); i++) {
            if (lines.get(i) instanceof Text text
                    && LineClassifier.SUBCKT.equals(LineClassifier.tryClassify(text.text()).orElse(null))) {
                return i;
            }
        }
        return -1;
    }

    // ---- settings resolved through the parent chain ----

    public boolean isReadOnly() {
        return readOnly;
    }

    public SpiceCircuit getParent() {
        return parent;
    }

    public LibraryPaths getLibraryPaths() {
        if (parent != null) {
            return parent.getLibraryPaths();
        }
        if (libraryPaths == null) {
            libraryPaths = new LibraryPaths();
        }
        return libraryPaths;
    }

    public String getLineTerminator() {
        return parent != null ? parent.getLineTerminator() : "\n";
    }

    /**
     * Directory of the netlist file, searched first for libraries, or
     * {@code null} when the circuit does not come from a file.
     */
    public Path getCircuitDirectory() {
        return parent != null ? parent.getCircuitDirectory() : null;
    }

    @Override
    public String toString() {
        StringBuilder out = new StringBuilder();
        writeLines(out);
        return out.toString();
    }
}
