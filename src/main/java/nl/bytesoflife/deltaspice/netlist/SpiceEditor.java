package nl.bytesoflife.deltaspice.netlist;

import nl.bytesoflife.deltaspice.netlist.grammar.LineClassifier;
import nl.bytesoflife.deltaspice.util.EncodingDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;

/**
 * Reads a netlist file into a tree of circuit scopes and writes the edited
 * tree back out.
 * <p>
 * The file is read once, at construction or on {@link #reset()}, and never
 * rewritten implicitly: edits only reach disk through {@link #save(Path)}.
 * <pre>
 * SpiceEditor editor = new SpiceEditor(Path.of("amp.net"));
 * editor.setComponentValue("R1", "4.7k");
 * editor.setComponentValue("X1:R2", 2200.0);
 * editor.addInstruction(".tran 1m");
 * editor.save(Path.of("amp_run1.net"));
 * </pre>
 */
public class SpiceEditor extends SpiceCircuit {

    private static final Logger log = LoggerFactory.getLogger(SpiceEditor.class);

    /** Some line of a netlist starts with a comment or a directive. */
    public static final String EXPECTED_PATTERN = "^[*.]";

    private static final String BLANK_NETLIST = "* netlist generated by delta-spice\n.end\n";

    private final Path netlistFile;
    private final Charset encoding;
    private final LibraryPaths libraryPaths = new LibraryPaths();
    private String lineTerminator = "\n";
    private boolean byteOrderMark;

    /**
     * Opens a netlist, detecting its encoding.
     *
     * @throws IOException         if the file cannot be read or its encoding
     *                             cannot be detected
     * @throws StructuralException if the netlist has no {@code .END} line or a
     *                             subcircuit is not closed
     */
    public SpiceEditor(Path netlistFile) throws IOException {
        this(netlistFile, EncodingDetector.detect(netlistFile, EXPECTED_PATTERN));
    }

    public SpiceEditor(Path netlistFile, Charset encoding) throws IOException {
        this(netlistFile, encoding, Files.readString(netlistFile, encoding));
    }

    private SpiceEditor(Path netlistFile, Charset encoding, String content) {
        super(null, LineClassifier.END, false);
        this.netlistFile = netlistFile;
        this.encoding = encoding;
        load(content);
    }

    /**
     * A new netlist holding only a title comment and {@code .END}. Nothing is
     * written until {@link #save(Path)}.
     */
    public static SpiceEditor createBlank(Path netlistFile) {
        return new SpiceEditor(netlistFile, StandardCharsets.UTF_8, BLANK_NETLIST);
    }

    /**
     * A netlist parsed from text, not backed by a file.
     */
    public static SpiceEditor fromString(String netlist) {
        return new SpiceEditor(null, StandardCharsets.UTF_8, netlist);
    }

    /**
     * Discards all edits and reads the file again with the stored encoding.
     */
    public void reset() throws IOException {
        if (netlistFile == null) {
            throw new IllegalStateException("Netlist was not read from a file");
        }
        load(Files.readString(netlistFile, encoding));
    }

    private void load(String content) {
        clear();
        byteOrderMark = !content.isEmpty() && content.charAt(0) == EncodingDetector.BYTE_ORDER_MARK;
        if (byteOrderMark) {
            content = content.substring(1);
        }
        List<String> lines = splitLines(content);
        Iterator<String> source = lines.iterator();
        if (!collect(source)) {
            throw new StructuralException("Missing " + LineClassifier.END + " in netlist "
                    + (netlistFile != null ? netlistFile : "text"));
        }
        // anything after .END is not part of the circuit but is kept
        while (source.hasNext()) {
            appendText(source.next());
        }
        log.debug("Loaded {} lines from {} ({})", lines.size(),
                netlistFile != null ? netlistFile : "text", encoding.name());
    }

    /**
     * Writes the netlist, clones of edited subcircuits included, with the
     * encoding it was read with. A byte order mark read from the file is
     * written back.
     */
    public void save(Path target) throws IOException {
        String text = toNetlistString();
        Files.writeString(target, byteOrderMark ? EncodingDetector.BYTE_ORDER_MARK + text : text, encoding);
        log.info("Netlist saved to {}", target);
    }

    public String toNetlistString() {
        return toString();
    }

    public Path getNetlistFile() {
        return netlistFile;
    }

    public Charset getEncoding() {
        return encoding;
    }

    @Override
    public LibraryPaths getLibraryPaths() {
        return libraryPaths;
    }

    @Override
    public String getLineTerminator() {
        return lineTerminator;
    }

    /**
     * Terminator used for lines added by the editor. Lines read from the file
     * keep their own.
     */
    public void setLineTerminator(String lineTerminator) {
        this.lineTerminator = lineTerminator;
    }

    @Override
    public Path getCircuitDirectory() {
        if (netlistFile == null) {
            return null;
        }
        return netlistFile.toAbsolutePath().getParent();
    }
}
