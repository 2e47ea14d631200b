package nl.bytesoflife.deltaspice.netlist;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SpiceEditorTest {

    private static final Path AMPLIFIER = Path.of("testdata/netlists/amplifier.net");

    @TempDir
    Path tempDir;

    @Test
    void readsAndWritesBackUnchanged() throws IOException {
        SpiceEditor editor = new SpiceEditor(AMPLIFIER);

        assertEquals(StandardCharsets.UTF_8, editor.getEncoding());
        assertEquals(AMPLIFIER, editor.getNetlistFile());
        assertEquals(Files.readString(AMPLIFIER), editor.toNetlistString());
    }

    @Test
    void linesAfterEndAreKept() throws IOException {
        Path nested = Path.of("testdata/netlists/nested.net");
        SpiceEditor editor = new SpiceEditor(nested, StandardCharsets.UTF_8);

        editor.addInstruction(".tran 1m");

        assertTrue(editor.toNetlistString().endsWith(".op\n.tran 1m\n.end\n* trailing notes are kept\n"));
    }

    @Test
    void windowsLineEndingsArePreserved() throws IOException {
        Path crlf = Path.of("testdata/netlists/crlf.net");
        SpiceEditor editor = new SpiceEditor(crlf);
        editor.setLineTerminator("\r\n");

        editor.setComponentValue("R1", "2k");
        editor.addInstruction(".op");

        assertEquals("* Windows line endings\r\nR1 a b 2k\r\nC1 b 0 1u\r\n.op\r\n.end\r\n", editor.toNetlistString());
    }

    @Test
    void saveWritesToTheGivenPathOnly() throws IOException {
        String original = Files.readString(AMPLIFIER);
        SpiceEditor editor = new SpiceEditor(AMPLIFIER);
        editor.setComponentValue("R1", "4.7k");
        Path target = tempDir.resolve("run1.net");

        editor.save(target);

        assertEquals(editor.toNetlistString(), Files.readString(target));
        assertTrue(Files.readString(target).contains("R1 in n1 4.7k\n"));
        assertEquals(original, Files.readString(AMPLIFIER));
    }

    @Test
    void saveKeepsTheDetectedEncoding() throws IOException {
        Path file = tempDir.resolve("utf16.net");
        Files.write(file, "* utf-16 netlist\nR1 a b 1k\n.end\n".getBytes(StandardCharsets.UTF_16LE));
        SpiceEditor editor = new SpiceEditor(file);
        assertEquals(StandardCharsets.UTF_16LE, editor.getEncoding());

        editor.setComponentValue("R1", "10k");
        Path target = tempDir.resolve("utf16_out.net");
        editor.save(target);

        assertEquals("* utf-16 netlist\nR1 a b 10k\n.end\n", Files.readString(target, StandardCharsets.UTF_16LE));
    }

    @Test
    void byteOrderMarkSurvivesASave() throws IOException {
        String netlist = "\uFEFF* marked netlist\nR1 a b 1k\n.end\n";
        Path file = tempDir.resolve("marked.net");
        Files.write(file, netlist.getBytes(StandardCharsets.UTF_16LE));
        SpiceEditor editor = new SpiceEditor(file);
        assertEquals(StandardCharsets.UTF_16LE, editor.getEncoding());
        assertEquals("* marked netlist\nR1 a b 1k\n.end\n", editor.toNetlistString());

        Path unchanged = tempDir.resolve("unchanged.net");
        editor.save(unchanged);
        assertArrayEquals(Files.readAllBytes(file), Files.readAllBytes(unchanged));

        editor.setComponentValue("R1", "10k");
        Path edited = tempDir.resolve("edited.net");
        editor.save(edited);
        byte[] bytes = Files.readAllBytes(edited);
        assertEquals((byte) 0xFF, bytes[0]);
        assertEquals((byte) 0xFE, bytes[1]);
        assertEquals("\uFEFF* marked netlist\nR1 a b 10k\n.end\n", new String(bytes, StandardCharsets.UTF_16LE));
    }

    @Test
    void resetDiscardsEdits() throws IOException {
        Path file = Files.copy(AMPLIFIER, tempDir.resolve("amplifier.net"));
        SpiceEditor editor = new SpiceEditor(file);
        editor.setComponentValue("X1:R1", "2k");
        editor.removeInstruction(".backanno");

        editor.reset();

        assertEquals(Files.readString(file), editor.toNetlistString());
        assertEquals("1k", editor.getComponentValue("X1:R1"));
    }

    @Test
    void resetReadsTheCurrentFile() throws IOException {
        Path file = tempDir.resolve("changing.net");
        Files.writeString(file, "R1 a b 1k\n.end\n");
        SpiceEditor editor = new SpiceEditor(file);

        Files.copy(AMPLIFIER, file, StandardCopyOption.REPLACE_EXISTING);
        editor.reset();

        assertEquals(12, editor.getComponents().size());
    }

    @Test
    void resetOfADeletedFile() throws IOException {
        Path file = Files.copy(AMPLIFIER, tempDir.resolve("gone.net"));
        SpiceEditor editor = new SpiceEditor(file);
        Files.delete(file);

        assertThrows(NoSuchFileException.class, editor::reset);
    }

    @Test
    void resetNeedsAFile() {
        SpiceEditor editor = SpiceEditor.fromString("R1 a b 1k\n.end\n");
        assertThrows(IllegalStateException.class, editor::reset);
        assertNull(editor.getNetlistFile());
        assertNull(editor.getCircuitDirectory());
    }

    @Test
    void blankNetlist() throws IOException {
        Path file = tempDir.resolve("new.net");
        SpiceEditor editor = SpiceEditor.createBlank(file);
        assertFalse(Files.exists(file));

        editor.addComponent("V1 in 0 5");
        editor.addComponent("R1 in 0 1k");
        editor.addInstruction(".op");
        editor.save(file);

        assertEquals("* netlist generated by delta-spice\nV1 in 0 5\nR1 in 0 1k\n.op\n.end\n", Files.readString(file));
        assertEquals(5, new SpiceEditor(file).getLines().size());
    }

    @Test
    void missingEndIsAStructuralError() throws IOException {
        Path file = tempDir.resolve("truncated.net");
        Files.writeString(file, "* no end\nR1 a b 1k\n");
        StructuralException e = assertThrows(StructuralException.class, () -> new SpiceEditor(file));
        assertTrue(e.getMessage().contains(".END"));
    }

    @Test
    void missingFile() {
        assertThrows(NoSuchFileException.class, () -> new SpiceEditor(tempDir.resolve("nothing.net")));
    }

    @Test
    void circuitDirectoryIsTheFileDirectory() throws IOException {
        SpiceEditor editor = new SpiceEditor(AMPLIFIER);
        assertEquals(AMPLIFIER.toAbsolutePath().getParent(), editor.getCircuitDirectory());
        assertEquals(editor.getCircuitDirectory(), editor.getSubcircuit("X1").getCircuitDirectory());
    }

    @Test
    void subcircuitFromAnIncludedLibrary() throws IOException {
        SpiceEditor editor = new SpiceEditor(AMPLIFIER);
        assertTrue(editor.getLibraryPaths().addCustomPath(Path.of("testdata/lib")));

        SpiceCircuit opbuf = editor.getSubcircuit("XU1");

        assertEquals("OPBUF", opbuf.name());
        assertTrue(opbuf.isReadOnly());
        assertSame(editor, opbuf.getParent());
        assertEquals("10Meg", editor.getComponentValue("XU1:R1"));
        assertEquals(1e7, editor.getComponentFloatValue("XU1:R1"), 1e-3);
    }

    @Test
    void libraryDefinitionsCannotBeEditedDirectly() throws IOException {
        SpiceEditor editor = new SpiceEditor(AMPLIFIER);
        editor.getLibraryPaths().addCustomPath(Path.of("testdata/lib"));
        SpiceCircuit opbuf = editor.getSubcircuit("XU1");

        assertThrows(ReadOnlyViolationException.class, () -> opbuf.setComponentValue("R1", "1Meg"));
        assertThrows(ReadOnlyViolationException.class, () -> opbuf.addInstruction(".op"));
        assertThrows(ReadOnlyViolationException.class, () -> opbuf.rename("MINE"));
    }

    @Test
    void editingALibraryInstanceClonesItIntoTheNetlist() throws IOException {
        String library = Files.readString(Path.of("testdata/lib/opamps.lib"));
        SpiceEditor editor = new SpiceEditor(AMPLIFIER);
        editor.getLibraryPaths().addCustomPath(Path.of("testdata/lib"));

        editor.setComponentValue("XU1:R1", "1Meg");

        String out = editor.toNetlistString();
        assertTrue(out.contains("XU1 out fb 0 OPBUF_XU1\n"));
        assertTrue(out.contains("""
                .backanno
                .SUBCKT OPBUF_XU1 out fb gnd
                E1 out gnd 0 fb 100k
                R1 out fb 1Meg
                .ENDS OPBUF_XU1
                .end
                """));
        assertFalse(editor.getSubcircuit("XU1").isReadOnly());
        assertEquals(library, Files.readString(Path.of("testdata/lib/opamps.lib")));
    }

    @Test
    void libraryNotInTheSearchPaths() throws IOException {
        SpiceEditor editor = new SpiceEditor(AMPLIFIER);
        editor.getLibraryPaths().setSimulatorPaths(List.of());

        ReferenceNotFoundException e = assertThrows(ReferenceNotFoundException.class,
                () -> editor.getSubcircuit("XU1"));
        assertEquals("OPBUF", e.getReference());
    }

    @Test
    void libraryNextToTheNetlist() throws IOException {
        Path file = tempDir.resolve("local.net");
        Files.writeString(file, "* local library\nX1 a b OPCOMP_LOCAL\n.inc \"parts lib.sub\"\n.end\n");
        Files.writeString(tempDir.resolve("parts lib.sub"), ".subckt OPCOMP_LOCAL a b\nR1 a b 5k\n.ends\n");

        SpiceEditor editor = new SpiceEditor(file);

        assertEquals("5k", editor.getComponentValue("X1:R1"));
        editor.setComponentValue("X1:R1", "6k");
        assertTrue(editor.toNetlistString().contains(".subckt OPCOMP_LOCAL_X1 a b\nR1 a b 6k\n.ends\n.end\n"));
    }
}
