package nl.bytesoflife.deltaspice.netlist;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LibraryPathsTest {

    @TempDir
    Path tempDir;

    @Test
    void simulatorDefaultsComeFromTheBundledList() {
        List<Path> defaults = LibraryPaths.simulatorDefaults();

        assertEquals(6, defaults.size());
        Path home = Path.of(System.getProperty("user.home"));
        assertEquals(home.resolve("AppData/Local/LTspice/lib"), defaults.get(0));
        assertSame(defaults, LibraryPaths.simulatorDefaults());
    }

    @Test
    void searchOrder() {
        LibraryPaths paths = new LibraryPaths(List.of(Path.of("/opt/spice/lib")));
        paths.addCustomPath(tempDir);
        Path circuitDir = Path.of("/work/circuits");

        assertEquals(List.of(circuitDir, Path.of("."), Path.of("/opt/spice/lib"), tempDir),
                paths.searchRoots(circuitDir));
        assertEquals(List.of(Path.of("."), Path.of("/opt/spice/lib"), tempDir), paths.searchRoots(null));
    }

    @Test
    void customPathMustBeADirectory() {
        LibraryPaths paths = new LibraryPaths(List.of());

        assertFalse(paths.addCustomPath(tempDir.resolve("missing")));
        assertTrue(paths.addCustomPath(tempDir));
        assertEquals(List.of(tempDir), paths.getCustomPaths());

        paths.setCustomPaths(List.of(tempDir.resolve("missing"), tempDir));
        assertEquals(List.of(tempDir), paths.getCustomPaths());
    }

    @Test
    void simulatorPathsCanBeReplaced() {
        LibraryPaths paths = new LibraryPaths();
        paths.setSimulatorPaths(List.of(tempDir));
        assertEquals(List.of(tempDir), paths.getSimulatorPaths());
    }

    @Test
    void findsALibrary() {
        LibraryPaths paths = new LibraryPaths(List.of());
        paths.addCustomPath(Path.of("testdata/lib"));

        assertEquals(Path.of("testdata/lib/opamps.lib"), paths.find("opamps.lib", null).orElseThrow());
        assertTrue(paths.find("missing.lib", null).isEmpty());
    }
}
