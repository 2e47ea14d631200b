package nl.bytesoflife.deltaspice.netlist;

import nl.bytesoflife.deltaspice.util.FileSearch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Where library files named by {@code .LIB} and {@code .INC} directives are
 * looked up: the circuit's own directory, the working directory, the
 * simulator's default library paths and any custom paths, in that order.
 */
public class LibraryPaths {

    private static final Logger log = LoggerFactory.getLogger(LibraryPaths.class);

    private static final String DEFAULT_SIMULATOR_PATHS = "/library-paths/ltspice.txt";

    private static volatile List<Path> cachedSimulatorDefaults;

    private final List<Path> simulatorPaths;
    private final List<Path> customPaths = new ArrayList<>();

    public LibraryPaths() {
        this(simulatorDefaults());
    }

    public LibraryPaths(List<Path> simulatorPaths) {
        this.simulatorPaths = new ArrayList<>(simulatorPaths);
    }

    public static List<Path> simulatorDefaults() {
        if (cachedSimulatorDefaults == null) {
            synchronized (LibraryPaths.class) {
                if (cachedSimulatorDefaults == null) {
                    cachedSimulatorDefaults = loadSimulatorDefaults();
                }
            }
        }
        return cachedSimulatorDefaults;
    }

    public List<Path> getSimulatorPaths() {
        return Collections.unmodifiableList(simulatorPaths);
    }

    /**
     * Replaces the simulator library paths, e.g. with the ones of the
     * simulator that will run the netlist.
     */
    public void setSimulatorPaths(List<Path> paths) {
        simulatorPaths.clear();
        simulatorPaths.addAll(paths);
    }

    public List<Path> getCustomPaths() {
        return Collections.unmodifiableList(customPaths);
    }

    public void setCustomPaths(List<Path> paths) {
        customPaths.clear();
        for (Path path : paths) {
            addCustomPath(path);
        }
    }

    /**
     * Adds a custom search directory. Paths that are not existing directories
     * are skipped.
     *
     * @return whether the path was added
     */
    public boolean addCustomPath(Path path) {
        if (Files.isDirectory(FileSearch.expandHome(path))) {
            log.debug("Adding path '{}' to the custom library path list", path);
            customPaths.add(path);
            return true;
        }
        log.warn("Cannot add path '{}' to the custom library path list, as it does not exist", path);
        return false;
    }

    public List<Path> searchRoots(Path circuitDirectory) {
        List<Path> roots = new ArrayList<>();
        if (circuitDirectory != null) {
            roots.add(circuitDirectory);
        }
        roots.add(Path.of("."));
        roots.addAll(simulatorPaths);
        roots.addAll(customPaths);
        return roots;
    }

    public Optional<Path> find(String fileName, Path circuitDirectory) {
        return FileSearch.searchFile(fileName, searchRoots(circuitDirectory));
    }

    private static List<Path> loadSimulatorDefaults() {
        try (InputStream is = LibraryPaths.class.getResourceAsStream(DEFAULT_SIMULATOR_PATHS)) {
            if (is == null) throw new IllegalStateException("Resource not found: " + DEFAULT_SIMULATOR_PATHS);
            List<Path> paths = new ArrayList<>();
            BufferedReader reader = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8));
            String line;
            while ((line = reader.readLine()) != null) {
                line = line.strip();
                if (line.isEmpty() || line.startsWith("#")) continue;
                paths.add(FileSearch.expandHome(Path.of(line)));
            }
            return Collections.unmodifiableList(paths);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load default library paths", e);
        }
    }
}
