package nl.bytesoflife.deltaspice.util;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Looks up a file name over an ordered list of directories.
 */
public final class FileSearch {

    private FileSearch() {
    }

    /**
     * Returns the first existing regular file named {@code fileName} under one
     * of the roots, in order. An absolute file name is returned as is when it
     * exists. Roots starting with {@code ~} are resolved against the user home.
     */
    public static Optional<Path> searchFile(String fileName, List<Path> roots) {
        Path name;
        try {
            name = Path.of(fileName);
        } catch (InvalidPathException e) {
            return Optional.empty();
        }
        if (name.isAbsolute()) {
            return Files.isRegularFile(name) ? Optional.of(name) : Optional.empty();
        }
        for (Path root : roots) {
            if (root == null) {
                continue;
            }
            Path candidate = expandHome(root).resolve(name);
            if (Files.isRegularFile(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    public static Path expandHome(Path path) {
        String text = path.toString();
        if (text.equals("~") || text.startsWith("~/") || text.startsWith("~\\")) {
            return Path.of(System.getProperty("user.home") + text.substring(1));
        }
        return path;
    }
}
