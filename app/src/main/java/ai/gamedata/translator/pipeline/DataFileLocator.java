package ai.gamedata.translator.pipeline;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Finds the data files of a run below the data root.
 */
public class DataFileLocator {

    static final String DATA_FILE_EXTENSION = ".txt";

    private final Path dataRoot;

    public DataFileLocator(Path dataRoot) {
        this.dataRoot = Objects.requireNonNull(dataRoot, "dataRoot");
    }

    /**
     * Every {@code .txt} file below the root, sorted by relative path.
     */
    public List<Path> locateAll() {
        if (!Files.isDirectory(dataRoot)) {
            throw new IllegalArgumentException("Data directory does not exist: " + dataRoot);
        }
        try (Stream<Path> paths = Files.walk(dataRoot)) {
            return paths.filter(Files::isRegularFile)
                    .filter(DataFileLocator::isDataFile)
                    .sorted()
                    .collect(Collectors.toUnmodifiableList());
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to list data files under " + dataRoot, ex);
        }
    }

    /**
     * A single file given relative to the data root. Existence, and staying below the root, are
     * checked when it is processed, so such a file is reported like any other per-file failure.
     */
    public List<Path> locate(String relativePath) {
        if (relativePath == null || relativePath.isBlank()) {
            return locateAll();
        }
        return List.of(dataRoot.resolve(relativePath.trim().replace('\\', '/')).normalize());
    }

    private static boolean isDataFile(Path path) {
        return path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(DATA_FILE_EXTENSION);
    }
}
