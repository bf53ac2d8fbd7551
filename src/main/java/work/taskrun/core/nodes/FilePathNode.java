package work.taskrun.core.nodes;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import work.taskrun.core.shared.Fingerprints;
import work.taskrun.core.shared.Names;

/**
 * Node backed by a file path.
 *
 * <p>Instances compare by identity. The graph deduplicates edges by node identity, so obtain nodes through
 * {@code FilePathNodeCache} to share one instance per location.
 */
public final class FilePathNode implements Node {
    private final String name;
    private final Path value;
    private final Path path;

    private FilePathNode(String name, Path value, Path path) {
        this.name = name;
        this.value = value;
        this.path = path;
    }

    /**
     * @throws InvalidReferenceException if {@code path} is not absolute
     */
    public static FilePathNode fromPath(Path path) {
        if (path == null || !path.isAbsolute()) {
            throw new InvalidReferenceException(path, "FilePathNode must be instantiated from absolute path: " + path);
        }
        return new FilePathNode(Names.toPosix(path), path, path);
    }

    @Override
    public String name() {
        return name;
    }

    public Path value() {
        return value;
    }

    @Override
    public Path path() {
        return path;
    }

    @Override
    public String state() {
        try {
            return Fingerprints.lastModified(path);
        } catch (NoSuchFileException ex) {
            throw new NodeNotFoundException(path);
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to read modification time of " + path, ex);
        }
    }

    @Override
    public String toString() {
        return "FilePathNode[" + name + "]";
    }
}
