package work.taskrun.core.nodes;

import java.nio.file.Path;

/**
 * Raised by {@link Node#state()} when the underlying resource does not exist.
 */
public final class NodeNotFoundException extends IllegalStateException {
    private final Path path;

    public NodeNotFoundException(Path path) {
        super("Node does not exist: " + path);
        this.path = path;
    }

    public Path path() {
        return path;
    }
}
