package work.taskrun.core.collect;

import java.nio.file.Path;

/**
 * Raised when no {@link NodeCollector} recognizes a reference.
 */
public final class NodeNotCollectedException extends IllegalStateException {
    private final Object reference;
    private final String taskName;
    private final Path path;

    public NodeNotCollectedException(Object reference, String taskName, Path path) {
        super("'" + reference + "' cannot be parsed as a dependency or product for task '"
            + taskName + "' in '" + path + "'.");
        this.reference = reference;
        this.taskName = taskName;
        this.path = path;
    }

    public Object reference() {
        return reference;
    }

    public String taskName() {
        return taskName;
    }

    public Path path() {
        return path;
    }
}
