package work.taskrun.core.collect;

import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import work.taskrun.core.nodes.FilePathNode;
import work.taskrun.core.nodes.InvalidReferenceException;

/**
 * Hands out exactly one {@link FilePathNode} per absolute location, so every task referencing a file
 * observes the same node instance.
 */
public final class FilePathNodeCache {
    private final Map<Path, FilePathNode> nodes = new ConcurrentHashMap<>();

    /**
     * @throws InvalidReferenceException if {@code path} is not absolute
     */
    public FilePathNode getOrCreate(Path path) {
        if (path == null || !path.isAbsolute()) {
            throw new InvalidReferenceException(path, "FilePathNode must be instantiated from absolute path: " + path);
        }
        return nodes.computeIfAbsent(path.normalize(), FilePathNode::fromPath);
    }

    public int size() {
        return nodes.size();
    }

    public void reset() {
        nodes.clear();
    }
}
