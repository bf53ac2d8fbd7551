package work.taskrun.core.collect;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Optional;
import work.taskrun.core.nodes.InvalidReferenceException;
import work.taskrun.core.nodes.Node;

/**
 * Collects strings and paths as file nodes. Relative references are resolved against the directory of the
 * task file.
 */
public final class FilePathCollector implements NodeCollector {
    @Override
    public Optional<Node> tryCollect(CollectionSession session, Path definingPath, Object reference) {
        Path path;
        if (reference instanceof Path p) {
            path = p;
        } else if (reference instanceof String text && !text.isBlank()) {
            try {
                path = Path.of(text);
            } catch (InvalidPathException ex) {
                throw new InvalidReferenceException(reference, "Invalid path '" + text + "': " + ex.getReason());
            }
        } else {
            return Optional.empty();
        }
        if (!path.isAbsolute()) {
            Path base = definingPath.toAbsolutePath().getParent();
            path = base == null ? path.toAbsolutePath() : base.resolve(path);
        }
        return Optional.of(session.cache().getOrCreate(path.normalize()));
    }
}
