package work.taskrun.core.collect;

import java.nio.file.Path;
import java.util.Optional;
import work.taskrun.core.nodes.Node;

/**
 * Resolves raw references through the collectors registered on the session.
 */
public final class NodeResolver {
    private NodeResolver() {}

    /**
     * Asks each collector in registration order; the first one recognizing the reference wins.
     *
     * @throws NodeNotCollectedException if no collector recognizes the reference
     */
    public static Node resolve(CollectionSession session, Path definingPath, String taskName, Object reference) {
        for (NodeCollector collector : session.collectors()) {
            Optional<Node> node = collector.tryCollect(session, definingPath, reference);
            if (node.isPresent()) {
                return node.get();
            }
        }
        throw new NodeNotCollectedException(reference, taskName, definingPath);
    }
}
