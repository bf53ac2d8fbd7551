package work.taskrun.core.collect;

import java.nio.file.Path;
import java.util.Optional;
import work.taskrun.core.nodes.Node;

/**
 * Turns a raw reference from a {@code depends_on}/{@code produces} declaration into a node.
 */
@FunctionalInterface
public interface NodeCollector {
    /**
     * @param definingPath the task file declaring the reference
     * @return the node, or empty if this collector does not recognize the reference
     */
    Optional<Node> tryCollect(CollectionSession session, Path definingPath, Object reference);
}
