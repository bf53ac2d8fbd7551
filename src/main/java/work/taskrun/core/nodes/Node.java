package work.taskrun.core.nodes;

import java.nio.file.Path;

/**
 * Addressable entity of the dependency graph: a task or a resource.
 */
public interface Node {
    /**
     * Globally unique identifier of the node.
     */
    String name();

    Path path();

    /**
     * Fingerprint of the node's current version. Equal fingerprints mean the node did not change between two
     * observations, within the resolution of the filesystem clock.
     *
     * @throws NodeNotFoundException if the underlying resource does not exist
     */
    String state();
}
