package work.taskrun.core.nodes;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Flattens one declaration into a keyed mapping of references.
 *
 * <p>The top level is special-cased: a bare reference or each element of a top-level sequence gets a fresh
 * {@link Placeholder} key, eligible for auto-numbering by {@link NodeMerger}. Below the top level sequences
 * keep their positional ordinals and references are kept as leaves. Placeholder tokens are unique per
 * normalizer instance, so use one instance for all declarations that are merged together.
 */
public final class NodeNormalizer {
    private long nextToken;

    public Map<NodeKey, NodeTree<Object>> normalize(NodeSpec spec) {
        Map<NodeKey, NodeTree<Object>> normalized = new LinkedHashMap<>();
        if (spec instanceof NodeSpec.Mapping mapping) {
            return normalizeMapping(mapping);
        }
        if (spec instanceof NodeSpec.Sequence sequence) {
            for (NodeSpec element : sequence.elements()) {
                normalized.put(placeholder(false), toTree(element));
            }
            return normalized;
        }
        normalized.put(placeholder(true), toTree(spec));
        return normalized;
    }

    private NodeTree<Object> toTree(NodeSpec spec) {
        if (spec instanceof NodeSpec.Mapping mapping) {
            return NodeTree.branch(normalizeMapping(mapping));
        }
        if (spec instanceof NodeSpec.Sequence sequence) {
            Map<NodeKey, NodeTree<Object>> indexed = new LinkedHashMap<>();
            List<NodeSpec> elements = sequence.elements();
            for (int i = 0; i < elements.size(); i++) {
                indexed.put(NodeKey.ordinal(i), toTree(elements.get(i)));
            }
            return NodeTree.branch(indexed);
        }
        return NodeTree.leaf(((NodeSpec.Scalar) spec).reference());
    }

    private Map<NodeKey, NodeTree<Object>> normalizeMapping(NodeSpec.Mapping mapping) {
        Map<NodeKey, NodeTree<Object>> normalized = new LinkedHashMap<>();
        for (Map.Entry<NodeKey, NodeSpec> entry : mapping.entries().entrySet()) {
            normalized.put(entry.getKey(), toTree(entry.getValue()));
        }
        return normalized;
    }

    private Placeholder placeholder(boolean scalar) {
        return new Placeholder(scalar, nextToken++);
    }
}
