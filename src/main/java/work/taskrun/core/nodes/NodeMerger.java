package work.taskrun.core.nodes;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import work.taskrun.core.shared.Names;

/**
 * Merges the normalized mappings of all declarations of one kind attached to a task.
 */
public final class NodeMerger {
    private NodeMerger() {}

    /**
     * Normalizes and merges the declarations of one kind ({@code depends_on} or {@code produces}).
     */
    public static NodeTree<Object> mergeDeclarations(List<NodeSpec> declarations, String kind) {
        var normalizer = new NodeNormalizer();
        List<Map<NodeKey, NodeTree<Object>>> mappings = new ArrayList<>(declarations.size());
        for (NodeSpec declaration : declarations) {
            mappings.add(normalizer.normalize(declaration));
        }
        return merge(mappings, kind);
    }

    /**
     * Rejects explicit keys declared more than once, then merges.
     *
     * @throws DuplicateNodeNameException if an explicit key occurs in more than one mapping
     */
    public static NodeTree<Object> merge(List<Map<NodeKey, NodeTree<Object>>> mappings, String kind) {
        checkNamesAreUnique(mappings, kind);
        return mergeMappings(mappings);
    }

    static void checkNamesAreUnique(List<Map<NodeKey, NodeTree<Object>>> mappings, String kind) {
        List<NodeKey> names = new ArrayList<>();
        for (Map<NodeKey, NodeTree<Object>> mapping : mappings) {
            for (NodeKey key : mapping.keySet()) {
                if (key.isExplicit()) {
                    names.add(key);
                }
            }
        }
        Set<NodeKey> duplicated = Names.findDuplicates(names);
        if (!duplicated.isEmpty()) {
            throw new DuplicateNodeNameException(kind, duplicated);
        }
    }

    /**
     * Shallow merge on the first-level keys. Placeholders are replaced by the smallest ordinal that is neither
     * used explicitly nor already assigned. A lone scalar placeholder collapses to its bare value and a lone
     * collection placeholder becomes {@code {0: value}}.
     */
    static NodeTree<Object> mergeMappings(List<Map<NodeKey, NodeTree<Object>>> mappings) {
        Map<NodeKey, NodeTree<Object>> merged = Names.unionOf(mappings);

        if (merged.size() == 1) {
            var only = merged.entrySet().iterator().next();
            if (only.getKey() instanceof Placeholder placeholder) {
                if (placeholder.scalar()) {
                    return only.getValue();
                }
                return NodeTree.branch(Map.of(NodeKey.ordinal(0), only.getValue()));
            }
        }

        Map<NodeKey, NodeTree<Object>> out = new LinkedHashMap<>();
        int counter = 0;
        for (Map.Entry<NodeKey, NodeTree<Object>> entry : merged.entrySet()) {
            if (entry.getKey().isExplicit()) {
                out.put(entry.getKey(), entry.getValue());
                continue;
            }
            NodeKey candidate = NodeKey.ordinal(counter++);
            while (merged.containsKey(candidate) || out.containsKey(candidate)) {
                candidate = NodeKey.ordinal(counter++);
            }
            out.put(candidate, entry.getValue());
        }
        return NodeTree.branch(out);
    }
}
