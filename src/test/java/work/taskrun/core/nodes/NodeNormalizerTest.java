package work.taskrun.core.nodes;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class NodeNormalizerTest {
    @Test
    void wrapsTopLevelScalarInScalarPlaceholder() {
        var normalized = new NodeNormalizer().normalize(NodeSpec.of("in.txt"));

        assertEquals(1, normalized.size());
        var entry = normalized.entrySet().iterator().next();
        var placeholder = assertInstanceOf(Placeholder.class, entry.getKey());
        assertTrue(placeholder.scalar());
        assertFalse(placeholder.isExplicit());
        assertEquals(NodeTree.leaf("in.txt"), entry.getValue());
    }

    @Test
    void givesEachTopLevelElementItsOwnPlaceholder() {
        var normalized = new NodeNormalizer().normalize(NodeSpec.of(List.of("a.txt", "b.txt")));

        assertEquals(2, normalized.size());
        var keys = new ArrayList<>(normalized.keySet());
        for (NodeKey key : keys) {
            var placeholder = assertInstanceOf(Placeholder.class, key);
            assertFalse(placeholder.scalar());
        }
        assertNotEquals(keys.get(0), keys.get(1));
        assertEquals(List.of("a.txt", "b.txt"), new ArrayList<>(leaves(normalized)));
    }

    @Test
    void keepsExplicitKeysOfMappings() {
        var declaration = new LinkedHashMap<String, Object>();
        declaration.put("config", "config.toml");
        declaration.put("data", "data.csv");

        var normalized = new NodeNormalizer().normalize(NodeSpec.of(declaration));

        assertEquals(List.of(NodeKey.name("config"), NodeKey.name("data")), new ArrayList<>(normalized.keySet()));
        assertEquals(NodeTree.leaf("config.toml"), normalized.get(NodeKey.name("config")));
    }

    @Test
    void usesPositionalOrdinalsBelowTopLevel() {
        var normalized = new NodeNormalizer().normalize(NodeSpec.of(Map.of("figures", List.of("a.png", "b.png"))));

        var figures = assertInstanceOf(NodeTree.Branch.class, normalized.get(NodeKey.name("figures")));
        assertEquals(NodeTree.leaf("a.png"), figures.get(NodeKey.ordinal(0)));
        assertEquals(NodeTree.leaf("b.png"), figures.get(NodeKey.ordinal(1)));
    }

    @Test
    void nestedSequenceInsideTopLevelSequenceKeepsIndices() {
        var normalized = new NodeNormalizer().normalize(NodeSpec.of(List.of(List.of("a", "b"), "c")));

        var values = new ArrayList<>(normalized.values());
        var nested = assertInstanceOf(NodeTree.Branch.class, values.get(0));
        assertEquals(List.of(NodeKey.ordinal(0), NodeKey.ordinal(1)), new ArrayList<>(nested.children().keySet()));
        assertEquals(NodeTree.leaf("c"), values.get(1));
    }

    @Test
    void tokensAreUniqueAcrossDeclarations() {
        var normalizer = new NodeNormalizer();
        var first = normalizer.normalize(NodeSpec.of("a"));
        var second = normalizer.normalize(NodeSpec.of("a"));

        assertNotEquals(first.keySet().iterator().next(), second.keySet().iterator().next());
    }

    private static List<Object> leaves(Map<NodeKey, NodeTree<Object>> normalized) {
        var leaves = new ArrayList<Object>();
        for (NodeTree<Object> tree : normalized.values()) {
            leaves.addAll(tree.leaves());
        }
        return leaves;
    }
}
