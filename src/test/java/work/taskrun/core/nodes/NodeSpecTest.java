package work.taskrun.core.nodes;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class NodeSpecTest {
    @Test
    void pathsAreScalars() {
        var path = Path.of("data", "in.txt");
        assertEquals(new NodeSpec.Scalar(path), NodeSpec.of(path));
    }

    @Test
    void stringsAreScalars() {
        assertEquals(new NodeSpec.Scalar("in.txt"), NodeSpec.of("in.txt"));
    }

    @Test
    void listsSetsAndArraysAreSequences() {
        assertInstanceOf(NodeSpec.Sequence.class, NodeSpec.of(List.of("a")));
        assertInstanceOf(NodeSpec.Sequence.class, NodeSpec.of(Set.of("a")));
        var array = assertInstanceOf(NodeSpec.Sequence.class, NodeSpec.of(new String[] {"a", "b"}));
        assertEquals(List.of(new NodeSpec.Scalar("a"), new NodeSpec.Scalar("b")), array.elements());
    }

    @Test
    void nullIsAScalar() {
        var sequence = assertInstanceOf(NodeSpec.Sequence.class, NodeSpec.of(Arrays.asList("a", null)));
        assertEquals(List.of(new NodeSpec.Scalar("a"), new NodeSpec.Scalar(null)), sequence.elements());
    }

    @Test
    void keysDenotingTheSameOrdinalAreRejected() {
        Map<Object, Object> figures = new LinkedHashMap<>();
        figures.put(1, "a.png");
        figures.put("1", "b.png");

        var ex = assertThrows(
            DuplicateNodeNameException.class,
            () -> NodeSpec.of(Map.of("figures", figures), "produces")
        );
        assertEquals("produces", ex.kind());
        assertEquals(Set.of(NodeKey.ordinal(1)), ex.names());
    }

    @Test
    void mapsBecomeMappingsWithNormalizedKeys() {
        var mapping = assertInstanceOf(NodeSpec.Mapping.class, NodeSpec.of(Map.of("2", "b.txt")));
        assertEquals(Map.of(NodeKey.ordinal(2), new NodeSpec.Scalar("b.txt")), mapping.entries());
    }
}
