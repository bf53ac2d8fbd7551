package work.taskrun.core.nodes;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Payload of one {@code depends_on}/{@code produces} declaration: a bare reference, a sequence or a keyed
 * mapping, nested arbitrarily.
 */
public interface NodeSpec {

    /**
     * Converts raw declaration values. Maps become {@link Mapping}, collections and arrays become
     * {@link Sequence}; anything else (strings, paths and {@code null} included) is a {@link Scalar}.
     *
     * @throws DuplicateNodeNameException if two keys of one map denote the same {@link NodeKey}, e.g. {@code 0}
     *     and {@code "0"}
     */
    static NodeSpec of(Object raw) {
        return of(raw, "declaration");
    }

    /**
     * Same as {@link #of(Object)}; {@code kind} names the declaration in error messages.
     */
    static NodeSpec of(Object raw, String kind) {
        if (raw instanceof NodeSpec spec) {
            return spec;
        }
        if (raw instanceof Map<?, ?> map) {
            Map<NodeKey, NodeSpec> entries = new LinkedHashMap<>();
            Set<NodeKey> collisions = new LinkedHashSet<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                NodeKey key = NodeKey.of(entry.getKey());
                if (entries.putIfAbsent(key, of(entry.getValue(), kind)) != null) {
                    collisions.add(key);
                }
            }
            if (!collisions.isEmpty()) {
                throw new DuplicateNodeNameException(kind, collisions);
            }
            return new Mapping(entries);
        }
        if (raw instanceof Collection<?> collection) {
            List<NodeSpec> elements = new ArrayList<>(collection.size());
            for (Object item : collection) {
                elements.add(of(item, kind));
            }
            return new Sequence(elements);
        }
        if (raw != null && raw.getClass().isArray()) {
            int length = Array.getLength(raw);
            List<NodeSpec> elements = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                elements.add(of(Array.get(raw, i), kind));
            }
            return new Sequence(elements);
        }
        return new Scalar(raw);
    }

    /**
     * A single reference. May be {@code null}; whether it names a node is up to the collectors.
     */
    record Scalar(Object reference) implements NodeSpec {}

    record Sequence(List<NodeSpec> elements) implements NodeSpec {
        public Sequence {
            elements = List.copyOf(elements);
        }
    }

    record Mapping(Map<NodeKey, NodeSpec> entries) implements NodeSpec {
        public Mapping {
            entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        }
    }
}
