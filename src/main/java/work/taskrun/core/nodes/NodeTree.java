package work.taskrun.core.nodes;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Nested keyed structure holding references (before collection) or nodes (after collection).
 *
 * <p>A task with a single bare dependency exposes a {@link Leaf}; every other declaration shape yields a
 * {@link Branch} whose insertion order is preserved.
 */
public interface NodeTree<T> {

    static <T> NodeTree<T> leaf(T value) {
        return new Leaf<>(value);
    }

    static <T> NodeTree<T> branch(Map<NodeKey, NodeTree<T>> children) {
        return new Branch<>(children);
    }

    static <T> NodeTree<T> empty() {
        return new Branch<>(Map.of());
    }

    <R> NodeTree<R> map(Function<? super T, ? extends R> fn);

    /**
     * Leaves in depth-first insertion order.
     */
    List<T> leaves();

    /**
     * Plain representation for serialization: the leaf itself or nested maps keyed by {@link NodeKey#toString()}.
     */
    Object toPlain(Function<? super T, ?> leafConverter);

    record Leaf<T>(T value) implements NodeTree<T> {
        @Override
        public <R> NodeTree<R> map(Function<? super T, ? extends R> fn) {
            return new Leaf<>(fn.apply(value));
        }

        @Override
        public List<T> leaves() {
            return Collections.singletonList(value);
        }

        @Override
        public Object toPlain(Function<? super T, ?> leafConverter) {
            return leafConverter.apply(value);
        }
    }

    record Branch<T>(Map<NodeKey, NodeTree<T>> children) implements NodeTree<T> {
        public Branch {
            children = Collections.unmodifiableMap(new LinkedHashMap<>(children));
        }

        public NodeTree<T> get(NodeKey key) {
            return children.get(key);
        }

        @Override
        public <R> NodeTree<R> map(Function<? super T, ? extends R> fn) {
            Map<NodeKey, NodeTree<R>> mapped = new LinkedHashMap<>();
            for (Map.Entry<NodeKey, NodeTree<T>> entry : children.entrySet()) {
                mapped.put(entry.getKey(), entry.getValue().map(fn));
            }
            return new Branch<>(mapped);
        }

        @Override
        public List<T> leaves() {
            List<T> leaves = new ArrayList<>();
            for (NodeTree<T> child : children.values()) {
                leaves.addAll(child.leaves());
            }
            return leaves;
        }

        @Override
        public Object toPlain(Function<? super T, ?> leafConverter) {
            Map<String, Object> plain = new LinkedHashMap<>();
            for (Map.Entry<NodeKey, NodeTree<T>> entry : children.entrySet()) {
                plain.put(entry.getKey().toString(), entry.getValue().toPlain(leafConverter));
            }
            return plain;
        }
    }
}
