package work.taskrun.core.nodes;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Key of an entry in a dependency or product mapping: an explicit name or a non-negative ordinal.
 *
 * <p>Integer-like names ({@code "0"}, {@code "12"}) are always represented as {@link Ordinal}, so an
 * explicitly numbered entry blocks that number from auto-assignment.
 */
public interface NodeKey {
    default boolean isExplicit() {
        return true;
    }

    static NodeKey of(Object raw) {
        Objects.requireNonNull(raw, "key");
        if (raw instanceof NodeKey key) {
            return key;
        }
        if (raw instanceof Integer || raw instanceof Long || raw instanceof Short || raw instanceof Byte) {
            long value = ((Number) raw).longValue();
            if (value < 0 || value > Integer.MAX_VALUE) {
                throw new IllegalArgumentException("Node keys must be non-negative integers or names, got " + raw);
            }
            return new Ordinal((int) value);
        }
        String text = raw.toString();
        if (Name.INTEGER_LIKE.matcher(text).matches()) {
            return new Ordinal(Integer.parseInt(text));
        }
        return new Name(text);
    }

    static NodeKey ordinal(int value) {
        return new Ordinal(value);
    }

    static NodeKey name(String value) {
        return new Name(value);
    }

    record Name(String value) implements NodeKey {
        static final Pattern INTEGER_LIKE = Pattern.compile("0|[1-9][0-9]{0,8}");

        public Name {
            Objects.requireNonNull(value, "value");
            if (INTEGER_LIKE.matcher(value).matches()) {
                throw new IllegalArgumentException("Integer-like key '" + value + "' must be an ordinal");
            }
        }

        @Override
        public String toString() {
            return value;
        }
    }

    record Ordinal(int value) implements NodeKey {
        public Ordinal {
            if (value < 0) {
                throw new IllegalArgumentException("Ordinal keys must be non-negative, got " + value);
            }
        }

        @Override
        public String toString() {
            return Integer.toString(value);
        }
    }
}
