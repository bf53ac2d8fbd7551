package work.taskrun.core.shared;

import java.nio.file.Path;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Naming and duplicate-detection helpers shared by task collection and node merging.
 */
public final class Names {
    public static final String TASK_NAME_SEPARATOR = "::";

    private Names() {}

    /**
     * Builds the unique task name, e.g. {@code module.py::task_dummy}.
     */
    public static String createTaskName(Path path, String baseName) {
        return toPosix(path) + TASK_NAME_SEPARATOR + baseName;
    }

    public static String toPosix(Path path) {
        return path.toString().replace('\\', '/');
    }

    /**
     * Returns the entries occurring more than once, in order of their second occurrence.
     */
    public static <T> Set<T> findDuplicates(Iterable<T> values) {
        Set<T> seen = new HashSet<>();
        Set<T> duplicates = new LinkedHashSet<>();
        for (T value : values) {
            if (!seen.add(value)) {
                duplicates.add(value);
            }
        }
        return duplicates;
    }

    /**
     * Shallow union of maps. Later maps override earlier entries with an equal key; the key keeps
     * the position of its first occurrence.
     */
    public static <K, V> Map<K, V> unionOf(List<? extends Map<? extends K, ? extends V>> maps) {
        Map<K, V> union = new LinkedHashMap<>();
        for (Map<? extends K, ? extends V> map : maps) {
            union.putAll(map);
        }
        return union;
    }
}
