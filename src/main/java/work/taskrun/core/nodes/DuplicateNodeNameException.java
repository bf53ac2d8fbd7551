package work.taskrun.core.nodes;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Raised when a task declares the same explicit dependency or product key more than once.
 */
public final class DuplicateNodeNameException extends IllegalArgumentException {
    private final String kind;
    private final Set<NodeKey> names;

    public DuplicateNodeNameException(String kind, Set<NodeKey> names) {
        super("Marker '" + kind + "' has nodes with the same name: " + names);
        this.kind = kind;
        this.names = Collections.unmodifiableSet(new LinkedHashSet<>(names));
    }

    public String kind() {
        return kind;
    }

    public Set<NodeKey> names() {
        return names;
    }
}
