package work.taskrun.core.marks;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Annotation attached to a task function: a name plus positional and keyword arguments.
 */
public record Mark(String name, List<Object> args, Map<String, Object> kwargs) {
    public Mark {
        Objects.requireNonNull(name, "name");
        args = args == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(args));
        kwargs = kwargs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(kwargs));
    }

    public static Mark of(String name, Object... args) {
        return new Mark(name, Arrays.asList(args), Map.of());
    }

    public static Mark dependsOn(Object objects) {
        return of(Declarations.DEPENDS_ON, objects);
    }

    public static Mark produces(Object objects) {
        return of(Declarations.PRODUCES, objects);
    }
}
