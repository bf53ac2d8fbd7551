package work.taskrun.core.marks;

import java.util.List;
import java.util.Map;
import work.taskrun.core.nodes.NodeSpec;

/**
 * The {@code depends_on} and {@code produces} declarations. Both take a single argument {@code objects}: a
 * reference, a collection of references or a mapping from names to references, nested arbitrarily.
 *
 * <p>Marker arguments are parsed against that signature, so a malformed marker reports the same error a
 * malformed call would.
 */
public final class Declarations {
    public static final String DEPENDS_ON = "depends_on";
    public static final String PRODUCES = "produces";
    static final String PARAMETER = "objects";

    private Declarations() {}

    public static NodeSpec dependsOn(List<Object> args, Map<String, Object> kwargs) {
        return parse(DEPENDS_ON, args, kwargs);
    }

    public static NodeSpec produces(List<Object> args, Map<String, Object> kwargs) {
        return parse(PRODUCES, args, kwargs);
    }

    public static NodeSpec parse(Mark mark) {
        return parse(mark.name(), mark.args(), mark.kwargs());
    }

    static NodeSpec parse(String declaration, List<Object> args, Map<String, Object> kwargs) {
        List<Object> positional = args == null ? List.of() : args;
        Map<String, Object> named = kwargs == null ? Map.of() : kwargs;

        if (positional.size() > 1) {
            throw new IllegalArgumentException(
                declaration + "() takes 1 positional argument but " + positional.size() + " were given"
            );
        }
        for (String key : named.keySet()) {
            if (!PARAMETER.equals(key)) {
                throw new IllegalArgumentException(declaration + "() got an unexpected keyword argument '" + key + "'");
            }
        }
        if (positional.size() == 1 && named.containsKey(PARAMETER)) {
            throw new IllegalArgumentException(declaration + "() got multiple values for argument '" + PARAMETER + "'");
        }

        Object objects;
        if (positional.size() == 1) {
            objects = positional.get(0);
        } else if (named.containsKey(PARAMETER)) {
            objects = named.get(PARAMETER);
        } else {
            throw new IllegalArgumentException(
                declaration + "() missing 1 required positional argument: '" + PARAMETER + "'"
            );
        }
        if (objects == null) {
            throw new IllegalArgumentException(declaration + "() argument '" + PARAMETER + "' must not be null");
        }
        return NodeSpec.of(objects, declaration);
    }
}
