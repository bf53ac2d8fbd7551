package work.taskrun.core.collect;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import work.taskrun.core.marks.Mark;
import work.taskrun.core.marks.MarkedFunction;
import work.taskrun.core.marks.TaskFunction;

/**
 * One entry of a task file before collection.
 */
public record TaskDefinition(Path file, String name, String call, List<Mark> markers, Map<String, Object> kwargs) {
    public TaskDefinition {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(call, "call");
        markers = markers == null ? List.of() : List.copyOf(markers);
        kwargs = kwargs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(kwargs));
    }

    /**
     * Looks up the body in the registry and attaches the markers and keyword arguments to it.
     *
     * @throws TaskFileException if no function is registered under {@link #call()}
     */
    public TaskFunction toFunction(TaskFunctionRegistry registry) {
        TaskFunction body = registry.get(call);
        if (body == null) {
            throw new TaskFileException(file, "Task '" + name + "' calls unknown function '" + call + "'");
        }
        return new MarkedFunction(body, markers, kwargs);
    }
}
