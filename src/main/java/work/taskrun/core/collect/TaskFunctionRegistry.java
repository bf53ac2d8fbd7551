package work.taskrun.core.collect;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import work.taskrun.core.marks.TaskFunction;

/**
 * Stores the task bodies task files refer to through {@code call}.
 */
public final class TaskFunctionRegistry {
    private final Map<String, TaskFunction> functions = new ConcurrentHashMap<>();

    public TaskFunctionRegistry register(String id, TaskFunction fn) {
        functions.put(id, fn);
        return this;
    }

    public TaskFunction get(String id) {
        return id == null ? null : functions.get(id);
    }
}
