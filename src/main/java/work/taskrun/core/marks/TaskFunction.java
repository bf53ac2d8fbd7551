package work.taskrun.core.marks;

import java.util.Map;

/**
 * Body of a task, called with the named values the executor binds.
 */
@FunctionalInterface
public interface TaskFunction {
    void call(Map<String, Object> arguments) throws Exception;
}
