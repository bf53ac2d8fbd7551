package work.taskrun.core.marks;

/**
 * A task function layered over another one.
 */
public interface WrappedFunction extends TaskFunction {
    TaskFunction wrapped();

    /**
     * Follows {@link #wrapped()} until reaching a function that is not itself wrapped.
     */
    static TaskFunction unwrap(TaskFunction function) {
        TaskFunction current = function;
        while (current instanceof WrappedFunction wrapper) {
            current = wrapper.wrapped();
        }
        return current;
    }
}
