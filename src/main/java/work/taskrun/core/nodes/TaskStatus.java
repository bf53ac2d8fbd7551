package work.taskrun.core.nodes;

/**
 * Lifecycle of a task: collected once, executed at most once.
 */
public enum TaskStatus {
    COLLECTED,
    EXECUTING,
    SUCCEEDED,
    FAILED
}
