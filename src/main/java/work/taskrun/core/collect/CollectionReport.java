package work.taskrun.core.collect;

import java.util.Objects;
import java.util.Optional;
import work.taskrun.core.nodes.Task;

/**
 * Outcome of collecting one task (or of loading one task file, when the file itself is broken).
 *
 * @param source task name, or the file when no task could be read from it
 */
public record CollectionReport(Outcome outcome, String source, Task task, Exception error) {
    public CollectionReport {
        Objects.requireNonNull(outcome, "outcome");
        Objects.requireNonNull(source, "source");
    }

    public static CollectionReport success(Task task) {
        return new CollectionReport(Outcome.SUCCESS, task.name(), task, null);
    }

    public static CollectionReport failure(String source, Exception error) {
        return new CollectionReport(Outcome.FAILURE, source, null, Objects.requireNonNull(error, "error"));
    }

    public Optional<Task> taskIfCollected() {
        return Optional.ofNullable(task);
    }

    public boolean isSuccess() {
        return outcome == Outcome.SUCCESS;
    }

    public enum Outcome {
        SUCCESS,
        FAILURE
    }
}
