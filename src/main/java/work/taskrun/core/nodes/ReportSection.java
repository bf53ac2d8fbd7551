package work.taskrun.core.nodes;

import java.util.Objects;

/**
 * Output captured while executing a task, e.g. {@code ("call", "stdout", "...")}.
 */
public record ReportSection(String when, String key, String content) {
    public ReportSection {
        Objects.requireNonNull(when, "when");
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(content, "content");
    }
}
