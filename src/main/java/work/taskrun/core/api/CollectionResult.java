package work.taskrun.core.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.taskrun.core.collect.CollectionReport;
import work.taskrun.core.marks.Mark;
import work.taskrun.core.nodes.Node;
import work.taskrun.core.nodes.Task;
import work.taskrun.core.shared.Names;

/**
 * Outcome of a {@link TaskrunCollector} run (usable by the CLI and embedding apps).
 */
public record CollectionResult(Status status, List<CollectionReport> reports, Instant startedAt, Instant finishedAt) {
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    public CollectionResult {
        reports = List.copyOf(reports);
    }

    public static CollectionResult of(List<CollectionReport> reports, Instant startedAt) {
        boolean failed = reports.stream().anyMatch(report -> !report.isSuccess());
        return new CollectionResult(failed ? Status.FAILURE : Status.SUCCESS, reports, startedAt, Instant.now());
    }

    public List<Task> tasks() {
        List<Task> tasks = new ArrayList<>();
        for (CollectionReport report : reports) {
            report.taskIfCollected().ifPresent(tasks::add);
        }
        return tasks;
    }

    public List<CollectionReport> failures() {
        return reports.stream().filter(report -> !report.isSuccess()).toList();
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("status", status.name().toLowerCase());
        List<Object> tasks = new ArrayList<>();
        for (Task task : tasks()) {
            tasks.add(describe(task));
        }
        serializable.put("tasks", tasks);
        List<Object> errors = new ArrayList<>();
        for (CollectionReport failure : failures()) {
            Map<String, Object> error = new LinkedHashMap<>();
            error.put("source", failure.source());
            error.put("type", failure.error().getClass().getSimpleName());
            error.put("error", String.valueOf(failure.error().getMessage()));
            errors.add(error);
        }
        serializable.put("errors", errors);
        serializable.put("startedAt", startedAt.toString());
        serializable.put("finishedAt", finishedAt.toString());
        return serializable;
    }

    public String toPrettyJson() throws JsonProcessingException {
        return WRITER.writeValueAsString(toSerializableMap());
    }

    private static Map<String, Object> describe(Task task) {
        Map<String, Object> description = new LinkedHashMap<>();
        description.put("name", task.name());
        description.put("shortName", task.shortName());
        description.put("path", Names.toPosix(task.path()));
        description.put("dependsOn", task.dependsOn().toPlain(Node::name));
        description.put("produces", task.produces().toPlain(Node::name));
        List<String> markers = new ArrayList<>();
        for (Mark mark : task.markers()) {
            markers.add(mark.name());
        }
        description.put("markers", markers);
        return description;
    }

    public enum Status {
        SUCCESS(0),
        FAILURE(1);

        private final int exitCode;

        Status(int exitCode) {
            this.exitCode = exitCode;
        }

        public int exitCode() {
            return exitCode;
        }
    }
}
