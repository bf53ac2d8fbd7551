package work.taskrun.core.nodes;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import work.taskrun.core.marks.Mark;
import work.taskrun.core.marks.TaskFunction;
import work.taskrun.core.shared.Fingerprints;
import work.taskrun.core.shared.Names;

/**
 * Task whose body is a {@link TaskFunction} defined in a task file.
 */
public final class FunctionTask implements Task {
    private final String baseName;
    private final String name;
    private final String shortName;
    private final Path path;
    private final TaskFunction function;
    private final NodeTree<Node> dependsOn;
    private final NodeTree<Node> produces;
    private final List<Mark> markers;
    private final Map<String, Object> kwargs;
    private final Map<String, Object> attributes = new ConcurrentHashMap<>();
    private final List<ReportSection> reportSections = new ArrayList<>();
    private volatile TaskStatus status = TaskStatus.COLLECTED;

    private FunctionTask(Builder builder) {
        this.baseName = Objects.requireNonNull(builder.baseName, "baseName");
        this.path = Objects.requireNonNull(builder.path, "path");
        this.function = Objects.requireNonNull(builder.function, "function");
        this.name = builder.name == null ? Names.createTaskName(path, baseName) : builder.name;
        this.shortName = builder.shortName == null ? name : builder.shortName;
        this.dependsOn = builder.dependsOn == null ? NodeTree.empty() : builder.dependsOn;
        this.produces = builder.produces == null ? NodeTree.empty() : builder.produces;
        this.markers = List.copyOf(builder.markers);
        this.kwargs = Collections.unmodifiableMap(new LinkedHashMap<>(builder.kwargs));
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String baseName() {
        return baseName;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String shortName() {
        return shortName;
    }

    @Override
    public Path path() {
        return path;
    }

    @Override
    public TaskFunction function() {
        return function;
    }

    @Override
    public NodeTree<Node> dependsOn() {
        return dependsOn;
    }

    @Override
    public NodeTree<Node> produces() {
        return produces;
    }

    @Override
    public List<Mark> markers() {
        return markers;
    }

    @Override
    public Map<String, Object> kwargs() {
        return kwargs;
    }

    @Override
    public Map<String, Object> attributes() {
        return attributes;
    }

    @Override
    public TaskStatus status() {
        return status;
    }

    @Override
    public synchronized List<ReportSection> reportSections() {
        return List.copyOf(reportSections);
    }

    @Override
    public void execute(Map<String, Object> arguments) throws Exception {
        synchronized (this) {
            if (status != TaskStatus.COLLECTED) {
                throw new IllegalStateException("Task " + name + " cannot be executed while " + status);
            }
            status = TaskStatus.EXECUTING;
        }
        try {
            function.call(arguments == null ? Map.of() : arguments);
            status = TaskStatus.SUCCEEDED;
        } catch (Throwable ex) {
            status = TaskStatus.FAILED;
            throw ex;
        }
    }

    @Override
    public synchronized void addReportSection(String when, String key, String content) {
        if (status == TaskStatus.COLLECTED) {
            throw new IllegalStateException("Task " + name + " has not been executed yet");
        }
        if (content != null && !content.isEmpty()) {
            reportSections.add(new ReportSection(when, key, content));
        }
    }

    /**
     * Last modification time of the file defining the task.
     */
    @Override
    public String state() {
        try {
            return Fingerprints.lastModified(path);
        } catch (NoSuchFileException ex) {
            throw new NodeNotFoundException(path);
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to read modification time of " + path, ex);
        }
    }

    @Override
    public String toString() {
        return "FunctionTask[" + name + "]";
    }

    public static final class Builder {
        private String baseName;
        private String name;
        private String shortName;
        private Path path;
        private TaskFunction function;
        private NodeTree<Node> dependsOn;
        private NodeTree<Node> produces;
        private List<Mark> markers = List.of();
        private Map<String, Object> kwargs = Map.of();

        public Builder baseName(String baseName) {
            this.baseName = baseName;
            return this;
        }

        /**
         * Overrides the derived {@code <path>::<baseName>} name.
         */
        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder shortName(String shortName) {
            this.shortName = shortName;
            return this;
        }

        public Builder path(Path path) {
            this.path = path;
            return this;
        }

        public Builder function(TaskFunction function) {
            this.function = function;
            return this;
        }

        public Builder dependsOn(NodeTree<Node> dependsOn) {
            this.dependsOn = dependsOn;
            return this;
        }

        public Builder produces(NodeTree<Node> produces) {
            this.produces = produces;
            return this;
        }

        public Builder markers(List<Mark> markers) {
            this.markers = markers == null ? List.of() : markers;
            return this;
        }

        public Builder kwargs(Map<String, Object> kwargs) {
            this.kwargs = kwargs == null ? Map.of() : kwargs;
            return this;
        }

        public FunctionTask build() {
            return new FunctionTask(this);
        }
    }
}
