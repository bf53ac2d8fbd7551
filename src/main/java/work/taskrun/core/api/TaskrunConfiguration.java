package work.taskrun.core.api;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable configuration of a collection run.
 *
 * @param root directory task files and relative references are resolved against
 * @param taskFiles task files, relative to {@code root} unless absolute
 * @param configFile the {@code taskrun.toml} the configuration was read from, if any
 */
public record TaskrunConfiguration(Path root, List<Path> taskFiles, Optional<Path> configFile) {
    public static final String DEFAULT_TASK_FILE = "tasks.yaml";

    public TaskrunConfiguration {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(configFile, "configFile");
        root = root.toAbsolutePath().normalize();
        taskFiles = taskFiles == null || taskFiles.isEmpty() ? List.of(Path.of(DEFAULT_TASK_FILE)) : List.copyOf(taskFiles);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Path root;
        private List<Path> taskFiles = List.of();
        private Optional<Path> configFile = Optional.empty();

        public Builder root(Path root) {
            this.root = root;
            return this;
        }

        public Builder taskFiles(List<Path> taskFiles) {
            this.taskFiles = taskFiles;
            return this;
        }

        public Builder configFile(Optional<Path> configFile) {
            this.configFile = configFile;
            return this;
        }

        public TaskrunConfiguration build() {
            return new TaskrunConfiguration(root, taskFiles, configFile);
        }
    }
}
