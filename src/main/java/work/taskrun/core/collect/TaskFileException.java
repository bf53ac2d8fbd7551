package work.taskrun.core.collect;

import java.nio.file.Path;

/**
 * Raised when a task file cannot be read or does not describe tasks.
 */
public final class TaskFileException extends IllegalStateException {
    private final Path file;

    public TaskFileException(Path file, String message) {
        super(message + " (" + file + ")");
        this.file = file;
    }

    public TaskFileException(Path file, String message, Throwable cause) {
        super(message + " (" + file + ")", cause);
        this.file = file;
    }

    public Path file() {
        return file;
    }
}
