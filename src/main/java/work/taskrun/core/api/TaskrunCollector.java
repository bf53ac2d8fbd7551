package work.taskrun.core.api;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import work.taskrun.core.collect.CollectionSession;
import work.taskrun.core.collect.TaskCollector;

/**
 * Public entry point for embedding task collection.
 */
public final class TaskrunCollector {
    public CollectionResult collect(TaskrunConfiguration configuration) {
        return collect(configuration, CollectionSession.create(configuration.root()));
    }

    /**
     * Collects with a caller-provided session, e.g. one with additional collectors or task functions.
     */
    public CollectionResult collect(TaskrunConfiguration configuration, CollectionSession session) {
        var started = Instant.now();
        session.reset();
        List<Path> files = new ArrayList<>();
        for (Path file : configuration.taskFiles()) {
            files.add(configuration.root().resolve(file).normalize());
        }
        return CollectionResult.of(TaskCollector.collect(session, files), started);
    }
}
