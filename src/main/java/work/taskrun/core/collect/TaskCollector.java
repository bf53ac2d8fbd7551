package work.taskrun.core.collect;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import work.taskrun.core.nodes.Task;
import work.taskrun.core.shared.Names;

/**
 * Collects every task of a set of task files. A failing task yields a failure report and leaves the other
 * tasks untouched.
 */
public final class TaskCollector {
    private TaskCollector() {}

    public static List<CollectionReport> collect(CollectionSession session, List<Path> files) {
        var reports = new ArrayList<CollectionReport>();
        for (Path file : files) {
            Path absolute = session.root().resolve(file).normalize();
            List<TaskDefinition> definitions;
            try {
                definitions = TaskFileLoader.load(absolute);
            } catch (TaskFileException ex) {
                reports.add(CollectionReport.failure(Names.toPosix(absolute), ex));
                continue;
            }
            for (TaskDefinition definition : definitions) {
                reports.add(collectTask(session, definition));
            }
        }
        return rejectDuplicateNames(reports);
    }

    static CollectionReport collectTask(CollectionSession session, TaskDefinition definition) {
        String name = Names.createTaskName(definition.file(), definition.name());
        try {
            var function = definition.toFunction(session.functions());
            return CollectionReport.success(TaskFactory.create(definition.file(), definition.name(), function, session));
        } catch (RuntimeException ex) {
            return CollectionReport.failure(name, ex);
        }
    }

    private static List<CollectionReport> rejectDuplicateNames(List<CollectionReport> reports) {
        var names = new ArrayList<String>();
        for (CollectionReport report : reports) {
            report.taskIfCollected().map(Task::name).ifPresent(names::add);
        }
        Set<String> duplicated = Names.findDuplicates(names);
        if (duplicated.isEmpty()) {
            return reports;
        }
        var checked = new ArrayList<CollectionReport>(reports.size());
        for (CollectionReport report : reports) {
            if (report.isSuccess() && duplicated.contains(report.source())) {
                checked.add(CollectionReport.failure(
                    report.source(),
                    new IllegalStateException("Task '" + report.source() + "' is defined more than once")
                ));
            } else {
                checked.add(report);
            }
        }
        return checked;
    }
}
