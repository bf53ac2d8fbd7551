package work.taskrun.core.nodes;

import java.util.List;
import java.util.Map;
import work.taskrun.core.marks.Mark;
import work.taskrun.core.marks.TaskFunction;

/**
 * A node that is executed: owns its resolved dependencies and products.
 */
public interface Task extends Node {
    /**
     * Name as declared in the task file.
     */
    String baseName();

    /**
     * Shortest name identifying the task for display; the full {@link #name()} unless shortened.
     */
    String shortName();

    NodeTree<Node> dependsOn();

    NodeTree<Node> produces();

    List<Mark> markers();

    Map<String, Object> kwargs();

    /**
     * Free-form information other components attach to the task.
     */
    Map<String, Object> attributes();

    TaskFunction function();

    TaskStatus status();

    List<ReportSection> reportSections();

    void execute(Map<String, Object> arguments) throws Exception;

    /**
     * Records output for the report. Sections with empty content are ignored.
     *
     * @throws IllegalStateException if the task has not started executing
     */
    void addReportSection(String when, String key, String content);
}
