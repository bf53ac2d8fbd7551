package work.taskrun.core.nodes;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.taskrun.core.marks.TaskFunction;

class FunctionTaskTest {
    @TempDir
    Path tempDir;

    @Test
    void derivesNameAndShortName() {
        var task = FunctionTask.builder()
            .baseName("task_dummy")
            .path(Path.of("module.py"))
            .function(arguments -> {})
            .build();

        assertEquals("module.py::task_dummy", task.name());
        assertEquals(task.name(), task.shortName());
        assertEquals(TaskStatus.COLLECTED, task.status());
        assertEquals(Map.of(), task.dependsOn().toPlain(Node::name));
    }

    @Test
    void keepsExplicitShortName() {
        var task = FunctionTask.builder()
            .baseName("task_dummy")
            .path(Path.of("module.py"))
            .shortName("task_dummy")
            .function(arguments -> {})
            .build();

        assertEquals("task_dummy", task.shortName());
    }

    @Test
    void executesBodyWithArguments() throws Exception {
        List<Map<String, Object>> calls = new ArrayList<>();
        var task = task(calls::add);

        task.execute(Map.of("produces", "out.txt"));

        assertEquals(List.of(Map.of("produces", "out.txt")), calls);
        assertEquals(TaskStatus.SUCCEEDED, task.status());
    }

    @Test
    void failingBodyMarksTaskFailed() {
        var task = task(arguments -> {
            throw new IOException("disk full");
        });

        var ex = assertThrows(IOException.class, () -> task.execute(Map.of()));
        assertEquals("disk full", ex.getMessage());
        assertEquals(TaskStatus.FAILED, task.status());
    }

    @Test
    void errorInBodyMarksTaskFailed() {
        var task = task(arguments -> {
            throw new AssertionError("boom");
        });

        var error = assertThrows(AssertionError.class, () -> task.execute(Map.of()));
        assertEquals("boom", error.getMessage());
        assertEquals(TaskStatus.FAILED, task.status());
    }

    @Test
    void executesOnlyOnce() throws Exception {
        var task = task(arguments -> {});
        task.execute(Map.of());

        assertThrows(IllegalStateException.class, () -> task.execute(Map.of()));
        assertEquals(TaskStatus.SUCCEEDED, task.status());
    }

    @Test
    void reportSectionsRequireExecution() throws Exception {
        var task = task(arguments -> {});
        assertThrows(IllegalStateException.class, () -> task.addReportSection("call", "stdout", "hi"));

        task.execute(Map.of());
        task.addReportSection("call", "stdout", "hi");
        task.addReportSection("call", "stderr", "");
        task.addReportSection("teardown", "stdout", "bye");

        assertEquals(
            List.of(new ReportSection("call", "stdout", "hi"), new ReportSection("teardown", "stdout", "bye")),
            task.reportSections()
        );
    }

    @Test
    void reportSectionsCanBeAddedDuringExecution() throws Exception {
        var holder = new ArrayList<Task>();
        var task = task(arguments -> holder.get(0).addReportSection("call", "stdout", "running"));
        holder.add(task);

        task.execute(Map.of());

        assertEquals(List.of(new ReportSection("call", "stdout", "running")), task.reportSections());
    }

    @Test
    void stateFollowsDefiningFile() throws Exception {
        var file = Files.writeString(tempDir.resolve("tasks.yaml"), "tasks: []");
        Files.setLastModifiedTime(file, FileTime.from(Instant.ofEpochSecond(1_650_000_000L)));
        var task = FunctionTask.builder().baseName("task_a").path(file).function(arguments -> {}).build();

        assertEquals("1650000000", task.state());

        Files.delete(file);
        assertThrows(NodeNotFoundException.class, task::state);
    }

    @Test
    void attributesAreMutable() {
        var task = task(arguments -> {});
        task.attributes().put("duration", 1.5);

        assertTrue(task.attributes().containsKey("duration"));
    }

    @Test
    void exposesResolvedNodes() {
        var node = FilePathNode.fromPath(tempDir.resolve("in.txt"));
        var task = FunctionTask.builder()
            .baseName("task_a")
            .path(tempDir.resolve("tasks.yaml"))
            .function(arguments -> {})
            .dependsOn(NodeTree.leaf(node))
            .build();

        assertSame(node, task.dependsOn().leaves().get(0));
    }

    private FunctionTask task(TaskFunction body) {
        return FunctionTask.builder()
            .baseName("task_example")
            .path(tempDir.resolve("tasks.yaml"))
            .function(body)
            .build();
    }
}
