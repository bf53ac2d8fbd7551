package work.taskrun.core.shared;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class NamesTest {
    @Test
    void createsTaskNameFromPathAndBaseName() {
        assertEquals("module.py::task_dummy", Names.createTaskName(Path.of("module.py"), "task_dummy"));
    }

    @Test
    void taskNameUsesForwardSlashes() {
        var path = Path.of("src", "tasks", "tasks.yaml");
        assertEquals("src/tasks/tasks.yaml::task_copy", Names.createTaskName(path, "task_copy"));
    }

    @Test
    void findsDuplicates() {
        assertEquals(Set.of("a"), Names.findDuplicates(List.of("a", "b", "a")));
        assertTrue(Names.findDuplicates(List.of("a", "b")).isEmpty());
    }

    @Test
    void reportsEachDuplicateOnce() {
        assertEquals(Set.of("a", "b"), Names.findDuplicates(List.of("a", "b", "a", "b", "a")));
    }

    @Test
    void unionKeepsLastValueForEqualKeys() {
        Map<String, Integer> union = Names.unionOf(List.of(Map.of("a", 0), Map.of("a", 1)));
        assertEquals(Map.of("a", 1), union);
    }

    @Test
    void unionCombinesDistinctKeys() {
        Map<String, Integer> union = Names.unionOf(List.of(Map.of("a", 0), Map.of("b", 1)));
        assertEquals(Map.of("a", 0, "b", 1), union);
    }
}
