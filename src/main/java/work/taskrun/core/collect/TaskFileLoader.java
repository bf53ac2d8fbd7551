package work.taskrun.core.collect;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import work.taskrun.core.marks.Mark;

/**
 * Loads task definitions from YAML task files.
 *
 * <pre>
 * tasks:
 *   - name: task_copy
 *     call: write_text
 *     markers:
 *       - name: depends_on
 *         args: [in.txt]
 *       - name: produces
 *         kwargs: {objects: {out: out.txt}}
 *     kwargs: {content: hello}
 * </pre>
 */
public final class TaskFileLoader {
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private TaskFileLoader() {}

    public static List<TaskDefinition> load(Path file) {
        JsonNode root;
        try (var in = Files.newInputStream(file)) {
            root = YAML_MAPPER.readTree(in);
        } catch (IOException ex) {
            throw new TaskFileException(file, "Failed to read task file: " + ex.getMessage(), ex);
        }
        if (root == null || root.isNull() || root.isMissingNode()) {
            return List.of();
        }
        if (!root.isObject()) {
            throw new TaskFileException(file, "Task file must be a mapping with a 'tasks' list");
        }
        var tasksNode = root.get("tasks");
        if (tasksNode == null || tasksNode.isNull()) {
            return List.of();
        }
        if (!tasksNode.isArray()) {
            throw new TaskFileException(file, "'tasks' must be a list");
        }
        var definitions = new ArrayList<TaskDefinition>();
        for (var taskNode : tasksNode) {
            definitions.add(toDefinition(file, taskNode));
        }
        return definitions;
    }

    private static TaskDefinition toDefinition(Path file, JsonNode node) {
        if (!node.isObject()) {
            throw new TaskFileException(file, "Task entry must be a mapping: " + node);
        }
        String name = requireText(file, node, "name");
        String call = requireText(file, node, "call");
        var markers = new ArrayList<Mark>();
        var markersNode = node.get("markers");
        if (markersNode != null && !markersNode.isNull()) {
            if (!markersNode.isArray()) {
                throw new TaskFileException(file, "'markers' of task '" + name + "' must be a list");
            }
            for (var markNode : markersNode) {
                markers.add(toMark(file, name, markNode));
            }
        }
        return new TaskDefinition(file, name, call, markers, toMap(file, name, node.get("kwargs"), "kwargs"));
    }

    private static Mark toMark(Path file, String task, JsonNode node) {
        if (node.isTextual()) {
            return new Mark(node.asText(), List.of(), Map.of());
        }
        if (!node.isObject()) {
            throw new TaskFileException(file, "Marker of task '" + task + "' must be a name or a mapping: " + node);
        }
        String name = requireText(file, node, "name");
        List<Object> args = new ArrayList<>();
        var argsNode = node.get("args");
        if (argsNode != null && !argsNode.isNull()) {
            if (!argsNode.isArray()) {
                throw new TaskFileException(file, "'args' of marker '" + name + "' must be a list");
            }
            for (var item : argsNode) {
                args.add(convertNode(item));
            }
        }
        return new Mark(name, args, toMap(file, task, node.get("kwargs"), "kwargs"));
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> toMap(Path file, String task, JsonNode node, String field) {
        if (node == null || node.isNull()) {
            return Map.of();
        }
        if (!node.isObject()) {
            throw new TaskFileException(file, "'" + field + "' of task '" + task + "' must be a mapping");
        }
        return (Map<String, Object>) convertNode(node);
    }

    private static String requireText(Path file, JsonNode node, String field) {
        var value = node.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            throw new TaskFileException(file, "Entry is missing '" + field + "': " + node);
        }
        return value.asText();
    }

    private static Object convertNode(JsonNode node) {
        return YAML_MAPPER.convertValue(node, Object.class);
    }
}
