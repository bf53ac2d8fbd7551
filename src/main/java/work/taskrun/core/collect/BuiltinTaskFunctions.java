package work.taskrun.core.collect;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Task bodies available to every task file. Relative paths in their arguments resolve against the
 * project root.
 */
public final class BuiltinTaskFunctions {
    public static final String NOOP = "noop";
    public static final String TOUCH = "touch";
    public static final String WRITE_TEXT = "write_text";

    private BuiltinTaskFunctions() {}

    public static TaskFunctionRegistry register(TaskFunctionRegistry registry, Path root) {
        registry.register(NOOP, arguments -> {});
        registry.register(TOUCH, arguments -> touch(root, arguments));
        registry.register(WRITE_TEXT, arguments -> writeText(root, arguments));
        return registry;
    }

    private static void touch(Path root, Map<String, Object> arguments) throws IOException {
        Object raw = arguments.get("paths");
        if (!(raw instanceof List<?> paths)) {
            throw new IllegalArgumentException("touch: 'paths' must be a list");
        }
        for (Object item : paths) {
            Path target = prepareTarget(root, item);
            if (Files.exists(target)) {
                Files.setLastModifiedTime(target, FileTime.from(Instant.now()));
            } else {
                Files.createFile(target);
            }
        }
    }

    private static void writeText(Path root, Map<String, Object> arguments) throws IOException {
        Object path = arguments.get("path");
        if (path == null) {
            throw new IllegalArgumentException("write_text: 'path' is required");
        }
        Path target = prepareTarget(root, path);
        Files.writeString(target, String.valueOf(arguments.getOrDefault("content", "")), StandardCharsets.UTF_8);
    }

    private static Path prepareTarget(Path root, Object reference) throws IOException {
        Path target = root.resolve(String.valueOf(reference)).normalize();
        Path parent = target.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        return target;
    }
}
