package work.taskrun.core.api;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlInvalidTypeException;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;

/**
 * Reads {@link TaskrunConfiguration} from {@code taskrun.toml}:
 *
 * <pre>
 * [taskrun]
 * root = "."
 * task_files = ["tasks.yaml"]
 * </pre>
 */
public final class ConfigurationLoader {
    public static final String CONFIG_FILE_NAME = "taskrun.toml";
    private static final String SECTION = "taskrun";

    private ConfigurationLoader() {}

    /**
     * Finds the nearest {@code taskrun.toml} in {@code start} or one of its parents.
     */
    public static Optional<Path> discover(Path start) {
        Path current = start.toAbsolutePath().normalize();
        while (current != null) {
            Path candidate = current.resolve(CONFIG_FILE_NAME);
            if (Files.isRegularFile(candidate)) {
                return Optional.of(candidate);
            }
            current = current.getParent();
        }
        return Optional.empty();
    }

    /**
     * Resolves the configuration for a run started in {@code workingDirectory}.
     *
     * @param explicitConfig config file given by the user; discovered when null
     * @param taskFileOverrides task files given by the user; replace the configured ones when not empty
     */
    public static TaskrunConfiguration resolve(Path workingDirectory, Path explicitConfig, List<Path> taskFileOverrides) {
        Optional<Path> configFile = explicitConfig != null
            ? Optional.of(workingDirectory.resolve(explicitConfig).normalize())
            : discover(workingDirectory);
        TaskrunConfiguration base = configFile
            .map(ConfigurationLoader::load)
            .orElseGet(() -> TaskrunConfiguration.builder().root(workingDirectory).build());
        if (taskFileOverrides == null || taskFileOverrides.isEmpty()) {
            return base;
        }
        List<Path> overrides = new ArrayList<>();
        for (Path file : taskFileOverrides) {
            overrides.add(workingDirectory.resolve(file).toAbsolutePath().normalize());
        }
        return TaskrunConfiguration.builder()
            .root(base.root())
            .taskFiles(overrides)
            .configFile(base.configFile())
            .build();
    }

    /**
     * @throws IllegalArgumentException if the file cannot be read or is not valid
     */
    public static TaskrunConfiguration load(Path configFile) {
        Path absolute = configFile.toAbsolutePath().normalize();
        TomlParseResult result;
        try {
            result = Toml.parse(Files.readString(absolute));
        } catch (IOException ex) {
            throw new IllegalArgumentException("Unable to read configuration " + absolute + ": " + ex.getMessage(), ex);
        }
        if (result.hasErrors()) {
            throw new IllegalArgumentException("Invalid configuration " + absolute + ": " + result.errors().get(0));
        }
        return fromToml(result, absolute);
    }

    static TaskrunConfiguration fromToml(TomlParseResult result, Path configFile) {
        Path directory = configFile.getParent();
        TomlTable section = result.getTable(SECTION);
        if (section == null) {
            return TaskrunConfiguration.builder()
                .root(directory)
                .configFile(Optional.of(configFile))
                .build();
        }
        try {
            String rootValue = section.getString("root");
            Path root = rootValue == null || rootValue.isBlank() ? directory : directory.resolve(rootValue).normalize();
            return TaskrunConfiguration.builder()
                .root(root)
                .taskFiles(readPaths(section.getArray("task_files")))
                .configFile(Optional.of(configFile))
                .build();
        } catch (TomlInvalidTypeException ex) {
            throw new IllegalArgumentException("Invalid configuration " + configFile + ": " + ex.getMessage(), ex);
        }
    }

    private static List<Path> readPaths(TomlArray array) {
        if (array == null || array.isEmpty()) {
            return List.of();
        }
        List<Path> paths = new ArrayList<>(array.size());
        for (int i = 0; i < array.size(); i++) {
            paths.add(Path.of(array.getString(i)));
        }
        return paths;
    }
}
