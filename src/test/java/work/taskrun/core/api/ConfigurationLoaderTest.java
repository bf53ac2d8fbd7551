package work.taskrun.core.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigurationLoaderTest {
    @TempDir
    Path tempDir;

    @Test
    void readsRootAndTaskFiles() throws Exception {
        var config = Files.writeString(tempDir.resolve("taskrun.toml"), """
            [taskrun]
            root = "project"
            task_files = ["a.yaml", "nested/b.yaml"]
            """);

        var configuration = ConfigurationLoader.load(config);

        assertEquals(tempDir.resolve("project"), configuration.root());
        assertEquals(List.of(Path.of("a.yaml"), Path.of("nested/b.yaml")), configuration.taskFiles());
        assertEquals(Optional.of(config), configuration.configFile());
    }

    @Test
    void missingSectionUsesDefaults() throws Exception {
        var config = Files.writeString(tempDir.resolve("taskrun.toml"), "[other]\nkey = 1\n");

        var configuration = ConfigurationLoader.load(config);

        assertEquals(tempDir, configuration.root());
        assertEquals(List.of(Path.of(TaskrunConfiguration.DEFAULT_TASK_FILE)), configuration.taskFiles());
    }

    @Test
    void rejectsInvalidFiles() throws Exception {
        var syntax = Files.writeString(tempDir.resolve("syntax.toml"), "[taskrun\n");
        var types = Files.writeString(tempDir.resolve("types.toml"), "[taskrun]\nroot = 3\n");

        assertThrows(IllegalArgumentException.class, () -> ConfigurationLoader.load(syntax));
        assertThrows(IllegalArgumentException.class, () -> ConfigurationLoader.load(types));
        assertThrows(IllegalArgumentException.class, () -> ConfigurationLoader.load(tempDir.resolve("missing.toml")));
    }

    @Test
    void discoversConfigurationInParentDirectories() throws Exception {
        var config = Files.writeString(tempDir.resolve("taskrun.toml"), "[taskrun]\n");
        var nested = Files.createDirectories(tempDir.resolve("a").resolve("b"));

        assertEquals(Optional.of(config), ConfigurationLoader.discover(nested));
    }

    @Test
    void overridesReplaceConfiguredTaskFiles() throws Exception {
        Files.writeString(tempDir.resolve("taskrun.toml"), "[taskrun]\ntask_files = [\"a.yaml\"]\n");

        var configuration = ConfigurationLoader.resolve(tempDir, null, List.of(Path.of("other.yaml")));

        assertEquals(tempDir, configuration.root());
        assertEquals(List.of(tempDir.resolve("other.yaml")), configuration.taskFiles());
        assertTrue(configuration.configFile().isPresent());
    }

    @Test
    void explicitConfigurationIsResolvedAgainstWorkingDirectory() throws Exception {
        var sub = Files.createDirectories(tempDir.resolve("conf"));
        Files.writeString(sub.resolve("custom.toml"), "[taskrun]\nroot = \"..\"\n");

        var configuration = ConfigurationLoader.resolve(tempDir, Path.of("conf/custom.toml"), List.of());

        assertEquals(tempDir, configuration.root());
        assertEquals(Optional.of(sub.resolve("custom.toml")), configuration.configFile());
    }
}
