package work.taskrun.core.cli;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.taskrun.core.api.CollectionResult;
import work.taskrun.core.api.ConfigurationLoader;
import work.taskrun.core.api.TaskrunCollector;
import work.taskrun.core.api.TaskrunConfiguration;
import work.taskrun.core.collect.CollectionReport;

@CommandLine.Command(
    name = "collect",
    description = "Collect tasks and print them with their dependencies and products as JSON.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class CollectCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = {"-c", "--config"},
        paramLabel = "FILE",
        description = "Configuration file (default: nearest taskrun.toml).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path config;

    @CommandLine.Option(
        names = {"-C", "--directory"},
        paramLabel = "DIR",
        description = "Run as if started in DIR.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path directory;

    @CommandLine.Parameters(
        paramLabel = "TASK_FILE",
        arity = "0..*",
        description = "Task files to collect (overrides task_files of the configuration)."
    )
    private List<Path> taskFiles = new ArrayList<>();

    @Override
    public Integer call() throws Exception {
        Path workingDirectory = directory == null
            ? Paths.get("").toAbsolutePath().normalize()
            : directory.toAbsolutePath().normalize();
        TaskrunConfiguration configuration = ConfigurationLoader.resolve(workingDirectory, config, taskFiles);

        CollectionResult result = new TaskrunCollector().collect(configuration);

        PrintWriter out = spec.commandLine().getOut();
        out.println(result.toPrettyJson());
        out.flush();

        for (CollectionReport failure : result.failures()) {
            ShortErrorHandler.report(spec.commandLine(), failure.source(), failure.error());
        }
        return result.status().exitCode();
    }
}
