package work.taskrun.core.cli;

import picocli.CommandLine;

@CommandLine.Command(
    name = "taskrun",
    description = "File-based task runner.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    subcommands = { CollectCommand.class }
)
final class TaskrunCommand implements Runnable {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }
}
