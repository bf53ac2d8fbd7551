package work.taskrun.core.cli;

import picocli.CommandLine;
import work.taskrun.core.api.ConfigurationLoader;
import work.taskrun.core.api.TaskrunConfiguration;

/**
 * Version from the jar manifest plus the file names a project is discovered by.
 */
final class VersionProvider implements CommandLine.IVersionProvider {
    @Override
    public String[] getVersion() {
        String version = Main.class.getPackage().getImplementationVersion();
        return new String[] {
            "taskrun " + (version == null ? "development" : version),
            "configuration: " + ConfigurationLoader.CONFIG_FILE_NAME
                + ", default task file: " + TaskrunConfiguration.DEFAULT_TASK_FILE,
            "java " + Runtime.version()
        };
    }
}
