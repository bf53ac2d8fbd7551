package work.taskrun.core.cli;

import picocli.CommandLine;
import work.taskrun.core.collect.NodeNotCollectedException;
import work.taskrun.core.nodes.DuplicateNodeNameException;
import work.taskrun.core.nodes.InvalidReferenceException;

/**
 * Prints one line per failure instead of a stack trace. Stack traces are printed when
 * {@code -Dtaskrun.debug=true} is set.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    static final String DEBUG_PROPERTY = "taskrun.debug";

    @Override
    public int handleExecutionException(
        Exception ex,
        CommandLine commandLine,
        CommandLine.ParseResult parseResult
    ) {
        report(commandLine, "taskrun", ex);
        return commandLine.getCommandSpec().exitCodeOnExecutionException();
    }

    static void report(CommandLine commandLine, String source, Throwable error) {
        var err = commandLine.getErr();
        err.println(commandLine.getColorScheme().errorText(source + ": " + describe(error)));
        if (Boolean.getBoolean(DEBUG_PROPERTY)) {
            error.printStackTrace(err);
        }
        err.flush();
    }

    static String describe(Throwable error) {
        if (error instanceof NodeNotCollectedException notCollected) {
            return "no collector recognizes '" + notCollected.reference() + "' declared by task '"
                + notCollected.taskName() + "'";
        }
        if (error instanceof DuplicateNodeNameException duplicate) {
            return duplicate.kind() + " declares " + duplicate.names() + " more than once";
        }
        if (error instanceof InvalidReferenceException invalid) {
            return "invalid reference '" + invalid.reference() + "': " + invalid.getMessage();
        }
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }
}
