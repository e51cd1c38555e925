package work.hostbridge.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Prints execution failures as a single line; the stack trace only goes out with {@code -Dhostbridge.debug=true}.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    private static final Logger LOG = LoggerFactory.getLogger(ShortErrorHandler.class);
    static final String DEBUG_PROPERTY = "hostbridge.debug";

    @Override
    public int handleExecutionException(
        Exception ex,
        CommandLine commandLine,
        CommandLine.ParseResult parseResult
    ) {
        Throwable root = ex;
        while (root.getCause() != null && root.getCause() != root && root instanceof CommandLine.ExecutionException) {
            root = root.getCause();
        }
        String message = root.getMessage();
        if (message == null || message.isBlank()) {
            message = root.getClass().getSimpleName();
        }
        commandLine.getErr().println(commandLine.getColorScheme().errorText("bridge-run: " + message));
        if (Boolean.getBoolean(DEBUG_PROPERTY)) {
            root.printStackTrace(commandLine.getErr());
        } else {
            LOG.debug("bridge-run failed", root);
        }
        return commandLine.getCommandSpec().exitCodeOnExecutionException();
    }
}
