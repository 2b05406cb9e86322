package work.lcod.recli.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import work.lcod.recli.api.RecliException;

/**
 * Reports a failed leaf action as a single line on the command's error stream. An argument count
 * mismatch is followed by the command's usage so the expected arguments are visible.
 */
final class ActionErrorHandler implements CommandLine.IExecutionExceptionHandler {
    private static final Logger LOG = LoggerFactory.getLogger(ActionErrorHandler.class);

    @Override
    public int handleExecutionException(
        Exception ex,
        CommandLine commandLine,
        CommandLine.ParseResult parseResult
    ) {
        RecliException failure = findFailure(ex);
        String message = failure != null ? failure.getMessage() : ex.getMessage();
        if (message == null || message.isBlank()) {
            message = ex.getClass().getSimpleName();
        }
        commandLine.getErr().println(commandLine.getColorScheme().errorText(message));
        if (failure != null && failure.kind() == RecliException.Kind.WRONG_ARITY) {
            commandLine.usage(commandLine.getErr());
        }

        LOG.debug("{} failed", commandLine.getCommandSpec().qualifiedName(), ex);
        if (Boolean.getBoolean("recli.debug")) {
            ex.printStackTrace(commandLine.getErr());
        }
        return commandLine.getCommandSpec().exitCodeOnExecutionException();
    }

    private static RecliException findFailure(Throwable ex) {
        for (Throwable current = ex; current != null; current = current.getCause()) {
            if (current instanceof RecliException recli) {
                return recli;
            }
            if (current.getCause() == current) {
                break;
            }
        }
        return null;
    }
}
