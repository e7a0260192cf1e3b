package work.labsim.simulator.cli;

import java.io.PrintWriter;
import picocli.CommandLine;
import work.labsim.simulator.error.ProtocolExecutionException;
import work.labsim.simulator.error.RunLogFormatException;
import work.labsim.simulator.error.SimulationException;
import work.labsim.simulator.format.RunLogFormatter;

/**
 * Reports a failed run on stderr as {@code labsim-simulate: [code] message}. Execution failures
 * also print the run log recorded up to the failing command.
 */
final class FailureReporter implements CommandLine.IExecutionExceptionHandler {
    static final String DEBUG_PROPERTY = "labsim.debug";
    static final String PARTIAL_RUN_LOG_HEADER = "Run log up to the failure:";

    @Override
    public int handleExecutionException(
        Exception ex,
        CommandLine commandLine,
        CommandLine.ParseResult parseResult
    ) {
        var err = commandLine.getErr();
        var prefix = commandLine.getCommandName() + ": ";
        if (!(ex instanceof SimulationException failure)) {
            err.println(commandLine.getColorScheme().errorText(prefix + "internal error: " + describe(ex)));
            ex.printStackTrace(err);
            err.flush();
            return ExitCodes.INTERNAL_ERROR;
        }
        err.println(commandLine.getColorScheme().errorText(prefix + "[" + failure.code() + "] " + describe(failure)));
        if (failure instanceof ProtocolExecutionException execution && !execution.partialRunLog().isEmpty()) {
            printPartialRunLog(execution, err);
        }
        if (Boolean.getBoolean(DEBUG_PROPERTY)) {
            ex.printStackTrace(err);
        }
        err.flush();
        return ExitCodes.SIMULATION_FAILED;
    }

    private static void printPartialRunLog(ProtocolExecutionException execution, PrintWriter err) {
        err.println(PARTIAL_RUN_LOG_HEADER);
        try {
            RunLogFormatter.lines(execution.partialRunLog()).forEach(line -> err.println("  " + line));
        } catch (RunLogFormatException ex) {
            err.println("  (not renderable: " + ex.getMessage() + ")");
        }
    }

    private static String describe(Exception ex) {
        var message = ex.getMessage();
        return message == null || message.isBlank() ? ex.getClass().getSimpleName() : message;
    }
}
