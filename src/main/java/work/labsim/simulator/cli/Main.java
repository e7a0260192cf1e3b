package work.labsim.simulator.cli;

import picocli.CommandLine;

/**
 * {@code labsim-simulate} launcher.
 */
public final class Main {
    private Main() {}

    public static void main(String[] args) {
        System.exit(commandLine(new SimulateCommand()).execute(args));
    }

    static CommandLine commandLine(SimulateCommand command) {
        var commandLine = new CommandLine(command);
        commandLine.setExecutionExceptionHandler(new FailureReporter());
        commandLine.setUsageHelpAutoWidth(true);
        return commandLine;
    }
}
