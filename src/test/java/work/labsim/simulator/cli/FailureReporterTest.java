package work.labsim.simulator.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import org.junit.jupiter.api.Test;
import work.labsim.simulator.error.ConfigurationException;

class FailureReporterTest {
    private final StringWriter err = new StringWriter();

    @Test
    void simulationFailuresAreOneLineWithTheirCode() {
        int code = report(new ConfigurationException("Bundle path and input path must be different"));
        assertEquals(ExitCodes.SIMULATION_FAILED, code);
        assertEquals("labsim-simulate: [configuration_error] Bundle path and input path must be different",
            err.toString().strip());
    }

    @Test
    void anythingElseIsAnInternalErrorWithItsTrace() {
        int code = report(new IllegalStateException("pipette table corrupted"));
        assertEquals(ExitCodes.INTERNAL_ERROR, code);
        var text = err.toString();
        assertTrue(text.startsWith("labsim-simulate: internal error: pipette table corrupted"), text);
        assertTrue(text.contains("at work.labsim.simulator.cli.FailureReporterTest"), text);
    }

    @Test
    void blankMessagesFallBackToTheExceptionType() {
        report(new IllegalArgumentException());
        assertTrue(err.toString().startsWith("labsim-simulate: internal error: IllegalArgumentException"), err::toString);
    }

    private int report(Exception ex) {
        var commandLine = Main.commandLine(new SimulateCommand());
        commandLine.setErr(new PrintWriter(err, true));
        return new FailureReporter().handleExecutionException(ex, commandLine, null);
    }
}
