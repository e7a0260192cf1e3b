package work.labsim.simulator.error;

/**
 * Template substitution failure while rendering a run log.
 */
public final class RunLogFormatException extends SimulationException {
    public RunLogFormatException(String message) {
        super("format_error", message);
    }
}
