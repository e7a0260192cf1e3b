package work.labsim.simulator.runtime;

/**
 * A protocol step failed; the message names the step path and command.
 */
public final class StepFailureException extends RuntimeException {
    private final String path;

    StepFailureException(String path, String command, Throwable cause) {
        super(path + " (" + command + "): " + describe(cause), cause);
        this.path = path;
    }

    public String path() {
        return path;
    }

    private static String describe(Throwable cause) {
        var message = cause.getMessage();
        return message == null || message.isBlank() ? cause.getClass().getSimpleName() : message;
    }
}
