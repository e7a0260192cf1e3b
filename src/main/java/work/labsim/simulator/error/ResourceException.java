package work.labsim.simulator.error;

/**
 * Missing, unreadable or conflicting external labware/data resources.
 */
public final class ResourceException extends SimulationException {
    public ResourceException(String message) {
        super("resource_error", message);
    }

    public ResourceException(String message, Throwable cause) {
        super("resource_error", message, cause);
    }
}
