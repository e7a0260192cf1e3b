package work.labsim.simulator.error;

/**
 * Incompatible engine flags, unreadable settings or an invalid bundle destination.
 */
public final class ConfigurationException extends SimulationException {
    public ConfigurationException(String message) {
        super("configuration_error", message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super("configuration_error", message, cause);
    }
}
