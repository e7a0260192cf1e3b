package work.labsim.simulator.error;

/**
 * Raised when protocol content cannot be turned into a descriptor.
 */
public final class ProtocolParseException extends SimulationException {
    public ProtocolParseException(String message) {
        super("parse_error", message);
    }

    public ProtocolParseException(String message, Throwable cause) {
        super("parse_error", message, cause);
    }
}
