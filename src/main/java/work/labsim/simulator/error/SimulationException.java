package work.labsim.simulator.error;

/**
 * Base exception for simulator failures; carries a stable machine-readable code next to the message.
 */
public class SimulationException extends RuntimeException {
    private final String code;

    public SimulationException(String code, String message) {
        super(message);
        this.code = code;
    }

    public SimulationException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String code() {
        return code;
    }
}
