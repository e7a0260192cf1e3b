package work.labsim.simulator.error;

import java.util.Objects;
import work.labsim.simulator.trace.RunLog;

/**
 * Failure inside an engine after tracing started. The run log accumulated up to the failure
 * travels with the exception so callers can still inspect it.
 */
public final class ProtocolExecutionException extends SimulationException {
    public static final String EXECUTION_ERROR = "execution_error";
    public static final String CANCELLED = "cancelled";

    private final RunLog partialRunLog;

    public ProtocolExecutionException(String code, String message, RunLog partialRunLog, Throwable cause) {
        super(code, message, cause);
        this.partialRunLog = Objects.requireNonNull(partialRunLog, "partialRunLog");
    }

    public RunLog partialRunLog() {
        return partialRunLog;
    }

    public boolean isCancellation() {
        return CANCELLED.equals(code());
    }
}
