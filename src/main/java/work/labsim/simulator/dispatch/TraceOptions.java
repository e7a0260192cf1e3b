package work.labsim.simulator.dispatch;

import java.util.Objects;
import work.labsim.simulator.api.LogLevel;

/**
 * How a run is traced.
 *
 * @param logLevel        minimum severity captured into spans
 * @param propagateLogs   whether captured records also reach the regular logging output
 * @param stackLoggerName logger the interceptor attaches to; everything below it is captured
 */
public record TraceOptions(LogLevel logLevel, boolean propagateLogs, String stackLoggerName) {
    public static final String DEFAULT_STACK_LOGGER = "work.labsim.simulator";

    public TraceOptions {
        Objects.requireNonNull(logLevel, "logLevel");
        stackLoggerName = stackLoggerName == null || stackLoggerName.isBlank() ? DEFAULT_STACK_LOGGER : stackLoggerName;
    }

    public static TraceOptions defaults() {
        return new TraceOptions(LogLevel.WARNING, false, DEFAULT_STACK_LOGGER);
    }

    public static TraceOptions of(LogLevel logLevel) {
        return new TraceOptions(logLevel, false, DEFAULT_STACK_LOGGER);
    }
}
