package work.labsim.simulator.api;

import java.util.Objects;
import java.util.Optional;
import work.labsim.simulator.config.EngineFlags;
import work.labsim.simulator.dispatch.TraceOptions;
import work.labsim.simulator.protocol.ProtocolSource;
import work.labsim.simulator.runtime.SimulationContext.CancellationToken;

/**
 * Immutable configuration of one simulation.
 */
public record SimulationConfiguration(
    ProtocolSource source,
    EngineFlags flags,
    LogLevel logLevel,
    boolean propagateLogs,
    String stackLoggerName,
    Optional<CancellationToken> cancellationToken
) {
    public SimulationConfiguration {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(flags, "flags");
        Objects.requireNonNull(logLevel, "logLevel");
        Objects.requireNonNull(cancellationToken, "cancellationToken");
        stackLoggerName = stackLoggerName == null || stackLoggerName.isBlank() ? TraceOptions.DEFAULT_STACK_LOGGER : stackLoggerName;
    }

    public TraceOptions traceOptions() {
        return new TraceOptions(logLevel, propagateLogs, stackLoggerName);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private ProtocolSource source;
        private EngineFlags flags = EngineFlags.DEFAULTS;
        private LogLevel logLevel = LogLevel.WARNING;
        private boolean propagateLogs;
        private String stackLoggerName = TraceOptions.DEFAULT_STACK_LOGGER;
        private Optional<CancellationToken> cancellationToken = Optional.empty();

        public Builder source(ProtocolSource source) {
            this.source = source;
            return this;
        }

        public Builder flags(EngineFlags flags) {
            this.flags = flags;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public Builder propagateLogs(boolean propagateLogs) {
            this.propagateLogs = propagateLogs;
            return this;
        }

        public Builder stackLoggerName(String stackLoggerName) {
            this.stackLoggerName = stackLoggerName;
            return this;
        }

        public Builder cancellationToken(CancellationToken cancellationToken) {
            this.cancellationToken = Optional.ofNullable(cancellationToken);
            return this;
        }

        public SimulationConfiguration build() {
            return new SimulationConfiguration(source, flags, logLevel, propagateLogs, stackLoggerName, cancellationToken);
        }
    }
}
