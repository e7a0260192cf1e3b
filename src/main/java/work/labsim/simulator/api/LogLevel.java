package work.labsim.simulator.api;

import ch.qos.logback.classic.Level;
import java.util.Locale;
import java.util.Optional;

/**
 * Minimum severity captured into the run log; {@link #NONE} turns capture off.
 */
public enum LogLevel {
    DEBUG(Level.DEBUG),
    INFO(Level.INFO),
    WARNING(Level.WARN),
    ERROR(Level.ERROR),
    NONE(null);

    private final Level logbackLevel;

    LogLevel(Level logbackLevel) {
        this.logbackLevel = logbackLevel;
    }

    public Optional<Level> logbackLevel() {
        return Optional.ofNullable(logbackLevel);
    }

    public boolean captures() {
        return this != NONE;
    }

    public static LogLevel from(String value) {
        if (value == null || value.isBlank()) {
            return WARNING;
        }
        var normalized = value.trim().toUpperCase(Locale.ROOT);
        if ("WARN".equals(normalized)) {
            return WARNING;
        }
        try {
            return LogLevel.valueOf(normalized);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported log level: " + value);
        }
    }
}
