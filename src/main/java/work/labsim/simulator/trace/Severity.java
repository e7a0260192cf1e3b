package work.labsim.simulator.trace;

import ch.qos.logback.classic.Level;

/**
 * Severity attached to captured log records. Names follow the run-log text format.
 */
public enum Severity {
    DEBUG,
    INFO,
    WARNING,
    ERROR;

    public static Severity fromLogback(Level level) {
        if (level == null) {
            return INFO;
        }
        if (level.isGreaterOrEqual(Level.ERROR)) {
            return ERROR;
        }
        if (level.isGreaterOrEqual(Level.WARN)) {
            return WARNING;
        }
        if (level.isGreaterOrEqual(Level.INFO)) {
            return INFO;
        }
        return DEBUG;
    }
}
