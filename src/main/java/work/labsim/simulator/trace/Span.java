package work.labsim.simulator.trace;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One traced command: its nesting level, the payload it was announced with and the log
 * records drained into it.
 */
public final class Span {
    private final int level;
    private final Map<String, Object> payload;
    private final List<LogRecord> logs;
    private final boolean frozen;

    Span(int level, Map<String, Object> payload) {
        this(level, payload, new ArrayList<>(), false);
    }

    private Span(int level, Map<String, Object> payload, List<LogRecord> logs, boolean frozen) {
        if (level < 0) {
            throw new IllegalArgumentException("level must be >= 0");
        }
        this.level = level;
        this.payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        this.logs = logs;
        this.frozen = frozen;
    }

    public int level() {
        return level;
    }

    public Map<String, Object> payload() {
        return payload;
    }

    public List<LogRecord> logs() {
        return Collections.unmodifiableList(logs);
    }

    public String text() {
        var text = payload.get("text");
        return text == null ? "" : text.toString();
    }

    void appendLog(LogRecord record) {
        if (frozen) {
            throw new IllegalStateException("span is frozen");
        }
        logs.add(record);
    }

    Span freeze() {
        if (frozen) {
            return this;
        }
        return new Span(level, payload, List.copyOf(logs), true);
    }

    @Override
    public String toString() {
        return "Span{level=" + level + ", text=" + text() + ", logs=" + logs.size() + "}";
    }
}
