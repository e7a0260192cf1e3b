package work.labsim.simulator.trace;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Published once per command invocation boundary on {@link #TOPIC}.
 */
public record LifecycleEvent(Phase phase, String commandKind, Map<String, Object> payload) {
    public static final String TOPIC = "command";

    public LifecycleEvent {
        Objects.requireNonNull(phase, "phase");
        Objects.requireNonNull(commandKind, "commandKind");
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public static LifecycleEvent before(String commandKind, Map<String, Object> payload) {
        return new LifecycleEvent(Phase.BEFORE, commandKind, payload);
    }

    public static LifecycleEvent after(String commandKind, Map<String, Object> payload) {
        return new LifecycleEvent(Phase.AFTER, commandKind, payload);
    }
}
