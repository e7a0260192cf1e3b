package work.labsim.simulator.runtime;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * How an engine generation words locations and delays in command text.
 */
public enum NamingStyle {
    CURRENT {
        @Override
        public String describe(Location location) {
            var labware = location.labware();
            return location.well() + " of " + labware.displayName() + " on " + labware.slot();
        }

        @Override
        String delayTemplate() {
            return "Delaying for {minutes}m {seconds}s";
        }

        @Override
        Map<String, Object> delayFields(Duration duration) {
            var fields = new LinkedHashMap<String, Object>();
            fields.put("minutes", duration.toMinutes());
            fields.put("seconds", (duration.toMillis() % 60_000L) / 1000.0);
            return fields;
        }
    },
    LEGACY {
        @Override
        public String describe(Location location) {
            return "well " + location.well() + " in \"" + location.labware().slot() + "\"";
        }

        @Override
        String delayTemplate() {
            return "Delaying for {duration}";
        }

        @Override
        Map<String, Object> delayFields(Duration duration) {
            var seconds = duration.getSeconds();
            var fields = new LinkedHashMap<String, Object>();
            fields.put("duration", String.format("%d:%02d:%02d", seconds / 3600, (seconds % 3600) / 60, seconds % 60));
            return fields;
        }
    };

    public abstract String describe(Location location);

    abstract String delayTemplate();

    abstract Map<String, Object> delayFields(Duration duration);

    CommandPayload delayPayload(Duration duration) {
        return CommandPayload.of("delay", delayTemplate(), delayFields(duration));
    }
}
