package work.labsim.simulator.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import work.labsim.simulator.format.TemplateRenderer;

/**
 * Payload announced with a command. Always carries {@code name} and {@code text}; every
 * placeholder in {@code text} must be a key of the same payload.
 */
public final class CommandPayload {
    public static final String NAME = "name";
    public static final String TEXT = "text";

    private final Map<String, Object> values;

    private CommandPayload(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static CommandPayload of(String name, String template, Map<String, ?> fields) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("command name is required");
        }
        Objects.requireNonNull(template, "template");
        var values = new LinkedHashMap<String, Object>();
        values.put(NAME, name);
        values.put(TEXT, template);
        if (fields != null) {
            fields.forEach((key, value) -> {
                if (NAME.equals(key) || TEXT.equals(key)) {
                    throw new IllegalArgumentException("'" + key + "' is reserved in command payloads");
                }
                values.put(key, value);
            });
        }
        for (var key : TemplateRenderer.placeholders(template)) {
            if (!values.containsKey(key)) {
                throw new IllegalArgumentException("Command " + name + " template references missing field '" + key + "'");
            }
        }
        return new CommandPayload(values);
    }

    public String name() {
        return (String) values.get(NAME);
    }

    public String template() {
        return (String) values.get(TEXT);
    }

    public Map<String, Object> asMap() {
        return values;
    }
}
