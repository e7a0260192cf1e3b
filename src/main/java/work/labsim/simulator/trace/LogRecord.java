package work.labsim.simulator.trace;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import org.slf4j.helpers.MessageFormatter;

/**
 * Unformatted diagnostic record captured during a run. {@code message} is the raw SLF4J pattern.
 */
public record LogRecord(Severity severity, String moduleName, String message, List<Object> args) {
    public LogRecord {
        Objects.requireNonNull(severity, "severity");
        moduleName = moduleName == null ? "" : moduleName;
        message = message == null ? "" : message;
        args = args == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(args));
    }

    /**
     * Applies the arguments to the pattern. Only called when rendering.
     */
    public String formattedMessage() {
        if (args.isEmpty()) {
            return message;
        }
        return MessageFormatter.arrayFormat(message, args.toArray()).getMessage();
    }
}
