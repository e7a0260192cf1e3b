package work.labsim.simulator.format;

import java.util.ArrayList;
import java.util.List;
import work.labsim.simulator.trace.LogRecord;
import work.labsim.simulator.trace.RunLog;
import work.labsim.simulator.trace.Span;

/**
 * Renders a run log as text: one line per span, indented with one tab per nesting level,
 * followed by the log records attributed to that span.
 */
public final class RunLogFormatter {
    public static final String LOGS_HEADER = "Logs from this command:";

    private RunLogFormatter() {}

    public static String format(RunLog runLog) {
        return String.join("\n", lines(runLog));
    }

    public static List<String> lines(RunLog runLog) {
        var lines = new ArrayList<String>();
        for (Span span : runLog) {
            var indent = "\t".repeat(span.level());
            var template = span.payload().get("text");
            lines.add(indent + (template == null ? "" : TemplateRenderer.render(template.toString(), span.payload())));
            if (!span.logs().isEmpty()) {
                lines.add(indent + LOGS_HEADER);
                for (LogRecord record : span.logs()) {
                    lines.add(indent + record.severity() + " (" + record.moduleName() + "): " + record.formattedMessage());
                }
            }
        }
        return lines;
    }
}
