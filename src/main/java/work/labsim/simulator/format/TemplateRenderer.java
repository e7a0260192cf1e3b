package work.labsim.simulator.format;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import work.labsim.simulator.error.RunLogFormatException;

/**
 * Flat named-placeholder substitution ({@code "Aspirating {volume} uL"}). Doubled braces give a
 * literal brace; a key missing from the value map is an error, never left in place.
 */
public final class TemplateRenderer {
    private TemplateRenderer() {}

    public static String render(String template, Map<String, ?> values) {
        var out = new StringBuilder(template.length() + 16);
        scan(template, out, key -> {
            if (!values.containsKey(key)) {
                throw new RunLogFormatException("Template references unknown key '" + key + "': " + template);
            }
            return String.valueOf(values.get(key));
        });
        return out.toString();
    }

    /**
     * Placeholder names in order of appearance.
     */
    public static List<String> placeholders(String template) {
        var keys = new ArrayList<String>();
        scan(template, new StringBuilder(), key -> {
            keys.add(key);
            return "";
        });
        return keys;
    }

    private static void scan(String template, StringBuilder out, KeyResolver resolver) {
        int i = 0;
        int length = template.length();
        while (i < length) {
            char c = template.charAt(i);
            if (c == '{') {
                if (i + 1 < length && template.charAt(i + 1) == '{') {
                    out.append('{');
                    i += 2;
                    continue;
                }
                int close = template.indexOf('}', i + 1);
                if (close < 0) {
                    throw new RunLogFormatException("Unterminated placeholder in template: " + template);
                }
                var key = template.substring(i + 1, close);
                if (key.isEmpty() || key.indexOf('{') >= 0) {
                    throw new RunLogFormatException("Invalid placeholder '{" + key + "}' in template: " + template);
                }
                out.append(resolver.resolve(key));
                i = close + 1;
            } else if (c == '}') {
                if (i + 1 < length && template.charAt(i + 1) == '}') {
                    out.append('}');
                    i += 2;
                    continue;
                }
                throw new RunLogFormatException("Single '}' in template: " + template);
            } else {
                out.append(c);
                i++;
            }
        }
    }

    @FunctionalInterface
    private interface KeyResolver {
        String resolve(String key);
    }
}
