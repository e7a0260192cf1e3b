package work.labsim.simulator.shared;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Parses user-friendly durations: {@code 30s}, {@code 2m}, {@code 1h}, {@code 250ms}, compounds
 * such as {@code 1m30s}, or a bare number of seconds ({@code 4.5}).
 */
public final class DurationParser {
    private static final Pattern PART = Pattern.compile("(\\d+(?:\\.\\d+)?)(ms|h|m|s)");

    private DurationParser() {}

    public static Optional<Duration> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String trimmed = raw.trim().toLowerCase(Locale.ROOT).replace(" ", "");
        if (trimmed.matches("\\d+(\\.\\d+)?")) {
            return Optional.of(ofSeconds(Double.parseDouble(trimmed)));
        }
        var matcher = PART.matcher(trimmed);
        long millis = 0L;
        int consumed = 0;
        while (matcher.find()) {
            if (matcher.start() != consumed) {
                throw new IllegalArgumentException("Invalid duration: " + raw);
            }
            double value = Double.parseDouble(matcher.group(1));
            millis += Math.round(value * multiplier(matcher.group(2)));
            consumed = matcher.end();
        }
        if (consumed == 0 || consumed != trimmed.length()) {
            throw new IllegalArgumentException("Invalid duration: " + raw);
        }
        return Optional.of(Duration.ofMillis(millis));
    }

    public static Duration ofSeconds(double seconds) {
        if (seconds < 0) {
            throw new IllegalArgumentException("Duration must not be negative: " + seconds);
        }
        return Duration.ofMillis(Math.round(seconds * 1000.0));
    }

    private static long multiplier(String unit) {
        switch (unit) {
            case "ms":
                return 1L;
            case "s":
                return 1_000L;
            case "m":
                return 60_000L;
            default:
                return 3_600_000L;
        }
    }
}
