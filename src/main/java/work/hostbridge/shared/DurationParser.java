package work.hostbridge.shared;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses user-friendly durations ({@code 10ms}, {@code 30s}, {@code 2m}, {@code 1h}; a bare number is milliseconds).
 */
public final class DurationParser {
    private static final Pattern FORMAT = Pattern.compile("(\\d+)\\s*(ms|s|m|h)?");

    private DurationParser() {}

    /**
     * @return empty for {@code null} or blank input
     * @throws IllegalArgumentException when the text is not a duration
     */
    public static Optional<Duration> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        Matcher matcher = FORMAT.matcher(raw.trim().toLowerCase(Locale.ROOT));
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Invalid duration '" + raw + "' (expected e.g. 250ms, 30s, 2m, 1h)");
        }
        long value;
        try {
            value = Long.parseLong(matcher.group(1));
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Duration out of range: '" + raw + "'", ex);
        }
        String unit = matcher.group(2) == null ? "ms" : matcher.group(2);
        try {
            return Optional.of(toDuration(value, unit));
        } catch (ArithmeticException ex) {
            throw new IllegalArgumentException("Duration out of range: '" + raw + "'", ex);
        }
    }

    private static Duration toDuration(long value, String unit) {
        switch (unit) {
            case "s":
                return Duration.ofSeconds(value);
            case "m":
                return Duration.ofMinutes(value);
            case "h":
                return Duration.ofHours(value);
            default:
                return Duration.ofMillis(value);
        }
    }
}
