package work.lcod.forge.shared;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

/**
 * Small helper to parse user-friendly durations (e.g. {@code 30s}, {@code 2m}, {@code 5h}).
 */
public final class DurationParser {
    private DurationParser() {}

    public static Optional<Duration> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String trimmed = raw.trim().toLowerCase(Locale.ROOT);
        if ("0".equals(trimmed)) {
            return Optional.of(Duration.ZERO);
        }
        long multiplier = 1L;
        if (trimmed.endsWith("ms")) {
            trimmed = trimmed.substring(0, trimmed.length() - 2);
        } else if (trimmed.endsWith("s")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
            multiplier = 1_000L;
        } else if (trimmed.endsWith("m")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
            multiplier = 60_000L;
        } else if (trimmed.endsWith("h")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
            multiplier = 3_600_000L;
        }
        long value;
        try {
            value = Long.parseLong(trimmed.trim());
        } catch (NumberFormatException ex) {
            throw new ConfigurationException("Invalid duration: " + raw, ex);
        }
        if (value < 0) {
            throw new ConfigurationException("Duration must not be negative: " + raw);
        }
        return Optional.of(Duration.ofMillis(value * multiplier));
    }

    /**
     * Renders a duration the way the run report prints it ({@code 850ms}, {@code 1.2s}, {@code 3m04s}).
     */
    public static String format(Duration duration) {
        long millis = duration == null ? 0L : duration.toMillis();
        if (millis < 1_000L) {
            return millis + "ms";
        }
        if (millis < 60_000L) {
            return String.format(Locale.ROOT, "%.1fs", millis / 1000.0);
        }
        long seconds = millis / 1000L;
        return String.format(Locale.ROOT, "%dm%02ds", seconds / 60L, seconds % 60L);
    }
}
