package io.dapprunner.shared;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

/**
 * Parses user-friendly durations ({@code 90}, {@code 90s}, {@code 5m}, {@code 2h}, {@code 500ms}).
 * Bare numbers are seconds.
 */
public final class DurationParser {
    private DurationParser() {}

    public static Optional<Duration> parse(Object raw) {
        if (raw == null) {
            return Optional.empty();
        }
        if (raw instanceof Number number) {
            return Optional.of(ofSeconds(number.doubleValue(), raw));
        }
        return parse(String.valueOf(raw));
    }

    public static Optional<Duration> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String trimmed = raw.trim().toLowerCase(Locale.ROOT);
        double multiplier = 1d;
        if (trimmed.endsWith("ms")) {
            trimmed = trimmed.substring(0, trimmed.length() - 2);
            multiplier = 0.001d;
        } else if (trimmed.endsWith("s")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        } else if (trimmed.endsWith("m")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
            multiplier = 60d;
        } else if (trimmed.endsWith("h")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
            multiplier = 3_600d;
        }
        try {
            return Optional.of(ofSeconds(Double.parseDouble(trimmed.trim()) * multiplier, raw));
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid duration: " + raw, ex);
        }
    }

    private static Duration ofSeconds(double seconds, Object raw) {
        if (seconds < 0 || Double.isNaN(seconds) || Double.isInfinite(seconds)) {
            throw new IllegalArgumentException("Invalid duration: " + raw);
        }
        return Duration.ofMillis(Math.round(seconds * 1_000d));
    }
}
