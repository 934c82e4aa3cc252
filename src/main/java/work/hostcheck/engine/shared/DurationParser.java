package work.hostcheck.engine.shared;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

/**
 * Parses command timeouts written as {@code 500ms}, {@code 30s}, {@code 2m}, {@code 1h} or bare milliseconds.
 */
public final class DurationParser {
    private DurationParser() {}

    public static Optional<Duration> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String trimmed = raw.trim().toLowerCase(Locale.ROOT);
        long multiplier;
        String digits;
        if (trimmed.endsWith("ms")) {
            digits = trimmed.substring(0, trimmed.length() - 2);
            multiplier = 1L;
        } else if (trimmed.endsWith("s")) {
            digits = trimmed.substring(0, trimmed.length() - 1);
            multiplier = 1_000L;
        } else if (trimmed.endsWith("m")) {
            digits = trimmed.substring(0, trimmed.length() - 1);
            multiplier = 60_000L;
        } else if (trimmed.endsWith("h")) {
            digits = trimmed.substring(0, trimmed.length() - 1);
            multiplier = 3_600_000L;
        } else {
            digits = trimmed;
            multiplier = 1L;
        }
        long value;
        try {
            value = Long.parseLong(digits.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid duration: " + raw, ex);
        }
        if (value < 0) {
            throw new IllegalArgumentException("Duration must not be negative: " + raw);
        }
        try {
            return Optional.of(Duration.ofMillis(Math.multiplyExact(value, multiplier)));
        } catch (ArithmeticException ex) {
            throw new IllegalArgumentException("Invalid duration: " + raw, ex);
        }
    }
}
