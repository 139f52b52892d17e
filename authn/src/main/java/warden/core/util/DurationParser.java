package warden.core.util;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.regex.Pattern;

/**
 * Parses duration strings written either as a sequence of decimal numbers with unit
 * suffixes ({@code 500ms}, {@code 1s}, {@code 1m30s}, {@code 1.5h}, {@code 250us}) or
 * as ISO-8601 ({@code PT0.5S}).
 *
 * <p>Supported units: ns, us (or µs), ms, s, m, h.
 */
public final class DurationParser {

    private static final Pattern SEGMENT = Pattern.compile("(\\d+(?:\\.\\d*)?|\\.\\d+)(ns|us|µs|μs|ms|s|m|h)");

    private DurationParser() {}

    /**
     * Parse a duration string.
     *
     * @param value the string to parse
     * @return the parsed duration
     * @throws IllegalArgumentException if the string is blank or not a valid duration
     */
    public static Duration parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Duration must not be empty");
        }
        final var trimmed = value.trim();
        if (trimmed.startsWith("P") || trimmed.startsWith("p") || trimmed.startsWith("-P")) {
            try {
                return Duration.parse(trimmed);
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("Invalid duration: " + value, e);
            }
        }

        var text = trimmed;
        var negative = false;
        if (text.startsWith("-") || text.startsWith("+")) {
            negative = text.startsWith("-");
            text = text.substring(1);
        }
        if ("0".equals(text)) {
            return Duration.ZERO;
        }

        final var matcher = SEGMENT.matcher(text);
        var position = 0;
        var nanos = BigDecimal.ZERO;
        while (position < text.length()) {
            if (!matcher.find(position) || matcher.start() != position) {
                throw new IllegalArgumentException("Invalid duration: " + value);
            }
            final var amount = new BigDecimal(matcher.group(1));
            nanos = nanos.add(amount.multiply(BigDecimal.valueOf(nanosPerUnit(matcher.group(2)))));
            position = matcher.end();
        }
        if (position == 0) {
            throw new IllegalArgumentException("Invalid duration: " + value);
        }

        final long totalNanos;
        try {
            totalNanos = nanos.setScale(0, RoundingMode.DOWN).longValueExact();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Duration out of range: " + value, e);
        }
        final var duration = Duration.ofNanos(totalNanos);
        return negative ? duration.negated() : duration;
    }

    private static long nanosPerUnit(String unit) {
        return switch (unit) {
            case "ns" -> 1L;
            case "us", "µs", "μs" -> 1_000L;
            case "ms" -> 1_000_000L;
            case "s" -> 1_000_000_000L;
            case "m" -> 60_000_000_000L;
            case "h" -> 3_600_000_000_000L;
            default -> throw new IllegalArgumentException("Unknown duration unit: " + unit);
        };
    }
}
