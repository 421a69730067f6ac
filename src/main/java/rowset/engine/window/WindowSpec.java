package rowset.engine.window;

import java.time.Duration;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fixed time window written as amount and unit: {@code 5T} (minutes), {@code 1H} (hours), {@code 2D} (days).
 */
public record WindowSpec(long amount, char unit) {
    private static final Pattern FORMAT = Pattern.compile("^(\\d+)([THD])$");

    public WindowSpec {
        if (amount <= 0) throw new IllegalArgumentException("Window size must be positive: " + amount);
        if (unit != 'T' && unit != 'H' && unit != 'D') throw new IllegalArgumentException("Unknown window unit '" + unit + "', expected T, H or D");
        // the window must fit in epoch millis, buckets are computed in them
        try {
            toDuration(amount, unit).toMillis();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Window too large: " + amount + unit, e);
        }
    }

    public static WindowSpec parse(String text) {
        if (text == null) throw new IllegalArgumentException("window must not be null");
        Matcher m = FORMAT.matcher(text.trim());
        if (!m.matches()) throw new IllegalArgumentException("Invalid window '" + text + "'. Use formats like 5T (minutes), 1H (hours), 1D (days)");
        long amount;
        try {
            amount = Long.parseLong(m.group(1));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Window size too large: " + text, e);
        }
        return new WindowSpec(amount, m.group(2).charAt(0));
    }

    public static WindowSpec minutes(long n) { return new WindowSpec(n, 'T'); }
    public static WindowSpec hours(long n) { return new WindowSpec(n, 'H'); }
    public static WindowSpec days(long n) { return new WindowSpec(n, 'D'); }

    public Duration duration() { return toDuration(amount, unit); }

    private static Duration toDuration(long amount, char unit) {
        return switch (unit) {
            case 'T' -> Duration.ofMinutes(amount);
            case 'H' -> Duration.ofHours(amount);
            default -> Duration.ofDays(amount);
        };
    }

    public long millis() { return duration().toMillis(); }

    @Override
    public String toString() { return amount + String.valueOf(unit); }
}
