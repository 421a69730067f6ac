package rowset.engine.numeric;

import java.text.ParsePosition;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Reads time cells as epoch milliseconds. Local date-times are taken as UTC.
 * Plain numbers are epoch seconds, checked after the compact yyyyMMdd[HHmm[ss]] forms.
 */
public final class TimestampParser {
    public static final DateTimeFormatter OUTPUT_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    // compact forms carry their exact length: the year field would otherwise swallow extra digits
    private record Format(DateTimeFormatter formatter, boolean hasTime, int length) {
        Format(DateTimeFormatter formatter, boolean hasTime) { this(formatter, hasTime, -1); }
    }

    private static final List<Format> FORMATS = List.of(
        new Format(strict("uuuu-MM-dd HH:mm:ss"), true),
        new Format(strict("uuuu-MM-dd HH:mm"), true),
        new Format(strict("uuuu-MM-dd"), false),
        new Format(strict("uuuuMMddHHmmss"), true, 14),
        new Format(strict("uuuuMMddHHmm"), true, 12),
        new Format(strict("uuuuMMdd"), false, 8),
        new Format(strict("uuuu/MM/dd HH:mm:ss"), true),
        new Format(strict("uuuu/MM/dd HH:mm"), true),
        new Format(strict("uuuu/MM/dd"), false),
        new Format(strict("MM/dd/uuuu HH:mm:ss"), true),
        new Format(strict("MM/dd/uuuu HH:mm"), true),
        new Format(strict("MM/dd/uuuu"), false),
        new Format(DateTimeFormatter.ISO_LOCAL_DATE_TIME, true)
    );

    /** A parsed time cell; numeric marks cells that were read as epoch seconds. */
    public record Timestamp(long epochMillis, boolean numeric) {}

    private final NumericParser numbers;

    public TimestampParser(NumericParser numbers) {
        this.numbers = numbers;
    }

    public Optional<Timestamp> tryParse(String cell) {
        if (cell == null || cell.isBlank()) return Optional.empty();
        String s = cell.trim();
        for (Format f : FORMATS) {
            Optional<LocalDateTime> ldt = tryFormat(f, s);
            if (ldt.isPresent()) return Optional.of(new Timestamp(ldt.get().toInstant(ZoneOffset.UTC).toEpochMilli(), false));
        }
        Optional<Instant> withOffset = tryOffset(s);
        if (withOffset.isPresent()) return Optional.of(new Timestamp(withOffset.get().toEpochMilli(), false));
        OptionalDouble seconds = numbers.tryParse(s);
        if (seconds.isPresent()) return Optional.of(new Timestamp(Math.round(seconds.getAsDouble() * 1000.0), true));
        return Optional.empty();
    }

    // STRICT rejects Feb 30 instead of clamping it; patterns with seconds accept an optional fraction
    private static DateTimeFormatter strict(String pattern) {
        DateTimeFormatterBuilder b = new DateTimeFormatterBuilder().appendPattern(pattern);
        if (pattern.endsWith("HH:mm:ss")) b.optionalStart().appendFraction(ChronoField.NANO_OF_SECOND, 1, 9, true).optionalEnd();
        return b.toFormatter().withResolverStyle(ResolverStyle.STRICT);
    }

    public static String formatMillis(long epochMillis) {
        return OUTPUT_FORMAT.format(LocalDateTime.ofEpochSecond(Math.floorDiv(epochMillis, 1000L),
            (int) Math.floorMod(epochMillis, 1000L) * 1_000_000, ZoneOffset.UTC));
    }

    private static Optional<LocalDateTime> tryFormat(Format f, String s) {
        if (f.length() >= 0 && s.length() != f.length()) return Optional.empty();
        ParsePosition pos = new ParsePosition(0);
        if (f.formatter().parseUnresolved(s, pos) == null || pos.getIndex() != s.length()) return Optional.empty();
        try {
            TemporalAccessor t = f.formatter().parse(s);
            return Optional.of(f.hasTime() ? LocalDateTime.from(t) : LocalDate.from(t).atStartOfDay());
        } catch (DateTimeParseException outOfRange) {
            // shape matched but a field is invalid (month 13, Feb 30)
            return Optional.empty();
        }
    }

    private static Optional<Instant> tryOffset(String s) {
        ParsePosition pos = new ParsePosition(0);
        if (DateTimeFormatter.ISO_OFFSET_DATE_TIME.parseUnresolved(s, pos) == null || pos.getIndex() != s.length()) return Optional.empty();
        try {
            return Optional.of(OffsetDateTime.parse(s, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant());
        } catch (DateTimeParseException outOfRange) {
            return Optional.empty();
        }
    }
}
