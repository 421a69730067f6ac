package rowset.engine.numeric;

import java.util.OptionalDouble;
import java.util.regex.Pattern;

/**
 * Parses text cells to doubles without throwing. Grouping separators are ignored,
 * NaN / Infinity (and anything overflowing to infinity) count as a failed parse.
 */
public final class NumericParser {
    private static final Pattern PLAIN_NUMBER = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");
    private static final NumericParser INVARIANT = new NumericParser(NumericCulture.INVARIANT);

    private final NumericCulture culture;

    public NumericParser(NumericCulture culture) {
        if (culture == null) throw new IllegalArgumentException("culture must not be null");
        this.culture = culture;
    }

    public static NumericParser invariant() { return INVARIANT; }

    public NumericCulture culture() { return culture; }

    public OptionalDouble tryParse(String cell) {
        if (cell == null) return OptionalDouble.empty();
        String s = cell.trim();
        if (s.isEmpty()) return OptionalDouble.empty();
        String normalized = normalize(s);
        if (!PLAIN_NUMBER.matcher(normalized).matches()) return OptionalDouble.empty();
        double v = Double.parseDouble(normalized);
        return Double.isFinite(v) ? OptionalDouble.of(v) : OptionalDouble.empty();
    }

    public boolean isNumeric(String cell) { return tryParse(cell).isPresent(); }

    /** Blank cells are missing values, not coercion failures. */
    public static boolean isBlank(String cell) { return cell == null || cell.isBlank(); }

    private String normalize(String s) {
        char grouping = culture.groupingSeparator();
        char decimal = culture.decimalSeparator();
        StringBuilder sb = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == grouping) continue;
            sb.append(c == decimal ? '.' : c);
        }
        return sb.toString();
    }
}
