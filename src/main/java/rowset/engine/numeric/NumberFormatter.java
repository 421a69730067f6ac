package rowset.engine.numeric;

import java.math.BigDecimal;

/**
 * Writes computed doubles back into cells: shortest plain decimal, no exponent, no trailing zeros.
 */
public final class NumberFormatter {
    private NumberFormatter() {}

    public static String format(double value) {
        if (!Double.isFinite(value)) throw new IllegalArgumentException("Cannot write non-finite value: " + value);
        if (value == 0.0) return "0"; // also folds -0.0
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    public static String format(long value) { return Long.toString(value); }
}
