package rowset.engine.numeric;

/**
 * Decimal and thousands separators used when reading numbers out of text cells.
 */
public record NumericCulture(char decimalSeparator, char groupingSeparator) {
    public static final NumericCulture INVARIANT = new NumericCulture('.', ',');
    public static final NumericCulture EUROPEAN = new NumericCulture(',', '.');

    public NumericCulture {
        if (decimalSeparator == groupingSeparator) {
            throw new IllegalArgumentException("Decimal and grouping separators must differ: '" + decimalSeparator + "'");
        }
        if (Character.isDigit(decimalSeparator) || Character.isDigit(groupingSeparator)) {
            throw new IllegalArgumentException("Separators cannot be digits");
        }
    }
}
