package rowset.engine.exec;

import java.util.OptionalDouble;
import java.util.Set;

import rowset.engine.numeric.NumericParser;

/**
 * Numeric comparison of one column against a constant.
 * Supports operators: EQ, LT, LTE, GT, GTE.
 * Blank cells never match; a non-blank cell that is not a number raises RowProcessingException.
 */
public class ComparisonPredicate implements Predicate {
    public enum Op { EQ, LT, LTE, GT, GTE }

    private final String column;
    private final Op op;
    private final double value;

    public ComparisonPredicate(String column, Op op, double value) {
        if (column == null || column.isEmpty()) throw new IllegalArgumentException("column must not be empty");
        if (!Double.isFinite(value)) throw new IllegalArgumentException("comparison value must be finite");
        this.column = column;
        this.op = op;
        this.value = value;
    }

    @Override
    public boolean test(Row row, NumericParser numbers) {
        String cell = row.get(column);
        if (NumericParser.isBlank(cell)) return false;
        OptionalDouble parsed = numbers.tryParse(cell);
        if (parsed.isEmpty()) {
            throw new RowProcessingException("Value '" + cell + "' in column '" + column + "' is not numeric", -1, column);
        }
        double v = parsed.getAsDouble();
        return switch (op) {
            case EQ -> v == value;
            case LT -> v < value;
            case LTE -> v <= value;
            case GT -> v > value;
            case GTE -> v >= value;
        };
    }

    @Override
    public Set<String> columns() { return Set.of(column); }

    @Override
    public String toString() { return column + " " + op + " " + value; }
}
