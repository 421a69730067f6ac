package rowset.engine.exec;

import java.util.Set;

import rowset.engine.numeric.NumericParser;

/**
 * Exact string equality on one column. An optional trim applies to the cell only.
 */
public class EqualityPredicate implements Predicate {
    private final String column;
    private final String expected;
    private final boolean trim;

    public EqualityPredicate(String column, String expected) { this(column, expected, false); }

    public EqualityPredicate(String column, String expected, boolean trim) {
        if (column == null || column.isEmpty()) throw new IllegalArgumentException("column must not be empty");
        this.column = column;
        this.expected = expected == null ? "" : expected;
        this.trim = trim;
    }

    @Override
    public boolean test(Row row, NumericParser numbers) {
        String v = row.get(column);
        return expected.equals(trim ? v.trim() : v);
    }

    @Override
    public Set<String> columns() { return Set.of(column); }

    // For debugging
    @Override
    public String toString() { return column + " = '" + expected + "'"; }
}
