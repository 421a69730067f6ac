package rowset.engine.join;

import rowset.engine.catalog.ColumnRef;

/**
 * Equality condition between a left and a right column. Both sides may be named differently
 * (or addressed by position); outputName renames the merged key column in the result.
 */
public record JoinKey(ColumnRef left, ColumnRef right, String outputName) {

    public JoinKey {
        if (left == null || right == null) throw new IllegalArgumentException("Join key needs a left and a right column");
        if (outputName != null && outputName.isBlank()) outputName = null;
    }

    public static JoinKey on(String column) { return of(column, column); }

    public static JoinKey of(String leftColumn, String rightColumn) {
        return new JoinKey(ColumnRef.byName(leftColumn), ColumnRef.byName(rightColumn), null);
    }

    public static JoinKey of(String leftColumn, String rightColumn, String outputName) {
        return new JoinKey(ColumnRef.byName(leftColumn), ColumnRef.byName(rightColumn), outputName);
    }

    /**
     * "left:right" or "left:right:output"; integers address columns by position.
     */
    public static JoinKey parse(String mapping) {
        if (mapping == null) throw new IllegalArgumentException("Join mapping must not be null");
        String[] parts = mapping.split(":", -1);
        if (parts.length < 2 || parts.length > 3) {
            throw new IllegalArgumentException("Invalid join mapping format: '" + mapping
                + "'. Expected format: 'leftColumn:rightColumn' or 'leftColumn:rightColumn:outputName'");
        }
        return new JoinKey(ColumnRef.parse(parts[0]), ColumnRef.parse(parts[1]), parts.length == 3 ? parts[2].trim() : null);
    }

    @Override
    public String toString() { return left + ":" + right + (outputName != null ? ":" + outputName : ""); }
}
