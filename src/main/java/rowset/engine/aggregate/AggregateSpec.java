package rowset.engine.aggregate;

// One aggregate to compute: source column, function and optional explicit output column name.
public record AggregateSpec(String column, AggregateFunction function, String outputName) {

    public AggregateSpec {
        if (column == null || column.isEmpty()) throw new IllegalArgumentException("Aggregate column must not be empty");
        if (function == null) throw new IllegalArgumentException("Aggregate function must not be null");
        if (outputName != null && outputName.isEmpty()) outputName = null;
    }

    public static AggregateSpec of(String column, AggregateFunction function) {
        return new AggregateSpec(column, function, null);
    }

    public static AggregateSpec of(String column, AggregateFunction function, String outputName) {
        return new AggregateSpec(column, function, outputName);
    }

    /** {column}{separator}{function} unless an explicit name was given. */
    public String outputColumn(String separator) {
        return outputName != null ? outputName : column + separator + function.label();
    }
}
