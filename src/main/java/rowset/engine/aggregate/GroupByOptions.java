package rowset.engine.aggregate;

/**
 * keepKeys: emit the key columns in front of the aggregates.
 * dropEmptyKeys: skip rows whose key tuple contains an empty cell instead of grouping them.
 * separator: placed between source column and function label in generated names.
 */
public record GroupByOptions(boolean keepKeys, boolean dropEmptyKeys, String separator) {
    public static final GroupByOptions DEFAULT = new GroupByOptions(true, false, "_");

    public GroupByOptions {
        if (separator == null) separator = "_";
    }

    public GroupByOptions withKeepKeys(boolean value) { return new GroupByOptions(value, dropEmptyKeys, separator); }
    public GroupByOptions withDropEmptyKeys(boolean value) { return new GroupByOptions(keepKeys, value, separator); }
    public GroupByOptions withSeparator(String value) { return new GroupByOptions(keepKeys, dropEmptyKeys, value); }
}
