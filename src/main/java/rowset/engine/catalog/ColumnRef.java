package rowset.engine.catalog;

/**
 * Identifies a column either by name or by zero-based position.
 * Exactly one of name / index is set.
 */
public record ColumnRef(String name, Integer index) {

    public ColumnRef {
        if ((name == null) == (index == null)) {
            throw new IllegalArgumentException("ColumnRef needs exactly one of name or index");
        }
        if (index != null && index < 0) throw new IllegalArgumentException("Column index must be >= 0: " + index);
    }

    public static ColumnRef byName(String name) { return new ColumnRef(name, null); }
    public static ColumnRef byIndex(int index) { return new ColumnRef(null, index); }

    /** Integers are positions, anything else is a name. */
    public static ColumnRef parse(String text) {
        if (text == null || text.isBlank()) throw new IllegalArgumentException("Column identifier cannot be empty");
        String t = text.trim();
        try {
            return byIndex(Integer.parseInt(t));
        } catch (NumberFormatException notAnIndex) {
            return byName(t);
        }
    }

    public int resolve(Schema schema) {
        if (name != null) return schema.require(name);
        if (index >= schema.size()) {
            throw new SchemaException("Column index " + index + " is out of range. Column count: " + schema.size(), String.valueOf(index));
        }
        return index;
    }

    public String resolveName(Schema schema) { return schema.column(resolve(schema)); }

    @Override
    public String toString() { return name != null ? name : String.valueOf(index); }
}
