package rowset.engine.catalog;

/**
 * Raised when a referenced column does not exist or a schema would contain duplicate names.
 * Always fatal: it signals a configuration mistake, not bad data.
 */
public class SchemaException extends IllegalArgumentException {
    private final String column;

    public SchemaException(String message, String column) {
        super(message);
        this.column = column;
    }

    public static SchemaException unknownColumn(String column, Schema schema) {
        return new SchemaException("Column '" + column + "' not found. Available columns: " + String.join(", ", schema.columns()), column);
    }

    public String column() { return column; }
}
