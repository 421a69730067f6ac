package rowset.engine.exec;

/**
 * Per-row failure raised in strict mode (ignoreErrors = false), e.g. a cell that cannot be read as a number.
 * rowIndex is -1 when the failing row is not known at the point of failure.
 */
public class RowProcessingException extends RuntimeException {
    private final int rowIndex;
    private final String column;

    public RowProcessingException(String message, int rowIndex, String column) {
        super(message);
        this.rowIndex = rowIndex;
        this.column = column;
    }

    public int rowIndex() { return rowIndex; }
    public String column() { return column; }

    public RowProcessingException atRow(int index) {
        RowProcessingException e = new RowProcessingException(getMessage(), index, column);
        e.setStackTrace(getStackTrace());
        return e;
    }
}
