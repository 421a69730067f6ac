package rowset.engine.pipeline;

/**
 * Failure of a terminal pipeline operation. stageIndex is -1 for the source;
 * rowIndex is -1 and column null when not known.
 */
public class PipelineExecutionException extends RuntimeException {
    private final String operation;
    private final int stageIndex;
    private final int rowIndex;
    private final String column;

    public PipelineExecutionException(String operation, int stageIndex, int rowIndex, String column, Throwable cause) {
        super(buildMessage(operation, stageIndex, rowIndex, column, cause), cause);
        this.operation = operation;
        this.stageIndex = stageIndex;
        this.rowIndex = rowIndex;
        this.column = column;
    }

    public String operation() { return operation; }
    public int stageIndex() { return stageIndex; }
    public int rowIndex() { return rowIndex; }
    public String column() { return column; }

    private static String buildMessage(String operation, int stageIndex, int rowIndex, String column, Throwable cause) {
        StringBuilder sb = new StringBuilder(operation).append(" failed at ");
        sb.append(stageIndex < 0 ? "source" : "stage " + stageIndex);
        if (rowIndex >= 0) sb.append(", row ").append(rowIndex);
        if (column != null) sb.append(", column '").append(column).append('\'');
        if (cause != null && cause.getMessage() != null) sb.append(": ").append(cause.getMessage());
        return sb.toString();
    }
}
