package rowset.engine.aggregate;

import java.util.List;

import rowset.engine.exec.ExecutionContext;
import rowset.engine.exec.RowProcessingException;
import rowset.engine.numeric.NumberFormatter;

/**
 * Reduces the cells of one group or window to a single output cell.
 * Numeric functions skip cells that do not parse. COUNT counts every cell, FIRST / LAST return them verbatim.
 */
public final class CellAggregator {
    private CellAggregator() {}

    /**
     * @param column   source column, for error reporting
     * @param firstRow input index of the group's first row, for error reporting
     */
    public static String aggregate(AggregateFunction function, List<String> cells, String column, int firstRow, ExecutionContext ctx) {
        switch (function) {
            case COUNT:
                return NumberFormatter.format(cells.size());
            case FIRST:
                return cells.isEmpty() ? "" : cells.get(0);
            case LAST:
                return cells.isEmpty() ? "" : cells.get(cells.size() - 1);
            default:
                break;
        }
        StatsAggregator stats = new StatsAggregator();
        for (String cell : cells) ctx.numbers().tryParse(cell).ifPresent(stats::add);
        if (stats.isEmpty()) return emptyResult(function, column, firstRow, ctx);
        double v = switch (function) {
            case MEAN -> stats.mean();
            case SUM -> stats.sum();
            case MIN -> stats.min();
            case MAX -> stats.max();
            case STD -> stats.stddev();
            case VAR -> stats.variance();
            case MEDIAN -> stats.median();
            default -> throw new IllegalStateException("Unhandled aggregate function: " + function);
        };
        return NumberFormatter.format(v);
    }

    private static String emptyResult(AggregateFunction function, String column, int firstRow, ExecutionContext ctx) {
        if (function == AggregateFunction.SUM) return "0";
        if (ctx.ignoreErrors()) return ctx.defaultValue();
        throw new RowProcessingException("No numeric values to compute " + function.label() + " of column '" + column + "'", firstRow, column);
    }
}
