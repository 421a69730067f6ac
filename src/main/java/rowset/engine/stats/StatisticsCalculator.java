package rowset.engine.stats;

import rowset.engine.aggregate.StatsAggregator;
import rowset.engine.exec.Row;
import rowset.engine.exec.RowSet;
import rowset.engine.numeric.NumericParser;

public final class StatisticsCalculator {
    private StatisticsCalculator() {}

    public static ColumnStatistics describe(RowSet rows, String column, NumericParser numbers) {
        StatsAggregator stats = collect(rows, column, numbers);
        int nulls = 0;
        int idx = rows.schema().require(column);
        for (Row r : rows) if (NumericParser.isBlank(r.get(idx))) nulls++;
        if (stats.isEmpty()) throw new IllegalStateException("Column '" + column + "' has no numeric values");
        return new ColumnStatistics(column, stats.count(), nulls, stats.mean(), stats.stddev(),
            stats.min(), stats.max(), stats.median(), stats.quantile(0.25), stats.quantile(0.75));
    }

    static StatsAggregator collect(RowSet rows, String column, NumericParser numbers) {
        int idx = rows.schema().require(column);
        StatsAggregator stats = new StatsAggregator();
        for (Row r : rows) numbers.tryParse(r.get(idx)).ifPresent(stats::add);
        return stats;
    }
}
