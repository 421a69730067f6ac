package rowset.engine.stats;

/**
 * Descriptive statistics of one column. count is the number of numeric cells,
 * nullCount the number of blank ones; cells that are neither are not counted.
 */
public record ColumnStatistics(String column, int count, int nullCount, double mean, double std,
                               double min, double max, double median, double q1, double q3) {
    public double iqr() { return q3 - q1; }
    public double variance() { return std * std; }
}
