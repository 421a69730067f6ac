package rowset.engine.aggregate;

import java.util.Locale;

/**
 * Aggregate functions shared by group-by, resample and rolling windows.
 */
public enum AggregateFunction {
    MEAN(true),
    SUM(true),
    MIN(true),
    MAX(true),
    COUNT(false),
    STD(true),
    VAR(true),
    MEDIAN(true),
    FIRST(false),
    LAST(false);

    private final boolean numeric;

    AggregateFunction(boolean numeric) { this.numeric = numeric; }

    /** True when cells are parsed as numbers; COUNT / FIRST / LAST work on raw cells. */
    public boolean isNumeric() { return numeric; }

    /** Lower-case name used in generated column names, e.g. price_mean. */
    public String label() { return name().toLowerCase(Locale.ROOT); }

    public static AggregateFunction parse(String text) {
        if (text == null || text.isBlank()) throw new IllegalArgumentException("Aggregate function must not be empty");
        String t = text.trim().toUpperCase(Locale.ROOT);
        return switch (t) {
            case "AVG", "AVERAGE" -> MEAN;
            case "STDDEV" -> STD;
            case "VARIANCE" -> VAR;
            default -> {
                for (AggregateFunction f : values()) if (f.name().equals(t)) yield f;
                throw new IllegalArgumentException("Unknown aggregate function: " + text);
            }
        };
    }
}
