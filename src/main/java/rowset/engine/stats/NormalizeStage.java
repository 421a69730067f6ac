package rowset.engine.stats;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import rowset.engine.aggregate.StatsAggregator;
import rowset.engine.catalog.Schema;
import rowset.engine.exec.ExecutionContext;
import rowset.engine.exec.Row;
import rowset.engine.exec.RowProcessingException;
import rowset.engine.exec.RowSet;
import rowset.engine.exec.Stage;
import rowset.engine.numeric.NumberFormatter;
import rowset.engine.numeric.NumericParser;

/**
 * Rescales numeric columns, each into a new column placed right after its source.
 * MIN_MAX maps onto [rangeMin, rangeMax]; Z_SCORE and ROBUST ignore the range.
 * A column without spread does not fail: MIN_MAX writes rangeMin, the others write 0.
 */
public class NormalizeStage implements Stage {
    private static final Logger log = LoggerFactory.getLogger(NormalizeStage.class);

    public static final String DEFAULT_SUFFIX = "_normalized";

    private final Map<String, String> outputs; // source column -> output column
    private final NormalizationMethod method;
    private final double rangeMin;
    private final double rangeMax;

    public NormalizeStage(String column, NormalizationMethod method) {
        this(column, method, null);
    }

    public NormalizeStage(String column, NormalizationMethod method, String outputColumn) {
        this(Map.of(requireColumn(column), outputColumn == null || outputColumn.isEmpty() ? column + DEFAULT_SUFFIX : outputColumn),
            method, 0.0, 1.0);
    }

    public NormalizeStage(List<String> columns, NormalizationMethod method) {
        this(columns, method, 0.0, 1.0);
    }

    public NormalizeStage(List<String> columns, NormalizationMethod method, double rangeMin, double rangeMax) {
        this(suffixed(columns), method, rangeMin, rangeMax);
    }

    private NormalizeStage(Map<String, String> outputs, NormalizationMethod method, double rangeMin, double rangeMax) {
        if (method == null) throw new IllegalArgumentException("method must not be null");
        if (!Double.isFinite(rangeMin) || !Double.isFinite(rangeMax)) throw new IllegalArgumentException("Target range must be finite");
        if (method == NormalizationMethod.MIN_MAX && rangeMin >= rangeMax) {
            throw new IllegalArgumentException("Range minimum must be less than range maximum for min-max normalization: [" + rangeMin + ", " + rangeMax + "]");
        }
        this.outputs = outputs;
        this.method = method;
        this.rangeMin = rangeMin;
        this.rangeMax = rangeMax;
    }

    private static String requireColumn(String column) {
        if (column == null || column.isEmpty()) throw new IllegalArgumentException("Column must be specified");
        return column;
    }

    private static Map<String, String> suffixed(List<String> columns) {
        if (columns == null || columns.isEmpty()) throw new IllegalArgumentException("At least one column must be specified for normalization");
        Map<String, String> out = new LinkedHashMap<>();
        for (String c : columns) {
            if (out.put(requireColumn(c), c + DEFAULT_SUFFIX) != null) throw new IllegalArgumentException("Column listed twice: " + c);
        }
        return out;
    }

    @Override
    public String name() { return "normalize"; }

    public List<String> columns() { return List.copyOf(outputs.keySet()); }

    @Override
    public Schema outputSchema(Schema input) {
        input.requireAll(outputs.keySet());
        List<String> cols = new ArrayList<>();
        for (String c : input.columns()) {
            cols.add(c);
            String out = outputs.get(c);
            if (out != null) cols.add(out);
        }
        return Schema.of(cols);
    }

    @Override
    public RowSet apply(RowSet input, ExecutionContext ctx) {
        Schema in = input.schema();
        Schema outSchema = outputSchema(in);

        // per input position: the scaling for normalized columns, null otherwise
        Scaling[] scalings = new Scaling[in.size()];
        for (String column : outputs.keySet()) {
            scalings[in.require(column)] = scalingFor(input, column, ctx);
        }

        RowSet.Builder out = RowSet.builder(outSchema);
        int replaced = 0;
        for (int i = 0; i < input.size(); i++) {
            Row r = input.row(i);
            List<String> cells = new ArrayList<>(outSchema.size());
            for (int c = 0; c < in.size(); c++) {
                String cell = r.get(c);
                cells.add(cell);
                Scaling s = scalings[c];
                if (s == null) continue;
                if (NumericParser.isBlank(cell)) {
                    cells.add("");
                    continue;
                }
                OptionalDouble v = ctx.numbers().tryParse(cell);
                if (v.isPresent()) {
                    cells.add(NumberFormatter.format(s.apply(v.getAsDouble())));
                } else if (ctx.ignoreErrors()) {
                    cells.add(ctx.defaultValue());
                    replaced++;
                } else {
                    throw new RowProcessingException("Cannot read '" + cell + "' as a number in column '" + in.column(c) + "'", i, in.column(c));
                }
            }
            out.add(cells);
        }
        if (replaced > 0) log.warn("normalize wrote the default value for {} unreadable cell(s) in {}", replaced, outputs.keySet());
        log.debug("normalize {} {} over {} row(s)", method, outputs.keySet(), input.size());
        return out.build();
    }

    private Scaling scalingFor(RowSet input, String column, ExecutionContext ctx) {
        StatsAggregator stats = StatisticsCalculator.collect(input, column, ctx.numbers());
        // nothing numeric: every non-blank cell goes through the unreadable-cell policy
        if (stats.isEmpty()) return new Scaling(0.0, 0.0, 0.0, 0.0);
        double center;
        double spread;
        switch (method) {
            case MIN_MAX -> {
                center = stats.min();
                spread = stats.max() - stats.min();
            }
            case Z_SCORE -> {
                center = stats.mean();
                spread = stats.stddev();
            }
            default -> {
                center = stats.median();
                spread = stats.quantile(0.75) - stats.quantile(0.25);
            }
        }
        boolean minMax = method == NormalizationMethod.MIN_MAX;
        double offset = minMax ? rangeMin : 0.0;
        if (spread == 0.0) {
            log.warn("normalize: column '{}' has no spread, writing {}", column, NumberFormatter.format(offset));
        }
        return new Scaling(center, spread, minMax ? rangeMax - rangeMin : 1.0, offset);
    }

    /** (v - center) / spread * width + offset; a zero spread maps every value to offset. */
    private record Scaling(double center, double spread, double width, double offset) {
        double apply(double v) {
            return spread == 0.0 ? offset : (v - center) / spread * width + offset;
        }
    }

    @Override
    public String toString() { return "NormalizeStage[" + method + " " + outputs.keySet() + "]"; }
}
