package rowset.engine.window;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import rowset.engine.aggregate.AggregateFunction;
import rowset.engine.aggregate.CellAggregator;
import rowset.engine.catalog.Schema;
import rowset.engine.exec.ExecutionContext;
import rowset.engine.exec.Row;
import rowset.engine.exec.RowSet;
import rowset.engine.exec.Stage;

/**
 * Trailing row-count window: row i gets the aggregate of rows max(0, i - size + 1) .. i,
 * written to {@code column + suffix}. Input columns and row count are kept.
 */
public class RollingStage implements Stage {
    private static final Logger log = LoggerFactory.getLogger(RollingStage.class);

    public static final String DEFAULT_SUFFIX = "_rolling";

    private final int size;
    private final List<String> targets;
    private final AggregateFunction function;
    private final String suffix;

    public RollingStage(int size, List<String> targets, AggregateFunction function) {
        this(size, targets, function, DEFAULT_SUFFIX);
    }

    public RollingStage(int size, List<String> targets, AggregateFunction function, String suffix) {
        if (size < 1) throw new IllegalArgumentException("Window size must be at least 1: " + size);
        if (targets == null || targets.isEmpty()) throw new IllegalArgumentException("At least one target column must be specified");
        if (function == null) throw new IllegalArgumentException("function must not be null");
        if (suffix == null || suffix.isEmpty()) throw new IllegalArgumentException("Output suffix must not be empty");
        this.size = size;
        this.targets = List.copyOf(targets);
        this.function = function;
        this.suffix = suffix;
    }

    @Override
    public String name() { return "rolling"; }

    @Override
    public Schema outputSchema(Schema input) {
        input.requireAll(targets);
        List<String> cols = new ArrayList<>(input.columns());
        for (String t : targets) cols.add(t + suffix);
        return Schema.of(cols);
    }

    @Override
    public RowSet apply(RowSet input, ExecutionContext ctx) {
        Schema outSchema = outputSchema(input.schema());
        int[] targetIdx = new int[targets.size()];
        for (int k = 0; k < targetIdx.length; k++) targetIdx[k] = input.schema().require(targets.get(k));

        RowSet.Builder out = RowSet.builder(outSchema);
        for (int i = 0; i < input.size(); i++) {
            Row r = input.row(i);
            List<String> cells = new ArrayList<>(r.values());
            int from = Math.max(0, i - size + 1);
            for (int k = 0; k < targetIdx.length; k++) {
                List<String> window = new ArrayList<>(i - from + 1);
                for (int j = from; j <= i; j++) window.add(input.row(j).get(targetIdx[k]));
                cells.add(CellAggregator.aggregate(function, window, targets.get(k), i, ctx));
            }
            out.add(cells);
        }
        log.debug("rolling {} {} over {} row(s) of {}", size, function.label(), input.size(), targets);
        return out.build();
    }

    @Override
    public String toString() { return "RollingStage[" + size + " " + function + targets + "]"; }
}
