package rowset.engine.window;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import rowset.engine.aggregate.AggregateFunction;
import rowset.engine.aggregate.CellAggregator;
import rowset.engine.catalog.Schema;
import rowset.engine.exec.ExecutionContext;
import rowset.engine.exec.RowProcessingException;
import rowset.engine.exec.RowSet;
import rowset.engine.exec.Stage;
import rowset.engine.numeric.NumberFormatter;
import rowset.engine.numeric.TimestampParser;
import rowset.engine.numeric.TimestampParser.Timestamp;

/**
 * Buckets rows into fixed, epoch-aligned time windows and aggregates the target columns per bucket.
 * Only non-empty buckets are emitted, oldest first.
 */
public class ResampleStage implements Stage {
    private static final Logger log = LoggerFactory.getLogger(ResampleStage.class);

    private final String timeColumn;
    private final List<String> targets;
    private final WindowSpec window;
    private final AggregateFunction function;

    public ResampleStage(String timeColumn, List<String> targets, WindowSpec window, AggregateFunction function) {
        if (timeColumn == null || timeColumn.isEmpty()) throw new IllegalArgumentException("Time column must be specified");
        if (targets == null || targets.isEmpty()) throw new IllegalArgumentException("At least one target column must be specified");
        if (window == null) throw new IllegalArgumentException("window must not be null");
        if (function == null) throw new IllegalArgumentException("function must not be null");
        this.timeColumn = timeColumn;
        this.targets = List.copyOf(targets);
        this.window = window;
        this.function = function;
    }

    @Override
    public String name() { return "resample"; }

    @Override
    public Schema outputSchema(Schema input) {
        input.require(timeColumn);
        input.requireAll(targets);
        List<String> cols = new ArrayList<>();
        cols.add(timeColumn);
        cols.addAll(targets);
        return Schema.of(cols);
    }

    @Override
    public RowSet apply(RowSet input, ExecutionContext ctx) {
        Schema outSchema = outputSchema(input.schema());
        int timeIdx = input.schema().require(timeColumn);
        int[] targetIdx = new int[targets.size()];
        for (int k = 0; k < targetIdx.length; k++) targetIdx[k] = input.schema().require(targets.get(k));

        long width = window.millis();
        TreeMap<Long, List<Integer>> buckets = new TreeMap<>();
        boolean allNumeric = true;
        int dropped = 0;
        for (int i = 0; i < input.size(); i++) {
            String cell = input.row(i).get(timeIdx);
            Optional<Timestamp> t = ctx.timestamps().tryParse(cell);
            if (t.isEmpty()) {
                if (!ctx.ignoreErrors()) throw new RowProcessingException("Cannot read '" + cell + "' as a time in column '" + timeColumn + "'", i, timeColumn);
                dropped++;
                continue;
            }
            allNumeric &= t.get().numeric();
            long start = Math.floorDiv(t.get().epochMillis(), width) * width;
            buckets.computeIfAbsent(start, x -> new ArrayList<>()).add(i);
        }

        RowSet.Builder out = RowSet.builder(outSchema);
        for (Map.Entry<Long, List<Integer>> b : buckets.entrySet()) {
            List<Integer> members = b.getValue();
            List<String> cells = new ArrayList<>(outSchema.size());
            long start = b.getKey();
            cells.add(allNumeric ? NumberFormatter.format(Math.floorDiv(start, 1000L)) : TimestampParser.formatMillis(start));
            for (int k = 0; k < targetIdx.length; k++) {
                List<String> values = new ArrayList<>(members.size());
                for (int idx : members) values.add(input.row(idx).get(targetIdx[k]));
                cells.add(CellAggregator.aggregate(function, values, targets.get(k), members.get(0), ctx));
            }
            out.add(cells);
        }
        if (dropped > 0) log.warn("resample dropped {} row(s) with unreadable times in '{}'", dropped, timeColumn);
        log.debug("resample {} {} of {}: {} row(s) -> {} bucket(s)", window, function.label(), targets, input.size(), buckets.size());
        return out.build();
    }

    @Override
    public String toString() { return "ResampleStage[" + timeColumn + " " + window + " " + function + targets + "]"; }
}
