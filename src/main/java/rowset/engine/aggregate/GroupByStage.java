package rowset.engine.aggregate;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import rowset.engine.catalog.Schema;
import rowset.engine.exec.ExecutionContext;
import rowset.engine.exec.Row;
import rowset.engine.exec.RowSet;
import rowset.engine.exec.Stage;

/**
 * Groups rows by the values of the key columns and computes aggregates per group.
 * Groups come out in first-seen order. No key columns means one group holding every row.
 */
public class GroupByStage implements Stage {
    private static final Logger log = LoggerFactory.getLogger(GroupByStage.class);

    private final List<String> keys;
    private final List<AggregateSpec> aggregates;
    private final GroupByOptions options;

    public GroupByStage(List<String> keys, List<AggregateSpec> aggregates) {
        this(keys, aggregates, GroupByOptions.DEFAULT);
    }

    public GroupByStage(List<String> keys, List<AggregateSpec> aggregates, GroupByOptions options) {
        if (aggregates == null || aggregates.isEmpty()) throw new IllegalArgumentException("At least one aggregation must be specified");
        for (String k : keys) {
            if (k == null || k.isEmpty()) throw new IllegalArgumentException("Group key column must not be empty");
        }
        this.keys = List.copyOf(keys);
        this.aggregates = List.copyOf(aggregates);
        this.options = options;
    }

    @Override
    public String name() { return "groupBy"; }

    public List<String> keys() { return keys; }
    public List<AggregateSpec> aggregates() { return aggregates; }

    @Override
    public Schema outputSchema(Schema input) {
        input.requireAll(keys);
        List<String> cols = new ArrayList<>();
        if (options.keepKeys()) cols.addAll(keys);
        for (AggregateSpec a : aggregates) {
            input.require(a.column());
            cols.add(a.outputColumn(options.separator()));
        }
        return Schema.of(cols); // rejects duplicate output names
    }

    @Override
    public RowSet apply(RowSet input, ExecutionContext ctx) {
        Schema in = input.schema();
        Schema outSchema = outputSchema(in);
        int[] keyIdx = new int[keys.size()];
        for (int i = 0; i < keyIdx.length; i++) keyIdx[i] = in.require(keys.get(i));

        // key tuple -> member row indices, in first-seen order
        Map<List<String>, List<Integer>> groups = new LinkedHashMap<>();
        int skipped = 0;
        for (int i = 0; i < input.size(); i++) {
            Row r = input.row(i);
            String[] key = new String[keyIdx.length];
            boolean emptyKey = false;
            for (int k = 0; k < keyIdx.length; k++) {
                key[k] = r.get(keyIdx[k]);
                if (key[k].isEmpty()) emptyKey = true;
            }
            if (emptyKey && options.dropEmptyKeys()) {
                skipped++;
                continue;
            }
            groups.computeIfAbsent(Arrays.asList(key), x -> new ArrayList<>()).add(i);
        }

        RowSet.Builder out = RowSet.builder(outSchema);
        for (Map.Entry<List<String>, List<Integer>> g : groups.entrySet()) {
            List<Integer> members = g.getValue();
            List<String> cells = new ArrayList<>(outSchema.size());
            if (options.keepKeys()) cells.addAll(g.getKey());
            for (AggregateSpec a : aggregates) {
                int col = in.require(a.column());
                List<String> values = new ArrayList<>(members.size());
                for (int idx : members) values.add(input.row(idx).get(col));
                cells.add(CellAggregator.aggregate(a.function(), values, a.column(), members.get(0), ctx));
            }
            out.add(cells);
        }
        if (skipped > 0) log.debug("groupBy skipped {} row(s) with empty keys", skipped);
        log.debug("groupBy {} -> {} group(s) from {} row(s)", keys, groups.size(), input.size());
        return out.build();
    }

    @Override
    public String toString() { return "GroupByStage" + keys + aggregates; }
}
