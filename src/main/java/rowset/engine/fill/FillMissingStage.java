package rowset.engine.fill;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import rowset.engine.aggregate.StatsAggregator;
import rowset.engine.catalog.Schema;
import rowset.engine.exec.ExecutionContext;
import rowset.engine.exec.Row;
import rowset.engine.exec.RowSet;
import rowset.engine.exec.Stage;
import rowset.engine.numeric.NumberFormatter;
import rowset.engine.numeric.NumericParser;

/**
 * Replaces blank cells of the given columns in place. Schema and row count are unchanged.
 * When a column offers nothing to fill from (no numeric cell for MEAN / MEDIAN, no
 * non-blank cell for MODE, no neighbour for FORWARD / BACKWARD) its blanks stay blank.
 */
public class FillMissingStage implements Stage {
    private static final Logger log = LoggerFactory.getLogger(FillMissingStage.class);

    private final List<String> columns;
    private final FillMethod method;
    private final String constant;

    public FillMissingStage(List<String> columns, FillMethod method) {
        this(columns, method, null);
    }

    public FillMissingStage(List<String> columns, FillMethod method, String constant) {
        if (columns == null || columns.isEmpty()) throw new IllegalArgumentException("At least one column must be specified");
        if (method == null) throw new IllegalArgumentException("method must not be null");
        if (method == FillMethod.CONSTANT && constant == null) throw new IllegalArgumentException("CONSTANT fill needs a value");
        this.columns = List.copyOf(columns);
        this.method = method;
        this.constant = constant;
    }

    @Override
    public String name() { return "fillMissing"; }

    @Override
    public Schema outputSchema(Schema input) {
        input.requireAll(columns);
        return input;
    }

    @Override
    public RowSet apply(RowSet input, ExecutionContext ctx) {
        Schema schema = outputSchema(input.schema());
        String[][] cells = new String[input.size()][];
        for (int i = 0; i < cells.length; i++) cells[i] = input.row(i).values().toArray(new String[0]);

        int filled = 0;
        for (String column : columns) {
            int c = schema.require(column);
            filled += switch (method) {
                case FORWARD -> fillForward(cells, c);
                case BACKWARD -> fillBackward(cells, c);
                default -> fillWith(cells, c, fillValue(input, c, ctx));
            };
        }

        RowSet.Builder out = RowSet.builder(schema);
        for (String[] row : cells) out.add(row);
        log.debug("fillMissing {} {} filled {} cell(s)", method, columns, filled);
        return out.build();
    }

    // null when the column has nothing to fill from
    private String fillValue(RowSet input, int c, ExecutionContext ctx) {
        switch (method) {
            case CONSTANT:
                return constant;
            case MODE:
                return mode(input, c);
            default:
                break;
        }
        StatsAggregator stats = new StatsAggregator();
        for (Row r : input) ctx.numbers().tryParse(r.get(c)).ifPresent(stats::add);
        if (stats.isEmpty()) return null;
        return NumberFormatter.format(method == FillMethod.MEAN ? stats.mean() : stats.median());
    }

    private static String mode(RowSet input, int c) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (Row r : input) {
            String v = r.get(c);
            if (!NumericParser.isBlank(v)) counts.merge(v, 1, Integer::sum);
        }
        String best = null;
        int bestCount = 0;
        for (Map.Entry<String, Integer> e : counts.entrySet()) {
            if (e.getValue() > bestCount) {
                best = e.getKey();
                bestCount = e.getValue();
            }
        }
        return best;
    }

    private static int fillWith(String[][] cells, int c, String value) {
        if (value == null) return 0;
        int n = 0;
        for (String[] row : cells) {
            if (NumericParser.isBlank(row[c])) {
                row[c] = value;
                n++;
            }
        }
        return n;
    }

    private static int fillForward(String[][] cells, int c) {
        int n = 0;
        String last = null;
        for (String[] row : cells) {
            if (!NumericParser.isBlank(row[c])) last = row[c];
            else if (last != null) {
                row[c] = last;
                n++;
            }
        }
        return n;
    }

    private static int fillBackward(String[][] cells, int c) {
        int n = 0;
        String next = null;
        for (int i = cells.length - 1; i >= 0; i--) {
            if (!NumericParser.isBlank(cells[i][c])) next = cells[i][c];
            else if (next != null) {
                cells[i][c] = next;
                n++;
            }
        }
        return n;
    }

    @Override
    public String toString() { return "FillMissingStage[" + method + " " + columns + "]"; }
}
