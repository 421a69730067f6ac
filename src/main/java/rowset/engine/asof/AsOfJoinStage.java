package rowset.engine.asof;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import rowset.engine.catalog.Schema;
import rowset.engine.exec.ExecutionContext;
import rowset.engine.exec.Row;
import rowset.engine.exec.RowSet;
import rowset.engine.exec.Stage;
import rowset.engine.numeric.TimestampParser.Timestamp;

/**
 * Attaches to every left row the columns of one right row chosen by time proximity.
 * Left row order and count are preserved; a left row without a match gets empty right columns.
 */
public class AsOfJoinStage implements Stage {
    private static final Logger log = LoggerFactory.getLogger(AsOfJoinStage.class);

    private final RowSet right;
    private final AsOfOptions options;
    private final int rightTimeIdx;

    public AsOfJoinStage(RowSet right, AsOfOptions options) {
        if (right == null) throw new IllegalArgumentException("right side must not be null");
        if (options == null) throw new IllegalArgumentException("as-of options must not be null");
        this.right = right;
        this.options = options;
        this.rightTimeIdx = right.schema().require(options.rightOn());
    }

    @Override
    public String name() { return "mergeAsOf"; }

    @Override
    public Schema outputSchema(Schema input) {
        input.require(options.leftOn());
        List<String> cols = new ArrayList<>(input.columns());
        Set<String> used = new HashSet<>(cols);
        Schema rs = right.schema();
        for (int j = 0; j < rs.size(); j++) {
            if (j == rightTimeIdx) continue;
            String name = rs.column(j);
            if (used.contains(name)) {
                String base = name + options.suffix();
                name = base;
                int n = 2;
                while (used.contains(name)) name = base + "_" + n++;
            }
            cols.add(name);
            used.add(name);
        }
        return Schema.of(cols);
    }

    @Override
    public RowSet apply(RowSet left, ExecutionContext ctx) {
        Schema outSchema = outputSchema(left.schema());
        int leftTimeIdx = left.schema().require(options.leftOn());

        // right rows with a readable time, stable-sorted by it
        List<long[]> entries = new ArrayList<>(); // {epochMillis, rowIndex}
        int unreadableRight = 0;
        for (int j = 0; j < right.size(); j++) {
            Optional<Timestamp> t = ctx.timestamps().tryParse(right.row(j).get(rightTimeIdx));
            if (t.isPresent()) entries.add(new long[] {t.get().epochMillis(), j});
            else unreadableRight++;
        }
        entries.sort(Comparator.comparingLong(e -> e[0]));
        long[] times = new long[entries.size()];
        int[] rowIdx = new int[entries.size()];
        for (int k = 0; k < times.length; k++) {
            times[k] = entries.get(k)[0];
            rowIdx[k] = (int) entries.get(k)[1];
        }

        Long toleranceMillis = options.tolerance() == null ? null : options.tolerance().toMillis();
        int rightWidth = outSchema.size() - left.schema().size();
        RowSet.Builder out = RowSet.builder(outSchema);
        int matched = 0;
        int unreadableLeft = 0;
        for (Row l : left) {
            String[] cells = Arrays.copyOf(l.values().toArray(new String[0]), outSchema.size());
            Arrays.fill(cells, l.size(), cells.length, "");
            Optional<Timestamp> t = ctx.timestamps().tryParse(l.get(leftTimeIdx));
            if (t.isEmpty()) {
                unreadableLeft++;
                out.add(cells);
                continue;
            }
            int k = pick(times, t.get().epochMillis());
            if (k >= 0 && (toleranceMillis == null || Math.abs(times[k] - t.get().epochMillis()) <= toleranceMillis)) {
                Row r = right.row(rowIdx[k]);
                int c = l.size();
                for (int j = 0; j < r.size(); j++) {
                    if (j == rightTimeIdx) continue;
                    cells[c++] = r.get(j);
                }
                matched++;
            }
            out.add(cells);
        }
        if (unreadableRight > 0 || unreadableLeft > 0) {
            log.warn("mergeAsOf ignored {} right and {} left row(s) with unreadable times", unreadableRight, unreadableLeft);
        }
        log.debug("mergeAsOf {} on {}/{}: {} of {} left row(s) matched ({} right columns)",
            options.direction(), options.leftOn(), options.rightOn(), matched, left.size(), rightWidth);
        return out.build();
    }

    // index into the sorted times, or -1 when there is no candidate
    private int pick(long[] times, long t) {
        return switch (options.direction()) {
            case BACKWARD -> lastAtOrBefore(times, t);
            case FORWARD -> firstAtOrAfter(times, t);
            case NEAREST -> {
                int b = lastAtOrBefore(times, t);
                int f = firstAtOrAfter(times, t);
                if (b < 0) yield f;
                if (f < 0) yield b;
                yield (t - times[b]) <= (times[f] - t) ? b : f;
            }
        };
    }

    static int lastAtOrBefore(long[] times, long t) {
        int lo = 0, hi = times.length; // first index with time > t
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (times[mid] <= t) lo = mid + 1;
            else hi = mid;
        }
        return lo - 1;
    }

    static int firstAtOrAfter(long[] times, long t) {
        int lo = 0, hi = times.length; // first index with time >= t
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (times[mid] < t) lo = mid + 1;
            else hi = mid;
        }
        return lo < times.length ? lo : -1;
    }

    @Override
    public String toString() { return "AsOfJoinStage[" + options + "]"; }
}
