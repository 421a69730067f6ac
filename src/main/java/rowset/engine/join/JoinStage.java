package rowset.engine.join;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import rowset.engine.catalog.Schema;
import rowset.engine.catalog.SchemaException;
import rowset.engine.exec.ExecutionContext;
import rowset.engine.exec.Row;
import rowset.engine.exec.RowSet;
import rowset.engine.exec.Stage;

/**
 * Hash equality join of the pipeline rows (left) with a fixed right RowSet.
 * One side is materialized into a hash index keyed by the tuple of key cells and the other side looks rows up in it.
 * A key tuple with an empty cell never matches anything.
 */
public class JoinStage implements Stage {
    private static final Logger log = LoggerFactory.getLogger(JoinStage.class);

    private final RowSet right;
    private final List<JoinKey> keys;
    private final JoinOptions options;
    private final int[] rightKeyIdx;

    public JoinStage(RowSet right, List<JoinKey> keys, JoinOptions options) {
        if (right == null) throw new IllegalArgumentException("right side must not be null");
        if (keys == null || keys.isEmpty()) throw new IllegalArgumentException("At least one join key must be specified");
        this.right = right;
        this.keys = List.copyOf(keys);
        this.options = options == null ? JoinOptions.of(JoinType.INNER) : options;
        // right schema is known now, so right-side key errors surface at construction
        this.rightKeyIdx = new int[keys.size()];
        for (int k = 0; k < rightKeyIdx.length; k++) rightKeyIdx[k] = keys.get(k).right().resolve(right.schema());
    }

    @Override
    public String name() { return "join"; }

    public JoinType type() { return options.type(); }

    @Override
    public Schema outputSchema(Schema input) {
        return layout(input).schema;
    }

    @Override
    public RowSet apply(RowSet left, ExecutionContext ctx) {
        Layout layout = layout(left.schema());
        int[] leftKeyIdx = layout.leftKeyIdx;
        RowSet.Builder out = RowSet.builder(layout.schema);
        int unmatched = 0;

        if (options.type() == JoinType.RIGHT) {
            Map<List<String>, List<Integer>> leftIndex = index(left, leftKeyIdx);
            for (Row r : right) {
                List<String> key = keyOf(r, rightKeyIdx);
                List<Integer> matches = key == null ? null : leftIndex.get(key);
                if (matches == null) {
                    out.add(layout.combine(null, r));
                    unmatched++;
                    continue;
                }
                for (int i : matches) out.add(layout.combine(left.row(i), r));
            }
        } else {
            Map<List<String>, List<Integer>> rightIndex = index(right, rightKeyIdx);
            boolean[] rightMatched = new boolean[right.size()];
            for (Row l : left) {
                List<String> key = keyOf(l, leftKeyIdx);
                List<Integer> matches = key == null ? null : rightIndex.get(key);
                if (matches == null) {
                    if (options.type() != JoinType.INNER) {
                        out.add(layout.combine(l, null));
                        unmatched++;
                    }
                    continue;
                }
                for (int j : matches) {
                    out.add(layout.combine(l, right.row(j)));
                    rightMatched[j] = true;
                }
            }
            if (options.type() == JoinType.OUTER) {
                for (int j = 0; j < rightMatched.length; j++) {
                    if (rightMatched[j]) continue;
                    out.add(layout.combine(null, right.row(j)));
                    unmatched++;
                }
            }
        }
        log.debug("{} join {} x {} -> {} row(s), {} unmatched", options.type(), left.size(), right.size(), out.size(), unmatched);
        return out.build();
    }

    private Map<List<String>, List<Integer>> index(RowSet rows, int[] keyIdx) {
        Map<List<String>, List<Integer>> index = new HashMap<>();
        for (int i = 0; i < rows.size(); i++) {
            List<String> key = keyOf(rows.row(i), keyIdx);
            if (key != null) index.computeIfAbsent(key, k -> new ArrayList<>()).add(i);
        }
        return index;
    }

    // null when any key cell is empty: such rows never match
    private List<String> keyOf(Row row, int[] keyIdx) {
        String[] key = new String[keyIdx.length];
        for (int k = 0; k < keyIdx.length; k++) {
            String v = row.get(keyIdx[k]);
            if (options.trimKeys()) v = v.trim();
            if (v.isEmpty()) return null;
            key[k] = v;
        }
        return Arrays.asList(key);
    }

    private Layout layout(Schema leftSchema) {
        int[] leftKeyIdx = new int[keys.size()];
        for (int k = 0; k < leftKeyIdx.length; k++) leftKeyIdx[k] = keys.get(k).left().resolve(leftSchema);

        Schema rightSchema = right.schema();
        List<String> names = new ArrayList<>();
        List<String> sourceNames = new ArrayList<>();
        List<int[]> sources = new ArrayList<>(); // {side, index}: side 0 = left, 1 = right, 2 = key k
        Set<String> used = new HashSet<>();

        for (int i = 0; i < leftSchema.size(); i++) {
            int k = indexOf(leftKeyIdx, i);
            String name;
            if (k >= 0) {
                String out = keys.get(k).outputName();
                name = out != null ? out : options.leftPrefix() + leftSchema.column(i);
                sources.add(new int[] {2, k});
            } else {
                name = options.leftPrefix() + leftSchema.column(i);
                sources.add(new int[] {0, i});
            }
            names.add(name);
            sourceNames.add(leftSchema.column(i));
            used.add(name);
        }
        for (int j = 0; j < rightSchema.size(); j++) {
            if (indexOf(rightKeyIdx, j) >= 0) continue;
            String base = options.rightPrefix() + rightSchema.column(j);
            String name = base;
            if (used.contains(name)) {
                name = base + options.collisionSuffix();
                int n = 2;
                while (used.contains(name)) name = base + options.collisionSuffix() + "_" + n++;
            }
            names.add(name);
            sourceNames.add(rightSchema.column(j));
            sources.add(new int[] {1, j});
            used.add(name);
        }

        List<String> select = options.selectColumns();
        if (!select.isEmpty()) {
            Set<String> wanted = new HashSet<>(select);
            Set<String> found = new HashSet<>();
            List<String> keptNames = new ArrayList<>();
            List<int[]> keptSources = new ArrayList<>();
            for (int c = 0; c < names.size(); c++) {
                boolean isKey = sources.get(c)[0] == 2;
                boolean byOutput = wanted.contains(names.get(c));
                boolean bySource = wanted.contains(sourceNames.get(c));
                if (byOutput) found.add(names.get(c));
                if (bySource) found.add(sourceNames.get(c));
                if (isKey || byOutput || bySource) {
                    keptNames.add(names.get(c));
                    keptSources.add(sources.get(c));
                }
            }
            for (String s : select) {
                if (!found.contains(s)) {
                    throw new SchemaException("Selected column '" + s + "' not found in join output. Available columns: " + String.join(", ", names), s);
                }
            }
            names = keptNames;
            sources = keptSources;
        }
        return new Layout(Schema.of(names), sources.toArray(new int[0][]), leftKeyIdx, rightKeyIdx);
    }

    private static int indexOf(int[] arr, int value) {
        for (int i = 0; i < arr.length; i++) if (arr[i] == value) return i;
        return -1;
    }

    /** Resolved output columns and where each one takes its cell from. */
    private static final class Layout {
        final Schema schema;
        final int[][] sources;
        final int[] leftKeyIdx;
        final int[] rightKeyIdx;

        Layout(Schema schema, int[][] sources, int[] leftKeyIdx, int[] rightKeyIdx) {
            this.schema = schema;
            this.sources = sources;
            this.leftKeyIdx = leftKeyIdx;
            this.rightKeyIdx = rightKeyIdx;
        }

        // either side may be null for an unmatched row
        String[] combine(Row l, Row r) {
            String[] cells = new String[sources.length];
            for (int c = 0; c < sources.length; c++) {
                int[] src = sources[c];
                cells[c] = switch (src[0]) {
                    case 0 -> l == null ? "" : l.get(src[1]);
                    case 1 -> r == null ? "" : r.get(src[1]);
                    default -> l != null ? l.get(leftKeyIdx[src[1]]) : r.get(rightKeyIdx[src[1]]);
                };
            }
            return cells;
        }
    }

    @Override
    public String toString() { return "JoinStage[" + options.type() + " on " + keys + "]"; }
}
