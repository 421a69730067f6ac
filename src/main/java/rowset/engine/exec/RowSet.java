package rowset.engine.exec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import rowset.engine.catalog.Schema;

/**
 * Ordered rows sharing one Schema. Immutable: stages always return a new RowSet.
 */
public final class RowSet implements Iterable<Row> {
    private final Schema schema;
    private final List<Row> rows;

    private RowSet(Schema schema, List<Row> rows) {
        this.schema = schema;
        this.rows = rows;
    }

    public static RowSet empty(Schema schema) { return new RowSet(schema, List.of()); }

    public static RowSet of(Schema schema, List<Row> rows) {
        for (int i = 0; i < rows.size(); i++) {
            if (!rows.get(i).schema().equals(schema)) {
                throw new IllegalArgumentException("Row " + i + " schema " + rows.get(i).schema() + " does not match " + schema);
            }
        }
        return new RowSet(schema, List.copyOf(rows));
    }

    /**
     * Column order comes from the first map. Cells missing from later maps are empty.
     */
    public static RowSet fromMaps(List<? extends Map<String, String>> maps) {
        if (maps.isEmpty()) return empty(Schema.empty());
        Schema schema = Schema.of(maps.get(0).keySet());
        Builder b = builder(schema);
        for (Map<String, String> m : maps) b.add(m);
        return b.build();
    }

    public static Builder builder(Schema schema) { return new Builder(schema); }
    public static Builder builder(String... columns) { return new Builder(Schema.of(columns)); }

    public Schema schema() { return schema; }
    public List<String> columns() { return schema.columns(); }
    public List<Row> rows() { return rows; }
    public Row row(int index) { return rows.get(index); }
    public int size() { return rows.size(); }
    public boolean isEmpty() { return rows.isEmpty(); }

    @Override
    public Iterator<Row> iterator() { return rows.iterator(); }

    public List<String> column(String name) {
        int idx = schema.require(name);
        List<String> out = new ArrayList<>(rows.size());
        for (Row r : rows) out.add(r.get(idx));
        return out;
    }

    /** Columnar snapshot: column name -> cells in row order. */
    public Map<String, List<String>> toColumns() {
        Map<String, List<String>> out = new LinkedHashMap<>();
        for (String c : schema.columns()) out.put(c, Collections.unmodifiableList(column(c)));
        return Collections.unmodifiableMap(out);
    }

    public List<Map<String, String>> toMaps() {
        List<Map<String, String>> out = new ArrayList<>(rows.size());
        for (Row r : rows) out.add(r.asMap());
        return out;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof RowSet other && schema.equals(other.schema) && rows.equals(other.rows);
    }

    @Override
    public int hashCode() { return 31 * schema.hashCode() + rows.hashCode(); }

    @Override
    public String toString() { return "RowSet" + schema.columns() + " rows=" + rows.size(); }

    public static final class Builder {
        private final Schema schema;
        private final List<Row> rows = new ArrayList<>();

        private Builder(Schema schema) { this.schema = schema; }

        public Schema schema() { return schema; }

        public Builder add(String... cells) {
            rows.add(Row.of(schema, cells));
            return this;
        }

        public Builder add(List<String> cells) {
            rows.add(Row.of(schema, cells));
            return this;
        }

        public Builder add(Map<String, String> cells) {
            rows.add(Row.fromMap(schema, cells));
            return this;
        }

        public Builder add(Row row) {
            if (!row.schema().equals(schema)) throw new IllegalArgumentException("Row schema " + row.schema() + " does not match " + schema);
            rows.add(row);
            return this;
        }

        public int size() { return rows.size(); }

        public RowSet build() { return new RowSet(schema, List.copyOf(rows)); }
    }
}
