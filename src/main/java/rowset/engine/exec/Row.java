package rowset.engine.exec;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import rowset.engine.catalog.Schema;

/**
 * Row is the unit flowing between stages: an ordered column -> text cell mapping bound to a Schema.
 * Every cell is text; missing values are the empty string.
 */
public final class Row {
    private final Schema schema;
    private final String[] cells;

    // takes ownership of cells, callers must not keep the array
    private Row(Schema schema, String[] cells) {
        if (cells.length != schema.size()) {
            throw new IllegalArgumentException("Row has " + cells.length + " cells but schema has " + schema.size() + " columns");
        }
        for (int i = 0; i < cells.length; i++) if (cells[i] == null) cells[i] = "";
        this.schema = schema;
        this.cells = cells;
    }

    public static Row of(Schema schema, List<String> values) {
        return new Row(schema, values.toArray(new String[0]));
    }

    public static Row of(Schema schema, String... values) {
        return new Row(schema, values.clone());
    }

    /** Missing keys become empty cells, keys outside the schema are ignored. */
    public static Row fromMap(Schema schema, Map<String, String> values) {
        String[] cells = new String[schema.size()];
        for (int i = 0; i < cells.length; i++) cells[i] = values.getOrDefault(schema.column(i), "");
        return new Row(schema, cells);
    }

    public Schema schema() { return schema; }
    public String get(int index) { return cells[index]; }
    public String get(String column) { return cells[schema.require(column)]; }
    public List<String> values() { return Collections.unmodifiableList(Arrays.asList(cells)); }
    public int size() { return cells.length; }

    public Map<String, String> asMap() {
        Map<String, String> m = new LinkedHashMap<>(cells.length * 2);
        for (int i = 0; i < cells.length; i++) m.put(schema.column(i), cells[i]);
        return m;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Row other && schema.equals(other.schema) && Arrays.equals(cells, other.cells);
    }

    @Override
    public int hashCode() { return 31 * schema.hashCode() + Arrays.hashCode(cells); }

    @Override
    public String toString() { return "Row" + asMap(); }
}
