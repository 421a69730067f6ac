package rowset.engine.catalog;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered list of unique column names with name -> position lookup.
 */
public final class Schema {
    private static final Schema EMPTY = new Schema(List.of());

    private final List<String> columns;
    private final Map<String, Integer> positions;

    private Schema(List<String> columns) {
        this.columns = List.copyOf(columns);
        this.positions = new HashMap<>(columns.size() * 2);
        for (int i = 0; i < this.columns.size(); i++) {
            String name = this.columns.get(i);
            if (positions.putIfAbsent(name, i) != null) {
                throw new SchemaException("Duplicate column name in schema: " + name, name);
            }
        }
    }

    public static Schema of(String... columns) { return new Schema(List.of(columns)); }
    public static Schema of(Collection<String> columns) { return columns.isEmpty() ? EMPTY : new Schema(new ArrayList<>(columns)); }
    public static Schema empty() { return EMPTY; }

    public List<String> columns() { return columns; }
    public int size() { return columns.size(); }
    public String column(int index) { return columns.get(index); }
    public boolean contains(String name) { return positions.containsKey(name); }

    // -1 when absent
    public int indexOf(String name) {
        Integer idx = positions.get(name);
        return idx == null ? -1 : idx;
    }

    public int require(String name) {
        Integer idx = positions.get(name);
        if (idx == null) throw SchemaException.unknownColumn(name, this);
        return idx;
    }

    public void requireAll(Collection<String> names) {
        for (String n : names) require(n);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Schema other && columns.equals(other.columns);
    }

    @Override
    public int hashCode() { return columns.hashCode(); }

    @Override
    public String toString() { return "Schema" + columns; }
}
