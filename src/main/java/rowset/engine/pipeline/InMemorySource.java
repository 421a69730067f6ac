package rowset.engine.pipeline;

import rowset.engine.config.EngineOptions;
import rowset.engine.exec.RowSet;

public final class InMemorySource implements RowSource {
    private final RowSet rows;

    public InMemorySource(RowSet rows) {
        if (rows == null) throw new IllegalArgumentException("rows must not be null");
        this.rows = rows;
    }

    @Override
    public RowSet read(EngineOptions options) { return rows; }

    @Override
    public String toString() { return "InMemorySource[" + rows.size() + " row(s)]"; }
}
