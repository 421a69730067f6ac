package rowset.engine.pipeline;

import rowset.engine.config.EngineOptions;
import rowset.engine.exec.RowSet;

/** Receives the final rows of a pipeline; written once per {@link Pipeline#writeTo}. */
@FunctionalInterface
public interface RowSink {
    void write(RowSet rows, EngineOptions options);
}
