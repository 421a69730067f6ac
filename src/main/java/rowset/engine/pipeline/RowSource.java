package rowset.engine.pipeline;

import rowset.engine.config.EngineOptions;
import rowset.engine.exec.RowSet;

/** Where a pipeline's rows come from. Read once per terminal operation. */
@FunctionalInterface
public interface RowSource {
    RowSet read(EngineOptions options);
}
