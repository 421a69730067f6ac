package rowset.engine.pipeline;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import rowset.engine.catalog.Schema;
import rowset.engine.catalog.SchemaException;
import rowset.engine.cli.TablePrinter;
import rowset.engine.config.EngineOptions;
import rowset.engine.exec.ExecutionContext;
import rowset.engine.exec.RowProcessingException;
import rowset.engine.exec.RowSet;
import rowset.engine.exec.Stage;

/**
 * Runs a stage chain: one source read, schema validation of the whole chain, then each stage in order.
 */
public class PipelineExecutor {
    private static final Logger log = LoggerFactory.getLogger(PipelineExecutor.class);
    private static final int PREVIEW_ROWS = 10;

    /** Final rows plus the report of the run that produced them. */
    public record Result(RowSet rows, PipelineReport report) {}

    public Result execute(String operation, RowSource source, List<Stage> stages, EngineOptions options) {
        long started = System.nanoTime();
        RowSet current;
        try {
            current = source.read(options);
        } catch (RuntimeException e) {
            throw wrap(operation, -1, e);
        }
        if (current == null) throw new PipelineExecutionException(operation, -1, -1, null, new IllegalStateException("source returned no rows"));
        int sourceRows = current.size();
        log.debug("{}: read {} row(s) from {}", operation, sourceRows, source);

        // every schema error surfaces before any row is processed
        Schema schema = current.schema();
        for (int i = 0; i < stages.size(); i++) {
            try {
                schema = stages.get(i).outputSchema(schema);
            } catch (RuntimeException e) {
                throw wrap(operation, i, e);
            }
        }

        ExecutionContext ctx = new ExecutionContext(options);
        List<PipelineReport.StageStats> stats = new ArrayList<>(stages.size());
        for (int i = 0; i < stages.size(); i++) {
            Stage stage = stages.get(i);
            int rowsIn = current.size();
            long t0 = System.nanoTime();
            try {
                current = stage.apply(current, ctx);
            } catch (RuntimeException e) {
                throw wrap(operation, i, e);
            }
            long elapsed = System.nanoTime() - t0;
            stats.add(new PipelineReport.StageStats(i, stage.name(), rowsIn, current.size(), elapsed));
            log.debug("{}: stage {} {} {} -> {} row(s) in {} us", operation, i, stage.name(), rowsIn, current.size(), elapsed / 1_000);
        }

        PipelineReport report = new PipelineReport(operation, sourceRows, stats, System.nanoTime() - started);
        log.info("{}: {} stage(s), {} source row(s) -> {} row(s)", operation, stages.size(), sourceRows, current.size());
        if (log.isDebugEnabled()) log.debug("{} result:\n{}", operation, TablePrinter.render(current, PREVIEW_ROWS));
        return new Result(current, report);
    }

    static PipelineExecutionException wrap(String operation, int stageIndex, RuntimeException e) {
        if (e instanceof PipelineExecutionException pe) return pe;
        if (e instanceof RowProcessingException rpe) {
            return new PipelineExecutionException(operation, stageIndex, rpe.rowIndex(), rpe.column(), e);
        }
        if (e instanceof SchemaException se) {
            return new PipelineExecutionException(operation, stageIndex, -1, se.column(), e);
        }
        return new PipelineExecutionException(operation, stageIndex, -1, null, e);
    }
}
