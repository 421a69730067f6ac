package rowset.engine.pipeline;

import java.util.List;

/**
 * What one terminal operation did: rows read from the source and rows in / out of every stage.
 */
public record PipelineReport(String operation, int sourceRows, List<StageStats> stages, long totalNanos) {
    public record StageStats(int index, String name, int rowsIn, int rowsOut, long elapsedNanos) {}

    public PipelineReport {
        stages = List.copyOf(stages);
    }

    public int outputRows() {
        return stages.isEmpty() ? sourceRows : stages.get(stages.size() - 1).rowsOut();
    }
}
