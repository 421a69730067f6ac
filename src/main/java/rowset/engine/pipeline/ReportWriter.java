package rowset.engine.pipeline;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/**
 * Writes a PipelineReport as pretty-printed JSON, timings in milliseconds.
 */
public class ReportWriter {
    private final Gson gson = new GsonBuilder().disableHtmlEscaping().setPrettyPrinting().create();

    public String toJson(PipelineReport report) {
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("operation", report.operation());
        root.put("source_rows", report.sourceRows());
        root.put("output_rows", report.outputRows());
        root.put("total_ms", millis(report.totalNanos()));
        List<Map<String, Object>> stages = new ArrayList<>();
        for (PipelineReport.StageStats s : report.stages()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("index", s.index());
            entry.put("name", s.name());
            entry.put("rows_in", s.rowsIn());
            entry.put("rows_out", s.rowsOut());
            entry.put("elapsed_ms", millis(s.elapsedNanos()));
            stages.add(entry);
        }
        root.put("stages", stages);
        return gson.toJson(root);
    }

    public void write(PipelineReport report, Path file) throws IOException {
        Path dir = file.toAbsolutePath().getParent();
        if (dir != null && !Files.exists(dir)) Files.createDirectories(dir);
        Files.writeString(file, toJson(report));
    }

    // 3 decimals
    private static double millis(long nanos) {
        return Math.round(nanos / 1_000.0) / 1_000.0;
    }
}
