package rowset.engine.window;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

import rowset.engine.aggregate.AggregateFunction;
import rowset.engine.catalog.Schema;
import rowset.engine.catalog.SchemaException;
import rowset.engine.exec.ExecutionContext;
import rowset.engine.exec.RowSet;

public class RollingStageTest {

    private static RowSet series(String... values) {
        RowSet.Builder b = RowSet.builder("v");
        for (String v : values) b.add(v);
        return b.build();
    }

    @Test
    void trailingMeanOverThreeRows() {
        RowSet out = new RollingStage(3, List.of("v"), AggregateFunction.MEAN).apply(series("1", "2", "3", "4"), ExecutionContext.defaults());
        assertEquals(List.of("v", "v_rolling"), out.columns());
        assertEquals(List.of("1", "1.5", "2", "3"), out.column("v_rolling"));
        assertEquals(List.of("1", "2", "3", "4"), out.column("v"));
    }

    @Test
    void rowCountIsPreservedForAnyWindow() {
        RowSet in = series("4", "", "x", "7", "1");
        for (int k = 1; k <= 7; k++) {
            RollingStage r = new RollingStage(k, List.of("v"), AggregateFunction.SUM, "_sum" + k);
            assertEquals(in.size(), r.apply(in, ExecutionContext.defaults()).size());
        }
    }

    @Test
    void unreadableCellsAreSkippedInsideTheWindow() {
        RowSet out = new RollingStage(2, List.of("v"), AggregateFunction.MAX, "_max")
            .apply(series("4", "x", "1", "2"), ExecutionContext.defaults());
        assertEquals(List.of("4", "4", "1", "2"), out.column("v_max"));
    }

    @Test
    void medianStdAndLastOverTrailingWindow() {
        RowSet in = series("1", "3", "2", "10");
        ExecutionContext ctx = ExecutionContext.defaults();
        assertEquals(List.of("1", "2", "2", "3"),
            new RollingStage(3, List.of("v"), AggregateFunction.MEDIAN, "_med").apply(in, ctx).column("v_med"));
        assertEquals(List.of("0", "2", "0.5", "32"),
            new RollingStage(2, List.of("v"), AggregateFunction.VAR, "_var").apply(in, ctx).column("v_var"));
        assertEquals(List.of("1", "1", "1", "2"),
            new RollingStage(3, List.of("v"), AggregateFunction.MIN, "_min").apply(in, ctx).column("v_min"));
        assertEquals(List.of("1", "3", "2", "10"),
            new RollingStage(3, List.of("v"), AggregateFunction.LAST, "_last").apply(in, ctx).column("v_last"));
    }

    @Test
    void configurationErrors() {
        assertThrows(IllegalArgumentException.class, () -> new RollingStage(0, List.of("v"), AggregateFunction.MEAN));
        assertThrows(IllegalArgumentException.class, () -> new RollingStage(2, List.of(), AggregateFunction.MEAN));
        assertThrows(IllegalArgumentException.class, () -> new RollingStage(2, List.of("v"), AggregateFunction.MEAN, ""));
        RollingStage r = new RollingStage(2, List.of("v"), AggregateFunction.MEAN, "_x");
        assertThrows(SchemaException.class, () -> r.outputSchema(Schema.of("v", "v_x")));
    }
}
