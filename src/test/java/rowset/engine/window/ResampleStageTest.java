package rowset.engine.window;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

import rowset.engine.aggregate.AggregateFunction;
import rowset.engine.exec.ExecutionContext;
import rowset.engine.exec.RowProcessingException;
import rowset.engine.exec.RowSet;

public class ResampleStageTest {

    private static RowSet ticks() {
        return RowSet.builder("time", "price", "volume")
            .add("2024-01-01 10:07:00", "5", "1")
            .add("2024-01-01 10:01:00", "1", "2")
            .add("2024-01-01 10:03:59", "3", "3")
            .add("2024-01-01 10:22:00", "9", "4")
            .build();
    }

    @Test
    void bucketsAlignToEpochAndOmitEmptyOnes() {
        ResampleStage r = new ResampleStage("time", List.of("price", "volume"), WindowSpec.parse("5T"), AggregateFunction.MEAN);
        RowSet out = r.apply(ticks(), ExecutionContext.defaults());
        assertEquals(List.of("time", "price", "volume"), out.columns());
        assertEquals(List.of("2024-01-01 10:00:00", "2024-01-01 10:05:00", "2024-01-01 10:20:00"), out.column("time"));
        assertEquals(List.of("2", "5", "9"), out.column("price"));
        assertEquals(List.of("2.5", "1", "4"), out.column("volume"));
        assertTrue(out.size() < ticks().size());
    }

    @Test
    void numericTimesStayEpochSeconds() {
        RowSet in = RowSet.builder("t", "v").add("0", "1").add("59", "2").add("61", "4").build();
        RowSet out = new ResampleStage("t", List.of("v"), WindowSpec.minutes(1), AggregateFunction.SUM)
            .apply(in, ExecutionContext.defaults());
        assertEquals(List.of("0", "60"), out.column("t"));
        assertEquals(List.of("3", "4"), out.column("v"));
    }

    @Test
    void unreadableTimeFailsStrictAndIsDroppedWhenTolerant() {
        RowSet in = RowSet.builder("t", "v").add("2024-01-01", "1").add("soon", "2").build();
        ResampleStage r = new ResampleStage("t", List.of("v"), WindowSpec.days(1), AggregateFunction.COUNT);

        RowProcessingException e = assertThrows(RowProcessingException.class, () -> r.apply(in, ExecutionContext.defaults()));
        assertEquals(1, e.rowIndex());
        assertEquals("t", e.column());

        RowSet out = r.apply(in, ExecutionContext.tolerant());
        assertEquals(List.of("2024-01-01 00:00:00"), out.column("t"));
        assertEquals(List.of("1"), out.column("v"));
    }

    @Test
    void spreadOfSingleValueBucketIsZero() {
        RowSet in = RowSet.builder("t", "v").add("0", "2").add("30", "4").add("90", "8").build();
        RowSet out = new ResampleStage("t", List.of("v"), WindowSpec.minutes(1), AggregateFunction.STD)
            .apply(in, ExecutionContext.defaults());
        assertEquals(Math.sqrt(2.0), Double.parseDouble(out.row(0).get("v")), 1e-12);
        assertEquals("0", out.row(1).get("v"));
    }

    @Test
    void configurationErrors() {
        assertThrows(IllegalArgumentException.class, () -> new ResampleStage("t", List.of(), WindowSpec.hours(1), AggregateFunction.SUM));
        assertThrows(IllegalArgumentException.class, () -> new ResampleStage("", List.of("v"), WindowSpec.hours(1), AggregateFunction.SUM));
    }
}
