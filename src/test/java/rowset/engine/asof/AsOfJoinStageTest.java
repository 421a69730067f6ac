package rowset.engine.asof;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;

import rowset.engine.catalog.SchemaException;
import rowset.engine.exec.ExecutionContext;
import rowset.engine.exec.Row;
import rowset.engine.exec.RowSet;

public class AsOfJoinStageTest {

    // trades at 10:00:05, 10:00:30, 10:02:00, 09:59:00
    private static RowSet trades() {
        return RowSet.builder("time", "sym", "qty")
            .add("2024-01-01 10:00:05", "A", "100")
            .add("2024-01-01 10:00:30", "A", "200")
            .add("2024-01-01 10:02:00", "A", "300")
            .add("2024-01-01 09:59:00", "A", "400")
            .build();
    }

    // quotes deliberately out of order, two at 10:00:00
    private static RowSet quotes() {
        return RowSet.builder("ts", "sym", "bid")
            .add("2024-01-01 10:01:00", "A", "11")
            .add("2024-01-01 10:00:00", "A", "10a")
            .add("2024-01-01 10:00:00", "A", "10b")
            .add("garbage", "A", "99")
            .build();
    }

    private static RowSet merge(AsOfOptions options) {
        return new AsOfJoinStage(quotes(), options).apply(trades(), ExecutionContext.defaults());
    }

    @Test
    void backwardPicksLastQuoteAtOrBefore() {
        RowSet out = merge(AsOfOptions.of("time", "ts"));
        assertEquals(List.of("time", "sym", "qty", "sym_right", "bid"), out.columns());
        assertEquals(List.of("10b", "10b", "11", ""), out.column("bid"));
        assertEquals(List.of("100", "200", "300", "400"), out.column("qty"));
    }

    @Test
    void forwardPicksFirstQuoteAtOrAfter() {
        RowSet out = merge(AsOfOptions.of("time", "ts").withDirection(Direction.FORWARD));
        assertEquals(List.of("11", "11", "", "10a"), out.column("bid"));
    }

    @Test
    void nearestBreaksTiesBackward() {
        RowSet left = RowSet.builder("t").add("2024-01-01 10:00:30").add("2024-01-01 10:00:40").build();
        RowSet out = new AsOfJoinStage(quotes(), AsOfOptions.of("t", "ts").withDirection(Direction.NEAREST))
            .apply(left, ExecutionContext.defaults());
        assertEquals(List.of("10b", "11"), out.column("bid"));
    }

    @Test
    void toleranceLimitsDistance() {
        RowSet out = merge(AsOfOptions.of("time", "ts").withTolerance(Duration.ofSeconds(10)));
        assertEquals(List.of("10b", "", "", ""), out.column("bid"));
        assertEquals(4, out.size());
    }

    @Test
    void matchedRightTimesRespectDirectionAndTolerance() {
        RowSet right = RowSet.builder("ts", "rt").add("100", "100").add("160", "160").add("250", "250").add("400", "400").build();
        RowSet left = RowSet.builder("t").add("90").add("150").add("200").add("260").add("399").add("500").build();
        ExecutionContext ctx = ExecutionContext.defaults();
        for (Direction d : Direction.values()) {
            RowSet out = new AsOfJoinStage(right, AsOfOptions.of("t", "ts").withDirection(d).withTolerance(Duration.ofSeconds(60)))
                .apply(left, ctx);
            for (Row r : out) {
                if (r.get("rt").isEmpty()) continue;
                long l = Long.parseLong(r.get("t"));
                long m = Long.parseLong(r.get("rt"));
                if (d == Direction.BACKWARD) assertTrue(m <= l);
                if (d == Direction.FORWARD) assertTrue(m >= l);
                assertTrue(Math.abs(m - l) <= 60);
            }
        }
    }

    @Test
    void unreadableLeftTimeIsEmittedUnmatched() {
        RowSet left = RowSet.builder("time").add("not a time").build();
        RowSet out = new AsOfJoinStage(quotes(), AsOfOptions.of("time", "ts")).apply(left, ExecutionContext.defaults());
        assertEquals(1, out.size());
        assertEquals("", out.row(0).get("bid"));
    }

    @Test
    void configurationErrors() {
        assertThrows(IllegalArgumentException.class, () -> AsOfOptions.on("t").withTolerance(Duration.ofSeconds(-1)));
        assertThrows(IllegalArgumentException.class, () -> AsOfOptions.on("t").withTolerance(Duration.ofSeconds(Long.MAX_VALUE)));
        assertThrows(SchemaException.class, () -> new AsOfJoinStage(quotes(), AsOfOptions.of("time", "missing")));
        AsOfJoinStage stage = new AsOfJoinStage(quotes(), AsOfOptions.of("missing", "ts"));
        assertThrows(SchemaException.class, () -> stage.outputSchema(trades().schema()));
        assertEquals(Direction.NEAREST, Direction.parse("nearest"));
    }
}
