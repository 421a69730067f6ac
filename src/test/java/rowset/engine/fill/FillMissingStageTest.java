package rowset.engine.fill;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

import rowset.engine.catalog.Schema;
import rowset.engine.catalog.SchemaException;
import rowset.engine.exec.ExecutionContext;
import rowset.engine.exec.RowSet;

public class FillMissingStageTest {

    private static RowSet readings() {
        return RowSet.builder("id", "v", "tag")
            .add("1", "", "a")
            .add("2", "1", "")
            .add("3", "", "b")
            .add("4", "4", "b")
            .add("5", "n/a", "a")
            .add("6", "7", "")
            .add("7", " ", "a")
            .build();
    }

    private static List<String> fill(String column, FillMethod method) {
        return new FillMissingStage(List.of(column), method).apply(readings(), ExecutionContext.defaults()).column(column);
    }

    @Test
    void meanAndMedianUseNumericCellsOnly() {
        assertEquals(List.of("4", "1", "4", "4", "n/a", "7", "4"), fill("v", FillMethod.MEAN));
        assertEquals(List.of("4", "1", "4", "4", "n/a", "7", "4"), fill("v", FillMethod.MEDIAN));
    }

    @Test
    void modePrefersFirstSeenOnTies() {
        assertEquals(List.of("a", "a", "b", "b", "a", "a", "a"), fill("tag", FillMethod.MODE));
        RowSet tie = RowSet.builder("c").add("x").add("").add("y").build();
        assertEquals(List.of("x", "x", "y"),
            new FillMissingStage(List.of("c"), FillMethod.MODE).apply(tie, ExecutionContext.defaults()).column("c"));
    }

    @Test
    void forwardAndBackwardLeaveUnreachableEndsBlank() {
        assertEquals(List.of("", "1", "1", "4", "n/a", "7", "7"), fill("v", FillMethod.FORWARD));
        assertEquals(List.of("1", "1", "4", "4", "n/a", "7", " "), fill("v", FillMethod.BACKWARD));
    }

    @Test
    void constantFillsSeveralColumnsAndKeepsShape() {
        RowSet in = readings();
        RowSet out = new FillMissingStage(List.of("v", "tag"), FillMethod.CONSTANT, "0").apply(in, ExecutionContext.defaults());
        assertEquals(in.schema(), out.schema());
        assertEquals(in.size(), out.size());
        assertEquals(List.of("0", "1", "0", "4", "n/a", "7", "0"), out.column("v"));
        assertEquals(List.of("a", "0", "b", "b", "a", "0", "a"), out.column("tag"));
    }

    @Test
    void columnWithoutNumbersIsLeftAlone() {
        assertEquals(List.of("a", "", "b", "b", "a", "", "a"), fill("tag", FillMethod.MEAN));
    }

    @Test
    void configurationErrors() {
        assertThrows(IllegalArgumentException.class, () -> new FillMissingStage(List.of("v"), FillMethod.CONSTANT));
        assertThrows(IllegalArgumentException.class, () -> new FillMissingStage(List.of(), FillMethod.MEAN));
        FillMissingStage s = new FillMissingStage(List.of("nope"), FillMethod.MEAN);
        assertThrows(SchemaException.class, () -> s.outputSchema(Schema.of("v")));
        assertEquals(FillMethod.FORWARD, FillMethod.parse("ffill"));
    }
}
