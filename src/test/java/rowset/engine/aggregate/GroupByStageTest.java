package rowset.engine.aggregate;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

import rowset.engine.catalog.Schema;
import rowset.engine.catalog.SchemaException;
import rowset.engine.exec.ExecutionContext;
import rowset.engine.exec.RowProcessingException;
import rowset.engine.exec.RowSet;

public class GroupByStageTest {

    private static RowSet sales() {
        return RowSet.builder("region", "product", "amount")
            .add("north", "a", "10")
            .add("south", "a", "5")
            .add("north", "b", "30")
            .add("north", "a", "x")
            .add("", "b", "7")
            .build();
    }

    @Test
    void meanWithoutKeysProducesSingleRow() {
        RowSet in = RowSet.fromMaps(List.of(Map.of("t", "1", "v", "10"), Map.of("t", "2", "v", "30")));
        GroupByStage g = new GroupByStage(List.of(), List.of(AggregateSpec.of("v", AggregateFunction.MEAN)));
        RowSet out = g.apply(in, ExecutionContext.defaults());
        assertEquals(List.of(Map.of("v_mean", "20")), out.toMaps());
    }

    @Test
    void groupsInFirstSeenOrderAndSkipsUnreadableCells() {
        GroupByStage g = new GroupByStage(List.of("region"), List.of(
            AggregateSpec.of("amount", AggregateFunction.SUM),
            AggregateSpec.of("amount", AggregateFunction.COUNT),
            AggregateSpec.of("product", AggregateFunction.FIRST, "first_product")));
        RowSet out = g.apply(sales(), ExecutionContext.defaults());

        assertEquals(List.of("region", "amount_sum", "amount_count", "first_product"), out.columns());
        assertEquals(List.of("north", "south", ""), out.column("region"));
        assertEquals(List.of("40", "5", "7"), out.column("amount_sum"));
        assertEquals(List.of("3", "1", "1"), out.column("amount_count"));
        assertEquals(List.of("a", "a", "b"), out.column("first_product"));
    }

    @Test
    void spreadMedianMinAndLastPerGroup() {
        RowSet in = RowSet.builder("k", "v")
            .add("a", "4")
            .add("b", "7")
            .add("a", "1")
            .add("a", "5")
            .add("b", "")
            .add("a", "2")
            .build();
        GroupByStage g = new GroupByStage(List.of("k"), List.of(
            AggregateSpec.of("v", AggregateFunction.STD),
            AggregateSpec.of("v", AggregateFunction.VAR),
            AggregateSpec.of("v", AggregateFunction.MEDIAN),
            AggregateSpec.of("v", AggregateFunction.MIN),
            AggregateSpec.of("v", AggregateFunction.LAST)));
        RowSet out = g.apply(in, ExecutionContext.defaults());
        assertEquals(List.of("k", "v_std", "v_var", "v_median", "v_min", "v_last"), out.columns());

        // a: 4, 1, 5, 2 -> mean 3, sample variance 10/3, median between 2 and 4
        assertEquals(Math.sqrt(10.0 / 3.0), Double.parseDouble(out.row(0).get("v_std")), 1e-12);
        assertEquals(10.0 / 3.0, Double.parseDouble(out.row(0).get("v_var")), 1e-12);
        assertEquals("3", out.row(0).get("v_median"));
        assertEquals("1", out.row(0).get("v_min"));
        assertEquals("2", out.row(0).get("v_last"));

        // b: a single numeric value has no spread; LAST is the raw last cell
        assertEquals("0", out.row(1).get("v_std"));
        assertEquals("0", out.row(1).get("v_var"));
        assertEquals("7", out.row(1).get("v_median"));
        assertEquals("7", out.row(1).get("v_min"));
        assertEquals("", out.row(1).get("v_last"));
    }

    @Test
    void countsCoverEveryInputRow() {
        GroupByStage g = new GroupByStage(List.of("region", "product"), List.of(AggregateSpec.of("amount", AggregateFunction.COUNT)));
        RowSet in = sales();
        RowSet out = g.apply(in, ExecutionContext.defaults());
        int total = 0;
        for (String c : out.column("amount_count")) total += Integer.parseInt(c);
        assertEquals(in.size(), total);
    }

    @Test
    void dropEmptyKeysAndCustomSeparator() {
        GroupByOptions opts = GroupByOptions.DEFAULT.withDropEmptyKeys(true).withSeparator(".").withKeepKeys(false);
        GroupByStage g = new GroupByStage(List.of("region"), List.of(AggregateSpec.of("amount", AggregateFunction.MAX)), opts);
        RowSet out = g.apply(sales(), ExecutionContext.defaults());
        assertEquals(List.of("amount.max"), out.columns());
        assertEquals(List.of("30", "5"), out.column("amount.max"));
    }

    @Test
    void groupWithoutNumericValuesFailsStrictAndUsesDefaultWhenTolerant() {
        RowSet in = RowSet.builder("k", "v").add("a", "1").add("b", "oops").build();
        GroupByStage g = new GroupByStage(List.of("k"), List.of(AggregateSpec.of("v", AggregateFunction.MEAN)));

        RowProcessingException e = assertThrows(RowProcessingException.class, () -> g.apply(in, ExecutionContext.defaults()));
        assertEquals(1, e.rowIndex());
        assertEquals("v", e.column());

        ExecutionContext tolerant = new ExecutionContext(ExecutionContext.tolerant().options().withDefaultValue("NA"));
        assertEquals(List.of("1", "NA"), g.apply(in, tolerant).column("v_mean"));
    }

    @Test
    void emptyInputGivesEmptyOutput() {
        GroupByStage g = new GroupByStage(List.of("k"), List.of(AggregateSpec.of("v", AggregateFunction.SUM)));
        RowSet out = g.apply(RowSet.empty(Schema.of("k", "v")), ExecutionContext.defaults());
        assertTrue(out.isEmpty());
        assertEquals(List.of("k", "v_sum"), out.columns());
    }

    @Test
    void configurationErrors() {
        assertThrows(IllegalArgumentException.class, () -> new GroupByStage(List.of("k"), List.of()));
        GroupByStage g = new GroupByStage(List.of("nope"), List.of(AggregateSpec.of("v", AggregateFunction.SUM)));
        assertThrows(SchemaException.class, () -> g.outputSchema(Schema.of("k", "v")));
        GroupByStage dup = new GroupByStage(List.of("k"), List.of(AggregateSpec.of("v", AggregateFunction.SUM, "k")));
        assertThrows(SchemaException.class, () -> dup.outputSchema(Schema.of("k", "v")));
        assertEquals(AggregateFunction.MEAN, AggregateFunction.parse("avg"));
        assertThrows(IllegalArgumentException.class, () -> AggregateFunction.parse("mode"));
    }
}
