package rowset.engine.stats;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import rowset.engine.catalog.SchemaException;
import rowset.engine.exec.RowSet;
import rowset.engine.numeric.NumericParser;

public class StatisticsCalculatorTest {

    @Test
    void describesNumericCellsAndCountsBlanks() {
        RowSet rows = RowSet.builder("v").add("1").add("2").add("").add("3").add("4").add("n/a").build();
        ColumnStatistics s = StatisticsCalculator.describe(rows, "v", NumericParser.invariant());
        assertEquals(4, s.count());
        assertEquals(1, s.nullCount());
        assertEquals(2.5, s.mean(), 1e-9);
        assertEquals(1.0, s.min(), 1e-9);
        assertEquals(4.0, s.max(), 1e-9);
        assertEquals(2.5, s.median(), 1e-9);
        assertEquals(1.75, s.q1(), 1e-9);
        assertEquals(3.25, s.q3(), 1e-9);
        assertEquals(1.5, s.iqr(), 1e-9);
        assertEquals(5.0 / 3.0, s.variance(), 1e-9);
    }

    @Test
    void failsWithoutNumericValuesOrColumn() {
        RowSet rows = RowSet.builder("v").add("a").build();
        assertThrows(IllegalStateException.class, () -> StatisticsCalculator.describe(rows, "v", NumericParser.invariant()));
        assertThrows(SchemaException.class, () -> StatisticsCalculator.describe(rows, "w", NumericParser.invariant()));
    }
}
