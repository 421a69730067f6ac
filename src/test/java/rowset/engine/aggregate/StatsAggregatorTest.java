package rowset.engine.aggregate;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

public class StatsAggregatorTest {

    @Test
    void computesDescriptiveStatistics() {
        StatsAggregator s = new StatsAggregator();
        for (double v : new double[] {4, 1, 3, 2}) s.add(v);
        assertEquals(4, s.count());
        assertEquals(10.0, s.sum(), 1e-9);
        assertEquals(2.5, s.mean(), 1e-9);
        assertEquals(1.0, s.min(), 1e-9);
        assertEquals(4.0, s.max(), 1e-9);
        assertEquals(2.5, s.median(), 1e-9);
        assertEquals(5.0 / 3.0, s.variance(), 1e-9);
        assertEquals(1.75, s.quantile(0.25), 1e-9);
        assertEquals(3.25, s.quantile(0.75), 1e-9);
    }

    @Test
    void singleSampleHasZeroVariance() {
        StatsAggregator s = new StatsAggregator();
        s.add(7);
        assertEquals(0.0, s.variance());
        assertEquals(7.0, s.median());
    }

    @Test
    void emptyAggregatorHasNoStatistics() {
        StatsAggregator s = new StatsAggregator();
        assertTrue(s.isEmpty());
        assertEquals(0.0, s.sum());
        assertThrows(IllegalStateException.class, s::mean);
        assertThrows(IllegalArgumentException.class, () -> {
            s.add(1);
            s.quantile(1.5);
        });
    }
}
