package rowset.engine.aggregate;

import java.util.Arrays;

/**
 * Accumulates numeric samples and answers the usual descriptive statistics.
 */
public class StatsAggregator {
    private double[] samples = new double[8];
    private int count;
    private double sum;
    private double min = Double.POSITIVE_INFINITY;
    private double max = Double.NEGATIVE_INFINITY;
    private double[] sorted; // cache, reset on add

    public void add(double value) {
        if (count == samples.length) samples = Arrays.copyOf(samples, count * 2);
        samples[count++] = value;
        sum += value;
        if (value < min) min = value;
        if (value > max) max = value;
        sorted = null;
    }

    public int count() { return count; }
    public boolean isEmpty() { return count == 0; }
    public double sum() { return sum; }

    public double min() { requireSamples(); return min; }
    public double max() { requireSamples(); return max; }

    public double mean() {
        requireSamples();
        return sum / count;
    }

    // Sample variance (unbiased, n-1 denominator); a single sample has variance 0
    public double variance() {
        requireSamples();
        if (count < 2) return 0.0;
        double m = mean();
        double acc = 0.0;
        for (int i = 0; i < count; i++) {
            double diff = samples[i] - m;
            acc += diff * diff;
        }
        return acc / (count - 1);
    }

    public double stddev() {
        return Math.sqrt(variance());
    }

    public double median() { return quantile(0.5); }

    /**
     * Quantile with linear interpolation between the two bracketing order statistics,
     * position p * (n - 1) over the sorted samples.
     */
    public double quantile(double p) {
        requireSamples();
        if (p < 0.0 || p > 1.0) throw new IllegalArgumentException("quantile must be within [0, 1]: " + p);
        if (sorted == null) {
            sorted = Arrays.copyOf(samples, count);
            Arrays.sort(sorted);
        }
        double pos = p * (count - 1);
        int lo = (int) Math.floor(pos);
        int hi = (int) Math.ceil(pos);
        return sorted[lo] + (pos - lo) * (sorted[hi] - sorted[lo]);
    }

    private void requireSamples() {
        if (count == 0) throw new IllegalStateException("No samples");
    }
}
