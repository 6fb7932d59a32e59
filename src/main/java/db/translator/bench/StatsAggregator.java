package db.translator.bench;

import java.util.Arrays;

/**
 * Timing samples (nanoseconds) for one backend/query pair. Running sum, min and max are kept on
 * add; order statistics sort a copy of the buffer.
 */
public class StatsAggregator {
    private long[] samples = new long[32];
    private int size;
    private long sum;
    private long min = Long.MAX_VALUE;
    private long max = Long.MIN_VALUE;

    public void add(long nanos) {
        if (size == samples.length) samples = Arrays.copyOf(samples, size * 2);
        samples[size++] = nanos;
        sum += nanos;
        min = Math.min(min, nanos);
        max = Math.max(max, nanos);
    }

    public int count() { return size; }

    public long min() { return size == 0 ? 0L : min; }
    public long max() { return size == 0 ? 0L : max; }

    public double mean() {
        return size == 0 ? 0.0 : (double) sum / size;
    }

    // n-1 denominator
    public double variance() {
        if (size < 2) return 0.0;
        double m = mean();
        double acc = 0.0;
        for (int k = 0; k < size; k++) {
            double d = samples[k] - m;
            acc += d * d;
        }
        return acc / (size - 1);
    }

    public double stddev() {
        return Math.sqrt(variance());
    }

    public double median() {
        return percentile(50);
    }

    /**
     * Linear interpolation between the closest ranks, p in [0, 100]. For p = 50 on an even-sized
     * sample this is the mean of the two middle values.
     */
    public double percentile(double p) {
        if (p < 0 || p > 100) throw new IllegalArgumentException("percentile out of range: " + p);
        if (size == 0) return 0.0;
        long[] sorted = Arrays.copyOf(samples, size);
        Arrays.sort(sorted);
        double pos = p / 100.0 * (size - 1);
        int lo = (int) Math.floor(pos);
        int hi = Math.min(lo + 1, size - 1);
        return sorted[lo] + (pos - lo) * (sorted[hi] - sorted[lo]);
    }
}
