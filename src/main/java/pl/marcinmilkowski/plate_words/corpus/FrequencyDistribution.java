package pl.marcinmilkowski.plate_words.corpus;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Summary of a corpus frequency distribution, computed once per corpus.
 *
 * Log-space values use ln(f + 1) so zero-frequency entries stay finite.
 * Percentile thresholds are read off the frequencies sorted descending:
 * the threshold for percentile p is the frequency at index
 * floor((100 - p) * n / 100).
 */
public final class FrequencyDistribution {

    /** Percentiles checked in order, most common first. */
    public static final double[] PERCENTILES = {5, 10, 25, 50, 75, 90, 95, 99, 99.9};

    private final long[] descending;
    private final long maxFrequency;
    private final long minFrequency;
    private final long medianFrequency;
    private final double meanFrequency;
    private final double maxLogFrequency;
    private final double minLogFrequency;
    private final double medianLogFrequency;
    private final double meanLogFrequency;
    private final double logStdDev;
    private final Map<Double, Long> percentileThresholds;

    private FrequencyDistribution(long[] descending) {
        this.descending = descending;
        int n = descending.length;
        if (n == 0) {
            maxFrequency = minFrequency = medianFrequency = 0;
            meanFrequency = maxLogFrequency = minLogFrequency = 0;
            medianLogFrequency = meanLogFrequency = logStdDev = 0;
            percentileThresholds = Collections.emptyMap();
            return;
        }

        maxFrequency = descending[0];
        minFrequency = descending[n - 1];
        medianFrequency = descending[n / 2];

        double sum = 0;
        double logSum = 0;
        for (long f : descending) {
            sum += f;
            logSum += Math.log1p(f);
        }
        meanFrequency = sum / n;
        meanLogFrequency = logSum / n;
        maxLogFrequency = Math.log1p(maxFrequency);
        minLogFrequency = Math.log1p(minFrequency);
        medianLogFrequency = Math.log1p(medianFrequency);

        double squares = 0;
        for (long f : descending) {
            double d = Math.log1p(f) - meanLogFrequency;
            squares += d * d;
        }
        logStdDev = Math.sqrt(squares / n);

        Map<Double, Long> thresholds = new LinkedHashMap<>();
        for (double p : PERCENTILES) {
            int idx = (int) Math.floor((100.0 - p) * n / 100.0);
            thresholds.put(p, descending[Math.min(idx, n - 1)]);
        }
        percentileThresholds = Collections.unmodifiableMap(thresholds);
    }

    static FrequencyDistribution of(long[] frequencies) {
        long[] sorted = frequencies.clone();
        Arrays.sort(sorted);
        // reverse into descending order
        for (int i = 0, j = sorted.length - 1; i < j; i++, j--) {
            long tmp = sorted[i];
            sorted[i] = sorted[j];
            sorted[j] = tmp;
        }
        return new FrequencyDistribution(sorted);
    }

    /**
     * Rarity percentile for a frequency: 100 minus the first percentile
     * whose threshold the frequency reaches. Frequencies below every
     * threshold get 99.9; an empty distribution gives 50.
     */
    public double rarityPercentile(long frequency) {
        if (percentileThresholds.isEmpty()) {
            return 50.0;
        }
        for (double p : PERCENTILES) {
            if (frequency >= percentileThresholds.get(p)) {
                return 100.0 - p;
            }
        }
        return 99.9;
    }

    /**
     * Rank of a frequency among all corpus entries, 1 = most common.
     * Equal frequencies share the rank of their first occurrence.
     */
    public int rank(long frequency) {
        int lo = 0;
        int hi = descending.length;
        // first index with descending[i] <= frequency
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (descending[mid] > frequency) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return Math.min(lo, Math.max(0, descending.length - 1)) + 1;
    }

    public int totalWords() { return descending.length; }
    public long maxFrequency() { return maxFrequency; }
    public long minFrequency() { return minFrequency; }
    public long medianFrequency() { return medianFrequency; }
    public double meanFrequency() { return meanFrequency; }
    public double maxLogFrequency() { return maxLogFrequency; }
    public double minLogFrequency() { return minLogFrequency; }
    public double medianLogFrequency() { return medianLogFrequency; }
    public double meanLogFrequency() { return meanLogFrequency; }
    public double logStdDev() { return logStdDev; }

    /**
     * Percentile to frequency threshold, in {@link #PERCENTILES} order.
     */
    public Map<Double, Long> percentileThresholds() {
        return percentileThresholds;
    }
}
