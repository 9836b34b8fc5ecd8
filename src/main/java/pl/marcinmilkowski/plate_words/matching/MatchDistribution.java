package pl.marcinmilkowski.plate_words.matching;

import com.alibaba.fastjson2.JSONObject;

import java.util.Arrays;
import java.util.List;

/**
 * Frequency statistics over a solver's matches.
 *
 * Standard deviation is the sample one (0 for a single match). Quartiles use
 * the exclusive method; with fewer than four matches q1 and q3 fall back to
 * the median.
 */
public record MatchDistribution(
    double mean,
    double median,
    double stdDev,
    long min,
    long max,
    double q1,
    double q3
) {

    /**
     * @return null for an empty list
     */
    public static MatchDistribution of(List<Long> frequencies) {
        int n = frequencies.size();
        if (n == 0) {
            return null;
        }
        long[] sorted = frequencies.stream().mapToLong(Long::longValue).toArray();
        Arrays.sort(sorted);

        double sum = 0;
        for (long f : sorted) sum += f;
        double mean = sum / n;

        double stdDev = 0;
        if (n > 1) {
            double squares = 0;
            for (long f : sorted) {
                double d = f - mean;
                squares += d * d;
            }
            stdDev = Math.sqrt(squares / (n - 1));
        }

        double median = median(sorted);
        double q1 = n >= 4 ? exclusiveQuartile(sorted, 1) : median;
        double q3 = n >= 4 ? exclusiveQuartile(sorted, 3) : median;

        return new MatchDistribution(mean, median, stdDev, sorted[0], sorted[n - 1], q1, q3);
    }

    private static double median(long[] sorted) {
        int n = sorted.length;
        if (n % 2 == 1) {
            return sorted[n / 2];
        }
        return (sorted[n / 2 - 1] + sorted[n / 2]) / 2.0;
    }

    private static double exclusiveQuartile(long[] sorted, int i) {
        int m = sorted.length + 1;
        int j = i * m / 4;
        j = Math.max(1, Math.min(j, sorted.length - 1));
        int delta = i * m - j * 4;
        return (sorted[j - 1] * (4.0 - delta) + sorted[j] * (double) delta) / 4.0;
    }

    public JSONObject toJson() {
        JSONObject obj = new JSONObject();
        obj.put("mean", mean);
        obj.put("median", median);
        obj.put("std_dev", stdDev);
        obj.put("min_freq", min);
        obj.put("max_freq", max);
        obj.put("q1", q1);
        obj.put("q3", q3);
        return obj;
    }
}
