package pl.marcinmilkowski.plate_words.indexer;

import com.alibaba.fastjson2.JSONObject;

/**
 * Information statistics of one plate's solution set, precomputed at build time.
 *
 * With M the total frequency mass of the solutions and P(w) = freq(w) / M,
 * entropy is sum(-P log2 P) and the bit values are -log2 P over solutions
 * with nonzero frequency.
 */
public record PlateStatistics(
    long totalFrequencyMass,
    double entropy,
    int solutionCount,
    double averageBits,
    double minBits,
    double maxBits
) {

    public static final PlateStatistics EMPTY = new PlateStatistics(0, 0, 0, 0, 0, 0);

    /**
     * Maximum possible information for a solution, log2(M); 0 when M <= 1.
     */
    public double maxPossibleBits() {
        return totalFrequencyMass > 1 ? log2(totalFrequencyMass) : 0.0;
    }

    static double log2(double x) {
        return Math.log(x) / Math.log(2);
    }

    public JSONObject toJson() {
        JSONObject obj = new JSONObject();
        obj.put("total_freq_mass", totalFrequencyMass);
        obj.put("entropy", entropy);
        obj.put("num_solutions", solutionCount);
        obj.put("avg_info_bits", averageBits);
        obj.put("min_info_bits", minBits);
        obj.put("max_info_bits", maxBits);
        return obj;
    }
}
