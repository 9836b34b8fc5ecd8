package pl.marcinmilkowski.plate_words.corpus;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FrequencyDistributionTest {

    private static FrequencyDistribution oneToHundred() {
        long[] frequencies = new long[100];
        for (int i = 0; i < 100; i++) {
            frequencies[i] = i + 1;
        }
        return FrequencyDistribution.of(frequencies);
    }

    @Test
    @DisplayName("Thresholds are read from frequencies sorted descending")
    void computesThresholds() {
        FrequencyDistribution dist = oneToHundred();

        assertEquals(5L, dist.percentileThresholds().get(5.0));
        assertEquals(50L, dist.percentileThresholds().get(50.0));
        assertEquals(99L, dist.percentileThresholds().get(99.0));
        assertEquals(100L, dist.percentileThresholds().get(99.9));
    }

    @Test
    @DisplayName("Rarity percentile is 100 minus the first threshold reached")
    void rarityPercentile() {
        FrequencyDistribution dist = oneToHundred();

        assertEquals(95.0, dist.rarityPercentile(5));
        assertEquals(95.0, dist.rarityPercentile(100));
        assertEquals(99.9, dist.rarityPercentile(3));
    }

    @Test
    void emptyDistributionGivesMidpoint() {
        FrequencyDistribution dist = FrequencyDistribution.of(new long[0]);
        assertEquals(50.0, dist.rarityPercentile(10));
        assertEquals(0, dist.totalWords());
        assertEquals(0.0, dist.logStdDev());
    }

    @Test
    @DisplayName("Log statistics use ln(f + 1)")
    void logStatistics() {
        FrequencyDistribution dist = FrequencyDistribution.of(new long[]{10, 100, 50});

        assertEquals(100, dist.maxFrequency());
        assertEquals(10, dist.minFrequency());
        assertEquals(50, dist.medianFrequency());
        assertEquals(Math.log(101), dist.maxLogFrequency(), 1e-12);
        assertEquals((Math.log(101) + Math.log(51) + Math.log(11)) / 3, dist.meanLogFrequency(), 1e-12);
        assertTrue(dist.logStdDev() > 0);
    }

    @Test
    @DisplayName("Rank is 1-based with the most common word first")
    void rank() {
        FrequencyDistribution dist = FrequencyDistribution.of(new long[]{10, 100, 50, 50});

        assertEquals(1, dist.rank(100));
        assertEquals(2, dist.rank(50));
        assertEquals(4, dist.rank(10));
        assertEquals(2, dist.rank(75));
        assertEquals(4, dist.rank(1));
    }
}
