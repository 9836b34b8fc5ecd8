package pl.marcinmilkowski.plate_words.scoring;

import pl.marcinmilkowski.plate_words.corpus.InvalidInputException;
import pl.marcinmilkowski.plate_words.corpus.Plate;
import pl.marcinmilkowski.plate_words.corpus.Word;
import pl.marcinmilkowski.plate_words.corpus.WordFrequency;
import pl.marcinmilkowski.plate_words.indexer.CorpusIndex;
import pl.marcinmilkowski.plate_words.indexer.PlateStatistics;
import pl.marcinmilkowski.plate_words.indexer.SolutionSet;

import java.util.*;

/**
 * Shannon information content of choosing a word among a plate's solutions.
 *
 * P(word | plate) = freq(word) / M, M = total frequency of the plate's
 * solutions; information = -log2 P bits. The normalized score divides by the
 * plate's maximum possible information, log2(M). Plate statistics come from
 * the {@link CorpusIndex}, so scoring is a constant-time lookup.
 */
public class InformationScorer implements DimensionScorer {

    public static final String DIMENSION = "information";

    private final CorpusIndex index;

    public InformationScorer(CorpusIndex index) {
        this.index = index;
    }

    @Override
    public String dimension() {
        return DIMENSION;
    }

    @Override
    public ScoreOutcome score(String rawWord, String rawPlate) {
        String word;
        Plate plate;
        try {
            plate = Plate.of(rawPlate);
            word = Word.normalize(rawWord);
        } catch (InvalidInputException e) {
            return ScoreOutcome.failure(DIMENSION, FailureKind.INVALID_INPUT, e.getMessage());
        }

        SolutionSet solutions = index.solutionsFor(plate);
        if (solutions == null) {
            return ScoreOutcome.failure(DIMENSION, FailureKind.UNCOVERED_PATTERN,
                "Plate '" + plate + "' is not covered by the " + index.coverage() + " corpus index");
        }
        if (index.corpus().frequency(word) <= 0) {
            return ScoreOutcome.failure(DIMENSION, FailureKind.NOT_FOUND,
                "Word '" + word + "' not found in corpus");
        }
        OptionalDouble bitsValue = solutions.informationBits(word);
        if (bitsValue.isEmpty()) {
            String reason = solutions.failed()
                ? " (solving this plate failed during the index build)" : "";
            return ScoreOutcome.failure(DIMENSION, FailureKind.NOT_A_SOLUTION,
                "Word '" + word + "' is not a solution for plate '" + plate + "'" + reason);
        }

        double bits = bitsValue.getAsDouble();
        PlateStatistics stats = solutions.statistics();
        double maxPossible = stats.maxPossibleBits();
        double normalized = maxPossible > 0 ? ScoreResult.clamp(bits / maxPossible * 100) : 0.0;
        double percentile = ScoreResult.clamp(percentileWithinPlate(bits, stats));
        long frequency = solutions.frequency(word);

        Map<String, Double> components = new LinkedHashMap<>();
        components.put("normalized", normalized);
        components.put("percentile", percentile);

        Map<String, Double> metrics = new LinkedHashMap<>();
        metrics.put("information_bits", bits);
        metrics.put("probability", Math.pow(2, -bits));
        metrics.put("corpus_frequency", (double) frequency);
        metrics.put("log_corpus_frequency", Math.log1p(frequency));
        metrics.put("plate_entropy", stats.entropy());
        metrics.put("plate_solutions", (double) stats.solutionCount());
        metrics.put("avg_info_bits", stats.averageBits());
        metrics.put("min_info_bits", stats.minBits());
        metrics.put("max_info_bits", stats.maxBits());
        metrics.put("total_freq_mass", (double) stats.totalFrequencyMass());

        Map<String, String> details = new LinkedHashMap<>();
        details.put("information", describeBits(bits));
        details.put("relative", describeRelative(bits, stats.averageBits()));

        return ScoreOutcome.success(new ScoreResult(DIMENSION, word, plate.letters(), normalized,
            components, metrics, interpret(normalized), details));
    }

    /**
     * Solutions of a covered plate ordered by information content, highest first.
     * Empty for uncovered plates.
     *
     * @throws InvalidInputException if the plate is malformed
     */
    public List<WordFrequency> topWordsForPlate(String rawPlate, int limit) {
        SolutionSet solutions = index.solutionsFor(Plate.of(rawPlate));
        if (solutions == null) {
            return List.of();
        }
        // lower frequency means more bits; ties keep solver order
        return solutions.solutions().stream()
            .filter(wf -> wf.frequency() > 0)
            .sorted(Comparator.comparingLong(WordFrequency::frequency))
            .limit(limit)
            .toList();
    }

    /**
     * Linear interpolation: 0..50 up to the plate average, 50..100 from average to max.
     */
    static double percentileWithinPlate(double bits, PlateStatistics stats) {
        double avg = stats.averageBits();
        double max = stats.maxBits();
        if (max <= avg) {
            return 50.0;
        }
        if (bits >= max) {
            return 100.0;
        }
        if (bits <= avg) {
            return avg > 0 ? 50.0 * (bits / avg) : 0.0;
        }
        return 50.0 + 50.0 * ((bits - avg) / (max - avg));
    }

    static String interpret(double normalized) {
        if (normalized >= 80) return "Exceptional information content";
        if (normalized >= 60) return "High information content";
        if (normalized >= 40) return "Moderate information content";
        if (normalized >= 20) return "Low information content";
        return "Very predictable choice";
    }

    private static String describeBits(double bits) {
        if (bits >= 15) return "Extremely informative choice (very surprising)";
        if (bits >= 10) return "Highly informative choice (quite surprising)";
        if (bits >= 7) return "Moderately informative choice";
        if (bits >= 4) return "Somewhat predictable choice";
        return "Highly predictable choice";
    }

    private static String describeRelative(double bits, double avg) {
        if (bits > avg * 1.5) return "Well above average for this plate";
        if (bits > avg * 1.1) return "Above average for this plate";
        if (bits > avg * 0.9) return "About average for this plate";
        if (bits > avg * 0.5) return "Below average for this plate";
        return "Well below average for this plate";
    }
}
