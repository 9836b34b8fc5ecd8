package pl.marcinmilkowski.plate_words.scoring;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Weighted, failure-tolerant combination of the three dimensions.
 *
 * Weights are normalized to sum to 1. A failing dimension contributes 0 and
 * lowers confidence (working / 3), but its weight is not redistributed: the
 * score is the plain sum of working contributions. Set {@code renormalizeMissing}
 * to divide by the sum of working weights instead.
 */
public class EnsembleScorer {

    private static final Logger logger = LoggerFactory.getLogger(EnsembleScorer.class);

    private static final int DIMENSIONS = 3;

    private final FrequencyScorer frequency;
    private final InformationScorer information;
    private final OrthographicScorer orthographic;
    private final boolean renormalizeMissing;

    public EnsembleScorer(FrequencyScorer frequency, InformationScorer information,
                          OrthographicScorer orthographic, boolean renormalizeMissing) {
        this.frequency = frequency;
        this.information = information;
        this.orthographic = orthographic;
        this.renormalizeMissing = renormalizeMissing;
    }

    public EnsembleScorer(FrequencyScorer frequency, InformationScorer information,
                          OrthographicScorer orthographic) {
        this(frequency, information, orthographic, false);
    }

    /**
     * @throws IllegalArgumentException if every weight is zero
     * @throws AllScorersFailedException if no dimension produced a score
     */
    public EnsembleResult score(String word, String plate, EnsembleWeights weights) {
        EnsembleWeights normalized = weights.normalized();

        List<ComponentScore> components = new ArrayList<>(DIMENSIONS);
        components.add(new ComponentScore(FrequencyScorer.DIMENSION, normalized.frequency(),
            frequency.score(word, plate)));
        components.add(new ComponentScore(InformationScorer.DIMENSION, normalized.information(),
            information.score(word, plate)));
        components.add(new ComponentScore(OrthographicScorer.DIMENSION, normalized.orthographic(),
            orthographic.score(word, plate)));

        int working = 0;
        double sum = 0;
        double workingWeight = 0;
        List<ScoreFailure> failures = new ArrayList<>();
        for (ComponentScore c : components) {
            if (c.working()) {
                working++;
                sum += c.weightedContribution();
                workingWeight += c.weight();
            } else {
                failures.add(c.outcome().failure());
            }
        }

        if (working == 0) {
            throw new AllScorersFailedException(word, plate, failures);
        }
        if (!failures.isEmpty()) {
            logger.debug("Ensemble for '{}'/'{}' degraded: {}", word, plate, failures);
        }

        double score = sum;
        if (renormalizeMissing && workingWeight > 0) {
            score = sum / workingWeight;
        }
        score = ScoreResult.clamp(score);

        String normalizedWord = firstWord(components, word);
        String normalizedPlate = plate == null ? null : plate.trim().toUpperCase(Locale.ROOT);
        return new EnsembleResult(normalizedWord, normalizedPlate, score,
            (double) working / DIMENSIONS, working, normalized, renormalizeMissing,
            components, interpret(score));
    }

    public EnsembleResult score(String word, String plate) {
        return score(word, plate, EnsembleWeights.EQUAL);
    }

    private static String firstWord(List<ComponentScore> components, String fallback) {
        for (ComponentScore c : components) {
            if (c.working()) {
                return c.outcome().result().word();
            }
        }
        return fallback;
    }

    static String interpret(double score) {
        if (score >= 80) return "Exceptional solution";
        if (score >= 60) return "Impressive solution";
        if (score >= 40) return "Solid solution";
        if (score >= 20) return "Ordinary solution";
        return "Predictable solution";
    }
}
