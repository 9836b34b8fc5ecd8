package pl.marcinmilkowski.plate_words.scoring;

import pl.marcinmilkowski.plate_words.config.ScoringConfigLoader.FrequencyConfig;
import pl.marcinmilkowski.plate_words.corpus.Corpus;
import pl.marcinmilkowski.plate_words.corpus.FrequencyDistribution;
import pl.marcinmilkowski.plate_words.corpus.InvalidInputException;
import pl.marcinmilkowski.plate_words.corpus.Word;
import pl.marcinmilkowski.plate_words.corpus.WordFrequency;

import java.util.*;

/**
 * Rarity of a word over the global corpus frequency distribution.
 *
 * Three sub-scores, all with higher = rarer:
 * 1. inverse frequency: (maxLog - log) / maxLog * 100
 * 2. percentile rarity: 100 - first percentile whose threshold the frequency reaches
 * 3. z-score rarity: z = (meanLog - log) / sdLog, mapped from [-3, 3] to [0, 100]
 *
 * log is ln(freq + 1). The combined score weights them 0.4 / 0.4 / 0.2 by default.
 */
public class FrequencyScorer implements DimensionScorer {

    public static final String DIMENSION = "frequency";

    private final Corpus corpus;
    private final FrequencyConfig config;

    public FrequencyScorer(Corpus corpus, FrequencyConfig config) {
        this.corpus = corpus;
        this.config = config;
    }

    public FrequencyScorer(Corpus corpus) {
        this(corpus, FrequencyConfig.defaults());
    }

    @Override
    public String dimension() {
        return DIMENSION;
    }

    @Override
    public ScoreOutcome score(String word, String plate) {
        return score(word);
    }

    public ScoreOutcome score(String rawWord) {
        String word;
        try {
            word = Word.normalize(rawWord);
        } catch (InvalidInputException e) {
            return ScoreOutcome.failure(DIMENSION, FailureKind.INVALID_INPUT, e.getMessage());
        }

        long frequency = corpus.frequency(word);
        if (frequency <= 0) {
            return ScoreOutcome.failure(DIMENSION, FailureKind.NOT_FOUND,
                "Word '" + word + "' not found in corpus");
        }

        FrequencyDistribution dist = corpus.distribution();
        double logFrequency = Math.log1p(frequency);

        double maxLog = dist.maxLogFrequency();
        double inverse = maxLog > 0 ? ScoreResult.clamp((maxLog - logFrequency) / maxLog * 100) : 0.0;

        double percentile = ScoreResult.clamp(dist.rarityPercentile(frequency));

        double sd = dist.logStdDev();
        double zScore = sd > 0 ? (dist.meanLogFrequency() - logFrequency) / sd : 0.0;
        double zScoreRarity = ScoreResult.clamp((zScore + 3) / 6 * 100);

        double combined = ScoreResult.clamp(
            inverse * config.inverseWeight()
                + percentile * config.percentileWeight()
                + zScoreRarity * config.zScoreWeight());

        Map<String, Double> components = new LinkedHashMap<>();
        components.put("inverse_frequency", inverse);
        components.put("percentile_rarity", percentile);
        components.put("z_score_rarity", zScoreRarity);
        components.put("combined", combined);

        Map<String, Double> metrics = new LinkedHashMap<>();
        metrics.put("frequency", (double) frequency);
        metrics.put("log_frequency", logFrequency);
        metrics.put("z_score", zScore);
        metrics.put("frequency_rank", (double) dist.rank(frequency));
        metrics.put("total_corpus_words", (double) dist.totalWords());
        metrics.put("corpus_frequency_percentile", 100.0 - percentile);

        Map<String, String> details = new LinkedHashMap<>();
        details.put("inverse_frequency", describeInverse(inverse));
        details.put("percentile", describePercentile(percentile));
        details.put("frequency_bracket", frequencyBracket(frequency));

        return ScoreOutcome.success(new ScoreResult(DIMENSION, word, null, combined,
            components, metrics, interpret(combined), details));
    }

    /**
     * The {@code limit} least frequent words with nonzero frequency, rarest first.
     * Equal frequencies keep corpus order.
     */
    public List<WordFrequency> rarestWords(int limit) {
        return corpus.entries().stream()
            .filter(wf -> wf.frequency() > 0)
            .sorted(Comparator.comparingLong(WordFrequency::frequency))
            .limit(limit)
            .toList();
    }

    static String interpret(double combined) {
        if (combined >= 90) return "extremely rare";
        if (combined >= 70) return "very rare";
        if (combined >= 50) return "rare";
        if (combined >= 35) return "uncommon";
        if (combined >= 20) return "common";
        return "very common";
    }

    private static String describeInverse(double inverse) {
        if (inverse >= 90) return "Extremely rare word";
        if (inverse >= 80) return "Very rare word (sophisticated vocabulary)";
        if (inverse >= 60) return "Uncommon word (above average vocabulary)";
        if (inverse >= 40) return "Moderately common word";
        if (inverse >= 20) return "Common word (everyday vocabulary)";
        return "Very common word (basic vocabulary)";
    }

    private static String describePercentile(double percentile) {
        if (percentile >= 95) return "Top 5% rarest words";
        if (percentile >= 90) return "Top 10% rarest words";
        if (percentile >= 75) return "Top 25% rarest words";
        if (percentile >= 50) return "Above median rarity";
        if (percentile >= 25) return "Below median rarity";
        return "Very common word";
    }

    static String frequencyBracket(long frequency) {
        if (frequency >= 100_000) return "Ultra-high frequency (core vocabulary)";
        if (frequency >= 10_000) return "High frequency (common words)";
        if (frequency >= 1_000) return "Medium frequency (familiar words)";
        if (frequency >= 100) return "Low frequency (less familiar)";
        if (frequency >= 10) return "Very low frequency (rare words)";
        return "Ultra-low frequency (very rare words)";
    }
}
