package pl.marcinmilkowski.plate_words.scoring;

import pl.marcinmilkowski.plate_words.config.ScoringConfigLoader.OrthographicConfig;
import pl.marcinmilkowski.plate_words.corpus.InvalidInputException;
import pl.marcinmilkowski.plate_words.corpus.Plate;
import pl.marcinmilkowski.plate_words.corpus.Word;
import pl.marcinmilkowski.plate_words.matching.Matchers;
import pl.marcinmilkowski.plate_words.ngram.NGramModel;

import java.util.*;

/**
 * Orthographic complexity of the whole candidate word.
 *
 * Average surprisal (-log2 p) of the word's boundary-padded bigrams and
 * trigrams is mapped linearly from fixed bounds (default [6, 12] and [7, 18]
 * bits) into [0, 100]. Unseen n-grams get the smoothing probability.
 * Combined = 0.4 * bigram + 0.6 * trigram.
 *
 * Unlike the other dimensions this one looks at every letter of the word,
 * not only the ones that matched the plate.
 */
public class OrthographicScorer implements DimensionScorer {

    public static final String DIMENSION = "orthographic";

    private final NGramModel model;
    private final OrthographicConfig config;

    public OrthographicScorer(NGramModel model, OrthographicConfig config) {
        this.model = model;
        this.config = config;
    }

    public OrthographicScorer(NGramModel model) {
        this(model, OrthographicConfig.defaults());
    }

    @Override
    public String dimension() {
        return DIMENSION;
    }

    /**
     * Plate-independent: the plate argument is ignored.
     */
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
        return ScoreOutcome.success(scoreNormalized(word, null, Map.of()));
    }

    /**
     * Score the word after checking that it solves the plate; the letters
     * that matched are reported in the details.
     */
    public ScoreOutcome scoreAgainstPlate(String rawWord, String rawPlate) {
        String word;
        Plate plate;
        try {
            word = Word.normalize(rawWord);
            plate = Plate.of(rawPlate);
        } catch (InvalidInputException e) {
            return ScoreOutcome.failure(DIMENSION, FailureKind.INVALID_INPUT, e.getMessage());
        }
        if (!Matchers.isSubsequence(plate.query(), word)) {
            return ScoreOutcome.failure(DIMENSION, FailureKind.NOT_A_SOLUTION,
                "Word '" + word + "' does not match plate '" + plate + "'");
        }
        return ScoreOutcome.success(scoreNormalized(word, plate.letters(),
            Map.of("matching_sequence", matchedLetters(plate.query(), word))));
    }

    private ScoreResult scoreNormalized(String word, String plate, Map<String, String> extraDetails) {
        Surprisal bigram = surprisal(word, 2);
        Surprisal trigram = surprisal(word, 3);

        double bigramScore = rescale(bigram.average(), config.bigramMin(), config.bigramMax());
        double trigramScore = rescale(trigram.average(), config.trigramMin(), config.trigramMax());
        double combined = ScoreResult.clamp(
            bigramScore * config.bigramWeight() + trigramScore * config.trigramWeight());

        Map<String, Double> components = new LinkedHashMap<>();
        components.put("bigram_complexity", bigramScore);
        components.put("trigram_complexity", trigramScore);
        components.put("combined_complexity", combined);

        Map<String, Double> metrics = new LinkedHashMap<>();
        metrics.put("avg_bigram_surprisal", bigram.average());
        metrics.put("avg_trigram_surprisal", trigram.average());
        metrics.put("total_bigram_surprisal", bigram.total());
        metrics.put("total_trigram_surprisal", trigram.total());
        metrics.put("word_length", (double) word.length());
        metrics.put("total_bigrams", (double) bigram.count());
        metrics.put("total_trigrams", (double) trigram.count());

        Map<String, String> details = new LinkedHashMap<>();
        details.put("bigram_patterns", describeBigrams(bigramScore));
        details.put("trigram_patterns", describeTrigrams(trigramScore));
        details.putAll(extraDetails);

        return new ScoreResult(DIMENSION, word, plate, combined, components, metrics,
            interpret(combined), details);
    }

    private Surprisal surprisal(String word, int n) {
        List<String> grams = NGramModel.extract(word, n);
        double total = 0;
        for (String gram : grams) {
            double p = model.probability(gram);
            total += -ScoreResult.log2(p > 0 ? p : config.smoothing());
        }
        return new Surprisal(total, grams.size());
    }

    private static double rescale(double value, double min, double max) {
        return ScoreResult.clamp((value - min) / (max - min) * 100);
    }

    /**
     * The word's letters consumed by a left-to-right subsequence match.
     */
    static String matchedLetters(String query, String word) {
        StringBuilder matched = new StringBuilder(query.length());
        int cursor = 0;
        for (int i = 0; i < word.length() && cursor < query.length(); i++) {
            if (word.charAt(i) == query.charAt(cursor)) {
                matched.append(word.charAt(i));
                cursor++;
            }
        }
        return matched.toString();
    }

    static String interpret(double combined) {
        if (combined >= 85) return "Extremely high orthographic complexity";
        if (combined >= 70) return "High orthographic complexity";
        if (combined >= 50) return "Moderate orthographic complexity";
        if (combined >= 30) return "Low orthographic complexity";
        return "Very low orthographic complexity";
    }

    private static String describeBigrams(double score) {
        if (score >= 80) return "Highly unusual bigram patterns";
        if (score >= 60) return "Somewhat unusual bigram patterns";
        if (score >= 40) return "Moderately natural bigram patterns";
        if (score >= 20) return "Fairly natural bigram patterns";
        return "Very natural bigram patterns";
    }

    private static String describeTrigrams(double score) {
        if (score >= 80) return "Highly complex trigram sequences";
        if (score >= 60) return "Moderately complex trigram sequences";
        if (score >= 40) return "Average trigram complexity";
        if (score >= 20) return "Simple trigram sequences";
        return "Very simple trigram sequences";
    }

    private record Surprisal(double total, int count) {
        double average() {
            return count > 0 ? total / count : 0.0;
        }
    }
}
