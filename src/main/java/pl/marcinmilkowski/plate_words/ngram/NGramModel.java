package pl.marcinmilkowski.plate_words.ngram;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;

import java.util.*;

/**
 * Frequency-weighted letter bigram and trigram probabilities.
 *
 * Words are padded with {@value #START} and {@value #END} before n-grams are
 * extracted, so "cat" yields bigrams ^c, ca, at, t$ and trigrams ^ca, cat, at$.
 * Every stored probability is in (0, 1]; unseen n-grams are simply absent.
 */
public final class NGramModel {

    public static final char START = '^';
    public static final char END = '$';

    private final Map<String, Double> bigrams;
    private final Map<String, Double> trigrams;
    private final Map<String, Long> bigramCounts;
    private final Map<String, Long> trigramCounts;
    private final long totalBigrams;
    private final long totalTrigrams;
    private final int corpusWords;

    NGramModel(Map<String, Long> bigramCounts, Map<String, Long> trigramCounts, int corpusWords) {
        this.bigramCounts = Collections.unmodifiableMap(new HashMap<>(bigramCounts));
        this.trigramCounts = Collections.unmodifiableMap(new HashMap<>(trigramCounts));
        this.totalBigrams = sum(bigramCounts);
        this.totalTrigrams = sum(trigramCounts);
        this.bigrams = toProbabilities(bigramCounts, totalBigrams);
        this.trigrams = toProbabilities(trigramCounts, totalTrigrams);
        this.corpusWords = corpusWords;
    }

    /**
     * Boundary-padded n-grams of a word, left to right.
     */
    public static List<String> extract(String word, int n) {
        String padded = START + word + END;
        if (padded.length() < n) {
            return List.of();
        }
        List<String> grams = new ArrayList<>(padded.length() - n + 1);
        for (int i = 0; i + n <= padded.length(); i++) {
            grams.add(padded.substring(i, i + n));
        }
        return grams;
    }

    /**
     * Probability of a bigram or trigram, or 0 if it was never seen.
     */
    public double probability(String ngram) {
        Map<String, Double> table = tableFor(ngram.length());
        return table.getOrDefault(ngram, 0.0);
    }

    public Map<String, Double> bigramProbabilities() {
        return bigrams;
    }

    public Map<String, Double> trigramProbabilities() {
        return trigrams;
    }

    public long totalBigrams() {
        return totalBigrams;
    }

    public long totalTrigrams() {
        return totalTrigrams;
    }

    public int corpusWords() {
        return corpusWords;
    }

    /**
     * Shannon entropy (bits) of the bigram (n=2) or trigram (n=3) distribution.
     */
    public double entropy(int n) {
        double h = 0;
        for (double p : tableFor(n).values()) {
            h -= p * Math.log(p) / Math.log(2);
        }
        return h;
    }

    /**
     * The {@code limit} most frequent n-grams of order n, ties broken alphabetically.
     */
    public List<Map.Entry<String, Long>> mostCommon(int n, int limit) {
        Map<String, Long> counts = n == 2 ? bigramCounts : trigramCounts;
        return counts.entrySet().stream()
            .sorted(Map.Entry.<String, Long>comparingByValue().reversed()
                .thenComparing(Map.Entry.<String, Long>comparingByKey()))
            .limit(limit)
            .map(e -> Map.entry(e.getKey(), e.getValue()))
            .toList();
    }

    /**
     * Model statistics for reporting.
     */
    public JSONObject statsJson() {
        JSONObject obj = new JSONObject();
        obj.put("corpus_words", corpusWords);
        obj.put("total_unique_bigrams", bigrams.size());
        obj.put("total_unique_trigrams", trigrams.size());
        obj.put("total_bigrams", totalBigrams);
        obj.put("total_trigrams", totalTrigrams);
        obj.put("bigram_entropy", entropy(2));
        obj.put("trigram_entropy", entropy(3));
        obj.put("most_common_bigrams", toJsonArray(mostCommon(2, 20)));
        obj.put("most_common_trigrams", toJsonArray(mostCommon(3, 20)));
        return obj;
    }

    private Map<String, Double> tableFor(int n) {
        if (n == 2) return bigrams;
        if (n == 3) return trigrams;
        throw new IllegalArgumentException("Only bigrams and trigrams are modelled, got n=" + n);
    }

    private static JSONArray toJsonArray(List<Map.Entry<String, Long>> entries) {
        JSONArray array = new JSONArray();
        for (Map.Entry<String, Long> e : entries) {
            JSONArray pair = new JSONArray();
            pair.add(e.getKey());
            pair.add(e.getValue());
            array.add(pair);
        }
        return array;
    }

    private static long sum(Map<String, Long> counts) {
        long total = 0;
        for (long c : counts.values()) total += c;
        return total;
    }

    private static Map<String, Double> toProbabilities(Map<String, Long> counts, long total) {
        Map<String, Double> probs = new HashMap<>(counts.size() * 2);
        if (total > 0) {
            for (Map.Entry<String, Long> e : counts.entrySet()) {
                if (e.getValue() > 0) {
                    probs.put(e.getKey(), (double) e.getValue() / total);
                }
            }
        }
        return Collections.unmodifiableMap(probs);
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "NGramModel[%d bigrams, %d trigrams from %d words]",
            bigrams.size(), trigrams.size(), corpusWords);
    }
}
