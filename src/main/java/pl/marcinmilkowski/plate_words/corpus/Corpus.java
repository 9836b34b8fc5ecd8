package pl.marcinmilkowski.plate_words.corpus;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.ObjLongConsumer;

/**
 * Immutable word to frequency vocabulary.
 *
 * Words are stored in insertion order, which is also the tie-break order
 * wherever results are sorted by frequency. The frequency distribution used
 * by the rarity scorer is computed once, at construction.
 *
 * Usage:
 *   Corpus corpus = Corpus.builder()
 *       .add("cat", 100)
 *       .add("act", 50)
 *       .build();
 */
public final class Corpus {

    private static final Logger logger = LoggerFactory.getLogger(Corpus.class);

    private final String[] words;
    private final long[] frequencies;
    private final Map<String, Integer> positions;
    private final FrequencyDistribution distribution;
    private final int skippedEntries;

    private Corpus(String[] words, long[] frequencies, Map<String, Integer> positions, int skippedEntries) {
        this.words = words;
        this.frequencies = frequencies;
        this.positions = positions;
        this.skippedEntries = skippedEntries;
        this.distribution = FrequencyDistribution.of(frequencies);
    }

    /**
     * Build a corpus from a word to frequency map, keeping the map's iteration order.
     */
    public static Corpus of(Map<String, ? extends Number> pairs) {
        Builder builder = builder();
        for (Map.Entry<String, ? extends Number> e : pairs.entrySet()) {
            Number value = e.getValue();
            builder.add(e.getKey(), value == null ? 0L : value.longValue());
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Frequency of a word, or 0 if absent. The lookup is case-insensitive.
     */
    public long frequency(String word) {
        if (word == null) return 0;
        Integer pos = positions.get(word.toLowerCase(Locale.ROOT));
        return pos != null ? frequencies[pos] : 0;
    }

    public boolean contains(String word) {
        return word != null && positions.containsKey(word.toLowerCase(Locale.ROOT));
    }

    /**
     * Number of distinct words.
     */
    public int size() {
        return words.length;
    }

    public boolean isEmpty() {
        return words.length == 0;
    }

    public String wordAt(int index) {
        return words[index];
    }

    public long frequencyAt(int index) {
        return frequencies[index];
    }

    /**
     * Visit every entry in insertion order.
     */
    public void forEach(ObjLongConsumer<String> visitor) {
        for (int i = 0; i < words.length; i++) {
            visitor.accept(words[i], frequencies[i]);
        }
    }

    /**
     * All entries in insertion order (read-only).
     */
    public List<WordFrequency> entries() {
        List<WordFrequency> list = new ArrayList<>(words.length);
        for (int i = 0; i < words.length; i++) {
            list.add(new WordFrequency(words[i], frequencies[i]));
        }
        return Collections.unmodifiableList(list);
    }

    public FrequencyDistribution distribution() {
        return distribution;
    }

    /**
     * Number of input entries dropped because they were not alphabetic.
     */
    public int skippedEntries() {
        return skippedEntries;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "Corpus[%d words, max freq=%d]",
            words.length, distribution.maxFrequency());
    }

    /**
     * Accumulates entries; duplicate words (after normalization) have their
     * frequencies summed.
     */
    public static final class Builder {

        private static final int MAX_LOGGED_SKIPS = 5;

        private final LinkedHashMap<String, Long> entries = new LinkedHashMap<>();
        private int skipped = 0;

        private Builder() {
        }

        /**
         * Add a word. Non-alphabetic entries are skipped and counted.
         *
         * @throws IllegalArgumentException if the frequency is negative
         */
        public Builder add(String word, long frequency) {
            if (frequency < 0) {
                throw new IllegalArgumentException("Negative frequency for '" + word + "': " + frequency);
            }
            String normalized = word == null ? "" : word.trim().toLowerCase(Locale.ROOT);
            if (!Word.isAlphabetic(normalized)) {
                skipped++;
                if (skipped <= MAX_LOGGED_SKIPS) {
                    logger.warn("Skipping non-alphabetic corpus entry '{}'", word);
                }
                return this;
            }
            entries.merge(normalized, frequency, Long::sum);
            return this;
        }

        public Corpus build() {
            int n = entries.size();
            String[] words = new String[n];
            long[] frequencies = new long[n];
            Map<String, Integer> positions = new HashMap<>(n * 2);
            int i = 0;
            for (Map.Entry<String, Long> e : entries.entrySet()) {
                words[i] = e.getKey();
                frequencies[i] = e.getValue();
                positions.put(e.getKey(), i);
                i++;
            }
            if (skipped > 0) {
                logger.debug("Corpus build skipped {} non-alphabetic entries", skipped);
            }
            return new Corpus(words, frequencies, Collections.unmodifiableMap(positions), skipped);
        }
    }
}
