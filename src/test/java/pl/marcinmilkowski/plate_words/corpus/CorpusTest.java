package pl.marcinmilkowski.plate_words.corpus;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CorpusTest {

    @Test
    @DisplayName("Duplicate words after normalization have their frequencies summed")
    void sumsDuplicates() {
        Corpus corpus = Corpus.builder()
            .add("Cat", 3)
            .add("cat ", 2)
            .add("act", 1)
            .build();

        assertEquals(2, corpus.size());
        assertEquals(5, corpus.frequency("cat"));
        assertEquals(5, corpus.frequency("CAT"));
    }

    @Test
    @DisplayName("Non-alphabetic entries are skipped and counted")
    void skipsNonAlphabetic() {
        Corpus corpus = Corpus.builder()
            .add("don't", 5)
            .add("r2d2", 1)
            .add("", 1)
            .add(null, 1)
            .add("ok", 7)
            .build();

        assertEquals(1, corpus.size());
        assertEquals(4, corpus.skippedEntries());
        assertTrue(corpus.contains("ok"));
    }

    @Test
    void rejectsNegativeFrequency() {
        Corpus.Builder builder = Corpus.builder();
        assertThrows(IllegalArgumentException.class, () -> builder.add("cat", -1));
    }

    @Test
    @DisplayName("Entries keep insertion order")
    void keepsInsertionOrder() {
        Map<String, Integer> pairs = new LinkedHashMap<>();
        pairs.put("zebra", 1);
        pairs.put("apple", 10);
        pairs.put("mango", 5);

        Corpus corpus = Corpus.of(pairs);

        List<WordFrequency> entries = corpus.entries();
        assertEquals("zebra", entries.get(0).word());
        assertEquals("apple", entries.get(1).word());
        assertEquals("mango", entries.get(2).word());
        assertEquals("apple", corpus.wordAt(1));
        assertEquals(10, corpus.frequencyAt(1));
        assertThrows(UnsupportedOperationException.class,
            () -> entries.add(new WordFrequency("x", 1)));
    }

    @Test
    void absentWordsHaveZeroFrequency() {
        Corpus corpus = Corpus.of(Map.of("cat", 100));
        assertEquals(0, corpus.frequency("dog"));
        assertEquals(0, corpus.frequency(null));
        assertFalse(corpus.contains(null));
    }

    @Test
    void nullFrequencyCountsAsZero() {
        Map<String, Long> pairs = new HashMap<>();
        pairs.put("cot", null);
        Corpus corpus = Corpus.of(pairs);
        assertTrue(corpus.contains("cot"));
        assertEquals(0, corpus.frequency("cot"));
    }

    @Test
    void forEachVisitsEveryEntry() {
        Corpus corpus = Corpus.of(Map.of("cat", 100, "act", 50));
        long[] total = {0};
        corpus.forEach((word, frequency) -> total[0] += frequency);
        assertEquals(150, total[0]);
    }

    @Test
    void emptyCorpus() {
        Corpus corpus = Corpus.builder().build();
        assertTrue(corpus.isEmpty());
        assertEquals(0, corpus.distribution().totalWords());
    }
}
