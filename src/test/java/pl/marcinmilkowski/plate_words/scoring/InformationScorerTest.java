package pl.marcinmilkowski.plate_words.scoring;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import pl.marcinmilkowski.plate_words.config.ScoringConfigLoader.IndexConfig;
import pl.marcinmilkowski.plate_words.corpus.Corpus;
import pl.marcinmilkowski.plate_words.corpus.Plate;
import pl.marcinmilkowski.plate_words.corpus.WordFrequency;
import pl.marcinmilkowski.plate_words.indexer.CorpusIndex;
import pl.marcinmilkowski.plate_words.indexer.CorpusIndexBuilder;
import pl.marcinmilkowski.plate_words.indexer.PlateStatistics;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InformationScorerTest {

    private static InformationScorer scorer;

    private static double log2(double x) {
        return Math.log(x) / Math.log(2);
    }

    @BeforeAll
    static void buildIndex() throws InterruptedException {
        Map<String, Integer> pairs = new LinkedHashMap<>();
        pairs.put("cat", 50);
        pairs.put("tact", 10);
        pairs.put("dog", 40);
        pairs.put("cot", 0);
        Corpus corpus = Corpus.of(pairs);
        IndexConfig config = new IndexConfig("abcdgot", 2, 2, 4, 1000);
        CorpusIndex index = new CorpusIndexBuilder(corpus, config)
            .buildPartial(2, List.of(Plate.of("CT"), Plate.of("DG")));
        scorer = new InformationScorer(index);
    }

    @Test
    @DisplayName("Bits are -log2 P(word | plate), normalized by log2 of the mass")
    void scoresSolution() {
        ScoreResult tact = scorer.score("tact", "ct").result();

        assertEquals(log2(6), tact.metric("information_bits"), 1e-12);
        assertEquals(1.0 / 6, tact.metric("probability"), 1e-12);
        assertEquals(log2(6) / log2(60) * 100, tact.score(), 1e-9);
        assertEquals(tact.score(), tact.component("normalized"), 1e-12);
        assertEquals(60.0, tact.metric("total_freq_mass"));
        assertEquals("CT", tact.plate());
        assertEquals("tact", tact.word());
    }

    @Test
    @DisplayName("The rarest solution sits at the top of the plate's percentile range")
    void percentileWithinPlate() {
        assertEquals(100.0, scorer.score("tact", "CT").result().component("percentile"), 1e-12);

        ScoreResult cat = scorer.score("cat", "CT").result();
        double avg = (log2(1.2) + log2(6)) / 2;
        assertEquals(50.0 * log2(1.2) / avg, cat.component("percentile"), 1e-9);
    }

    @Test
    void percentileInterpolation() {
        PlateStatistics stats = new PlateStatistics(100, 1.0, 3, 4.0, 1.0, 8.0);

        assertEquals(25.0, InformationScorer.percentileWithinPlate(2.0, stats), 1e-12);
        assertEquals(75.0, InformationScorer.percentileWithinPlate(6.0, stats), 1e-12);
        assertEquals(100.0, InformationScorer.percentileWithinPlate(9.0, stats), 1e-12);
        assertEquals(50.0, InformationScorer.percentileWithinPlate(3.0,
            new PlateStatistics(8, 0, 1, 3.0, 3.0, 3.0)), 1e-12);
    }

    @Test
    @DisplayName("A plate's only solution carries no information")
    void singleSolutionPlate() {
        ScoreResult dog = scorer.score("dog", "DG").result();

        assertEquals(0.0, dog.metric("information_bits"), 1e-12);
        assertEquals(0.0, dog.score(), 1e-12);
    }

    @Test
    @DisplayName("Failures are classified by cause")
    void classifiesFailures() {
        assertEquals(FailureKind.NOT_A_SOLUTION, scorer.score("dog", "CT").failure().kind());
        assertEquals(FailureKind.NOT_FOUND, scorer.score("zebra", "CT").failure().kind());
        assertEquals(FailureKind.NOT_FOUND, scorer.score("cot", "CT").failure().kind());
        assertEquals(FailureKind.UNCOVERED_PATTERN, scorer.score("cat", "AT").failure().kind());
        assertEquals(FailureKind.INVALID_INPUT, scorer.score("cat", "C").failure().kind());
        assertEquals(FailureKind.INVALID_INPUT, scorer.score("c4t", "CT").failure().kind());
    }

    @Test
    void topWordsByInformation() {
        List<WordFrequency> top = scorer.topWordsForPlate("ct", 5);

        assertEquals(List.of("tact", "cat"), top.stream().map(WordFrequency::word).toList());
        assertTrue(scorer.topWordsForPlate("AT", 5).isEmpty());
    }
}
