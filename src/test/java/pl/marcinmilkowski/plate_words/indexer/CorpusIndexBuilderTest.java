package pl.marcinmilkowski.plate_words.indexer;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import pl.marcinmilkowski.plate_words.config.ScoringConfigLoader.IndexConfig;
import pl.marcinmilkowski.plate_words.corpus.Corpus;
import pl.marcinmilkowski.plate_words.corpus.InvalidInputException;
import pl.marcinmilkowski.plate_words.corpus.Plate;
import pl.marcinmilkowski.plate_words.corpus.WordFrequency;
import pl.marcinmilkowski.plate_words.matching.MatchMode;
import pl.marcinmilkowski.plate_words.matching.Solver;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;

import static org.junit.jupiter.api.Assertions.*;

class CorpusIndexBuilderTest {

    private static final IndexConfig CONFIG = new IndexConfig("abct", 2, 2, 3, 5);

    private static Corpus corpus() {
        Map<String, Integer> pairs = new LinkedHashMap<>();
        pairs.put("cat", 100);
        pairs.put("act", 50);
        pairs.put("bat", 20);
        pairs.put("tact", 10);
        return Corpus.of(pairs);
    }

    @Test
    @DisplayName("Full build covers every plate over the alphabet")
    void buildsFullIndex() throws InterruptedException {
        CorpusIndex index = new CorpusIndexBuilder(corpus(), CONFIG).buildFull(2);

        assertEquals(16, index.size());
        assertEquals(CoverageMode.FULL, index.coverage());
        assertEquals(2, index.patternLength());
        assertEquals(0, index.failedPlateCount());

        SolutionSet at = index.solutionsFor(Plate.of("AT"));
        assertEquals(List.of("cat", "act", "bat", "tact"),
            at.solutions().stream().map(WordFrequency::word).toList());
        assertTrue(index.solutionsFor(Plate.of("AA")).isEmpty());
        assertTrue(index.isCovered(Plate.of("AA")));
    }

    @Test
    @DisplayName("Plate and word indexes agree in both directions")
    void indexesAreConsistent() throws InterruptedException {
        CorpusIndex index = new CorpusIndexBuilder(corpus(), CONFIG).buildFull(2);

        for (Plate plate : index.plates()) {
            for (WordFrequency wf : index.solutionsFor(plate).solutions()) {
                assertTrue(index.patternsFor(wf.word()).contains(plate), wf.word() + " / " + plate);
            }
        }
        for (String word : index.solvedWords()) {
            for (Plate plate : index.patternsFor(word)) {
                assertTrue(index.solutionsFor(plate).contains(word), word + " / " + plate);
            }
        }
        assertTrue(index.patternsFor("zebra").isEmpty());
    }

    @Test
    @DisplayName("Word lookup ignores case")
    void patternsForIgnoresCase() throws InterruptedException {
        CorpusIndex index = new CorpusIndexBuilder(corpus(), CONFIG).buildFull(2);

        assertFalse(index.patternsFor("cat").isEmpty());
        assertEquals(index.patternsFor("cat"), index.patternsFor("CAT"));
        assertEquals(index.patternsFor("tact"), index.patternsFor("TaCt"));
        assertTrue(index.patternsFor(null).isEmpty());
    }

    @Test
    @DisplayName("Solution sets match a direct solver call")
    void matchesSolver() throws InterruptedException {
        Corpus corpus = corpus();
        CorpusIndex index = new CorpusIndexBuilder(corpus, CONFIG).buildFull(2);
        Solver solver = new Solver(corpus);

        for (Plate plate : index.plates()) {
            assertEquals(solver.solve(plate.query(), MatchMode.SUBSEQUENCE),
                index.solutionsFor(plate).solutions(), plate.toString());
        }
    }

    @Test
    @DisplayName("Partial build covers only sampled plates of the requested length")
    void buildsPartialIndex() throws InterruptedException {
        List<Plate> sample = List.of(Plate.of("CT"), Plate.of("ct"), Plate.of("ABC"));

        CorpusIndex index = new CorpusIndexBuilder(corpus(), CONFIG).buildPartial(2, sample);

        assertEquals(CoverageMode.PARTIAL, index.coverage());
        assertEquals(1, index.size());
        assertTrue(index.isCovered(Plate.of("CT")));
        assertFalse(index.isCovered(Plate.of("AT")));
        assertNull(index.solutionsFor(Plate.of("AT")));
        assertEquals(3, index.solutionsFor(Plate.of("CT")).size());
    }

    @Test
    @DisplayName("A plate whose solve throws is stored as an empty failed set")
    void storesFailedPlates() throws InterruptedException {
        Solver failing = new Solver(corpus()) {
            @Override
            public List<WordFrequency> solve(String query, MatchMode mode) {
                if (query.equals("ab")) {
                    throw new IllegalStateException("boom");
                }
                return super.solve(query, mode);
            }
        };

        CorpusIndex index = new CorpusIndexBuilder(failing, CONFIG).buildFull(2);

        SolutionSet ab = index.solutionsFor(Plate.of("AB"));
        assertTrue(ab.failed());
        assertTrue(ab.isEmpty());
        assertEquals(1, index.failedPlateCount());
        assertEquals(16, index.size());
        assertFalse(index.solutionsFor(Plate.of("AT")).failed());
    }

    @Test
    @DisplayName("Thread count and batch size do not change the result")
    void deterministicAcrossThreads() throws InterruptedException {
        Corpus corpus = corpus();
        CorpusIndex single = new CorpusIndexBuilder(corpus, CONFIG.withThreads(1).withBatchSize(16)).buildFull(2);
        CorpusIndex parallel = new CorpusIndexBuilder(corpus, CONFIG.withThreads(4).withBatchSize(1)).buildFull(2);

        assertEquals(new ArrayList<>(single.plates()), new ArrayList<>(parallel.plates()));
        for (Plate plate : single.plates()) {
            assertEquals(single.solutionsFor(plate).solutions(), parallel.solutionsFor(plate).solutions());
        }
        assertEquals(single.solvedWords(), parallel.solvedWords());
    }

    @Test
    void rejectsOutOfRangeLength() {
        CorpusIndexBuilder builder = new CorpusIndexBuilder(corpus(), CONFIG);
        assertThrows(InvalidInputException.class, () -> builder.buildFull(1));
        assertThrows(InvalidInputException.class, () -> builder.buildPartial(9, List.of()));
    }

    @Test
    @DisplayName("A cancelled builder aborts instead of returning a partial index")
    void cancelAbortsBuild() {
        CorpusIndexBuilder builder = new CorpusIndexBuilder(corpus(), CONFIG);
        builder.cancel();

        assertTrue(builder.isCancelled());
        assertThrows(CancellationException.class, () -> builder.buildFull(2));
    }
}
