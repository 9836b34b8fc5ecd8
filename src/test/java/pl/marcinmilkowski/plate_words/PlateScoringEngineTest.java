package pl.marcinmilkowski.plate_words;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import pl.marcinmilkowski.plate_words.config.ScoringConfigLoader;
import pl.marcinmilkowski.plate_words.corpus.Corpus;
import pl.marcinmilkowski.plate_words.corpus.Plate;
import pl.marcinmilkowski.plate_words.corpus.WordFrequency;
import pl.marcinmilkowski.plate_words.indexer.CorpusIndex;
import pl.marcinmilkowski.plate_words.indexer.CoverageMode;
import pl.marcinmilkowski.plate_words.matching.MatchMode;
import pl.marcinmilkowski.plate_words.ngram.NGramModel;
import pl.marcinmilkowski.plate_words.scoring.EnsembleResult;
import pl.marcinmilkowski.plate_words.scoring.EnsembleWeights;
import pl.marcinmilkowski.plate_words.scoring.FailureKind;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class PlateScoringEngineTest {

    private PlateScoringEngine engine;
    private Corpus corpus;

    @BeforeEach
    void setUp() {
        engine = new PlateScoringEngine(ScoringConfigLoader.fromJson(
            "{\"index\": {\"alphabet\": \"abct\", \"pattern_length\": 2, \"threads\": 2, \"batch_size\": 4}}"));
        Map<String, Integer> pairs = new LinkedHashMap<>();
        pairs.put("cat", 100);
        pairs.put("act", 50);
        pairs.put("tact", 10);
        corpus = engine.loadCorpus(pairs);
    }

    @Test
    @DisplayName("Each build and query operation works on explicit structures")
    void explicitOperations() throws InterruptedException {
        List<WordFrequency> solved = engine.solve(corpus, "act", MatchMode.SUBSEQUENCE);
        assertEquals(List.of(new WordFrequency("act", 50), new WordFrequency("tact", 10)), solved);

        CorpusIndex index = engine.buildCorpusIndex(corpus, 2, CoverageMode.FULL, null);
        assertEquals(16, index.size());
        NGramModel model = engine.buildNGramModel(corpus);

        assertTrue(engine.scoreFrequency(corpus, "tact").isSuccess());
        assertTrue(engine.scoreInformation(index, "tact", "ct").isSuccess());
        assertTrue(engine.scoreOrthographic(model, "tact").isSuccess());

        EnsembleResult result = engine.scoreEnsemble(corpus, index, model, "tact", "ct", EnsembleWeights.EQUAL);
        assertEquals(1.0, result.confidence(), 1e-12);
    }

    @Test
    void partialBuildNeedsSample() {
        assertThrows(IllegalArgumentException.class,
            () -> engine.buildCorpusIndex(corpus, 2, CoverageMode.PARTIAL, null));
    }

    @Test
    void currentBeforeBuildFails() {
        assertThrows(IllegalStateException.class, () -> engine.current());
        assertThrows(IllegalStateException.class, () -> engine.score("tact", "CT"));
    }

    @Test
    @DisplayName("Rebuild installs a complete snapshot used by score()")
    void rebuildInstallsSnapshot() throws InterruptedException {
        EngineSnapshot first = engine.rebuild(corpus, CoverageMode.PARTIAL, List.of(Plate.of("AT")));

        assertSame(first, engine.current());
        assertSame(corpus, first.corpus());
        assertEquals(CoverageMode.PARTIAL, first.index().coverage());
        assertEquals(FailureKind.UNCOVERED_PATTERN, engine.score("tact", "CT")
            .component("information").outcome().failure().kind());

        EngineSnapshot second = engine.rebuild(corpus, CoverageMode.FULL, null);

        assertNotSame(first, second);
        assertSame(second, engine.current());
        EnsembleResult result = engine.score("tact", "CT", EnsembleWeights.EQUAL);
        assertEquals(3, result.workingComponents());
    }

    @Test
    @DisplayName("Readers see a complete snapshot while a rebuild runs")
    void readersDuringRebuild() throws Exception {
        engine.rebuild(corpus, CoverageMode.FULL, null);
        AtomicBoolean running = new AtomicBoolean(true);
        ExecutorService readers = Executors.newFixedThreadPool(2);
        List<Future<Integer>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < 2; i++) {
                futures.add(readers.submit(() -> {
                    int reads = 0;
                    do {
                        EngineSnapshot snapshot = engine.current();
                        assertSame(snapshot.corpus(), snapshot.index().corpus());
                        assertEquals(3, engine.score("tact", "AT").workingComponents());
                        reads++;
                    } while (running.get());
                    return reads;
                }));
            }
            for (int i = 0; i < 3; i++) {
                engine.rebuild(corpus, CoverageMode.FULL, null);
            }
        } finally {
            running.set(false);
            readers.shutdown();
            assertTrue(readers.awaitTermination(30, TimeUnit.SECONDS));
        }
        for (Future<Integer> future : futures) {
            assertTrue(future.get() > 0);
        }
    }
}
