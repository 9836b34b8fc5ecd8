package pl.marcinmilkowski.plate_words;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.plate_words.config.ScoringConfigLoader;
import pl.marcinmilkowski.plate_words.corpus.Corpus;
import pl.marcinmilkowski.plate_words.corpus.Plate;
import pl.marcinmilkowski.plate_words.corpus.WordFrequency;
import pl.marcinmilkowski.plate_words.indexer.CorpusIndex;
import pl.marcinmilkowski.plate_words.indexer.CorpusIndexBuilder;
import pl.marcinmilkowski.plate_words.indexer.CoverageMode;
import pl.marcinmilkowski.plate_words.matching.MatchMode;
import pl.marcinmilkowski.plate_words.matching.Solver;
import pl.marcinmilkowski.plate_words.ngram.NGramModel;
import pl.marcinmilkowski.plate_words.ngram.NGramModelBuilder;
import pl.marcinmilkowski.plate_words.scoring.*;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Entry point to the matching and scoring engine.
 *
 * The build operations (corpus index, n-gram model) are slow batch jobs and
 * should run at startup or on an explicit rebuild. The query operations are
 * read-only and safe to call concurrently.
 *
 * {@link #rebuild} assembles a complete {@link EngineSnapshot} and installs it
 * with a single reference swap, so readers of {@link #current()} see either the
 * old snapshot or the new one, never a partial build.
 */
public class PlateScoringEngine {

    private static final Logger logger = LoggerFactory.getLogger(PlateScoringEngine.class);

    private final ScoringConfigLoader config;
    private final AtomicReference<EngineSnapshot> snapshot = new AtomicReference<>();

    public PlateScoringEngine(ScoringConfigLoader config) {
        this.config = config;
    }

    public PlateScoringEngine() {
        this(ScoringConfigLoader.createDefault());
    }

    public ScoringConfigLoader getConfig() {
        return config;
    }

    // --- build phase ---

    public Corpus loadCorpus(Map<String, ? extends Number> wordFrequencyPairs) {
        return Corpus.of(wordFrequencyPairs);
    }

    /**
     * @param samplePlates required for {@link CoverageMode#PARTIAL}, ignored for FULL
     */
    public CorpusIndex buildCorpusIndex(Corpus corpus, int patternLength, CoverageMode mode,
                                        Collection<Plate> samplePlates) throws InterruptedException {
        CorpusIndexBuilder builder = new CorpusIndexBuilder(corpus, config.getIndex());
        if (mode == CoverageMode.FULL) {
            return builder.buildFull(patternLength);
        }
        if (samplePlates == null) {
            throw new IllegalArgumentException("Partial coverage needs sample plates");
        }
        return builder.buildPartial(patternLength, samplePlates);
    }

    public NGramModel buildNGramModel(Corpus corpus) throws InterruptedException {
        return new NGramModelBuilder(config.getIndex().threads()).build(corpus);
    }

    /**
     * Build every structure for a corpus and install them atomically.
     */
    public EngineSnapshot rebuild(Corpus corpus, CoverageMode mode, Collection<Plate> samplePlates)
            throws InterruptedException {
        long start = System.currentTimeMillis();
        int length = config.getIndex().patternLength();
        CorpusIndex index = buildCorpusIndex(corpus, length, mode, samplePlates);
        NGramModel model = buildNGramModel(corpus);
        EngineSnapshot built = new EngineSnapshot(corpus, index, model,
            ensemble(corpus, index, model), Instant.now());

        EngineSnapshot previous = snapshot.getAndSet(built);
        logger.info("Installed new engine snapshot in {} ms: {} ({})",
            System.currentTimeMillis() - start, index, previous == null ? "first build" : "replaced previous");
        return built;
    }

    /**
     * The installed snapshot.
     *
     * @throws IllegalStateException if nothing has been built yet
     */
    public EngineSnapshot current() {
        EngineSnapshot current = snapshot.get();
        if (current == null) {
            throw new IllegalStateException("Engine has not been built; call rebuild() first");
        }
        return current;
    }

    // --- query phase ---

    public List<WordFrequency> solve(Corpus corpus, String pattern, MatchMode mode) {
        return new Solver(corpus).solve(pattern, mode);
    }

    public ScoreOutcome scoreFrequency(Corpus corpus, String word) {
        return new FrequencyScorer(corpus, config.getFrequency()).score(word);
    }

    public ScoreOutcome scoreInformation(CorpusIndex index, String word, String plate) {
        return new InformationScorer(index).score(word, plate);
    }

    public ScoreOutcome scoreOrthographic(NGramModel model, String word) {
        return new OrthographicScorer(model, config.getOrthographic()).score(word);
    }

    /**
     * @throws AllScorersFailedException if no dimension produced a score
     */
    public EnsembleResult scoreEnsemble(Corpus corpus, CorpusIndex index, NGramModel model,
                                        String word, String plate, EnsembleWeights weights) {
        return ensemble(corpus, index, model).score(word, plate, weights);
    }

    /**
     * Score against the installed snapshot with the configured default weights.
     */
    public EnsembleResult score(String word, String plate) {
        return current().ensemble().score(word, plate, EnsembleWeights.from(config.getEnsemble()));
    }

    public EnsembleResult score(String word, String plate, EnsembleWeights weights) {
        return current().ensemble().score(word, plate, weights);
    }

    private EnsembleScorer ensemble(Corpus corpus, CorpusIndex index, NGramModel model) {
        return new EnsembleScorer(
            new FrequencyScorer(corpus, config.getFrequency()),
            new InformationScorer(index),
            new OrthographicScorer(model, config.getOrthographic()),
            config.getEnsemble().renormalizeMissing());
    }
}
