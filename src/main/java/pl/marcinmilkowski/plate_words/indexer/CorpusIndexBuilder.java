package pl.marcinmilkowski.plate_words.indexer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.plate_words.config.ScoringConfigLoader.IndexConfig;
import pl.marcinmilkowski.plate_words.corpus.Corpus;
import pl.marcinmilkowski.plate_words.corpus.InvalidInputException;
import pl.marcinmilkowski.plate_words.corpus.Plate;
import pl.marcinmilkowski.plate_words.corpus.WordFrequency;
import pl.marcinmilkowski.plate_words.matching.MatchMode;
import pl.marcinmilkowski.plate_words.matching.PatternGenerator;
import pl.marcinmilkowski.plate_words.matching.Solver;

import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Builds a {@link CorpusIndex} by solving plates in subsequence mode.
 *
 * Plates are split into batches and solved on a fixed thread pool. Each
 * batch produces its own partial map; the partial maps are merged in batch
 * order once every worker has finished, so the result does not depend on
 * thread scheduling. A plate whose solver call throws is logged and stored
 * as an empty, failed solution set.
 *
 * Usage:
 *   CorpusIndexBuilder builder = new CorpusIndexBuilder(corpus, indexConfig);
 *   CorpusIndex full = builder.buildFull(3);
 *   CorpusIndex partial = builder.buildPartial(3, samplePlates);
 */
public class CorpusIndexBuilder {

    private static final Logger logger = LoggerFactory.getLogger(CorpusIndexBuilder.class);

    private final Corpus corpus;
    private final Solver solver;
    private final IndexConfig config;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public CorpusIndexBuilder(Corpus corpus, IndexConfig config) {
        this(new Solver(corpus), config);
    }

    /**
     * Build with a specific solver (its corpus is the one indexed).
     */
    public CorpusIndexBuilder(Solver solver, IndexConfig config) {
        this.corpus = solver.corpus();
        this.solver = solver;
        this.config = config;
    }

    /**
     * Index every plate of the given length over the configured alphabet.
     */
    public CorpusIndex buildFull(int patternLength) throws InterruptedException {
        checkLength(patternLength);
        List<Plate> plates = new ArrayList<>();
        for (String letters : PatternGenerator.all(config.alphabet(), patternLength)) {
            plates.add(Plate.of(letters));
        }
        return build(plates, CoverageMode.FULL, patternLength);
    }

    /**
     * Index only the sampled plates of the given length. Duplicates are
     * collapsed; plates of other lengths are skipped.
     */
    public CorpusIndex buildPartial(int patternLength, Collection<Plate> sample) throws InterruptedException {
        Set<Plate> unique = new LinkedHashSet<>();
        int skipped = 0;
        for (Plate plate : sample) {
            if (plate.length() == patternLength) {
                unique.add(plate);
            } else {
                skipped++;
            }
        }
        if (skipped > 0) {
            logger.warn("Skipped {} sample plates not of length {}", skipped, patternLength);
        }
        return build(new ArrayList<>(unique), CoverageMode.PARTIAL, patternLength);
    }

    /**
     * Ask running and future builds to stop. Workers check between plates;
     * the build then throws {@link CancellationException}.
     */
    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    private CorpusIndex build(List<Plate> plates, CoverageMode coverage, int patternLength)
            throws InterruptedException {
        checkLength(patternLength);
        long startTime = System.currentTimeMillis();
        int threads = config.threads();
        logger.info("Building {} corpus index: {} plates of length {} over {} words",
            coverage, plates.size(), patternLength, corpus.size());
        logger.info("Configuration: threads={}, batch={}", threads, config.batchSize());

        AtomicInteger processed = new AtomicInteger(0);
        AtomicInteger failures = new AtomicInteger(0);
        List<List<Plate>> batches = partitionList(plates, config.batchSize());

        ExecutorService executor = Executors.newFixedThreadPool(threads);
        List<Future<Map<Plate, SolutionSet>>> futures = new ArrayList<>();
        LinkedHashMap<Plate, SolutionSet> merged = new LinkedHashMap<>(plates.size() * 2);
        try {
            for (List<Plate> batch : batches) {
                futures.add(executor.submit(() -> solveBatch(batch, plates.size(), processed, failures)));
            }

            for (Future<Map<Plate, SolutionSet>> future : futures) {
                try {
                    merged.putAll(future.get());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw ie;
                } catch (ExecutionException ee) {
                    if (ee.getCause() instanceof CancellationException) {
                        throw (CancellationException) ee.getCause();
                    }
                    // solveBatch traps per-plate errors, so this is unexpected
                    throw new IllegalStateException("Corpus index batch failed", ee.getCause());
                }
            }
        } finally {
            executor.shutdownNow();
            if (!executor.awaitTermination(1, TimeUnit.MINUTES)) {
                logger.warn("Index workers did not terminate within 1 minute");
            }
        }

        CorpusIndex index = new CorpusIndex(corpus, coverage, patternLength, merged);
        long elapsed = System.currentTimeMillis() - startTime;
        logger.info("Corpus index built in {} ms: {} plates, {} solved words, {} failed",
            elapsed, index.size(), index.solvedWords().size(), failures.get());
        return index;
    }

    private Map<Plate, SolutionSet> solveBatch(List<Plate> batch, int total,
                                               AtomicInteger processed, AtomicInteger failures) {
        Map<Plate, SolutionSet> partial = new LinkedHashMap<>(batch.size() * 2);
        for (Plate plate : batch) {
            if (cancelled.get() || Thread.currentThread().isInterrupted()) {
                throw new CancellationException("Corpus index build cancelled");
            }
            try {
                List<WordFrequency> solutions = solver.solve(plate.query(), MatchMode.SUBSEQUENCE);
                partial.put(plate, SolutionSet.of(plate, solutions));
            } catch (RuntimeException e) {
                failures.incrementAndGet();
                logger.error("Failed to solve plate '{}', storing empty solution set", plate, e);
                partial.put(plate, SolutionSet.failed(plate));
            }
            int count = processed.incrementAndGet();
            if (count % config.progressEvery() == 0) {
                logger.info("Progress: {}/{} plates solved", count, total);
            }
        }
        return partial;
    }

    private static void checkLength(int patternLength) {
        if (patternLength < Plate.MIN_LENGTH || patternLength > Plate.MAX_LENGTH) {
            throw new InvalidInputException("Pattern length out of range: " + patternLength);
        }
    }

    private static <T> List<List<T>> partitionList(List<T> list, int batchSize) {
        List<List<T>> batches = new ArrayList<>();
        for (int i = 0; i < list.size(); i += batchSize) {
            batches.add(list.subList(i, Math.min(i + batchSize, list.size())));
        }
        return batches;
    }
}
