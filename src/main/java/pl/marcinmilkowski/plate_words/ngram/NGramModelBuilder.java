package pl.marcinmilkowski.plate_words.ngram;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.plate_words.corpus.Corpus;

import java.util.*;
import java.util.concurrent.*;

/**
 * Trains an {@link NGramModel} from a corpus.
 *
 * Every word contributes its boundary-padded bigrams and trigrams, each
 * weighted by the word's frequency. The word list is split into contiguous
 * ranges counted on a fixed thread pool; partial counts are summed once all
 * workers finish.
 */
public class NGramModelBuilder {

    private static final Logger logger = LoggerFactory.getLogger(NGramModelBuilder.class);

    private static final int MIN_RANGE = 1000;

    private final int threads;

    public NGramModelBuilder(int threads) {
        this.threads = Math.max(1, threads);
    }

    public NGramModel build(Corpus corpus) throws InterruptedException {
        long startTime = System.currentTimeMillis();
        int n = corpus.size();
        int rangeSize = Math.max(MIN_RANGE, (n + threads - 1) / threads);

        Map<String, Long> bigramCounts = new HashMap<>();
        Map<String, Long> trigramCounts = new HashMap<>();

        ExecutorService executor = Executors.newFixedThreadPool(threads);
        List<Future<Counts>> futures = new ArrayList<>();
        try {
            for (int from = 0; from < n; from += rangeSize) {
                int start = from;
                int end = Math.min(n, from + rangeSize);
                futures.add(executor.submit(() -> countRange(corpus, start, end)));
            }
            for (Future<Counts> future : futures) {
                try {
                    Counts partial = future.get();
                    partial.bigrams.forEach((k, v) -> bigramCounts.merge(k, v, Long::sum));
                    partial.trigrams.forEach((k, v) -> trigramCounts.merge(k, v, Long::sum));
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw ie;
                } catch (ExecutionException ee) {
                    throw new IllegalStateException("N-gram counting failed", ee.getCause());
                }
            }
        } finally {
            executor.shutdownNow();
        }

        NGramModel model = new NGramModel(bigramCounts, trigramCounts, n);
        logger.info("Orthographic model built in {} ms: {} words, {} unique bigrams, {} unique trigrams",
            System.currentTimeMillis() - startTime, n,
            model.bigramProbabilities().size(), model.trigramProbabilities().size());
        return model;
    }

    private static Counts countRange(Corpus corpus, int from, int to) {
        Counts counts = new Counts();
        for (int i = from; i < to; i++) {
            long frequency = corpus.frequencyAt(i);
            if (frequency <= 0) {
                continue;
            }
            String word = corpus.wordAt(i);
            for (String gram : NGramModel.extract(word, 2)) {
                counts.bigrams.merge(gram, frequency, Long::sum);
            }
            for (String gram : NGramModel.extract(word, 3)) {
                counts.trigrams.merge(gram, frequency, Long::sum);
            }
        }
        return counts;
    }

    private static final class Counts {
        final Map<String, Long> bigrams = new HashMap<>();
        final Map<String, Long> trigrams = new HashMap<>();
    }
}
