package pl.marcinmilkowski.plate_words.matching;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.plate_words.corpus.Corpus;
import pl.marcinmilkowski.plate_words.corpus.WordFrequency;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.function.Predicate;

/**
 * Finds every corpus word that matches a query under a {@link MatchMode}.
 *
 * Results are sorted by frequency descending. The sort is stable, so words
 * with equal frequency keep the corpus insertion order. Each corpus word
 * appears at most once.
 */
public class Solver {

    private static final Logger logger = LoggerFactory.getLogger(Solver.class);

    private static final Comparator<WordFrequency> BY_FREQUENCY_DESC =
        (a, b) -> Long.compare(b.frequency(), a.frequency());

    private final Corpus corpus;

    public Solver(Corpus corpus) {
        this.corpus = corpus;
    }

    /**
     * Solve a raw query.
     *
     * @return matches by descending frequency; empty for an empty query or no matches
     * @throws pl.marcinmilkowski.plate_words.corpus.InvalidInputException if the query has invalid characters
     */
    public List<WordFrequency> solve(String query, MatchMode mode) {
        String normalized = mode.normalizeQuery(query);
        if (normalized.isEmpty()) {
            return Collections.emptyList();
        }

        Predicate<String> predicate = mode.compile(normalized);
        List<WordFrequency> matches = new ArrayList<>();
        for (int i = 0; i < corpus.size(); i++) {
            String word = corpus.wordAt(i);
            if (predicate.test(word)) {
                matches.add(new WordFrequency(word, corpus.frequencyAt(i)));
            }
        }
        matches.sort(BY_FREQUENCY_DESC);

        logger.debug("Found {} words matching '{}' in mode '{}'", matches.size(), normalized, mode.id());
        return Collections.unmodifiableList(matches);
    }

    /**
     * Solve and attach distribution statistics and a fertility bucket.
     */
    public SolveSummary summarize(String query, MatchMode mode) {
        List<WordFrequency> matches = solve(query, mode);
        return SolveSummary.of(mode.normalizeQuery(query), mode, matches);
    }

    public Corpus corpus() {
        return corpus;
    }
}
