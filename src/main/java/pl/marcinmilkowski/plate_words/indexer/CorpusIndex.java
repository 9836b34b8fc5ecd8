package pl.marcinmilkowski.plate_words.indexer;

import pl.marcinmilkowski.plate_words.corpus.Corpus;
import pl.marcinmilkowski.plate_words.corpus.Plate;
import pl.marcinmilkowski.plate_words.corpus.WordFrequency;

import java.util.*;

/**
 * Frozen plate to solutions and word to plates indexes over one corpus.
 *
 * Both directions are derived from the same solution sets, so for every
 * covered plate p and word w: w is in solutionsFor(p) iff p is in patternsFor(w).
 * Instances are immutable; a rebuild produces a new index.
 */
public final class CorpusIndex {

    private final Corpus corpus;
    private final CoverageMode coverage;
    private final int patternLength;
    private final Map<Plate, SolutionSet> solutionsFor;
    private final Map<String, Set<Plate>> patternsFor;
    private final int failedPlates;

    CorpusIndex(Corpus corpus, CoverageMode coverage, int patternLength,
                LinkedHashMap<Plate, SolutionSet> solutions) {
        this.corpus = corpus;
        this.coverage = coverage;
        this.patternLength = patternLength;
        this.solutionsFor = Collections.unmodifiableMap(solutions);

        Map<String, Set<Plate>> inverse = new HashMap<>();
        int failed = 0;
        for (SolutionSet set : solutions.values()) {
            if (set.failed()) {
                failed++;
            }
            for (WordFrequency wf : set.solutions()) {
                inverse.computeIfAbsent(wf.word(), k -> new LinkedHashSet<>()).add(set.plate());
            }
        }
        Map<String, Set<Plate>> frozen = new HashMap<>(inverse.size() * 2);
        for (Map.Entry<String, Set<Plate>> e : inverse.entrySet()) {
            frozen.put(e.getKey(), Collections.unmodifiableSet(e.getValue()));
        }
        this.patternsFor = Collections.unmodifiableMap(frozen);
        this.failedPlates = failed;
    }

    /**
     * Solution set of a plate, or null if the plate is not covered.
     */
    public SolutionSet solutionsFor(Plate plate) {
        return solutionsFor.get(plate);
    }

    /**
     * Plates (within build coverage) that a word solves; empty if none.
     * The lookup is case-insensitive.
     */
    public Set<Plate> patternsFor(String word) {
        if (word == null) return Collections.emptySet();
        return patternsFor.getOrDefault(word.toLowerCase(Locale.ROOT), Collections.emptySet());
    }

    public boolean isCovered(Plate plate) {
        return solutionsFor.containsKey(plate);
    }

    /**
     * Covered plates in build order.
     */
    public Set<Plate> plates() {
        return solutionsFor.keySet();
    }

    /**
     * Words that solve at least one covered plate.
     */
    public Set<String> solvedWords() {
        return patternsFor.keySet();
    }

    public Corpus corpus() {
        return corpus;
    }

    public CoverageMode coverage() {
        return coverage;
    }

    public int patternLength() {
        return patternLength;
    }

    public int size() {
        return solutionsFor.size();
    }

    /**
     * Number of plates whose solving failed and were stored as empty.
     */
    public int failedPlateCount() {
        return failedPlates;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "CorpusIndex[%s length=%d, %d plates, %d words, %d failed]",
            coverage, patternLength, solutionsFor.size(), patternsFor.size(), failedPlates);
    }
}
