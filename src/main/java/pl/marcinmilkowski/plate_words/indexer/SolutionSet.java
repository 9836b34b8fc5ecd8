package pl.marcinmilkowski.plate_words.indexer;

import pl.marcinmilkowski.plate_words.corpus.Plate;
import pl.marcinmilkowski.plate_words.corpus.WordFrequency;

import java.util.*;

/**
 * All corpus words solving one plate, with per-word information content.
 *
 * Solutions keep the solver's order (frequency descending). A set marked
 * {@link #failed()} is empty because solving the plate threw during the build.
 */
public final class SolutionSet {

    private final Plate plate;
    private final List<WordFrequency> solutions;
    private final Map<String, WordFrequency> byWord;
    private final Map<String, Double> informationBits;
    private final PlateStatistics statistics;
    private final boolean failed;

    private SolutionSet(Plate plate, List<WordFrequency> solutions, boolean failed) {
        this.plate = plate;
        this.solutions = List.copyOf(solutions);
        this.failed = failed;

        Map<String, WordFrequency> index = new HashMap<>(solutions.size() * 2);
        long mass = 0;
        for (WordFrequency wf : solutions) {
            index.put(wf.word(), wf);
            mass += wf.frequency();
        }
        this.byWord = Collections.unmodifiableMap(index);

        Map<String, Double> bits = new HashMap<>(solutions.size() * 2);
        double entropy = 0;
        double sumBits = 0;
        double minBits = Double.POSITIVE_INFINITY;
        double maxBits = 0;
        if (mass > 0) {
            for (WordFrequency wf : solutions) {
                if (wf.frequency() <= 0) {
                    continue;
                }
                double p = (double) wf.frequency() / mass;
                double info = -PlateStatistics.log2(p);
                bits.put(wf.word(), info);
                entropy += p * info;
                sumBits += info;
                minBits = Math.min(minBits, info);
                maxBits = Math.max(maxBits, info);
            }
        }
        this.informationBits = Collections.unmodifiableMap(bits);
        this.statistics = bits.isEmpty()
            ? new PlateStatistics(mass, 0, solutions.size(), 0, 0, 0)
            : new PlateStatistics(mass, entropy, solutions.size(), sumBits / bits.size(), minBits, maxBits);
    }

    public static SolutionSet of(Plate plate, List<WordFrequency> solutions) {
        return new SolutionSet(plate, solutions, false);
    }

    /**
     * Empty placeholder for a plate whose build failed.
     */
    public static SolutionSet failed(Plate plate) {
        return new SolutionSet(plate, List.of(), true);
    }

    public Plate plate() {
        return plate;
    }

    /**
     * Solutions by descending frequency.
     */
    public List<WordFrequency> solutions() {
        return solutions;
    }

    public boolean contains(String word) {
        return byWord.containsKey(word);
    }

    /**
     * Corpus frequency of a solution, or 0 if it is not a solution.
     */
    public long frequency(String word) {
        WordFrequency wf = byWord.get(word);
        return wf != null ? wf.frequency() : 0;
    }

    /**
     * -log2 P(word | plate), empty for non-solutions and zero-frequency solutions.
     */
    public OptionalDouble informationBits(String word) {
        Double bits = informationBits.get(word);
        return bits != null ? OptionalDouble.of(bits) : OptionalDouble.empty();
    }

    public PlateStatistics statistics() {
        return statistics;
    }

    public int size() {
        return solutions.size();
    }

    public boolean isEmpty() {
        return solutions.isEmpty();
    }

    public boolean failed() {
        return failed;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "SolutionSet[%s %d solutions%s]",
            plate, solutions.size(), failed ? " FAILED" : "");
    }
}
