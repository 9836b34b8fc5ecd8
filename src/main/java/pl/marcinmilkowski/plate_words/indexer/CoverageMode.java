package pl.marcinmilkowski.plate_words.indexer;

/**
 * Which plates a {@link CorpusIndex} was built for.
 */
public enum CoverageMode {
    /** Every plate of the configured length over the alphabet. */
    FULL,
    /** Only plates from a supplied sample; other plates are uncovered. */
    PARTIAL
}
