package pl.marcinmilkowski.plate_words.scoring;

/**
 * Why a scorer could not produce a score. All kinds are recoverable.
 */
public enum FailureKind {
    /** Word absent from the corpus or with zero frequency. */
    NOT_FOUND,
    /** Word is in the corpus but does not solve the plate. */
    NOT_A_SOLUTION,
    /** Plate outside a partial-coverage index. */
    UNCOVERED_PATTERN,
    /** Word or plate failed normalization. */
    INVALID_INPUT
}
