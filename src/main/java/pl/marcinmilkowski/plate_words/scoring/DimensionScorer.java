package pl.marcinmilkowski.plate_words.scoring;

/**
 * One independent dimension of word impressiveness.
 *
 * Implementations are read-only over prebuilt structures and safe for
 * concurrent use. Plate-independent dimensions ignore the plate argument.
 */
public interface DimensionScorer {

    String dimension();

    ScoreOutcome score(String word, String plate);
}
