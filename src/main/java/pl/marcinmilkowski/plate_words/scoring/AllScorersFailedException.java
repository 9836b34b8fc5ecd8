package pl.marcinmilkowski.plate_words.scoring;

import java.util.List;

/**
 * Thrown by the ensemble when no dimension produced a score.
 */
public class AllScorersFailedException extends IllegalStateException {

    private final transient List<ScoreFailure> failures;

    public AllScorersFailedException(String word, String plate, List<ScoreFailure> failures) {
        super("All scorers failed for '" + word + "' on plate '" + plate + "': " + failures);
        this.failures = List.copyOf(failures);
    }

    public List<ScoreFailure> getFailures() {
        return failures;
    }
}
