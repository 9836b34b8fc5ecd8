package pl.marcinmilkowski.plate_words.scoring;

import com.alibaba.fastjson2.JSONObject;

import java.util.Objects;
import java.util.Optional;

/**
 * Either a {@link ScoreResult} or a {@link ScoreFailure}, never both.
 */
public final class ScoreOutcome {

    private final ScoreResult result;
    private final ScoreFailure failure;

    private ScoreOutcome(ScoreResult result, ScoreFailure failure) {
        this.result = result;
        this.failure = failure;
    }

    public static ScoreOutcome success(ScoreResult result) {
        return new ScoreOutcome(Objects.requireNonNull(result), null);
    }

    public static ScoreOutcome failure(ScoreFailure failure) {
        return new ScoreOutcome(null, Objects.requireNonNull(failure));
    }

    static ScoreOutcome failure(String dimension, FailureKind kind, String message) {
        return failure(new ScoreFailure(dimension, kind, message));
    }

    public boolean isSuccess() {
        return result != null;
    }

    /**
     * @throws IllegalStateException if this outcome is a failure
     */
    public ScoreResult result() {
        if (result == null) {
            throw new IllegalStateException("No result: " + failure);
        }
        return result;
    }

    /**
     * @throws IllegalStateException if this outcome is a success
     */
    public ScoreFailure failure() {
        if (failure == null) {
            throw new IllegalStateException("Outcome is a success");
        }
        return failure;
    }

    public Optional<ScoreResult> asOptional() {
        return Optional.ofNullable(result);
    }

    public JSONObject toJson() {
        return result != null ? result.toJson() : failure.toJson();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ScoreOutcome)) return false;
        ScoreOutcome other = (ScoreOutcome) o;
        return Objects.equals(result, other.result) && Objects.equals(failure, other.failure);
    }

    @Override
    public int hashCode() {
        return Objects.hash(result, failure);
    }

    @Override
    public String toString() {
        return result != null ? result.toString() : "FAILED " + failure;
    }
}
