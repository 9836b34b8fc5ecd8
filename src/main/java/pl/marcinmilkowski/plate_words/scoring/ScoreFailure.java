package pl.marcinmilkowski.plate_words.scoring;

import com.alibaba.fastjson2.JSONObject;

/**
 * A typed scorer failure.
 */
public record ScoreFailure(
    String dimension,
    FailureKind kind,
    String message
) {

    public JSONObject toJson() {
        JSONObject obj = new JSONObject();
        obj.put("dimension", dimension);
        obj.put("kind", kind.name());
        obj.put("error", message);
        return obj;
    }

    @Override
    public String toString() {
        return dimension + " " + kind + ": " + message;
    }
}
