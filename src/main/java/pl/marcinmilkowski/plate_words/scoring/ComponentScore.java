package pl.marcinmilkowski.plate_words.scoring;

import com.alibaba.fastjson2.JSONObject;

/**
 * One dimension's part in an ensemble score.
 */
public record ComponentScore(
    String dimension,
    double weight,          // normalized weight
    ScoreOutcome outcome
) {

    public boolean working() {
        return outcome.isSuccess();
    }

    /**
     * score * weight for a working component, 0 otherwise.
     */
    public double weightedContribution() {
        return working() ? outcome.result().score() * weight : 0.0;
    }

    public JSONObject toJson() {
        JSONObject obj = new JSONObject();
        obj.put("status", working() ? "success" : "failed");
        obj.put("weight", weight);
        if (working()) {
            obj.put("score", outcome.result().score());
            obj.put("weighted_contribution", weightedContribution());
        } else {
            obj.put("error", outcome.failure().message());
            obj.put("kind", outcome.failure().kind().name());
        }
        obj.put("details", outcome.toJson());
        return obj;
    }
}
