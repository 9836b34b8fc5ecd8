package pl.marcinmilkowski.plate_words.scoring;

import com.alibaba.fastjson2.JSONObject;

import java.util.List;
import java.util.Locale;

/**
 * Aggregate of the three dimensions for one (word, plate) pair.
 *
 * Includes every component, failed ones too, with their failure reasons.
 */
public record EnsembleResult(
    String word,
    String plate,
    double score,                  // 0-100
    double confidence,             // working components / 3
    int workingComponents,
    EnsembleWeights weights,       // normalized
    boolean renormalized,
    List<ComponentScore> components,
    String interpretation
) {

    public EnsembleResult {
        components = List.copyOf(components);
    }

    public ComponentScore component(String dimension) {
        for (ComponentScore c : components) {
            if (c.dimension().equals(dimension)) {
                return c;
            }
        }
        throw new IllegalArgumentException("Unknown dimension: " + dimension);
    }

    public List<ScoreFailure> failures() {
        return components.stream()
            .filter(c -> !c.working())
            .map(c -> c.outcome().failure())
            .toList();
    }

    public JSONObject toJson() {
        JSONObject obj = new JSONObject();
        obj.put("word", word);
        obj.put("plate", plate);
        obj.put("ensemble_score", score);
        obj.put("confidence", confidence);
        obj.put("working_components", workingComponents);
        obj.put("weights", weights.toJson());
        obj.put("renormalized", renormalized);
        JSONObject individual = new JSONObject();
        for (ComponentScore c : components) {
            individual.put(c.dimension(), c.toJson());
        }
        obj.put("individual_scores", individual);
        obj.put("interpretation", interpretation);
        return obj;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "EnsembleResult[%s/%s score=%.1f confidence=%.2f]",
            word, plate, score, confidence);
    }
}
