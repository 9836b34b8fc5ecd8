package pl.marcinmilkowski.plate_words.scoring;

import com.alibaba.fastjson2.JSONObject;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * One dimension's score for a word (and plate, where the dimension uses one).
 *
 * {@code score} and every value in {@code components} lie in [0, 100].
 * {@code metrics} holds raw intermediate values such as bits or z-scores.
 */
public record ScoreResult(
    String dimension,
    String word,
    String plate,                     // null for plate-independent dimensions
    double score,
    Map<String, Double> components,   // named sub-scores, 0-100
    Map<String, Double> metrics,      // raw values
    String interpretation,            // overall bucket
    Map<String, String> details       // finer-grained descriptions
) {

    public ScoreResult {
        components = Collections.unmodifiableMap(new LinkedHashMap<>(components));
        metrics = Collections.unmodifiableMap(new LinkedHashMap<>(metrics));
        details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public double metric(String name) {
        Double value = metrics.get(name);
        if (value == null) {
            throw new IllegalArgumentException("No metric '" + name + "' in " + dimension + " result");
        }
        return value;
    }

    public double component(String name) {
        Double value = components.get(name);
        if (value == null) {
            throw new IllegalArgumentException("No component '" + name + "' in " + dimension + " result");
        }
        return value;
    }

    public JSONObject toJson() {
        JSONObject obj = new JSONObject();
        obj.put("dimension", dimension);
        obj.put("word", word);
        if (plate != null) obj.put("plate", plate);
        obj.put("score", score);
        obj.put("scores", new JSONObject(components));
        obj.put("raw_metrics", new JSONObject(metrics));
        obj.put("interpretation", interpretation);
        obj.put("details", new JSONObject(details));
        return obj;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "%s(%s%s)=%.1f [%s]",
            dimension, word, plate != null ? "/" + plate : "", score, interpretation);
    }

    /**
     * Clamp to [0, 100]; NaN becomes 0.
     */
    static double clamp(double value) {
        if (Double.isNaN(value)) return 0.0;
        return Math.max(0.0, Math.min(100.0, value));
    }

    static double log2(double x) {
        return Math.log(x) / Math.log(2);
    }
}
