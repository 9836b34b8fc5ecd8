package pl.marcinmilkowski.plate_words.scoring;

import com.alibaba.fastjson2.JSONObject;
import pl.marcinmilkowski.plate_words.config.ScoringConfigLoader.EnsembleConfig;

import java.util.Locale;

/**
 * Relative weights of the three dimensions. Need not sum to 1;
 * {@link #normalized()} scales them so they do.
 */
public record EnsembleWeights(double frequency, double information, double orthographic) {

    public static final EnsembleWeights EQUAL = new EnsembleWeights(1, 1, 1);

    public EnsembleWeights {
        if (frequency < 0 || information < 0 || orthographic < 0
            || Double.isNaN(frequency) || Double.isNaN(information) || Double.isNaN(orthographic)) {
            throw new IllegalArgumentException(String.format(Locale.ROOT,
                "Weights must be non-negative: %s/%s/%s", frequency, information, orthographic));
        }
    }

    public static EnsembleWeights from(EnsembleConfig config) {
        return new EnsembleWeights(config.frequencyWeight(), config.informationWeight(),
            config.orthographicWeight());
    }

    public double total() {
        return frequency + information + orthographic;
    }

    /**
     * @throws IllegalArgumentException if all weights are zero
     */
    public EnsembleWeights normalized() {
        double total = total();
        if (!(total > 0)) {
            throw new IllegalArgumentException("At least one ensemble weight must be positive");
        }
        return new EnsembleWeights(frequency / total, information / total, orthographic / total);
    }

    public double weightOf(String dimension) {
        switch (dimension) {
            case FrequencyScorer.DIMENSION:
                return frequency;
            case InformationScorer.DIMENSION:
                return information;
            case OrthographicScorer.DIMENSION:
                return orthographic;
            default:
                throw new IllegalArgumentException("Unknown dimension: " + dimension);
        }
    }

    public JSONObject toJson() {
        JSONObject obj = new JSONObject();
        obj.put("vocabulary", frequency);
        obj.put("information", information);
        obj.put("orthographic", orthographic);
        return obj;
    }
}
