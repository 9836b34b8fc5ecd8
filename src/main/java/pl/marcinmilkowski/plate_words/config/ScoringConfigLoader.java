package pl.marcinmilkowski.plate_words.config;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.plate_words.corpus.Plate;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads scoring engine configuration from JSON.
 *
 * Expected JSON structure (every section and key is optional):
 * {
 *   "version": "1.0",
 *   "index": {
 *     "alphabet": "abcdefghijklmnopqrstuvwxyz",
 *     "pattern_length": 3,
 *     "threads": 8,
 *     "batch_size": 256,
 *     "progress_every": 1000
 *   },
 *   "frequency": { "inverse_weight": 0.4, "percentile_weight": 0.4, "zscore_weight": 0.2 },
 *   "orthographic": {
 *     "smoothing": 1e-10,
 *     "bigram_min": 6, "bigram_max": 12,
 *     "trigram_min": 7, "trigram_max": 18,
 *     "bigram_weight": 0.4, "trigram_weight": 0.6
 *   },
 *   "ensemble": {
 *     "frequency_weight": 0.333, "information_weight": 0.333, "orthographic_weight": 0.334,
 *     "renormalize_missing": false
 *   }
 * }
 */
public class ScoringConfigLoader {

    private static final Logger logger = LoggerFactory.getLogger(ScoringConfigLoader.class);

    public static final String DEFAULT_RESOURCE = "plate-scoring.json";

    private final String version;
    private final IndexConfig index;
    private final FrequencyConfig frequency;
    private final OrthographicConfig orthographic;
    private final EnsembleConfig ensemble;

    /**
     * Load configuration from a file.
     *
     * @throws IOException if the file cannot be read
     * @throws IllegalArgumentException if the file is invalid
     */
    public ScoringConfigLoader(Path configPath) throws IOException {
        this(readFile(configPath), configPath.toString());
    }

    private ScoringConfigLoader(String content, String source) {
        JSONObject root;
        try {
            root = JSON.parseObject(content);
        } catch (JSONException e) {
            throw new IllegalArgumentException("Malformed scoring config " + source + ": " + e.getMessage(), e);
        }
        if (root == null) {
            root = new JSONObject();
        }

        this.version = root.getString("version") != null ? root.getString("version") : "1.0";
        this.index = IndexConfig.fromJson(section(root, "index"));
        this.frequency = FrequencyConfig.fromJson(section(root, "frequency"));
        this.orthographic = OrthographicConfig.fromJson(section(root, "orthographic"));
        this.ensemble = EnsembleConfig.fromJson(section(root, "ensemble"));

        logger.info("Loaded scoring config version {} from {}: pattern length {}, {} threads",
            version, source, index.patternLength(), index.threads());
    }

    /**
     * Parse configuration from a JSON string.
     */
    public static ScoringConfigLoader fromJson(String content) {
        return new ScoringConfigLoader(content, "<string>");
    }

    /**
     * Load the bundled {@value #DEFAULT_RESOURCE} from the classpath.
     */
    public static ScoringConfigLoader createDefault() {
        try (InputStream in = ScoringConfigLoader.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Default scoring config not found on classpath: " + DEFAULT_RESOURCE);
            }
            return new ScoringConfigLoader(new String(in.readAllBytes(), StandardCharsets.UTF_8), DEFAULT_RESOURCE);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load default scoring config: " + DEFAULT_RESOURCE, e);
        }
    }

    private static String readFile(Path configPath) throws IOException {
        if (!Files.exists(configPath)) {
            throw new IOException("Scoring config file not found: " + configPath);
        }
        return Files.readString(configPath, StandardCharsets.UTF_8);
    }

    private static JSONObject section(JSONObject root, String name) {
        JSONObject obj = root.getJSONObject(name);
        return obj != null ? obj : new JSONObject();
    }

    public String getVersion() { return version; }
    public IndexConfig getIndex() { return index; }
    public FrequencyConfig getFrequency() { return frequency; }
    public OrthographicConfig getOrthographic() { return orthographic; }
    public EnsembleConfig getEnsemble() { return ensemble; }

    /**
     * Export the loaded config.
     */
    public JSONObject toJson() {
        JSONObject root = new JSONObject();
        root.put("version", version);
        root.put("index", index.toJson());
        root.put("frequency", frequency.toJson());
        root.put("orthographic", orthographic.toJson());
        root.put("ensemble", ensemble.toJson());
        return root;
    }

    private static double doubleValue(JSONObject obj, String key, double defaultValue) {
        return obj.containsKey(key) ? obj.getDoubleValue(key) : defaultValue;
    }

    private static void requirePositive(String key, double value) {
        if (!(value > 0)) {
            throw new IllegalArgumentException("'" + key + "' must be positive: " + value);
        }
    }

    /**
     * Weights must be non-negative, not NaN, and sum to a positive total.
     */
    private static void requireWeights(String section, double... weights) {
        double total = 0;
        for (double w : weights) {
            if (Double.isNaN(w) || w < 0) {
                throw new IllegalArgumentException("'" + section + "' weights must be non-negative: " + w);
            }
            total += w;
        }
        if (!(total > 0) || Double.isInfinite(total)) {
            throw new IllegalArgumentException("'" + section + "' weights must have a positive finite sum: " + total);
        }
    }

    /**
     * Corpus index build settings.
     */
    public record IndexConfig(
        String alphabet,
        int patternLength,
        int threads,
        int batchSize,
        int progressEvery
    ) {
        public static final String DEFAULT_ALPHABET = "abcdefghijklmnopqrstuvwxyz";

        public IndexConfig {
            if (alphabet == null || alphabet.isBlank()) {
                throw new IllegalArgumentException("'alphabet' must not be empty");
            }
            if (patternLength < Plate.MIN_LENGTH || patternLength > Plate.MAX_LENGTH) {
                throw new IllegalArgumentException("'pattern_length' must be between "
                    + Plate.MIN_LENGTH + " and " + Plate.MAX_LENGTH + ": " + patternLength);
            }
            requirePositive("threads", threads);
            requirePositive("batch_size", batchSize);
            requirePositive("progress_every", progressEvery);
        }

        public static IndexConfig defaults() {
            return fromJson(new JSONObject());
        }

        static IndexConfig fromJson(JSONObject obj) {
            String alphabet = obj.getString("alphabet");
            return new IndexConfig(
                alphabet != null ? alphabet : DEFAULT_ALPHABET,
                obj.getIntValue("pattern_length", 3),
                obj.getIntValue("threads", Runtime.getRuntime().availableProcessors()),
                obj.getIntValue("batch_size", 256),
                obj.getIntValue("progress_every", 1000));
        }

        public IndexConfig withThreads(int n) {
            return new IndexConfig(alphabet, patternLength, n, batchSize, progressEvery);
        }

        public IndexConfig withBatchSize(int size) {
            return new IndexConfig(alphabet, patternLength, threads, size, progressEvery);
        }

        public JSONObject toJson() {
            JSONObject obj = new JSONObject();
            obj.put("alphabet", alphabet);
            obj.put("pattern_length", patternLength);
            obj.put("threads", threads);
            obj.put("batch_size", batchSize);
            obj.put("progress_every", progressEvery);
            return obj;
        }
    }

    /**
     * Weights of the three rarity sub-scores.
     */
    public record FrequencyConfig(double inverseWeight, double percentileWeight, double zScoreWeight) {

        public FrequencyConfig {
            requireWeights("frequency", inverseWeight, percentileWeight, zScoreWeight);
        }

        public static FrequencyConfig defaults() {
            return new FrequencyConfig(0.4, 0.4, 0.2);
        }

        static FrequencyConfig fromJson(JSONObject obj) {
            return new FrequencyConfig(
                doubleValue(obj, "inverse_weight", 0.4),
                doubleValue(obj, "percentile_weight", 0.4),
                doubleValue(obj, "zscore_weight", 0.2));
        }

        public JSONObject toJson() {
            JSONObject obj = new JSONObject();
            obj.put("inverse_weight", inverseWeight);
            obj.put("percentile_weight", percentileWeight);
            obj.put("zscore_weight", zScoreWeight);
            return obj;
        }
    }

    /**
     * Surprisal scaling bounds (bits) and n-gram order weights.
     */
    public record OrthographicConfig(
        double smoothing,
        double bigramMin,
        double bigramMax,
        double trigramMin,
        double trigramMax,
        double bigramWeight,
        double trigramWeight
    ) {
        public OrthographicConfig {
            requirePositive("smoothing", smoothing);
            if (bigramMax <= bigramMin) {
                throw new IllegalArgumentException("'bigram_max' must exceed 'bigram_min'");
            }
            if (trigramMax <= trigramMin) {
                throw new IllegalArgumentException("'trigram_max' must exceed 'trigram_min'");
            }
        }

        public static OrthographicConfig defaults() {
            return fromJson(new JSONObject());
        }

        static OrthographicConfig fromJson(JSONObject obj) {
            return new OrthographicConfig(
                doubleValue(obj, "smoothing", 1e-10),
                doubleValue(obj, "bigram_min", 6.0),
                doubleValue(obj, "bigram_max", 12.0),
                doubleValue(obj, "trigram_min", 7.0),
                doubleValue(obj, "trigram_max", 18.0),
                doubleValue(obj, "bigram_weight", 0.4),
                doubleValue(obj, "trigram_weight", 0.6));
        }

        public JSONObject toJson() {
            JSONObject obj = new JSONObject();
            obj.put("smoothing", smoothing);
            obj.put("bigram_min", bigramMin);
            obj.put("bigram_max", bigramMax);
            obj.put("trigram_min", trigramMin);
            obj.put("trigram_max", trigramMax);
            obj.put("bigram_weight", bigramWeight);
            obj.put("trigram_weight", trigramWeight);
            return obj;
        }
    }

    /**
     * Default ensemble weights and the missing-component policy.
     */
    public record EnsembleConfig(
        double frequencyWeight,
        double informationWeight,
        double orthographicWeight,
        boolean renormalizeMissing
    ) {
        public EnsembleConfig {
            requireWeights("ensemble", frequencyWeight, informationWeight, orthographicWeight);
        }

        public static EnsembleConfig defaults() {
            return fromJson(new JSONObject());
        }

        static EnsembleConfig fromJson(JSONObject obj) {
            return new EnsembleConfig(
                doubleValue(obj, "frequency_weight", 1.0 / 3),
                doubleValue(obj, "information_weight", 1.0 / 3),
                doubleValue(obj, "orthographic_weight", 1.0 / 3),
                obj.containsKey("renormalize_missing") && obj.getBooleanValue("renormalize_missing"));
        }

        public JSONObject toJson() {
            JSONObject obj = new JSONObject();
            obj.put("frequency_weight", frequencyWeight);
            obj.put("information_weight", informationWeight);
            obj.put("orthographic_weight", orthographicWeight);
            obj.put("renormalize_missing", renormalizeMissing);
            return obj;
        }
    }
}
