package pl.marcinmilkowski.plate_words.corpus;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

/**
 * Loads a word-frequency table into a {@link Corpus}.
 *
 * Supported formats:
 * - JSON array: [{"word": "cat", "frequency": 100}, ...]
 * - JSON object: {"cat": 100, "act": 50, ...}
 * - TSV: word&lt;TAB&gt;frequency per line, '#' starts a comment line
 *
 * The format is chosen by file extension (.json vs anything else).
 */
public final class CorpusLoader {

    private static final Logger logger = LoggerFactory.getLogger(CorpusLoader.class);

    private CorpusLoader() {
    }

    /**
     * Load a corpus file.
     *
     * @throws FileNotFoundException if the file does not exist
     * @throws IOException if the file cannot be read or parsed
     */
    public static Corpus load(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new FileNotFoundException("Corpus file not found: " + path);
        }

        long start = System.currentTimeMillis();
        Corpus corpus;
        if (path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".json")) {
            corpus = parseJson(Files.readString(path, StandardCharsets.UTF_8));
        } else {
            corpus = loadTsv(path);
        }

        logger.info("Corpus loaded: {} words ({} skipped) from {} in {} ms",
            corpus.size(), corpus.skippedEntries(), path, System.currentTimeMillis() - start);
        return corpus;
    }

    /**
     * Parse JSON content in either the array or the object layout.
     *
     * @throws IOException if the content is not valid JSON or an entry is malformed
     */
    public static Corpus parseJson(String content) throws IOException {
        Corpus.Builder builder = Corpus.builder();
        try {
            String trimmed = content.trim();
            if (trimmed.startsWith("{")) {
                JSONObject root = JSON.parseObject(trimmed);
                for (Map.Entry<String, Object> e : root.entrySet()) {
                    builder.add(e.getKey(), toFrequency(e.getKey(), e.getValue()));
                }
            } else {
                JSONArray array = JSON.parseArray(trimmed);
                if (array == null) {
                    throw new IOException("Corpus JSON is empty");
                }
                for (int i = 0; i < array.size(); i++) {
                    JSONObject item = array.getJSONObject(i);
                    if (item == null) {
                        throw new IOException("Invalid corpus entry at index " + i);
                    }
                    String word = item.getString("word");
                    if (word == null) {
                        throw new IOException("Missing 'word' field at index " + i);
                    }
                    builder.add(word, toFrequency(word, item.get("frequency")));
                }
            }
        } catch (JSONException | IllegalArgumentException e) {
            throw new IOException("Malformed corpus JSON: " + e.getMessage(), e);
        }
        return builder.build();
    }

    private static Corpus loadTsv(Path path) throws IOException {
        Corpus.Builder builder = Corpus.builder();
        int lineNo = 0;
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNo++;
                if (line.isBlank() || line.startsWith("#")) {
                    continue;
                }
                String[] parts = line.split("\t");
                if (parts.length < 2) {
                    throw new IOException("Expected word<TAB>frequency at line " + lineNo + ": " + line);
                }
                try {
                    builder.add(parts[0], Long.parseLong(parts[1].trim()));
                } catch (IllegalArgumentException e) {
                    throw new IOException("Bad frequency at line " + lineNo + ": " + line, e);
                }
            }
        }
        return builder.build();
    }

    private static long toFrequency(String word, Object value) throws IOException {
        if (value instanceof Number) {
            try {
                return new BigDecimal(value.toString()).longValueExact();
            } catch (ArithmeticException | NumberFormatException e) {
                throw new IOException("Frequency for '" + word + "' is not a whole number: " + value, e);
            }
        }
        if (value instanceof String) {
            try {
                return Long.parseLong(((String) value).trim());
            } catch (NumberFormatException e) {
                throw new IOException("Bad frequency for '" + word + "': " + value, e);
            }
        }
        throw new IOException("Missing frequency for '" + word + "'");
    }
}
