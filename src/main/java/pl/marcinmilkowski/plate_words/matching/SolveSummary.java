package pl.marcinmilkowski.plate_words.matching;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import pl.marcinmilkowski.plate_words.corpus.WordFrequency;

import java.util.List;
import java.util.Locale;

/**
 * Solver output with aggregate statistics.
 */
public record SolveSummary(
    String query,
    MatchMode mode,
    List<WordFrequency> matches,
    long totalFrequency,
    MatchDistribution distribution,   // null when there are no matches
    LexicalFertility fertility
) {

    static SolveSummary of(String query, MatchMode mode, List<WordFrequency> matches) {
        long total = 0;
        for (WordFrequency m : matches) {
            total += m.frequency();
        }
        MatchDistribution distribution = MatchDistribution.of(
            matches.stream().map(WordFrequency::frequency).toList());
        return new SolveSummary(query, mode, matches, total, distribution,
            LexicalFertility.of(matches.size()));
    }

    public int matchCount() {
        return matches.size();
    }

    public JSONObject toJson() {
        JSONObject obj = new JSONObject();
        obj.put("combination", query);
        obj.put("mode", mode.id());
        JSONArray array = new JSONArray();
        for (WordFrequency m : matches) {
            JSONObject item = new JSONObject();
            item.put("word", m.word());
            item.put("frequency", m.frequency());
            array.add(item);
        }
        obj.put("matches", array);
        obj.put("match_count", matches.size());
        obj.put("total_frequency", totalFrequency);
        obj.put("frequency_distribution", distribution != null ? distribution.toJson() : null);
        obj.put("lexical_fertility", fertility.name().toLowerCase(Locale.ROOT));
        return obj;
    }
}
