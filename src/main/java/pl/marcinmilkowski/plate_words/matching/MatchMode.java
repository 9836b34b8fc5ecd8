package pl.marcinmilkowski.plate_words.matching;

import pl.marcinmilkowski.plate_words.corpus.InvalidInputException;

import java.util.Locale;
import java.util.function.Predicate;

/**
 * The five ways a query can match a corpus word.
 *
 * Each mode compiles a normalized query into a word predicate, so a corpus
 * scan pays any preparation cost (e.g. the positional automaton) only once.
 */
public enum MatchMode {

    /** Letters in order, gaps allowed. The game rule. */
    SUBSEQUENCE("subsequence") {
        @Override
        public Predicate<String> compile(String query) {
            return word -> Matchers.isSubsequence(query, word);
        }
    },

    /** Letters in order, no gaps. */
    SUBSTRING("substring") {
        @Override
        public Predicate<String> compile(String query) {
            return word -> Matchers.isSubstring(query, word);
        }
    },

    /** Exactly the query's letters, any order. */
    ANAGRAM("anagram") {
        @Override
        public Predicate<String> compile(String query) {
            return word -> Matchers.isAnagram(query, word);
        }
    },

    /** At least the query's letters, any order. */
    ANAGRAM_SUBSET("anagram_subset") {
        @Override
        public Predicate<String> compile(String query) {
            return word -> Matchers.isAnagramSubset(query, word);
        }
    },

    /** Same length, '?' matches any letter. */
    POSITIONAL("pattern") {
        @Override
        public Predicate<String> compile(String query) {
            return PositionalPattern.compile(query)::matches;
        }

        @Override
        protected boolean isAllowed(char c) {
            return super.isAllowed(c) || c == PositionalPattern.WILDCARD;
        }
    };

    private final String id;

    MatchMode(String id) {
        this.id = id;
    }

    /**
     * Compile a normalized query into a predicate over normalized words.
     */
    public abstract Predicate<String> compile(String query);

    /**
     * One-off check of a single word against a normalized query.
     */
    public boolean matches(String query, String word) {
        return compile(query).test(word);
    }

    /**
     * Lowercase and validate a raw query for this mode. Returns an empty
     * string for null or blank input.
     *
     * @throws InvalidInputException if the query has characters this mode does not accept
     */
    public String normalizeQuery(String raw) {
        if (raw == null) {
            return "";
        }
        String query = raw.trim().toLowerCase(Locale.ROOT);
        for (int i = 0; i < query.length(); i++) {
            if (!isAllowed(query.charAt(i))) {
                throw new InvalidInputException(
                    "Invalid character '" + query.charAt(i) + "' in " + id + " query: '" + raw + "'");
            }
        }
        return query;
    }

    protected boolean isAllowed(char c) {
        return c >= 'a' && c <= 'z';
    }

    /**
     * External identifier, e.g. "anagram_subset".
     */
    public String id() {
        return id;
    }

    /**
     * Look up a mode by its identifier or enum name, case-insensitively.
     *
     * @throws InvalidInputException for unknown modes
     */
    public static MatchMode fromId(String id) {
        if (id != null) {
            for (MatchMode mode : values()) {
                if (mode.id.equalsIgnoreCase(id) || mode.name().equalsIgnoreCase(id)) {
                    return mode;
                }
            }
        }
        throw new InvalidInputException("Unknown match mode: " + id);
    }
}
