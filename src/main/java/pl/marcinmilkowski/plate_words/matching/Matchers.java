package pl.marcinmilkowski.plate_words.matching;

/**
 * Pure matching predicates over normalized lowercase strings.
 *
 * None of these throw; a length mismatch simply returns false.
 */
public final class Matchers {

    private static final int ALPHABET = 26;

    private Matchers() {
    }

    /**
     * Pattern letters occur in the word in order, gaps allowed.
     * The pattern cursor advances once per matching character of the word.
     */
    public static boolean isSubsequence(String pattern, String word) {
        int cursor = 0;
        int n = pattern.length();
        for (int i = 0; i < word.length() && cursor < n; i++) {
            if (word.charAt(i) == pattern.charAt(cursor)) {
                cursor++;
            }
        }
        return cursor == n;
    }

    /**
     * Pattern appears as a contiguous run inside the word.
     */
    public static boolean isSubstring(String pattern, String word) {
        return word.contains(pattern);
    }

    /**
     * Word's letter multiset equals the pattern's.
     */
    public static boolean isAnagram(String pattern, String word) {
        if (pattern.length() != word.length()) {
            return false;
        }
        int[] counts = letterCounts(pattern);
        for (int i = 0; i < word.length(); i++) {
            int idx = word.charAt(i) - 'a';
            if (idx < 0 || idx >= ALPHABET || --counts[idx] < 0) {
                return false;
            }
        }
        return true;
    }

    /**
     * Word's letter multiset contains at least the pattern's (Scrabble style).
     */
    public static boolean isAnagramSubset(String pattern, String word) {
        if (word.length() < pattern.length()) {
            return false;
        }
        int[] needed = letterCounts(pattern);
        int[] available = letterCounts(word);
        for (int i = 0; i < ALPHABET; i++) {
            if (available[i] < needed[i]) {
                return false;
            }
        }
        return true;
    }

    /**
     * Equal length; every non-wildcard pattern position matches exactly.
     */
    public static boolean matchesPositional(String pattern, String word) {
        return PositionalPattern.compile(pattern).matches(word);
    }

    static int[] letterCounts(String text) {
        int[] counts = new int[ALPHABET];
        for (int i = 0; i < text.length(); i++) {
            int idx = text.charAt(i) - 'a';
            if (idx >= 0 && idx < ALPHABET) {
                counts[idx]++;
            }
        }
        return counts;
    }
}
