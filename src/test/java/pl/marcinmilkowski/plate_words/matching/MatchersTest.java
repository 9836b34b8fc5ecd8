package pl.marcinmilkowski.plate_words.matching;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MatchersTest {

    @Test
    @DisplayName("Subsequence allows gaps but keeps order")
    void subsequence() {
        assertTrue(Matchers.isSubsequence("act", "act"));
        assertTrue(Matchers.isSubsequence("act", "tact"));
        assertTrue(Matchers.isSubsequence("ct", "cat"));
        assertFalse(Matchers.isSubsequence("act", "cat"));
        assertFalse(Matchers.isSubsequence("aa", "cat"));
        assertTrue(Matchers.isSubsequence("aa", "banana"));
        assertFalse(Matchers.isSubsequence("actx", "act"));
        assertTrue(Matchers.isSubsequence("", "cat"));
    }

    @Test
    void substring() {
        assertTrue(Matchers.isSubstring("act", "tact"));
        assertFalse(Matchers.isSubstring("ct", "cat"));
    }

    @Test
    @DisplayName("Anagram requires the exact letter multiset")
    void anagram() {
        assertTrue(Matchers.isAnagram("act", "cat"));
        assertTrue(Matchers.isAnagram("act", "tac"));
        assertFalse(Matchers.isAnagram("act", "tact"));
        assertFalse(Matchers.isAnagram("aab", "abb"));
    }

    @Test
    @DisplayName("Anagram subset requires at least the query letters")
    void anagramSubset() {
        assertTrue(Matchers.isAnagramSubset("act", "tact"));
        assertTrue(Matchers.isAnagramSubset("tt", "tact"));
        assertFalse(Matchers.isAnagramSubset("aact", "tact"));
        assertFalse(Matchers.isAnagramSubset("acts", "act"));
    }

    @Test
    @DisplayName("Positional patterns match same-length words with '?' wildcards")
    void positional() {
        assertTrue(Matchers.matchesPositional("c?t", "cat"));
        assertTrue(Matchers.matchesPositional("c?t", "cut"));
        assertFalse(Matchers.matchesPositional("c?t", "cast"));
        assertFalse(Matchers.matchesPositional("c?t", "ct"));
        assertTrue(Matchers.matchesPositional("??", "at"));
        assertTrue(Matchers.matchesPositional("cat", "cat"));
        assertFalse(Matchers.matchesPositional("cat", "cot"));
    }

    @Test
    void letterCounts() {
        int[] counts = Matchers.letterCounts("banana");
        assertEquals(3, counts['a' - 'a']);
        assertEquals(2, counts['n' - 'a']);
        assertEquals(1, counts['b' - 'a']);
    }
}
