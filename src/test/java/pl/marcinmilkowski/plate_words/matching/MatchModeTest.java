package pl.marcinmilkowski.plate_words.matching;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import pl.marcinmilkowski.plate_words.corpus.InvalidInputException;

import java.util.function.Predicate;

import static org.junit.jupiter.api.Assertions.*;

class MatchModeTest {

    @Test
    @DisplayName("Modes are looked up by identifier or enum name")
    void fromId() {
        assertEquals(MatchMode.POSITIONAL, MatchMode.fromId("pattern"));
        assertEquals(MatchMode.POSITIONAL, MatchMode.fromId("positional"));
        assertEquals(MatchMode.ANAGRAM_SUBSET, MatchMode.fromId("anagram_subset"));
        assertEquals(MatchMode.SUBSEQUENCE, MatchMode.fromId("SUBSEQUENCE"));
        assertThrows(InvalidInputException.class, () -> MatchMode.fromId("regex"));
        assertThrows(InvalidInputException.class, () -> MatchMode.fromId(null));
    }

    @Test
    @DisplayName("Queries are lowercased and validated per mode")
    void normalizeQuery() {
        assertEquals("act", MatchMode.SUBSEQUENCE.normalizeQuery(" AcT "));
        assertEquals("", MatchMode.SUBSEQUENCE.normalizeQuery(null));
        assertEquals("", MatchMode.ANAGRAM.normalizeQuery("   "));
        assertEquals("c?t", MatchMode.POSITIONAL.normalizeQuery("C?T"));
        assertThrows(InvalidInputException.class, () -> MatchMode.SUBSEQUENCE.normalizeQuery("c?t"));
        assertThrows(InvalidInputException.class, () -> MatchMode.SUBSTRING.normalizeQuery("a1"));
        assertThrows(InvalidInputException.class, () -> MatchMode.POSITIONAL.normalizeQuery("c*t"));
    }

    @Test
    void compiledPredicateIsReusable() {
        Predicate<String> predicate = MatchMode.POSITIONAL.compile("?at");
        assertTrue(predicate.test("cat"));
        assertTrue(predicate.test("bat"));
        assertFalse(predicate.test("cart"));
    }

    @Test
    void matchesDelegatesToMode() {
        assertTrue(MatchMode.SUBSEQUENCE.matches("ct", "tact"));
        assertFalse(MatchMode.SUBSTRING.matches("ct", "cat"));
        assertTrue(MatchMode.ANAGRAM.matches("tca", "act"));
        assertTrue(MatchMode.ANAGRAM_SUBSET.matches("ta", "tact"));
    }
}
