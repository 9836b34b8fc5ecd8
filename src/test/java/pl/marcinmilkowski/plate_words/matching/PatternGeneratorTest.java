package pl.marcinmilkowski.plate_words.matching;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PatternGeneratorTest {

    @Test
    @DisplayName("All patterns come in lexicographic order")
    void generatesAll() {
        List<String> patterns = PatternGenerator.all("cba", 2);

        assertEquals(9, patterns.size());
        assertEquals("aa", patterns.get(0));
        assertEquals("ab", patterns.get(1));
        assertEquals("ba", patterns.get(3));
        assertEquals("cc", patterns.get(8));
    }

    @Test
    void alphabetIsDeduplicated() {
        assertEquals(List.of("a", "b"), PatternGenerator.all("aAb!", 1));
    }

    @Test
    void degenerateInputsGiveNothing() {
        assertTrue(PatternGenerator.all("abc", 0).isEmpty());
        assertTrue(PatternGenerator.all("123", 2).isEmpty());
        assertTrue(PatternGenerator.random("abc", 3, 0, 1L).isEmpty());
    }

    @Test
    @DisplayName("Random patterns are repeatable for a fixed seed")
    void randomIsSeeded() {
        List<String> first = PatternGenerator.random("abcdef", 3, 50, 42L);
        List<String> second = PatternGenerator.random("abcdef", 3, 50, 42L);

        assertEquals(first, second);
        assertEquals(50, first.size());
        for (String pattern : first) {
            assertEquals(3, pattern.length());
            assertTrue(pattern.matches("[a-f]{3}"), pattern);
        }
    }
}
