package pl.marcinmilkowski.plate_words.matching;

import org.apache.lucene.index.Term;
import org.apache.lucene.search.WildcardQuery;
import org.apache.lucene.util.automaton.Automaton;
import org.apache.lucene.util.automaton.CharacterRunAutomaton;
import org.apache.lucene.util.automaton.Operations;

/**
 * A positional (Wordle/Hangman style) pattern compiled to a run automaton.
 *
 * Uses Lucene's wildcard syntax: '?' stands for exactly one letter, every
 * other position must match literally. Patterns are restricted to a-z and '?',
 * so '*' and the escape character never reach the wildcard compiler.
 *
 * Compile once and reuse across a corpus scan.
 */
public final class PositionalPattern {

    public static final char WILDCARD = WildcardQuery.WILDCARD_CHAR;

    private static final String FIELD = "word";

    private final String pattern;
    private final CharacterRunAutomaton automaton;

    private PositionalPattern(String pattern, CharacterRunAutomaton automaton) {
        this.pattern = pattern;
        this.automaton = automaton;
    }

    /**
     * Compile a normalized positional pattern (lowercase letters and '?').
     */
    public static PositionalPattern compile(String pattern) {
        Automaton wildcard = WildcardQuery.toAutomaton(new Term(FIELD, pattern));
        Automaton deterministic = Operations.determinize(wildcard, Operations.DEFAULT_DETERMINIZE_WORK_LIMIT);
        return new PositionalPattern(pattern, new CharacterRunAutomaton(deterministic));
    }

    public boolean matches(String word) {
        return word.length() == pattern.length() && automaton.run(word);
    }

    public String pattern() {
        return pattern;
    }

    @Override
    public String toString() {
        return "PositionalPattern[" + pattern + "]";
    }
}
