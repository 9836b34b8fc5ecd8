package pl.marcinmilkowski.plate_words.corpus;

import java.util.Locale;

/**
 * The puzzle's letter sequence ("plate"), stored uppercase.
 *
 * Length is bounded to [{@value #MIN_LENGTH}, {@value #MAX_LENGTH}].
 * Matching is done on the lowercase {@link #query()} form.
 */
public record Plate(String letters) implements Comparable<Plate> {

    public static final int MIN_LENGTH = 2;
    public static final int MAX_LENGTH = 8;

    public Plate {
        if (letters == null) {
            throw new InvalidInputException("Plate must not be null");
        }
        String lower = letters.trim().toLowerCase(Locale.ROOT);
        if (!Word.isAlphabetic(lower)) {
            throw new InvalidInputException("Plate must contain only letters a-z: '" + letters + "'");
        }
        if (lower.length() < MIN_LENGTH || lower.length() > MAX_LENGTH) {
            throw new InvalidInputException(String.format(Locale.ROOT,
                "Plate length must be between %d and %d: '%s'", MIN_LENGTH, MAX_LENGTH, letters));
        }
        letters = lower.toUpperCase(Locale.ROOT);
    }

    public static Plate of(String raw) {
        return new Plate(raw);
    }

    /**
     * Lowercase form used against corpus words.
     */
    public String query() {
        return letters.toLowerCase(Locale.ROOT);
    }

    public int length() {
        return letters.length();
    }

    @Override
    public int compareTo(Plate other) {
        return letters.compareTo(other.letters);
    }

    @Override
    public String toString() {
        return letters;
    }
}
