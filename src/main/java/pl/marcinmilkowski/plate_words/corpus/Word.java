package pl.marcinmilkowski.plate_words.corpus;

import java.util.Locale;

/**
 * A normalized candidate word: lowercase ASCII letters only.
 *
 * Frequency is not stored here; it is always looked up in a {@link Corpus}.
 */
public record Word(String text) {

    public Word {
        text = normalize(text);
    }

    public static Word of(String raw) {
        return new Word(raw);
    }

    /**
     * Lowercase and trim, then reject anything that is not purely alphabetic.
     *
     * @throws InvalidInputException if the text is null, blank or not alphabetic
     */
    public static String normalize(String raw) {
        if (raw == null) {
            throw new InvalidInputException("Word must not be null");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        if (normalized.isEmpty()) {
            throw new InvalidInputException("Word must not be empty");
        }
        if (!isAlphabetic(normalized)) {
            throw new InvalidInputException("Word must contain only letters a-z: '" + raw + "'");
        }
        return normalized;
    }

    /**
     * Check whether a (lowercase) string contains only a-z.
     */
    public static boolean isAlphabetic(String text) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c < 'a' || c > 'z') {
                return false;
            }
        }
        return !text.isEmpty();
    }

    public int length() {
        return text.length();
    }

    @Override
    public String toString() {
        return text;
    }
}
