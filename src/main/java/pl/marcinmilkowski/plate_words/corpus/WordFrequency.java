package pl.marcinmilkowski.plate_words.corpus;

/**
 * A corpus word paired with its frequency.
 */
public record WordFrequency(
    String word,       // normalized lowercase word
    long frequency     // corpus frequency, >= 0
) {

    @Override
    public String toString() {
        return word + "=" + frequency;
    }
}
