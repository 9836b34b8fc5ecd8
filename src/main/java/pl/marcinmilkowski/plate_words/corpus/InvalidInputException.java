package pl.marcinmilkowski.plate_words.corpus;

/**
 * Thrown when a word, plate or solver query fails normalization
 * (non-alphabetic characters, empty text, plate length out of range).
 */
public class InvalidInputException extends IllegalArgumentException {

    public InvalidInputException(String message) {
        super(message);
    }
}
