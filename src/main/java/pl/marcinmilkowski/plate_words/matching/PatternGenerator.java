package pl.marcinmilkowski.plate_words.matching;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Random;
import java.util.TreeSet;

/**
 * Generates candidate plate strings over an alphabet.
 */
public final class PatternGenerator {

    private PatternGenerator() {
    }

    /**
     * Every string of the given length over the alphabet, in lexicographic
     * order of the sorted, de-duplicated alphabet. For "abc" and length 2:
     * aa, ab, ac, ba, ...
     */
    public static List<String> all(String alphabet, int length) {
        char[] letters = normalizeAlphabet(alphabet);
        if (length <= 0 || letters.length == 0) {
            return List.of();
        }
        long total = (long) Math.pow(letters.length, length);
        if (total > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Too many patterns: " + letters.length + "^" + length);
        }
        List<String> result = new ArrayList<>((int) total);
        int[] digits = new int[length];
        char[] buffer = new char[length];
        for (long n = 0; n < total; n++) {
            for (int i = 0; i < length; i++) {
                buffer[i] = letters[digits[i]];
            }
            result.add(new String(buffer));
            // odometer increment, rightmost digit fastest
            for (int i = length - 1; i >= 0; i--) {
                if (++digits[i] < letters.length) break;
                digits[i] = 0;
            }
        }
        return result;
    }

    /**
     * {@code count} random strings of the given length; repeatable for a fixed seed.
     */
    public static List<String> random(String alphabet, int length, int count, long seed) {
        char[] letters = normalizeAlphabet(alphabet);
        if (length <= 0 || letters.length == 0 || count <= 0) {
            return List.of();
        }
        Random random = new Random(seed);
        List<String> result = new ArrayList<>(count);
        char[] buffer = new char[length];
        for (int n = 0; n < count; n++) {
            for (int i = 0; i < length; i++) {
                buffer[i] = letters[random.nextInt(letters.length)];
            }
            result.add(new String(buffer));
        }
        return result;
    }

    static char[] normalizeAlphabet(String alphabet) {
        TreeSet<Character> set = new TreeSet<>();
        for (char c : alphabet.toLowerCase(Locale.ROOT).toCharArray()) {
            if (c >= 'a' && c <= 'z') {
                set.add(c);
            }
        }
        char[] letters = new char[set.size()];
        int i = 0;
        for (char c : set) letters[i++] = c;
        return letters;
    }
}
