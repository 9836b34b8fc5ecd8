package pl.marcinmilkowski.plate_words.matching;

/**
 * How many solutions a query has, bucketed.
 */
public enum LexicalFertility {
    BARREN,     // 0
    SPARSE,     // 1-5
    MODERATE,   // 6-20
    RICH,       // 21-50
    ABUNDANT;   // 51+

    public static LexicalFertility of(int matchCount) {
        if (matchCount == 0) return BARREN;
        if (matchCount <= 5) return SPARSE;
        if (matchCount <= 20) return MODERATE;
        if (matchCount <= 50) return RICH;
        return ABUNDANT;
    }
}
