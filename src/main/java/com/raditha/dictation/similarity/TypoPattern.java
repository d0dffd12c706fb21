package com.raditha.dictation.similarity;

/**
 * Common German spelling slips recognized by {@link TypoPatternDetector}.
 */
public enum TypoPattern {
    SCH_AS_SH(0.15, "'sch' written as 'sh'"),
    MISSING_UMLAUT(0.15, "umlaut written as plain vowel"),
    ESZETT_AS_S(0.10, "'ß' written as 's'"),
    SINGLE_VOWEL_FOR_DOUBLE(0.10, "double vowel written as single vowel");

    private final double bonus;
    private final String description;

    TypoPattern(double bonus, String description) {
        this.bonus = bonus;
        this.description = description;
    }

    /**
     * Similarity bonus granted when this pattern explains a difference.
     */
    public double bonus() {
        return bonus;
    }

    public String description() {
        return description;
    }
}
