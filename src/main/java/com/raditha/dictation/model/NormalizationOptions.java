package com.raditha.dictation.model;

/**
 * Options controlling how text is normalized before comparison.
 *
 * @param preserveCase     Keep letter case so it stays significant for equality
 * @param stripPunctuation Remove everything that is not a letter, number or
 *                         whitespace
 */
public record NormalizationOptions(boolean preserveCase, boolean stripPunctuation) {

    /**
     * Case-insensitive comparison with punctuation removed (the common case).
     */
    public static NormalizationOptions caseInsensitive() {
        return new NormalizationOptions(false, true);
    }

    /**
     * Case-sensitive comparison with punctuation removed.
     */
    public static NormalizationOptions caseSensitive() {
        return new NormalizationOptions(true, true);
    }

    /**
     * Options for the given capitalization mode, stripping punctuation.
     */
    public static NormalizationOptions of(boolean preserveCase) {
        return preserveCase ? caseSensitive() : caseInsensitive();
    }
}
