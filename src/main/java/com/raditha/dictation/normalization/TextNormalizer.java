package com.raditha.dictation.normalization;

import com.raditha.dictation.model.NormalizationOptions;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Canonicalizes learner and reference text before comparison.
 * <p>
 * Learners without a German keyboard type umlauts as {@code ae}, {@code a:} or
 * {@code a/} and the sharp s as {@code s/}. Those notations are folded into the
 * single letter first, so that every later step (and every comparison) sees the
 * same spelling no matter how it was typed.
 * <p>
 * Pipeline:
 * <ol>
 * <li>alternate notations to umlaut letters (case-insensitive, case of the base
 * letter kept)</li>
 * <li>lower-casing unless case is preserved</li>
 * <li>optional punctuation removal, followed by a second notation pass for
 * pairs the removal made adjacent</li>
 * <li>whitespace collapsed and trimmed</li>
 * </ol>
 * The result is idempotent: normalizing twice equals normalizing once.
 */
public class TextNormalizer {

    private static final Pattern ALTERNATE_NOTATION = Pattern.compile("([aouAOU])([eE:/])|([sS])/");
    private static final Pattern UMLAUT_LETTER = Pattern.compile("[äöüÄÖÜß]");
    private static final Pattern UMLAUT_NOTATION = Pattern.compile("(?i)[aou][e:/]|s/");
    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");

    /**
     * Normalize text with the given options.
     *
     * @param text    Text to normalize, may be null
     * @param options Case and punctuation handling
     * @return Normalized text, never null
     */
    public String normalize(String text, NormalizationOptions options) {
        if (text == null || text.isEmpty()) {
            return "";
        }

        String normalized = canonicalizeLetters(text);

        if (!options.preserveCase()) {
            normalized = normalized.toLowerCase(Locale.ROOT);
        }

        if (options.stripPunctuation()) {
            normalized = canonicalizeLetters(removePunctuation(normalized));
        }

        return WHITESPACE_RUN.matcher(normalized).replaceAll(" ").trim();
    }

    /**
     * Normalize with punctuation stripped, case folded unless preserved.
     */
    public String normalize(String text, boolean preserveCase) {
        return normalize(text, NormalizationOptions.of(preserveCase));
    }

    /**
     * Replace alternate notations with umlaut letters, leaving everything else
     * (case, punctuation, spacing) untouched.
     */
    public String canonicalizeLetters(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        Matcher matcher = ALTERNATE_NOTATION.matcher(text);
        if (!matcher.find()) {
            return text;
        }

        StringBuilder result = new StringBuilder(text.length());
        do {
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacementFor(matcher)));
        } while (matcher.find());
        matcher.appendTail(result);
        return result.toString();
    }

    /**
     * Remove every character that is not a letter, number or whitespace.
     */
    public String removePunctuation(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        StringBuilder result = new StringBuilder(text.length());
        text.codePoints()
                .filter(cp -> !isPunctuation(cp))
                .forEach(result::appendCodePoint);
        return result.toString();
    }

    /**
     * Check whether a raw word contains an umlaut, a sharp s, or one of their
     * alternate notations.
     */
    public boolean containsUmlautPattern(String word) {
        if (word == null || word.isEmpty()) {
            return false;
        }
        return UMLAUT_LETTER.matcher(word).find() || UMLAUT_NOTATION.matcher(word).find();
    }

    /**
     * Anything that is not a letter, number or whitespace counts as punctuation.
     */
    public static boolean isPunctuation(int codePoint) {
        return !(Character.isLetter(codePoint) || isNumber(codePoint) || Character.isWhitespace(codePoint));
    }

    /**
     * Convenience overload for a single-character string.
     */
    public static boolean isPunctuation(String character) {
        return character != null && !character.isEmpty() && isPunctuation(character.codePointAt(0));
    }

    private static boolean isNumber(int codePoint) {
        int type = Character.getType(codePoint);
        return type == Character.DECIMAL_DIGIT_NUMBER
                || type == Character.LETTER_NUMBER
                || type == Character.OTHER_NUMBER;
    }

    /**
     * Letter written by a two-character notation such as {@code oe}, {@code o:}
     * or {@code s/}, or {@code 0} when the pair is not a notation.
     */
    public static char notationLetter(char base, char mark) {
        if (base == 's' || base == 'S') {
            return mark == '/' ? 'ß' : 0;
        }
        if (mark != 'e' && mark != 'E' && mark != ':' && mark != '/') {
            return 0;
        }
        return switch (base) {
            case 'a' -> 'ä';
            case 'o' -> 'ö';
            case 'u' -> 'ü';
            case 'A' -> 'Ä';
            case 'O' -> 'Ö';
            case 'U' -> 'Ü';
            default -> 0;
        };
    }

    private static String replacementFor(Matcher matcher) {
        String pair = matcher.group();
        return String.valueOf(notationLetter(pair.charAt(0), pair.charAt(1)));
    }
}
