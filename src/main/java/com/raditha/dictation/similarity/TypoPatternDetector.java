package com.raditha.dictation.similarity;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Recognizes typical German spelling slips between a typed word and its
 * reference, so feedback can name the slip instead of only marking characters.
 */
public class TypoPatternDetector {

    private static final Map<Character, Character> UMLAUT_BASES = Map.of('ä', 'a', 'ö', 'o', 'ü', 'u');
    private static final String[] DOUBLE_VOWELS = {"ee", "aa", "oo"};
    private static final int MAX_UMLAUT_OFFSET = 2;

    /**
     * Detect all patterns explaining differences between input and reference.
     *
     * @param input     Typed word
     * @param reference Reference word
     * @return Patterns found, empty when none apply
     */
    public Set<TypoPattern> detect(String input, String reference) {
        Set<TypoPattern> patterns = EnumSet.noneOf(TypoPattern.class);
        if (input == null || reference == null || input.isEmpty() || reference.isEmpty()) {
            return patterns;
        }

        String in = input.toLowerCase(Locale.ROOT);
        String ref = reference.toLowerCase(Locale.ROOT);

        if (in.contains("sh") && !in.contains("sch") && ref.contains("sch")) {
            patterns.add(TypoPattern.SCH_AS_SH);
        }

        for (Map.Entry<Character, Character> entry : UMLAUT_BASES.entrySet()) {
            int umlautIndex = ref.indexOf(entry.getKey());
            int baseIndex = in.indexOf(entry.getValue());
            if (umlautIndex >= 0 && baseIndex >= 0 && Math.abs(umlautIndex - baseIndex) <= MAX_UMLAUT_OFFSET) {
                patterns.add(TypoPattern.MISSING_UMLAUT);
            }
        }

        if (ref.indexOf('ß') >= 0 && in.indexOf('s') >= 0 && in.indexOf('ß') < 0) {
            patterns.add(TypoPattern.ESZETT_AS_S);
        }

        for (String doubleVowel : DOUBLE_VOWELS) {
            if (ref.contains(doubleVowel) && !in.contains(doubleVowel)) {
                patterns.add(TypoPattern.SINGLE_VOWEL_FOR_DOUBLE);
            }
        }

        return patterns;
    }

    /**
     * Largest bonus among the detected patterns (0.0 when none).
     */
    public double bonus(String input, String reference) {
        return detect(input, reference).stream()
                .mapToDouble(TypoPattern::bonus)
                .max()
                .orElse(0.0);
    }
}
