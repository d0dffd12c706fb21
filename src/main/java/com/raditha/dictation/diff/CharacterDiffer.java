package com.raditha.dictation.diff;

import com.raditha.dictation.model.CharSegment;
import com.raditha.dictation.normalization.TextNormalizer;

import java.util.ArrayList;
import java.util.List;

/**
 * Explains an imperfect word pair character by character.
 * <p>
 * The differ tries three shortcuts before falling back to a forward scan:
 * words equal up to case, a typed fragment inside the reference (compound
 * words such as "morgen" for "Montagmorgen") and a reference inside a longer
 * typed word. The scan resynchronizes with a short look-ahead on either side.
 * <p>
 * Words are compared as letter units. An umlaut notation such as {@code o:}
 * is one unit; a typed {@code oe} is one unit only when the reference has an
 * {@code ö}, so ordinary letter pairs like the {@code ue} of "Feuer" stay two
 * letters. Segments always carry the text the learner typed.
 */
public class CharacterDiffer {

    private static final int LOOK_AHEAD_LIMIT = 3;
    private static final String UMLAUTS = "äöü";

    /**
     * One compared letter and the raw text it was read from.
     */
    private record Unit(char letter, String text) {
    }

    /**
     * Diff a typed word against its reference word.
     *
     * @param referenceWord Reference word
     * @param candidateWord Typed word
     * @param preserveCase  Whether a case difference makes a character incorrect
     * @return Segments in display order
     */
    public List<CharSegment> diffChars(String referenceWord, String candidateWord, boolean preserveCase) {
        String rawExpected = referenceWord == null ? "" : referenceWord;
        String rawActual = candidateWord == null ? "" : candidateWord;

        if (!rawActual.isEmpty() && lower(rawExpected).equals(lower(rawActual))) {
            return caseOnly(plainUnits(rawExpected), plainUnits(rawActual), preserveCase);
        }

        List<Unit> expected = units(rawExpected, "");
        List<Unit> actual = units(rawActual, umlautsOf(expected));

        if (actual.isEmpty()) {
            return placeholders(expected, 0, expected.size());
        }
        if (expected.isEmpty()) {
            return extras(actual, 0, actual.size());
        }

        String expectedLower = lower(letters(expected));
        String actualLower = lower(letters(actual));

        if (expectedLower.equals(actualLower)) {
            return caseOnly(expected, actual, preserveCase);
        }

        int start = expectedLower.indexOf(actualLower);
        if (start >= 0) {
            return fragmentOfReference(expected, actual, start, preserveCase);
        }

        start = actualLower.indexOf(expectedLower);
        if (start >= 0) {
            return referenceInsideCandidate(expected, actual, start, preserveCase);
        }

        return scan(expected, actual, preserveCase);
    }

    /**
     * Split a word into letter units. Notations with {@code :} or {@code /}
     * always fold; an {@code e} digraph folds only into one of the given
     * umlauts.
     */
    private static List<Unit> units(String word, String foldableUmlauts) {
        List<Unit> units = new ArrayList<>(word.length());
        int i = 0;
        while (i < word.length()) {
            char c = word.charAt(i);
            if (i + 1 < word.length()) {
                char mark = word.charAt(i + 1);
                char letter = TextNormalizer.notationLetter(c, mark);
                boolean digraph = mark == 'e' || mark == 'E';
                if (letter != 0 && (!digraph || foldableUmlauts.indexOf(Character.toLowerCase(letter)) >= 0)) {
                    units.add(new Unit(letter, word.substring(i, i + 2)));
                    i += 2;
                    continue;
                }
            }
            units.add(new Unit(c, String.valueOf(c)));
            i++;
        }
        return units;
    }

    private static List<Unit> plainUnits(String word) {
        List<Unit> units = new ArrayList<>(word.length());
        for (int i = 0; i < word.length(); i++) {
            units.add(new Unit(word.charAt(i), String.valueOf(word.charAt(i))));
        }
        return units;
    }

    private static String umlautsOf(List<Unit> units) {
        StringBuilder sb = new StringBuilder();
        for (Unit unit : units) {
            char letter = Character.toLowerCase(unit.letter());
            if (UMLAUTS.indexOf(letter) >= 0) {
                sb.append(letter);
            }
        }
        return sb.toString();
    }

    private static String letters(List<Unit> units) {
        StringBuilder sb = new StringBuilder(units.size());
        for (Unit unit : units) {
            sb.append(unit.letter());
        }
        return sb.toString();
    }

    // Per character, so indices stay aligned with the units
    private static String lower(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            sb.append(Character.toLowerCase(text.charAt(i)));
        }
        return sb.toString();
    }

    private static List<CharSegment> caseOnly(List<Unit> expected, List<Unit> actual, boolean preserveCase) {
        List<CharSegment> segments = new ArrayList<>(actual.size());
        for (int i = 0; i < actual.size(); i++) {
            segments.add(compare(expected, i, actual.get(i), preserveCase));
        }
        return segments;
    }

    private static List<CharSegment> fragmentOfReference(List<Unit> expected, List<Unit> actual, int start,
            boolean preserveCase) {
        List<CharSegment> segments = new ArrayList<>(placeholders(expected, 0, start));
        for (int i = 0; i < actual.size(); i++) {
            segments.add(compare(expected, start + i, actual.get(i), preserveCase));
        }
        segments.addAll(placeholders(expected, start + actual.size(), expected.size()));
        return segments;
    }

    private static List<CharSegment> referenceInsideCandidate(List<Unit> expected, List<Unit> actual, int start,
            boolean preserveCase) {
        List<CharSegment> segments = new ArrayList<>(extras(actual, 0, start));
        for (int i = 0; i < expected.size(); i++) {
            segments.add(compare(expected, i, actual.get(start + i), preserveCase));
        }
        segments.addAll(extras(actual, start + expected.size(), actual.size()));
        return segments;
    }

    private static List<CharSegment> scan(List<Unit> expected, List<Unit> actual, boolean preserveCase) {
        List<CharSegment> segments = new ArrayList<>();
        int e = 0;
        int a = 0;

        while (e < expected.size()) {
            char charExpected = expected.get(e).letter();

            if (TextNormalizer.isPunctuation(charExpected)) {
                if (a < actual.size() && actual.get(a).letter() == charExpected) {
                    segments.add(CharSegment.correct(actual.get(a).text()));
                    a++;
                } else {
                    segments.add(CharSegment.placeholder(String.valueOf(charExpected)));
                }
                e++;
                continue;
            }

            if (a >= actual.size()) {
                segments.add(placeholder(charExpected));
                e++;
                continue;
            }

            Unit unitActual = actual.get(a);
            if (TextNormalizer.isPunctuation(unitActual.letter())) {
                segments.add(CharSegment.incorrect(unitActual.text()));
                a++;
                continue;
            }

            if (same(charExpected, unitActual.letter(), preserveCase)) {
                segments.add(CharSegment.correct(unitActual.text()));
                e++;
                a++;
                continue;
            }

            int skipActual = lookAhead(charExpected, actual, a, preserveCase);
            if (skipActual > 0) {
                for (int k = 0; k < skipActual; k++) {
                    segments.add(CharSegment.incorrect(actual.get(a + k).text()));
                }
                a += skipActual;
                continue;
            }

            int skipExpected = lookAhead(unitActual.letter(), expected, e, preserveCase);
            if (skipExpected > 0) {
                for (int k = 0; k < skipExpected; k++) {
                    segments.add(placeholder(expected.get(e + k).letter()));
                }
                e += skipExpected;
                continue;
            }

            segments.add(CharSegment.incorrect(unitActual.text()));
            e++;
            a++;
        }

        segments.addAll(extras(actual, a, actual.size()));
        return segments;
    }

    /**
     * Distance (1..3) to the next occurrence of {@code target} after
     * {@code from} in {@code units}, or 0 when it is not within reach.
     */
    private static int lookAhead(char target, List<Unit> units, int from, boolean preserveCase) {
        for (int i = 1; i <= LOOK_AHEAD_LIMIT && from + i < units.size(); i++) {
            if (same(target, units.get(from + i).letter(), preserveCase)) {
                return i;
            }
        }
        return 0;
    }

    private static CharSegment compare(List<Unit> expected, int index, Unit actual, boolean preserveCase) {
        char e = expected.get(index).letter();
        char a = actual.letter();
        if (same(e, a, preserveCase)) {
            return CharSegment.correct(actual.text());
        }
        if (index == 0 && Character.isUpperCase(e) && Character.toLowerCase(e) == a) {
            return CharSegment.capitalization(actual.text());
        }
        return CharSegment.incorrect(actual.text());
    }

    private static boolean same(char expected, char actual, boolean preserveCase) {
        if (preserveCase) {
            return expected == actual;
        }
        return Character.toLowerCase(expected) == Character.toLowerCase(actual);
    }

    private static CharSegment placeholder(char expected) {
        // Punctuation stays visible so the learner sees what is missing
        return CharSegment.placeholder(TextNormalizer.isPunctuation(expected)
                ? String.valueOf(expected)
                : CharSegment.PLACEHOLDER_GLYPH);
    }

    private static List<CharSegment> placeholders(List<Unit> expected, int from, int to) {
        List<CharSegment> segments = new ArrayList<>();
        for (int i = from; i < to; i++) {
            segments.add(placeholder(expected.get(i).letter()));
        }
        return segments;
    }

    private static List<CharSegment> extras(List<Unit> actual, int from, int to) {
        List<CharSegment> segments = new ArrayList<>();
        for (int i = from; i < to; i++) {
            segments.add(CharSegment.extra(actual.get(i).text()));
        }
        return segments;
    }
}
