package com.raditha.dictation.model;

import com.raditha.dictation.similarity.TypoPattern;
import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Set;

/**
 * Verdict for one word position of a live comparison.
 * This is the unit the rendering layer consumes.
 *
 * @param kind           Verdict
 * @param referenceWord  Reference word, null for EXTRA
 * @param candidateWord  Typed word, null for MISSING
 * @param referenceIndex Index into the reference words, -1 for EXTRA
 * @param candidateIndex Index into the candidate words, -1 for MISSING
 * @param score          Match score of the pair (0.0 for MISSING and EXTRA)
 * @param charSegments   Character diff, only populated for PARTIAL
 * @param typoPatterns   Recognized typo patterns, only populated for PARTIAL
 */
public record WordJudgment(
        JudgmentKind kind,
        @Nullable String referenceWord,
        @Nullable String candidateWord,
        int referenceIndex,
        int candidateIndex,
        double score,
        List<CharSegment> charSegments,
        Set<TypoPattern> typoPatterns) {

    public WordJudgment {
        charSegments = charSegments == null ? List.of() : List.copyOf(charSegments);
        typoPatterns = typoPatterns == null ? Set.of() : Set.copyOf(typoPatterns);
    }

    public static WordJudgment correct(String referenceWord, String candidateWord,
            int referenceIndex, int candidateIndex, double score) {
        return new WordJudgment(JudgmentKind.CORRECT, referenceWord, candidateWord,
                referenceIndex, candidateIndex, score, List.of(), Set.of());
    }

    public static WordJudgment partial(String referenceWord, String candidateWord,
            int referenceIndex, int candidateIndex, double score,
            List<CharSegment> charSegments, Set<TypoPattern> typoPatterns) {
        return new WordJudgment(JudgmentKind.PARTIAL, referenceWord, candidateWord,
                referenceIndex, candidateIndex, score, charSegments, typoPatterns);
    }

    public static WordJudgment missing(String referenceWord, int referenceIndex) {
        return new WordJudgment(JudgmentKind.MISSING, referenceWord, null,
                referenceIndex, -1, 0.0, List.of(), Set.of());
    }

    public static WordJudgment extra(String candidateWord, int candidateIndex) {
        return new WordJudgment(JudgmentKind.EXTRA, null, candidateWord,
                -1, candidateIndex, 0.0, List.of(), Set.of());
    }

    /**
     * Text shown for this word: the reference word for CORRECT, the typed word for
     * PARTIAL and EXTRA, and one underscore per letter for MISSING.
     */
    public String displayText() {
        return switch (kind) {
            case CORRECT -> referenceWord;
            case PARTIAL, EXTRA -> candidateWord;
            case MISSING -> CharSegment.PLACEHOLDER_GLYPH.repeat(letterCount(referenceWord));
        };
    }

    private static int letterCount(String word) {
        return (int) word.codePoints()
                .filter(cp -> Character.isLetterOrDigit(cp))
                .count();
    }
}
