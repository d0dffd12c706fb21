package com.raditha.dictation.similarity;

import com.raditha.dictation.config.ComparisonConfig;
import com.raditha.dictation.model.NormalizationOptions;
import com.raditha.dictation.normalization.TextNormalizer;

/**
 * Word-level similarity measures built on edit distance.
 * <p>
 * Every measure except {@link #distance} normalizes its inputs first, so the
 * alternate umlaut notations and punctuation never count as differences.
 */
public class SimilarityScorer {

    /**
     * Normal forms of one word.
     *
     * @param folded        Case-folded normal form
     * @param cased         Normal form with case kept
     * @param umlautPattern Whether the raw word has an umlaut or a notation of one
     */
    public record PreparedWord(String folded, String cased, boolean umlautPattern) {
    }

    private static final int SHORT_WORD_LENGTH = 3;
    private static final int SHORT_WORD_TOLERANCE = 1;
    private static final int LONG_WORD_TOLERANCE = 2;

    private static final int MIN_COMPOUND_PART = 3;
    private static final int MIN_COMPOUND_SUFFIX = 4;
    private static final double MIN_COMPOUND_RATIO = 0.3;
    private static final int SHARED_TAIL_MIN_LENGTH = 6;
    private static final int SHARED_TAIL_OFFSET = 3;

    private final TextNormalizer normalizer;
    private final LevenshteinDistance levenshtein;
    private final KeyboardProximity proximity;
    private final ComparisonConfig config;

    public SimilarityScorer() {
        this(new TextNormalizer(), ComparisonConfig.standard());
    }

    public SimilarityScorer(TextNormalizer normalizer, ComparisonConfig config) {
        this.normalizer = normalizer;
        this.levenshtein = new LevenshteinDistance();
        this.proximity = new KeyboardProximity();
        this.config = config;
    }

    /**
     * Unit-cost edit distance between the raw strings.
     * Symmetric, zero iff the strings are equal.
     */
    public int distance(String a, String b) {
        return levenshtein.compute(a, b);
    }

    /**
     * Edit distance where substituting neighbouring keys costs less.
     */
    public double weightedDistance(String a, String b, KeyboardLayout layout) {
        return levenshtein.computeWeighted(a, b, proximity, layout);
    }

    /**
     * Edit distance weighted with the configured keyboard layout.
     */
    public double weightedDistance(String a, String b) {
        return weightedDistance(a, b, config.keyboardLayout());
    }

    /**
     * Similarity of two words in [0,1].
     * Identical normal forms score 1.0; otherwise {@code 1 - distance/maxLen},
     * boosted when either raw word carries an umlaut or one of its notations.
     */
    public double similarity(String a, String b) {
        return similarity(prepare(a), prepare(b));
    }

    /**
     * Similarity of two prepared words, same result as {@link #similarity(String, String)}.
     */
    public double similarity(PreparedWord a, PreparedWord b) {
        if (a.folded().equals(b.folded())) {
            return 1.0;
        }

        int maxLength = Math.max(a.folded().length(), b.folded().length());
        double similarity = 1.0 - ((double) levenshtein.compute(a.folded(), b.folded()) / maxLength);

        if (a.umlautPattern() || b.umlautPattern()) {
            similarity = Math.min(1.0, similarity * config.umlautBoost());
        }
        return similarity;
    }

    /**
     * Check if two words are close enough to be the same word misspelled.
     * Short words (3 characters or fewer) tolerate one edit, longer words two.
     */
    public boolean areSimilar(String a, String b) {
        String na = normalizer.normalize(a, NormalizationOptions.caseInsensitive());
        String nb = normalizer.normalize(b, NormalizationOptions.caseInsensitive());
        if (na.equals(nb)) {
            return true;
        }
        if (na.isEmpty() || nb.isEmpty()) {
            return false;
        }

        int longer = Math.max(na.length(), nb.length());
        int tolerance = longer <= SHORT_WORD_LENGTH ? SHORT_WORD_TOLERANCE : LONG_WORD_TOLERANCE;
        return levenshtein.compute(na, nb) <= tolerance;
    }

    /**
     * Strict equality after normalization, with no edit-distance leniency.
     * This is the only comparison used for statistics and for marking a word
     * correct on the results screen.
     */
    public boolean areExactlyEqual(String a, String b, boolean preserveCase) {
        if (a == null || b == null) {
            return false;
        }
        NormalizationOptions options = NormalizationOptions.of(preserveCase);
        return normalizer.normalize(a, options).equals(normalizer.normalize(b, options));
    }

    public boolean areExactlyEqual(PreparedWord a, PreparedWord b, boolean preserveCase) {
        return preserveCase ? a.cased().equals(b.cased()) : a.folded().equals(b.folded());
    }

    /**
     * Normalize a word once for repeated scoring against many others.
     */
    public PreparedWord prepare(String word) {
        return new PreparedWord(
                normalizer.normalize(word, NormalizationOptions.caseInsensitive()),
                normalizer.normalize(word, NormalizationOptions.caseSensitive()),
                normalizer.containsUmlautPattern(word));
    }

    /**
     * Check if one word appears inside the other (either direction), after
     * normalization and case folding.
     */
    public boolean isCompoundSubstring(String a, String b) {
        String na = normalizer.normalize(a, NormalizationOptions.caseInsensitive());
        String nb = normalizer.normalize(b, NormalizationOptions.caseInsensitive());
        if (na.isEmpty() || nb.isEmpty()) {
            return false;
        }
        return na.contains(nb) || nb.contains(na);
    }

    /**
     * Guarded compound rule: is {@code part} a plausible piece of
     * {@code compound}? Function words only match themselves; short or tiny
     * fragments do not count.
     */
    public boolean isCompoundPart(String part, String compound) {
        String p = normalizer.normalize(part, NormalizationOptions.caseInsensitive());
        String c = normalizer.normalize(compound, NormalizationOptions.caseInsensitive());
        if (p.isEmpty() || c.isEmpty()) {
            return false;
        }
        if (p.equals(c)) {
            return true;
        }
        if (config.isFunctionWord(p) || config.isFunctionWord(c)) {
            return false;
        }

        if (c.contains(p) && p.length() >= MIN_COMPOUND_PART
                && (double) p.length() / c.length() >= MIN_COMPOUND_RATIO) {
            return true;
        }
        if (c.endsWith(p) && p.length() >= MIN_COMPOUND_SUFFIX) {
            return true;
        }
        if (c.startsWith(p) && p.length() >= MIN_COMPOUND_PART) {
            return true;
        }

        // Same tail behind a garbled start, e.g. "antagmorgen" for "montagmorgen"
        if (p.length() >= SHARED_TAIL_MIN_LENGTH && c.length() >= SHARED_TAIL_MIN_LENGTH) {
            String partTail = p.substring(SHARED_TAIL_OFFSET);
            return partTail.length() >= MIN_COMPOUND_SUFFIX && partTail.equals(c.substring(SHARED_TAIL_OFFSET));
        }
        return false;
    }

    public TextNormalizer normalizer() {
        return normalizer;
    }

    public ComparisonConfig config() {
        return config;
    }
}
