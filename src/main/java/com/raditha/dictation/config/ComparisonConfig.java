package com.raditha.dictation.config;

import com.raditha.dictation.similarity.KeyboardLayout;

import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Tuning constants of the comparison engine.
 * The defaults are empirically tuned values; they are kept configurable rather
 * than derived.
 *
 * @param windowSize                     Candidate words searched ahead per
 *                                       reference word in live matching
 * @param acceptanceThreshold            Live match is accepted above this score
 * @param caseSensitivePositionPenalty   Penalty per look-ahead position when
 *                                       case matters
 * @param caseInsensitivePositionPenalty Penalty per look-ahead position when
 *                                       case is ignored
 * @param penaltyFloor                   Position penalty never pushes a score
 *                                       below this value
 * @param earlyExitScore                 Look-ahead stops once a score exceeds
 *                                       this value
 * @param compoundScore                  Score of a compound-word containment
 * @param umlautBoost                    Similarity multiplier for words with
 *                                       umlaut notations
 * @param functionWords                  Short words matched only exactly and
 *                                       given a leniency boost
 * @param keyboardLayout                 Layout used for proximity-weighted
 *                                       distances
 */
public record ComparisonConfig(
        int windowSize,
        double acceptanceThreshold,
        double caseSensitivePositionPenalty,
        double caseInsensitivePositionPenalty,
        double penaltyFloor,
        double earlyExitScore,
        double compoundScore,
        double umlautBoost,
        Set<String> functionWords,
        KeyboardLayout keyboardLayout) {

    public static final Set<String> DEFAULT_FUNCTION_WORDS = Set.of("in", "ihr", "ist", "es", "der", "die", "das");

    /**
     * Validate configuration.
     */
    public ComparisonConfig {
        if (windowSize < 1) {
            throw new IllegalArgumentException("windowSize must be >= 1");
        }
        requireUnitRange("acceptanceThreshold", acceptanceThreshold);
        requireUnitRange("caseSensitivePositionPenalty", caseSensitivePositionPenalty);
        requireUnitRange("caseInsensitivePositionPenalty", caseInsensitivePositionPenalty);
        requireUnitRange("penaltyFloor", penaltyFloor);
        requireUnitRange("earlyExitScore", earlyExitScore);
        requireUnitRange("compoundScore", compoundScore);
        if (umlautBoost < 1.0) {
            throw new IllegalArgumentException("umlautBoost must be >= 1.0");
        }
        functionWords = functionWords == null
                ? Set.of()
                : functionWords.stream()
                        .map(w -> w.toLowerCase(Locale.ROOT))
                        .collect(Collectors.toUnmodifiableSet());
        if (keyboardLayout == null) {
            keyboardLayout = KeyboardLayout.QWERTZ;
        }
    }

    /**
     * Standard preset: the tuned values of the live feedback.
     */
    public static ComparisonConfig standard() {
        return new ComparisonConfig(
                5, // windowSize
                0.38, // acceptanceThreshold
                0.01, // caseSensitivePositionPenalty
                0.03, // caseInsensitivePositionPenalty
                0.4, // penaltyFloor
                0.95, // earlyExitScore
                0.85, // compoundScore
                1.2, // umlautBoost
                DEFAULT_FUNCTION_WORDS,
                KeyboardLayout.QWERTZ);
    }

    /**
     * Strict preset: shorter look-ahead and a higher bar for accepting a match.
     */
    public static ComparisonConfig strict() {
        return new ComparisonConfig(
                3,
                0.5,
                0.03,
                0.05,
                0.4,
                0.95,
                0.8,
                1.1,
                DEFAULT_FUNCTION_WORDS,
                KeyboardLayout.QWERTZ);
    }

    /**
     * Lenient preset: longer look-ahead, cheaper word-order slips.
     */
    public static ComparisonConfig lenient() {
        return new ComparisonConfig(
                7,
                0.3,
                0.01,
                0.02,
                0.35,
                0.95,
                0.85,
                1.2,
                DEFAULT_FUNCTION_WORDS,
                KeyboardLayout.AUTO);
    }

    /**
     * Resolve a preset by name; unknown names fall back to standard.
     */
    public static ComparisonConfig preset(String name) {
        if (name == null) {
            return standard();
        }
        return switch (name.toLowerCase(Locale.ROOT)) {
            case "strict" -> strict();
            case "lenient" -> lenient();
            default -> standard();
        };
    }

    /**
     * Position penalty per look-ahead step for the given capitalization mode.
     */
    public double positionPenalty(boolean preserveCase) {
        return preserveCase ? caseSensitivePositionPenalty : caseInsensitivePositionPenalty;
    }

    public boolean isFunctionWord(String word) {
        return word != null && functionWords.contains(word.toLowerCase(Locale.ROOT));
    }

    private static void requireUnitRange(String name, double value) {
        if (value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException(name + " must be between 0.0 and 1.0");
        }
    }
}
