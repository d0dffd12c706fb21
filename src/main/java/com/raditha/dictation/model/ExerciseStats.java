package com.raditha.dictation.model;

import java.util.List;
import java.util.OptionalDouble;

/**
 * Statistics of a whole exercise, derived from the per-sentence attempts.
 *
 * @param totalSentences       Sentences in the exercise
 * @param completedSentences   Sentences the learner attempted
 * @param totalWords           Words in all reference sentences
 * @param attemptedWords       Words the learner typed
 * @param correctWords         Strictly correct typed words
 * @param incorrectWords       Typed words that are not strictly correct
 * @param completionPercentage attemptedWords / totalWords * 100
 * @param accuracyPercentage   correctWords / totalWords * 100
 * @param mistakePercentage    incorrectWords / attemptedWords * 100
 * @param matches              MATCH ops of the global alignment
 * @param substitutions        SUBSTITUTE ops of the global alignment
 * @param insertions           INSERT ops of the global alignment
 * @param deletions            DELETE ops of the global alignment
 * @param sentences            Per-sentence counts, in exercise order
 * @param wordsPerMinute       Typing speed, when an elapsed time was supplied
 */
public record ExerciseStats(
        int totalSentences,
        int completedSentences,
        int totalWords,
        int attemptedWords,
        int correctWords,
        int incorrectWords,
        double completionPercentage,
        double accuracyPercentage,
        double mistakePercentage,
        int matches,
        int substitutions,
        int insertions,
        int deletions,
        List<SentenceStats> sentences,
        OptionalDouble wordsPerMinute) {

    public ExerciseStats {
        sentences = sentences == null ? List.of() : List.copyOf(sentences);
        if (wordsPerMinute == null) {
            wordsPerMinute = OptionalDouble.empty();
        }
    }

    /**
     * Mistakes counted on the global alignment (every op that is not a match).
     */
    public int alignmentMistakes() {
        return substitutions + insertions + deletions;
    }

    /**
     * Format accuracy as a rounded percentage string.
     */
    public String formatAccuracy() {
        return String.format("%.0f%%", accuracyPercentage);
    }

    /**
     * Format completion as a rounded percentage string.
     */
    public String formatCompletion() {
        return String.format("%.0f%%", completionPercentage);
    }
}
