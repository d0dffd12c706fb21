package com.raditha.dictation.model;

/**
 * Word counts for one sentence.
 *
 * @param sentenceIndex  Position of the sentence in the exercise
 * @param referenceWords Number of words in the reference sentence
 * @param attemptedWords Number of words the learner typed
 * @param correctWords   Typed words strictly equal to a distinct reference word
 * @param incorrectWords Typed words that are not strictly correct
 * @param attempted      False when the sentence was skipped
 * @param exact          True when the whole sentence is correct after
 *                       normalization
 */
public record SentenceStats(
        int sentenceIndex,
        int referenceWords,
        int attemptedWords,
        int correctWords,
        int incorrectWords,
        boolean attempted,
        boolean exact) {

    public static SentenceStats skipped(int sentenceIndex, int referenceWords) {
        return new SentenceStats(sentenceIndex, referenceWords, 0, 0, 0, false, false);
    }
}
