package com.raditha.dictation.model;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * A reference sentence and the learner's final text for it.
 *
 * @param reference Reference sentence
 * @param candidate Learner's text, or null when the sentence was not attempted
 */
public record SentenceAttempt(String reference, @Nullable String candidate) {

    public SentenceAttempt {
        if (reference == null) {
            reference = "";
        }
    }

    public static SentenceAttempt skipped(String reference) {
        return new SentenceAttempt(reference, null);
    }

    public boolean attempted() {
        return candidate != null;
    }

    public List<String> referenceWords() {
        return Token.words(reference);
    }

    /**
     * Words typed by the learner, empty when not attempted.
     */
    public List<String> candidateWords() {
        return candidate == null ? List.of() : Token.words(candidate);
    }
}
