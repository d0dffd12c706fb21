package com.raditha.dictation.model;

/**
 * Fitness of one candidate word against one reference word.
 *
 * @param candidateIndex Index of the candidate word in the candidate sequence
 * @param score          Match score (0.0-1.0)
 */
public record ScoredMatch(int candidateIndex, double score) {

    public ScoredMatch {
        if (score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("score must be between 0.0 and 1.0, got " + score);
        }
    }

    /**
     * Check if this match beats an acceptance threshold (strictly).
     */
    public boolean exceeds(double threshold) {
        return score > threshold;
    }
}
