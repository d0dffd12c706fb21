package com.raditha.dictation.model;

/**
 * Classification of one rendered character of a word diff.
 */
public enum SegmentType {
    /** Typed character matches the reference character */
    CORRECT,

    /** Typed character is wrong (garbled, inserted, or wrong case) */
    INCORRECT,

    /** Reference character the learner has not typed */
    PLACEHOLDER,

    /** Typed character beyond the reference word */
    EXTRA
}
