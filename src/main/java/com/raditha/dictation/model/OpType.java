package com.raditha.dictation.model;

/**
 * Kind of a word-level edit operation in an alignment.
 */
public enum OpType {
    /** Reference and candidate word are exactly equal after normalization */
    MATCH,

    /** Candidate word stands in the place of a different reference word */
    SUBSTITUTE,

    /** Candidate word with no reference counterpart (extra word) */
    INSERT,

    /** Reference word with no candidate counterpart (missing word) */
    DELETE
}
