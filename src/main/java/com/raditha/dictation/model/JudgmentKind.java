package com.raditha.dictation.model;

/**
 * Word-level verdict rendered by the live feedback surface.
 */
public enum JudgmentKind {
    CORRECT,
    PARTIAL,
    MISSING,
    EXTRA
}
