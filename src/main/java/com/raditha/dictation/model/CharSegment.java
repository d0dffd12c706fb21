package com.raditha.dictation.model;

/**
 * One character of a character-level word diff.
 *
 * @param type               Segment classification
 * @param text               Character to render (a placeholder glyph for
 *                           un-typed letters)
 * @param capitalizationOnly True when the only problem is a lower-case first
 *                           letter where the reference is capitalized
 */
public record CharSegment(SegmentType type, String text, boolean capitalizationOnly) {

    public static final String PLACEHOLDER_GLYPH = "_";

    public static CharSegment correct(String text) {
        return new CharSegment(SegmentType.CORRECT, text, false);
    }

    public static CharSegment incorrect(String text) {
        return new CharSegment(SegmentType.INCORRECT, text, false);
    }

    public static CharSegment capitalization(String text) {
        return new CharSegment(SegmentType.INCORRECT, text, true);
    }

    public static CharSegment placeholder(String text) {
        return new CharSegment(SegmentType.PLACEHOLDER, text, false);
    }

    public static CharSegment extra(String text) {
        return new CharSegment(SegmentType.EXTRA, text, false);
    }

    /**
     * True for segments that render a character the learner actually typed.
     */
    public boolean isTyped() {
        return type != SegmentType.PLACEHOLDER;
    }
}
