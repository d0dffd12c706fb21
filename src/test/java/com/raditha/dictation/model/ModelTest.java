package com.raditha.dictation.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the value types of the comparison engine.
 */
class ModelTest {

    @Test
    void testTokenize() {
        List<Token> tokens = Token.tokenize("  Ich  wohne\tin Berlin. ");
        assertEquals(4, tokens.size());
        assertEquals(new Token("Berlin.", 3), tokens.get(3));
        assertEquals(7, tokens.get(3).length());
        assertTrue(Token.tokenize("   ").isEmpty());
        assertTrue(Token.tokenize(null).isEmpty());
        assertEquals(List.of("Es", "ist", "schön"), Token.words("Es ist schön"));
    }

    @Test
    void testAlignmentOpIndices() {
        assertTrue(AlignmentOp.match(0, 0).hasReference());
        assertFalse(AlignmentOp.insert(2).hasReference());
        assertFalse(AlignmentOp.delete(1).hasCandidate());
        assertThrows(IllegalArgumentException.class, () -> new AlignmentOp(OpType.INSERT, 0, 1));
        assertThrows(IllegalArgumentException.class, () -> new AlignmentOp(OpType.MATCH, -1, 1));
        assertThrows(IllegalArgumentException.class, () -> new AlignmentOp(null, 0, 0));
    }

    @Test
    void testScoredMatch() {
        assertTrue(new ScoredMatch(0, 0.39).exceeds(0.38));
        assertFalse(new ScoredMatch(0, 0.38).exceeds(0.38));
        assertThrows(IllegalArgumentException.class, () -> new ScoredMatch(0, 1.5));
    }

    @Test
    void testDisplayText() {
        assertEquals("Berlin", WordJudgment.correct("Berlin", "berlin", 0, 0, 1.0).displayText());
        assertEquals("___", WordJudgment.missing("ist", 1).displayText());
        assertEquals("______", WordJudgment.missing("Berlin.", 3).displayText());
        assertEquals("jetzt", WordJudgment.extra("jetzt", 2).displayText());
    }

    @Test
    void testSentenceAttempt() {
        SentenceAttempt skipped = SentenceAttempt.skipped("Es ist schön");
        assertFalse(skipped.attempted());
        assertTrue(skipped.candidateWords().isEmpty());
        assertEquals(3, skipped.referenceWords().size());

        SentenceAttempt attempt = new SentenceAttempt(null, "Es ist");
        assertEquals("", attempt.reference());
        assertEquals(List.of("Es", "ist"), attempt.candidateWords());
    }

    @Test
    void testCharSegmentTyped() {
        assertFalse(CharSegment.placeholder("_").isTyped());
        assertTrue(CharSegment.extra("x").isTyped());
        assertTrue(CharSegment.capitalization("b").capitalizationOnly());
        assertEquals(SegmentType.INCORRECT, CharSegment.capitalization("b").type());
    }
}
