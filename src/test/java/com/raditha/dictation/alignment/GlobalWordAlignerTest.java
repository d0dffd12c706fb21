package com.raditha.dictation.alignment;

import com.raditha.dictation.model.AlignmentOp;
import com.raditha.dictation.model.OpType;
import com.raditha.dictation.similarity.SimilarityScorer;
import net.jqwik.api.*;
import net.jqwik.api.lifecycle.BeforeProperty;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for GlobalWordAligner.
 */
class GlobalWordAlignerTest {

    private GlobalWordAligner aligner;

    @BeforeEach
    @BeforeProperty
    void setUp() {
        aligner = new GlobalWordAligner(new SimilarityScorer());
    }

    @Test
    void testSubstitutionInTheMiddle() {
        List<String> reference = List.of("Der", "Hund", "läuft", "schnell");
        List<String> candidate = List.of("Der", "Hund", "rennt", "schnell");

        List<AlignmentOp> ops = aligner.align(reference, candidate, false);

        assertEquals(List.of(
                AlignmentOp.match(0, 0),
                AlignmentOp.match(1, 1),
                AlignmentOp.substitute(2, 2),
                AlignmentOp.match(3, 3)), ops);
        // 1 - (1 - 4/5) * 1.2 for the umlaut word
        assertEquals(0.76, aligner.cost(reference, candidate, ops), 0.001);
    }

    @Test
    void testIdenticalSequencesAreAllMatches() {
        List<String> words = List.of("Ich", "wohne", "in", "Berlin");
        List<AlignmentOp> ops = aligner.align(words, words, true);

        assertEquals(4, ops.size());
        assertTrue(ops.stream().allMatch(op -> op.type() == OpType.MATCH));
    }

    @Test
    void testExtraWordIsInsert() {
        List<AlignmentOp> ops = aligner.align(
                List.of("Ich", "wohne", "in", "Berlin"),
                List.of("Ich", "wohne", "jetzt", "in", "Berlin"),
                false);

        assertEquals(List.of(
                AlignmentOp.match(0, 0),
                AlignmentOp.match(1, 1),
                AlignmentOp.insert(2),
                AlignmentOp.match(2, 3),
                AlignmentOp.match(3, 4)), ops);
    }

    @Test
    void testMissingWordIsDelete() {
        List<AlignmentOp> ops = aligner.align(
                List.of("Ich", "wohne", "in", "Berlin"),
                List.of("Ich", "wohne", "Berlin"),
                false);

        assertEquals(List.of(
                AlignmentOp.match(0, 0),
                AlignmentOp.match(1, 1),
                AlignmentOp.delete(2),
                AlignmentOp.match(3, 2)), ops);
    }

    @Test
    void testCaseDecidesBetweenMatchAndSubstitute() {
        List<String> reference = List.of("Berlin");
        List<String> candidate = List.of("berlin");

        assertEquals(List.of(AlignmentOp.match(0, 0)), aligner.align(reference, candidate, false));
        assertEquals(List.of(AlignmentOp.substitute(0, 0)), aligner.align(reference, candidate, true));
    }

    @Test
    void testAlternateNotationMatches() {
        assertEquals(List.of(AlignmentOp.match(0, 0), AlignmentOp.match(1, 1)),
                aligner.align(List.of("Es", "schön"), List.of("es", "schoen"), false));
    }

    @Test
    void testEmptySequences() {
        assertEquals(List.of(AlignmentOp.insert(0), AlignmentOp.insert(1)),
                aligner.align(List.of(), List.of("a", "b"), false));
        assertEquals(List.of(AlignmentOp.delete(0), AlignmentOp.delete(1)),
                aligner.align(List.of("a", "b"), List.of(), false));
        assertTrue(aligner.align(List.of(), List.of(), false).isEmpty());
        assertTrue(aligner.align(null, null, false).isEmpty());
    }

    @Property(tries = 150)
    void alignmentReconstructsBothSequences(@ForAll("sentences") List<String> reference,
            @ForAll("sentences") List<String> candidate, @ForAll boolean preserveCase) {
        List<AlignmentOp> ops = aligner.align(reference, candidate, preserveCase);

        List<Integer> referenceIndices = ops.stream()
                .filter(AlignmentOp::hasReference)
                .map(AlignmentOp::referenceIndex)
                .toList();
        List<Integer> candidateIndices = ops.stream()
                .filter(AlignmentOp::hasCandidate)
                .map(AlignmentOp::candidateIndex)
                .toList();

        assertEquals(IntStream.range(0, reference.size()).boxed().toList(), referenceIndices);
        assertEquals(IntStream.range(0, candidate.size()).boxed().toList(), candidateIndices);
    }

    @Property(tries = 100)
    void alignmentCostNeverExceedsDeleteAllInsertAll(@ForAll("sentences") List<String> reference,
            @ForAll("sentences") List<String> candidate) {
        List<AlignmentOp> ops = aligner.align(reference, candidate, false);
        double cost = aligner.cost(reference, candidate, ops);
        assertTrue(cost <= reference.size() + candidate.size() + 1e-9);
    }

    @Provide
    Arbitrary<List<String>> sentences() {
        return Arbitraries.of("Ich", "ich", "wohne", "wone", "in", "im", "Berlin", "berlin", "schön", "schoen",
                "Montagmorgen", "morgen")
                .list()
                .ofMinSize(0)
                .ofMaxSize(7);
    }
}
