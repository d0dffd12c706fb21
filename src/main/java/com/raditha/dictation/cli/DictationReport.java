package com.raditha.dictation.cli;

import com.raditha.dictation.metrics.MetricsExporter;
import com.raditha.dictation.model.AlignmentOp;
import com.raditha.dictation.model.WordJudgment;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Everything the CLI reports for one checked transcript.
 *
 * @param exercise      Exercise name
 * @param lesson        Selected lesson, null when all lessons were checked
 * @param caseSensitive Whether capitalization was checked
 * @param sentences     Per-sentence results in exercise order
 * @param stats         Aggregated statistics
 */
public record DictationReport(
        String exercise,
        @Nullable String lesson,
        boolean caseSensitive,
        List<SentenceReport> sentences,
        MetricsExporter.ExerciseMetrics stats) {

    public DictationReport {
        sentences = List.copyOf(sentences);
    }

    /**
     * Result for one sentence.
     *
     * @param index     Zero-based sentence index
     * @param reference Reference sentence
     * @param candidate Typed text, null when skipped
     * @param correct   Whole sentence correct after normalization
     * @param judgments Live word judgments
     * @param alignment Global word alignment
     */
    public record SentenceReport(
            int index,
            String reference,
            @Nullable String candidate,
            boolean correct,
            List<WordJudgment> judgments,
            List<AlignmentOp> alignment) {

        public SentenceReport {
            judgments = List.copyOf(judgments);
            alignment = List.copyOf(alignment);
        }
    }
}
