package com.raditha.dictation.cli;

import com.raditha.dictation.metrics.MetricsExporter.ExerciseMetrics;
import com.raditha.dictation.model.CharSegment;
import com.raditha.dictation.model.WordJudgment;
import com.raditha.dictation.similarity.TypoPattern;

import java.io.PrintStream;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders a {@link DictationReport} as plain text.
 * <p>
 * Word markup: correct words as typed, {@code [x]} for a wrong character,
 * {@code (x)} for an extra character, {@code _} for a letter not typed yet,
 * {@code +word} for an extra word.
 */
@SuppressWarnings("java:S106")
public class ReportPrinter {

    private final PrintStream out;

    public ReportPrinter(PrintStream out) {
        this.out = out;
    }

    public void print(DictationReport report) {
        out.println("=".repeat(80));
        out.println("DICTATION REPORT");
        out.println("=".repeat(80));
        out.println();
        out.printf("Exercise: %s%n", report.exercise());
        if (report.lesson() != null) {
            out.printf("Lesson: %s%n", report.lesson());
        }
        out.printf("Capitalization: %s%n", report.caseSensitive() ? "checked" : "ignored");
        out.println();

        for (DictationReport.SentenceReport sentence : report.sentences()) {
            printSentence(sentence);
        }

        printSummary(report.stats());
    }

    private void printSentence(DictationReport.SentenceReport sentence) {
        out.println("-".repeat(80));
        out.printf("Sentence %d: %s%n", sentence.index() + 1, sentence.reference());
        if (sentence.candidate() == null) {
            out.println("  (skipped)");
            out.println();
            return;
        }

        out.printf("  Typed:    %s%n", sentence.candidate());
        out.printf("  Feedback: %s%n", render(sentence.judgments()));
        for (WordJudgment judgment : sentence.judgments()) {
            if (!judgment.typoPatterns().isEmpty()) {
                out.printf("    %s: %s%n", judgment.candidateWord(), judgment.typoPatterns().stream()
                        .map(TypoPattern::description)
                        .sorted()
                        .collect(Collectors.joining("; ")));
            }
        }
        out.println(sentence.correct() ? "  ✓ Correct" : "  ✗ Not yet correct");
        out.println();
    }

    private void printSummary(ExerciseMetrics stats) {
        out.println("=".repeat(80));
        out.println("SUMMARY");
        out.println("=".repeat(80));
        out.printf("Sentences attempted: %d of %d%n", stats.completedSentences(), stats.totalSentences());
        out.printf("Words typed: %d of %d (%.0f%% complete)%n",
                stats.attemptedWords(), stats.totalWords(), stats.completionPercentage());
        out.printf("Correct words: %d (%.0f%% accuracy)%n", stats.correctWords(), stats.accuracyPercentage());
        out.printf("Incorrect words: %d (%.0f%%)%n", stats.incorrectWords(), stats.mistakePercentage());
        out.printf("Alignment: %d matched, %d substituted, %d extra, %d missing%n",
                stats.matches(), stats.substitutions(), stats.insertions(), stats.deletions());
        stats.wordsPerMinute().ifPresent(wpm -> out.printf("Speed: %.1f words per minute%n", wpm));
        out.println();
    }

    /**
     * Render live judgments as one line of marked-up words.
     */
    static String render(List<WordJudgment> judgments) {
        return judgments.stream()
                .map(ReportPrinter::render)
                .collect(Collectors.joining(" "));
    }

    static String render(WordJudgment judgment) {
        return switch (judgment.kind()) {
            case CORRECT, MISSING -> judgment.displayText();
            case EXTRA -> "+" + judgment.displayText();
            case PARTIAL -> judgment.charSegments().isEmpty()
                    ? judgment.displayText()
                    : renderSegments(judgment.charSegments());
        };
    }

    private static String renderSegments(List<CharSegment> segments) {
        StringBuilder sb = new StringBuilder();
        for (CharSegment segment : segments) {
            switch (segment.type()) {
                case CORRECT, PLACEHOLDER -> sb.append(segment.text());
                case INCORRECT -> sb.append('[').append(segment.text()).append(']');
                case EXTRA -> sb.append('(').append(segment.text()).append(')');
            }
        }
        return sb.toString();
    }
}
