package com.raditha.dictation.metrics;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.raditha.dictation.model.ExerciseStats;
import com.raditha.dictation.model.SentenceStats;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;

/**
 * Exports exercise statistics to CSV and JSON formats for progress tracking.
 */
public class MetricsExporter {

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

    private static final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .registerModule(new Jdk8Module())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    /**
     * Exercise-level metrics, the exported view of {@link ExerciseStats}.
     */
    public record ExerciseMetrics(
            String exerciseName,
            LocalDateTime timestamp,
            int totalSentences,
            int completedSentences,
            int totalWords,
            int attemptedWords,
            int correctWords,
            int incorrectWords,
            double completionPercentage,
            double accuracyPercentage,
            double mistakePercentage,
            int matches,
            int substitutions,
            int insertions,
            int deletions,
            OptionalDouble wordsPerMinute,
            List<SentenceMetrics> sentences) {
    }

    /**
     * Per-sentence metrics.
     */
    public record SentenceMetrics(
            int sentenceIndex,
            int referenceWords,
            int attemptedWords,
            int correctWords,
            int incorrectWords,
            boolean attempted,
            boolean exact) {
    }

    /**
     * Build exportable metrics from exercise statistics.
     */
    public ExerciseMetrics buildMetrics(ExerciseStats stats, String exerciseName) {
        List<SentenceMetrics> sentences = stats.sentences().stream()
                .map(MetricsExporter::buildSentenceMetrics)
                .toList();

        return new ExerciseMetrics(
                exerciseName,
                LocalDateTime.now().withNano(0),
                stats.totalSentences(),
                stats.completedSentences(),
                stats.totalWords(),
                stats.attemptedWords(),
                stats.correctWords(),
                stats.incorrectWords(),
                stats.completionPercentage(),
                stats.accuracyPercentage(),
                stats.mistakePercentage(),
                stats.matches(),
                stats.substitutions(),
                stats.insertions(),
                stats.deletions(),
                stats.wordsPerMinute(),
                sentences);
    }

    private static SentenceMetrics buildSentenceMetrics(SentenceStats s) {
        return new SentenceMetrics(s.sentenceIndex(), s.referenceWords(), s.attemptedWords(),
                s.correctWords(), s.incorrectWords(), s.attempted(), s.exact());
    }

    /**
     * Export metrics to CSV format.
     */
    public void exportToCsv(ExerciseMetrics metrics, Path outputPath) throws IOException {
        StringBuilder csv = new StringBuilder();

        csv.append("# Exercise Summary\n");
        csv.append("timestamp,exercise,total_sentences,completed_sentences,total_words,attempted_words,"
                + "correct_words,incorrect_words,completion_pct,accuracy_pct,mistake_pct,"
                + "matches,substitutions,insertions,deletions,wpm\n");
        csv.append(String.format(Locale.ROOT, "%s,%s,%d,%d,%d,%d,%d,%d,%.2f,%.2f,%.2f,%d,%d,%d,%d,%s\n",
                metrics.timestamp().format(TIMESTAMP_FORMAT),
                metrics.exerciseName(),
                metrics.totalSentences(),
                metrics.completedSentences(),
                metrics.totalWords(),
                metrics.attemptedWords(),
                metrics.correctWords(),
                metrics.incorrectWords(),
                metrics.completionPercentage(),
                metrics.accuracyPercentage(),
                metrics.mistakePercentage(),
                metrics.matches(),
                metrics.substitutions(),
                metrics.insertions(),
                metrics.deletions(),
                metrics.wordsPerMinute().isPresent()
                        ? String.format(Locale.ROOT, "%.1f", metrics.wordsPerMinute().getAsDouble())
                        : ""));

        csv.append("\n");

        csv.append("# Per-Sentence Metrics\n");
        csv.append("sentence,reference_words,attempted_words,correct_words,incorrect_words,attempted,exact\n");
        for (SentenceMetrics sentence : metrics.sentences()) {
            csv.append(String.format(Locale.ROOT, "%d,%d,%d,%d,%d,%b,%b\n",
                    sentence.sentenceIndex() + 1,
                    sentence.referenceWords(),
                    sentence.attemptedWords(),
                    sentence.correctWords(),
                    sentence.incorrectWords(),
                    sentence.attempted(),
                    sentence.exact()));
        }

        Files.writeString(outputPath, csv.toString());
    }

    /**
     * Export metrics to JSON format.
     */
    public void exportToJson(ExerciseMetrics metrics, Path outputPath) throws IOException {
        mapper.writerWithDefaultPrettyPrinter().writeValue(outputPath.toFile(), metrics);
    }

    /**
     * Read metrics previously written by {@link #exportToJson}.
     */
    public ExerciseMetrics readJson(Path inputPath) throws IOException {
        return mapper.readValue(inputPath.toFile(), ExerciseMetrics.class);
    }

    /**
     * Render any report object as pretty-printed JSON.
     */
    public String toJson(Object value) throws IOException {
        return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
    }
}
