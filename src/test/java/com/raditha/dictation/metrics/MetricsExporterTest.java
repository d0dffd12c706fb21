package com.raditha.dictation.metrics;

import com.raditha.dictation.model.ExerciseStats;
import com.raditha.dictation.model.SentenceStats;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.OptionalDouble;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for MetricsExporter.
 */
class MetricsExporterTest {

    @TempDir
    Path tempDir;

    private MetricsExporter exporter;
    private ExerciseStats stats;

    @BeforeEach
    void setUp() {
        exporter = new MetricsExporter();
        stats = new ExerciseStats(2, 1, 8, 4, 3, 1, 50.0, 37.5, 25.0, 3, 1, 0, 4,
                List.of(new SentenceStats(0, 4, 4, 3, 1, true, false), SentenceStats.skipped(1, 4)),
                OptionalDouble.of(12.5));
    }

    @Test
    void testBuildMetrics() {
        MetricsExporter.ExerciseMetrics metrics = exporter.buildMetrics(stats, "a1-dictations");

        assertEquals("a1-dictations", metrics.exerciseName());
        assertNotNull(metrics.timestamp());
        assertEquals(0, metrics.timestamp().getNano());
        assertEquals(8, metrics.totalWords());
        assertEquals(37.5, metrics.accuracyPercentage(), 0.001);
        assertEquals(4, metrics.deletions());
        assertEquals(2, metrics.sentences().size());
        assertFalse(metrics.sentences().get(1).attempted());
    }

    @Test
    void testExportToCsv() throws IOException {
        Path csv = tempDir.resolve("metrics.csv");
        exporter.exportToCsv(exporter.buildMetrics(stats, "a1-dictations"), csv);

        List<String> lines = Files.readAllLines(csv);
        assertEquals("# Exercise Summary", lines.get(0));
        assertTrue(lines.get(1).startsWith("timestamp,exercise,total_sentences"));
        assertTrue(lines.get(2).contains(",a1-dictations,2,1,8,4,3,1,50.00,37.50,25.00,3,1,0,4,12.5"));
        assertTrue(lines.contains("# Per-Sentence Metrics"));
        assertTrue(lines.contains("1,4,4,3,1,true,false"));
        assertTrue(lines.contains("2,4,0,0,0,false,false"));
    }

    @Test
    void testCsvLeavesSpeedEmptyWhenUnknown() throws IOException {
        ExerciseStats noSpeed = new ExerciseStats(1, 1, 4, 4, 4, 0, 100.0, 100.0, 0.0, 4, 0, 0, 0,
                List.of(new SentenceStats(0, 4, 4, 4, 0, true, true)), OptionalDouble.empty());
        Path csv = tempDir.resolve("metrics.csv");
        exporter.exportToCsv(exporter.buildMetrics(noSpeed, "lesson"), csv);

        String summary = Files.readAllLines(csv).get(2);
        assertTrue(summary.endsWith(",4,0,0,0,"));
    }

    @Test
    void testJsonRoundTrip() throws IOException {
        MetricsExporter.ExerciseMetrics metrics = exporter.buildMetrics(stats, "a1-dictations");
        Path json = tempDir.resolve("metrics.json");

        exporter.exportToJson(metrics, json);

        assertTrue(Files.readString(json).contains("\"exerciseName\" : \"a1-dictations\""));
        assertEquals(metrics, exporter.readJson(json));
    }

    @Test
    void testToJsonWritesIsoTimestamp() throws IOException {
        MetricsExporter.ExerciseMetrics metrics = exporter.buildMetrics(stats, "a1-dictations");
        String json = exporter.toJson(metrics);

        assertTrue(json.contains("\"timestamp\" : \"" + metrics.timestamp().toString().substring(0, 10)));
        assertTrue(json.contains("\"wordsPerMinute\" : 12.5"));
    }
}
