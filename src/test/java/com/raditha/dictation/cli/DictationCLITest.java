package com.raditha.dictation.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.raditha.dictation.DictationEngine;
import com.raditha.dictation.metrics.MetricsExporter;
import com.raditha.dictation.model.SentenceAttempt;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the dictation command line: exit codes, output modes and exports.
 */
class DictationCLITest {

    @TempDir
    Path tempDir;

    private ByteArrayOutputStream outContent;
    private ByteArrayOutputStream errContent;
    private PrintStream originalOut;
    private PrintStream originalErr;
    private String reference;

    @BeforeEach
    void setUp() throws Exception {
        outContent = new ByteArrayOutputStream();
        errContent = new ByteArrayOutputStream();
        originalOut = System.out;
        originalErr = System.err;
        System.setOut(new PrintStream(outContent));
        System.setErr(new PrintStream(errContent));
        reference = Paths.get(getClass().getResource("/exercises/a1-dictations.txt").toURI()).toString();
    }

    @AfterEach
    void tearDown() {
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    private String transcript(String content) throws IOException {
        Path file = tempDir.resolve("transcript.txt");
        Files.writeString(file, content);
        return file.toString();
    }

    @Test
    void testHelp() {
        int exitCode = DictationCLI.createCommandLine().execute("--help");

        assertEquals(0, exitCode);
        assertTrue(outContent.toString().contains("--case-sensitive"));
        assertTrue(outContent.toString().contains("--export"));
    }

    @Test
    void testTextReport() throws IOException {
        int exitCode = DictationCLI.createCommandLine().execute("--lesson", "A1L01", reference,
                transcript("Ich wohne in Berlin\nAm Montagmorgen gehe ich ins Buero\n"));

        assertEquals(0, exitCode);
        String output = outContent.toString();
        assertTrue(output.contains("DICTATION REPORT"));
        assertTrue(output.contains("Exercise: a1-dictations"));
        assertTrue(output.contains("Lesson: A1L01"));
        assertTrue(output.contains("Capitalization: ignored"));
        assertTrue(output.contains("Sentences attempted: 2 of 2"));
        assertFalse(output.contains("Not yet correct"));
    }

    @Test
    void testSkippedAndWrongSentences() throws IOException {
        int exitCode = DictationCLI.createCommandLine().execute("--case-sensitive", reference,
                transcript("Ich wone in berlin\n\nDas Wetter ist schoen\n"));

        assertEquals(0, exitCode);
        String output = outContent.toString();
        assertTrue(output.contains("Capitalization: checked"));
        assertTrue(output.contains("(skipped)"));
        assertTrue(output.contains("Not yet correct"));
        assertTrue(output.contains("Sentences attempted: 2 of 4"));
    }

    @Test
    void testJsonOutput() throws IOException {
        int exitCode = DictationCLI.createCommandLine().execute("--json", "--lesson", "A1L01", reference,
                transcript("Ich wohne in Berlin\nAm Montagmorgen gehe ich ins Buero\n"));

        assertEquals(0, exitCode);
        JsonNode root = new ObjectMapper().readTree(outContent.toString());
        assertEquals("a1-dictations", root.get("exercise").asText());
        assertEquals(2, root.get("sentences").size());
        assertTrue(root.get("sentences").get(0).get("correct").asBoolean());
        assertEquals(10, root.get("stats").get("correctWords").asInt());
        assertEquals(100.0, root.get("stats").get("accuracyPercentage").asDouble(), 0.001);
    }

    @Test
    void testExportBoth() throws IOException {
        Path outputDir = tempDir.resolve("reports");
        int exitCode = DictationCLI.createCommandLine().execute("--export", "both", "--output",
                outputDir.toString(), reference, transcript("Ich wohne in Berlin.\n"));

        assertEquals(0, exitCode);
        assertTrue(Files.exists(outputDir.resolve("dictation-metrics.csv")));
        Path json = outputDir.resolve("dictation-metrics.json");
        assertTrue(Files.exists(json));

        MetricsExporter.ExerciseMetrics metrics = new MetricsExporter().readJson(json);
        assertEquals(4, metrics.totalSentences());
        assertEquals(1, metrics.completedSentences());
    }

    @Test
    void testInvalidExportFormat() {
        int exitCode = DictationCLI.createCommandLine().execute("--export", "xml", reference);

        assertEquals(2, exitCode);
        assertTrue(errContent.toString().contains("xml"));
    }

    @Test
    void testInvalidPreset() throws IOException {
        int exitCode = DictationCLI.createCommandLine().execute("--preset", "bogus", reference,
                transcript("Ich wohne in Berlin.\n"));

        assertEquals(2, exitCode);
        assertTrue(errContent.toString().contains("Preset must be"));
    }

    @Test
    void testUnknownLesson() throws IOException {
        int exitCode = DictationCLI.createCommandLine().execute("--lesson", "B2L09", reference,
                transcript("Ich wohne in Berlin.\n"));

        assertEquals(2, exitCode);
        assertTrue(errContent.toString().contains("Unknown lesson: B2L09"));
    }

    @Test
    void testOutputPathIsAFile() throws IOException {
        Path file = tempDir.resolve("not-a-dir");
        Files.writeString(file, "x");

        int exitCode = DictationCLI.createCommandLine().execute("--export", "csv", "--output", file.toString(),
                reference, transcript("Ich wohne in Berlin.\n"));

        assertEquals(2, exitCode);
    }

    @Test
    void testMissingReferenceFile() throws IOException {
        int exitCode = DictationCLI.createCommandLine().execute(tempDir.resolve("missing.txt").toString(),
                transcript("Ich wohne in Berlin.\n"));

        assertEquals(3, exitCode);
        assertTrue(errContent.toString().contains("I/O error"));
    }

    @Test
    void testMissingConfigFile() throws IOException {
        int exitCode = DictationCLI.createCommandLine().execute("--config-file",
                tempDir.resolve("absent.yml").toString(), reference, transcript("Ich wohne in Berlin.\n"));

        assertEquals(3, exitCode);
    }

    @Test
    void testMissingReferenceArgument() {
        assertEquals(2, DictationCLI.createCommandLine().execute());
    }

    @Test
    void testBuildAttempts() {
        List<SentenceAttempt> attempts = DictationCLI.buildAttempts(
                List.of("Eins.", "Zwei.", "Drei."), List.of("eins", "   "));

        assertEquals(3, attempts.size());
        assertTrue(attempts.get(0).attempted());
        assertEquals("eins", attempts.get(0).candidate());
        assertFalse(attempts.get(1).attempted());
        assertFalse(attempts.get(2).attempted());
    }

    @Test
    void testBuildReport() {
        DictationReport report = DictationCLI.buildReport(new DictationEngine(), "inline", null,
                List.of(new SentenceAttempt("Ich wohne in Berlin.", "Ich wone in Berlin"),
                        SentenceAttempt.skipped("Das Wetter ist schön.")),
                false);

        assertEquals(2, report.sentences().size());
        DictationReport.SentenceReport first = report.sentences().get(0);
        assertFalse(first.correct());
        assertEquals(4, first.judgments().size());
        assertEquals(4, first.alignment().size());
        DictationReport.SentenceReport second = report.sentences().get(1);
        assertNull(second.candidate());
        assertTrue(second.judgments().isEmpty());
        assertEquals(3, report.stats().correctWords());
        assertEquals(8, report.stats().totalWords());
    }
}
