package com.raditha.dictation.cli;

import com.raditha.dictation.DictationEngine;
import com.raditha.dictation.config.ComparisonConfig;
import com.raditha.dictation.config.ComparisonSettings;
import com.raditha.dictation.exercise.Exercise;
import com.raditha.dictation.exercise.ExerciseLoader;
import com.raditha.dictation.exercise.Lesson;
import com.raditha.dictation.metrics.MetricsExporter;
import com.raditha.dictation.model.ExerciseStats;
import com.raditha.dictation.model.SentenceAttempt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * Command-line interface for checking dictation transcripts.
 * <p>
 * Usage:
 * dictation [options] &lt;reference&gt; [&lt;transcript&gt;]
 * <p>
 * The reference is a dictation file (one sentence per line, optional lesson
 * headers). The transcript holds the learner's text, one line per reference
 * sentence; blank or missing lines are skipped sentences. Without a transcript
 * file the text is read from standard input.
 * <p>
 * Configuration priority: CLI arguments > dictation.yml > defaults
 */
@Command(name = "dictation", mixinStandardHelpOptions = true, version = "Dictation v1.0.0",
        description = "Dictation transcript checker with fuzzy word alignment")
@SuppressWarnings("java:S106")
public class DictationCLI implements Callable<Integer> {

    private static final Logger logger = LoggerFactory.getLogger(DictationCLI.class);

    private static final Set<String> PRESETS = Set.of("standard", "strict", "lenient");

    @Parameters(index = "0", description = "Dictation file with the reference sentences", paramLabel = "<reference>")
    private Path referenceFile;

    @Parameters(index = "1", arity = "0..1", description = "Transcript file (default: standard input)",
            paramLabel = "<transcript>")
    private Path transcriptFile;

    @Option(names = "--case-sensitive", description = "Check capitalization")
    private boolean caseSensitive = false;

    @Option(names = "--lesson", description = "Only check the sentences of this lesson", paramLabel = "<id>")
    private String lesson;

    @Option(names = "--json", description = "Output results in JSON format")
    private boolean jsonOutput = false;

    @Option(names = "--export", description = "Export metrics (csv, json, or both)", paramLabel = "<format>",
            converter = ExportFormatConverter.class)
    private ExportFormat exportFormat;

    @Option(names = "--output", description = "Directory for exported metrics", paramLabel = "<path>")
    private String outputPath;

    @Option(names = "--config-file", description = "Use custom configuration file", paramLabel = "<path>")
    private String configFile;

    @Option(names = "--preset", description = "Comparison preset: standard, strict or lenient",
            paramLabel = "<name>")
    private String preset;

    /**
     * Picocli call method - executes the main logic.
     *
     * @return exit code (0 for success, non-zero for errors)
     */
    @Override
    public Integer call() throws Exception {
        validateConfiguration();

        Map<String, Object> settings = configFile != null
                ? ComparisonSettings.readSection(Paths.get(configFile), true)
                : ComparisonSettings.readSection(Paths.get(ComparisonSettings.DEFAULT_FILE_NAME), false);
        ComparisonConfig config = ComparisonSettings.loadConfig(settings, preset);
        boolean preserveCase = ComparisonSettings.caseSensitive(settings, caseSensitive);

        Exercise exercise = new ExerciseLoader().load(referenceFile);
        List<String> sentences = selectSentences(exercise);
        List<String> transcript = readTranscript();

        DictationEngine engine = new DictationEngine(config);
        List<SentenceAttempt> attempts = buildAttempts(sentences, transcript);
        DictationReport report = buildReport(engine, exerciseName(), lesson, attempts, preserveCase);

        if (jsonOutput) {
            System.out.println(new MetricsExporter().toJson(report));
        } else {
            new ReportPrinter(System.out).print(report);
        }

        if (exportFormat != null) {
            exportMetrics(report.stats());
        }
        return 0;
    }

    public static void main(String[] args) {
        int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }

    /**
     * Build the command line with the exit-code mapping used by {@link #main}.
     */
    public static CommandLine createCommandLine() {
        CommandLine cmd = new CommandLine(new DictationCLI());

        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof IllegalArgumentException) {
                commandLine.getErr().println("Configuration error: " + ex.getMessage());
                return 2;
            } else if (ex instanceof IOException) {
                commandLine.getErr().println("I/O error: " + ex.getMessage());
                return 3;
            } else {
                commandLine.getErr().println("Error: " + ex.getMessage());
                ex.printStackTrace(commandLine.getErr());
                return 1;
            }
        });

        cmd.setParameterExceptionHandler((ex, args) -> {
            CommandLine.Help.ColorScheme colorScheme = CommandLine.Help.defaultColorScheme(CommandLine.Help.Ansi.AUTO);
            cmd.getErr().println(colorScheme.errorText(ex.getMessage()));
            CommandLine.UnmatchedArgumentException.printSuggestions(ex, cmd.getErr());
            cmd.getErr().print(cmd.getUsageMessage(colorScheme));
            return 2;
        });

        return cmd;
    }

    /**
     * Validate CLI configuration before execution.
     *
     * @throws IllegalArgumentException if configuration is invalid
     */
    private void validateConfiguration() {
        if (preset != null && !PRESETS.contains(preset.toLowerCase(Locale.ROOT))) {
            throw new IllegalArgumentException(
                    "Preset must be 'standard', 'strict', or 'lenient', got: " + preset);
        }

        if (outputPath != null) {
            Path outputDir = Paths.get(outputPath);
            if (Files.exists(outputDir) && !Files.isDirectory(outputDir)) {
                throw new IllegalArgumentException("Output path exists but is not a directory: " + outputPath);
            }
        }
    }

    private List<String> selectSentences(Exercise exercise) {
        if (lesson == null) {
            return exercise.allSentences();
        }
        return exercise.lesson(lesson)
                .map(Lesson::sentences)
                .orElseThrow(() -> new IllegalArgumentException(
                        "Unknown lesson: " + lesson + ". Available: " + String.join(", ", exercise.lessonIds())));
    }

    private List<String> readTranscript() throws IOException {
        if (transcriptFile != null) {
            return Files.readAllLines(transcriptFile, StandardCharsets.UTF_8);
        }
        logger.info("Reading transcript from standard input");
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8))) {
            return reader.lines().toList();
        }
    }

    static List<SentenceAttempt> buildAttempts(List<String> sentences, List<String> transcript) {
        List<SentenceAttempt> attempts = new ArrayList<>(sentences.size());
        for (int i = 0; i < sentences.size(); i++) {
            String typed = i < transcript.size() ? transcript.get(i).strip() : "";
            attempts.add(typed.isEmpty()
                    ? SentenceAttempt.skipped(sentences.get(i))
                    : new SentenceAttempt(sentences.get(i), typed));
        }
        if (transcript.size() > sentences.size()) {
            logger.warn("Transcript has {} lines but only {} sentences were checked",
                    transcript.size(), sentences.size());
        }
        return attempts;
    }

    static DictationReport buildReport(DictationEngine engine, String exerciseName, String lesson,
            List<SentenceAttempt> attempts, boolean preserveCase) {
        List<DictationReport.SentenceReport> sentences = new ArrayList<>(attempts.size());
        for (int i = 0; i < attempts.size(); i++) {
            SentenceAttempt attempt = attempts.get(i);
            sentences.add(new DictationReport.SentenceReport(
                    i,
                    attempt.reference(),
                    attempt.candidate(),
                    engine.isSentenceCorrect(attempt.reference(), attempt.candidate(), preserveCase),
                    attempt.attempted()
                            ? engine.matchLive(attempt.referenceWords(), attempt.candidateWords(), preserveCase)
                            : List.of(),
                    attempt.attempted()
                            ? engine.alignWords(attempt.referenceWords(), attempt.candidateWords(), preserveCase)
                            : List.of()));
        }

        ExerciseStats stats = engine.aggregateStats(attempts, preserveCase);
        return new DictationReport(exerciseName, lesson, preserveCase, sentences,
                new MetricsExporter().buildMetrics(stats, exerciseName));
    }

    private String exerciseName() {
        String fileName = referenceFile.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    /**
     * Export metrics to CSV/JSON files.
     */
    private void exportMetrics(MetricsExporter.ExerciseMetrics metrics) throws IOException {
        MetricsExporter exporter = new MetricsExporter();

        Path outputDir = outputPath != null ? Paths.get(outputPath) : Paths.get(".");
        Files.createDirectories(outputDir);

        if (exportFormat.includesCsv()) {
            Path csvPath = outputDir.resolve("dictation-metrics.csv");
            exporter.exportToCsv(metrics, csvPath);
            System.out.println("\n✓ Metrics exported to: " + csvPath.toAbsolutePath());
        }

        if (exportFormat.includesJson()) {
            Path jsonPath = outputDir.resolve("dictation-metrics.json");
            exporter.exportToJson(metrics, jsonPath);
            System.out.println("✓ Metrics exported to: " + jsonPath.toAbsolutePath());
        }
    }

    /**
     * Custom converter for ExportFormat enum to handle CLI string values.
     */
    public static class ExportFormatConverter implements ITypeConverter<ExportFormat> {
        @Override
        public ExportFormat convert(String value) throws Exception {
            return ExportFormat.fromString(value);
        }
    }
}
