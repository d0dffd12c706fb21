package com.raditha.dictation.exercise;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Parses plain-text dictation files.
 * <p>
 * One sentence per line. A line such as {@code A1L01} starts a new lesson;
 * blank lines are ignored. Sentences that appear before the first header
 * belong to the {@value #DEFAULT_LESSON} lesson.
 */
public class ExerciseLoader {

    private static final Logger logger = LoggerFactory.getLogger(ExerciseLoader.class);

    public static final String DEFAULT_LESSON = "DEFAULT";
    private static final Pattern LESSON_HEADER = Pattern.compile("^[A-Z]\\d+L\\d+");

    /**
     * Load an exercise file.
     *
     * @throws IOException if the file cannot be read
     */
    public Exercise load(Path file) throws IOException {
        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        Exercise exercise = parse(file.getFileName().toString(), lines);
        logger.info("Loaded {} lessons with {} sentences from {}",
                exercise.lessons().size(), exercise.allSentences().size(), file);
        return exercise;
    }

    public Exercise parse(String source, String text) {
        return parse(source, text == null ? List.of() : text.lines().toList());
    }

    public Exercise parse(String source, List<String> lines) {
        Map<String, List<String>> lessons = new LinkedHashMap<>();
        String current = null;

        for (String raw : lines) {
            String line = raw.strip();
            if (line.isEmpty()) {
                continue;
            }
            if (isLessonHeader(line)) {
                current = line;
                if (lessons.containsKey(current)) {
                    logger.warn("Lesson {} appears more than once, merging sentences", current);
                }
                lessons.computeIfAbsent(current, k -> new ArrayList<>());
            } else {
                String lesson = current != null ? current : DEFAULT_LESSON;
                lessons.computeIfAbsent(lesson, k -> new ArrayList<>()).add(line);
            }
        }

        List<Lesson> result = new ArrayList<>(lessons.size());
        lessons.forEach((id, sentences) -> result.add(new Lesson(id, sentences)));
        return new Exercise(source, result);
    }

    static boolean isLessonHeader(String line) {
        return LESSON_HEADER.matcher(line).find();
    }
}
