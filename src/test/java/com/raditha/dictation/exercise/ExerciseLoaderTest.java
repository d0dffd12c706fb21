package com.raditha.dictation.exercise;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ExerciseLoader.
 */
class ExerciseLoaderTest {

    @TempDir
    Path tempDir;

    private ExerciseLoader loader;

    @BeforeEach
    void setUp() {
        loader = new ExerciseLoader();
    }

    @Test
    void testLoadLessonFile() throws Exception {
        Path file = Paths.get(getClass().getResource("/exercises/a1-dictations.txt").toURI());

        Exercise exercise = loader.load(file);

        assertEquals("a1-dictations.txt", exercise.source());
        assertEquals(List.of("A1L01", "A1L02"), exercise.lessonIds());
        assertEquals(4, exercise.allSentences().size());
        assertEquals(List.of("Ich wohne in Berlin.", "Am Montagmorgen gehe ich ins Büro."),
                exercise.lesson("A1L01").orElseThrow().sentences());
        assertTrue(exercise.lesson("B2L01").isEmpty());
    }

    @Test
    void testSentencesWithoutHeader() {
        Exercise exercise = loader.parse("inline", "Ich wohne in Berlin.\n\n  Wir trinken Kaffee.  \n");

        assertEquals(List.of(ExerciseLoader.DEFAULT_LESSON), exercise.lessonIds());
        assertEquals(List.of("Ich wohne in Berlin.", "Wir trinken Kaffee."), exercise.allSentences());
    }

    @Test
    void testRepeatedHeaderIsMerged() {
        Exercise exercise = loader.parse("inline", List.of("A1L01", "Eins.", "A1L02", "Zwei.", "A1L01", "Drei."));

        assertEquals(List.of("A1L01", "A1L02"), exercise.lessonIds());
        assertEquals(List.of("Eins.", "Drei."), exercise.lesson("A1L01").orElseThrow().sentences());
    }

    @Test
    void testLessonHeaderDetection() {
        assertTrue(ExerciseLoader.isLessonHeader("A1L01"));
        assertTrue(ExerciseLoader.isLessonHeader("B2L10 Wohnen"));
        assertFalse(ExerciseLoader.isLessonHeader("Ich wohne in Berlin."));
        assertFalse(ExerciseLoader.isLessonHeader("a1l01"));
    }

    @Test
    void testEmptyInput() {
        assertTrue(loader.parse("empty", (String) null).lessons().isEmpty());
        assertTrue(loader.parse("empty", "\n\n").allSentences().isEmpty());
    }

    @Test
    void testMissingFile() {
        assertThrows(IOException.class, () -> loader.load(tempDir.resolve("missing.txt")));
    }

    @Test
    void testLoadUtf8() throws IOException {
        Path file = tempDir.resolve("lesson.txt");
        Files.writeString(file, "C1L01\nDie Straße ist schön.\n");

        Exercise exercise = loader.load(file);

        assertEquals("Die Straße ist schön.", exercise.allSentences().get(0));
    }

    @Test
    void testBlankLessonIdIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new Lesson(" ", List.of()));
    }
}
