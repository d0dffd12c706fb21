package com.raditha.dictation.exercise;

import java.util.List;
import java.util.Optional;

/**
 * A parsed dictation file: lessons in file order.
 *
 * @param source  Where the exercise was loaded from (file name or label)
 * @param lessons Lessons in file order
 */
public record Exercise(String source, List<Lesson> lessons) {

    public Exercise {
        lessons = lessons == null ? List.of() : List.copyOf(lessons);
    }

    public Optional<Lesson> lesson(String id) {
        return lessons.stream()
                .filter(l -> l.id().equals(id))
                .findFirst();
    }

    public List<String> lessonIds() {
        return lessons.stream().map(Lesson::id).toList();
    }

    /**
     * All sentences of all lessons, flattened in file order.
     */
    public List<String> allSentences() {
        return lessons.stream()
                .flatMap(l -> l.sentences().stream())
                .toList();
    }
}
