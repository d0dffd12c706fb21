package com.raditha.dictation.exercise;

import java.util.List;

/**
 * A named group of dictation sentences.
 *
 * @param id        Lesson header, e.g. "A1L01"
 * @param sentences Reference sentences in file order
 */
public record Lesson(String id, List<String> sentences) {

    public Lesson {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Lesson id cannot be blank");
        }
        sentences = sentences == null ? List.of() : List.copyOf(sentences);
    }
}
