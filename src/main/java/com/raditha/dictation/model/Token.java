package com.raditha.dictation.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Represents a single word of a sentence.
 * The original text is preserved for display; comparisons go through the
 * normalizer and the similarity scorer, never through {@code equals}.
 *
 * @param text     Original word text (e.g., "Montagmorgen,")
 * @param position Zero-based index of the word in its sentence
 */
public record Token(String text, int position) {

    /**
     * Split a sentence into tokens on runs of whitespace.
     * Empty pieces are dropped, so blank input yields an empty list.
     */
    public static List<Token> tokenize(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<Token> tokens = new ArrayList<>();
        for (String piece : text.trim().split("\\s+")) {
            if (!piece.isEmpty()) {
                tokens.add(new Token(piece, tokens.size()));
            }
        }
        return List.copyOf(tokens);
    }

    /**
     * Split a sentence into its raw word strings.
     */
    public static List<String> words(String text) {
        return tokenize(text).stream()
                .map(Token::text)
                .toList();
    }

    /**
     * Length of the original text in characters.
     */
    public int length() {
        return text.length();
    }
}
