package com.raditha.dictation.exercise;

import com.raditha.dictation.model.NormalizationOptions;
import com.raditha.dictation.model.Token;
import com.raditha.dictation.normalization.TextNormalizer;
import com.raditha.dictation.similarity.SimilarityScorer;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Distinct normalized words of an exercise, with a typo-tolerant lookup.
 */
public class Vocabulary {

    /**
     * Result of a closest-word lookup.
     *
     * @param word     Vocabulary word
     * @param distance Edit distance from the normalized input
     */
    public record WordMatch(String word, int distance) {
    }

    private final List<String> words;
    private final TextNormalizer normalizer;
    private final SimilarityScorer scorer;

    public Vocabulary(List<String> sentences, SimilarityScorer scorer) {
        this.scorer = scorer;
        this.normalizer = scorer.normalizer();

        Set<String> distinct = new LinkedHashSet<>();
        for (String sentence : sentences) {
            distinct.addAll(Token.words(normalizer.normalize(sentence, NormalizationOptions.caseInsensitive())));
        }
        this.words = List.copyOf(distinct);
    }

    public static Vocabulary of(Exercise exercise, SimilarityScorer scorer) {
        return new Vocabulary(exercise.allSentences(), scorer);
    }

    public List<String> words() {
        return words;
    }

    public boolean contains(String word) {
        return words.contains(normalizer.normalize(word, NormalizationOptions.caseInsensitive()));
    }

    /**
     * Find the vocabulary word closest to the input; ties go to the word seen
     * first.
     *
     * @return The closest word, empty when the vocabulary is empty
     */
    public Optional<WordMatch> closest(String input) {
        String normalized = normalizer.normalize(input, NormalizationOptions.caseInsensitive());
        WordMatch best = null;
        for (String word : words) {
            int distance = scorer.distance(normalized, word);
            if (best == null || distance < best.distance()) {
                best = new WordMatch(word, distance);
            }
        }
        return Optional.ofNullable(best);
    }
}
