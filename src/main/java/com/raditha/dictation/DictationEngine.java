package com.raditha.dictation;

import com.raditha.dictation.alignment.GlobalWordAligner;
import com.raditha.dictation.alignment.StreamingWordMatcher;
import com.raditha.dictation.config.ComparisonConfig;
import com.raditha.dictation.diff.CharacterDiffer;
import com.raditha.dictation.model.AlignmentOp;
import com.raditha.dictation.model.CharSegment;
import com.raditha.dictation.model.ExerciseStats;
import com.raditha.dictation.model.SentenceAttempt;
import com.raditha.dictation.model.WordJudgment;
import com.raditha.dictation.normalization.TextNormalizer;
import com.raditha.dictation.similarity.SimilarityScorer;
import com.raditha.dictation.similarity.TypoPatternDetector;
import com.raditha.dictation.stats.StatsAggregator;

import java.time.Duration;
import java.util.List;

/**
 * Entry point of the comparison engine.
 * <p>
 * Wires the normalizer, scorer, aligners, differ and aggregator for one
 * {@link ComparisonConfig}. Instances hold no mutable state and can be shared.
 */
public class DictationEngine {

    private final ComparisonConfig config;
    private final TextNormalizer normalizer;
    private final SimilarityScorer scorer;
    private final GlobalWordAligner aligner;
    private final StreamingWordMatcher matcher;
    private final CharacterDiffer differ;
    private final StatsAggregator aggregator;

    public DictationEngine() {
        this(ComparisonConfig.standard());
    }

    public DictationEngine(ComparisonConfig config) {
        this.config = config;
        this.normalizer = new TextNormalizer();
        this.scorer = new SimilarityScorer(normalizer, config);
        this.differ = new CharacterDiffer();
        this.aligner = new GlobalWordAligner(scorer);
        this.matcher = new StreamingWordMatcher(scorer, differ, new TypoPatternDetector());
        this.aggregator = new StatsAggregator(scorer, aligner);
    }

    public String normalize(String text, boolean preserveCase) {
        return normalizer.normalize(text, preserveCase);
    }

    public int distance(String a, String b) {
        return scorer.distance(a, b);
    }

    public double similarity(String a, String b) {
        return scorer.similarity(a, b);
    }

    public boolean areSimilar(String a, String b) {
        return scorer.areSimilar(a, b);
    }

    public boolean areExactlyEqual(String a, String b, boolean preserveCase) {
        return scorer.areExactlyEqual(a, b, preserveCase);
    }

    public boolean isCompoundSubstring(String a, String b) {
        return scorer.isCompoundSubstring(a, b);
    }

    public List<AlignmentOp> alignWords(List<String> referenceWords, List<String> candidateWords,
            boolean preserveCase) {
        return aligner.align(referenceWords, candidateWords, preserveCase);
    }

    public List<WordJudgment> matchLive(List<String> referenceWords, List<String> candidateWordsSoFar,
            boolean preserveCase) {
        return matcher.matchLive(referenceWords, candidateWordsSoFar, preserveCase);
    }

    public List<CharSegment> diffChars(String referenceWord, String candidateWord, boolean preserveCase) {
        return differ.diffChars(referenceWord, candidateWord, preserveCase);
    }

    public ExerciseStats aggregateStats(List<SentenceAttempt> attempts, boolean preserveCase) {
        return aggregator.aggregate(attempts, preserveCase);
    }

    public ExerciseStats aggregateStats(List<SentenceAttempt> attempts, boolean preserveCase, Duration elapsed) {
        return aggregator.aggregate(attempts, preserveCase, elapsed);
    }

    /**
     * Whole-sentence check used to decide whether the learner may move on.
     */
    public boolean isSentenceCorrect(String reference, String candidate, boolean preserveCase) {
        return aggregator.isSentenceCorrect(reference, candidate, preserveCase);
    }

    public SimilarityScorer scorer() {
        return scorer;
    }

    public ComparisonConfig config() {
        return config;
    }
}
