package com.raditha.dictation.stats;

import com.raditha.dictation.alignment.GlobalWordAligner;
import com.raditha.dictation.model.AlignmentOp;
import com.raditha.dictation.model.ExerciseStats;
import com.raditha.dictation.model.NormalizationOptions;
import com.raditha.dictation.model.SentenceAttempt;
import com.raditha.dictation.model.SentenceStats;
import com.raditha.dictation.normalization.TextNormalizer;
import com.raditha.dictation.similarity.SimilarityScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Folds per-sentence attempts into exercise statistics.
 * <p>
 * Word correctness is strict: a typed word counts as correct only when it is
 * exactly equal (after normalization) to a reference word of the same
 * sentence that no other typed word has claimed. The edit-operation counts
 * come from a global alignment over the whole exercise.
 */
public class StatsAggregator {

    private static final Logger logger = LoggerFactory.getLogger(StatsAggregator.class);

    private static final double SECONDS_PER_MINUTE = 60.0;

    private final SimilarityScorer scorer;
    private final GlobalWordAligner aligner;
    private final TextNormalizer normalizer;

    public StatsAggregator(SimilarityScorer scorer, GlobalWordAligner aligner) {
        this.scorer = scorer;
        this.aligner = aligner;
        this.normalizer = scorer.normalizer();
    }

    public ExerciseStats aggregate(List<SentenceAttempt> attempts, boolean preserveCase) {
        return aggregate(attempts, preserveCase, null);
    }

    /**
     * Aggregate statistics over all attempts.
     *
     * @param attempts     One entry per reference sentence, in exercise order
     * @param preserveCase Whether capitalization is significant
     * @param elapsed      Time spent typing, or null when unknown
     * @return Exercise statistics
     */
    public ExerciseStats aggregate(List<SentenceAttempt> attempts, boolean preserveCase, Duration elapsed) {
        List<SentenceAttempt> all = attempts == null ? List.of() : attempts;
        List<SentenceStats> sentences = new ArrayList<>(all.size());
        List<String> allReferenceWords = new ArrayList<>();
        List<String> allCandidateWords = new ArrayList<>();

        int totalWords = 0;
        int attemptedWords = 0;
        int correctWords = 0;
        int completedSentences = 0;

        for (int i = 0; i < all.size(); i++) {
            SentenceAttempt attempt = all.get(i);
            List<String> referenceWords = attempt.referenceWords();
            List<String> candidateWords = attempt.candidateWords();
            allReferenceWords.addAll(referenceWords);
            allCandidateWords.addAll(candidateWords);
            totalWords += referenceWords.size();

            if (!attempt.attempted()) {
                sentences.add(SentenceStats.skipped(i, referenceWords.size()));
                continue;
            }

            completedSentences++;
            int correct = countCorrect(referenceWords, candidateWords, preserveCase);
            attemptedWords += candidateWords.size();
            correctWords += correct;
            sentences.add(new SentenceStats(i, referenceWords.size(), candidateWords.size(), correct,
                    candidateWords.size() - correct, true,
                    isSentenceCorrect(attempt.reference(), attempt.candidate(), preserveCase)));
        }

        int incorrectWords = attemptedWords - correctWords;
        int[] opCounts = countOps(aligner.align(allReferenceWords, allCandidateWords, preserveCase));

        ExerciseStats stats = new ExerciseStats(
                all.size(),
                completedSentences,
                totalWords,
                attemptedWords,
                correctWords,
                incorrectWords,
                percentage(attemptedWords, totalWords),
                percentage(correctWords, totalWords),
                percentage(incorrectWords, attemptedWords),
                opCounts[0],
                opCounts[1],
                opCounts[2],
                opCounts[3],
                sentences,
                wordsPerMinute(attemptedWords, elapsed));

        logger.debug("Aggregated {} sentences: {}/{} words correct", all.size(), correctWords, totalWords);
        return stats;
    }

    /**
     * Whole-sentence correctness: the normalized texts are identical.
     */
    public boolean isSentenceCorrect(String reference, String candidate, boolean preserveCase) {
        if (reference == null || candidate == null) {
            return false;
        }
        NormalizationOptions options = NormalizationOptions.of(preserveCase);
        return normalizer.normalize(reference, options).equals(normalizer.normalize(candidate, options));
    }

    /**
     * Greedy one-to-one matching: each typed word claims the first unclaimed
     * reference word it is exactly equal to.
     */
    int countCorrect(List<String> referenceWords, List<String> candidateWords, boolean preserveCase) {
        boolean[] claimed = new boolean[referenceWords.size()];
        int correct = 0;
        for (String candidate : candidateWords) {
            for (int r = 0; r < referenceWords.size(); r++) {
                if (!claimed[r] && scorer.areExactlyEqual(referenceWords.get(r), candidate, preserveCase)) {
                    claimed[r] = true;
                    correct++;
                    break;
                }
            }
        }
        return correct;
    }

    private static int[] countOps(List<AlignmentOp> ops) {
        int[] counts = new int[4];
        for (AlignmentOp op : ops) {
            switch (op.type()) {
                case MATCH -> counts[0]++;
                case SUBSTITUTE -> counts[1]++;
                case INSERT -> counts[2]++;
                case DELETE -> counts[3]++;
            }
        }
        return counts;
    }

    private static double percentage(int part, int whole) {
        return whole == 0 ? 0.0 : (double) part / whole * 100.0;
    }

    private static OptionalDouble wordsPerMinute(int words, Duration elapsed) {
        if (elapsed == null || elapsed.isZero() || elapsed.isNegative()) {
            return OptionalDouble.empty();
        }
        double minutes = elapsed.toMillis() / 1000.0 / SECONDS_PER_MINUTE;
        return minutes <= 0.0 ? OptionalDouble.empty() : OptionalDouble.of(words / minutes);
    }
}
