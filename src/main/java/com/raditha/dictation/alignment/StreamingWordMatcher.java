package com.raditha.dictation.alignment;

import com.raditha.dictation.config.ComparisonConfig;
import com.raditha.dictation.diff.CharacterDiffer;
import com.raditha.dictation.model.CharSegment;
import com.raditha.dictation.model.NormalizationOptions;
import com.raditha.dictation.model.ScoredMatch;
import com.raditha.dictation.model.WordJudgment;
import com.raditha.dictation.normalization.TextNormalizer;
import com.raditha.dictation.similarity.SimilarityScorer;
import com.raditha.dictation.similarity.TypoPattern;
import com.raditha.dictation.similarity.TypoPatternDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Greedy, causal word matcher for feedback while the learner is still typing.
 * <p>
 * Reference words are visited left to right. Each one looks at a bounded
 * window of not yet consumed candidate words and takes the best scoring one;
 * words skipped on the way become EXTRA. A reference word without an
 * acceptable candidate is MISSING and does not move the candidate cursor, so
 * the same typed word can still match the next reference word.
 */
public class StreamingWordMatcher {

    private static final Logger logger = LoggerFactory.getLogger(StreamingWordMatcher.class);

    private static final double CASE_SLIP_SCORE = 0.75;
    private static final double CASE_ONLY_SCORE = 0.95;
    private static final double CASED_SIMILAR_BASE = 0.6;
    private static final double CASED_SIMILAR_RANGE = 0.3;
    private static final double SIMILAR_BASE = 0.5;
    private static final double SIMILAR_RANGE = 0.4;
    private static final double COMPOUND_CUTOFF = 0.9;
    private static final double SIMILAR_CUTOFF = 0.8;
    private static final double FALLBACK_CUTOFF = 0.5;
    private static final double FUNCTION_WORD_SCORE = 0.95;

    private final SimilarityScorer scorer;
    private final CharacterDiffer differ;
    private final TypoPatternDetector typoDetector;
    private final TextNormalizer normalizer;
    private final ComparisonConfig config;

    public StreamingWordMatcher(SimilarityScorer scorer, CharacterDiffer differ, TypoPatternDetector typoDetector) {
        this.scorer = scorer;
        this.differ = differ;
        this.typoDetector = typoDetector;
        this.normalizer = scorer.normalizer();
        this.config = scorer.config();
    }

    /**
     * Judge the words typed so far against the reference words.
     *
     * @param referenceWords      Words of the reference sentence
     * @param candidateWordsSoFar Words typed so far
     * @param preserveCase        Whether capitalization is checked
     * @return One judgment per reference word plus one per unmatched typed
     *         word, in display order
     */
    public List<WordJudgment> matchLive(List<String> referenceWords, List<String> candidateWordsSoFar,
            boolean preserveCase) {
        List<String> ref = referenceWords == null ? List.of() : referenceWords;
        List<String> cand = candidateWordsSoFar == null ? List.of() : candidateWordsSoFar;
        List<WordJudgment> judgments = new ArrayList<>(ref.size() + cand.size());
        int cursor = 0;

        for (int i = 0; i < ref.size(); i++) {
            String referenceWord = ref.get(i);
            if (cursor >= cand.size()) {
                judgments.add(WordJudgment.missing(referenceWord, i));
                continue;
            }

            ScoredMatch best = findBest(referenceWord, cand, cursor, preserveCase);
            if (best == null || !best.exceeds(config.acceptanceThreshold())) {
                judgments.add(WordJudgment.missing(referenceWord, i));
                continue;
            }

            for (int j = cursor; j < best.candidateIndex(); j++) {
                judgments.add(WordJudgment.extra(cand.get(j), j));
            }
            judgments.add(judge(referenceWord, cand.get(best.candidateIndex()), i, best, preserveCase));
            cursor = best.candidateIndex() + 1;
        }

        for (int j = cursor; j < cand.size(); j++) {
            judgments.add(WordJudgment.extra(cand.get(j), j));
        }

        logger.debug("Live match of {} reference words against {} typed words produced {} judgments",
                ref.size(), cand.size(), judgments.size());
        return List.copyOf(judgments);
    }

    private ScoredMatch findBest(String referenceWord, List<String> cand, int cursor, boolean preserveCase) {
        ScoredMatch best = null;
        int window = Math.min(config.windowSize(), cand.size() - cursor);

        for (int j = 0; j < window; j++) {
            double score = score(referenceWord, cand.get(cursor + j), j, preserveCase);
            if (best == null || score > best.score()) {
                best = new ScoredMatch(cursor + j, score);
            }
            if (score > config.earlyExitScore()) {
                break;
            }
        }
        return best;
    }

    /**
     * Score one candidate word against a reference word.
     *
     * @param offset Distance of the candidate from the cursor
     */
    double score(String referenceWord, String candidateWord, int offset, boolean preserveCase) {
        NormalizationOptions options = NormalizationOptions.of(preserveCase);
        String expected = normalizer.normalize(referenceWord, options);
        String actual = normalizer.normalize(candidateWord, options);
        double score = 0.0;

        if (preserveCase) {
            score = casedScore(referenceWord, candidateWord, expected, actual);
        } else if (expected.equals(actual)) {
            score = 1.0;
        }

        if (score < COMPOUND_CUTOFF
                && (scorer.isCompoundPart(candidateWord, referenceWord)
                        || scorer.isCompoundPart(referenceWord, candidateWord))) {
            score = config.compoundScore();
        }

        if (score < SIMILAR_CUTOFF && scorer.areSimilar(expected, actual)) {
            score = SIMILAR_BASE + SIMILAR_RANGE * (1.0 - relativeDistance(expected, actual));
        } else if (score < FALLBACK_CUTOFF) {
            score = positionalOverlap(expected, actual);
        }

        if (score < SIMILAR_CUTOFF && config.isFunctionWord(referenceWord)
                && referenceWord.toLowerCase(Locale.ROOT).equals(candidateWord.toLowerCase(Locale.ROOT))) {
            score = FUNCTION_WORD_SCORE;
        }

        if (score > config.penaltyFloor()) {
            score = Math.max(config.penaltyFloor(), score - offset * config.positionPenalty(preserveCase));
        }
        return Math.min(1.0, Math.max(0.0, score));
    }

    private double casedScore(String referenceWord, String candidateWord, String expected, String actual) {
        if (expected.equals(actual)) {
            return 1.0;
        }
        if (expected.toLowerCase(Locale.ROOT).equals(actual.toLowerCase(Locale.ROOT))) {
            return startsUpper(referenceWord) && !startsUpper(candidateWord) ? CASE_SLIP_SCORE : CASE_ONLY_SCORE;
        }
        if (scorer.areSimilar(expected, actual)) {
            String e = expected.toLowerCase(Locale.ROOT);
            String a = actual.toLowerCase(Locale.ROOT);
            return CASED_SIMILAR_BASE + CASED_SIMILAR_RANGE * (1.0 - relativeDistance(e, a));
        }
        return 0.0;
    }

    private WordJudgment judge(String referenceWord, String candidateWord, int referenceIndex, ScoredMatch best,
            boolean preserveCase) {
        // The score only decides acceptance; CORRECT follows strict equality like the statistics
        if (scorer.areExactlyEqual(referenceWord, candidateWord, preserveCase)) {
            return WordJudgment.correct(referenceWord, candidateWord, referenceIndex, best.candidateIndex(),
                    best.score());
        }

        List<CharSegment> segments = differ.diffChars(referenceWord, candidateWord, preserveCase);
        Set<TypoPattern> patterns = typoDetector.detect(
                normalizer.canonicalizeLetters(candidateWord), normalizer.canonicalizeLetters(referenceWord));
        return WordJudgment.partial(referenceWord, candidateWord, referenceIndex, best.candidateIndex(),
                best.score(), segments, patterns);
    }

    /**
     * Keyboard-weighted edit distance relative to the longer word.
     */
    private double relativeDistance(String a, String b) {
        int longer = Math.max(a.length(), b.length());
        return longer == 0 ? 0.0 : Math.min(1.0, scorer.weightedDistance(a, b) / longer);
    }

    /**
     * Fraction of positions holding the same character in both words.
     */
    private static double positionalOverlap(String a, String b) {
        int longer = Math.max(a.length(), b.length());
        if (longer == 0) {
            return 0.0;
        }
        int shorter = Math.min(a.length(), b.length());
        int same = 0;
        for (int k = 0; k < shorter; k++) {
            if (a.charAt(k) == b.charAt(k)) {
                same++;
            }
        }
        return (double) same / longer;
    }

    private static boolean startsUpper(String word) {
        return !word.isEmpty() && Character.isUpperCase(word.charAt(0));
    }
}
