package com.raditha.dictation.alignment;

import com.raditha.dictation.model.AlignmentOp;
import com.raditha.dictation.similarity.SimilarityScorer;
import com.raditha.dictation.similarity.SimilarityScorer.PreparedWord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Minimum-cost alignment of two whole word sequences.
 * <p>
 * Used once a sentence is complete, for statistics. The full cost table is
 * kept together with the choice made in each cell, and the backtrace follows
 * the stored choices, so equal-cost paths are resolved the same way every
 * time: diagonal first, then deletion, then insertion.
 */
public class GlobalWordAligner {

    private static final Logger logger = LoggerFactory.getLogger(GlobalWordAligner.class);

    private static final double INDEL_COST = 1.0;
    private static final double EPSILON = 1e-9;

    private static final byte DIAGONAL = 1;
    private static final byte DELETE = 2;
    private static final byte INSERT = 3;

    private final SimilarityScorer scorer;

    public GlobalWordAligner(SimilarityScorer scorer) {
        this.scorer = scorer;
    }

    /**
     * Align reference words against candidate words.
     *
     * @param referenceWords Words of the reference sentence(s)
     * @param candidateWords Words typed by the learner
     * @param preserveCase   Whether capitalization is significant for MATCH
     * @return Edit script reading both sequences left to right
     */
    public List<AlignmentOp> align(List<String> referenceWords, List<String> candidateWords, boolean preserveCase) {
        List<String> ref = referenceWords == null ? List.of() : referenceWords;
        List<String> cand = candidateWords == null ? List.of() : candidateWords;
        int n = ref.size();
        int m = cand.size();

        double[][] cost = new double[n + 1][m + 1];
        byte[][] choice = new byte[n + 1][m + 1];
        boolean[][] exact = new boolean[n + 1][m + 1];

        for (int i = 1; i <= n; i++) {
            cost[i][0] = i * INDEL_COST;
            choice[i][0] = DELETE;
        }
        for (int j = 1; j <= m; j++) {
            cost[0][j] = j * INDEL_COST;
            choice[0][j] = INSERT;
        }

        List<PreparedWord> preparedRef = ref.stream().map(scorer::prepare).toList();
        List<PreparedWord> preparedCand = cand.stream().map(scorer::prepare).toList();
        for (int i = 1; i <= n; i++) {
            for (int j = 1; j <= m; j++) {
                fillCell(preparedRef.get(i - 1), preparedCand.get(j - 1), i, j, preserveCase, cost, choice, exact);
            }
        }

        List<AlignmentOp> ops = backtrace(n, m, choice, exact);
        logger.debug("Aligned {} reference words with {} candidate words: cost {}, {} ops",
                n, m, cost[n][m], ops.size());
        return List.copyOf(ops);
    }

    private void fillCell(PreparedWord referenceWord, PreparedWord candidateWord, int i, int j, boolean preserveCase,
            double[][] cost, byte[][] choice, boolean[][] exact) {
        boolean equal = scorer.areExactlyEqual(referenceWord, candidateWord, preserveCase);
        double substitution = equal ? 0.0 : 1.0 - scorer.similarity(referenceWord, candidateWord);

        double diagonal = cost[i - 1][j - 1] + substitution;
        double delete = cost[i - 1][j] + INDEL_COST;
        double insert = cost[i][j - 1] + INDEL_COST;

        double best = diagonal;
        byte bestChoice = DIAGONAL;
        if (delete < best - EPSILON) {
            best = delete;
            bestChoice = DELETE;
        }
        if (insert < best - EPSILON) {
            best = insert;
            bestChoice = INSERT;
        }

        cost[i][j] = best;
        choice[i][j] = bestChoice;
        exact[i][j] = equal;
    }

    private static List<AlignmentOp> backtrace(int n, int m, byte[][] choice, boolean[][] exact) {
        List<AlignmentOp> ops = new ArrayList<>(n + m);
        int i = n;
        int j = m;
        while (i > 0 || j > 0) {
            byte c = choice[i][j];
            if (c == DIAGONAL) {
                ops.add(exact[i][j] ? AlignmentOp.match(i - 1, j - 1) : AlignmentOp.substitute(i - 1, j - 1));
                i--;
                j--;
            } else if (c == DELETE) {
                ops.add(AlignmentOp.delete(i - 1));
                i--;
            } else if (c == INSERT) {
                ops.add(AlignmentOp.insert(j - 1));
                j--;
            } else {
                throw new IllegalStateException("No alignment choice recorded at " + i + "," + j);
            }
        }
        Collections.reverse(ops);
        return ops;
    }

    /**
     * Sum the cost of an edit script produced by {@link #align}.
     */
    public double cost(List<String> referenceWords, List<String> candidateWords, List<AlignmentOp> ops) {
        double total = 0.0;
        for (AlignmentOp op : ops) {
            switch (op.type()) {
                case MATCH -> {
                    // free
                }
                case SUBSTITUTE -> total += 1.0 - scorer.similarity(
                        referenceWords.get(op.referenceIndex()), candidateWords.get(op.candidateIndex()));
                case INSERT, DELETE -> total += INDEL_COST;
            }
        }
        return total;
    }
}
