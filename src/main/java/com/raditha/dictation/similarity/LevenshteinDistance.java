package com.raditha.dictation.similarity;

/**
 * Levenshtein edit distance between two character sequences.
 * Space-optimized dynamic programming implementation.
 */
public class LevenshteinDistance {

    /**
     * Compute the unit-cost edit distance (insert, delete, substitute one
     * character).
     * Uses only O(min(m,n)) space instead of O(m*n).
     *
     * @param first  First string, null treated as empty
     * @param second Second string, null treated as empty
     * @return Minimum number of single-character edits
     */
    public int compute(String first, String second) {
        StringPair pair = ensureShorterFirst(first, second);
        String shorter = pair.shorter();
        String longer = pair.longer();

        int m = shorter.length();
        int n = longer.length();
        if (m == 0) {
            return n;
        }

        // Use rolling array - only need current and previous row
        RollingArrays arrays = new RollingArrays(m);

        for (int i = 0; i <= m; i++) {
            arrays.prev[i] = i;
        }

        for (int j = 1; j <= n; j++) {
            arrays.curr[0] = j;
            char c = longer.charAt(j - 1);

            for (int i = 1; i <= m; i++) {
                if (shorter.charAt(i - 1) == c) {
                    arrays.curr[i] = arrays.prev[i - 1];
                } else {
                    // Min of: delete, insert, replace
                    arrays.curr[i] = 1 + Math.min(
                            Math.min(arrays.prev[i], arrays.curr[i - 1]),
                            arrays.prev[i - 1]);
                }
            }

            arrays.swap();
        }

        return arrays.prev[m];
    }

    /**
     * Compute an edit distance where a substitution costs
     * {@link KeyboardProximity#proximityCost} instead of 1, so that hitting a
     * neighbouring key is cheaper than an unrelated typo.
     */
    public double computeWeighted(String first, String second, KeyboardProximity proximity, KeyboardLayout layout) {
        StringPair pair = ensureShorterFirst(first, second);
        String shorter = pair.shorter();
        String longer = pair.longer();

        int m = shorter.length();
        int n = longer.length();
        if (m == 0) {
            return n;
        }

        double[] prev = new double[m + 1];
        double[] curr = new double[m + 1];
        for (int i = 0; i <= m; i++) {
            prev[i] = i;
        }

        for (int j = 1; j <= n; j++) {
            curr[0] = j;
            char c = longer.charAt(j - 1);

            for (int i = 1; i <= m; i++) {
                char s = shorter.charAt(i - 1);
                double substitution = s == c ? 0.0 : proximity.proximityCost(s, c, layout);
                curr[i] = Math.min(
                        Math.min(prev[i] + 1, curr[i - 1] + 1),
                        prev[i - 1] + substitution);
            }

            double[] temp = prev;
            prev = curr;
            curr = temp;
        }

        return prev[m];
    }

    /**
     * Helper to ensure shorter sequence comes first (for space optimization).
     */
    static StringPair ensureShorterFirst(String first, String second) {
        String a = first == null ? "" : first;
        String b = second == null ? "" : second;
        if (a.length() > b.length()) {
            return new StringPair(b, a);
        }
        return new StringPair(a, b);
    }

    /**
     * Helper class for rolling arrays to avoid duplicate swap logic.
     */
    static class RollingArrays {
        int[] prev;
        int[] curr;

        RollingArrays(int size) {
            this.prev = new int[size + 1];
            this.curr = new int[size + 1];
        }

        void swap() {
            int[] temp = prev;
            prev = curr;
            curr = temp;
        }
    }

    /**
     * Helper record to hold shorter/longer strings.
     */
    record StringPair(String shorter, String longer) {
    }
}
