package com.phillippitts.lineaccuracy.service.match.similarity;

/**
 * Levenshtein edit distance over characters.
 * Space-optimized dynamic programming implementation.
 */
public final class Levenshtein {

    private Levenshtein() {
    }

    /**
     * Computes the minimum number of single-character insertions, deletions and substitutions.
     *
     * @param a first word
     * @param b second word
     * @return edit distance, 0 for equal strings
     */
    public static int distance(String a, String b) {
        // Keep the shorter word in the row to use O(min(m,n)) space
        if (a.length() > b.length()) {
            String temp = a;
            a = b;
            b = temp;
        }
        int m = a.length();
        int n = b.length();

        int[] prev = new int[m + 1];
        int[] curr = new int[m + 1];
        for (int i = 0; i <= m; i++) {
            prev[i] = i;
        }

        for (int j = 1; j <= n; j++) {
            curr[0] = j;
            for (int i = 1; i <= m; i++) {
                if (a.charAt(i - 1) == b.charAt(j - 1)) {
                    curr[i] = prev[i - 1];
                } else {
                    curr[i] = 1 + Math.min(Math.min(prev[i], curr[i - 1]), prev[i - 1]);
                }
            }
            int[] temp = prev;
            prev = curr;
            curr = temp;
        }
        return prev[m];
    }
}
