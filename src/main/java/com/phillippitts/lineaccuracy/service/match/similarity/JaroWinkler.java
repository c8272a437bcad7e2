package com.phillippitts.lineaccuracy.service.match.similarity;

/**
 * Jaro-Winkler string similarity, used to forgive recognizer misspellings of names.
 */
public final class JaroWinkler {

    /** Weight of each shared prefix character. */
    static final double PREFIX_SCALE = 0.1;
    static final int MAX_PREFIX = 4;

    private JaroWinkler() {
    }

    /**
     * Calculates Jaro-Winkler similarity.
     *
     * @param s1 first string
     * @param s2 second string
     * @return similarity between 0.0 and 1.0 (1.0 for identical strings)
     */
    public static double similarity(String s1, String s2) {
        double jaro = jaro(s1, s2);
        int prefix = 0;
        int limit = Math.min(MAX_PREFIX, Math.min(s1.length(), s2.length()));
        while (prefix < limit && s1.charAt(prefix) == s2.charAt(prefix)) {
            prefix++;
        }
        return jaro + prefix * PREFIX_SCALE * (1 - jaro);
    }

    /**
     * Calculates plain Jaro similarity with a match window of {@code max(len)/2 - 1}.
     *
     * @param s1 first string
     * @param s2 second string
     * @return similarity between 0.0 and 1.0
     */
    public static double jaro(String s1, String s2) {
        if (s1.equals(s2)) {
            return 1.0;
        }
        if (s1.isEmpty() || s2.isEmpty()) {
            return 0.0;
        }

        int window = Math.max(s1.length(), s2.length()) / 2 - 1;
        boolean[] matched1 = new boolean[s1.length()];
        boolean[] matched2 = new boolean[s2.length()];

        int matches = 0;
        for (int i = 0; i < s1.length(); i++) {
            int start = Math.max(0, i - window);
            int end = Math.min(i + window + 1, s2.length());
            for (int j = start; j < end; j++) {
                if (!matched2[j] && s1.charAt(i) == s2.charAt(j)) {
                    matched1[i] = true;
                    matched2[j] = true;
                    matches++;
                    break;
                }
            }
        }
        if (matches == 0) {
            return 0.0;
        }

        int transpositions = 0;
        int k = 0;
        for (int i = 0; i < s1.length(); i++) {
            if (!matched1[i]) {
                continue;
            }
            while (!matched2[k]) {
                k++;
            }
            if (s1.charAt(i) != s2.charAt(k)) {
                transpositions++;
            }
            k++;
        }

        double m = matches;
        return (m / s1.length() + m / s2.length() + (m - transpositions / 2.0) / m) / 3.0;
    }
}
