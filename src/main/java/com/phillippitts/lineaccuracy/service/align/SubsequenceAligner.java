package com.phillippitts.lineaccuracy.service.align;

import com.phillippitts.lineaccuracy.domain.SubsequenceMatchResult;
import com.phillippitts.lineaccuracy.service.match.WordComparator;
import com.phillippitts.lineaccuracy.service.match.WordTables;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Gap-tolerant live aligner based on the longest common subsequence.
 *
 * <p>Unlike {@link LockedAligner}, a wrong word in the middle of a line does not stop later correct
 * words from being recognized. Skippable words and stutter repeats are pre-marked as matched; spoken
 * fillers are dropped before the table is built.
 *
 * <p>Time and space are O(expected x spoken). That is fine for a dialogue line and its transcript,
 * which are tens of words; paragraph-length input would need a banded or rolling-array variant,
 * which cannot recover the matched indices without extra bookkeeping.
 */
public final class SubsequenceAligner extends AbstractLineAligner<SubsequenceMatchResult> {

    public SubsequenceAligner(WordComparator comparator, WordTables tables) {
        super(comparator, tables);
    }

    @Override
    protected SubsequenceMatchResult doAlign(TokenAlignment a) {
        Set<Integer> matchedIndices = new TreeSet<>();
        List<Integer> rows = new ArrayList<>();
        for (int e = 0; e < a.expectedSize(); e++) {
            if (a.isAutoSatisfiable(e)) {
                matchedIndices.add(e);
            } else {
                rows.add(e);
            }
        }
        int skipped = matchedIndices.size();
        int effective = a.expectedSize() - skipped;

        List<Integer> columns = new ArrayList<>();
        for (int s = 0; s < a.spokenSize(); s++) {
            if (!a.isFiller(s)) {
                columns.add(s);
            }
        }

        if (rows.isEmpty()) {
            return new SubsequenceMatchResult(matchedIndices, 0, 1.0);
        }
        if (columns.isEmpty()) {
            return new SubsequenceMatchResult(matchedIndices, 0, 0.0);
        }

        int m = rows.size();
        int n = columns.size();
        boolean[][] same = new boolean[m][n];
        int[][] lcs = new int[m + 1][n + 1];
        for (int i = 1; i <= m; i++) {
            for (int j = 1; j <= n; j++) {
                same[i - 1][j - 1] = a.directMatch(rows.get(i - 1), columns.get(j - 1));
                if (same[i - 1][j - 1]) {
                    lcs[i][j] = lcs[i - 1][j - 1] + 1;
                } else {
                    lcs[i][j] = Math.max(lcs[i - 1][j], lcs[i][j - 1]);
                }
            }
        }

        // Backtrack to recover which expected words were matched
        int i = m;
        int j = n;
        while (i > 0 && j > 0) {
            if (same[i - 1][j - 1]) {
                matchedIndices.add(rows.get(i - 1));
                i--;
                j--;
            } else if (lcs[i - 1][j] >= lcs[i][j - 1]) {
                i--;
            } else {
                j--;
            }
        }

        int matchedCount = matchedIndices.size() - skipped;
        double coverage = effective > 0 ? (double) matchedCount / effective : 1.0;
        return new SubsequenceMatchResult(matchedIndices, matchedCount, coverage);
    }
}
