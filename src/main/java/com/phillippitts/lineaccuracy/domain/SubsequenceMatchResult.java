package com.phillippitts.lineaccuracy.domain;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Gap-tolerant live match of a transcript against a line.
 *
 * @param matchedIndices indices into the expected words that are satisfied, including auto-matched
 *                       skippable words and stutter repeats; iteration order is ascending
 * @param matchedCount   words actually matched by speech, auto-matched words excluded
 * @param coverage       {@code matchedCount} over the scored expected words, 0 to 1
 */
public record SubsequenceMatchResult(Set<Integer> matchedIndices, int matchedCount, double coverage) {

    public SubsequenceMatchResult {
        matchedIndices = matchedIndices == null
                ? Collections.emptySortedSet()
                : Collections.unmodifiableSortedSet(new TreeSet<>(matchedIndices));
        if (coverage < 0.0 || coverage > 1.0) {
            throw new IllegalArgumentException("Coverage must be between 0.0 and 1.0, got: " + coverage);
        }
    }
}
