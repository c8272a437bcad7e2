package com.phillippitts.lineaccuracy.domain;

import java.util.List;

/**
 * End-of-utterance verdict for one spoken attempt at a line.
 *
 * @param correct      whether the attempt passes (no substitutions, within tolerance)
 * @param accuracy     matched words as a percentage of the scored words, 0 to 100
 * @param missingWords expected words the speaker left out
 * @param extraWords   spoken words with no counterpart in the line (fillers excluded)
 * @param wrongWords   substitutions, rendered as {@code "spoken" instead of "expected"}
 */
public record AccuracyResult(
        boolean correct,
        int accuracy,
        List<String> missingWords,
        List<String> extraWords,
        List<String> wrongWords
) {

    /**
     * Compact constructor with validation.
     *
     * @throws IllegalArgumentException if accuracy is outside 0..100
     */
    public AccuracyResult {
        if (accuracy < 0 || accuracy > 100) {
            throw new IllegalArgumentException("Accuracy must be between 0 and 100, got: " + accuracy);
        }
        missingWords = missingWords == null ? List.of() : List.copyOf(missingWords);
        extraWords = extraWords == null ? List.of() : List.copyOf(extraWords);
        wrongWords = wrongWords == null ? List.of() : List.copyOf(wrongWords);
    }

    /**
     * Result for an attempt that reproduced the line exactly.
     *
     * @return a correct result with 100% accuracy and no diagnostics
     */
    public static AccuracyResult perfect() {
        return new AccuracyResult(true, 100, List.of(), List.of(), List.of());
    }
}
