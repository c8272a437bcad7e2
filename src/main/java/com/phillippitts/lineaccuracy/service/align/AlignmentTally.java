package com.phillippitts.lineaccuracy.service.align;

import com.phillippitts.lineaccuracy.domain.AccuracyResult;

import java.util.List;

/**
 * Raw counts from a batch alignment, before tolerance bands are applied.
 *
 * @param expectedCount expected words in the line
 * @param matchedCount  expected words matched by speech
 * @param skippedCount  auto-satisfiable words that went unspoken, excluded from scoring
 * @param missingWords  expected words left out
 * @param extraWords    unexpected spoken words, fillers excluded
 * @param wrongWords    substitutions
 */
public record AlignmentTally(
        int expectedCount,
        int matchedCount,
        int skippedCount,
        List<String> missingWords,
        List<String> extraWords,
        List<String> wrongWords
) {

    public AlignmentTally {
        missingWords = List.copyOf(missingWords);
        extraWords = List.copyOf(extraWords);
        wrongWords = List.copyOf(wrongWords);
    }

    /**
     * @return expected words that count towards accuracy
     */
    public int effectiveWordCount() {
        return expectedCount - skippedCount;
    }

    /**
     * @return matched words as a rounded percentage of the scored words, 100 when nothing is scored
     */
    public int accuracy() {
        int effective = effectiveWordCount();
        if (effective <= 0) {
            return 100;
        }
        long rounded = Math.round(matchedCount * 100.0 / effective);
        return (int) Math.max(0, Math.min(100, rounded));
    }

    /**
     * Applies the tolerance band for this line length and produces the verdict.
     *
     * <p>Any substitution fails the attempt regardless of aggregate accuracy.
     *
     * @param strict whether strict mode is on
     * @return final result
     */
    public AccuracyResult toResult(boolean strict) {
        ToleranceBands band = ToleranceBands.forWordCount(effectiveWordCount(), strict);
        int accuracy = accuracy();
        boolean correct = wrongWords.isEmpty()
                && accuracy >= band.minAccuracy()
                && missingWords.size() <= band.allowedMissing()
                && extraWords.size() <= band.allowedExtra();
        return new AccuracyResult(correct, accuracy, missingWords, extraWords, wrongWords);
    }
}
