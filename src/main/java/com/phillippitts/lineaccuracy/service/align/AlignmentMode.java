package com.phillippitts.lineaccuracy.service.align;

/**
 * Which alignment moves an aligner may use.
 *
 * <p>Live locking only accepts one-to-one matches: merging words across a boundary that the
 * recognizer may still revise would lock a guess.
 */
public enum AlignmentMode {
    /** End-of-utterance verdict. */
    BATCH(true),
    /** Monotonic live progress. */
    INCREMENTAL_LOCK(false),
    /** Per-word rendering of a finished attempt. */
    DIFF(true);

    private final boolean allowsMerges;

    AlignmentMode(boolean allowsMerges) {
        this.allowsMerges = allowsMerges;
    }

    /**
     * @return whether compound, split and multi-word moves are allowed
     */
    public boolean allowsMerges() {
        return allowsMerges;
    }
}
