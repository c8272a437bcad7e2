package com.phillippitts.lineaccuracy.service.align;

/**
 * What the locked aligner does with a state that already hit a mismatch.
 */
public enum ErrorPolicy {
    /** The state stays frozen until the caller starts a fresh one. */
    FREEZE,
    /** Matching is retried from the locked point, clearing the error if the transcript now matches. */
    RECOVER
}
