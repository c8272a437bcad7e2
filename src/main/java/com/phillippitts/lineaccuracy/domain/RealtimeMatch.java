package com.phillippitts.lineaccuracy.domain;

/**
 * Single-pass live match: how many expected words were matched in order before the first mismatch.
 *
 * @param matched  count of expected words matched from the start of the line
 * @param hasError whether matching stopped on a mismatch
 */
public record RealtimeMatch(int matched, boolean hasError) {
}
