package com.phillippitts.lineaccuracy.domain;

import java.util.List;

/**
 * Caller-held progress of live matching for one line.
 *
 * <p>The state only ever grows: spoken words that matched are locked and are never re-examined, so a
 * recognizer revising earlier words cannot move highlighted progress backwards. Once {@code hasError}
 * is set the state is frozen until the caller starts over with {@link #fresh()}.
 *
 * <p>Instances must not be shared between lines or sessions; one practice turn owns one chain of states.
 *
 * @param lockedWords   spoken words consumed by the lock, in order
 * @param lockedCount   number of expected words matched so far
 * @param hasError      whether a mismatch stopped matching
 * @param expectedIndex position in the expected words where matching resumes
 */
public record LockedWordState(
        List<String> lockedWords,
        int lockedCount,
        boolean hasError,
        int expectedIndex
) {

    public LockedWordState {
        lockedWords = lockedWords == null ? List.of() : List.copyOf(lockedWords);
        if (lockedCount < 0) {
            throw new IllegalArgumentException("lockedCount must not be negative, got: " + lockedCount);
        }
        // States posted by older clients carry no resume index
        if (expectedIndex < lockedCount) {
            expectedIndex = lockedCount;
        }
    }

    /**
     * Creates an empty state for a new line.
     *
     * @return state with nothing locked and no error
     */
    public static LockedWordState fresh() {
        return new LockedWordState(List.of(), 0, false, 0);
    }
}
