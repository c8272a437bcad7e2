package com.phillippitts.lineaccuracy.service.align;

import com.phillippitts.lineaccuracy.domain.LockedWordState;
import com.phillippitts.lineaccuracy.domain.RealtimeMatch;
import com.phillippitts.lineaccuracy.domain.Token;
import com.phillippitts.lineaccuracy.service.match.KnownNames;
import com.phillippitts.lineaccuracy.service.match.WordComparator;
import com.phillippitts.lineaccuracy.service.match.WordTables;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Incremental aligner for live highlighting.
 *
 * <p>Each call extends the previous {@link LockedWordState} with the spoken words beyond the locked
 * prefix. Only direct matches lock a word; skippable words and stutter repeats the speaker left out
 * are stepped over. The first mismatch sets {@code hasError} and stops.
 *
 * <p>A transcript shorter than the locked prefix is a recognizer revision and leaves the state as is.
 */
public final class LockedAligner {

    private final WordComparator comparator;
    private final WordTables tables;
    private final ErrorPolicy errorPolicy;

    public LockedAligner(WordComparator comparator, WordTables tables, ErrorPolicy errorPolicy) {
        this.comparator = Objects.requireNonNull(comparator);
        this.tables = Objects.requireNonNull(tables);
        this.errorPolicy = Objects.requireNonNull(errorPolicy);
    }

    /**
     * Extends a locked state with the current transcript.
     *
     * @param expected   expected tokens
     * @param spoken     the whole transcript so far
     * @param previous   previous state, or null for a new line
     * @param knownNames names eligible for fuzzy matching (may be null)
     * @return the new state; the very same {@code previous} instance when nothing may change
     */
    public LockedWordState extend(List<Token> expected, List<String> spoken, LockedWordState previous,
                                  KnownNames knownNames) {
        LockedWordState prev = previous == null ? LockedWordState.fresh() : previous;
        if (prev.hasError() && errorPolicy == ErrorPolicy.FREEZE) {
            return prev;
        }
        List<String> words = spoken == null ? List.of() : spoken;
        if (words.size() < prev.lockedWords().size()) {
            return prev;
        }

        TokenAlignment a = new TokenAlignment(expected == null ? List.of() : expected, words, comparator, tables,
                knownNames);
        List<String> locked = new ArrayList<>(prev.lockedWords());
        int lockedCount = prev.lockedCount();
        int e = prev.expectedIndex();
        int s = locked.size();
        boolean hasError = false;

        while (s < a.spokenSize() && e < a.expectedSize()) {
            if (a.shouldSkip(e, s)) {
                e++;
                continue;
            }
            AlignmentStep step = a.match(e, s, AlignmentMode.INCREMENTAL_LOCK);
            if (!step.matched()) {
                hasError = true;
                break;
            }
            locked.add(a.spoken(s));
            lockedCount++;
            e++;
            s++;
        }

        if (prev.hasError() && hasError && lockedCount == prev.lockedCount()) {
            return prev;
        }
        return new LockedWordState(locked, lockedCount, hasError, e);
    }

    /**
     * Single pass from an empty state, with no persisted lock.
     *
     * @param expected   expected tokens
     * @param spoken     transcript
     * @param knownNames names eligible for fuzzy matching (may be null)
     * @return matched word count and whether a mismatch stopped matching
     */
    public RealtimeMatch realtime(List<Token> expected, List<String> spoken, KnownNames knownNames) {
        LockedWordState state = extend(expected, spoken, LockedWordState.fresh(), knownNames);
        return new RealtimeMatch(state.lockedCount(), state.hasError());
    }

    /**
     * Whether a state has consumed the whole line without error. Trailing skippable words and stutter
     * repeats count as consumed.
     *
     * @param expected expected tokens
     * @param state    locked state (may be null)
     * @return true when the line is finished
     */
    public boolean isComplete(List<Token> expected, LockedWordState state) {
        if (state == null || state.hasError()) {
            return false;
        }
        List<Token> tokens = expected == null ? List.of() : expected;
        TokenAlignment a = new TokenAlignment(tokens, List.of(), comparator, tables, KnownNames.none());
        int e = state.expectedIndex();
        while (e < a.expectedSize() && a.isAutoSatisfiable(e)) {
            e++;
        }
        return e >= a.expectedSize();
    }
}
