package com.phillippitts.lineaccuracy.service.align;

import com.phillippitts.lineaccuracy.domain.Token;
import com.phillippitts.lineaccuracy.service.match.KnownNames;
import com.phillippitts.lineaccuracy.service.match.WordComparator;
import com.phillippitts.lineaccuracy.service.match.WordTables;

import java.util.List;

/**
 * Per-call alignment context shared by the batch, locked and word-by-word aligners.
 *
 * <p>Holds one expected line and one transcript and answers position-based questions about them.
 * All of the skip, match, compound, split and multi-word rules live here so the aligners cannot
 * drift apart; each aligner only decides what to do with the answer.
 */
public final class TokenAlignment {

    private final List<Token> expected;
    private final List<String> spoken;
    private final WordComparator comparator;
    private final WordTables tables;
    private final KnownNames knownNames;

    public TokenAlignment(List<Token> expected, List<String> spoken, WordComparator comparator,
                          WordTables tables, KnownNames knownNames) {
        this.expected = expected;
        this.spoken = spoken;
        this.comparator = comparator;
        this.tables = tables;
        this.knownNames = knownNames == null ? KnownNames.none() : knownNames;
    }

    public int expectedSize() {
        return expected.size();
    }

    public int spokenSize() {
        return spoken.size();
    }

    public Token expected(int e) {
        return expected.get(e);
    }

    public String spoken(int s) {
        return spoken.get(s);
    }

    /**
     * Whether the expected word may go unspoken: a skippable sound or direction, or a written
     * stutter repeating the previous word.
     */
    public boolean isAutoSatisfiable(int e) {
        return tables.isSkippable(expected.get(e).normalized()) || isStutterRepeat(e);
    }

    public boolean isStutterRepeat(int e) {
        return e > 0 && expected.get(e).normalized().equals(expected.get(e - 1).normalized());
    }

    public boolean isSkippable(int e) {
        return tables.isSkippable(expected.get(e).normalized());
    }

    public boolean isFiller(int s) {
        return tables.isFiller(spoken.get(s));
    }

    /**
     * Compares the expected word at {@code e} with the spoken word at {@code s}.
     */
    public boolean directMatch(int e, int s) {
        return comparator.matches(expected.get(e), spoken.get(s), knownNames);
    }

    /**
     * Whether the expected word at {@code e} should be skipped against the spoken word at {@code s}:
     * it is auto-satisfiable and the speaker did not say it.
     */
    public boolean shouldSkip(int e, int s) {
        return isAutoSatisfiable(e) && !directMatch(e, s);
    }

    /**
     * Tries every move allowed by {@code mode}, in order: direct, compound, split, expansion,
     * contraction.
     *
     * @param e    expected position, must be in range
     * @param s    spoken position, must be in range
     * @param mode alignment mode
     * @return the first move that succeeds, or {@link AlignmentStep#NONE}
     */
    public AlignmentStep match(int e, int s, AlignmentMode mode) {
        Token expWord = expected.get(e);
        String spkWord = spoken.get(s);

        if (comparator.matches(expWord, spkWord, knownNames)) {
            return new AlignmentStep(AlignmentStep.Kind.DIRECT, 1, 1, spkWord);
        }
        if (!mode.allowsMerges()) {
            return AlignmentStep.NONE;
        }

        if (s + 1 < spoken.size()) {
            String joined = spkWord + spoken.get(s + 1);
            if (comparator.matches(expWord, joined, knownNames)) {
                return new AlignmentStep(AlignmentStep.Kind.COMPOUND, 1, 2, joined);
            }
        }

        if (e + 1 < expected.size()) {
            String joinedExpected = expWord.normalized() + expected.get(e + 1).normalized();
            if (comparator.wordsMatch(joinedExpected, spkWord, expWord.original(), expWord.firstPosition(), knownNames)) {
                return new AlignmentStep(AlignmentStep.Kind.SPLIT, 2, 1, spkWord);
            }
        }

        for (List<String> phrase : tables.multiWordEquivalents(expWord.normalized())) {
            if (spokenStartsWith(s, phrase)) {
                return new AlignmentStep(AlignmentStep.Kind.EXPANSION, 1, phrase.size(), String.join(" ", phrase));
            }
        }

        for (List<String> phrase : tables.multiWordEquivalents(spkWord)) {
            if (expectedStartsWith(e, phrase)) {
                return new AlignmentStep(AlignmentStep.Kind.CONTRACTION, phrase.size(), 1, spkWord);
            }
        }

        return AlignmentStep.NONE;
    }

    /**
     * Looks for the spoken word at {@code s} among the next {@code window} expected words.
     *
     * @return offset (1-based) of the first match, or -1
     */
    public int findSpokenAheadInExpected(int e, int s, int window) {
        String spkWord = spoken.get(s);
        for (int i = 1; i <= window && e + i < expected.size(); i++) {
            Token ahead = expected.get(e + i);
            if (comparator.wordsMatch(ahead.normalized(), spkWord, ahead.original(), false, knownNames)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Looks for the expected word at {@code e} among the next {@code window} spoken words.
     *
     * @return offset (1-based) of the first match, or -1
     */
    public int findExpectedAheadInSpoken(int e, int s, int window) {
        Token expWord = expected.get(e);
        for (int i = 1; i <= window && s + i < spoken.size(); i++) {
            if (comparator.matches(expWord, spoken.get(s + i), knownNames)) {
                return i;
            }
        }
        return -1;
    }

    private boolean spokenStartsWith(int s, List<String> phrase) {
        if (s + phrase.size() > spoken.size()) {
            return false;
        }
        return spoken.subList(s, s + phrase.size()).equals(phrase);
    }

    private boolean expectedStartsWith(int e, List<String> phrase) {
        if (e + phrase.size() > expected.size()) {
            return false;
        }
        for (int i = 0; i < phrase.size(); i++) {
            if (!expected.get(e + i).normalized().equals(phrase.get(i))) {
                return false;
            }
        }
        return true;
    }
}
