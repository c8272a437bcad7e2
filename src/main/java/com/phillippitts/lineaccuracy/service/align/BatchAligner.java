package com.phillippitts.lineaccuracy.service.align;

import com.phillippitts.lineaccuracy.service.match.WordComparator;
import com.phillippitts.lineaccuracy.service.match.WordTables;

import java.util.ArrayList;
import java.util.List;

/**
 * Greedy end-of-utterance aligner producing counts for the pass/fail verdict.
 *
 * <p>At each position it tries, in order: skipping an unspoken skippable word or stutter repeat,
 * the alignment moves of {@link TokenAlignment#match}, dropping a spoken filler, and finally a bounded
 * look-ahead that classifies the pair as a missing word, an extra word, or a substitution.
 */
public final class BatchAligner extends AbstractLineAligner<AlignmentTally> {

    private final int lookAhead;

    /**
     * @param comparator word comparator
     * @param tables     word tables
     * @param lookAhead  look-ahead window in words, at least 1
     * @throws IllegalArgumentException if lookAhead is less than 1
     */
    public BatchAligner(WordComparator comparator, WordTables tables, int lookAhead) {
        super(comparator, tables);
        if (lookAhead < 1) {
            throw new IllegalArgumentException("lookAhead must be at least 1");
        }
        this.lookAhead = lookAhead;
    }

    @Override
    protected AlignmentTally doAlign(TokenAlignment a) {
        List<String> missing = new ArrayList<>();
        List<String> extra = new ArrayList<>();
        List<String> wrong = new ArrayList<>();
        int matched = 0;
        int skipped = 0;
        int e = 0;
        int s = 0;

        while (e < a.expectedSize() && s < a.spokenSize()) {
            if (a.shouldSkip(e, s)) {
                e++;
                skipped++;
                continue;
            }

            AlignmentStep step = a.match(e, s, AlignmentMode.BATCH);
            if (step.matched()) {
                matched += step.expectedConsumed();
                e += step.expectedConsumed();
                s += step.spokenConsumed();
                continue;
            }

            // Before look-ahead, so a mid-sentence "um" cannot throw the alignment off
            if (a.isFiller(s)) {
                s++;
                continue;
            }

            String expWord = a.expected(e).normalized();
            String spkWord = a.spoken(s);
            int expectedAhead = a.findSpokenAheadInExpected(e, s, lookAhead);
            int spokenAhead = a.findExpectedAheadInSpoken(e, s, lookAhead);

            if (expectedAhead == -1 && spokenAhead == -1) {
                wrong.add("\"" + spkWord + "\" instead of \"" + expWord + "\"");
                e++;
                s++;
            } else if (spokenAhead != -1 && (expectedAhead == -1 || spokenAhead <= expectedAhead)) {
                missing.add(expWord);
                e++;
            } else {
                extra.add(spkWord);
                s++;
            }
        }

        for (; e < a.expectedSize(); e++) {
            if (a.isAutoSatisfiable(e)) {
                skipped++;
            } else {
                missing.add(a.expected(e).normalized());
            }
        }
        for (; s < a.spokenSize(); s++) {
            if (!a.isFiller(s)) {
                extra.add(a.spoken(s));
            }
        }

        return new AlignmentTally(a.expectedSize(), matched, skipped, missing, extra, wrong);
    }
}
