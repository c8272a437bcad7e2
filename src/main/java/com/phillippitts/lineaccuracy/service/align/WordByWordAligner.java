package com.phillippitts.lineaccuracy.service.align;

import com.phillippitts.lineaccuracy.domain.WordByWordResult;
import com.phillippitts.lineaccuracy.domain.WordVerdict;
import com.phillippitts.lineaccuracy.service.match.WordComparator;
import com.phillippitts.lineaccuracy.service.match.WordTables;

import java.util.ArrayList;
import java.util.List;

/**
 * Produces exactly one verdict per expected word for rendering a finished attempt.
 *
 * <p>Skippable words and stutter repeats are always {@link WordVerdict#CORRECT}; they consume a spoken
 * word only when the speaker actually said them. Once the transcript runs out, every remaining word is
 * {@link WordVerdict#MISSING}.
 */
public final class WordByWordAligner extends AbstractLineAligner<WordByWordResult> {

    public WordByWordAligner(WordComparator comparator, WordTables tables) {
        super(comparator, tables);
    }

    @Override
    protected WordByWordResult doAlign(TokenAlignment a) {
        List<WordVerdict> results = new ArrayList<>(a.expectedSize());
        List<String> aligned = new ArrayList<>(a.expectedSize());
        int e = 0;
        int s = 0;

        while (e < a.expectedSize()) {
            String expWord = a.expected(e).normalized();
            boolean spokenLeft = s < a.spokenSize();

            if (a.isStutterRepeat(e) || a.isSkippable(e)) {
                if (spokenLeft && a.directMatch(e, s)) {
                    results.add(WordVerdict.CORRECT);
                    aligned.add(a.spoken(s));
                    s++;
                    e++;
                    continue;
                }
                // A stutter only counts once the speaker has started the line
                if (a.isSkippable(e) || s > 0) {
                    results.add(WordVerdict.CORRECT);
                    aligned.add(expWord);
                    e++;
                    continue;
                }
            }

            if (!spokenLeft) {
                results.add(WordVerdict.MISSING);
                aligned.add("");
                e++;
                continue;
            }

            AlignmentStep step = a.match(e, s, AlignmentMode.DIFF);
            if (step.matched()) {
                for (int i = 0; i < step.expectedConsumed(); i++) {
                    results.add(WordVerdict.CORRECT);
                    aligned.add(i == 0 ? step.spokenText() : "");
                }
                e += step.expectedConsumed();
                s += step.spokenConsumed();
                continue;
            }

            results.add(WordVerdict.WRONG);
            aligned.add(a.spoken(s));
            e++;
            s++;
        }

        return new WordByWordResult(results, aligned);
    }
}
