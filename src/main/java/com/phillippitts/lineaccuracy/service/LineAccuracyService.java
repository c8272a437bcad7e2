package com.phillippitts.lineaccuracy.service;

import com.phillippitts.lineaccuracy.config.accuracy.AccuracyProperties;
import com.phillippitts.lineaccuracy.domain.AccuracyResult;
import com.phillippitts.lineaccuracy.domain.LockedWordState;
import com.phillippitts.lineaccuracy.domain.RealtimeMatch;
import com.phillippitts.lineaccuracy.domain.SubsequenceMatchResult;
import com.phillippitts.lineaccuracy.domain.Token;
import com.phillippitts.lineaccuracy.domain.WordByWordResult;
import com.phillippitts.lineaccuracy.service.align.AlignmentTally;
import com.phillippitts.lineaccuracy.service.align.BatchAligner;
import com.phillippitts.lineaccuracy.service.align.LockedAligner;
import com.phillippitts.lineaccuracy.service.align.SubsequenceAligner;
import com.phillippitts.lineaccuracy.service.align.WordByWordAligner;
import com.phillippitts.lineaccuracy.service.match.KnownNames;
import com.phillippitts.lineaccuracy.service.match.WordComparator;
import com.phillippitts.lineaccuracy.service.match.WordTables;
import com.phillippitts.lineaccuracy.service.metrics.AccuracyMetrics;
import com.phillippitts.lineaccuracy.service.text.LineTokenizer;
import com.phillippitts.lineaccuracy.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;

/**
 * Entry point for judging spoken attempts at a line.
 *
 * <p>Every operation is a pure function of its arguments and the word tables loaded at startup, so
 * the service can be called from any thread. The only state is the caller-held
 * {@link LockedWordState}, which one practice turn owns exclusively.
 *
 * <p>No string input raises an exception: null is treated as empty text and empty text resolves to a
 * defined result.
 */
@Service
public class LineAccuracyService {

    private static final Logger LOG = LogManager.getLogger(LineAccuracyService.class);

    private final WordComparator comparator;
    private final BatchAligner batchAligner;
    private final LockedAligner lockedAligner;
    private final SubsequenceAligner subsequenceAligner;
    private final WordByWordAligner wordByWordAligner;
    private final AccuracyMetrics metrics;

    public LineAccuracyService(WordComparator comparator, WordTables tables, AccuracyProperties props,
                               AccuracyMetrics metrics) {
        this.comparator = Objects.requireNonNull(comparator);
        this.metrics = Objects.requireNonNull(metrics);
        this.batchAligner = new BatchAligner(comparator, tables, props.getLookAhead());
        this.lockedAligner = new LockedAligner(comparator, tables, props.getErrorPolicy());
        this.subsequenceAligner = new SubsequenceAligner(comparator, tables);
        this.wordByWordAligner = new WordByWordAligner(comparator, tables);
    }

    public AccuracyResult checkAccuracy(String expected, String spoken) {
        return checkAccuracy(expected, spoken, false, KnownNames.none());
    }

    public AccuracyResult checkAccuracy(String expected, String spoken, boolean strict) {
        return checkAccuracy(expected, spoken, strict, KnownNames.none());
    }

    /**
     * Scores a finished attempt at a line.
     *
     * @param expected   the line as written
     * @param spoken     the final transcript
     * @param strict     whether any missing or extra word fails the attempt
     * @param knownNames names eligible for fuzzy matching (may be null)
     * @return verdict with accuracy and the words that went wrong
     */
    public AccuracyResult checkAccuracy(String expected, String spoken, boolean strict, KnownNames knownNames) {
        long start = System.nanoTime();
        List<Token> expectedTokens = LineTokenizer.tokenizeScript(expected);
        List<String> spokenWords = LineTokenizer.tokenizeSpoken(spoken);

        AccuracyResult result;
        if (LineTokenizer.normalizedWords(expectedTokens).equals(spokenWords)) {
            result = AccuracyResult.perfect();
        } else {
            AlignmentTally tally = batchAligner.align(expectedTokens, spokenWords, knownNames);
            result = tally.toResult(strict);
        }

        metrics.recordCheckLatency(System.nanoTime() - start);
        metrics.recordCheckResult(result.correct(), strict);
        if (LOG.isDebugEnabled()) {
            LOG.debug("Checked line '{}' against '{}': correct={}, accuracy={}, missing={}, extra={}, wrong={}",
                    LogSanitizer.preview(expected), LogSanitizer.preview(spoken), result.correct(),
                    result.accuracy(), result.missingWords().size(), result.extraWords().size(),
                    result.wrongWords().size());
        }
        return result;
    }

    /**
     * Stateless live match: how many leading words were spoken correctly.
     */
    public RealtimeMatch getRealtimeWordMatch(String expected, String spoken, KnownNames knownNames) {
        return lockedAligner.realtime(LineTokenizer.tokenizeScript(expected),
                LineTokenizer.tokenizeSpoken(spoken), knownNames);
    }

    /**
     * Extends a caller-held locked state with the transcript so far.
     *
     * @param expected   the line as written
     * @param spoken     the accumulated transcript
     * @param previous   previous state, or null for a new line
     * @param knownNames names eligible for fuzzy matching (may be null)
     * @return the next state; {@code previous} itself when it cannot change
     */
    public LockedWordState getLockedWordMatch(String expected, String spoken, LockedWordState previous,
                                              KnownNames knownNames) {
        LockedWordState next = lockedAligner.extend(LineTokenizer.tokenizeScript(expected),
                LineTokenizer.tokenizeSpoken(spoken), previous, knownNames);
        boolean wasFrozen = previous != null && previous.hasError();
        if (next.hasError() && !wasFrozen) {
            metrics.incrementLockedFrozen();
            LOG.debug("Locked match stopped after {} words on '{}'", next.lockedCount(),
                    LogSanitizer.preview(spoken));
        }
        return next;
    }

    public LockedWordState createFreshLockedState() {
        return LockedWordState.fresh();
    }

    /**
     * Gap-tolerant live match based on the longest common subsequence.
     */
    public SubsequenceMatchResult getSubsequenceWordMatch(String expected, String spoken, KnownNames knownNames) {
        return subsequenceAligner.align(LineTokenizer.tokenizeScript(expected),
                LineTokenizer.tokenizeSpoken(spoken), knownNames);
    }

    /**
     * One verdict per expected word, with the spoken word aligned to each, for rendering a result.
     */
    public WordByWordResult getWordByWordResults(String expected, String spoken, KnownNames knownNames) {
        return wordByWordAligner.align(LineTokenizer.tokenizeScript(expected),
                LineTokenizer.tokenizeSpoken(spoken), knownNames);
    }

    /**
     * Whether a locked state covers the whole line, so listening can stop.
     */
    public boolean isLineComplete(String expected, LockedWordState state) {
        return lockedAligner.isComplete(LineTokenizer.tokenizeScript(expected), state);
    }

    /**
     * Compares two single words the way the aligners do. Null is treated as empty.
     */
    public boolean wordsMatch(String expected, String spoken, KnownNames knownNames) {
        List<Token> expectedTokens = LineTokenizer.tokenizeScript(expected);
        List<String> spokenWords = LineTokenizer.tokenizeSpoken(spoken);
        if (expectedTokens.isEmpty() || spokenWords.isEmpty()) {
            return expectedTokens.isEmpty() && spokenWords.isEmpty();
        }
        Token first = expectedTokens.get(0);
        return comparator.matches(first, spokenWords.get(0), knownNames == null ? KnownNames.none() : knownNames);
    }
}
