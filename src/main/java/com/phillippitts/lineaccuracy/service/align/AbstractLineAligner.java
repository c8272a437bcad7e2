package com.phillippitts.lineaccuracy.service.align;

import com.phillippitts.lineaccuracy.domain.Token;
import com.phillippitts.lineaccuracy.service.match.KnownNames;
import com.phillippitts.lineaccuracy.service.match.WordComparator;
import com.phillippitts.lineaccuracy.service.match.WordTables;

import java.util.List;
import java.util.Objects;

/**
 * Base class for aligners that walk one expected line against one transcript.
 *
 * <p>This class implements the Template Method pattern: {@link #align(List, List, KnownNames)}
 * replaces null inputs with empty ones, builds the shared {@link TokenAlignment} context and delegates
 * to {@link #doAlign(TokenAlignment)}. Subclasses never see null.
 *
 * <p><b>Thread Safety:</b> Aligners hold only immutable collaborators and are safe to share.
 *
 * @param <R> result type
 */
public abstract class AbstractLineAligner<R> {

    private final WordComparator comparator;
    private final WordTables tables;

    protected AbstractLineAligner(WordComparator comparator, WordTables tables) {
        this.comparator = Objects.requireNonNull(comparator);
        this.tables = Objects.requireNonNull(tables);
    }

    /**
     * Aligns a tokenized line with a tokenized transcript.
     *
     * @param expected   expected tokens (may be null)
     * @param spoken     spoken words (may be null)
     * @param knownNames names eligible for fuzzy matching (may be null)
     * @return aligner-specific result
     */
    public final R align(List<Token> expected, List<String> spoken, KnownNames knownNames) {
        return doAlign(new TokenAlignment(
                expected == null ? List.of() : expected,
                spoken == null ? List.of() : spoken,
                comparator,
                tables,
                knownNames == null ? KnownNames.none() : knownNames));
    }

    /**
     * Aligns using subclass-specific rules.
     *
     * @param alignment alignment context (never null)
     * @return aligner-specific result
     */
    protected abstract R doAlign(TokenAlignment alignment);
}
