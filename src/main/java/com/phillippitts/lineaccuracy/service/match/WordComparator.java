package com.phillippitts.lineaccuracy.service.match;

import com.phillippitts.lineaccuracy.domain.Token;

/**
 * Decides whether a spoken word counts as the expected word.
 *
 * <p>Implementations must be stateless and thread-safe; the aligners call them for every token pair.
 */
public interface WordComparator {

    /**
     * Compares an expected word with a spoken word.
     *
     * @param expected         normalized expected word
     * @param spoken           normalized spoken word
     * @param expectedOriginal expected word as written, casing preserved (may be null)
     * @param firstPosition    whether the expected word starts the line
     * @param knownNames       names eligible for fuzzy matching (never null)
     * @return true if the spoken word is acceptable for the expected one
     */
    boolean wordsMatch(String expected, String spoken, String expectedOriginal,
                       boolean firstPosition, KnownNames knownNames);

    /**
     * Compares an expected script token with a spoken word.
     *
     * @param expected   expected token
     * @param spoken     normalized spoken word
     * @param knownNames names eligible for fuzzy matching (never null)
     * @return true if the spoken word is acceptable for the expected one
     */
    default boolean matches(Token expected, String spoken, KnownNames knownNames) {
        return wordsMatch(expected.normalized(), spoken, expected.original(), expected.firstPosition(), knownNames);
    }
}
