package com.phillippitts.lineaccuracy.domain;

import java.util.Objects;

/**
 * A single comparable word of an expected script line.
 *
 * @param normalized    lower-cased form used for comparison
 * @param original      the word as written in the script, casing preserved for proper-noun detection
 * @param firstPosition whether this is the first word of the line
 */
public record Token(String normalized, String original, boolean firstPosition) {

    public Token {
        Objects.requireNonNull(normalized, "normalized must not be null");
        Objects.requireNonNull(original, "original must not be null");
    }
}
