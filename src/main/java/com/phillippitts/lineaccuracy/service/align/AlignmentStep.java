package com.phillippitts.lineaccuracy.service.align;

/**
 * Outcome of trying to align the expected word at one position with the spoken word at another.
 *
 * @param kind             which move succeeded, {@link Kind#NONE} if none did
 * @param expectedConsumed expected words covered by the move
 * @param spokenConsumed   spoken words covered by the move
 * @param spokenText       spoken text covered by the move, for display
 */
public record AlignmentStep(Kind kind, int expectedConsumed, int spokenConsumed, String spokenText) {

    public enum Kind {
        /** One expected word, one spoken word. */
        DIRECT,
        /** Two spoken words joined form one expected word ("cork screw"). */
        COMPOUND,
        /** One spoken word covers two expected words joined. */
        SPLIT,
        /** Expected word matches a spoken phrase ("alright" / "all right"). */
        EXPANSION,
        /** Spoken word matches an expected phrase ("all right" / "alright"). */
        CONTRACTION,
        NONE
    }

    static final AlignmentStep NONE = new AlignmentStep(Kind.NONE, 0, 0, "");

    public boolean matched() {
        return kind != Kind.NONE;
    }
}
