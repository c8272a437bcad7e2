package com.phillippitts.lineaccuracy.exception;

/**
 * Thrown when a word table (equivalents, skippable words, fillers) cannot be loaded.
 * This is a fatal error: the comparator must never run against empty tables.
 */
public class WordTableException extends LineAccuracyException {

    private final String location;

    public WordTableException(String location, String reason) {
        super("Word table unavailable at " + location + ": " + reason);
        this.location = location;
    }

    public WordTableException(String location, Throwable cause) {
        super("Word table unavailable at " + location, cause);
        this.location = location;
    }

    public String getLocation() {
        return location;
    }
}
