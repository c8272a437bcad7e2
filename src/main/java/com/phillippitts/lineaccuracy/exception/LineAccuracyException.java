package com.phillippitts.lineaccuracy.exception;

/**
 * Base exception for all line-accuracy application errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class LineAccuracyException extends RuntimeException {

    public LineAccuracyException(String message) {
        super(message);
    }

    public LineAccuracyException(String message, Throwable cause) {
        super(message, cause);
    }
}
