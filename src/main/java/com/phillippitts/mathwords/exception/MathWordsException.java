package com.phillippitts.mathwords.exception;

/**
 * Base exception for all mathwords application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class MathWordsException extends RuntimeException {

    public MathWordsException(String message) {
        super(message);
    }

    public MathWordsException(String message, Throwable cause) {
        super(message, cause);
    }

    public MathWordsException(Throwable cause) {
        super(cause);
    }
}
