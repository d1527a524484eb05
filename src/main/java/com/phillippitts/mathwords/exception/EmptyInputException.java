package com.phillippitts.mathwords.exception;

/**
 * Thrown when an expression is null, empty, or contains only whitespace.
 * Raised before any lexing takes place and never retried.
 */
public class EmptyInputException extends MathWordsException {

    public EmptyInputException() {
        super("Input string is empty");
    }

    public EmptyInputException(String message) {
        super(message);
    }
}
