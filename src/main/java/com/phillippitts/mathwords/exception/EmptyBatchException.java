package com.phillippitts.mathwords.exception;

/**
 * Thrown when a batch conversion is requested with no items.
 */
public class EmptyBatchException extends MathWordsException {

    public EmptyBatchException() {
        super("Expression list is empty");
    }
}
