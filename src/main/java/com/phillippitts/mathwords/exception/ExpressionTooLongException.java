package com.phillippitts.mathwords.exception;

/**
 * Thrown when an expression exceeds the configured maximum length.
 */
public class ExpressionTooLongException extends MathWordsException {

    private final int length;
    private final int limit;

    public ExpressionTooLongException(int length, int limit) {
        super("Expression too long: " + length + " characters. Max: " + limit);
        this.length = length;
        this.limit = limit;
    }

    public int getLength() {
        return length;
    }

    public int getLimit() {
        return limit;
    }
}
