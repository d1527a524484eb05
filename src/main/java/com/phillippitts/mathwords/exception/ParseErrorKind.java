package com.phillippitts.mathwords.exception;

/**
 * Structural failure categories reported by {@link ParseException}.
 */
public enum ParseErrorKind {
    UNBALANCED_BRACE,
    UNBALANCED_DELIMITER,
    UNKNOWN_COMMAND,
    UNEXPECTED_TOKEN,
    MISSING_ARGUMENT,
    UNKNOWN_ENVIRONMENT,
    EMPTY_INPUT,
    INVALID_MATHML
}
