/**
 * Application-specific exception hierarchy.
 *
 * <p>All exceptions extend {@link com.phillippitts.mathwords.exception.MathWordsException}, an
 * unchecked base, so callers can handle every conversion failure in one place.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.mathwords.exception.EmptyInputException} - blank expression</li>
 *   <li>{@link com.phillippitts.mathwords.exception.EmptyBatchException} - batch with no items</li>
 *   <li>{@link com.phillippitts.mathwords.exception.UnknownStyleException} - style name not registered</li>
 *   <li>{@link com.phillippitts.mathwords.exception.ExpressionTooLongException} - input above the configured limit</li>
 *   <li>{@link com.phillippitts.mathwords.exception.LexException} - malformed character sequence</li>
 *   <li>{@link com.phillippitts.mathwords.exception.ParseException} - structural failure, see
 *       {@link com.phillippitts.mathwords.exception.ParseErrorKind}</li>
 * </ul>
 *
 * <p>Every error is terminal for the failing call; no partial output accompanies an exception.
 * The REST boundary maps them to HTTP status codes in {@code GlobalExceptionHandler}.
 *
 * @since 1.0
 */
package com.phillippitts.mathwords.exception;
