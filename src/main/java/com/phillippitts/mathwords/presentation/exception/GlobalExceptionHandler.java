package com.phillippitts.mathwords.presentation.exception;

import com.phillippitts.mathwords.exception.EmptyBatchException;
import com.phillippitts.mathwords.exception.EmptyInputException;
import com.phillippitts.mathwords.exception.ExpressionTooLongException;
import com.phillippitts.mathwords.exception.LexException;
import com.phillippitts.mathwords.exception.MathWordsException;
import com.phillippitts.mathwords.exception.ParseException;
import com.phillippitts.mathwords.exception.UnknownStyleException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Invalid requests map to 400, expressions that cannot be lexed or parsed to 422.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Client error - request cannot be processed as given (HTTP 400).
     */
    @ExceptionHandler({EmptyInputException.class, EmptyBatchException.class,
            ExpressionTooLongException.class, UnknownStyleException.class})
    ResponseEntity<ApiError> handleInvalidRequest(MathWordsException ex) {
        LOG.warn("Rejected request: {}", ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Invalid request",
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Malformed JSON body (HTTP 400).
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    ResponseEntity<ApiError> handleUnreadableBody(HttpMessageNotReadableException ex) {
        LOG.warn("Unreadable request body: {}", ex.getMostSpecificCause().getMessage());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                "MalformedRequest",
                "Request body could not be read",
                "Expected a JSON object",
                Instant.now()
            ));
    }

    /**
     * Expression is not valid math input (HTTP 422).
     */
    @ExceptionHandler(LexException.class)
    ResponseEntity<ApiError> handleLexError(LexException ex) {
        LOG.warn("Lex error at position {}: {}", ex.getPosition(), ex.getReason());
        return ResponseEntity
            .status(HttpStatus.UNPROCESSABLE_ENTITY)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Expression could not be tokenized",
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Expression does not form a supported structure (HTTP 422). The error code carries the
     * parse error kind, e.g. {@code ParseException.UNKNOWN_COMMAND}.
     */
    @ExceptionHandler(ParseException.class)
    ResponseEntity<ApiError> handleParseError(ParseException ex) {
        LOG.warn("Parse error {} at position {}", ex.getKind(), ex.getPosition());
        return ResponseEntity
            .status(HttpStatus.UNPROCESSABLE_ENTITY)
            .body(new ApiError(
                ex.getClass().getSimpleName() + "." + ex.getKind(),
                "Expression could not be parsed",
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                "InternalServerError",
                "An unexpected error occurred",
                "Please contact support with request ID",
                Instant.now()
            ));
    }

    /**
     * Standardized error response for API clients.
     */
    record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
