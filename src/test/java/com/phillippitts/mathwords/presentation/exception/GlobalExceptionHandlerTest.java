package com.phillippitts.mathwords.presentation.exception;

import com.phillippitts.mathwords.exception.EmptyBatchException;
import com.phillippitts.mathwords.exception.EmptyInputException;
import com.phillippitts.mathwords.exception.ExpressionTooLongException;
import com.phillippitts.mathwords.exception.LexException;
import com.phillippitts.mathwords.exception.ParseErrorKind;
import com.phillippitts.mathwords.exception.ParseException;
import com.phillippitts.mathwords.exception.UnknownStyleException;
import com.phillippitts.mathwords.presentation.exception.GlobalExceptionHandler.ApiError;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpInputMessage;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void invalidRequestsReturn400WithExceptionName() {
        ResponseEntity<ApiError> empty = handler.handleInvalidRequest(new EmptyInputException());
        ResponseEntity<ApiError> batch = handler.handleInvalidRequest(new EmptyBatchException());
        ResponseEntity<ApiError> tooLong = handler.handleInvalidRequest(new ExpressionTooLongException(30000, 20000));
        ResponseEntity<ApiError> style = handler.handleInvalidRequest(new UnknownStyleException("Shouting"));

        assertThat(empty.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(empty.getBody().errorCode()).isEqualTo("EmptyInputException");
        assertThat(batch.getBody().errorCode()).isEqualTo("EmptyBatchException");
        assertThat(tooLong.getBody().details()).contains("30000").contains("20000");
        assertThat(style.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(style.getBody().details()).contains("Shouting");
    }

    @Test
    void unreadableBodyReturns400() {
        HttpMessageNotReadableException ex =
                new HttpMessageNotReadableException("JSON parse error", mock(HttpInputMessage.class));

        ResponseEntity<ApiError> response = handler.handleUnreadableBody(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().errorCode()).isEqualTo("MalformedRequest");
    }

    @Test
    void lexErrorReturns422() {
        ResponseEntity<ApiError> response = handler.handleLexError(new LexException(4, "trailing backslash"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        assertThat(response.getBody().errorCode()).isEqualTo("LexException");
        assertThat(response.getBody().details()).contains("position 4");
    }

    @Test
    void parseErrorReturns422WithKindInErrorCode() {
        ResponseEntity<ApiError> response = handler.handleParseError(ParseException.unknownCommand("dmodel", 4));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        assertThat(response.getBody().errorCode()).isEqualTo("ParseException.UNKNOWN_COMMAND");
        assertThat(response.getBody().details()).contains("\\dmodel");
    }

    @Test
    void parseErrorCodeFollowsKind() {
        ResponseEntity<ApiError> response = handler.handleParseError(
                new ParseException(ParseErrorKind.UNBALANCED_BRACE, 0, "missing }"));

        assertThat(response.getBody().errorCode()).isEqualTo("ParseException.UNBALANCED_BRACE");
    }

    @Test
    void unexpectedReturns500WithoutInternalDetails() {
        ResponseEntity<ApiError> response =
                handler.handleUnexpected(new IllegalStateException("database password: secret123"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().errorCode()).isEqualTo("InternalServerError");
        assertThat(response.getBody().toString())
                .contains("unexpected error")
                .doesNotContain("secret123")
                .doesNotContain("IllegalStateException");
    }

    @Test
    void errorResponsesCarryRecentTimestamp() {
        Instant before = Instant.now().minusSeconds(1);

        ResponseEntity<ApiError> response = handler.handleInvalidRequest(new EmptyInputException());

        assertThat(response.getBody().timestamp()).isAfter(before);
        assertThat(response.getBody().toString())
                .contains("errorCode=")
                .contains("message=")
                .contains("details=")
                .contains("timestamp=");
    }
}
