package com.phillippitts.mathwords.service;

import com.phillippitts.mathwords.config.properties.MathWordsProperties;
import com.phillippitts.mathwords.exception.EmptyInputException;
import com.phillippitts.mathwords.exception.ExpressionTooLongException;
import org.springframework.stereotype.Component;

/**
 * Checks raw input before it reaches the lexer.
 */
@Component
public class ExpressionValidator {

    private final MathWordsProperties props;

    public ExpressionValidator(MathWordsProperties props) {
        this.props = props;
    }

    /**
     * @param expression caller-supplied source
     * @throws EmptyInputException when the expression is null, empty or whitespace only
     * @throws ExpressionTooLongException when it exceeds {@code mathwords.max-expression-length}
     */
    public void validate(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new EmptyInputException();
        }
        if (expression.length() > props.getMaxExpressionLength()) {
            throw new ExpressionTooLongException(expression.length(), props.getMaxExpressionLength());
        }
    }
}
