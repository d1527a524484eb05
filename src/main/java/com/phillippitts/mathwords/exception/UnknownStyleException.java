package com.phillippitts.mathwords.exception;

/**
 * Thrown when a speech style name is not present in the style registry.
 * There is no fallback to the default style.
 */
public class UnknownStyleException extends MathWordsException {

    private final String styleName;

    public UnknownStyleException(String styleName) {
        super("Unknown speech style: '" + styleName + "'");
        this.styleName = styleName;
    }

    public String getStyleName() {
        return styleName;
    }
}
