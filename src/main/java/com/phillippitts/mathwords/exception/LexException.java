package com.phillippitts.mathwords.exception;

/**
 * Thrown when the LaTeX source contains a character sequence that cannot be tokenized,
 * such as a trailing backslash or a macro parameter character.
 */
public class LexException extends MathWordsException {

    private final int position;
    private final String reason;

    public LexException(int position, String reason) {
        super("Lex error at position " + position + ": " + reason);
        this.position = position;
        this.reason = reason;
    }

    /**
     * @return 0-based character offset into the original source
     */
    public int getPosition() {
        return position;
    }

    public String getReason() {
        return reason;
    }
}
