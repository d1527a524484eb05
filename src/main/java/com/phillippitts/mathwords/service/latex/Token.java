package com.phillippitts.mathwords.service.latex;

/**
 * Immutable lexical unit.
 *
 * @param type token kind
 * @param text command name, glyph, literal or environment name, depending on the type
 * @param position 0-based offset of the token's first character in the source
 */
public record Token(TokenType type, String text, int position) {

    public boolean is(TokenType expected) {
        return type == expected;
    }

    public boolean is(TokenType expected, String expectedText) {
        return type == expected && text.equals(expectedText);
    }

    @Override
    public String toString() {
        return type + "(" + text + ")@" + position;
    }
}
