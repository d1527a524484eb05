package com.phillippitts.mathwords.service.latex;

/**
 * Kinds of tokens produced by {@link LatexLexer}.
 */
public enum TokenType {
    /** Control sequence; text is the name without backslash. */
    COMMAND,
    /** {@code \begin{name}}; text is the environment name. */
    BEGIN_ENVIRONMENT,
    /** {@code \end{name}}; text is the environment name. */
    END_ENVIRONMENT,
    /** Verbatim argument of a text-mode command such as {@code \text}. */
    TEXT,
    OPEN_BRACE,
    CLOSE_BRACE,
    /** Fence glyph: parentheses, brackets, bars and their Unicode forms. */
    DELIMITER,
    SUPERSCRIPT,
    SUBSCRIPT,
    /** Decimal literal such as {@code 42} or {@code 3.14}. */
    NUMBER,
    /** Single letter. */
    IDENTIFIER,
    /** Operator or symbol glyph ({@code +}, {@code =}, {@code ≤}, {@code ∑}, {@code !}). */
    OPERATOR,
    /** One or more apostrophes. */
    PRIME,
    COMMA,
    SEMICOLON,
    /** Column separator {@code &}. */
    AMPERSAND,
    /** Row separator {@code \\}. */
    ROW_SEPARATOR,
    EOF
}
