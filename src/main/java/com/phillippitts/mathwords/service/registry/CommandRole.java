package com.phillippitts.mathwords.service.registry;

/**
 * Semantic tag of a registered control sequence. The parser dispatches on this tag with an
 * exhaustive switch, so adding a role forces every consumer to handle it.
 */
public enum CommandRole {
    /** Letter-like symbol with a fixed glyph and spoken word ({@code \alpha}, {@code \infty}). */
    SYMBOL,
    /** Binary operator or relation; payload is an {@link Operator}. */
    OPERATOR,
    /** Prefix logical operator ({@code \neg}); payload is a {@link UnaryOperator}. */
    UNARY,
    /** Named function applied to the following operand ({@code \sin}, {@code \log}). */
    FUNCTION,
    /** Operator with optional bounds spanning a body; payload is a {@link BigOperatorKind}. */
    BIG_OPERATOR,
    /** Two-argument fraction. */
    FRACTION,
    /** Two-argument binomial coefficient. */
    BINOMIAL,
    /** Root with an optional bracketed degree. */
    ROOT,
    /** One-argument decoration; payload is an accent {@link UnaryOperator}. */
    ACCENT,
    /** One-argument letter style; payload is a {@link MathFont}. */
    FONT,
    /** Text-mode wrapper whose argument is read verbatim. */
    TEXT,
    /** Fence glyph written as a command; payload is a {@link Delimiter}. */
    DELIMITER,
    /** Size modifier in front of a delimiter ({@code \left}, {@code \big}). */
    SIZING,
    /** Layout-only command that produces no speech ({@code \,}, {@code \quad}). */
    SPACING,
    /** Command whose single argument is dropped ({@code \label}, {@code \hspace}). */
    DISCARD,
    /** {@code \not} in front of a relation. */
    NEGATION,
    /** {@code \begin} or {@code \end} written without a braced environment name. */
    ENVIRONMENT
}
