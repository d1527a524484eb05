package com.phillippitts.mathwords.service.registry;

/**
 * Binding strength levels shared by the parser and the verbalizer.
 *
 * <p>Higher values bind tighter. The verbalizer compares these levels to decide when a
 * spoken grouping cue ("the quantity") is needed around a child expression.
 */
public final class Precedence {

    /** Comma or semicolon separated lists. */
    public static final int SEQUENCE = 0;

    /** {@code \mid} and colon in set-builder notation. */
    public static final int SUCH_THAT = 1;

    /** {@code \Rightarrow}, {@code \iff} and other implications. */
    public static final int IMPLICATION = 2;

    /** {@code \land} and {@code \lor}; looser than relations so {@code x > 0 \land y > 0} splits at the connective. */
    public static final int LOGICAL = 3;

    public static final int RELATION = 4;

    public static final int ADDITIVE = 5;

    public static final int MULTIPLICATIVE = 6;

    /** Juxtaposition, e.g. {@code 2x} or {@code QK^T}. */
    public static final int IMPLICIT = 7;

    public static final int PREFIX = 8;

    public static final int SCRIPT = 9;

    /** Leaves and self-delimiting constructs (fractions, roots, matrices). */
    public static final int ATOM = 10;

    private Precedence() {
        // Utility class - prevent instantiation
    }
}
