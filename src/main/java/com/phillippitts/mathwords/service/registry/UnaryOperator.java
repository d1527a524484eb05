package com.phillippitts.mathwords.service.registry;

import java.util.List;

/**
 * Prefix signs, postfix marks (factorial, primes) and accent decorations.
 *
 * <p>Accents such as {@code \hat} and {@code \vec} are modelled as unary operators because
 * they decorate exactly one operand and are spoken before or after it.
 */
public enum UnaryOperator {
    NEGATE(Fixity.PREFIX, "negative", "-", List.of()),
    POSITIVE(Fixity.PREFIX, "positive", "+", List.of()),
    PLUS_MINUS(Fixity.PREFIX, "plus or minus", "±", List.of()),
    MINUS_PLUS(Fixity.PREFIX, "minus or plus", "∓", List.of()),
    NOT(Fixity.PREFIX, "not", "¬", List.of("neg", "lnot")),

    FACTORIAL(Fixity.POSTFIX, "factorial", "!", List.of()),
    PRIME(Fixity.POSTFIX, "prime", "′", List.of()),
    DOUBLE_PRIME(Fixity.POSTFIX, "double prime", "″", List.of()),
    TRIPLE_PRIME(Fixity.POSTFIX, "triple prime", "‴", List.of()),

    HAT(Fixity.POSTFIX, "hat", "^", List.of("hat", "widehat")),
    BAR(Fixity.POSTFIX, "bar", "¯", List.of("bar", "overline")),
    UNDERLINE(Fixity.POSTFIX, "underline", "_", List.of("underline")),
    TILDE(Fixity.POSTFIX, "tilde", "~", List.of("tilde", "widetilde")),
    DOT(Fixity.POSTFIX, "dot", "˙", List.of("dot")),
    DOUBLE_DOT(Fixity.POSTFIX, "double dot", "¨", List.of("ddot")),
    VECTOR(Fixity.PREFIX, "vector", "→", List.of("vec", "overrightarrow"));

    /** Whether the spoken word precedes or follows the operand. */
    public enum Fixity { PREFIX, POSTFIX }

    private final Fixity fixity;
    private final String spoken;
    private final String glyph;
    private final List<String> commands;

    UnaryOperator(Fixity fixity, String spoken, String glyph, List<String> commands) {
        this.fixity = fixity;
        this.spoken = spoken;
        this.glyph = glyph;
        this.commands = commands;
    }

    public Fixity fixity() {
        return fixity;
    }

    public String spoken() {
        return spoken;
    }

    public String glyph() {
        return glyph;
    }

    public List<String> commands() {
        return commands;
    }

    /** True for decorations introduced by an accent command or MathML {@code mover accent}. */
    public boolean isAccent() {
        return ordinal() >= HAT.ordinal();
    }

    /**
     * Maps the prefix form of a binary operator glyph ({@code -x}, {@code \pm x}) to its sign.
     *
     * @param op operator found in prefix position
     * @return matching sign, or null if the operator cannot be used as a prefix
     */
    public static UnaryOperator prefixFor(Operator op) {
        return switch (op) {
            case MINUS -> NEGATE;
            case PLUS -> POSITIVE;
            case PLUS_MINUS -> PLUS_MINUS;
            case MINUS_PLUS -> MINUS_PLUS;
            default -> null;
        };
    }

    /**
     * Maps an accent glyph as found in MathML {@code <mover>} to its decoration.
     *
     * @param glyph accent character
     * @return decoration, or null when the glyph is not a known accent
     */
    public static UnaryOperator accentForGlyph(String glyph) {
        return switch (glyph) {
            case "^", "ˆ", "̂" -> HAT;
            case "¯", "‾", "̄", "_" -> BAR;
            case "~", "˜", "̃" -> TILDE;
            case "˙", "̇", "." -> DOT;
            case "¨", "̈" -> DOUBLE_DOT;
            case "→", "⃗" -> VECTOR;
            default -> null;
        };
    }
}
