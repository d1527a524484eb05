package com.phillippitts.mathwords.service.registry;

import java.util.List;

/**
 * Fence glyphs usable as opening or closing delimiters.
 */
public enum Delimiter {
    LEFT_PAREN("(", Side.OPEN, "open paren", List.of()),
    RIGHT_PAREN(")", Side.CLOSE, "close paren", List.of()),
    LEFT_BRACKET("[", Side.OPEN, "open bracket", List.of("lbrack")),
    RIGHT_BRACKET("]", Side.CLOSE, "close bracket", List.of("rbrack")),
    LEFT_BRACE("{", Side.OPEN, "open brace", List.of("{", "lbrace")),
    RIGHT_BRACE("}", Side.CLOSE, "close brace", List.of("}", "rbrace")),
    LEFT_ANGLE("⟨", Side.OPEN, "left angle bracket", List.of("langle")),
    RIGHT_ANGLE("⟩", Side.CLOSE, "right angle bracket", List.of("rangle")),
    LEFT_FLOOR("⌊", Side.OPEN, "left floor", List.of("lfloor")),
    RIGHT_FLOOR("⌋", Side.CLOSE, "right floor", List.of("rfloor")),
    LEFT_CEILING("⌈", Side.OPEN, "left ceiling", List.of("lceil")),
    RIGHT_CEILING("⌉", Side.CLOSE, "right ceiling", List.of("rceil")),
    VERTICAL_BAR("|", Side.EITHER, "vertical bar", List.of("vert", "lvert", "rvert")),
    DOUBLE_BAR("‖", Side.EITHER, "double vertical bar", List.of("|", "Vert", "lVert", "rVert")),
    NONE(".", Side.EITHER, "", List.of());

    /** Which side of a delimited group the glyph may appear on. */
    public enum Side { OPEN, CLOSE, EITHER }

    private final String glyph;
    private final Side side;
    private final String spoken;
    private final List<String> commands;

    Delimiter(String glyph, Side side, String spoken, List<String> commands) {
        this.glyph = glyph;
        this.side = side;
        this.spoken = spoken;
        this.commands = commands;
    }

    public String glyph() {
        return glyph;
    }

    public String spoken() {
        return spoken;
    }

    public List<String> commands() {
        return commands;
    }

    public boolean canOpen() {
        return side != Side.CLOSE;
    }

    public boolean canClose() {
        return side != Side.OPEN;
    }

    /**
     * The closing glyph that conventionally matches this opening glyph.
     */
    public Delimiter partner() {
        return switch (this) {
            case LEFT_PAREN -> RIGHT_PAREN;
            case LEFT_BRACKET -> RIGHT_BRACKET;
            case LEFT_BRACE -> RIGHT_BRACE;
            case LEFT_ANGLE -> RIGHT_ANGLE;
            case LEFT_FLOOR -> RIGHT_FLOOR;
            case LEFT_CEILING -> RIGHT_CEILING;
            case RIGHT_PAREN -> LEFT_PAREN;
            case RIGHT_BRACKET -> LEFT_BRACKET;
            case RIGHT_BRACE -> LEFT_BRACE;
            case RIGHT_ANGLE -> LEFT_ANGLE;
            case RIGHT_FLOOR -> LEFT_FLOOR;
            case RIGHT_CEILING -> LEFT_CEILING;
            case VERTICAL_BAR, DOUBLE_BAR, NONE -> this;
        };
    }

    /**
     * Whether {@code close} may terminate a group opened by this delimiter.
     * Parentheses and brackets may be mixed to write half-open intervals such as {@code [0, 1)}.
     */
    public boolean acceptsCloser(Delimiter close) {
        if (this == NONE || close == NONE) {
            return true;
        }
        if ((this == LEFT_PAREN || this == LEFT_BRACKET) && (close == RIGHT_PAREN || close == RIGHT_BRACKET)) {
            return true;
        }
        return partner() == close;
    }

    /**
     * Looks up a delimiter by its glyph, as written in source or in MathML {@code <mo>}.
     *
     * @param glyph delimiter character
     * @return delimiter, or null
     */
    public static Delimiter forGlyph(String glyph) {
        for (Delimiter d : values()) {
            if (d.glyph.equals(glyph)) {
                return d;
            }
        }
        return switch (glyph) {
            case "∣" -> VERTICAL_BAR;
            case "〈" -> LEFT_ANGLE;
            case "〉" -> RIGHT_ANGLE;
            default -> null;
        };
    }
}
