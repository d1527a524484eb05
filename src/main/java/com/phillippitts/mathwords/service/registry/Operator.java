package com.phillippitts.mathwords.service.registry;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Binary operators and relations with their precedence level and default spoken word.
 *
 * <p>Each constant lists the glyphs (source characters or Unicode symbols) and the LaTeX
 * command names that denote it. Speech styles may override {@link #spoken()} per operator.
 * All operators are left associative; {@link #isAssociative()} only states whether
 * regrouping a right operand of equal precedence changes the meaning.
 */
public enum Operator {
    MID(Precedence.SUCH_THAT, "such that", false, List.of("∣"), List.of("mid")),
    COLON(Precedence.SUCH_THAT, "colon", false, List.of(":"), List.of()),

    EQUALS(Precedence.RELATION, "equals", true, List.of("="), List.of()),
    NOT_EQUALS(Precedence.RELATION, "is not equal to", false, List.of("≠"), List.of("ne", "neq")),
    LESS(Precedence.RELATION, "is less than", false, List.of("<"), List.of("lt")),
    GREATER(Precedence.RELATION, "is greater than", false, List.of(">"), List.of("gt")),
    LESS_EQUAL(Precedence.RELATION, "is less than or equal to", false, List.of("≤"),
            List.of("le", "leq", "leqslant")),
    GREATER_EQUAL(Precedence.RELATION, "is greater than or equal to", false, List.of("≥"),
            List.of("ge", "geq", "geqslant")),
    MUCH_LESS(Precedence.RELATION, "is much less than", false, List.of("≪"), List.of("ll")),
    MUCH_GREATER(Precedence.RELATION, "is much greater than", false, List.of("≫"), List.of("gg")),
    APPROX(Precedence.RELATION, "is approximately equal to", false, List.of("≈"), List.of("approx")),
    SIMILAR(Precedence.RELATION, "is similar to", false, List.of("∼"), List.of("sim")),
    ASYMPTOTIC(Precedence.RELATION, "is asymptotically equal to", false, List.of("≃"), List.of("simeq")),
    CONGRUENT(Precedence.RELATION, "is congruent to", false, List.of("≅"), List.of("cong")),
    EQUIVALENT(Precedence.RELATION, "is equivalent to", false, List.of("≡"), List.of("equiv")),
    PROPORTIONAL(Precedence.RELATION, "is proportional to", false, List.of("∝"), List.of("propto")),
    DEFINED_AS(Precedence.RELATION, "is defined as", false, List.of("≔", ":="), List.of("coloneqq")),
    ELEMENT_OF(Precedence.RELATION, "is an element of", false, List.of("∈"), List.of("in")),
    NOT_ELEMENT_OF(Precedence.RELATION, "is not an element of", false, List.of("∉"), List.of("notin")),
    CONTAINS(Precedence.RELATION, "contains", false, List.of("∋"), List.of("ni")),
    SUBSET(Precedence.RELATION, "is a subset of", false, List.of("⊂"), List.of("subset")),
    SUBSET_EQ(Precedence.RELATION, "is a subset of or equal to", false, List.of("⊆"), List.of("subseteq")),
    SUPERSET(Precedence.RELATION, "is a superset of", false, List.of("⊃"), List.of("supset")),
    SUPERSET_EQ(Precedence.RELATION, "is a superset of or equal to", false, List.of("⊇"), List.of("supseteq")),
    PERPENDICULAR(Precedence.RELATION, "is perpendicular to", false, List.of("⊥"), List.of("perp")),
    PARALLEL(Precedence.RELATION, "is parallel to", false, List.of("∥"), List.of("parallel")),
    TO(Precedence.RELATION, "goes to", false, List.of("→"), List.of("to", "rightarrow")),
    LEFT_ARROW(Precedence.RELATION, "left arrow", false, List.of("←"), List.of("leftarrow", "gets")),
    MAPS_TO(Precedence.RELATION, "maps to", false, List.of("↦"), List.of("mapsto")),
    IMPLIES(Precedence.IMPLICATION, "implies", false, List.of("⇒"), List.of("Rightarrow", "implies")),
    IMPLIED_BY(Precedence.IMPLICATION, "is implied by", false, List.of("⇐"), List.of("Leftarrow", "impliedby")),
    IFF(Precedence.IMPLICATION, "if and only if", false, List.of("⇔"), List.of("Leftrightarrow", "iff")),

    AND(Precedence.LOGICAL, "and", true, List.of("∧"), List.of("land", "wedge")),
    OR(Precedence.LOGICAL, "or", true, List.of("∨"), List.of("lor", "vee")),

    PLUS(Precedence.ADDITIVE, "plus", true, List.of("+"), List.of()),
    MINUS(Precedence.ADDITIVE, "minus", false, List.of("-", "−"), List.of()),
    PLUS_MINUS(Precedence.ADDITIVE, "plus or minus", false, List.of("±"), List.of("pm")),
    MINUS_PLUS(Precedence.ADDITIVE, "minus or plus", false, List.of("∓"), List.of("mp")),
    UNION(Precedence.ADDITIVE, "union", true, List.of("∪"), List.of("cup")),
    INTERSECTION(Precedence.ADDITIVE, "intersection", true, List.of("∩"), List.of("cap")),
    SET_MINUS(Precedence.ADDITIVE, "set minus", false, List.of("∖"), List.of("setminus", "backslash")),
    DIRECT_SUM(Precedence.ADDITIVE, "direct sum", true, List.of("⊕"), List.of("oplus")),

    TIMES(Precedence.MULTIPLICATIVE, "times", true, List.of("×"), List.of("times")),
    DOT(Precedence.MULTIPLICATIVE, "dot", true, List.of("⋅", "·"), List.of("cdot")),
    STAR(Precedence.MULTIPLICATIVE, "star", false, List.of("*", "∗", "⋆"), List.of("ast", "star")),
    DIVIDED_BY(Precedence.MULTIPLICATIVE, "divided by", false, List.of("/", "÷"), List.of("div")),
    COMPOSE(Precedence.MULTIPLICATIVE, "composed with", false, List.of("∘"), List.of("circ")),
    TENSOR(Precedence.MULTIPLICATIVE, "tensor", false, List.of("⊗"), List.of("otimes")),
    MOD(Precedence.MULTIPLICATIVE, "mod", false, List.of(), List.of("bmod", "mod")),

    IMPLICIT_TIMES(Precedence.IMPLICIT, "", true, List.of(), List.of());

    private static final Map<String, Operator> BY_GLYPH = new HashMap<>();

    static {
        for (Operator op : values()) {
            for (String glyph : op.glyphs) {
                BY_GLYPH.put(glyph, op);
            }
        }
    }

    private final int precedence;
    private final String spoken;
    private final boolean associative;
    private final List<String> glyphs;
    private final List<String> commands;

    Operator(int precedence, String spoken, boolean associative, List<String> glyphs, List<String> commands) {
        this.precedence = precedence;
        this.spoken = spoken;
        this.associative = associative;
        this.glyphs = glyphs;
        this.commands = commands;
    }

    public int precedence() {
        return precedence;
    }

    /** Default English wording, used when the active style has no override. */
    public String spoken() {
        return spoken;
    }

    public boolean isAssociative() {
        return associative;
    }

    public boolean isRelation() {
        return precedence == Precedence.RELATION;
    }

    /** Display glyph, or empty for implicit multiplication. */
    public String glyph() {
        return glyphs.isEmpty() ? "" : glyphs.get(0);
    }

    public List<String> commands() {
        return commands;
    }

    /**
     * Looks up an operator by a source glyph such as {@code "+"} or {@code "≤"}.
     *
     * @param glyph operator text
     * @return operator, or null when the glyph is not a binary operator
     */
    public static Operator forGlyph(String glyph) {
        return BY_GLYPH.get(glyph);
    }
}
