package com.phillippitts.mathwords.service.registry;

import java.util.List;

/**
 * Operators that take optional lower/upper bounds and span a body expression.
 *
 * <p>Limit-like kinds ({@link #LIMIT}, {@link #MAXIMUM}, ...) read their lower bound with
 * "as" or "over" instead of "from ... to ...".
 */
public enum BigOperatorKind {
    SUM("sum", "∑", false, List.of("sum")),
    PRODUCT("product", "∏", false, List.of("prod")),
    COPRODUCT("coproduct", "∐", false, List.of("coprod")),
    INTEGRAL("integral", "∫", false, List.of("int", "intop")),
    DOUBLE_INTEGRAL("double integral", "∬", false, List.of("iint")),
    TRIPLE_INTEGRAL("triple integral", "∭", false, List.of("iiint")),
    CONTOUR_INTEGRAL("contour integral", "∮", false, List.of("oint")),
    UNION("union", "⋃", false, List.of("bigcup")),
    INTERSECTION("intersection", "⋂", false, List.of("bigcap")),
    DIRECT_SUM("direct sum", "⨁", false, List.of("bigoplus")),
    TENSOR_PRODUCT("tensor product", "⨂", false, List.of("bigotimes")),
    CONJUNCTION("conjunction", "⋀", false, List.of("bigwedge")),
    DISJUNCTION("disjunction", "⋁", false, List.of("bigvee")),
    LIMIT("limit", "lim", true, List.of("lim")),
    LIMIT_SUPERIOR("limit superior", "lim sup", true, List.of("limsup")),
    LIMIT_INFERIOR("limit inferior", "lim inf", true, List.of("liminf")),
    MAXIMUM("maximum", "max", true, List.of()),
    MINIMUM("minimum", "min", true, List.of()),
    SUPREMUM("supremum", "sup", true, List.of()),
    INFIMUM("infimum", "inf", true, List.of()),
    ARG_MAX("arg max", "argmax", true, List.of("argmax")),
    ARG_MIN("arg min", "argmin", true, List.of("argmin"));

    private final String spoken;
    private final String glyph;
    private final boolean limitLike;
    private final List<String> commands;

    BigOperatorKind(String spoken, String glyph, boolean limitLike, List<String> commands) {
        this.spoken = spoken;
        this.glyph = glyph;
        this.limitLike = limitLike;
        this.commands = commands;
    }

    public String spoken() {
        return spoken;
    }

    public String glyph() {
        return glyph;
    }

    public boolean isLimitLike() {
        return limitLike;
    }

    public boolean isIntegral() {
        return this == INTEGRAL || this == DOUBLE_INTEGRAL || this == TRIPLE_INTEGRAL || this == CONTOUR_INTEGRAL;
    }

    public List<String> commands() {
        return commands;
    }

    /**
     * Big-operator reading of a function that received a subscript, e.g. {@code \max_{i}}.
     *
     * @param functionName function command or MathML text such as {@code "max"}
     * @return matching kind, or null when the function has no big-operator reading
     */
    public static BigOperatorKind forScriptedFunction(String functionName) {
        return switch (functionName) {
            case "max" -> MAXIMUM;
            case "min" -> MINIMUM;
            case "sup" -> SUPREMUM;
            case "inf" -> INFIMUM;
            case "lim" -> LIMIT;
            case "argmax", "arg max" -> ARG_MAX;
            case "argmin", "arg min" -> ARG_MIN;
            default -> null;
        };
    }

    /**
     * Looks up a big operator by its Unicode glyph, as found in MathML {@code <mo>} elements.
     *
     * @param glyph operator character
     * @return matching kind, or null
     */
    public static BigOperatorKind forGlyph(String glyph) {
        for (BigOperatorKind kind : values()) {
            if (kind.glyph.equals(glyph)) {
                return kind;
            }
        }
        return null;
    }
}
