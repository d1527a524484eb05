package com.phillippitts.mathwords.service.registry;

import java.util.List;

/**
 * Supported {@code \begin{...}} environments and the way their rows are read.
 */
public enum EnvironmentKind {
    MATRIX(Layout.MATRIX, Delimiter.NONE, List.of("matrix")),
    PMATRIX(Layout.MATRIX, Delimiter.LEFT_PAREN, List.of("pmatrix")),
    BMATRIX(Layout.MATRIX, Delimiter.LEFT_BRACKET, List.of("bmatrix")),
    BRACE_MATRIX(Layout.MATRIX, Delimiter.LEFT_BRACE, List.of("Bmatrix")),
    DETERMINANT(Layout.MATRIX, Delimiter.VERTICAL_BAR, List.of("vmatrix")),
    NORM_MATRIX(Layout.MATRIX, Delimiter.DOUBLE_BAR, List.of("Vmatrix")),
    SMALL_MATRIX(Layout.MATRIX, Delimiter.NONE, List.of("smallmatrix")),
    ARRAY(Layout.MATRIX, Delimiter.NONE, List.of("array")),
    CASES(Layout.CASES, Delimiter.LEFT_BRACE, List.of("cases", "dcases")),
    LINES(Layout.LINES, Delimiter.NONE, List.of("aligned", "align", "align*", "alignat", "alignat*",
            "gathered", "gather", "gather*", "split", "eqnarray", "eqnarray*", "multline", "multline*",
            "equation", "equation*", "displaymath"));

    /** How rows and cells are spoken. */
    public enum Layout {
        /** Rows of cells, spoken with row and column markers. */
        MATRIX,
        /** Piecewise definition: value cell followed by condition cell. */
        CASES,
        /** Aligned equations: cells are joined back into one line per row. */
        LINES
    }

    private final Layout layout;
    private final Delimiter fence;
    private final List<String> names;

    EnvironmentKind(Layout layout, Delimiter fence, List<String> names) {
        this.layout = layout;
        this.fence = fence;
        this.names = names;
    }

    public Layout layout() {
        return layout;
    }

    /** Opening fence drawn around the environment ({@link Delimiter#NONE} for bare layouts). */
    public Delimiter fence() {
        return fence;
    }

    public List<String> names() {
        return names;
    }

    /** Whether the environment starts with a braced column specification, e.g. {@code {cc}}. */
    public boolean takesColumnSpec() {
        return this == ARRAY;
    }

    /**
     * Picks the matrix kind drawn with the given fence, used for MathML tables wrapped in fences.
     *
     * @param open opening delimiter around the table
     * @return matrix kind for that fence
     */
    public static EnvironmentKind matrixFencedBy(Delimiter open) {
        return switch (open) {
            case LEFT_PAREN -> PMATRIX;
            case LEFT_BRACKET -> BMATRIX;
            case LEFT_BRACE -> BRACE_MATRIX;
            case VERTICAL_BAR -> DETERMINANT;
            case DOUBLE_BAR -> NORM_MATRIX;
            default -> MATRIX;
        };
    }
}
