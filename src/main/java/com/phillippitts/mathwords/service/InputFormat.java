package com.phillippitts.mathwords.service;

import java.util.Locale;

/**
 * Markup language of an input expression.
 */
public enum InputFormat {
    LATEX,
    MATHML;

    /** Lower-case tag value used in metrics. */
    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
