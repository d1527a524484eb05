package com.phillippitts.mathwords.service.verbalize;

import com.phillippitts.mathwords.service.style.SpeechStyle;

import java.util.Objects;

/**
 * Immutable rendering parameters threaded through every recursive verbalizer call.
 *
 * @param style active speech style
 * @param displayMode true for standalone equations, which get fuller phrasing
 */
public record VerbalizationContext(SpeechStyle style, boolean displayMode) {

    public VerbalizationContext {
        Objects.requireNonNull(style, "style");
    }
}
