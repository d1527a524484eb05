package com.phillippitts.mathwords.service.style;

/**
 * Centralized constants for the registered speech style names.
 *
 * <p>Names are case-sensitive and are the values accepted by the public API and the REST
 * surface. {@link SpeechStyleRegistry#names()} returns them in this order.
 *
 * @since 1.0
 */
public final class SpeechStyleNames {

    /**
     * Verbose style with explicit structure words ("the fraction with numerator ... and denominator ...").
     * This is the default style.
     */
    public static final String CLEAR_SPEAK = "ClearSpeak";

    /**
     * Terser style that favours short phrases and end markers ("fraction, a over b, end fraction").
     */
    public static final String SIMPLE_SPEAK = "SimpleSpeak";

    /**
     * Symbol-by-symbol reading that always speaks delimiters and avoids natural-language shortcuts.
     */
    public static final String LITERAL_SPEAK = "LiteralSpeak";

    private SpeechStyleNames() {
        // Utility class - prevent instantiation
    }
}
