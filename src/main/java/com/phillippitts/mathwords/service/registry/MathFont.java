package com.phillippitts.mathwords.service.registry;

import java.util.List;

/**
 * Letter styles applied by font commands such as {@code \mathbb} or MathML {@code mathvariant}.
 */
public enum MathFont {
    NORMAL("", "normal", List.of()),
    DOUBLE_STRUCK("double struck", "double-struck", List.of("mathbb")),
    BOLD("bold", "bold", List.of("mathbf", "boldsymbol", "bm")),
    CALLIGRAPHIC("calligraphic", "script", List.of("mathcal")),
    SCRIPT("script", "bold-script", List.of("mathscr")),
    FRAKTUR("fraktur", "fraktur", List.of("mathfrak")),
    SANS_SERIF("sans serif", "sans-serif", List.of("mathsf")),
    MONOSPACE("monospace", "monospace", List.of("mathtt")),
    ITALIC("italic", "italic", List.of("mathit"));

    private final String spoken;
    private final String mathVariant;
    private final List<String> commands;

    MathFont(String spoken, String mathVariant, List<String> commands) {
        this.spoken = spoken;
        this.mathVariant = mathVariant;
        this.commands = commands;
    }

    public String spoken() {
        return spoken;
    }

    public List<String> commands() {
        return commands;
    }

    /**
     * Maps a MathML {@code mathvariant} attribute value to a font.
     *
     * @param variant attribute value (may be null)
     * @return font, {@link #NORMAL} when absent or unrecognised
     */
    public static MathFont forMathVariant(String variant) {
        if (variant == null || variant.isBlank()) {
            return NORMAL;
        }
        for (MathFont font : values()) {
            if (font.mathVariant.equals(variant)) {
                return font;
            }
        }
        return NORMAL;
    }
}
