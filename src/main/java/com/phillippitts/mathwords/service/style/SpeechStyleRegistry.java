package com.phillippitts.mathwords.service.style;

import com.phillippitts.mathwords.exception.UnknownStyleException;
import com.phillippitts.mathwords.service.registry.Operator;
import com.phillippitts.mathwords.service.style.SpeechStyle.BoundsPhrasing;
import com.phillippitts.mathwords.service.style.SpeechStyle.FractionPhrasing;
import com.phillippitts.mathwords.service.style.SpeechStyle.OrdinalFormat;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Process-wide, read-only catalogue of speech styles.
 *
 * <p>Styles are built once in the constructor and never change, so concurrent lookups need no
 * synchronization. Names are matched exactly; there is no fallback for an unknown name.
 */
@Component
public class SpeechStyleRegistry {

    private final Map<String, SpeechStyle> styles;
    private final List<String> names;

    public SpeechStyleRegistry() {
        Map<String, SpeechStyle> byName = new LinkedHashMap<>();
        register(byName, clearSpeak());
        register(byName, simpleSpeak());
        register(byName, literalSpeak());
        this.styles = Map.copyOf(byName);
        this.names = List.copyOf(byName.keySet());
    }

    private static void register(Map<String, SpeechStyle> byName, SpeechStyle style) {
        byName.put(style.name(), style);
    }

    private static SpeechStyle clearSpeak() {
        return new SpeechStyle(
                SpeechStyleNames.CLEAR_SPEAK,
                "Verbose reading with explicit structure words",
                Map.of(),
                Map.of(Operator.EQUALS, "is equal to"),
                FractionPhrasing.NUMERATOR_DENOMINATOR,
                true,
                true,
                OrdinalFormat.WORDS,
                "to the power of %s",
                "to the power of %s, end exponent",
                "negative",
                "the quantity",
                false,
                BoundsPhrasing.FROM_TO);
    }

    private static SpeechStyle simpleSpeak() {
        return new SpeechStyle(
                SpeechStyleNames.SIMPLE_SPEAK,
                "Terse reading with end markers",
                Map.of(Operator.DOT, "times", Operator.NOT_EQUALS, "not equals",
                        Operator.LESS_EQUAL, "is less than or equal to",
                        Operator.GREATER_EQUAL, "is greater than or equal to"),
                Map.of(),
                FractionPhrasing.OVER_END_FRACTION,
                true,
                true,
                OrdinalFormat.NUMERIC,
                "to the %s power",
                "raised to the %s power, end exponent",
                "negative",
                "the quantity",
                false,
                BoundsPhrasing.FROM_TO);
    }

    private static SpeechStyle literalSpeak() {
        return new SpeechStyle(
                SpeechStyleNames.LITERAL_SPEAK,
                "Symbol-by-symbol reading with spoken delimiters",
                Map.of(Operator.LESS, "less than", Operator.GREATER, "greater than",
                        Operator.LESS_EQUAL, "less than or equal to",
                        Operator.GREATER_EQUAL, "greater than or equal to",
                        Operator.ELEMENT_OF, "in", Operator.DIVIDED_BY, "slash",
                        Operator.NOT_EQUALS, "not equal to"),
                Map.of(),
                FractionPhrasing.START_END,
                false,
                false,
                OrdinalFormat.NONE,
                "superscript %s",
                "superscript %s, end superscript",
                "minus",
                "the quantity",
                true,
                BoundsPhrasing.LIMITS);
    }

    /**
     * @return style names in registration order; identical across calls
     */
    public List<String> names() {
        return names;
    }

    public Optional<SpeechStyle> find(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(styles.get(name));
    }

    /**
     * @param name style name
     * @return the style
     * @throws UnknownStyleException if no style is registered under {@code name}
     */
    public SpeechStyle require(String name) {
        return find(name).orElseThrow(() -> new UnknownStyleException(name));
    }
}
