package com.phillippitts.mathwords.service.style;

import com.phillippitts.mathwords.service.registry.Operator;

import java.util.Map;
import java.util.Objects;

/**
 * Immutable bundle of phrasing rules that governs how the verbalizer words a tree.
 *
 * @param name public style name (see {@link SpeechStyleNames})
 * @param description one-line summary for clients
 * @param operatorWords per-operator replacements for {@link Operator#spoken()}
 * @param displayOperatorWords replacements that apply only in display mode
 * @param fractions how fractions are framed
 * @param commonFractions whether small integer fractions are read as "two thirds"
 * @param naturalPowers whether exponents 2 and 3 read as "squared" and "cubed"
 * @param ordinals how integer exponents and root degrees are turned into ordinals
 * @param powerTemplate phrase for a simple exponent; {@code %s} is the exponent
 * @param complexPowerTemplate phrase for a compound exponent; {@code %s} is the exponent
 * @param negativeWord word for a prefix minus sign
 * @param quantityPhrase phrase that opens an implicit grouping
 * @param explicitDelimiters whether fences are always spoken, not only in display mode
 * @param bounds how big-operator bounds are read
 */
public record SpeechStyle(
        String name,
        String description,
        Map<Operator, String> operatorWords,
        Map<Operator, String> displayOperatorWords,
        FractionPhrasing fractions,
        boolean commonFractions,
        boolean naturalPowers,
        OrdinalFormat ordinals,
        String powerTemplate,
        String complexPowerTemplate,
        String negativeWord,
        String quantityPhrase,
        boolean explicitDelimiters,
        BoundsPhrasing bounds
) {

    /** Framing of fractions whose parts are not both single numbers or letters. */
    public enum FractionPhrasing {
        /** "the fraction with numerator a plus 1 and denominator b". */
        NUMERATOR_DENOMINATOR,
        /** "fraction, a plus 1 over b, end fraction". */
        OVER_END_FRACTION,
        /** "start fraction a over b end fraction", used for every fraction. */
        START_END
    }

    /** Ordinal rendering for integer exponents and root degrees. */
    public enum OrdinalFormat {
        /** "fourth", "n-th". */
        WORDS,
        /** "4th", "n-th". */
        NUMERIC,
        /** No ordinals; exponents use the power template and roots an index phrase. */
        NONE
    }

    /** Reading of big-operator bounds. */
    public enum BoundsPhrasing {
        /** "from i equals 1 to n". */
        FROM_TO,
        /** "with lower limit i equals 1 and upper limit n". */
        LIMITS
    }

    public SpeechStyle {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(fractions, "fractions");
        Objects.requireNonNull(ordinals, "ordinals");
        Objects.requireNonNull(bounds, "bounds");
        operatorWords = Map.copyOf(operatorWords);
        displayOperatorWords = Map.copyOf(displayOperatorWords);
    }

    /**
     * Resolves the spoken word for a binary operator.
     *
     * @param op operator
     * @param displayMode whether display-mode wording applies
     * @return style override, or the operator's default reading
     */
    public String operatorWord(Operator op, boolean displayMode) {
        if (displayMode && displayOperatorWords.containsKey(op)) {
            return displayOperatorWords.get(op);
        }
        return operatorWords.getOrDefault(op, op.spoken());
    }
}
