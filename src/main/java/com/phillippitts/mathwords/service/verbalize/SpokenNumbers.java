package com.phillippitts.mathwords.service.verbalize;

/**
 * Number words used for ordinals, row labels and common fractions.
 */
final class SpokenNumbers {

    private static final String[] CARDINALS = {
        "zero", "one", "two", "three", "four", "five", "six", "seven", "eight", "nine", "ten",
        "eleven", "twelve", "thirteen", "fourteen", "fifteen", "sixteen", "seventeen", "eighteen",
        "nineteen", "twenty"
    };

    private static final String[] ORDINALS = {
        "zeroth", "first", "second", "third", "fourth", "fifth", "sixth", "seventh", "eighth", "ninth",
        "tenth", "eleventh", "twelfth", "thirteenth", "fourteenth", "fifteenth", "sixteenth",
        "seventeenth", "eighteenth", "nineteenth", "twentieth"
    };

    private SpokenNumbers() {
        // Utility class - prevent instantiation
    }

    /** "one", "two", ... up to twenty, digits beyond. */
    static String cardinal(int n) {
        return n >= 0 && n < CARDINALS.length ? CARDINALS[n] : Integer.toString(n);
    }

    /** "first", "fourth", ... up to twentieth, numeric ordinals beyond. */
    static String ordinalWord(int n) {
        return n >= 0 && n < ORDINALS.length ? ORDINALS[n] : numericOrdinal(n);
    }

    /** "1st", "2nd", "3rd", "4th", "11th", "21st". */
    static String numericOrdinal(int n) {
        int lastTwo = n % 100;
        if (lastTwo >= 11 && lastTwo <= 13) {
            return n + "th";
        }
        switch (n % 10) {
            case 1:
                return n + "st";
            case 2:
                return n + "nd";
            case 3:
                return n + "rd";
            default:
                return n + "th";
        }
    }

    /**
     * Denominator word of a common fraction: "half"/"halves", "third"/"thirds", "fourth"/"fourths".
     *
     * @param denominator 2 to 10
     * @param plural whether the numerator is greater than one
     */
    static String fractionDenominator(int denominator, boolean plural) {
        if (denominator == 2) {
            return plural ? "halves" : "half";
        }
        String ordinal = ordinalWord(denominator);
        return plural ? ordinal + "s" : ordinal;
    }

    /**
     * @return the integer value of a plain digit string, or -1 when it is not a small integer
     */
    static int smallInteger(String literal) {
        if (literal.isEmpty() || literal.length() > 6 || !literal.chars().allMatch(Character::isDigit)) {
            return -1;
        }
        return Integer.parseInt(literal);
    }
}
