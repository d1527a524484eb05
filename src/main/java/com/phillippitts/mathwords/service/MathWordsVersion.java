package com.phillippitts.mathwords.service;

/**
 * Library version reported by the API.
 */
public final class MathWordsVersion {

    public static final String VERSION = "1.0.0";

    private MathWordsVersion() {
        // Utility class - prevent instantiation
    }
}
