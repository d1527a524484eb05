package com.phillippitts.mathwords.service.health;

import com.phillippitts.mathwords.exception.MathWordsException;
import com.phillippitts.mathwords.service.MathWordsService;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health indicator that converts a fixed expression in every registered style.
 *
 * <p>Reported as {@code verbalizer} under /actuator/health (the bean name minus the
 * {@code HealthIndicator} suffix). DOWN when any style fails or returns empty text.
 */
@Component
public class VerbalizerHealthIndicator implements HealthIndicator {

    static final String SAMPLE_EXPRESSION = "\\frac{a}{b} + \\sqrt{x^2}";

    private final MathWordsService service;

    public VerbalizerHealthIndicator(MathWordsService service) {
        this.service = service;
    }

    @Override
    public Health health() {
        Map<String, String> results = new LinkedHashMap<>();
        boolean allHealthy = true;
        for (String style : service.getSpeechStyles()) {
            try {
                String text = service.verbalize(SAMPLE_EXPRESSION, false, style);
                if (text.isBlank()) {
                    allHealthy = false;
                    results.put(style, "EMPTY output");
                } else {
                    results.put(style, "ok");
                }
            } catch (MathWordsException e) {
                allHealthy = false;
                results.put(style, "FAILED: " + e.getMessage());
            }
        }

        Health.Builder builder = allHealthy ? Health.up() : Health.down();
        return builder
                .withDetail("status", allHealthy ? "All styles verbalize the sample expression"
                        : "One or more styles failed")
                .withDetail("defaultStyle", service.getDefaultStyle())
                .withDetail("styles", results)
                .build();
    }
}
