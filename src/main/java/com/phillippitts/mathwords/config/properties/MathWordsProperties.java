package com.phillippitts.mathwords.config.properties;

import com.phillippitts.mathwords.service.style.SpeechStyleNames;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for the verbalization engine.
 */
@Validated
@ConfigurationProperties(prefix = "mathwords")
public class MathWordsProperties {

    /** Style used when a caller does not name one. Checked against the style registry at startup. */
    @NotBlank
    private final String defaultStyle;

    /** Inputs longer than this many characters are rejected before lexing. */
    @Min(1)
    private final int maxExpressionLength;

    private final Batch batch;

    @ConstructorBinding
    public MathWordsProperties(String defaultStyle, Integer maxExpressionLength, Batch batch) {
        this.defaultStyle = defaultStyle == null ? SpeechStyleNames.CLEAR_SPEAK : defaultStyle;
        this.maxExpressionLength = maxExpressionLength == null ? 20_000 : maxExpressionLength;
        this.batch = batch == null ? new Batch(null, null) : batch;
    }

    /**
     * Defaults for tests and programmatic use.
     */
    public MathWordsProperties() {
        this(null, null, null);
    }

    public String getDefaultStyle() {
        return defaultStyle;
    }

    public int getMaxExpressionLength() {
        return maxExpressionLength;
    }

    public Batch getBatch() {
        return batch;
    }

    /**
     * Batch conversion settings.
     */
    public static class Batch {

        private final boolean parallelEnabled;

        /** Batches with at least this many items run on the verbalizer executor. */
        @Min(1)
        private final int parallelThreshold;

        public Batch(Boolean parallelEnabled, Integer parallelThreshold) {
            this.parallelEnabled = parallelEnabled == null || parallelEnabled;
            this.parallelThreshold = parallelThreshold == null ? 8 : parallelThreshold;
        }

        public boolean isParallelEnabled() {
            return parallelEnabled;
        }

        public int getParallelThreshold() {
            return parallelThreshold;
        }
    }
}
