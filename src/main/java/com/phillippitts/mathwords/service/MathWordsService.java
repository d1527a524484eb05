package com.phillippitts.mathwords.service;

import com.phillippitts.mathwords.config.properties.MathWordsProperties;
import com.phillippitts.mathwords.domain.tree.MathNode;
import com.phillippitts.mathwords.exception.EmptyBatchException;
import com.phillippitts.mathwords.exception.EmptyInputException;
import com.phillippitts.mathwords.exception.ExpressionTooLongException;
import com.phillippitts.mathwords.exception.LexException;
import com.phillippitts.mathwords.exception.MathWordsException;
import com.phillippitts.mathwords.exception.ParseException;
import com.phillippitts.mathwords.exception.UnknownStyleException;
import com.phillippitts.mathwords.service.latex.LatexParser;
import com.phillippitts.mathwords.service.mathml.MathMlReader;
import com.phillippitts.mathwords.service.metrics.VerbalizationMetrics;
import com.phillippitts.mathwords.service.style.SpeechStyle;
import com.phillippitts.mathwords.service.style.SpeechStyleRegistry;
import com.phillippitts.mathwords.service.verbalize.Verbalizer;
import com.phillippitts.mathwords.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Public entry point: converts LaTeX or MathML expressions to English speech text.
 *
 * <p>Every call is independent. The command and style registries are read-only after startup,
 * so the service is safe for concurrent use without synchronization.
 *
 * <p><b>Batch semantics:</b> fail-fast. The first failing item in input order aborts the call
 * and its own exception is rethrown unchanged. Large batches are converted on the
 * {@code verbalizerExecutor}; results and errors are still reported in input order.
 */
@Service
public class MathWordsService {

    private static final Logger LOG = LogManager.getLogger(MathWordsService.class);

    private final LatexParser latexParser;
    private final MathMlReader mathMlReader;
    private final Verbalizer verbalizer;
    private final SpeechStyleRegistry styles;
    private final ExpressionValidator validator;
    private final VerbalizationMetrics metrics;
    private final Executor executor;
    private final MathWordsProperties.Batch batchProps;
    private final String defaultStyle;

    /**
     * Wires the engine components.
     *
     * @throws UnknownStyleException if {@code mathwords.default-style} names an unregistered style
     */
    public MathWordsService(LatexParser latexParser,
                            MathMlReader mathMlReader,
                            Verbalizer verbalizer,
                            SpeechStyleRegistry styles,
                            ExpressionValidator validator,
                            VerbalizationMetrics metrics,
                            @Qualifier("verbalizerExecutor") Executor executor,
                            MathWordsProperties properties) {
        this.latexParser = Objects.requireNonNull(latexParser);
        this.mathMlReader = Objects.requireNonNull(mathMlReader);
        this.verbalizer = Objects.requireNonNull(verbalizer);
        this.styles = Objects.requireNonNull(styles);
        this.validator = Objects.requireNonNull(validator);
        this.metrics = Objects.requireNonNull(metrics);
        this.executor = Objects.requireNonNull(executor);
        this.batchProps = properties.getBatch();
        this.defaultStyle = styles.require(properties.getDefaultStyle()).name();
        LOG.info("Math verbalizer ready: default style {}, styles {}", defaultStyle, styles.names());
    }

    /**
     * Verbalizes an inline LaTeX expression in the default style.
     */
    public String verbalize(String expression) {
        return verbalize(expression, false);
    }

    public String verbalize(String expression, boolean displayMode) {
        return verbalize(expression, displayMode, defaultStyle);
    }

    /**
     * Verbalizes a LaTeX expression.
     *
     * @param expression LaTeX math source without {@code $} delimiters
     * @param displayMode true for display equations
     * @param speechStyle registered style name, or null for the default
     * @return English text
     * @throws EmptyInputException if the expression is empty or whitespace
     * @throws UnknownStyleException if the style is not registered
     * @throws LexException if the source contains characters that cannot be tokenized
     * @throws ParseException if the source does not form a supported expression
     */
    public String verbalize(String expression, boolean displayMode, String speechStyle) {
        return verbalize(expression, InputFormat.LATEX, displayMode, speechStyle);
    }

    /**
     * Verbalizes an expression in the given input format.
     *
     * @param input LaTeX source or a MathML document
     * @param format input format, null meaning LaTeX
     * @param displayMode true for display equations
     * @param speechStyle registered style name, or null for the default
     * @return English text
     */
    public String verbalize(String input, InputFormat format, boolean displayMode, String speechStyle) {
        InputFormat effectiveFormat = format == null ? InputFormat.LATEX : format;
        String styleName = speechStyle == null ? defaultStyle : speechStyle;
        long t0 = System.nanoTime();
        try {
            validator.validate(input);
            SpeechStyle style = styles.require(styleName);
            MathNode tree = effectiveFormat == InputFormat.MATHML
                    ? mathMlReader.read(input)
                    : latexParser.parse(input);
            String text = verbalizer.verbalize(tree, style, displayMode);
            metrics.incrementSuccess(style.name());
            metrics.recordLatency(style.name(), effectiveFormat.tag(), System.nanoTime() - t0);
            LOG.debug("Verbalized [{}] as {} ({} chars out)", LogSanitizer.preview(input), style.name(), text.length());
            return text;
        } catch (MathWordsException e) {
            metrics.incrementFailure(styles.find(styleName).isPresent() ? styleName : "unknown", failureReason(e));
            LOG.warn("Verbalization failed for [{}]: {}", LogSanitizer.preview(input), e.getMessage());
            throw e;
        }
    }

    /**
     * Verbalizes a batch in the default style.
     *
     * @see #verbalizeBatch(List, String)
     */
    public List<String> verbalizeBatch(List<BatchItem> items) {
        return verbalizeBatch(items, defaultStyle);
    }

    /**
     * Verbalizes every item with one style and returns the results in input order.
     *
     * @param items expressions with optional display flag and format
     * @param speechStyle registered style name, or null for the default
     * @return one text per item, in input order
     * @throws EmptyBatchException if {@code items} is null or empty
     * @throws UnknownStyleException if the style is not registered
     * @throws MathWordsException the error of the first failing item in input order
     */
    public List<String> verbalizeBatch(List<BatchItem> items, String speechStyle) {
        if (items == null || items.isEmpty()) {
            throw new EmptyBatchException();
        }
        String styleName = styles.require(speechStyle == null ? defaultStyle : speechStyle).name();
        boolean parallel = batchProps.isParallelEnabled() && items.size() >= batchProps.getParallelThreshold();
        metrics.recordBatch(items.size(), parallel);
        LOG.debug("Verbalizing batch of {} items in {} ({})", items.size(), styleName,
                parallel ? "parallel" : "sequential");
        return parallel ? runParallel(items, styleName) : runSequential(items, styleName);
    }

    /**
     * @return registered style names in stable order
     */
    public List<String> getSpeechStyles() {
        return styles.names();
    }

    public String getDefaultStyle() {
        return defaultStyle;
    }

    private List<String> runSequential(List<BatchItem> items, String styleName) {
        List<String> results = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            results.add(convertItem(items.get(i), i, styleName));
        }
        return results;
    }

    private List<String> runParallel(List<BatchItem> items, String styleName) {
        List<CompletableFuture<String>> futures = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            final int index = i;
            futures.add(CompletableFuture.supplyAsync(() -> convertItem(items.get(index), index, styleName), executor));
        }
        List<String> results = new ArrayList<>(items.size());
        for (int i = 0; i < futures.size(); i++) {
            try {
                results.add(futures.get(i).join());
            } catch (CompletionException e) {
                futures.subList(i + 1, futures.size()).forEach(f -> f.cancel(false));
                throw unwrap(e);
            }
        }
        return results;
    }

    private String convertItem(BatchItem item, int index, String styleName) {
        if (item == null) {
            LOG.warn("Batch item {} is null", index);
            throw new EmptyInputException("Batch item " + index + " is null");
        }
        try {
            return verbalize(item.expression(), item.formatOrDefault(), item.isDisplayMode(), styleName);
        } catch (MathWordsException e) {
            LOG.warn("Batch aborted at item {}: {}", index, e.getMessage());
            throw e;
        }
    }

    private static RuntimeException unwrap(CompletionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return e;
    }

    private static String failureReason(MathWordsException e) {
        if (e instanceof ParseException parse) {
            return parse.getKind().name();
        }
        if (e instanceof LexException) {
            return "LEX_ERROR";
        }
        if (e instanceof EmptyInputException) {
            return "EMPTY_INPUT";
        }
        if (e instanceof ExpressionTooLongException) {
            return "TOO_LONG";
        }
        if (e instanceof UnknownStyleException) {
            return "UNKNOWN_STYLE";
        }
        return e.getClass().getSimpleName();
    }
}
