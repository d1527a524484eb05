package com.phillippitts.mathwords.service;

import com.phillippitts.mathwords.config.properties.MathWordsProperties;
import com.phillippitts.mathwords.exception.EmptyBatchException;
import com.phillippitts.mathwords.exception.EmptyInputException;
import com.phillippitts.mathwords.exception.ExpressionTooLongException;
import com.phillippitts.mathwords.exception.ParseErrorKind;
import com.phillippitts.mathwords.exception.ParseException;
import com.phillippitts.mathwords.exception.UnknownStyleException;
import com.phillippitts.mathwords.service.latex.LatexLexer;
import com.phillippitts.mathwords.service.latex.LatexParser;
import com.phillippitts.mathwords.service.mathml.MathMlReader;
import com.phillippitts.mathwords.service.metrics.VerbalizationMetrics;
import com.phillippitts.mathwords.service.registry.CommandRegistry;
import com.phillippitts.mathwords.service.style.SpeechStyleNames;
import com.phillippitts.mathwords.service.style.SpeechStyleRegistry;
import com.phillippitts.mathwords.service.verbalize.Verbalizer;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MathWordsServiceTest {

    private MeterRegistry meterRegistry;
    private ExecutorService executor;
    private MathWordsService service;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        executor = Executors.newFixedThreadPool(4);
        service = newService(new MathWordsProperties(null, null, new MathWordsProperties.Batch(true, 4)));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private MathWordsService newService(MathWordsProperties props) {
        CommandRegistry registry = new CommandRegistry();
        return new MathWordsService(
                new LatexParser(registry, new LatexLexer()),
                new MathMlReader(registry),
                new Verbalizer(registry),
                new SpeechStyleRegistry(),
                new ExpressionValidator(props),
                new VerbalizationMetrics(meterRegistry),
                executor,
                props);
    }

    @Test
    void fractionShouldMentionNumeratorAndDenominator() {
        String text = service.verbalize("\\frac{a}{b}");

        assertThat(text).contains("a").contains("b");
    }

    @Test
    void squareRootShouldMentionRootAndRadicand() {
        String text = service.verbalize("\\sqrt{2}");

        assertThat(text).contains("root").contains("2");
    }

    @Test
    void shouldUseDefaultStyleWhenNoneGiven() {
        assertThat(service.getDefaultStyle()).isEqualTo(SpeechStyleNames.CLEAR_SPEAK);
        assertThat(service.verbalize("x^2", false, null))
                .isEqualTo(service.verbalize("x^2", false, SpeechStyleNames.CLEAR_SPEAK));
    }

    @Test
    void displayModeShouldChangeWording() {
        assertThat(service.verbalize("a = b", true)).isEqualTo("a is equal to b");
        assertThat(service.verbalize("a = b", false)).isEqualTo("a equals b");
    }

    @Test
    void shouldRejectEmptyInput() {
        assertThatThrownBy(() -> service.verbalize("")).isInstanceOf(EmptyInputException.class);
        assertThatThrownBy(() -> service.verbalize("   \n ")).isInstanceOf(EmptyInputException.class);
        assertThatThrownBy(() -> service.verbalize(null)).isInstanceOf(EmptyInputException.class);
    }

    @Test
    void emptyInputShouldWinOverUnknownStyle() {
        assertThatThrownBy(() -> service.verbalize("", false, "NoSuchStyle"))
                .isInstanceOf(EmptyInputException.class);
    }

    @Test
    void shouldRejectUnknownStyle() {
        assertThatThrownBy(() -> service.verbalize("x", false, "NoSuchStyle"))
                .isInstanceOf(UnknownStyleException.class)
                .hasMessageContaining("NoSuchStyle");
    }

    @Test
    void undefinedMacroShouldFailWithUnknownCommand() {
        assertThatThrownBy(() -> service.verbalize("\\dmodel"))
                .isInstanceOf(ParseException.class)
                .satisfies(e -> assertThat(((ParseException) e).getKind()).isEqualTo(ParseErrorKind.UNKNOWN_COMMAND));
    }

    @Test
    void textSubscriptShouldSucceed() {
        assertThat(service.verbalize("d_{\\text{model}}")).isNotBlank().contains("model");
    }

    @Test
    void unexpandedMacroInFullExpressionShouldFailWithUnknownCommand() {
        assertThatThrownBy(() -> service.verbalize("W^Q \\in \\mathbb{R}^{\\dmodel \\times d_k}"))
                .isInstanceOf(ParseException.class)
                .satisfies(e -> {
                    ParseException pe = (ParseException) e;
                    assertThat(pe.getKind()).isEqualTo(ParseErrorKind.UNKNOWN_COMMAND);
                    assertThat(pe.getCommand()).isEqualTo("dmodel");
                });
    }

    @Test
    void expandedMacroInFullExpressionShouldSucceed() {
        String text = service.verbalize("W^Q \\in \\mathbb{R}^{d_{\\text{model}} \\times d_k}");

        assertThat(text).isNotBlank().contains("model");
    }

    @Test
    void inputWithNothingToSpeakShouldFailInEveryStyleAndMode() {
        for (String expr : List.of("{}", "\\text{ }", "\\mathrm{}", "\\begin{pmatrix}\\end{pmatrix}")) {
            for (String style : service.getSpeechStyles()) {
                for (boolean display : new boolean[] {false, true}) {
                    assertThatThrownBy(() -> service.verbalize(expr, display, style))
                            .as("%s in %s, display=%s", expr, style, display)
                            .isInstanceOf(ParseException.class)
                            .satisfies(e -> assertThat(((ParseException) e).getKind())
                                    .isEqualTo(ParseErrorKind.EMPTY_INPUT));
                }
            }
        }
    }

    @Test
    void deeplyNestedCommandsShouldFailWithParseException() {
        assertThatThrownBy(() -> service.verbalize("\\sqrt".repeat(3990) + "x"))
                .isInstanceOf(ParseException.class);
        assertThatThrownBy(() -> service.verbalize("x" + " + x".repeat(1200)))
                .isInstanceOf(ParseException.class);
    }

    @Test
    void displayMatrixShouldReadEveryEntryWithRowAndColumnMarkers() {
        String text = service.verbalize("\\begin{pmatrix} a & b \\\\ c & d \\end{pmatrix}", true);

        assertThat(text).contains("row one, column one, a, column two, b")
                .contains("row two, column one, c, column two, d");
    }

    @Test
    void shouldRejectOverlongInput() {
        MathWordsService strict = newService(new MathWordsProperties(null, 10, null));

        assertThatThrownBy(() -> strict.verbalize("x + y + z + w"))
                .isInstanceOf(ExpressionTooLongException.class);
    }

    @Test
    void constructorShouldRejectUnknownDefaultStyle() {
        assertThatThrownBy(() -> newService(new MathWordsProperties("Shouting", null, null)))
                .isInstanceOf(UnknownStyleException.class);
    }

    @Test
    void mathMlShouldReadLikeEquivalentLatex() {
        String mathMl = "<math><mi>a</mi><mo>+</mo><mi>b</mi><mo>⋅</mo><mi>c</mi></math>";

        assertThat(service.verbalize(mathMl, InputFormat.MATHML, false, null))
                .isEqualTo(service.verbalize("a + b \\cdot c"));
    }

    @Test
    void stylesShouldBeNonEmptyAndStable() {
        List<String> first = service.getSpeechStyles();

        assertThat(first).isNotEmpty().contains(service.getDefaultStyle());
        assertThat(service.getSpeechStyles()).isEqualTo(first);
    }

    @Test
    void everyStyleShouldVerbalizeCommonExpressions() {
        for (String style : service.getSpeechStyles()) {
            assertThat(service.verbalize("\\sum_{i=1}^{n} i^2", true, style)).isNotBlank();
            assertThat(service.verbalize("\\frac{-b \\pm \\sqrt{b^2 - 4ac}}{2a}", false, style)).isNotBlank();
        }
    }

    @Test
    void batchShouldRejectEmptyList() {
        assertThatThrownBy(() -> service.verbalizeBatch(List.of())).isInstanceOf(EmptyBatchException.class);
        assertThatThrownBy(() -> service.verbalizeBatch(null)).isInstanceOf(EmptyBatchException.class);
    }

    @Test
    void batchShouldMatchIndividualCallsSequentially() {
        List<BatchItem> items = List.of(BatchItem.of("x^2"), BatchItem.of("a = b", true));

        assertThat(service.verbalizeBatch(items))
                .containsExactly(service.verbalize("x^2"), service.verbalize("a = b", true));
    }

    @Test
    void batchShouldMatchIndividualCallsInParallel() {
        List<BatchItem> items = new ArrayList<>();
        List<String> expected = new ArrayList<>();
        for (int i = 1; i <= 20; i++) {
            String expr = "x^{" + i + "} + \\frac{" + i + "}{y}";
            items.add(BatchItem.of(expr));
            expected.add(service.verbalize(expr, false, SpeechStyleNames.SIMPLE_SPEAK));
        }

        assertThat(service.verbalizeBatch(items, SpeechStyleNames.SIMPLE_SPEAK)).isEqualTo(expected);
        Counter parallel = meterRegistry.find("mathwords.verbalization.batch.items").tag("mode", "parallel").counter();
        assertThat(parallel).isNotNull();
        assertThat(parallel.count()).isEqualTo(20.0);
    }

    @Test
    void batchShouldReportFirstFailureInInputOrder() {
        List<BatchItem> items = List.of(
                BatchItem.of("x"), BatchItem.of("\\dmodel"), BatchItem.of("y"), BatchItem.of("{x"), BatchItem.of("z"));

        assertThatThrownBy(() -> service.verbalizeBatch(items))
                .isInstanceOf(ParseException.class)
                .satisfies(e -> assertThat(((ParseException) e).getKind()).isEqualTo(ParseErrorKind.UNKNOWN_COMMAND));
    }

    @Test
    void batchShouldRejectNullAndBlankItems() {
        List<BatchItem> withNull = new ArrayList<>();
        withNull.add(BatchItem.of("x"));
        withNull.add(null);

        assertThatThrownBy(() -> service.verbalizeBatch(withNull)).isInstanceOf(EmptyInputException.class);
        assertThatThrownBy(() -> service.verbalizeBatch(List.of(BatchItem.of(" "))))
                .isInstanceOf(EmptyInputException.class);
    }

    @Test
    void batchShouldRejectUnknownStyleBeforeConverting() {
        assertThatThrownBy(() -> service.verbalizeBatch(List.of(BatchItem.of("x")), "NoSuchStyle"))
                .isInstanceOf(UnknownStyleException.class);
    }

    @Test
    void shouldCountSuccessAndFailure() {
        service.verbalize("x + 1");
        assertThatThrownBy(() -> service.verbalize("\\dmodel")).isInstanceOf(ParseException.class);

        Counter success = meterRegistry.find("mathwords.verbalization.success")
                .tag("style", SpeechStyleNames.CLEAR_SPEAK).counter();
        Counter failure = meterRegistry.find("mathwords.verbalization.failure")
                .tag("reason", "UNKNOWN_COMMAND").counter();
        assertThat(success).isNotNull();
        assertThat(success.count()).isEqualTo(1.0);
        assertThat(failure).isNotNull();
        assertThat(failure.count()).isEqualTo(1.0);
    }

    @Test
    void versionShouldBeSemantic() {
        assertThat(MathWordsVersion.VERSION).matches("\\d+\\.\\d+\\.\\d+");
    }
}
