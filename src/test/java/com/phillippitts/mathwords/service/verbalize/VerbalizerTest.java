package com.phillippitts.mathwords.service.verbalize;

import com.phillippitts.mathwords.domain.tree.MathNode;
import com.phillippitts.mathwords.domain.tree.MathNode.BinaryOp;
import com.phillippitts.mathwords.domain.tree.MathNode.Empty;
import com.phillippitts.mathwords.domain.tree.MathNode.Group;
import com.phillippitts.mathwords.domain.tree.MathNode.Identifier;
import com.phillippitts.mathwords.domain.tree.MathNode.Unsupported;
import com.phillippitts.mathwords.exception.ParseErrorKind;
import com.phillippitts.mathwords.exception.ParseException;
import com.phillippitts.mathwords.service.latex.LatexLexer;
import com.phillippitts.mathwords.service.latex.LatexParser;
import com.phillippitts.mathwords.service.registry.CommandRegistry;
import com.phillippitts.mathwords.service.registry.Operator;
import com.phillippitts.mathwords.service.style.SpeechStyleNames;
import com.phillippitts.mathwords.service.style.SpeechStyleRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VerbalizerTest {

    private LatexParser parser;
    private Verbalizer verbalizer;
    private SpeechStyleRegistry styles;

    @BeforeEach
    void setUp() {
        CommandRegistry registry = new CommandRegistry();
        parser = new LatexParser(registry, new LatexLexer());
        verbalizer = new Verbalizer(registry);
        styles = new SpeechStyleRegistry();
    }

    private String speak(String latex) {
        return speak(latex, SpeechStyleNames.CLEAR_SPEAK, false);
    }

    private String speak(String latex, String style, boolean displayMode) {
        return verbalizer.verbalize(parser.parse(latex), styles.require(style), displayMode);
    }

    @Test
    void shouldReadArithmetic() {
        assertThat(speak("x + 1")).isEqualTo("x plus 1");
        assertThat(speak("\\alpha - \\beta")).isEqualTo("alpha minus beta");
        assertThat(speak("2x")).isEqualTo("2 x");
    }

    @Test
    void shouldSwitchEqualsWordingInDisplayMode() {
        assertThat(speak("a = b")).isEqualTo("a equals b");
        assertThat(speak("a = b", SpeechStyleNames.CLEAR_SPEAK, true)).isEqualTo("a is equal to b");
    }

    @Test
    void shouldReadSimpleAndCommonFractions() {
        assertThat(speak("\\frac{a}{b}")).isEqualTo("a over b");
        assertThat(speak("\\frac{1}{2}")).isEqualTo("one half");
        assertThat(speak("\\frac{3}{4}")).isEqualTo("three fourths");
        assertThat(speak("2\\frac{1}{2}")).isEqualTo("2 and one half");
    }

    @Test
    void shouldFrameCompoundFractionsPerStyle() {
        assertThat(speak("\\frac{a+1}{b}"))
                .isEqualTo("the fraction with numerator a plus 1 and denominator b");
        assertThat(speak("\\frac{a+1}{b}", SpeechStyleNames.SIMPLE_SPEAK, false))
                .isEqualTo("fraction, a plus 1 over b, end fraction");
        assertThat(speak("\\frac{a}{b}", SpeechStyleNames.LITERAL_SPEAK, false))
                .isEqualTo("start fraction a over b end fraction");
    }

    @Test
    void shouldReadRoots() {
        assertThat(speak("\\sqrt{2}")).isEqualTo("the square root of 2");
        assertThat(speak("\\sqrt[3]{x}")).isEqualTo("the cube root of x");
        assertThat(speak("\\sqrt[n]{x}")).isEqualTo("the n-th root of x");
        assertThat(speak("\\sqrt{x+1}")).isEqualTo("the square root of x plus 1, end root");
    }

    @Test
    void shouldReadPowersPerStyle() {
        assertThat(speak("x^2")).isEqualTo("x squared");
        assertThat(speak("x^3")).isEqualTo("x cubed");
        assertThat(speak("x^4")).isEqualTo("x to the fourth power");
        assertThat(speak("x^4", SpeechStyleNames.SIMPLE_SPEAK, false)).isEqualTo("x to the 4th power");
        assertThat(speak("x^2", SpeechStyleNames.LITERAL_SPEAK, false)).isEqualTo("x superscript 2");
        assertThat(speak("x^{n+1}")).isEqualTo("x to the power of n plus 1, end exponent");
    }

    @Test
    void shouldReadExponentMarksAsWords() {
        assertThat(speak("90^\\circ")).isEqualTo("90 degrees");
        assertThat(speak("A^\\top")).isEqualTo("A transpose");
    }

    @Test
    void shouldSpeakImplicitGrouping() {
        assertThat(speak("(a+b)^2")).isEqualTo("the quantity a plus b, squared");
        assertThat(speak("2(x+1)")).isEqualTo("2 times the quantity x plus 1");
    }

    @Test
    void shouldReadSubscripts() {
        assertThat(speak("x_i")).isEqualTo("x sub i");
        assertThat(speak("x_{i+1}")).isEqualTo("x sub i plus 1, end subscript");
        assertThat(speak("d_{\\text{model}}")).isEqualTo("d sub model");
    }

    @Test
    void shouldReadFunctions() {
        assertThat(speak("\\sin x")).isEqualTo("the sine of x");
        assertThat(speak("\\sin^2 x")).isEqualTo("the sine squared of x");
        assertThat(speak("\\sin^{-1} x")).isEqualTo("the inverse sine of x");
        assertThat(speak("\\log_2 x")).isEqualTo("the log base 2 of x");
        assertThat(speak("f(x)")).isEqualTo("f of x");
        assertThat(speak("\\binom{n}{k}")).isEqualTo("n choose k");
    }

    @Test
    void shouldReadBigOperators() {
        assertThat(speak("\\sum_{i=1}^{n} i")).isEqualTo("sum from i equals 1 to n of i");
        assertThat(speak("\\sum_{i=1}^{n} i", SpeechStyleNames.CLEAR_SPEAK, true))
                .isEqualTo("the sum from i equals 1 to n of i");
        assertThat(speak("\\sum_{i=1}^{n} i", SpeechStyleNames.LITERAL_SPEAK, false))
                .isEqualTo("sum with lower limit i equals 1 and upper limit n of i");
        assertThat(speak("\\int_0^1 x\\,dx")).isEqualTo("integral from 0 to 1 of x d x");
    }

    @Test
    void shouldKeepInlineWordingInBoundsOfDisplayEquations() {
        assertThat(speak("\\sum_{i=1}^{n} i = S", SpeechStyleNames.CLEAR_SPEAK, true))
                .isEqualTo("the sum from i equals 1 to n of i is equal to S");
    }

    @Test
    void shouldReadLimits() {
        assertThat(speak("\\lim_{x \\to 0} f(x)")).isEqualTo("limit as x approaches 0 of f of x");
    }

    @Test
    void shouldReadSemanticFences() {
        assertThat(speak("|x|")).isEqualTo("the absolute value of x");
        assertThat(speak("\\{x \\mid x > 0\\}")).isEqualTo("the set of all x such that x is greater than 0");
        assertThat(speak("[0, 1)")).isEqualTo("the interval from 0 to 1, including 0 and not including 1");
    }

    @Test
    void shouldSpeakParenthesesWhenExplicit() {
        assertThat(speak("(a+b)", SpeechStyleNames.LITERAL_SPEAK, false))
                .isEqualTo("open paren a plus b close paren");
        assertThat(speak("(a+b)", SpeechStyleNames.CLEAR_SPEAK, true))
                .isEqualTo("open paren a plus b close paren");
        assertThat(speak("(a+b)")).isEqualTo("a plus b");
    }

    @Test
    void shouldReadPrefixAndPostfixOperators() {
        assertThat(speak("-x")).isEqualTo("negative x");
        assertThat(speak("-x", SpeechStyleNames.LITERAL_SPEAK, false)).isEqualTo("minus x");
        assertThat(speak("n!")).isEqualTo("n factorial");
        assertThat(speak("\\hat{x}")).isEqualTo("x hat");
        assertThat(speak("\\vec{v}")).isEqualTo("vector v");
    }

    @Test
    void shouldApplyStyleOperatorWords() {
        assertThat(speak("x \\cdot y")).isEqualTo("x dot y");
        assertThat(speak("x \\cdot y", SpeechStyleNames.SIMPLE_SPEAK, false)).isEqualTo("x times y");
    }

    @Test
    void shouldReadNumberSetsAndLogic() {
        assertThat(speak("x \\in \\mathbb{R}")).isEqualTo("x is an element of the real numbers");
        assertThat(speak("x > 0 \\land y > 0")).isEqualTo("x is greater than 0 and y is greater than 0");
    }

    @Test
    void shouldReadListsAndMatrices() {
        assertThat(speak("a, b, c")).isEqualTo("a comma b comma c");
        assertThat(speak("\\begin{pmatrix} 1 & 2 \\\\ 3 & 4 \\end{pmatrix}"))
                .isEqualTo("the two by two matrix with rows: row one, 1 comma 2; row two, 3 comma 4; end matrix");
    }

    @Test
    void shouldMarkRowsAndColumnsInDisplayMatrix() {
        String text = speak("\\begin{pmatrix} a & b \\\\ c & d \\end{pmatrix}", SpeechStyleNames.CLEAR_SPEAK, true);

        assertThat(text).isEqualTo("the two by two matrix with rows: row one, column one, a, column two, b; "
                + "row two, column one, c, column two, d; end matrix");
        assertThat(text).contains("row one").contains("row two").contains("column one").contains("column two");
    }

    @Test
    void shouldReadPiecewiseDefinitions() {
        String text = speak("f(x) = \\begin{cases} x & x > 0 \\\\ 0 & \\text{otherwise} \\end{cases}");

        assertThat(text).isEqualTo("f of x equals the piecewise function: case one, x, x is greater than 0; "
                + "case two, 0, otherwise; end cases");
    }

    @Test
    void shouldReadEvaluationBar() {
        assertThat(speak("\\left. x^2 \\right|_0^1")).isEqualTo("x squared, evaluated from 0 to 1");
    }

    @Test
    void shouldBeDeterministic() {
        String expr = "\\frac{-b \\pm \\sqrt{b^2 - 4ac}}{2a}";

        assertThat(speak(expr)).isEqualTo(speak(expr));
        assertThat(speak(expr)).contains("the square root of").doesNotContain("  ");
    }

    @Test
    void shouldRejectUnsupportedNodes() {
        assertThatThrownBy(() -> verbalizer.verbalize(new Unsupported("\\foo", "no reading"),
                styles.require(SpeechStyleNames.CLEAR_SPEAK), false))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("\\foo");
    }

    @Test
    void shouldRejectTreesWithNothingToSpeak() {
        assertThatThrownBy(() -> verbalizer.verbalize(new Group(new Empty()),
                styles.require(SpeechStyleNames.CLEAR_SPEAK), false))
                .isInstanceOf(ParseException.class)
                .satisfies(e -> assertThat(((ParseException) e).getKind()).isEqualTo(ParseErrorKind.EMPTY_INPUT));
    }

    @Test
    void shouldRejectTreesTooDeepToRender() {
        MathNode tree = Identifier.of("x");
        for (int i = 0; i < Verbalizer.MAX_TREE_DEPTH; i++) {
            tree = new BinaryOp(Operator.PLUS, tree, Identifier.of("x"));
        }
        MathNode deep = tree;

        assertThatThrownBy(() -> verbalizer.verbalize(deep, styles.require(SpeechStyleNames.CLEAR_SPEAK), false))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("nested too deeply");
    }

    @Test
    void shouldReadLongFlatSums() {
        String text = speak("x" + " + x".repeat(200));

        assertThat(text).startsWith("x plus x plus").endsWith("plus x");
    }

    @Test
    void normalizeShouldTidyPunctuation() {
        assertThat(Verbalizer.normalize(" , a ,, b ;")).isEqualTo("a, b");
        assertThat(Verbalizer.normalize("x   plus\n1")).isEqualTo("x plus 1");
    }
}
