package com.phillippitts.mathwords.service.verbalize;

import com.phillippitts.mathwords.domain.tree.MathNode;
import com.phillippitts.mathwords.domain.tree.MathNode.BigOperator;
import com.phillippitts.mathwords.domain.tree.MathNode.BinaryOp;
import com.phillippitts.mathwords.domain.tree.MathNode.Delimited;
import com.phillippitts.mathwords.domain.tree.MathNode.Empty;
import com.phillippitts.mathwords.domain.tree.MathNode.Fraction;
import com.phillippitts.mathwords.domain.tree.MathNode.FunctionCall;
import com.phillippitts.mathwords.domain.tree.MathNode.FunctionKind;
import com.phillippitts.mathwords.domain.tree.MathNode.Group;
import com.phillippitts.mathwords.domain.tree.MathNode.Identifier;
import com.phillippitts.mathwords.domain.tree.MathNode.Matrix;
import com.phillippitts.mathwords.domain.tree.MathNode.NumberLiteral;
import com.phillippitts.mathwords.domain.tree.MathNode.Power;
import com.phillippitts.mathwords.domain.tree.MathNode.Root;
import com.phillippitts.mathwords.domain.tree.MathNode.Separator;
import com.phillippitts.mathwords.domain.tree.MathNode.Sequence;
import com.phillippitts.mathwords.domain.tree.MathNode.Sub;
import com.phillippitts.mathwords.domain.tree.MathNode.SubSup;
import com.phillippitts.mathwords.domain.tree.MathNode.UnaryOp;
import com.phillippitts.mathwords.domain.tree.MathNode.Unsupported;
import com.phillippitts.mathwords.exception.ParseErrorKind;
import com.phillippitts.mathwords.exception.ParseException;
import com.phillippitts.mathwords.service.registry.BigOperatorKind;
import com.phillippitts.mathwords.service.registry.CommandRegistry;
import com.phillippitts.mathwords.service.registry.Delimiter;
import com.phillippitts.mathwords.service.registry.EnvironmentKind;
import com.phillippitts.mathwords.service.registry.MathFont;
import com.phillippitts.mathwords.service.registry.Operator;
import com.phillippitts.mathwords.service.registry.Precedence;
import com.phillippitts.mathwords.service.registry.UnaryOperator;
import com.phillippitts.mathwords.service.style.SpeechStyle;
import com.phillippitts.mathwords.service.style.SpeechStyle.FractionPhrasing;
import com.phillippitts.mathwords.service.style.SpeechStyle.OrdinalFormat;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Renders an expression tree as English words.
 *
 * <p>The traversal is pure: it reads the tree, the {@link VerbalizationContext} and the
 * read-only {@link CommandRegistry}, and returns a string. Grouping that is visible only
 * through tree shape is spoken with the style's quantity phrase whenever a child binds looser
 * than its parent (or equally, on the right of a non-associative operator).
 */
@Component
public class Verbalizer {

    private static final Map<String, String> NUMBER_SETS = Map.of(
            "R", "the real numbers",
            "N", "the natural numbers",
            "Z", "the integers",
            "Q", "the rational numbers",
            "C", "the complex numbers");

    /** Deepest tree the recursive renderer accepts. */
    static final int MAX_TREE_DEPTH = 1000;

    private static final Set<String> MARK_GLYPHS = Set.of("∘", "°", "⊤", "*", "∗", "⋆", "†", "+", "-", "−");

    private final CommandRegistry registry;

    public Verbalizer(CommandRegistry registry) {
        this.registry = registry;
    }

    /**
     * Verbalizes a tree.
     *
     * @param tree parsed expression
     * @param style speech style
     * @param displayMode true for display equations
     * @return normalized English text
     * @throws ParseException if the tree contains an unresolved construct, is too deep to
     *         render, or has nothing to speak
     */
    public String verbalize(MathNode tree, SpeechStyle style, boolean displayMode) {
        if (MathNode.depth(tree) > MAX_TREE_DEPTH) {
            throw new ParseException(ParseErrorKind.UNEXPECTED_TOKEN, -1, "expression is nested too deeply");
        }
        String text = normalize(render(tree, new VerbalizationContext(style, displayMode)));
        if (text.isEmpty()) {
            throw new ParseException(ParseErrorKind.EMPTY_INPUT, -1, "expression has no spoken content");
        }
        return text;
    }

    static String normalize(String text) {
        String result = text.replaceAll("\\s+", " ")
                .replaceAll(" ,", ",")
                .replaceAll(",(,)+", ",")
                .replaceAll(" ;", ";")
                .replaceAll(",;", ";")
                .trim();
        while (result.startsWith(",") || result.startsWith(";")) {
            result = result.substring(1).trim();
        }
        while (result.endsWith(",") || result.endsWith(";")) {
            result = result.substring(0, result.length() - 1).trim();
        }
        return result;
    }

    String render(MathNode node, VerbalizationContext ctx) {
        if (node instanceof NumberLiteral number) {
            return number.literal();
        }
        if (node instanceof Identifier identifier) {
            return identifierWord(identifier);
        }
        if (node instanceof BinaryOp binary) {
            return renderBinary(binary, ctx);
        }
        if (node instanceof UnaryOp unary) {
            return renderUnary(unary, ctx);
        }
        if (node instanceof Fraction fraction) {
            return renderFraction(fraction, ctx);
        }
        if (node instanceof Root root) {
            return renderRoot(root, ctx);
        }
        if (node instanceof Power power) {
            return renderPower(power.base(), power.exponent(), ctx);
        }
        if (node instanceof Sub sub) {
            return renderSub(sub.base(), sub.subscript(), ctx);
        }
        if (node instanceof SubSup subSup) {
            return renderSubSup(subSup, ctx);
        }
        if (node instanceof BigOperator big) {
            return renderBigOperator(big, ctx);
        }
        if (node instanceof FunctionCall call) {
            return renderFunction(call, ctx);
        }
        if (node instanceof Delimited delimited) {
            return renderDelimited(delimited, ctx);
        }
        if (node instanceof Matrix matrix) {
            return renderMatrix(matrix, ctx);
        }
        if (node instanceof Sequence sequence) {
            return joinItems(sequence.items(), separatorWord(sequence.separator()), ctx);
        }
        if (node instanceof Group group) {
            return render(group.inner(), ctx);
        }
        if (node instanceof Empty) {
            return "";
        }
        if (node instanceof Unsupported unsupported) {
            throw new ParseException(ParseErrorKind.UNEXPECTED_TOKEN, -1,
                    "unsupported construct '" + unsupported.rawText() + "': " + unsupported.reason());
        }
        throw new IllegalStateException("unhandled node type " + node.getClass().getSimpleName());
    }

    // ---- precedence and grouping -----------------------------------------------------------

    /**
     * Binding strength of a node as heard by a listener. Silent fences report the strength of
     * their content, since nothing in the speech marks them.
     */
    int precedenceOf(MathNode node, VerbalizationContext ctx) {
        if (node instanceof BinaryOp binary) {
            return binary.op().precedence();
        }
        if (node instanceof UnaryOp unary) {
            return unary.op().fixity() == UnaryOperator.Fixity.PREFIX && !unary.op().isAccent()
                    ? Precedence.PREFIX : Precedence.SCRIPT;
        }
        if (node instanceof Sequence) {
            return Precedence.SEQUENCE;
        }
        if (node instanceof Group group) {
            return precedenceOf(group.inner(), ctx);
        }
        if (node instanceof Delimited delimited) {
            return isSilentFence(delimited, ctx) ? precedenceOf(delimited.inner(), ctx) : Precedence.ATOM;
        }
        if (node instanceof BigOperator) {
            return Precedence.IMPLICIT;
        }
        if (node instanceof FunctionCall call) {
            return call.kind() == FunctionKind.NAMED && !call.args().isEmpty() ? Precedence.IMPLICIT : Precedence.ATOM;
        }
        if (node instanceof Power || node instanceof Sub || node instanceof SubSup) {
            return Precedence.SCRIPT;
        }
        return Precedence.ATOM;
    }

    private boolean needsGrouping(MathNode child, int parentPrecedence, boolean rightSide, boolean associative,
                                  VerbalizationContext ctx) {
        int childPrecedence = precedenceOf(child, ctx);
        return childPrecedence < parentPrecedence
                || (rightSide && childPrecedence == parentPrecedence && !associative);
    }

    private String grouped(MathNode child, VerbalizationContext ctx) {
        MathNode inner = unwrapSilent(child, ctx);
        String text = render(inner, ctx);
        if (ctx.style().explicitDelimiters()) {
            return "open paren " + text + " close paren";
        }
        return ctx.style().quantityPhrase() + " " + text + ",";
    }

    private MathNode unwrapSilent(MathNode node, VerbalizationContext ctx) {
        if (node instanceof Group group) {
            return unwrapSilent(group.inner(), ctx);
        }
        if (node instanceof Delimited delimited && isSilentFence(delimited, ctx)) {
            return unwrapSilent(delimited.inner(), ctx);
        }
        return node;
    }

    private String operand(MathNode child, int parentPrecedence, boolean rightSide, boolean associative,
                           VerbalizationContext ctx) {
        if (needsGrouping(child, parentPrecedence, rightSide, associative, ctx)) {
            return grouped(child, ctx);
        }
        return render(child, ctx);
    }

    // ---- leaves ----------------------------------------------------------------------------

    private String identifierWord(Identifier identifier) {
        String name = identifier.name();
        MathFont font = identifier.font();
        if (font == MathFont.DOUBLE_STRUCK && NUMBER_SETS.containsKey(name)) {
            return NUMBER_SETS.get(name);
        }
        String word = glyphWord(name);
        if (font == MathFont.NORMAL || font == MathFont.ITALIC) {
            return word;
        }
        return font.spoken() + " " + word;
    }

    private String glyphWord(String glyph) {
        String word = registry.spokenGlyph(glyph);
        if (word != null) {
            return word;
        }
        String function = registry.spokenFunction(glyph);
        return function != null ? function : glyph;
    }

    // ---- operators -------------------------------------------------------------------------

    private String renderBinary(BinaryOp binary, VerbalizationContext ctx) {
        Operator op = binary.op();
        if (op == Operator.IMPLICIT_TIMES) {
            return renderImplicit(binary, ctx);
        }
        String left = operand(binary.left(), op.precedence(), false, op.isAssociative(), ctx);
        String right = operand(binary.right(), op.precedence(), true, op.isAssociative(), ctx);
        return left + " " + ctx.style().operatorWord(op, ctx.displayMode()) + " " + right;
    }

    private String renderImplicit(BinaryOp binary, VerbalizationContext ctx) {
        int precedence = Precedence.IMPLICIT;
        boolean leftGrouped = needsGrouping(binary.left(), precedence, false, true, ctx);
        boolean rightGrouped = needsGrouping(binary.right(), precedence, true, true, ctx);
        String left = leftGrouped ? grouped(binary.left(), ctx) : render(binary.left(), ctx);
        String right = rightGrouped ? grouped(binary.right(), ctx) : render(binary.right(), ctx);
        if (isMixedNumber(binary)) {
            return left + " and " + right;
        }
        boolean spokenTimes = leftGrouped || rightGrouped
                || (endsWithNumber(binary.left()) && startsWithNumber(binary.right()));
        return spokenTimes ? left + " times " + right : left + " " + right;
    }

    private boolean isMixedNumber(BinaryOp binary) {
        return binary.left() instanceof NumberLiteral whole
                && SpokenNumbers.smallInteger(whole.literal()) >= 0
                && binary.right() instanceof Fraction fraction
                && commonFraction(fraction) != null;
    }

    private static boolean endsWithNumber(MathNode node) {
        if (node instanceof NumberLiteral) {
            return true;
        }
        return node instanceof BinaryOp binary && binary.op() == Operator.IMPLICIT_TIMES && endsWithNumber(binary.right());
    }

    private static boolean startsWithNumber(MathNode node) {
        if (node instanceof NumberLiteral) {
            return true;
        }
        if (node instanceof Power power) {
            return startsWithNumber(power.base());
        }
        return node instanceof BinaryOp binary && binary.op() == Operator.IMPLICIT_TIMES && startsWithNumber(binary.left());
    }

    private String renderUnary(UnaryOp unary, VerbalizationContext ctx) {
        UnaryOperator op = unary.op();
        switch (op) {
            case NEGATE:
                return ctx.style().negativeWord() + " " + operand(unary.operand(), Precedence.PREFIX, true, true, ctx);
            case POSITIVE:
            case PLUS_MINUS:
            case MINUS_PLUS:
            case NOT:
            case VECTOR:
                return op.spoken() + " " + operand(unary.operand(), Precedence.PREFIX, true, true, ctx);
            default:
                return operand(unary.operand(), Precedence.SCRIPT, false, true, ctx) + " " + op.spoken();
        }
    }

    // ---- fractions and roots ---------------------------------------------------------------

    private String renderFraction(Fraction fraction, VerbalizationContext ctx) {
        SpeechStyle style = ctx.style();
        if (style.commonFractions()) {
            String common = commonFraction(fraction);
            if (common != null) {
                return common;
            }
        }
        String numerator = render(fraction.numerator(), ctx);
        String denominator = render(fraction.denominator(), ctx);
        boolean simple = isSimple(fraction.numerator()) && isSimple(fraction.denominator());
        FractionPhrasing phrasing = style.fractions();
        if (phrasing == FractionPhrasing.START_END) {
            return "start fraction " + numerator + " over " + denominator + " end fraction";
        }
        if (simple) {
            return numerator + " over " + denominator;
        }
        if (phrasing == FractionPhrasing.NUMERATOR_DENOMINATOR) {
            return "the fraction with numerator " + numerator + " and denominator " + denominator + ",";
        }
        return "fraction, " + numerator + " over " + denominator + ", end fraction,";
    }

    /** "one half", "three fourths" for numerators 1..10 over denominators 2..10. */
    private static String commonFraction(Fraction fraction) {
        if (!(fraction.numerator() instanceof NumberLiteral numerator)
                || !(fraction.denominator() instanceof NumberLiteral denominator)) {
            return null;
        }
        int n = SpokenNumbers.smallInteger(numerator.literal());
        int d = SpokenNumbers.smallInteger(denominator.literal());
        if (n < 1 || n > 10 || d < 2 || d > 10) {
            return null;
        }
        return SpokenNumbers.cardinal(n) + " " + SpokenNumbers.fractionDenominator(d, n > 1);
    }

    private boolean isSimple(MathNode node) {
        if (node instanceof NumberLiteral || node instanceof Identifier) {
            return true;
        }
        if (node instanceof FunctionCall call) {
            return call.kind() == FunctionKind.TEXT && call.args().isEmpty();
        }
        if (node instanceof Group group) {
            return isSimple(group.inner());
        }
        if (node instanceof Sub sub) {
            return isSimple(sub.base()) && isSimple(sub.subscript());
        }
        return false;
    }

    private String renderRoot(Root root, VerbalizationContext ctx) {
        String radicand = render(root.radicand(), ctx);
        String ending = isSimple(root.radicand()) ? "" : ", end root,";
        if (root.degree() == null) {
            return "the square root of " + radicand + ending;
        }
        String degree = rootDegree(root.degree(), ctx);
        return degree + radicand + ending;
    }

    private String rootDegree(MathNode degree, VerbalizationContext ctx) {
        OrdinalFormat ordinals = ctx.style().ordinals();
        if (degree instanceof NumberLiteral number) {
            int n = SpokenNumbers.smallInteger(number.literal());
            if (n == 2) {
                return "the square root of ";
            }
            if (n == 3) {
                return "the cube root of ";
            }
            if (n >= 0 && ordinals != OrdinalFormat.NONE) {
                return "the " + ordinal(n, ordinals) + " root of ";
            }
        }
        if (degree instanceof Identifier identifier && ordinals != OrdinalFormat.NONE
                && identifier.name().length() == 1) {
            return "the " + identifierWord(identifier) + "-th root of ";
        }
        return "the root with index " + render(degree, ctx) + " of ";
    }

    private static String ordinal(int n, OrdinalFormat format) {
        return format == OrdinalFormat.WORDS ? SpokenNumbers.ordinalWord(n) : SpokenNumbers.numericOrdinal(n);
    }

    // ---- scripts ---------------------------------------------------------------------------

    private String renderPower(MathNode base, MathNode exponent, VerbalizationContext ctx) {
        if (base instanceof Empty) {
            return "superscript " + render(exponent, ctx);
        }
        if (base instanceof FunctionCall call && call.kind() == FunctionKind.NAMED) {
            return renderFunctionPower(call, exponent, ctx);
        }
        String baseText = operand(base, Precedence.SCRIPT, false, false, ctx);
        if (exponent instanceof Identifier symbol && isMarkGlyph(symbol.name())) {
            return baseText + " " + markWord(symbol.name());
        }
        return baseText + " " + powerPhrase(exponent, ctx);
    }

    /** Exponent glyphs read as a trailing word instead of a power. */
    private static boolean isMarkGlyph(String glyph) {
        return MARK_GLYPHS.contains(glyph) || (!glyph.isEmpty() && glyph.chars().allMatch(ch -> ch == '′'));
    }

    // \left. f(x) \right|_a^b
    private static boolean isEvaluationBar(Delimited delimited) {
        return delimited.open() == Delimiter.NONE && delimited.close() == Delimiter.VERTICAL_BAR;
    }

    private String markWord(String glyph) {
        switch (glyph) {
            case "′":
                return "prime";
            case "′′":
                return "double prime";
            case "′′′":
                return "triple prime";
            case "∘":
            case "°":
                return "degrees";
            case "⊤":
                return "transpose";
            case "*":
            case "∗":
            case "⋆":
                return "star";
            case "†":
                return "dagger";
            case "+":
                return "plus";
            case "-":
            case "−":
                return "minus";
            default:
                return glyph.length() + " primes";
        }
    }

    /** "squared", "to the fourth power", "to the power of n", per style. */
    private String powerPhrase(MathNode exponent, VerbalizationContext ctx) {
        SpeechStyle style = ctx.style();
        if (exponent instanceof NumberLiteral number) {
            int n = SpokenNumbers.smallInteger(number.literal());
            if (style.naturalPowers() && n == 2) {
                return "squared";
            }
            if (style.naturalPowers() && n == 3) {
                return "cubed";
            }
            if (n >= 0 && style.ordinals() != OrdinalFormat.NONE) {
                return "to the " + ordinal(n, style.ordinals()) + " power";
            }
        }
        String text = render(exponent, ctx);
        return String.format(isSimple(exponent) ? style.powerTemplate() : style.complexPowerTemplate(), text);
    }

    private String renderFunctionPower(FunctionCall call, MathNode exponent, VerbalizationContext ctx) {
        String name = functionWord(call);
        if (isMinusOne(exponent)) {
            return withArguments("the inverse " + name, call, ctx);
        }
        return withArguments("the " + name + " " + powerPhrase(exponent, ctx), call, ctx);
    }

    private static boolean isMinusOne(MathNode node) {
        MathNode inner = node instanceof Group group ? group.inner() : node;
        return inner instanceof UnaryOp unary && unary.op() == UnaryOperator.NEGATE
                && unary.operand() instanceof NumberLiteral one && "1".equals(one.literal());
    }

    private String renderSub(MathNode base, MathNode subscript, VerbalizationContext ctx) {
        if (base instanceof Empty) {
            return "subscript " + render(subscript, ctx);
        }
        if (base instanceof FunctionCall call && call.kind() == FunctionKind.NAMED) {
            return withArguments("the " + functionWord(call) + " base " + render(subscript, ctx), call, ctx);
        }
        if (base instanceof Delimited delimited && isEvaluationBar(delimited)) {
            return render(delimited.inner(), ctx) + ", evaluated at " + render(subscript, ctx);
        }
        String baseText = operand(base, Precedence.SCRIPT, false, false, ctx);
        String ending = isSimple(subscript) ? "" : ", end subscript,";
        return baseText + " sub " + render(subscript, ctx) + ending;
    }

    private String renderSubSup(SubSup node, VerbalizationContext ctx) {
        MathNode base = node.base();
        if (base instanceof Delimited delimited && isEvaluationBar(delimited)) {
            return render(delimited.inner(), ctx) + ", evaluated from " + render(node.subscript(), ctx)
                    + " to " + render(node.exponent(), ctx);
        }
        if (base instanceof Empty) {
            return "subscript " + render(node.subscript(), ctx) + " superscript " + render(node.exponent(), ctx);
        }
        return renderPower(new Sub(base, node.subscript()), node.exponent(), ctx);
    }

    // ---- big operators and functions -------------------------------------------------------

    private String renderBigOperator(BigOperator big, VerbalizationContext ctx) {
        BigOperatorKind kind = big.kind();
        StringBuilder text = new StringBuilder();
        if (ctx.displayMode()) {
            text.append("the ");
        }
        text.append(kind.spoken());
        // Bounds use inline wording even in display equations.
        VerbalizationContext boundsCtx = new VerbalizationContext(ctx.style(), false);
        if (kind.isLimitLike()) {
            appendLimitBounds(text, big, boundsCtx);
        } else {
            appendBounds(text, big, boundsCtx);
        }
        if (!(big.body() instanceof Empty)) {
            text.append(" of ").append(render(big.body(), ctx));
        }
        return text.toString();
    }

    private void appendLimitBounds(StringBuilder text, BigOperator big, VerbalizationContext ctx) {
        MathNode lower = big.lower();
        if (lower instanceof BinaryOp approach && approach.op() == Operator.TO) {
            text.append(" as ").append(render(approach.left(), ctx))
                    .append(" approaches ").append(render(approach.right(), ctx));
        } else if (lower != null) {
            text.append(" over ").append(render(lower, ctx));
        }
        if (big.upper() != null) {
            text.append(" to ").append(render(big.upper(), ctx));
        }
    }

    private void appendBounds(StringBuilder text, BigOperator big, VerbalizationContext ctx) {
        String lower = big.lower() == null ? null : render(big.lower(), ctx);
        String upper = big.upper() == null ? null : render(big.upper(), ctx);
        switch (ctx.style().bounds()) {
            case FROM_TO:
                if (lower != null && upper != null) {
                    text.append(" from ").append(lower).append(" to ").append(upper);
                } else if (lower != null) {
                    text.append(" over ").append(lower);
                } else if (upper != null) {
                    text.append(" to ").append(upper);
                }
                break;
            case LIMITS:
                if (lower != null && upper != null) {
                    text.append(" with lower limit ").append(lower).append(" and upper limit ").append(upper);
                } else if (lower != null) {
                    text.append(" with lower limit ").append(lower);
                } else if (upper != null) {
                    text.append(" with upper limit ").append(upper);
                }
                break;
            default:
                throw new IllegalStateException("unhandled bounds phrasing " + ctx.style().bounds());
        }
    }

    private String renderFunction(FunctionCall call, VerbalizationContext ctx) {
        switch (call.kind()) {
            case NAMED:
                return call.args().isEmpty() ? functionWord(call) : withArguments("the " + functionWord(call), call, ctx);
            case TEXT:
            case APPLIED:
                return call.args().isEmpty() ? call.name() : withArguments(call.name(), call, ctx);
            case BINOMIAL:
                return operand(call.args().get(0), Precedence.IMPLICIT, false, true, ctx) + " choose "
                        + operand(call.args().get(1), Precedence.IMPLICIT, true, true, ctx);
            default:
                throw new IllegalStateException("unhandled function kind " + call.kind());
        }
    }

    private String functionWord(FunctionCall call) {
        String spoken = registry.spokenFunction(call.name());
        return spoken != null ? spoken : call.name();
    }

    private String withArguments(String head, FunctionCall call, VerbalizationContext ctx) {
        if (call.args().isEmpty()) {
            return head;
        }
        if (call.args().size() == 1) {
            return head + " of " + operand(call.args().get(0), Precedence.IMPLICIT, true, true, ctx);
        }
        return head + " of " + joinItems(call.args(), "comma", ctx);
    }

    // ---- fences ----------------------------------------------------------------------------

    private boolean isPlainFence(Delimiter d) {
        return d == Delimiter.LEFT_PAREN || d == Delimiter.RIGHT_PAREN
                || d == Delimiter.LEFT_BRACKET || d == Delimiter.RIGHT_BRACKET;
    }

    /** True when a fence is conveyed only through grouping words. */
    private boolean isSilentFence(Delimited delimited, VerbalizationContext ctx) {
        if (delimited.open() == Delimiter.NONE && delimited.close() == Delimiter.NONE) {
            return true;
        }
        if (!isPlainFence(delimited.open()) || !isPlainFence(delimited.close())) {
            return false;
        }
        boolean matched = delimited.open().partner() == delimited.close();
        return matched && !ctx.displayMode() && !ctx.style().explicitDelimiters()
                && !(delimited.inner() instanceof Sequence) && !(delimited.inner() instanceof Empty);
    }

    private String renderDelimited(Delimited delimited, VerbalizationContext ctx) {
        Delimiter open = delimited.open();
        Delimiter close = delimited.close();
        MathNode inner = delimited.inner();
        if (isSilentFence(delimited, ctx)) {
            return render(inner, ctx);
        }
        if (!ctx.style().explicitDelimiters()) {
            String semantic = semanticFence(open, close, inner, ctx);
            if (semantic != null) {
                return semantic;
            }
        }
        String content = render(inner, ctx);
        String opening = open == Delimiter.NONE ? "" : open.spoken() + " ";
        String closing = close == Delimiter.NONE ? "" : " " + close.spoken();
        return opening + content + closing;
    }

    private String semanticFence(Delimiter open, Delimiter close, MathNode inner, VerbalizationContext ctx) {
        if (open == Delimiter.VERTICAL_BAR && close == Delimiter.VERTICAL_BAR) {
            return "the absolute value of " + render(inner, ctx) + ",";
        }
        if (open == Delimiter.DOUBLE_BAR && close == Delimiter.DOUBLE_BAR) {
            return "the norm of " + render(inner, ctx) + ",";
        }
        if (open == Delimiter.LEFT_FLOOR && close == Delimiter.RIGHT_FLOOR) {
            return "the floor of " + render(inner, ctx) + ",";
        }
        if (open == Delimiter.LEFT_CEILING && close == Delimiter.RIGHT_CEILING) {
            return "the ceiling of " + render(inner, ctx) + ",";
        }
        if (open == Delimiter.LEFT_BRACE && close == Delimiter.RIGHT_BRACE) {
            if (inner instanceof Empty) {
                return "the empty set";
            }
            if (inner instanceof BinaryOp builder && (builder.op() == Operator.MID || builder.op() == Operator.COLON)) {
                return "the set of all " + render(builder.left(), ctx) + " such that " + render(builder.right(), ctx) + ",";
            }
            return "the set " + render(inner, ctx) + ",";
        }
        boolean mismatched = isPlainFence(open) && isPlainFence(close) && open.partner() != close;
        if (mismatched && inner instanceof Sequence interval && interval.items().size() == 2) {
            String from = render(interval.items().get(0), ctx);
            String to = render(interval.items().get(1), ctx);
            String lowerEnd = open == Delimiter.LEFT_BRACKET ? "including " + from : "not including " + from;
            String upperEnd = close == Delimiter.RIGHT_BRACKET ? "including " + to : "not including " + to;
            return "the interval from " + from + " to " + to + ", " + lowerEnd + " and " + upperEnd + ",";
        }
        return null;
    }

    // ---- tables and lists ------------------------------------------------------------------

    private String renderMatrix(Matrix matrix, VerbalizationContext ctx) {
        switch (matrix.kind().layout()) {
            case MATRIX:
                return renderGrid(matrix, ctx);
            case CASES:
                return renderCases(matrix, ctx);
            case LINES:
                return renderLines(matrix, ctx);
            default:
                throw new IllegalStateException("unhandled layout " + matrix.kind().layout());
        }
    }

    private String renderGrid(Matrix matrix, VerbalizationContext ctx) {
        String noun = matrix.kind() == EnvironmentKind.DETERMINANT ? "determinant" : "matrix";
        StringBuilder text = new StringBuilder("the ")
                .append(SpokenNumbers.cardinal(matrix.rows().size())).append(" by ")
                .append(SpokenNumbers.cardinal(matrix.columnCount())).append(' ').append(noun)
                .append(" with rows:");
        int rowIndex = 1;
        for (List<MathNode> row : matrix.rows()) {
            text.append(" row ").append(SpokenNumbers.cardinal(rowIndex++)).append(',');
            List<String> cells = new ArrayList<>();
            int column = 1;
            for (MathNode cell : row) {
                String spoken = render(cell, ctx);
                cells.add(ctx.displayMode() ? "column " + SpokenNumbers.cardinal(column) + ", " + spoken : spoken);
                column++;
            }
            text.append(' ').append(String.join(ctx.displayMode() ? ", " : " comma ", cells)).append(';');
        }
        text.append(" end ").append(noun);
        return text.toString();
    }

    private String renderCases(Matrix matrix, VerbalizationContext ctx) {
        StringBuilder text = new StringBuilder("the piecewise function:");
        int caseIndex = 1;
        for (List<MathNode> row : matrix.rows()) {
            text.append(" case ").append(SpokenNumbers.cardinal(caseIndex++)).append(", ");
            List<String> parts = new ArrayList<>();
            for (MathNode cell : row) {
                String spoken = render(cell, ctx);
                if (!spoken.isBlank()) {
                    parts.add(spoken);
                }
            }
            text.append(String.join(", ", parts)).append(';');
        }
        text.append(" end cases");
        return text.toString();
    }

    private String renderLines(Matrix matrix, VerbalizationContext ctx) {
        StringBuilder text = new StringBuilder();
        int lineIndex = 1;
        for (List<MathNode> row : matrix.rows()) {
            List<String> parts = new ArrayList<>();
            for (MathNode cell : row) {
                parts.add(render(cell, ctx));
            }
            text.append(" line ").append(SpokenNumbers.cardinal(lineIndex++)).append(", ")
                    .append(String.join(" ", parts)).append(';');
        }
        return text.toString();
    }

    private String joinItems(List<MathNode> items, String separator, VerbalizationContext ctx) {
        List<String> spoken = new ArrayList<>(items.size());
        for (MathNode item : items) {
            spoken.add(render(item, ctx));
        }
        return String.join(" " + separator + " ", spoken);
    }

    private static String separatorWord(Separator separator) {
        return separator == Separator.COMMA ? "comma" : "semicolon";
    }
}
