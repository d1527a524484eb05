package com.phillippitts.mathwords.service.mathml;

import com.phillippitts.mathwords.domain.tree.MathNode;
import com.phillippitts.mathwords.domain.tree.MathNode.BigOperator;
import com.phillippitts.mathwords.domain.tree.MathNode.BinaryOp;
import com.phillippitts.mathwords.domain.tree.MathNode.Delimited;
import com.phillippitts.mathwords.domain.tree.MathNode.Empty;
import com.phillippitts.mathwords.domain.tree.MathNode.Fraction;
import com.phillippitts.mathwords.domain.tree.MathNode.FunctionCall;
import com.phillippitts.mathwords.domain.tree.MathNode.FunctionKind;
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
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Reads presentation MathML into the same {@link MathNode} tree the LaTeX parser produces.
 *
 * <p>Layout elements ({@code mfrac}, {@code msqrt}, scripts, tables) map one-to-one onto tree
 * nodes. The flat children of an {@code mrow} are regrouped by operator precedence, so
 * {@code <mi>a</mi><mo>+</mo><mi>b</mi><mo>⋅</mo><mi>c</mi>} reads the same as {@code a + b \cdot c}.
 *
 * <p>DOCTYPE declarations and external entities are rejected. Malformed XML and elements outside
 * the supported subset fail with {@link ParseErrorKind#INVALID_MATHML}.
 */
@Component
public class MathMlReader {

    private static final Logger LOG = LogManager.getLogger(MathMlReader.class);

    static final int MAX_DEPTH = 400;

    private static final String FUNCTION_APPLICATION = "\u2061";
    private static final String INVISIBLE_TIMES = "\u2062";
    private static final String INVISIBLE_SEPARATOR = "\u2063";

    private static final Set<String> TRANSPARENT_ELEMENTS = Set.of(
            "math", "mrow", "mstyle", "mpadded", "menclose");

    private static final Set<String> SILENT_ELEMENTS = Set.of(
            "mspace", "mphantom", "annotation", "annotation-xml", "none", "maligngroup", "malignmark");

    private static final Set<String> PREFIX_GLYPHS = Set.of("-", "−", "+", "±", "∓", "¬");

    private final CommandRegistry registry;

    public MathMlReader(CommandRegistry registry) {
        this.registry = registry;
    }

    /**
     * Parses a MathML document.
     *
     * @param source MathML markup with a {@code <math>} root element
     * @return expression tree
     * @throws ParseException with {@link ParseErrorKind#INVALID_MATHML} for malformed or unsupported
     *         markup, or {@link ParseErrorKind#EMPTY_INPUT} when the document has no content
     */
    public MathNode read(String source) {
        if (source == null || source.isBlank()) {
            throw new ParseException(ParseErrorKind.EMPTY_INPUT, 0, "empty MathML input");
        }
        Element root = parseDocument(source).getDocumentElement();
        if (!"math".equals(localName(root))) {
            throw invalid("root element must be <math>, found <" + localName(root) + ">");
        }
        MathNode tree = new Reader().convert(root);
        if (MathNode.isBlank(tree)) {
            throw new ParseException(ParseErrorKind.EMPTY_INPUT, 0, "MathML document has no content");
        }
        return tree;
    }

    private Document parseDocument(String source) {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setXIncludeAware(false);
            factory.setExpandEntityReferences(false);
            DocumentBuilder builder = factory.newDocumentBuilder();
            builder.setErrorHandler(new FailingErrorHandler());
            return builder.parse(new InputSource(new StringReader(source)));
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser does not support secure processing", e);
        } catch (SAXException e) {
            throw new ParseException(ParseErrorKind.INVALID_MATHML, -1, "malformed MathML: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new ParseException(ParseErrorKind.INVALID_MATHML, -1, "unreadable MathML: " + e.getMessage(), e);
        }
    }

    private static ParseException invalid(String detail) {
        return new ParseException(ParseErrorKind.INVALID_MATHML, -1, detail);
    }

    private static String localName(Node node) {
        String local = node.getLocalName();
        return local != null ? local : node.getNodeName();
    }

    private static List<Element> childElements(Element element) {
        List<Element> children = new ArrayList<>();
        NodeList nodes = element.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            if (nodes.item(i) instanceof Element child) {
                children.add(child);
            }
        }
        return children;
    }

    private static String text(Element element) {
        return element.getTextContent().replace('\u00A0', ' ').trim();
    }

    /** Element-to-node conversion for one document. */
    private final class Reader {

        private int depth;

        MathNode convert(Element element) {
            if (++depth > MAX_DEPTH) {
                throw invalid("nesting deeper than " + MAX_DEPTH + " levels");
            }
            try {
                return convertElement(element);
            } finally {
                depth--;
            }
        }

        private MathNode convertElement(Element element) {
            String name = localName(element);
            if (TRANSPARENT_ELEMENTS.contains(name)) {
                return row(childElements(element));
            }
            if (SILENT_ELEMENTS.contains(name)) {
                return new Empty();
            }
            switch (name) {
                case "semantics":
                    List<Element> children = childElements(element);
                    return children.isEmpty() ? new Empty() : convert(children.get(0));
                case "mi":
                    return identifier(element);
                case "mn":
                    return new NumberLiteral(text(element));
                case "mo":
                    return operatorAsOperand(text(element));
                case "mtext":
                case "ms":
                    String words = text(element);
                    return words.isEmpty() ? new Empty() : new FunctionCall(words, FunctionKind.TEXT, List.of());
                case "mfrac":
                    return fraction(element);
                case "msqrt":
                    return new Root(null, row(childElements(element)));
                case "mroot":
                    List<Element> parts = expectChildren(element, 2);
                    return new Root(convert(parts.get(1)), convert(parts.get(0)));
                case "msup":
                case "msub":
                case "msubsup":
                case "munder":
                case "mover":
                case "munderover":
                    return scripts(element, name);
                case "mfenced":
                    return fenced(element);
                case "mtable":
                    return new Matrix(tableRows(element), EnvironmentKind.MATRIX);
                case "merror":
                    throw invalid("document contains an <merror> element: " + text(element));
                default:
                    throw invalid("unsupported element <" + name + ">");
            }
        }

        private MathNode identifier(Element element) {
            String name = text(element);
            if (name.isEmpty()) {
                return new Empty();
            }
            if (name.codePointCount(0, name.length()) == 1) {
                return new Identifier(name, MathFont.forMathVariant(element.getAttribute("mathvariant")));
            }
            if (registry.isFunction(name)) {
                return new FunctionCall(name, FunctionKind.NAMED, List.of());
            }
            BigOperatorKind limit = BigOperatorKind.forGlyph(name);
            if (limit != null && limit.isLimitLike()) {
                return new BigOperator(limit, null, null, new Empty());
            }
            return new FunctionCall(name, FunctionKind.TEXT, List.of());
        }

        private MathNode operatorAsOperand(String glyph) {
            BigOperatorKind kind = BigOperatorKind.forGlyph(glyph);
            if (kind != null) {
                return new BigOperator(kind, null, null, new Empty());
            }
            return glyph.isEmpty() ? new Empty() : Identifier.of(glyph);
        }

        private MathNode fraction(Element element) {
            List<Element> parts = expectChildren(element, 2);
            MathNode top = convert(parts.get(0));
            MathNode bottom = convert(parts.get(1));
            String thickness = element.getAttribute("linethickness").trim();
            if (thickness.matches("0+(\\.0*)?([a-z]{2})?")) {
                return new FunctionCall("binom", FunctionKind.BINOMIAL, List.of(top, bottom));
            }
            return new Fraction(top, bottom);
        }

        private MathNode scripts(Element element, String name) {
            int expected = name.equals("msubsup") || name.equals("munderover") ? 3 : 2;
            List<Element> parts = expectChildren(element, expected);
            Element baseElement = parts.get(0);

            if (name.equals("mover") || name.equals("munder")) {
                UnaryOperator accent = accent(parts.get(1), name.equals("munder"));
                if (accent != null) {
                    return new UnaryOp(accent, convert(baseElement));
                }
            }

            MathNode base = convert(baseElement);
            MathNode lower = null;
            MathNode upper = null;
            switch (name) {
                case "msub", "munder" -> lower = convert(parts.get(1));
                case "msup", "mover" -> upper = convert(parts.get(1));
                default -> {
                    lower = convert(parts.get(1));
                    upper = convert(parts.get(2));
                }
            }

            BigOperatorKind kind = bigOperatorBase(base);
            if (kind != null) {
                if (base instanceof FunctionCall && lower == null) {
                    return new Power(base, upper);
                }
                return new BigOperator(kind, lower, upper, new Empty());
            }
            if (lower != null && upper != null) {
                return new SubSup(base, lower, upper);
            }
            return lower != null ? new Sub(base, lower) : new Power(base, upper);
        }

        private BigOperatorKind bigOperatorBase(MathNode base) {
            if (base instanceof BigOperator big && big.lower() == null && big.upper() == null) {
                return big.kind();
            }
            if (base instanceof FunctionCall call && call.args().isEmpty()) {
                return BigOperatorKind.forScriptedFunction(call.name());
            }
            return null;
        }

        private UnaryOperator accent(Element mark, boolean under) {
            if (!"mo".equals(localName(mark))) {
                return null;
            }
            String glyph = text(mark);
            if (under) {
                return glyph.equals("_") || glyph.equals("̲") || glyph.equals("‾") ? UnaryOperator.UNDERLINE : null;
            }
            return UnaryOperator.accentForGlyph(glyph);
        }

        private MathNode fenced(Element element) {
            Delimiter open = fenceAttribute(element, "open", "(");
            Delimiter close = fenceAttribute(element, "close", ")");
            String separators = element.getAttribute("separators");
            Separator separator = separators.trim().startsWith(";") ? Separator.SEMICOLON : Separator.COMMA;
            List<MathNode> items = new ArrayList<>();
            for (Element child : childElements(element)) {
                items.add(convert(child));
            }
            MathNode inner;
            if (items.isEmpty()) {
                inner = new Empty();
            } else if (items.size() == 1) {
                inner = items.get(0);
            } else {
                inner = new Sequence(items, separator);
            }
            if (inner instanceof Matrix table && table.kind() == EnvironmentKind.MATRIX) {
                return fencedTable(open, close, table);
            }
            return new Delimited(open, close, inner);
        }

        private Delimiter fenceAttribute(Element element, String attribute, String fallback) {
            String glyph = element.hasAttribute(attribute) ? element.getAttribute(attribute).trim() : fallback;
            if (glyph.isEmpty()) {
                return Delimiter.NONE;
            }
            Delimiter delimiter = Delimiter.forGlyph(glyph);
            if (delimiter == null) {
                throw invalid("unsupported fence '" + glyph + "'");
            }
            return delimiter;
        }

        private List<List<MathNode>> tableRows(Element table) {
            List<List<MathNode>> rows = new ArrayList<>();
            for (Element row : childElements(table)) {
                String rowName = localName(row);
                if (!rowName.equals("mtr") && !rowName.equals("mlabeledtr")) {
                    throw invalid("unexpected <" + rowName + "> inside <mtable>");
                }
                List<Element> cells = childElements(row);
                if (rowName.equals("mlabeledtr") && !cells.isEmpty()) {
                    cells = cells.subList(1, cells.size());
                }
                List<MathNode> converted = new ArrayList<>();
                for (Element cell : cells) {
                    converted.add("mtd".equals(localName(cell)) ? row(childElements(cell)) : convert(cell));
                }
                rows.add(converted);
            }
            return rows;
        }

        private List<Element> expectChildren(Element element, int count) {
            List<Element> children = childElements(element);
            if (children.size() != count) {
                throw invalid("<" + localName(element) + "> needs " + count + " children, found " + children.size());
            }
            return children;
        }

        /** Converts the flat children of a row-like element and regroups them by precedence. */
        MathNode row(List<Element> children) {
            List<Item> items = new ArrayList<>();
            for (Element child : children) {
                String name = localName(child);
                if (name.equals("mo")) {
                    String glyph = text(child);
                    if (!glyph.isEmpty() && !glyph.equals(FUNCTION_APPLICATION)) {
                        items.add(Item.operator(glyph));
                    }
                } else if (!SILENT_ELEMENTS.contains(name)) {
                    MathNode node = convert(child);
                    if (!(node instanceof Empty)) {
                        items.add(Item.operand(node));
                    }
                }
            }
            if (items.isEmpty()) {
                return new Empty();
            }
            return new RowParser(items).parseAll();
        }
    }

    /** One child of a row: either a converted operand or a raw {@code <mo>} glyph. */
    private record Item(MathNode node, String glyph) {

        static Item operand(MathNode node) {
            return new Item(node, null);
        }

        static Item operator(String glyph) {
            return new Item(null, glyph);
        }

        boolean isOperator() {
            return glyph != null;
        }

        boolean is(String text) {
            return text.equals(glyph);
        }
    }

    /** Precedence climbing over the items of one row. */
    private final class RowParser {

        private final List<Item> items;
        private int pos;

        RowParser(List<Item> items) {
            this.items = items;
        }

        MathNode parseAll() {
            MathNode result = parseSequence();
            if (pos < items.size()) {
                Item stray = items.get(pos);
                throw invalid("unexpected " + (stray.isOperator() ? "operator '" + stray.glyph() + "'" : "content")
                        + " in row");
            }
            return result;
        }

        private Item peek() {
            return pos < items.size() ? items.get(pos) : null;
        }

        private boolean atEnd() {
            return pos >= items.size();
        }

        private MathNode parseSequence() {
            List<MathNode> parts = new ArrayList<>();
            Separator separator = null;
            parts.add(parseExpression(Precedence.SUCH_THAT));
            while (!atEnd() && (peek().is(",") || peek().is(";") || peek().is(INVISIBLE_SEPARATOR))) {
                Separator found = peek().is(";") ? Separator.SEMICOLON : Separator.COMMA;
                separator = separator == null ? found : separator;
                pos++;
                if (!atEnd()) {
                    parts.add(parseExpression(Precedence.SUCH_THAT));
                }
            }
            return parts.size() == 1 ? parts.get(0) : new Sequence(parts, separator);
        }

        private MathNode parseExpression(int minPrecedence) {
            MathNode left = parseUnary();
            while (!atEnd()) {
                Item next = peek();
                Operator op = next.isOperator() ? Operator.forGlyph(next.glyph()) : null;
                if (op != null) {
                    if (op.precedence() < minPrecedence) {
                        break;
                    }
                    pos++;
                    if (atEnd()) {
                        throw invalid("operator '" + next.glyph() + "' has no right operand");
                    }
                    left = new BinaryOp(op, left, parseExpression(op.precedence() + 1));
                } else if (Precedence.IMPLICIT >= minPrecedence && startsOperand(next)) {
                    if (next.is(INVISIBLE_TIMES)) {
                        pos++;
                    }
                    left = new BinaryOp(Operator.IMPLICIT_TIMES, left, parseExpression(Precedence.IMPLICIT + 1));
                } else {
                    break;
                }
            }
            return left;
        }

        private boolean startsOperand(Item item) {
            if (!item.isOperator()) {
                return true;
            }
            if (item.is(INVISIBLE_TIMES)) {
                return pos + 1 < items.size();
            }
            return openingFence(item.glyph()) != null || BigOperatorKind.forGlyph(item.glyph()) != null;
        }

        private MathNode parseUnary() {
            Item next = peek();
            if (next == null) {
                throw invalid("row ends where an operand is expected");
            }
            if (next.isOperator() && PREFIX_GLYPHS.contains(next.glyph())) {
                pos++;
                Operator op = Operator.forGlyph(next.glyph());
                UnaryOperator sign = op == null ? UnaryOperator.NOT : UnaryOperator.prefixFor(op);
                if (sign == null) {
                    throw invalid("operator '" + next.glyph() + "' cannot be used as a prefix");
                }
                return new UnaryOp(sign, parseExpression(Precedence.IMPLICIT));
            }
            return parsePostfix(parsePrimary());
        }

        private MathNode parsePostfix(MathNode operand) {
            MathNode result = operand;
            while (!atEnd() && peek().isOperator()) {
                String glyph = peek().glyph();
                if (glyph.equals("!")) {
                    result = new UnaryOp(UnaryOperator.FACTORIAL, result);
                } else if (glyph.equals("′") || glyph.equals("'")) {
                    result = new UnaryOp(UnaryOperator.PRIME, result);
                } else if (glyph.equals("″")) {
                    result = new UnaryOp(UnaryOperator.DOUBLE_PRIME, result);
                } else {
                    break;
                }
                pos++;
            }
            return result;
        }

        private MathNode parsePrimary() {
            Item item = items.get(pos++);
            if (!item.isOperator()) {
                return attachTail(item.node());
            }
            BigOperatorKind big = BigOperatorKind.forGlyph(item.glyph());
            if (big != null) {
                return attachTail(new BigOperator(big, null, null, new Empty()));
            }
            Delimiter open = openingFence(item.glyph());
            if (open != null) {
                return parseFence(open);
            }
            if (registry.spokenGlyph(item.glyph()) != null && Operator.forGlyph(item.glyph()) == null) {
                return Identifier.of(item.glyph());
            }
            throw invalid("unexpected operator '" + item.glyph() + "'");
        }

        /** Gives a bare function its argument and a big operator its body from the rest of the row. */
        private MathNode attachTail(MathNode node) {
            if (node instanceof BigOperator big && big.body() instanceof Empty) {
                MathNode body = !atEnd() && startsOperand(peek()) ? parseExpression(Precedence.MULTIPLICATIVE) : new Empty();
                return new BigOperator(big.kind(), big.lower(), big.upper(), body);
            }
            if (isPendingFunction(node) && !atEnd() && startsOperand(peek())) {
                return withArguments(node, functionArguments());
            }
            return node;
        }

        private boolean isPendingFunction(MathNode node) {
            if (node instanceof FunctionCall call) {
                return call.kind() == FunctionKind.NAMED && call.args().isEmpty();
            }
            if (node instanceof Power power) {
                return isPendingFunction(power.base());
            }
            if (node instanceof Sub sub) {
                return isPendingFunction(sub.base());
            }
            return node instanceof SubSup subSup && isPendingFunction(subSup.base());
        }

        private List<MathNode> functionArguments() {
            Item next = peek();
            if (next.is("(")) {
                pos++;
                MathNode fence = parseFence(Delimiter.LEFT_PAREN);
                if (fence instanceof Delimited delimited && delimited.close() == Delimiter.RIGHT_PAREN) {
                    MathNode inner = delimited.inner();
                    if (inner instanceof Sequence list) {
                        return list.items();
                    }
                    return inner instanceof Empty ? List.of() : List.of(inner);
                }
                return List.of(fence);
            }
            MathNode argument = parsePostfix(parseArgumentPrimary());
            while (!atEnd() && startsOperand(peek()) && !startsFunctionOrBigOperator(peek())) {
                if (peek().is(INVISIBLE_TIMES)) {
                    pos++;
                }
                argument = new BinaryOp(Operator.IMPLICIT_TIMES, argument, parsePostfix(parsePrimary()));
            }
            return List.of(argument);
        }

        private MathNode parseArgumentPrimary() {
            if (peek().is(INVISIBLE_TIMES)) {
                pos++;
            }
            return parsePrimary();
        }

        private boolean startsFunctionOrBigOperator(Item item) {
            if (item.isOperator()) {
                return BigOperatorKind.forGlyph(item.glyph()) != null;
            }
            return item.node() instanceof BigOperator || isPendingFunction(item.node());
        }

        private MathNode withArguments(MathNode node, List<MathNode> args) {
            if (node instanceof FunctionCall call) {
                return new FunctionCall(call.name(), call.kind(), args);
            }
            if (node instanceof Power power) {
                return new Power(withArguments(power.base(), args), power.exponent());
            }
            if (node instanceof Sub sub) {
                return new Sub(withArguments(sub.base(), args), sub.subscript());
            }
            SubSup subSup = (SubSup) node;
            return new SubSup(withArguments(subSup.base(), args), subSup.subscript(), subSup.exponent());
        }

        /**
         * Reads a fenced group whose opener was just consumed. Parentheses and brackets may be
         * mixed for intervals; a brace with no closer around a table is a piecewise definition.
         */
        private MathNode parseFence(Delimiter open) {
            int close = findCloser(open);
            if (close < 0) {
                if (open == Delimiter.LEFT_BRACE && pos == items.size() - 1
                        && items.get(pos).node() instanceof Matrix table) {
                    pos++;
                    return new Matrix(table.rows(), EnvironmentKind.CASES);
                }
                throw invalid("fence '" + open.glyph() + "' is never closed");
            }
            List<Item> inside = items.subList(pos, close);
            Delimiter closer = Delimiter.forGlyph(items.get(close).glyph());
            pos = close + 1;
            MathNode inner = inside.isEmpty() ? new Empty() : new RowParser(new ArrayList<>(inside)).parseAll();
            if (inner instanceof Matrix table && table.kind() == EnvironmentKind.MATRIX) {
                return fencedTable(open, closer, table);
            }
            return new Delimited(open, closer, inner);
        }

        private int findCloser(Delimiter open) {
            boolean bar = open == Delimiter.VERTICAL_BAR || open == Delimiter.DOUBLE_BAR;
            int depth = 0;
            for (int i = pos; i < items.size(); i++) {
                Item item = items.get(i);
                if (!item.isOperator()) {
                    continue;
                }
                Delimiter d = Delimiter.forGlyph(item.glyph());
                if (d == null || d == Delimiter.NONE || Operator.forGlyph(item.glyph()) != null) {
                    continue;
                }
                if (bar) {
                    if (d == open && depth == 0) {
                        return i;
                    }
                } else if (d == Delimiter.VERTICAL_BAR || d == Delimiter.DOUBLE_BAR) {
                    continue;
                } else if (d.canOpen() && !d.canClose()) {
                    depth++;
                    continue;
                } else if (depth == 0 && open.acceptsCloser(d)) {
                    return i;
                }
                if (d.canClose() && !d.canOpen()) {
                    depth--;
                }
            }
            return -1;
        }
    }

    private static Delimiter openingFence(String glyph) {
        Delimiter fence = Delimiter.forGlyph(glyph);
        if (fence == null || fence == Delimiter.NONE || !fence.canOpen() || Operator.forGlyph(glyph) != null) {
            return null;
        }
        return fence;
    }

    private static MathNode fencedTable(Delimiter open, Delimiter close, Matrix table) {
        if (open == Delimiter.LEFT_BRACE && close == Delimiter.NONE) {
            return new Matrix(table.rows(), EnvironmentKind.CASES);
        }
        return new Matrix(table.rows(), EnvironmentKind.matrixFencedBy(open));
    }

    /** Turns parser diagnostics into exceptions instead of printing them to stderr. */
    private static final class FailingErrorHandler implements ErrorHandler {

        @Override
        public void warning(SAXParseException exception) {
            LOG.debug("MathML parser warning at line {}: {}", exception.getLineNumber(), exception.getMessage());
        }

        @Override
        public void error(SAXParseException exception) throws SAXException {
            throw exception;
        }

        @Override
        public void fatalError(SAXParseException exception) throws SAXException {
            throw exception;
        }
    }
}
