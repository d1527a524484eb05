package com.phillippitts.mathwords.service.latex;

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
import com.phillippitts.mathwords.exception.ParseErrorKind;
import com.phillippitts.mathwords.exception.ParseException;
import com.phillippitts.mathwords.service.registry.BigOperatorKind;
import com.phillippitts.mathwords.service.registry.CommandDescriptor;
import com.phillippitts.mathwords.service.registry.CommandRegistry;
import com.phillippitts.mathwords.service.registry.CommandRole;
import com.phillippitts.mathwords.service.registry.Delimiter;
import com.phillippitts.mathwords.service.registry.EnvironmentKind;
import com.phillippitts.mathwords.service.registry.MathFont;
import com.phillippitts.mathwords.service.registry.Operator;
import com.phillippitts.mathwords.service.registry.Precedence;
import com.phillippitts.mathwords.service.registry.UnaryOperator;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;

/**
 * Precedence-climbing parser from LaTeX tokens to a {@link MathNode} tree.
 *
 * <p>Binding, loosest first: comma lists, {@code \mid}, implications, logical connectives,
 * relations, additive, multiplicative, implicit multiplication, prefix signs, then scripts and postfix
 * marks on a primary. Command arguments follow the LaTeX convention of a brace group or a
 * single token, so {@code \frac12} reads as one half.
 *
 * <p>Every construct must resolve through the {@link CommandRegistry}; anything else is a
 * {@link ParseException}. No best-effort guesses are emitted.
 *
 * <p>The parser itself is stateless; each call runs in its own {@link Session}.
 */
@Component
public class LatexParser {

    /** Recursion guard against pathological nesting. */
    static final int MAX_DEPTH = 400;

    private static final Set<String> APPLIED_FUNCTION_LETTERS = Set.of("f", "g", "h");

    private static final Set<String> TEXT_MODE_COMMANDS = Set.of(
            "text", "textrm", "textit", "textbf", "textsf", "texttt", "textnormal", "mbox", "hbox");

    private final CommandRegistry registry;
    private final LatexLexer lexer;

    public LatexParser(CommandRegistry registry, LatexLexer lexer) {
        this.registry = registry;
        this.lexer = lexer;
    }

    /**
     * Tokenizes and parses LaTeX source.
     *
     * @param source LaTeX math source
     * @return expression tree
     * @throws ParseException with {@link ParseErrorKind#EMPTY_INPUT} for blank input, or any other
     *         structural failure
     * @throws com.phillippitts.mathwords.exception.LexException on invalid characters
     */
    public MathNode parse(String source) {
        if (source == null || source.isBlank()) {
            throw new ParseException(ParseErrorKind.EMPTY_INPUT, 0, "expression is empty");
        }
        return parse(lexer.tokenize(source));
    }

    /**
     * Parses a token stream produced by {@link LatexLexer}.
     *
     * @param tokens tokens terminated by {@link TokenType#EOF}
     * @return expression tree
     * @throws ParseException on any structural failure
     */
    public MathNode parse(List<Token> tokens) {
        return new Session(stripLayout(tokens)).parseTop();
    }

    /**
     * Drops spacing commands, size modifiers that are not {@code \left}/{@code \right}/{@code \middle},
     * and commands whose argument carries no content ({@code \label{...}}).
     */
    private List<Token> stripLayout(List<Token> tokens) {
        List<Token> kept = new ArrayList<>(tokens.size());
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (!token.is(TokenType.COMMAND)) {
                kept.add(token);
                continue;
            }
            CommandDescriptor descriptor = registry.find(token.text()).orElse(null);
            if (descriptor == null) {
                kept.add(token);
            } else if (descriptor.role() == CommandRole.SPACING) {
                continue;
            } else if (descriptor.role() == CommandRole.SIZING && !isFenceSizing(token.text())) {
                continue;
            } else if (descriptor.role() == CommandRole.DISCARD) {
                i = skipBraceGroup(tokens, i + 1, token);
            } else {
                kept.add(token);
            }
        }
        if (kept.isEmpty() || !kept.get(kept.size() - 1).is(TokenType.EOF)) {
            int end = tokens.isEmpty() ? 0 : tokens.get(tokens.size() - 1).position();
            kept.add(new Token(TokenType.EOF, "", end));
        }
        return kept;
    }

    private static boolean isFenceSizing(String name) {
        return "left".equals(name) || "right".equals(name) || "middle".equals(name);
    }

    /** @return index of the closing brace of the group starting at {@code open} */
    private static int skipBraceGroup(List<Token> tokens, int open, Token command) {
        if (open >= tokens.size() || !tokens.get(open).is(TokenType.OPEN_BRACE)) {
            throw new ParseException(ParseErrorKind.MISSING_ARGUMENT, command.position(),
                    "\\" + command.text() + " expects a braced argument");
        }
        int depth = 0;
        for (int i = open; i < tokens.size(); i++) {
            if (tokens.get(i).is(TokenType.OPEN_BRACE)) {
                depth++;
            } else if (tokens.get(i).is(TokenType.CLOSE_BRACE)) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        throw new ParseException(ParseErrorKind.MISSING_ARGUMENT, command.position(),
                "unterminated argument of \\" + command.text());
    }

    /** Parser state for a single call. */
    private final class Session {

        private final List<Token> tokens;
        private final Deque<Delimiter> fences = new ArrayDeque<>();
        private int pos;
        private int depth;
        private boolean ampersandTransparent = true;

        Session(List<Token> tokens) {
            this.tokens = new ArrayList<>(tokens);
        }

        // ---- entry -------------------------------------------------------------------------

        MathNode parseTop() {
            if (peek().is(TokenType.EOF)) {
                throw new ParseException(ParseErrorKind.EMPTY_INPUT, 0, "expression contains no math");
            }
            List<MathNode> lines = new ArrayList<>();
            while (true) {
                if (!peek().is(TokenType.ROW_SEPARATOR) && !peek().is(TokenType.EOF)) {
                    lines.add(parseSequence());
                }
                if (peek().is(TokenType.ROW_SEPARATOR)) {
                    next();
                    continue;
                }
                break;
            }
            Token end = peek();
            if (!end.is(TokenType.EOF)) {
                throw unexpectedTrailing(end);
            }
            if (lines.isEmpty()) {
                throw new ParseException(ParseErrorKind.EMPTY_INPUT, 0, "expression contains no math");
            }
            if (lines.stream().allMatch(MathNode::isBlank)) {
                throw new ParseException(ParseErrorKind.EMPTY_INPUT, 0, "expression has no spoken content");
            }
            if (lines.size() == 1) {
                return lines.get(0);
            }
            List<List<MathNode>> rows = new ArrayList<>();
            for (MathNode line : lines) {
                rows.add(List.of(line));
            }
            return new Matrix(rows, EnvironmentKind.LINES);
        }

        private ParseException unexpectedTrailing(Token token) {
            if (token.is(TokenType.CLOSE_BRACE)) {
                return new ParseException(ParseErrorKind.UNBALANCED_BRACE, token.position(), "unmatched '}'");
            }
            Delimiter closer = asDelimiter(token);
            if (closer != null || token.is(TokenType.COMMAND, "right")) {
                return new ParseException(ParseErrorKind.UNBALANCED_DELIMITER, token.position(),
                        "unmatched closing delimiter " + describe(token));
            }
            if (token.is(TokenType.END_ENVIRONMENT)) {
                return new ParseException(ParseErrorKind.UNKNOWN_ENVIRONMENT, token.position(),
                        "\\end{" + token.text() + "} without matching \\begin");
            }
            return new ParseException(ParseErrorKind.UNEXPECTED_TOKEN, token.position(),
                    "unexpected " + describe(token));
        }

        // ---- lists and binary operators ----------------------------------------------------

        MathNode parseSequence() {
            MathNode first = parseExpression(Precedence.SUCH_THAT);
            if (!peek().is(TokenType.COMMA) && !peek().is(TokenType.SEMICOLON)) {
                return first;
            }
            Separator separator = peek().is(TokenType.COMMA) ? Separator.COMMA : Separator.SEMICOLON;
            List<MathNode> items = new ArrayList<>();
            items.add(first);
            while (peek().is(TokenType.COMMA) || peek().is(TokenType.SEMICOLON)) {
                next();
                Token following = peek();
                if (isTerminator(following)) {
                    break;
                }
                items.add(parseExpression(Precedence.SUCH_THAT));
            }
            return items.size() == 1 ? items.get(0) : new Sequence(items, separator);
        }

        MathNode parseExpression(int minPrecedence) {
            enter();
            try {
                MathNode left = parseUnary();
                while (true) {
                    Token token = peek();
                    OperatorMatch match = binaryOperatorAt(token);
                    if (match != null) {
                        if (match.op().precedence() < minPrecedence) {
                            break;
                        }
                        pos += match.width();
                        if (isTerminator(peek())) {
                            throw new ParseException(ParseErrorKind.UNEXPECTED_TOKEN, peek().position(),
                                    "missing right operand of " + describe(token));
                        }
                        MathNode right = parseExpression(match.op().precedence() + 1);
                        left = new BinaryOp(match.op(), left, right);
                        continue;
                    }
                    if (token.is(TokenType.OPERATOR, ".") && isTerminator(peekAt(1))) {
                        next();
                        break;
                    }
                    if (Precedence.IMPLICIT >= minPrecedence && startsOperand(token)) {
                        MathNode right = parseExpression(Precedence.IMPLICIT + 1);
                        left = new BinaryOp(Operator.IMPLICIT_TIMES, left, right);
                        continue;
                    }
                    break;
                }
                return left;
            } finally {
                leave();
            }
        }

        private OperatorMatch binaryOperatorAt(Token token) {
            if (token.is(TokenType.OPERATOR)) {
                Operator op = Operator.forGlyph(token.text());
                return op == null ? null : new OperatorMatch(op, 1);
            }
            if (!token.is(TokenType.COMMAND)) {
                return null;
            }
            CommandDescriptor descriptor = registry.find(token.text()).orElse(null);
            if (descriptor == null) {
                return null;
            }
            if (descriptor.role() == CommandRole.OPERATOR) {
                return new OperatorMatch(descriptor.payload(Operator.class), 1);
            }
            if (descriptor.role() == CommandRole.NEGATION) {
                return negatedRelation(token, peekAt(1));
            }
            if (token.is(TokenType.COMMAND, "middle")) {
                Delimiter bar = asDelimiter(peekAt(1));
                if (bar == Delimiter.VERTICAL_BAR) {
                    return new OperatorMatch(Operator.MID, 2);
                }
                throw new ParseException(ParseErrorKind.MISSING_ARGUMENT, token.position(),
                        "\\middle expects a delimiter");
            }
            return null;
        }

        private OperatorMatch negatedRelation(Token not, Token target) {
            Operator op = null;
            if (target.is(TokenType.OPERATOR)) {
                op = Operator.forGlyph(target.text());
            } else if (target.is(TokenType.COMMAND)) {
                op = registry.find(target.text())
                        .filter(d -> d.role() == CommandRole.OPERATOR)
                        .map(d -> d.payload(Operator.class))
                        .orElse(null);
            }
            if (op == Operator.EQUALS) {
                return new OperatorMatch(Operator.NOT_EQUALS, 2);
            }
            if (op == Operator.ELEMENT_OF) {
                return new OperatorMatch(Operator.NOT_ELEMENT_OF, 2);
            }
            throw new ParseException(ParseErrorKind.UNEXPECTED_TOKEN, not.position(),
                    "\\not cannot negate " + describe(target));
        }

        // ---- unary, postfix, scripts -------------------------------------------------------

        MathNode parseUnary() {
            Token token = peek();
            UnaryOperator prefix = prefixAt(token);
            if (prefix != null) {
                next();
                if (isTerminator(peek())) {
                    throw new ParseException(ParseErrorKind.UNEXPECTED_TOKEN, peek().position(),
                            "missing operand after " + describe(token));
                }
                return new UnaryOp(prefix, parseExpression(Precedence.IMPLICIT));
            }
            return parsePostfix(parsePrimary());
        }

        private UnaryOperator prefixAt(Token token) {
            if (token.is(TokenType.OPERATOR)) {
                if (token.text().equals(UnaryOperator.NOT.glyph())) {
                    return UnaryOperator.NOT;
                }
                Operator op = Operator.forGlyph(token.text());
                return op == null ? null : UnaryOperator.prefixFor(op);
            }
            if (token.is(TokenType.COMMAND)) {
                CommandDescriptor descriptor = registry.find(token.text()).orElse(null);
                if (descriptor == null) {
                    return null;
                }
                if (descriptor.role() == CommandRole.UNARY) {
                    return descriptor.payload(UnaryOperator.class);
                }
                if (descriptor.role() == CommandRole.OPERATOR) {
                    return UnaryOperator.prefixFor(descriptor.payload(Operator.class));
                }
            }
            return null;
        }

        MathNode parsePostfix(MathNode primary) {
            MathNode base = primary;
            MathNode sub = null;
            MathNode sup = null;
            while (true) {
                Token token = peek();
                if (token.is(TokenType.SUPERSCRIPT)) {
                    if (sup != null) {
                        throw new ParseException(ParseErrorKind.UNEXPECTED_TOKEN, token.position(),
                                "double superscript");
                    }
                    next();
                    sup = parseScriptArgument(token, "superscript");
                } else if (token.is(TokenType.SUBSCRIPT)) {
                    if (sub != null) {
                        throw new ParseException(ParseErrorKind.UNEXPECTED_TOKEN, token.position(),
                                "double subscript");
                    }
                    next();
                    sub = parseScriptArgument(token, "subscript");
                } else if (primeCount(token) > 0 && sup == null) {
                    base = applyScripts(base, sub, null);
                    sub = null;
                    next();
                    base = new UnaryOp(primeOperator(primeCount(token)), base);
                } else if (token.is(TokenType.OPERATOR, "!")) {
                    base = applyScripts(base, sub, sup);
                    sub = null;
                    sup = null;
                    next();
                    base = new UnaryOp(UnaryOperator.FACTORIAL, base);
                } else {
                    break;
                }
            }
            return applyScripts(base, sub, sup);
        }

        private int primeCount(Token token) {
            if (token.is(TokenType.PRIME)) {
                return token.text().length();
            }
            if (token.is(TokenType.OPERATOR)) {
                switch (token.text()) {
                    case "′":
                        return 1;
                    case "″":
                        return 2;
                    case "‴":
                        return 3;
                    default:
                        return 0;
                }
            }
            return 0;
        }

        private UnaryOperator primeOperator(int count) {
            if (count == 1) {
                return UnaryOperator.PRIME;
            }
            return count == 2 ? UnaryOperator.DOUBLE_PRIME : UnaryOperator.TRIPLE_PRIME;
        }

        private MathNode applyScripts(MathNode base, MathNode sub, MathNode sup) {
            if (sub != null && sup != null) {
                return new SubSup(base, sub, sup);
            }
            if (sup != null) {
                return new Power(base, sup);
            }
            if (sub != null) {
                return new Sub(base, sub);
            }
            return base;
        }

        /**
         * Reads the argument of {@code ^} or {@code _}: a brace group or a single token.
         * Operator glyphs become symbols here ({@code 90^\circ}, {@code A^*}, {@code x^+}).
         */
        private MathNode parseScriptArgument(Token marker, String what) {
            Token token = peek();
            if (token.is(TokenType.OPERATOR) && Operator.forGlyph(token.text()) != null
                    || token.is(TokenType.OPERATOR) && primeCount(token) > 0) {
                next();
                return Identifier.of(token.text());
            }
            if (token.is(TokenType.PRIME)) {
                next();
                return Identifier.of("′".repeat(token.text().length()));
            }
            if (token.is(TokenType.COMMAND)) {
                CommandDescriptor descriptor = registry.require(token.text(), token.position());
                if (descriptor.role() == CommandRole.OPERATOR) {
                    next();
                    return Identifier.of(descriptor.payload(Operator.class).glyph());
                }
            }
            return parseArgument(marker, what, ParseErrorKind.UNBALANCED_BRACE);
        }

        /**
         * Reads one LaTeX argument: a brace group, a single digit, a letter or one command.
         *
         * @param owner token that requires the argument (for error positions)
         * @param what description used in error messages
         * @param unterminatedKind error kind when a brace group is never closed
         */
        private MathNode parseArgument(Token owner, String what, ParseErrorKind unterminatedKind) {
            enter();
            try {
                return readArgument(owner, what, unterminatedKind);
            } finally {
                leave();
            }
        }

        private MathNode readArgument(Token owner, String what, ParseErrorKind unterminatedKind) {
            Token token = peek();
            switch (token.type()) {
                case OPEN_BRACE:
                    next();
                    return parseGroupContent(token, unterminatedKind);
                case NUMBER:
                    return takeDigit(token);
                case IDENTIFIER:
                    next();
                    return Identifier.of(token.text());
                case COMMAND:
                    CommandDescriptor descriptor = registry.require(token.text(), token.position());
                    if (descriptor.role() == CommandRole.SYMBOL) {
                        next();
                        return Identifier.of(descriptor.glyph());
                    }
                    if (descriptor.role() == CommandRole.OPERATOR || descriptor.role() == CommandRole.SIZING
                            || descriptor.role() == CommandRole.NEGATION) {
                        break;
                    }
                    return parseCommand(token, descriptor);
                case OPERATOR:
                    if (isSymbolGlyph(token.text())) {
                        next();
                        return Identifier.of(token.text());
                    }
                    break;
                default:
                    break;
            }
            throw new ParseException(ParseErrorKind.MISSING_ARGUMENT, token.is(TokenType.EOF)
                    ? owner.position() : token.position(),
                    "missing " + what + " for " + describe(owner));
        }

        /** A multi-digit number used as a single-token argument contributes only its first digit. */
        private MathNode takeDigit(Token token) {
            String digits = token.text();
            if (digits.length() == 1) {
                next();
                return new NumberLiteral(digits);
            }
            tokens.set(pos, new Token(TokenType.NUMBER, digits.substring(1), token.position() + 1));
            return new NumberLiteral(digits.substring(0, 1));
        }

        /** Parses after an opening brace up to and including its closing brace. */
        private MathNode parseGroupContent(Token open, ParseErrorKind unterminatedKind) {
            boolean savedAmpersand = ampersandTransparent;
            ampersandTransparent = false;
            fences.push(Delimiter.NONE);
            try {
                if (peek().is(TokenType.CLOSE_BRACE)) {
                    next();
                    return new Empty();
                }
                Token single = peek();
                if (peekAt(1).is(TokenType.CLOSE_BRACE) && isLoneOperator(single)) {
                    next();
                    next();
                    return Identifier.of(glyphOf(single));
                }
                MathNode inner = parseSequence();
                Token close = peek();
                if (close.is(TokenType.CLOSE_BRACE)) {
                    next();
                    return inner;
                }
                if (close.is(TokenType.EOF)) {
                    throw new ParseException(unterminatedKind, open.position(), "unterminated '{'");
                }
                throw unexpectedInGroup(close);
            } finally {
                fences.pop();
                ampersandTransparent = savedAmpersand;
            }
        }

        private ParseException unexpectedInGroup(Token token) {
            if (asDelimiter(token) != null || token.is(TokenType.COMMAND, "right")) {
                return new ParseException(ParseErrorKind.UNBALANCED_DELIMITER, token.position(),
                        "unmatched delimiter " + describe(token));
            }
            if (token.is(TokenType.END_ENVIRONMENT)) {
                return new ParseException(ParseErrorKind.UNKNOWN_ENVIRONMENT, token.position(),
                        "\\end{" + token.text() + "} without matching \\begin");
            }
            return new ParseException(ParseErrorKind.UNEXPECTED_TOKEN, token.position(),
                    "unexpected " + describe(token) + " inside group");
        }

        private boolean isLoneOperator(Token token) {
            if (token.is(TokenType.OPERATOR)) {
                return Operator.forGlyph(token.text()) != null || primeCount(token) > 0;
            }
            if (token.is(TokenType.COMMAND)) {
                return registry.find(token.text()).map(d -> d.role() == CommandRole.OPERATOR).orElse(false);
            }
            return false;
        }

        private String glyphOf(Token token) {
            if (token.is(TokenType.COMMAND)) {
                return registry.require(token.text(), token.position()).payload(Operator.class).glyph();
            }
            return token.text();
        }

        // ---- primaries ---------------------------------------------------------------------

        MathNode parsePrimary() {
            Token token = peek();
            switch (token.type()) {
                case NUMBER:
                    next();
                    return new NumberLiteral(token.text());
                case IDENTIFIER:
                    next();
                    if (APPLIED_FUNCTION_LETTERS.contains(token.text()) && nextIsOpenParen()) {
                        return new FunctionCall(token.text(), FunctionKind.APPLIED, parseParenArguments());
                    }
                    return Identifier.of(token.text());
                case OPEN_BRACE: {
                    next();
                    MathNode inner = parseGroupContent(token, ParseErrorKind.UNBALANCED_BRACE);
                    return inner instanceof Empty ? inner : new Group(inner);
                }
                case CLOSE_BRACE:
                    throw new ParseException(ParseErrorKind.UNBALANCED_BRACE, token.position(), "unmatched '}'");
                case DELIMITER: {
                    Delimiter delimiter = Delimiter.forGlyph(token.text());
                    if (delimiter != null && opensFence(delimiter)) {
                        next();
                        return parseFenced(token, delimiter, false);
                    }
                    throw new ParseException(ParseErrorKind.UNBALANCED_DELIMITER, token.position(),
                            "unmatched closing delimiter '" + token.text() + "'");
                }
                case COMMAND:
                    return parseCommand(token, registry.require(token.text(), token.position()));
                case BEGIN_ENVIRONMENT:
                    next();
                    return parseEnvironment(token);
                case END_ENVIRONMENT:
                    throw new ParseException(ParseErrorKind.UNKNOWN_ENVIRONMENT, token.position(),
                            "\\end{" + token.text() + "} without matching \\begin");
                case SUPERSCRIPT:
                case SUBSCRIPT:
                    // bare script such as "{}^{14}C" or a leading "^2"
                    return new Empty();
                case OPERATOR: {
                    BigOperatorKind big = BigOperatorKind.forGlyph(token.text());
                    if (big != null) {
                        next();
                        return parseBigOperator(big);
                    }
                    if (isSymbolGlyph(token.text())) {
                        next();
                        return Identifier.of(token.text());
                    }
                    throw new ParseException(ParseErrorKind.UNEXPECTED_TOKEN, token.position(),
                            "unexpected " + describe(token));
                }
                case EOF:
                    throw new ParseException(ParseErrorKind.UNEXPECTED_TOKEN, token.position(),
                            "unexpected end of input");
                default:
                    throw new ParseException(ParseErrorKind.UNEXPECTED_TOKEN, token.position(),
                            "unexpected " + describe(token));
            }
        }

        private MathNode parseCommand(Token token, CommandDescriptor descriptor) {
            switch (descriptor.role()) {
                case SYMBOL:
                    next();
                    return Identifier.of(descriptor.glyph());
                case FUNCTION:
                    next();
                    return parseFunctionTail(token.text());
                case BIG_OPERATOR:
                    next();
                    return parseBigOperator(descriptor.payload(BigOperatorKind.class));
                case FRACTION: {
                    next();
                    MathNode numerator = parseArgument(token, "numerator", ParseErrorKind.MISSING_ARGUMENT);
                    MathNode denominator = parseArgument(token, "denominator", ParseErrorKind.MISSING_ARGUMENT);
                    return new Fraction(numerator, denominator);
                }
                case BINOMIAL: {
                    next();
                    MathNode n = parseArgument(token, "first argument", ParseErrorKind.MISSING_ARGUMENT);
                    MathNode k = parseArgument(token, "second argument", ParseErrorKind.MISSING_ARGUMENT);
                    return new FunctionCall(token.text(), FunctionKind.BINOMIAL, List.of(n, k));
                }
                case ROOT:
                    next();
                    return parseRoot(token);
                case ACCENT: {
                    next();
                    MathNode operand = parseArgument(token, "argument", ParseErrorKind.MISSING_ARGUMENT);
                    return new UnaryOp(descriptor.payload(UnaryOperator.class), operand);
                }
                case FONT: {
                    next();
                    MathNode operand = parseArgument(token, "argument", ParseErrorKind.MISSING_ARGUMENT);
                    return applyFont(operand, descriptor.payload(MathFont.class));
                }
                case TEXT:
                    next();
                    return parseText(token);
                case DELIMITER: {
                    Delimiter delimiter = descriptor.payload(Delimiter.class);
                    if (!opensFence(delimiter)) {
                        throw new ParseException(ParseErrorKind.UNBALANCED_DELIMITER, token.position(),
                                "unmatched closing delimiter " + describe(token));
                    }
                    next();
                    return parseFenced(token, delimiter, false);
                }
                case SIZING:
                    if ("left".equals(token.text())) {
                        next();
                        Delimiter open = expectSizedDelimiter(token);
                        return parseFenced(token, open, true);
                    }
                    throw new ParseException(ParseErrorKind.UNBALANCED_DELIMITER, token.position(),
                            "\\" + token.text() + " without matching \\left");
                case UNARY:
                case OPERATOR:
                case NEGATION:
                    throw new ParseException(ParseErrorKind.UNEXPECTED_TOKEN, token.position(),
                            "operator " + describe(token) + " is missing its left operand");
                case SPACING:
                case DISCARD:
                    throw new IllegalStateException("layout command reached the parser: \\" + token.text());
                case ENVIRONMENT:
                    throw new ParseException(ParseErrorKind.MISSING_ARGUMENT, token.position(),
                            "\\" + token.text() + " expects a braced environment name");
                default:
                    throw new IllegalStateException("unhandled command role " + descriptor.role());
            }
        }

        // ---- functions and big operators ---------------------------------------------------

        /**
         * Reads scripts and the argument of a named function. A subscript on max/min/sup/inf
         * turns the function into a limit-like big operator.
         */
        private MathNode parseFunctionTail(String name) {
            MathNode sub = null;
            MathNode sup = null;
            while (peek().is(TokenType.SUPERSCRIPT) || peek().is(TokenType.SUBSCRIPT)) {
                Token marker = next();
                if (marker.is(TokenType.SUPERSCRIPT)) {
                    if (sup != null) {
                        throw new ParseException(ParseErrorKind.UNEXPECTED_TOKEN, marker.position(),
                                "double superscript");
                    }
                    sup = parseScriptArgument(marker, "superscript");
                } else {
                    if (sub != null) {
                        throw new ParseException(ParseErrorKind.UNEXPECTED_TOKEN, marker.position(),
                                "double subscript");
                    }
                    sub = parseScriptArgument(marker, "subscript");
                }
            }
            BigOperatorKind limitLike = BigOperatorKind.forScriptedFunction(name);
            if (sub != null && limitLike != null) {
                return new BigOperator(limitLike, sub, sup, parseBigOperatorBody());
            }
            FunctionKind kind = registry.isFunction(name) ? FunctionKind.NAMED : FunctionKind.TEXT;
            FunctionCall call = new FunctionCall(name, kind, parseFunctionArguments());
            return applyScripts(call, sub, sup);
        }

        private List<MathNode> parseFunctionArguments() {
            if (nextIsOpenParen()) {
                return parseParenArguments();
            }
            Token token = peek();
            if (!startsOperand(token) && prefixAt(token) == null) {
                return List.of();
            }
            if (isFunctionOrBigOperator(token)) {
                return List.of(parseUnary());
            }
            MathNode argument = parseUnary();
            while (startsOperand(peek()) && !isFunctionOrBigOperator(peek())) {
                argument = new BinaryOp(Operator.IMPLICIT_TIMES, argument, parseUnary());
            }
            return List.of(argument);
        }

        private List<MathNode> parseParenArguments() {
            Token open = peek();
            MathNode fenced;
            if (open.is(TokenType.COMMAND, "left")) {
                next();
                fenced = parseFenced(open, expectSizedDelimiter(open), true);
            } else {
                next();
                fenced = parseFenced(open, Delimiter.LEFT_PAREN, false);
            }
            MathNode inner = ((Delimited) fenced).inner();
            if (inner instanceof Empty) {
                return List.of();
            }
            if (inner instanceof Sequence sequence && sequence.separator() == Separator.COMMA) {
                return sequence.items();
            }
            return List.of(inner);
        }

        private MathNode parseBigOperator(BigOperatorKind kind) {
            MathNode lower = null;
            MathNode upper = null;
            while (peek().is(TokenType.SUPERSCRIPT) || peek().is(TokenType.SUBSCRIPT)) {
                Token marker = next();
                if (marker.is(TokenType.SUBSCRIPT)) {
                    if (lower != null) {
                        throw new ParseException(ParseErrorKind.UNEXPECTED_TOKEN, marker.position(),
                                "double subscript");
                    }
                    lower = parseScriptArgument(marker, "lower bound");
                } else {
                    if (upper != null) {
                        throw new ParseException(ParseErrorKind.UNEXPECTED_TOKEN, marker.position(),
                                "double superscript");
                    }
                    upper = parseScriptArgument(marker, "upper bound");
                }
            }
            return new BigOperator(kind, lower, upper, parseBigOperatorBody());
        }

        private MathNode parseBigOperatorBody() {
            Token token = peek();
            if (!startsOperand(token) && prefixAt(token) == null) {
                return new Empty();
            }
            return parseExpression(Precedence.MULTIPLICATIVE);
        }

        private MathNode parseRoot(Token sqrt) {
            MathNode degree = null;
            if (peek().is(TokenType.DELIMITER, "[")) {
                Token open = next();
                fences.push(Delimiter.LEFT_BRACKET);
                try {
                    degree = parseSequence();
                } finally {
                    fences.pop();
                }
                if (!peek().is(TokenType.DELIMITER, "]")) {
                    throw new ParseException(ParseErrorKind.MISSING_ARGUMENT, open.position(),
                            "unterminated optional argument of \\sqrt");
                }
                next();
            }
            MathNode radicand = parseArgument(sqrt, "radicand", ParseErrorKind.MISSING_ARGUMENT);
            return new Root(degree, radicand);
        }

        // ---- text runs ---------------------------------------------------------------------

        private MathNode parseText(Token command) {
            String name = command.text();
            if (TEXT_MODE_COMMANDS.contains(name)) {
                Token text = peek();
                if (!text.is(TokenType.TEXT)) {
                    throw new ParseException(ParseErrorKind.MISSING_ARGUMENT, command.position(),
                            "\\" + name + " expects a braced argument");
                }
                next();
                String run = cleanText(text.text());
                if (run.isEmpty()) {
                    return new Empty();
                }
                return textRun(run);
            }
            Token open = peek();
            if (!open.is(TokenType.OPEN_BRACE)) {
                throw new ParseException(ParseErrorKind.MISSING_ARGUMENT, command.position(),
                        "\\" + name + " expects a braced argument");
            }
            String letters = plainRun();
            if (letters == null) {
                next();
                return parseGroupContent(open, ParseErrorKind.MISSING_ARGUMENT);
            }
            if (registry.isFunction(letters)) {
                return parseFunctionTail(letters);
            }
            return textRun(letters);
        }

        /**
         * If the brace group at the cursor holds only letters and digits, consumes it and
         * returns them joined; otherwise leaves the cursor alone and returns null.
         */
        private String plainRun() {
            StringBuilder run = new StringBuilder();
            int i = pos + 1;
            while (i < tokens.size()) {
                Token token = tokens.get(i);
                if (token.is(TokenType.CLOSE_BRACE)) {
                    if (run.length() == 0) {
                        return null;
                    }
                    pos = i + 1;
                    return run.toString();
                }
                if (!token.is(TokenType.IDENTIFIER) && !token.is(TokenType.NUMBER)) {
                    return null;
                }
                run.append(token.text());
                i++;
            }
            return null;
        }

        private MathNode textRun(String run) {
            BigOperatorKind limitLike = BigOperatorKind.forScriptedFunction(run);
            if (limitLike != null && peek().is(TokenType.SUBSCRIPT)) {
                return parseFunctionTail(run);
            }
            if (nextIsOpenParen()) {
                return new FunctionCall(run, FunctionKind.TEXT, parseParenArguments());
            }
            return new FunctionCall(run, FunctionKind.TEXT, List.of());
        }

        private String cleanText(String raw) {
            String text = raw.replace("\\ ", " ")
                    .replace("\\,", " ")
                    .replace("\\;", " ")
                    .replace("\\quad", " ")
                    .replace("~", " ")
                    .replace("$", "")
                    .replace("{", "")
                    .replace("}", "");
            return text.replaceAll("\\s+", " ").trim();
        }

        // ---- fences ------------------------------------------------------------------------

        private MathNode parseFenced(Token openToken, Delimiter open, boolean sized) {
            boolean savedAmpersand = ampersandTransparent;
            ampersandTransparent = false;
            fences.push(open);
            MathNode inner;
            try {
                inner = isFenceClose(peek(), open, sized) ? new Empty() : parseSequence();
            } finally {
                fences.pop();
                ampersandTransparent = savedAmpersand;
            }
            Token close = peek();
            if (sized) {
                if (!close.is(TokenType.COMMAND, "right")) {
                    throw new ParseException(ParseErrorKind.UNBALANCED_DELIMITER,
                            close.is(TokenType.EOF) ? openToken.position() : close.position(),
                            "\\left" + open.glyph() + " without matching \\right");
                }
                next();
                return new Delimited(open, expectSizedDelimiter(close), inner);
            }
            Delimiter closer = asDelimiter(close);
            if (closer != null && closer.canClose() && open.acceptsCloser(closer)) {
                next();
                return new Delimited(open, closer, inner);
            }
            throw new ParseException(ParseErrorKind.UNBALANCED_DELIMITER,
                    close.is(TokenType.EOF) ? openToken.position() : close.position(),
                    "unclosed '" + open.glyph() + "'");
        }

        private boolean isFenceClose(Token token, Delimiter open, boolean sized) {
            if (sized) {
                return token.is(TokenType.COMMAND, "right");
            }
            Delimiter closer = asDelimiter(token);
            return closer != null && closer.canClose() && open.acceptsCloser(closer);
        }

        private Delimiter expectSizedDelimiter(Token sizing) {
            Token token = peek();
            Delimiter delimiter = token.is(TokenType.OPERATOR, ".") ? Delimiter.NONE : asDelimiter(token);
            if (delimiter == null) {
                throw new ParseException(ParseErrorKind.MISSING_ARGUMENT, sizing.position(),
                        "\\" + sizing.text() + " expects a delimiter");
            }
            next();
            return delimiter;
        }

        private Delimiter asDelimiter(Token token) {
            if (token.is(TokenType.DELIMITER)) {
                return Delimiter.forGlyph(token.text());
            }
            if (token.is(TokenType.COMMAND)) {
                return registry.find(token.text())
                        .filter(d -> d.role() == CommandRole.DELIMITER)
                        .map(d -> d.payload(Delimiter.class))
                        .orElse(null);
            }
            return null;
        }

        /** Bars open a fence unless the innermost open fence is the same bar. */
        private boolean opensFence(Delimiter delimiter) {
            if (!delimiter.canOpen()) {
                return false;
            }
            if (!delimiter.canClose()) {
                return true;
            }
            return fences.isEmpty() || fences.peek() != delimiter;
        }

        private boolean nextIsOpenParen() {
            Token token = peek();
            if (token.is(TokenType.DELIMITER, "(")) {
                return true;
            }
            return token.is(TokenType.COMMAND, "left") && peekAt(1).is(TokenType.DELIMITER, "(");
        }

        // ---- environments ------------------------------------------------------------------

        private MathNode parseEnvironment(Token begin) {
            String name = begin.text();
            EnvironmentKind kind = registry.environment(name).orElseThrow(() ->
                    new ParseException(ParseErrorKind.UNKNOWN_ENVIRONMENT, begin.position(),
                            "unknown environment '" + name + "'"));
            if (kind.takesColumnSpec()) {
                skipColumnSpec(begin);
            }
            boolean savedAmpersand = ampersandTransparent;
            ampersandTransparent = kind.layout() == EnvironmentKind.Layout.LINES;
            fences.push(Delimiter.NONE);
            List<List<MathNode>> rows = new ArrayList<>();
            try {
                List<MathNode> cells = new ArrayList<>();
                while (true) {
                    Token token = peek();
                    boolean emptyCell = token.is(TokenType.AMPERSAND) || token.is(TokenType.ROW_SEPARATOR)
                            || token.is(TokenType.END_ENVIRONMENT);
                    cells.add(emptyCell ? new Empty() : parseSequence());
                    Token after = peek();
                    if (after.is(TokenType.AMPERSAND)) {
                        next();
                    } else if (after.is(TokenType.ROW_SEPARATOR)) {
                        next();
                        addRow(rows, cells);
                        cells = new ArrayList<>();
                        if (peek().is(TokenType.END_ENVIRONMENT)) {
                            break;
                        }
                    } else if (after.is(TokenType.END_ENVIRONMENT)) {
                        addRow(rows, cells);
                        break;
                    } else if (after.is(TokenType.EOF)) {
                        throw new ParseException(ParseErrorKind.UNKNOWN_ENVIRONMENT, begin.position(),
                                "\\begin{" + name + "} is never closed");
                    } else {
                        throw unexpectedInGroup(after);
                    }
                }
            } finally {
                fences.pop();
                ampersandTransparent = savedAmpersand;
            }
            Token end = next();
            if (!end.text().equals(name)) {
                throw new ParseException(ParseErrorKind.UNKNOWN_ENVIRONMENT, end.position(),
                        "\\begin{" + name + "} closed by \\end{" + end.text() + "}");
            }
            if (rows.isEmpty()) {
                return new Empty();
            }
            if (kind.layout() == EnvironmentKind.Layout.LINES && rows.size() == 1 && rows.get(0).size() == 1) {
                return rows.get(0).get(0);
            }
            return new Matrix(rows, kind);
        }

        private void addRow(List<List<MathNode>> rows, List<MathNode> cells) {
            if (cells.stream().allMatch(cell -> cell instanceof Empty)) {
                return;
            }
            rows.add(List.copyOf(cells));
        }

        private void skipColumnSpec(Token begin) {
            if (!peek().is(TokenType.OPEN_BRACE)) {
                throw new ParseException(ParseErrorKind.MISSING_ARGUMENT, begin.position(),
                        "\\begin{" + begin.text() + "} expects a column specification");
            }
            int depth = 0;
            while (!peek().is(TokenType.EOF)) {
                Token token = next();
                if (token.is(TokenType.OPEN_BRACE)) {
                    depth++;
                } else if (token.is(TokenType.CLOSE_BRACE)) {
                    depth--;
                    if (depth == 0) {
                        return;
                    }
                }
            }
            throw new ParseException(ParseErrorKind.MISSING_ARGUMENT, begin.position(),
                    "unterminated column specification");
        }

        // ---- token classification ----------------------------------------------------------

        private boolean startsOperand(Token token) {
            switch (token.type()) {
                case NUMBER:
                case IDENTIFIER:
                case OPEN_BRACE:
                case BEGIN_ENVIRONMENT:
                    return true;
                case DELIMITER: {
                    Delimiter delimiter = Delimiter.forGlyph(token.text());
                    return delimiter != null && opensFence(delimiter);
                }
                case OPERATOR:
                    return BigOperatorKind.forGlyph(token.text()) != null || isSymbolGlyph(token.text());
                case COMMAND: {
                    CommandDescriptor descriptor = registry.find(token.text()).orElse(null);
                    if (descriptor == null) {
                        // unknown commands are surfaced by parsePrimary
                        return true;
                    }
                    switch (descriptor.role()) {
                        case SYMBOL:
                        case FUNCTION:
                        case BIG_OPERATOR:
                        case FRACTION:
                        case BINOMIAL:
                        case ROOT:
                        case ACCENT:
                        case FONT:
                        case TEXT:
                        case UNARY:
                        case ENVIRONMENT:
                            return true;
                        case DELIMITER:
                            return opensFence(descriptor.payload(Delimiter.class));
                        case SIZING:
                            return "left".equals(token.text());
                        case OPERATOR:
                        case NEGATION:
                        case SPACING:
                        case DISCARD:
                            return false;
                        default:
                            throw new IllegalStateException("unhandled command role " + descriptor.role());
                    }
                }
                default:
                    return false;
            }
        }

        private boolean isFunctionOrBigOperator(Token token) {
            if (token.is(TokenType.OPERATOR)) {
                return BigOperatorKind.forGlyph(token.text()) != null;
            }
            if (!token.is(TokenType.COMMAND)) {
                return false;
            }
            return registry.find(token.text())
                    .map(d -> d.role() == CommandRole.FUNCTION || d.role() == CommandRole.BIG_OPERATOR)
                    .orElse(false);
        }

        /** Letter-like Unicode glyph such as ∞, α or ℝ that is neither an operator nor a postfix mark. */
        private boolean isSymbolGlyph(String glyph) {
            if (Operator.forGlyph(glyph) != null) {
                return false;
            }
            for (UnaryOperator op : UnaryOperator.values()) {
                if (op.glyph().equals(glyph)) {
                    return op == UnaryOperator.NOT;
                }
            }
            return registry.spokenGlyph(glyph) != null;
        }

        private boolean isTerminator(Token token) {
            switch (token.type()) {
                case EOF:
                case CLOSE_BRACE:
                case ROW_SEPARATOR:
                case AMPERSAND:
                case END_ENVIRONMENT:
                case COMMA:
                case SEMICOLON:
                    return true;
                case DELIMITER: {
                    Delimiter delimiter = Delimiter.forGlyph(token.text());
                    return delimiter != null && !opensFence(delimiter);
                }
                case COMMAND:
                    return token.is(TokenType.COMMAND, "right");
                default:
                    return false;
            }
        }

        private String describe(Token token) {
            switch (token.type()) {
                case COMMAND:
                    return "\\" + token.text();
                case EOF:
                    return "end of input";
                case BEGIN_ENVIRONMENT:
                    return "\\begin{" + token.text() + "}";
                case END_ENVIRONMENT:
                    return "\\end{" + token.text() + "}";
                case ROW_SEPARATOR:
                    return "row separator '\\\\'";
                default:
                    return "'" + token.text() + "'";
            }
        }

        // ---- cursor ------------------------------------------------------------------------

        private Token peek() {
            Token token = tokens.get(pos);
            while (ampersandTransparent && token.is(TokenType.AMPERSAND)) {
                pos++;
                token = tokens.get(pos);
            }
            return token;
        }

        private Token peekAt(int offset) {
            peek();
            int index = Math.min(pos + offset, tokens.size() - 1);
            return tokens.get(index);
        }

        private Token next() {
            Token token = peek();
            if (!token.is(TokenType.EOF)) {
                pos++;
            }
            return token;
        }

        private void enter() {
            if (++depth > MAX_DEPTH) {
                throw new ParseException(ParseErrorKind.UNEXPECTED_TOKEN, peek().position(),
                        "expression is nested too deeply");
            }
        }

        private void leave() {
            depth--;
        }
    }

    private static MathNode applyFont(MathNode node, MathFont font) {
        if (node instanceof Identifier identifier) {
            return new Identifier(identifier.name(), font);
        }
        if (node instanceof BinaryOp binary) {
            return new BinaryOp(binary.op(), applyFont(binary.left(), font), applyFont(binary.right(), font));
        }
        if (node instanceof Group group) {
            return new Group(applyFont(group.inner(), font));
        }
        if (node instanceof Sub sub) {
            return new Sub(applyFont(sub.base(), font), sub.subscript());
        }
        if (node instanceof Power power) {
            return new Power(applyFont(power.base(), font), power.exponent());
        }
        if (node instanceof SubSup subSup) {
            return new SubSup(applyFont(subSup.base(), font), subSup.subscript(), subSup.exponent());
        }
        if (node instanceof UnaryOp unary) {
            return new UnaryOp(unary.op(), applyFont(unary.operand(), font));
        }
        return node;
    }

    private record OperatorMatch(Operator op, int width) {
    }
}
