package com.phillippitts.mathwords.service.latex;

import com.phillippitts.mathwords.exception.LexException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Splits LaTeX math source into a flat token stream.
 *
 * <p>Recognized: control words ({@code \alpha}) and control symbols ({@code \,}, {@code \{}),
 * {@code \begin{name}}/{@code \end{name}}, decimal numbers, single-letter identifiers,
 * operator glyphs, fences, {@code ^}, {@code _}, {@code &}, {@code \\}, and {@code %} comments
 * (dropped). Brace matching is left to the parser.
 *
 * <p>The argument of a text-mode command ({@code \text{...}}, {@code \mbox{...}}) is emitted as
 * one {@link TokenType#TEXT} token so spacing inside it survives.
 *
 * <p>Stateless and thread-safe.
 */
@Component
public class LatexLexer {

    private static final Set<String> TEXT_MODE_COMMANDS = Set.of(
            "text", "textrm", "textit", "textbf", "textsf", "texttt", "textnormal", "mbox", "hbox");

    private static final String DELIMITER_CHARS = "()[]|⟨⟩⌊⌋⌈⌉‖";

    /**
     * Tokenizes the given source.
     *
     * @param source LaTeX math source (without surrounding {@code $} delimiters)
     * @return tokens in source order, always terminated by an {@link TokenType#EOF} token
     * @throws LexException on a stray trailing backslash or a character that is invalid in math mode
     */
    public List<Token> tokenize(String source) {
        if (source == null) {
            throw new IllegalArgumentException("source must not be null");
        }
        List<Token> tokens = new ArrayList<>();
        int i = 0;
        int n = source.length();
        while (i < n) {
            int cp = source.codePointAt(i);
            int width = Character.charCount(cp);
            char c = source.charAt(i);

            if (Character.isWhitespace(cp) || c == '~') {
                i += width;
            } else if (c == '%') {
                while (i < n && source.charAt(i) != '\n') {
                    i++;
                }
            } else if (c == '\\') {
                i = lexCommand(source, i, tokens);
            } else if (c == '{') {
                tokens.add(new Token(TokenType.OPEN_BRACE, "{", i++));
            } else if (c == '}') {
                tokens.add(new Token(TokenType.CLOSE_BRACE, "}", i++));
            } else if (c == '^') {
                tokens.add(new Token(TokenType.SUPERSCRIPT, "^", i++));
            } else if (c == '_') {
                tokens.add(new Token(TokenType.SUBSCRIPT, "_", i++));
            } else if (c == '&') {
                tokens.add(new Token(TokenType.AMPERSAND, "&", i++));
            } else if (c == ',') {
                tokens.add(new Token(TokenType.COMMA, ",", i++));
            } else if (c == ';') {
                tokens.add(new Token(TokenType.SEMICOLON, ";", i++));
            } else if (c == '\'') {
                int start = i;
                while (i < n && source.charAt(i) == '\'') {
                    i++;
                }
                tokens.add(new Token(TokenType.PRIME, source.substring(start, i), start));
            } else if (isAsciiDigit(c) || (c == '.' && i + 1 < n && isAsciiDigit(source.charAt(i + 1)))) {
                i = lexNumber(source, i, tokens);
            } else if (c == ':' && i + 1 < n && source.charAt(i + 1) == '=') {
                tokens.add(new Token(TokenType.OPERATOR, ":=", i));
                i += 2;
            } else if (c == '#') {
                throw new LexException(i, "macro parameter character '#' is not allowed in math");
            } else if (c == '$') {
                throw new LexException(i, "math shift '$' is not allowed inside an expression");
            } else if (Character.isISOControl(cp)) {
                throw new LexException(i, "control character U+" + String.format("%04X", cp));
            } else if (Character.isLetter(cp)) {
                tokens.add(new Token(TokenType.IDENTIFIER, new String(Character.toChars(cp)), i));
                i += width;
            } else if (DELIMITER_CHARS.indexOf(c) >= 0) {
                tokens.add(new Token(TokenType.DELIMITER, String.valueOf(c), i++));
            } else {
                tokens.add(new Token(TokenType.OPERATOR, new String(Character.toChars(cp)), i));
                i += width;
            }
        }
        tokens.add(new Token(TokenType.EOF, "", n));
        return Collections.unmodifiableList(tokens);
    }

    private int lexNumber(String source, int start, List<Token> tokens) {
        int i = start;
        int n = source.length();
        while (i < n && isAsciiDigit(source.charAt(i))) {
            i++;
        }
        if (i + 1 < n && source.charAt(i) == '.' && isAsciiDigit(source.charAt(i + 1))) {
            i++;
            while (i < n && isAsciiDigit(source.charAt(i))) {
                i++;
            }
        }
        tokens.add(new Token(TokenType.NUMBER, source.substring(start, i), start));
        return i;
    }

    private int lexCommand(String source, int start, List<Token> tokens) {
        int n = source.length();
        int i = start + 1;
        if (i >= n) {
            throw new LexException(start, "stray '\\' at end of input");
        }
        char first = source.charAt(i);
        if (first == '\\') {
            tokens.add(new Token(TokenType.ROW_SEPARATOR, "\\\\", start));
            return skipRowSpacing(source, i + 1);
        }
        if (!isAsciiLetter(first)) {
            int cp = source.codePointAt(i);
            String symbol = Character.isWhitespace(cp) ? " " : new String(Character.toChars(cp));
            tokens.add(new Token(TokenType.COMMAND, symbol, start));
            return i + Character.charCount(cp);
        }
        while (i < n && isAsciiLetter(source.charAt(i))) {
            i++;
        }
        String name = source.substring(start + 1, i);

        if ("begin".equals(name) || "end".equals(name)) {
            int after = lexEnvironment(source, start, i, "begin".equals(name), tokens);
            if (after >= 0) {
                return after;
            }
        }
        tokens.add(new Token(TokenType.COMMAND, name, start));
        if (TEXT_MODE_COMMANDS.contains(name)) {
            return lexTextArgument(source, i, tokens);
        }
        return i;
    }

    /**
     * Reads {@code {name}} after {@code \begin} or {@code \end}.
     *
     * @return index after the closing brace, or -1 when no well-formed name follows
     */
    private int lexEnvironment(String source, int start, int afterName, boolean begin, List<Token> tokens) {
        int i = skipSpaces(source, afterName);
        if (i >= source.length() || source.charAt(i) != '{') {
            return -1;
        }
        int close = source.indexOf('}', i + 1);
        if (close < 0) {
            return -1;
        }
        String env = source.substring(i + 1, close).trim();
        if (env.isEmpty() || !env.chars().allMatch(ch -> isAsciiLetter((char) ch) || ch == '*')) {
            return -1;
        }
        tokens.add(new Token(begin ? TokenType.BEGIN_ENVIRONMENT : TokenType.END_ENVIRONMENT, env, start));
        return close + 1;
    }

    /**
     * Captures a balanced brace group verbatim. When no group follows, or it is unterminated,
     * nothing is emitted and the parser reports the missing argument.
     */
    private int lexTextArgument(String source, int afterName, List<Token> tokens) {
        int open = skipSpaces(source, afterName);
        if (open >= source.length() || source.charAt(open) != '{') {
            return afterName;
        }
        int depth = 0;
        for (int i = open; i < source.length(); i++) {
            char c = source.charAt(i);
            if (c == '\\') {
                i++;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    tokens.add(new Token(TokenType.TEXT, source.substring(open + 1, i), open));
                    return i + 1;
                }
            }
        }
        return afterName;
    }

    // "\\[4pt]" carries a vertical skip that has no spoken form
    private int skipRowSpacing(String source, int from) {
        int i = skipSpaces(source, from);
        if (i < source.length() && source.charAt(i) == '[') {
            int close = source.indexOf(']', i);
            if (close > 0 && source.substring(i + 1, close).matches("\\s*-?[0-9.]*\\s*[a-z]{2}\\s*")) {
                return close + 1;
            }
        }
        return from;
    }

    private static int skipSpaces(String source, int from) {
        int i = from;
        while (i < source.length() && Character.isWhitespace(source.charAt(i))) {
            i++;
        }
        return i;
    }

    private static boolean isAsciiLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static boolean isAsciiDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
