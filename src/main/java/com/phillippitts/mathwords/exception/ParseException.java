package com.phillippitts.mathwords.exception;

/**
 * Thrown when a token stream (or MathML document) cannot be turned into an expression tree.
 *
 * <p>This is the dominant real-world failure: author-defined macros such as {@code \dmodel}
 * are not expanded and surface as {@link ParseErrorKind#UNKNOWN_COMMAND}.
 */
public class ParseException extends MathWordsException {

    private final ParseErrorKind kind;
    private final int position;
    private final String command;

    public ParseException(ParseErrorKind kind, int position, String detail) {
        this(kind, position, detail, null, null);
    }

    public ParseException(ParseErrorKind kind, int position, String detail, Throwable cause) {
        this(kind, position, detail, null, cause);
    }

    private ParseException(ParseErrorKind kind, int position, String detail, String command, Throwable cause) {
        super("Parse error (" + kind + ") at position " + position + ": " + detail, cause);
        this.kind = kind;
        this.position = position;
        this.command = command;
    }

    /**
     * Creates the error raised for a control sequence the command registry does not know.
     *
     * @param command command name without the leading backslash
     * @param position offset of the backslash in the source
     * @return parse exception of kind {@link ParseErrorKind#UNKNOWN_COMMAND}
     */
    public static ParseException unknownCommand(String command, int position) {
        return new ParseException(ParseErrorKind.UNKNOWN_COMMAND, position,
                "undefined control sequence \\" + command, command, null);
    }

    public ParseErrorKind getKind() {
        return kind;
    }

    /**
     * @return 0-based character offset into the original source, or -1 when unknown
     */
    public int getPosition() {
        return position;
    }

    /**
     * @return the offending command name for {@link ParseErrorKind#UNKNOWN_COMMAND}, otherwise null
     */
    public String getCommand() {
        return command;
    }
}
