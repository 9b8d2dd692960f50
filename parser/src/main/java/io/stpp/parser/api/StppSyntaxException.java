package io.stpp.parser.api;

/**
 * Exception thrown when the input contains a directive that cannot be interpreted:
 * a malformed condition, a {@code define}/{@code undef} without a tag, an unterminated
 * block or nesting beyond the configured limit.
 */
public class StppSyntaxException extends StppException {

    /**
     * Constructs a new StppSyntaxException.
     *
     * @param message the detail message
     * @param line the 1-based input line of the offending directive
     */
    public StppSyntaxException(String message, int line) {
        super(message, line, ErrorCode.SYNTAX, null);
    }

    public static StppSyntaxException emptyCondition(int line) {
        return new StppSyntaxException("Expected condition but got nothing", line);
    }

    public static StppSyntaxException unexpectedToken(String expected, String actual, int line) {
        return new StppSyntaxException(
            String.format("Expected '%s' but got '%s'", expected, actual),
            line
        );
    }

    public static StppSyntaxException missingTag(String directive, int line) {
        return new StppSyntaxException(directive + " statement without tag", line);
    }

    public static StppSyntaxException missingEndif(int openedAt) {
        return new StppSyntaxException("Missing endif for if block", openedAt);
    }

    public static StppSyntaxException nestingTooDeep(int maxDepth, int line) {
        return new StppSyntaxException("Nesting exceeds the maximum depth of " + maxDepth, line);
    }
}
