package io.stpp.parser.api;

/**
 * Base exception for every fatal preprocessing error. Each error is tied to the input line it was
 * detected on; the line is appended to the message as {@code (line N)}.
 */
public class StppException extends Exception {

    /** What went wrong, independent of the message text. */
    public enum ErrorCode {
        /** The input holds a directive that cannot be interpreted. */
        SYNTAX,
        /** The input could not be read or the output could not be written. */
        IO
    }

    private final int line;
    private final ErrorCode errorCode;

    protected StppException(String message, int line, ErrorCode errorCode, Throwable cause) {
        super(message + " (line " + line + ")", cause);
        this.line = line;
        this.errorCode = errorCode;
    }

    /**
     * Returns the input line the error was detected on.
     *
     * @return the 1-based line number
     */
    public int getLine() {
        return line;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
