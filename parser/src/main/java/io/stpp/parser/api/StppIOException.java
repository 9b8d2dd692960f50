package io.stpp.parser.api;

import java.io.IOException;

/**
 * Exception thrown when the input cannot be read or the output cannot be written. The cause is the
 * {@link IOException} of the underlying reader or writer.
 */
public class StppIOException extends StppException {

    private StppIOException(String message, int line, IOException cause) {
        super(cause.getMessage() == null ? message : message + ": " + cause.getMessage(), line, ErrorCode.IO, cause);
    }

    public static StppIOException readError(int line, IOException cause) {
        return new StppIOException("Failed to read input", line, cause);
    }

    public static StppIOException writeError(int line, IOException cause) {
        return new StppIOException("Failed to write output", line, cause);
    }
}
