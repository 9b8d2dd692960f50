package io.stpp.parser.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Receives non-fatal diagnostics, such as a single {@code &} written where {@code &&} was meant.
 * Allows the caller to choose between reporting and escalating them.
 */
@FunctionalInterface
public interface DiagnosticListener {

    /**
     * Default listener that logs each warning and lets processing continue.
     */
    DiagnosticListener DEFAULT = new DiagnosticListener() {
        private final Logger log = LoggerFactory.getLogger(DiagnosticListener.class);

        @Override
        public void warning(String message, int line) {
            log.warn("line {}: {}", line, message);
        }
    };

    /**
     * Handle a warning.
     *
     * @param message the warning text
     * @param line the 1-based input line it was detected on
     * @throws StppSyntaxException if the listener decides the warning is fatal
     */
    void warning(String message, int line) throws StppSyntaxException;

    /**
     * Creates a listener that turns every warning into a fatal error.
     *
     * @return a strict listener
     */
    static DiagnosticListener strict() {
        return (message, line) -> {
            throw new StppSyntaxException(message, line);
        };
    }
}
