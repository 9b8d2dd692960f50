package io.stpp.parser.api;

import java.util.Objects;

/**
 * Immutable settings for a {@link Preprocessor}.
 *
 * @param marker the character that starts every directive
 * @param maxDepth the maximum nesting of conditional blocks, and of sub-expressions in a condition
 * @param diagnostics the receiver of non-fatal warnings
 */
public record PreprocessorOptions(char marker, int maxDepth, DiagnosticListener diagnostics) {

    public static final char DEFAULT_MARKER = '#';
    public static final int DEFAULT_MAX_DEPTH = 256;

    public PreprocessorOptions {
        if (Character.isWhitespace(marker)) {
            throw new IllegalArgumentException("Directive marker must not be whitespace");
        }
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        Objects.requireNonNull(diagnostics, "diagnostics");
    }

    /**
     * Creates the default options: {@code #} marker, depth limit of 256, warnings logged.
     *
     * @return default options
     */
    public static PreprocessorOptions defaults() {
        return new PreprocessorOptions(DEFAULT_MARKER, DEFAULT_MAX_DEPTH, DiagnosticListener.DEFAULT);
    }

    public PreprocessorOptions withMarker(char marker) {
        return new PreprocessorOptions(marker, maxDepth, diagnostics);
    }

    public PreprocessorOptions withMaxDepth(int maxDepth) {
        return new PreprocessorOptions(marker, maxDepth, diagnostics);
    }

    public PreprocessorOptions withDiagnostics(DiagnosticListener diagnostics) {
        return new PreprocessorOptions(marker, maxDepth, diagnostics);
    }
}
