package io.stpp.parser.impl;

import io.stpp.parser.api.StppIOException;

/**
 * Reads the keyword that follows a directive marker.
 *
 * <p>Leading blanks are skipped. The word ends at the first whitespace after it, at a line
 * terminator or at end of stream; the terminating character is consumed. When the word was
 * ended by the line terminator or end of stream the directive has no argument. At most
 * {@link #MAX_KEYWORD_LENGTH} characters are kept, the rest of an overlong word is read and
 * dropped. Anything after the word (a condition, a tag name) is left on the stream.
 */
public final class DirectiveScanner {
    public static final int MAX_KEYWORD_LENGTH = 16;

    /**
     * A classified directive word.
     *
     * @param directive the directive kind
     * @param word the collected word, truncated to {@link #MAX_KEYWORD_LENGTH}
     * @param lineEnded true if nothing of the directive line is left on the stream
     */
    public record ScannedDirective(Directive directive, String word, boolean lineEnded) {}

    private DirectiveScanner() {}

    public static ScannedDirective scan(DirectiveReader in) throws StppIOException {
        StringBuilder word = new StringBuilder(MAX_KEYWORD_LENGTH);
        boolean started = false;
        boolean lineEnded = true;
        int c;
        while ((c = in.read()) != DirectiveReader.EOF) {
            if (c == '\n') {
                break;
            }
            if (!Character.isWhitespace(c)) {
                if (word.length() < MAX_KEYWORD_LENGTH) {
                    word.append((char) c);
                }
                started = true;
            } else if (started) {
                lineEnded = false;
                break;
            }
        }
        String text = word.toString();
        return new ScannedDirective(Directive.fromKeyword(text), text, lineEnded);
    }
}
