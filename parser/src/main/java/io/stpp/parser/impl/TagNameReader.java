package io.stpp.parser.impl;

import io.stpp.parser.api.StppIOException;

/**
 * Reads the tag argument of {@code define}/{@code undef}: the first whitespace-delimited word on
 * the rest of the line. Returns an empty string when the line holds no word.
 */
public final class TagNameReader {

    private TagNameReader() {}

    public static String read(DirectiveReader in) throws StppIOException {
        StringBuilder tag = new StringBuilder();
        int c;
        while ((c = in.read()) != DirectiveReader.EOF) {
            if (c == '\n') {
                break;
            }
            if (!Character.isWhitespace(c)) {
                tag.append((char) c);
            } else if (tag.length() > 0) {
                break;
            }
        }
        return tag.toString();
    }
}
