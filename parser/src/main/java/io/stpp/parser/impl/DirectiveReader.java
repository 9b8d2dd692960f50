package io.stpp.parser.impl;

import io.stpp.parser.api.StppIOException;
import java.io.IOException;
import java.io.PushbackReader;
import java.io.Reader;

/**
 * Character source for the interpreter. Reads one character at a time, supports pushing a
 * single character back and keeps track of the current 1-based line.
 */
public final class DirectiveReader {
    public static final int EOF = -1;

    private final PushbackReader in;
    private int line = 1;

    public DirectiveReader(Reader reader) {
        this.in = new PushbackReader(reader, 1);
    }

    /**
     * Reads the next character.
     *
     * @return the character, or {@link #EOF} at end of stream
     * @throws StppIOException if the underlying reader fails
     */
    public int read() throws StppIOException {
        try {
            int c = in.read();
            if (c == '\n') {
                line++;
            }
            return c;
        } catch (IOException e) {
            throw StppIOException.readError(line, e);
        }
    }

    /**
     * Pushes a character back so that the next {@link #read()} returns it. Pushing back
     * {@link #EOF} is a no-op.
     *
     * @param c the character last read
     * @throws StppIOException if the push-back buffer is already full
     */
    public void unread(int c) throws StppIOException {
        if (c == EOF) {
            return;
        }
        try {
            in.unread(c);
            if (c == '\n') {
                line--;
            }
        } catch (IOException e) {
            throw StppIOException.readError(line, e);
        }
    }

    public int line() {
        return line;
    }
}
