package io.stpp.parser.impl;

import io.stpp.parser.api.DiagnosticListener;
import io.stpp.parser.api.StppException;
import io.stpp.parser.api.StppSyntaxException;
import io.stpp.parser.impl.ExprToken.Type;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits one line of condition text into {@link ExprToken}s. The whole line, including its
 * terminating newline, is consumed on construction.
 *
 * <p>Whitespace and the operator characters {@code ! ^ ( ) && ||} end a tag name; every other
 * character is part of one. A single {@code &} or {@code |} is reported as a warning and read as
 * the doubled operator.
 */
public final class ExprLexer {
    private final List<ExprToken> tokens = new ArrayList<>();
    private final int line;
    private int position;

    /**
     * Tokenizes the rest of the current line.
     *
     * @param in the stream, positioned at the start of the condition
     * @param diagnostics receives operator-spelling warnings
     * @throws StppException if reading fails or the listener escalates a warning
     */
    public ExprLexer(DirectiveReader in, DiagnosticListener diagnostics) throws StppException {
        this.line = in.line();
        StringBuilder tag = new StringBuilder();
        int c;
        while ((c = in.read()) != DirectiveReader.EOF && c != '\n') {
            if (Character.isWhitespace(c)) {
                flushTag(tag);
                continue;
            }
            switch (c) {
                case '!' -> add(tag, Type.NOT);
                case '^' -> add(tag, Type.XOR);
                case '(' -> add(tag, Type.PAREN_OPEN);
                case ')' -> add(tag, Type.PAREN_CLOSE);
                case '&' -> {
                    add(tag, Type.AND);
                    expectDoubled(in, '&', "And operator is && not &", diagnostics);
                }
                case '|' -> {
                    add(tag, Type.OR);
                    expectDoubled(in, '|', "Or operator is || not |", diagnostics);
                }
                default -> tag.append((char) c);
            }
        }
        flushTag(tag);
    }

    private ExprLexer(int line) {
        this.line = line;
    }

    /**
     * Creates a lexer without tokens, for a directive whose line holds no condition.
     *
     * @param line the line of the directive
     * @return an exhausted lexer
     */
    public static ExprLexer empty(int line) {
        return new ExprLexer(line);
    }

    private void expectDoubled(DirectiveReader in, char op, String warning, DiagnosticListener diagnostics)
            throws StppException {
        int next = in.read();
        if (next != op) {
            diagnostics.warning(warning, line);
            in.unread(next);
        }
    }

    private void add(StringBuilder tag, Type type) {
        flushTag(tag);
        tokens.add(ExprToken.of(type));
    }

    private void flushTag(StringBuilder tag) {
        if (tag.length() > 0) {
            tokens.add(ExprToken.tag(tag.toString()));
            tag.setLength(0);
        }
    }

    /** Returns the token at the current position, {@link ExprToken#EOS} past the end. */
    public ExprToken current() {
        return position < tokens.size() ? tokens.get(position) : ExprToken.EOS;
    }

    public void accept() {
        position++;
    }

    /**
     * Consumes the current token if it has the given type.
     *
     * @param type the expected type
     * @return the consumed token
     * @throws StppSyntaxException if the current token has another type
     */
    public ExprToken expect(Type type) throws StppSyntaxException {
        ExprToken token = current();
        if (token.type() != type) {
            throw StppSyntaxException.unexpectedToken(type.display(), token.type().display(), line);
        }
        position++;
        return token;
    }

    /** Returns the input line the condition started on. */
    public int line() {
        return line;
    }

    List<ExprToken> tokens() {
        return List.copyOf(tokens);
    }
}
