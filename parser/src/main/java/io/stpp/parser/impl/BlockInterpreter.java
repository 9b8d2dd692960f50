package io.stpp.parser.impl;

import io.stpp.parser.api.PreprocessorOptions;
import io.stpp.parser.api.StppException;
import io.stpp.parser.api.StppIOException;
import io.stpp.parser.api.StppSyntaxException;
import io.stpp.parser.api.TagContext;
import io.stpp.parser.impl.DirectiveScanner.ScannedDirective;
import java.io.IOException;
import java.io.Writer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Consumes a whole input stream, interpreting directives and copying the literal text of active
 * spans to the output.
 *
 * <p>The marker character starts a directive wherever it appears. Conditional blocks are tracked
 * by a {@link ConditionalState}; a {@code define}/{@code undef} or an unknown directive only has
 * an effect while the current span is active. {@code elif}, {@code else} and {@code endif} outside
 * of any block are copied like unknown directives.
 */
public final class BlockInterpreter {
    private static final Logger log = LoggerFactory.getLogger(BlockInterpreter.class);

    private final DirectiveReader in;
    private final Writer out;
    private final TagContext context;
    private final PreprocessorOptions options;
    private final ConditionalState state = new ConditionalState();
    private final ConditionEvaluator evaluator;

    public BlockInterpreter(
            DirectiveReader in, Writer out, TagContext context, PreprocessorOptions options) {
        this.in = in;
        this.out = out;
        this.context = context;
        this.options = options;
        this.evaluator = new ConditionEvaluator(context, options.maxDepth());
    }

    /**
     * Processes the stream to its end.
     *
     * <p>Blocks still open when the run fails are closed again, so the depth of the context is
     * the same as before the run.
     *
     * @throws StppException on the first malformed directive or I/O failure
     */
    public void run() throws StppException {
        try {
            int c;
            while ((c = in.read()) != DirectiveReader.EOF) {
                if (c == options.marker()) {
                    directive();
                } else if (!state.isSuppressed()) {
                    write(c);
                }
            }
            if (state.inConditional()) {
                throw StppSyntaxException.missingEndif(state.openedAt());
            }
            out.flush();
        } catch (IOException e) {
            throw StppIOException.writeError(in.line(), e);
        } finally {
            closeOpenBlocks();
        }
    }

    private void closeOpenBlocks() {
        while (state.inConditional()) {
            state.exitIf();
            context.leaveBlock();
        }
    }

    private void directive() throws StppException {
        int line = in.line();
        ScannedDirective scanned = DirectiveScanner.scan(in);
        boolean suppressed = state.isSuppressed();
        log.debug("line {}: {} '{}' (suppressed={})", line, scanned.directive(), scanned.word(), suppressed);

        switch (scanned.directive()) {
            case IF -> enterIf(scanned, line, suppressed);
            case ELIF -> {
                // once a branch was taken the elif guard stays on the stream as suppressed text
                if (!state.inConditional()) {
                    echo(scanned, suppressed);
                } else if (state.beginElif()) {
                    state.resolveElif(evaluator.evaluate(guard(scanned, line)));
                }
            }
            case ELSE -> {
                if (state.inConditional()) {
                    state.handleElse();
                } else {
                    echo(scanned, suppressed);
                }
            }
            case ENDIF -> {
                if (state.inConditional()) {
                    state.exitIf();
                    context.leaveBlock();
                } else {
                    echo(scanned, suppressed);
                }
            }
            case DEFINE -> {
                String tag = argument(scanned);
                if (!suppressed) {
                    if (tag.isEmpty()) {
                        throw StppSyntaxException.missingTag("Define", line);
                    }
                    context.define(tag);
                    log.debug("line {}: defined '{}'", line, tag);
                }
            }
            case UNDEF -> {
                String tag = argument(scanned);
                if (!suppressed) {
                    if (tag.isEmpty()) {
                        throw StppSyntaxException.missingTag("Undef", line);
                    }
                    context.undefine(tag);
                    log.debug("line {}: undefined '{}'", line, tag);
                }
            }
            case UNKNOWN -> echo(scanned, suppressed);
        }
    }

    private void enterIf(ScannedDirective scanned, int line, boolean suppressed)
            throws StppException {
        if (state.depth() >= options.maxDepth()) {
            throw StppSyntaxException.nestingTooDeep(options.maxDepth(), line);
        }
        // a suppressed guard is consumed but not evaluated
        ExprLexer guard = guard(scanned, line);
        boolean condition = !suppressed && evaluator.evaluate(guard);
        state.enterIf(condition, line);
        context.enterBlock();
    }

    private ExprLexer guard(ScannedDirective scanned, int line) throws StppException {
        return scanned.lineEnded() ? ExprLexer.empty(line) : new ExprLexer(in, options.diagnostics());
    }

    private String argument(ScannedDirective scanned) throws StppIOException {
        return scanned.lineEnded() ? "" : TagNameReader.read(in);
    }

    private void echo(ScannedDirective scanned, boolean suppressed) throws StppIOException {
        if (suppressed) {
            return;
        }
        // the whitespace that ended the word is not reproduced
        write(options.marker());
        try {
            out.write(scanned.word());
        } catch (IOException e) {
            throw StppIOException.writeError(in.line(), e);
        }
    }

    private void write(int c) throws StppIOException {
        try {
            out.write(c);
        } catch (IOException e) {
            throw StppIOException.writeError(in.line(), e);
        }
    }
}
