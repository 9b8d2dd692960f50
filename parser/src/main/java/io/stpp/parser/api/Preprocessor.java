package io.stpp.parser.api;

import io.stpp.parser.impl.BlockInterpreter;
import io.stpp.parser.impl.DirectiveReader;
import java.io.Reader;
import java.io.StringReader;
import java.io.StringWriter;
import java.io.Writer;
import java.util.Collection;
import java.util.Objects;

/**
 * Entry point of the preprocessor. Copies the literal text of a character stream to a sink,
 * keeping only the spans selected by the {@code if}/{@code elif}/{@code else}/{@code endif}
 * directives and updating the tag set on {@code define}/{@code undef}.
 *
 * <p>Instances are stateless and may be reused; every call to {@code process} is an independent
 * run. Neither the reader nor the writer is closed; the writer is flushed after a successful run.
 *
 * <pre>{@code
 * Preprocessor pp = Preprocessor.create();
 * String out = pp.processToString("#if linux\nuname\n#endif\n", Set.of("linux"));
 * }</pre>
 */
public final class Preprocessor {
    private final PreprocessorOptions options;

    private Preprocessor(PreprocessorOptions options) {
        this.options = Objects.requireNonNull(options, "options");
    }

    public static Preprocessor create() {
        return new Preprocessor(PreprocessorOptions.defaults());
    }

    public static Preprocessor create(PreprocessorOptions options) {
        return new Preprocessor(options);
    }

    /**
     * Processes one stream with a fresh context.
     *
     * @param in the input
     * @param out the output sink
     * @param predefined the tags defined before the first directive
     * @return the context as left by the run
     * @throws StppException on the first fatal error; output written so far is not retracted
     */
    public TagContext process(Reader in, Writer out, Collection<String> predefined) throws StppException {
        TagContext context = new TagContext(predefined);
        process(in, out, context);
        return context;
    }

    /**
     * Processes one stream against a caller-supplied context.
     *
     * @param in the input
     * @param out the output sink
     * @param context the tag context, mutated in place
     * @throws StppException on the first fatal error
     */
    public void process(Reader in, Writer out, TagContext context) throws StppException {
        new BlockInterpreter(new DirectiveReader(in), out, context, options).run();
    }

    /**
     * Convenience variant for in-memory text.
     *
     * @param input the text to process
     * @param predefined the tags defined before the first directive
     * @return the selected text
     * @throws StppException on the first fatal error
     */
    public String processToString(String input, Collection<String> predefined) throws StppException {
        StringWriter out = new StringWriter();
        process(new StringReader(input), out, predefined);
        return out.toString();
    }
}
