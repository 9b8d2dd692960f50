package io.stpp.shell;

import io.stpp.parser.api.DiagnosticListener;
import io.stpp.parser.api.Preprocessor;
import io.stpp.parser.api.PreprocessorOptions;
import io.stpp.parser.api.StppException;
import io.stpp.parser.api.TagContext;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

@CommandLine.Command(
    name = "stpp",
    description = "Copies text from <in> to <out>, keeping the spans selected by #if/#elif/#else/#endif directives.",
    version = "0.1.0",
    mixinStandardHelpOptions = true)
public class Main implements Callable<Integer> {
    static final String LOG_LEVEL_PROPERTY = "org.slf4j.simpleLogger.log.io.stpp";

    @CommandLine.Option(names = {"-D", "--definition"}, paramLabel = "<tag>", description = "Define a tag (repeatable)")
    private List<String> definitions = new ArrayList<>();

    @CommandLine.Option(names = {"-W", "--werror"}, description = "Treat warnings as errors")
    private boolean werror;

    @CommandLine.Option(names = "--marker", paramLabel = "<char>", description = "Directive marker character (default: ${DEFAULT-VALUE})")
    private char marker = PreprocessorOptions.DEFAULT_MARKER;

    @CommandLine.Option(names = "--max-depth", paramLabel = "<n>", description = "Maximum nesting of blocks and expressions (default: ${DEFAULT-VALUE})")
    private int maxDepth = PreprocessorOptions.DEFAULT_MAX_DEPTH;

    @CommandLine.Option(names = {"-v", "--verbose"}, description = "Log every directive")
    private boolean verbose;

    @CommandLine.Parameters(index = "0", arity = "0..1", paramLabel = "in", description = "Input file, stdin if absent or --")
    private String input;

    @CommandLine.Parameters(index = "1", arity = "0..1", paramLabel = "out", description = "Output file, stdout if absent or --")
    private String output;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        if (!verbose) {
            return run();
        }
        // read by slf4j-simple when a logger is created, so it must be set before the first stpp logger
        String previous = System.setProperty(LOG_LEVEL_PROPERTY, "debug");
        try {
            return run();
        } finally {
            if (previous == null) {
                System.clearProperty(LOG_LEVEL_PROPERTY);
            } else {
                System.setProperty(LOG_LEVEL_PROPERTY, previous);
            }
        }
    }

    private int run() {
        Logger log = LoggerFactory.getLogger(Main.class);

        PreprocessorOptions options;
        try {
            options = PreprocessorOptions.defaults()
                .withMarker(marker)
                .withMaxDepth(maxDepth)
                .withDiagnostics(werror ? DiagnosticListener.strict() : DiagnosticListener.DEFAULT);
        } catch (IllegalArgumentException e) {
            System.err.println("stpp: " + e.getMessage());
            return 2;
        }
        Set<String> tags = new LinkedHashSet<>(definitions);
        log.debug("Predefined tags: {}", tags);

        Reader in;
        try {
            in = StreamProvider.openInput(input);
        } catch (IOException e) {
            System.err.println("stpp: Could not open input stream " + displayName(input, "stdin") + ": " + e.getMessage());
            return 1;
        }
        try (in; Writer out = StreamProvider.openOutput(output)) {
            TagContext context = Preprocessor.create(options).process(in, out, tags);
            log.debug("Finished with tags: {}", context.tags());
            return 0;
        } catch (StppException e) {
            System.err.println("stpp: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            System.err.println("stpp: Output stream " + displayName(output, "stdout") + " failed: " + e.getMessage());
            return 1;
        }
    }

    private static String displayName(String name, String standard) {
        return StreamProvider.isStandard(name) ? standard : name;
    }
}
