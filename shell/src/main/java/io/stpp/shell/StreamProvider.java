package io.stpp.shell;

import java.io.FilterReader;
import java.io.FilterWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Opens the input and output of a run. A missing name or {@code --} selects the standard
 * streams, which are never closed; files are read and written as UTF-8.
 */
final class StreamProvider {
    static final String STANDARD_STREAM = "--";

    private StreamProvider() {}

    static boolean isStandard(String name) {
        return name == null || name.isEmpty() || STANDARD_STREAM.equals(name);
    }

    static Reader openInput(String name) throws IOException {
        if (isStandard(name)) {
            return new FilterReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)) {
                @Override
                public void close() {}
            };
        }
        return Files.newBufferedReader(Paths.get(name), StandardCharsets.UTF_8);
    }

    static Writer openOutput(String name) throws IOException {
        if (isStandard(name)) {
            return new FilterWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8)) {
                @Override
                public void close() throws IOException {
                    flush();
                }
            };
        }
        Path path = Paths.get(name);
        return Files.newBufferedWriter(path, StandardCharsets.UTF_8);
    }
}
