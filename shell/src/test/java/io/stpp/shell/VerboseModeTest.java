package io.stpp.shell;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

/**
 * Tests for {@code --verbose}. Kept apart from {@link MainTest} because the debug level only
 * applies to loggers created after the option is seen, so no stpp logger may exist beforehand.
 */
class VerboseModeTest {

    private ByteArrayOutputStream outContent;
    private ByteArrayOutputStream errContent;
    private PrintStream originalOut;
    private PrintStream originalErr;
    private InputStream originalIn;

    @BeforeEach
    void setUp() {
        outContent = new ByteArrayOutputStream();
        errContent = new ByteArrayOutputStream();
        originalOut = System.out;
        originalErr = System.err;
        originalIn = System.in;
        System.setOut(new PrintStream(outContent));
        System.setErr(new PrintStream(errContent));
        System.setIn(new ByteArrayInputStream(
                "#define b\n#if a && b\nboth\n#endif\n".getBytes(StandardCharsets.UTF_8)));
    }

    @AfterEach
    void tearDown() {
        System.setOut(originalOut);
        System.setErr(originalErr);
        System.setIn(originalIn);
    }

    @Test
    void verboseLogsEveryDirectiveToStderr() {
        int exitCode = new CommandLine(new Main()).execute("-v", "-D", "a");

        String err = errContent.toString(StandardCharsets.UTF_8);
        assertEquals(0, exitCode, err);
        assertEquals("both\n", outContent.toString(StandardCharsets.UTF_8));
        assertTrue(err.contains("[DEBUG]"), err);
        assertTrue(err.contains("line 1: DEFINE 'define'"), err);
        assertTrue(err.contains("line 2: IF 'if'"), err);
        assertTrue(err.contains("line 4: ENDIF 'endif'"), err);
    }

    @Test
    void verboseDoesNotLeakTheLogLevelProperty() {
        new CommandLine(new Main()).execute("--verbose");

        assertNull(System.getProperty(Main.LOG_LEVEL_PROPERTY));
    }
}
