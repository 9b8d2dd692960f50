package io.stpp.parser.impl;

import static org.junit.jupiter.api.Assertions.*;

import io.stpp.parser.impl.DirectiveScanner.ScannedDirective;
import java.io.StringReader;
import org.junit.jupiter.api.Test;

class DirectiveScannerTest {

    private static DirectiveReader reader(String text) {
        return new DirectiveReader(new StringReader(text));
    }

    @Test
    void classifiesKeywords() throws Exception {
        assertEquals(Directive.IF, DirectiveScanner.scan(reader("if a")).directive());
        assertEquals(Directive.ELIF, DirectiveScanner.scan(reader("elif a")).directive());
        assertEquals(Directive.ELSE, DirectiveScanner.scan(reader("else\n")).directive());
        assertEquals(Directive.ENDIF, DirectiveScanner.scan(reader("endif")).directive());
        assertEquals(Directive.DEFINE, DirectiveScanner.scan(reader("define x")).directive());
        assertEquals(Directive.UNDEF, DirectiveScanner.scan(reader("undef x")).directive());
    }

    @Test
    void emptyAndPartialWordsAreUnknown() {
        assertEquals(Directive.UNKNOWN, Directive.fromKeyword(""));
        assertEquals(Directive.UNKNOWN, Directive.fromKeyword("end"));
        assertEquals(Directive.UNKNOWN, Directive.fromKeyword("endiff"));
        assertEquals(Directive.UNKNOWN, Directive.fromKeyword("null"));
    }

    @Test
    void keywordsAreCaseSensitive() throws Exception {
        ScannedDirective scanned = DirectiveScanner.scan(reader("IF a"));
        assertEquals(Directive.UNKNOWN, scanned.directive());
        assertEquals("IF", scanned.word());
    }

    @Test
    void leavesArgumentOnTheStream() throws Exception {
        DirectiveReader in = reader("if  a\n");
        assertEquals(Directive.IF, DirectiveScanner.scan(in).directive());
        // only the first blank after the word is consumed
        assertEquals(' ', in.read());
        assertEquals('a', in.read());
    }

    @Test
    void skipsBlanksBeforeTheWord() throws Exception {
        assertEquals(Directive.ENDIF, DirectiveScanner.scan(reader("   endif\n")).directive());
    }

    @Test
    void consumesTheLineTerminator() throws Exception {
        DirectiveReader in = reader("else\nbody");
        DirectiveScanner.scan(in);
        assertEquals('b', in.read());
    }

    @Test
    void emptyWordIsUnknown() throws Exception {
        DirectiveReader in = reader("\nnext");
        ScannedDirective scanned = DirectiveScanner.scan(in);
        assertEquals(Directive.UNKNOWN, scanned.directive());
        assertEquals("", scanned.word());
        assertEquals('n', in.read());
    }

    @Test
    void overlongWordIsTruncated() throws Exception {
        DirectiveReader in = reader("averyveryverylongkeyword rest");
        ScannedDirective scanned = DirectiveScanner.scan(in);
        assertEquals(Directive.UNKNOWN, scanned.directive());
        assertEquals("averyveryverylon", scanned.word());
        assertEquals(DirectiveScanner.MAX_KEYWORD_LENGTH, scanned.word().length());
        assertEquals('r', in.read());
    }

    @Test
    void prefixOfKeywordIsNotAKeyword() throws Exception {
        assertEquals(Directive.UNKNOWN, DirectiveScanner.scan(reader("endifx")).directive());
        assertEquals(Directive.UNKNOWN, DirectiveScanner.scan(reader("el")).directive());
    }

    @Test
    void reportsWhetherTheLineEnded() throws Exception {
        assertFalse(DirectiveScanner.scan(reader("undef x\n")).lineEnded());
        assertTrue(DirectiveScanner.scan(reader("undef\nx\n")).lineEnded());
        assertTrue(DirectiveScanner.scan(reader("undef")).lineEnded());
    }
}
