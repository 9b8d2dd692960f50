package io.stpp.parser.api;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

class TagContextTest {

    @Test
    void seededWithPredefinedTags() {
        TagContext ctx = new TagContext(List.of("a", "b", "a"));
        assertTrue(ctx.isDefined("a"));
        assertTrue(ctx.isDefined("b"));
        assertEquals(2, ctx.tags().size());
    }

    @Test
    void defineAndUndefine() {
        TagContext ctx = new TagContext();
        assertTrue(ctx.define("x"));
        assertFalse(ctx.define("x"));
        assertTrue(ctx.isDefined("x"));
        assertTrue(ctx.undefine("x"));
        assertFalse(ctx.undefine("x"));
        assertFalse(ctx.isDefined("x"));
    }

    @Test
    void tagsViewIsReadOnly() {
        TagContext ctx = new TagContext(List.of("a"));
        assertThrows(UnsupportedOperationException.class, () -> ctx.tags().add("b"));
    }

    @Test
    void depthBookkeeping() {
        TagContext ctx = new TagContext();
        ctx.enterBlock();
        ctx.enterBlock();
        assertEquals(2, ctx.depth());
        ctx.leaveBlock();
        ctx.leaveBlock();
        assertEquals(0, ctx.depth());
        assertThrows(IllegalStateException.class, ctx::leaveBlock);
    }
}
