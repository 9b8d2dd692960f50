package io.stpp.parser.impl;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ConditionalStateTest {

    private ConditionalState state;

    @BeforeEach
    void setUp() {
        state = new ConditionalState();
    }

    @Test
    void activeOutsideOfBlocks() {
        assertFalse(state.isSuppressed());
        assertFalse(state.inConditional());
        assertEquals(0, state.depth());
    }

    @Test
    void falseIfThenElse() {
        state.enterIf(false, 1);
        assertTrue(state.isSuppressed());
        state.handleElse();
        assertFalse(state.isSuppressed());
        state.exitIf();
        assertFalse(state.inConditional());
    }

    @Test
    void trueIfSkipsElifWithoutGuard() {
        state.enterIf(true, 1);
        assertFalse(state.isSuppressed());
        assertFalse(state.beginElif(), "guard must not be evaluated after a taken branch");
        assertTrue(state.isSuppressed());
        state.handleElse();
        assertTrue(state.isSuppressed());
    }

    @Test
    void firstTrueElifWins() {
        state.enterIf(false, 1);
        assertTrue(state.beginElif());
        state.resolveElif(false);
        assertTrue(state.isSuppressed());
        assertTrue(state.beginElif());
        state.resolveElif(true);
        assertFalse(state.isSuppressed());
        assertFalse(state.beginElif());
        assertTrue(state.isSuppressed());
    }

    @Test
    void nestedBlockInheritsSuppression() {
        state.enterIf(false, 1);
        state.enterIf(true, 2);
        assertTrue(state.isSuppressed());
        state.handleElse();
        assertTrue(state.isSuppressed());
        state.exitIf();
        assertEquals(1, state.depth());
        assertEquals(1, state.openedAt());
    }

    @Test
    void directivesWithoutIfAreRejected() {
        assertThrows(IllegalStateException.class, state::beginElif);
        assertThrows(IllegalStateException.class, state::handleElse);
        assertThrows(IllegalStateException.class, state::exitIf);
    }
}
