package io.stpp.parser.impl;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Tracks the state of nested if-blocks. Uses a stack so that nesting depth is bounded by memory
 * rather than by the call stack.
 *
 * <p>Each block remembers whether the current branch's guard holds, whether an earlier branch of
 * the same chain was already taken, and whether an enclosing block suppresses it. Text is emitted
 * only while no open block is suppressed.
 */
public final class ConditionalState {

    private static final class IfBlock {
        final boolean inheritedIgnore;
        final int openedAt;
        boolean condition;
        boolean onceTrue;

        IfBlock(boolean condition, boolean inheritedIgnore, int openedAt) {
            this.condition = condition;
            this.inheritedIgnore = inheritedIgnore;
            this.openedAt = openedAt;
        }

        boolean suppressed() {
            return inheritedIgnore || onceTrue || !condition;
        }
    }

    private final Deque<IfBlock> stack = new ArrayDeque<>();

    /**
     * Returns whether text is currently discarded. False outside of any block.
     */
    public boolean isSuppressed() {
        IfBlock current = stack.peek();
        return current != null && current.suppressed();
    }

    /**
     * Enters a new if-block. The block inherits the suppression of the enclosing one.
     *
     * @param condition the value of the if guard; pass false when the guard was not evaluated
     * @param line the line of the if directive
     */
    public void enterIf(boolean condition, int line) {
        stack.push(new IfBlock(condition, isSuppressed(), line));
    }

    /**
     * Starts an elif branch. Marks the chain as taken if the branch that just ended was active.
     *
     * @return true if the elif guard must be evaluated and passed to {@link #resolveElif}; false if
     *     an earlier branch was taken and the elif is skipped without looking at its guard
     * @throws IllegalStateException if not inside an if-block
     */
    public boolean beginElif() {
        IfBlock current = current("elif");
        if (current.condition) {
            current.onceTrue = true;
        }
        current.condition = false;
        return !current.onceTrue;
    }

    /**
     * Sets the guard value of the elif branch started by {@link #beginElif}.
     *
     * @param condition the value of the elif guard
     */
    public void resolveElif(boolean condition) {
        current("elif").condition = condition;
    }

    /**
     * Handles an else statement: active exactly when no earlier branch was taken.
     *
     * @throws IllegalStateException if not inside an if-block
     */
    public void handleElse() {
        IfBlock current = current("else");
        if (current.condition) {
            current.onceTrue = true;
        }
        current.condition = !current.onceTrue;
    }

    /**
     * Exits the current if-block.
     *
     * @throws IllegalStateException if not inside an if-block
     */
    public void exitIf() {
        current("endif");
        stack.pop();
    }

    /**
     * Returns whether we are currently inside any if-block.
     *
     * @return true if inside a conditional block
     */
    public boolean inConditional() {
        return !stack.isEmpty();
    }

    /**
     * Returns the nesting depth of conditionals.
     *
     * @return the number of open if-blocks
     */
    public int depth() {
        return stack.size();
    }

    /**
     * Returns the line of the innermost open if directive.
     *
     * @throws IllegalStateException if not inside an if-block
     */
    public int openedAt() {
        return current("open block").openedAt;
    }

    private IfBlock current(String directive) {
        IfBlock current = stack.peek();
        if (current == null) {
            throw new IllegalStateException(directive + " without if");
        }
        return current;
    }
}
