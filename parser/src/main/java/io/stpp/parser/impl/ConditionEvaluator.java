package io.stpp.parser.impl;

import io.stpp.parser.api.StppSyntaxException;
import io.stpp.parser.api.TagContext;
import io.stpp.parser.impl.ExprToken.Type;
import java.util.ArrayList;
import java.util.List;

/**
 * Evaluates a tokenized condition against a {@link TagContext}. Parsing and evaluation happen in
 * a single pass; no syntax tree is built.
 *
 * <p>Grammar:
 *
 * <pre>
 * binary  := unary ( EOS | ')' | '&amp;&amp;' binary | '||' binary | '^' binary )
 * unary   := '!' unary | primary
 * primary := '(' binary ')' | TAG
 * </pre>
 *
 * <p>A binary operator takes the whole remainder of the expression as its right operand, so there
 * is no precedence and chains fold to the right: {@code a && b || c} is {@code a && (b || c)}.
 * An operator chain is collected in a loop and folded afterwards; only parentheses and negations
 * count towards the depth limit.
 */
public final class ConditionEvaluator {
    private final TagContext context;
    private final int maxDepth;

    private ExprLexer lexer;
    private int depth;

    /**
     * Creates an evaluator.
     *
     * @param context the tags to test against
     * @param maxDepth the maximum nesting of parentheses and negations
     */
    public ConditionEvaluator(TagContext context, int maxDepth) {
        this.context = context;
        this.maxDepth = maxDepth;
    }

    /**
     * Evaluates all tokens of the lexer.
     *
     * @param lexer a lexer positioned at the first token
     * @return the value of the condition
     * @throws StppSyntaxException if the condition is empty or malformed
     */
    public boolean evaluate(ExprLexer lexer) throws StppSyntaxException {
        this.lexer = lexer;
        this.depth = 0;
        if (lexer.current().type() == Type.EOS) {
            throw StppSyntaxException.emptyCondition(lexer.line());
        }
        boolean result = binary();
        // binary() stops in front of ')' for the enclosing primary; at top level there is none
        lexer.expect(Type.EOS);
        return result;
    }

    private boolean binary() throws StppSyntaxException {
        List<Boolean> operands = new ArrayList<>();
        List<Type> operators = new ArrayList<>();
        operands.add(unary());
        while (true) {
            ExprToken next = lexer.current();
            switch (next.type()) {
                case EOS, PAREN_CLOSE -> {
                    return foldRight(operands, operators);
                }
                case AND, OR, XOR -> {
                    lexer.accept();
                    operators.add(next.type());
                    operands.add(unary());
                }
                case TAG, NOT, PAREN_OPEN -> throw StppSyntaxException.unexpectedToken(
                        "operator", next.type().display(), lexer.line());
            }
        }
    }

    private static boolean foldRight(List<Boolean> operands, List<Type> operators) {
        boolean result = operands.get(operands.size() - 1);
        for (int i = operators.size() - 1; i >= 0; i--) {
            boolean a = operands.get(i);
            result = switch (operators.get(i)) {
                case AND -> a && result;
                case OR -> a || result;
                case XOR -> a ^ result;
                default -> throw new IllegalStateException("Not a binary operator: " + operators.get(i));
            };
        }
        return result;
    }

    private boolean unary() throws StppSyntaxException {
        if (lexer.current().type() == Type.NOT) {
            lexer.accept();
            descend();
            boolean value = !unary();
            depth--;
            return value;
        }
        return primary();
    }

    private boolean primary() throws StppSyntaxException {
        if (lexer.current().type() == Type.PAREN_OPEN) {
            lexer.accept();
            descend();
            boolean value = binary();
            lexer.expect(Type.PAREN_CLOSE);
            depth--;
            return value;
        }
        ExprToken tag = lexer.expect(Type.TAG);
        return context.isDefined(tag.tag());
    }

    private void descend() throws StppSyntaxException {
        if (++depth > maxDepth) {
            throw StppSyntaxException.nestingTooDeep(maxDepth, lexer.line());
        }
    }
}
