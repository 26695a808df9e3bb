package io.github.cyfko.logicql.core.parsing;

import io.github.cyfko.logicql.core.api.Environment;
import io.github.cyfko.logicql.core.api.Op;
import io.github.cyfko.logicql.core.api.Operand;
import io.github.cyfko.logicql.core.api.Token;
import io.github.cyfko.logicql.core.exception.ExpressionSyntaxException;
import io.github.cyfko.logicql.core.exception.ParseError;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Evaluates a postfix token sequence to a single boolean in one pass.
 *
 * <h2>Algorithm</h2>
 * <pre>
 * For each token in postfix expression:
 *   - If TRUE / FALSE: push the constant (environment is not consulted)
 *   - If A / B / C: push the environment value (false when unbound)
 *   - If NOT (!): pop operand, push its negation
 *   - If AND (&amp;&amp;): pop right, pop left, push left AND right
 *   - If OR (||): pop right, pop left, push left OR right
 *
 * Stack should contain exactly ONE value at the end.
 * </pre>
 *
 * <p>
 * Both operands of {@code &&} and {@code ||} are always on the stack before they are
 * combined; there is no short-circuit, which makes no observable difference since
 * operands are plain values.
 * </p>
 *
 * <h2>Error Detection</h2>
 * <ul>
 *   <li>Stack underflow (operator without enough operands): {@link ParseError#INCOMPLETE_EXPRESSION}</li>
 *   <li>Zero or several values left at the end: {@link ParseError#INCOMPLETE_EXPRESSION}</li>
 *   <li>Grouping marker in the postfix input: {@link ParseError#UNKNOWN_OPERATOR}</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * This class is stateless and thread-safe. Inputs are never modified.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see PostfixConverter
 */
public final class PostfixEvaluator {

    private PostfixEvaluator() {
        // Utility class - prevent instantiation
    }

    /**
     * Evaluates a postfix token sequence under an environment.
     *
     * @param postfixTokens postfix tokens as produced by {@link PostfixConverter#toPostfix(List)}
     * @param environment   values of the free variables
     * @return the value of the expression
     * @throws ExpressionSyntaxException if the postfix sequence cannot be reduced to one value
     * @throws NullPointerException if an argument is null
     */
    public static boolean evaluate(List<Token> postfixTokens, Environment environment) {
        if (postfixTokens == null) {
            throw new NullPointerException("postfixTokens cannot be null");
        }
        if (environment == null) {
            throw new NullPointerException("environment cannot be null");
        }

        Deque<Boolean> stack = new ArrayDeque<>(postfixTokens.size());

        for (Token token : postfixTokens) {
            if (token instanceof Token.Variable variable) {
                stack.push(resolve(variable.name(), environment));
            } else if (token instanceof Token.Operator operator) {
                apply(operator.kind(), stack);
            } else {
                throw new ExpressionSyntaxException(ParseError.UNKNOWN_OPERATOR, String.format(
                        "Unknown operator '%s' in postfix expression",
                        Objects.requireNonNull(token, "postfix token cannot be null").label()
                ));
            }
        }

        if (stack.size() != 1) {
            throw new ExpressionSyntaxException(ParseError.INCOMPLETE_EXPRESSION, String.format(
                    "Incomplete expression: evaluation left %d values on stack (expected 1)",
                    stack.size()
            ));
        }

        return stack.pop();
    }

    private static boolean resolve(Operand operand, Environment environment) {
        return operand.isConstant() ? operand.constantValue() : environment.valueOf(operand);
    }

    private static void apply(Op op, Deque<Boolean> stack) {
        if (op == Op.NOT) {
            if (stack.isEmpty()) {
                throw new ExpressionSyntaxException(ParseError.INCOMPLETE_EXPRESSION,
                        "Incomplete expression: NOT operator (!) without operand");
            }
            stack.push(!stack.pop());
            return;
        }

        if (stack.size() < 2) {
            throw new ExpressionSyntaxException(ParseError.INCOMPLETE_EXPRESSION, String.format(
                    "Incomplete expression: %s operator (%s) requires two operands, stack contains %d",
                    op.name(), op.getSymbol(), stack.size()
            ));
        }
        boolean right = stack.pop();
        boolean left = stack.pop();
        stack.push(op.apply(left, right));
    }
}
