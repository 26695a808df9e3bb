package io.github.cyfko.logicql.core.parsing;

import io.github.cyfko.logicql.core.api.Token;
import io.github.cyfko.logicql.core.exception.ExpressionSyntaxException;
import io.github.cyfko.logicql.core.exception.ParseError;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Infix to postfix converter (shunting-yard) for validated token sequences.
 * <p>
 * Precedence and associativity come from {@link io.github.cyfko.logicql.core.api.Op}:
 * {@code !} (3, right), {@code &&} (2, left), {@code ||} (1, left).
 * Parentheses are pushed as opaque markers and never reach the output.
 * </p>
 *
 * <p><strong>Design:</strong></p>
 * <pre>
 * Phase 1 (TokenValidator):   adjacency rules
 * Phase 2 (this class):       postfix ordering + parenthesis balance
 * Phase 3 (PostfixEvaluator): stack evaluation under an environment
 * </pre>
 *
 * <p><strong>Performance characteristics:</strong></p>
 * <ul>
 *   <li>Time: O(n) where n = number of tokens</li>
 *   <li>Space: O(n) for the output list and the operator stack</li>
 *   <li>No recursion: the operator stack is an explicit {@link ArrayDeque}</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * // A || B && C
 * List<Token> postfix = PostfixConverter.toPostfix(List.of(
 *     variable(A), operator(OR), variable(B), operator(AND), variable(C)));
 * // Result: [A, B, C, &&, ||]
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class PostfixConverter {

    private PostfixConverter() {}

    /**
     * Converts a token sequence to postfix order.
     *
     * @param tokens the token sequence, not modified
     * @return a new list holding only operand and operator tokens
     * @throws ExpressionSyntaxException with {@link ParseError#MISMATCHED_PARENTHESES} if groups are unbalanced
     * @throws NullPointerException if {@code tokens} is null
     */
    public static List<Token> toPostfix(List<Token> tokens) {
        Objects.requireNonNull(tokens, "tokens cannot be null");

        List<Token> output = new ArrayList<>(tokens.size());
        Deque<Token> operators = new ArrayDeque<>(tokens.size());

        for (Token token : tokens) {
            if (token instanceof Token.Variable) {
                output.add(token);
            } else if (token instanceof Token.Operator current) {
                while (operators.peek() instanceof Token.Operator stacked && current.kind().yieldsTo(stacked.kind())) {
                    output.add(operators.pop());
                }
                operators.push(current);
            } else if (token instanceof Token.LeftParen) {
                operators.push(token);
            } else if (token instanceof Token.RightParen) {
                closeGroup(output, operators);
            }
        }

        while (!operators.isEmpty()) {
            Token top = operators.pop();
            if (top instanceof Token.LeftParen) {
                throw new ExpressionSyntaxException(ParseError.MISMATCHED_PARENTHESES,
                        "Mismatched parentheses: unmatched '('");
            }
            output.add(top);
        }

        return output;
    }

    private static void closeGroup(List<Token> output, Deque<Token> operators) {
        while (!operators.isEmpty()) {
            Token top = operators.pop();
            if (top instanceof Token.LeftParen) {
                return;
            }
            output.add(top);
        }
        throw new ExpressionSyntaxException(ParseError.MISMATCHED_PARENTHESES,
                "Mismatched parentheses: unmatched ')'");
    }
}
