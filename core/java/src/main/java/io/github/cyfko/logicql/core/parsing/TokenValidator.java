package io.github.cyfko.logicql.core.parsing;

import io.github.cyfko.logicql.core.api.Op;
import io.github.cyfko.logicql.core.api.Token;
import io.github.cyfko.logicql.core.config.EnginePolicy;
import io.github.cyfko.logicql.core.exception.ExpressionSyntaxException;
import io.github.cyfko.logicql.core.exception.ParseError;
import io.github.cyfko.logicql.core.utils.ValidationResult;

import java.util.List;
import java.util.Objects;

/**
 * Linear structural check of a token sequence, run before postfix conversion.
 * <p>
 * The validator looks at each token together with its neighbours and reports the first
 * illegal adjacency, so that malformed input is rejected with an attributable
 * {@link ParseError} instead of a generic stack failure later on.
 * </p>
 *
 * <h2>Rules</h2>
 * <table border="1">
 * <caption>Adjacency rules (checked left to right)</caption>
 * <thead><tr><th>Situation</th><th>Error</th></tr></thead>
 * <tbody>
 * <tr><td>No tokens</td><td>{@link ParseError#EMPTY_EXPRESSION}</td></tr>
 * <tr><td>More tokens than {@link EnginePolicy#maxTokenCount()}</td><td>{@link ParseError#EXPRESSION_TOO_LONG}</td></tr>
 * <tr><td>Operand followed by operand or {@code (}</td><td>{@link ParseError#MISSING_OPERATOR}</td></tr>
 * <tr><td>{@code )} followed by operand or {@code (}</td><td>{@link ParseError#MISSING_OPERATOR}</td></tr>
 * <tr><td>{@code &&}/{@code ||} first or last</td><td>{@link ParseError#DANGLING_OPERATOR}</td></tr>
 * <tr><td>{@code &&}/{@code ||} after an operator or {@code (}</td><td>{@link ParseError#INVALID_OPERATOR_PLACEMENT}</td></tr>
 * <tr><td>{@code !} followed by {@code &&}/{@code ||}</td><td>{@link ParseError#INVALID_OPERATOR_PLACEMENT}</td></tr>
 * <tr><td>{@code (} followed by {@code )} (strict grouping)</td><td>{@link ParseError#EMPTY_GROUP}</td></tr>
 * <tr><td>Operator followed by {@code )}, or {@code !} last (strict grouping)</td><td>{@link ParseError#DANGLING_OPERATOR}</td></tr>
 * </tbody>
 * </table>
 *
 * <p>
 * Parenthesis balance is not checked here: it needs a stack and belongs to
 * {@link PostfixConverter}.
 * </p>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * This class is stateless and thread-safe.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see PostfixConverter
 */
public final class TokenValidator {

    private TokenValidator() {
        // Utility class - prevent instantiation
    }

    /**
     * Validates the structure of a token sequence.
     *
     * @param tokens the token sequence, not modified
     * @param policy engine policy (length limit, grouping rules)
     * @return success, or the first violation found
     * @throws NullPointerException if an argument or a token is null
     */
    public static ValidationResult validate(List<Token> tokens, EnginePolicy policy) {
        Objects.requireNonNull(tokens, "tokens cannot be null");
        Objects.requireNonNull(policy, "policy cannot be null");

        if (tokens.isEmpty()) {
            return ValidationResult.failure(ParseError.EMPTY_EXPRESSION, -1, ParseError.EMPTY_EXPRESSION.getDefaultMessage());
        }

        if (tokens.size() > policy.maxTokenCount()) {
            return ValidationResult.failure(ParseError.EXPRESSION_TOO_LONG, -1, String.format(
                    "Expression too long (%d tokens, max: %d). Policy applied: %s",
                    tokens.size(), policy.maxTokenCount(), policy.policyName()
            ));
        }

        for (int i = 0; i < tokens.size(); i++) {
            Token current = Objects.requireNonNull(tokens.get(i), "Token at position " + i + " is null");
            Token previous = i > 0 ? tokens.get(i - 1) : null;
            Token next = i + 1 < tokens.size() ? tokens.get(i + 1) : null;

            ValidationResult violation = checkAdjacency(i, previous, current, next, policy);
            if (!violation.isValid()) {
                return violation;
            }
        }

        return ValidationResult.success();
    }

    /**
     * Validates the structure of a token sequence, throwing on the first violation.
     *
     * @param tokens the token sequence
     * @param policy engine policy
     * @throws ExpressionSyntaxException if the sequence is structurally invalid
     */
    public static void requireValid(List<Token> tokens, EnginePolicy policy) {
        validate(tokens, policy).orThrow();
    }

    private static ValidationResult checkAdjacency(int i, Token previous, Token current, Token next, EnginePolicy policy) {
        if (current instanceof Token.Variable && opensOperand(next)) {
            return ValidationResult.failure(ParseError.MISSING_OPERATOR, i, String.format(
                    "Missing operator between operands at position %d", i));
        }

        if (current instanceof Token.RightParen && opensOperand(next)) {
            return ValidationResult.failure(ParseError.MISSING_OPERATOR, i, String.format(
                    "Missing operator between ')' and next token at position %d", i));
        }

        if (Token.isBinaryOperator(current)) {
            if (previous == null || next == null) {
                return ValidationResult.failure(ParseError.DANGLING_OPERATOR, i, String.format(
                        "Binary operator '%s' needs operands on both sides at position %d", current.label(), i));
            }
            if (previous instanceof Token.Operator || previous instanceof Token.LeftParen) {
                return ValidationResult.failure(ParseError.INVALID_OPERATOR_PLACEMENT, i, String.format(
                        "Binary operator '%s' cannot follow '%s' at position %d", current.label(), previous.label(), i));
            }
        }

        if (Token.isOperator(current, Op.NOT) && Token.isBinaryOperator(next)) {
            return ValidationResult.failure(ParseError.INVALID_OPERATOR_PLACEMENT, i, String.format(
                    "'!' must be followed by an operand, '!' or '(' at position %d", i));
        }

        if (policy.strictGrouping()) {
            return checkGrouping(i, current, next);
        }

        return ValidationResult.success();
    }

    private static ValidationResult checkGrouping(int i, Token current, Token next) {
        if (current instanceof Token.LeftParen && next instanceof Token.RightParen) {
            return ValidationResult.failure(ParseError.EMPTY_GROUP, i, String.format(
                    "Parentheses must contain an operand at position %d", i));
        }

        if (current instanceof Token.Operator && next instanceof Token.RightParen) {
            return ValidationResult.failure(ParseError.DANGLING_OPERATOR, i, String.format(
                    "Operator '%s' is missing its right operand before ')' at position %d", current.label(), i));
        }

        if (Token.isOperator(current, Op.NOT) && next == null) {
            return ValidationResult.failure(ParseError.DANGLING_OPERATOR, i, String.format(
                    "'!' is missing its operand at position %d", i));
        }

        return ValidationResult.success();
    }

    /**
     * Tokens that start a new operand: a variable or an opening group.
     */
    private static boolean opensOperand(Token token) {
        return token instanceof Token.Variable || token instanceof Token.LeftParen;
    }
}
