package io.github.cyfko.logicql.core.exception;

import io.github.cyfko.logicql.core.api.ExpressionEngine;
import io.github.cyfko.logicql.core.parsing.PostfixConverter;
import io.github.cyfko.logicql.core.parsing.PostfixEvaluator;
import io.github.cyfko.logicql.core.parsing.TokenValidator;

import java.util.Objects;

/**
 * Exception thrown when a token sequence is structurally invalid or cannot be evaluated.
 * <p>
 * Each instance carries the {@link ParseError} kind that identifies the failing rule, so
 * callers can react to the kind rather than parse the message.
 * </p>
 *
 * <p><strong>Error Examples and Messages:</strong></p>
 * <pre>{@code
 * // 1. Empty expression
 * TokenValidator.requireValid(List.of(), policy);
 * // → EMPTY_EXPRESSION "Empty expression"
 *
 * // 2. Two operands in a row
 * TokenValidator.requireValid(List.of(variable(A), variable(B)), policy);
 * // → MISSING_OPERATOR "Missing operator between operands at position 0"
 *
 * // 3. Unbalanced group
 * PostfixConverter.toPostfix(List.of(LEFT_PAREN, variable(A)));
 * // → MISMATCHED_PARENTHESES "Mismatched parentheses: unmatched '('"
 * }</pre>
 *
 * <p>
 * The engine facade {@link ExpressionEngine#validateAndEvaluate} never lets this exception
 * escape: it is turned into a failed {@code EvaluationResult}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see TokenValidator
 * @see PostfixConverter
 * @see PostfixEvaluator
 */
public class ExpressionSyntaxException extends RuntimeException {

    private final ParseError error;

    /**
     * Creates an exception using the default message of the error kind.
     *
     * @param error the error kind, must not be null
     */
    public ExpressionSyntaxException(ParseError error) {
        this(error, Objects.requireNonNull(error, "Error kind cannot be null").getDefaultMessage());
    }

    /**
     * Creates an exception with an explanatory message.
     *
     * @param error   the error kind, must not be null
     * @param message the message describing the failure, ideally with the token position
     */
    public ExpressionSyntaxException(ParseError error, String message) {
        super(message);
        this.error = Objects.requireNonNull(error, "Error kind cannot be null");
    }

    /**
     * Creates an exception wrapping an underlying cause.
     *
     * @param error   the error kind, must not be null
     * @param message the message describing the failure
     * @param cause   the original cause
     */
    public ExpressionSyntaxException(ParseError error, String message, Throwable cause) {
        super(message, cause);
        this.error = Objects.requireNonNull(error, "Error kind cannot be null");
    }

    /**
     * Returns the kind of failure.
     *
     * @return the error kind, never null
     */
    public ParseError getError() {
        return error;
    }
}
