package io.github.cyfko.logicql.core.utils;

import io.github.cyfko.logicql.core.exception.ExpressionSyntaxException;
import io.github.cyfko.logicql.core.exception.ParseError;

import java.util.Objects;

/**
 * Class representing the result of a structural validation.
 * <p>
 * The result is either a success or a failure carrying the {@link ParseError} kind, the
 * position of the offending token and a message.
 * </p>
 *
 * <p>Instances are immutable and created via the static methods
 * {@link #success()} and {@link #failure(ParseError, int, String)}.</p>
 *
 * <p>Usage example:</p>
 * <pre>{@code
 * ValidationResult result = TokenValidator.validate(tokens, policy);
 * if (!result.isValid()) {
 *     System.out.println(result.getError() + ": " + result.getErrorMessage());
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ValidationResult {

    private static final ValidationResult SUCCESS = new ValidationResult(null, -1, null);

    private final ParseError error;
    private final int position;
    private final String errorMessage;

    private ValidationResult(ParseError error, int position, String errorMessage) {
        this.error = error;
        this.position = position;
        this.errorMessage = errorMessage;
    }

    /**
     * Creates an instance indicating a successful validation.
     *
     * @return a valid result with no error
     */
    public static ValidationResult success() {
        return SUCCESS;
    }

    /**
     * Creates an instance indicating a failed validation.
     *
     * @param error        the failed rule, must not be null
     * @param position     index of the offending token, {@code -1} when not tied to a token
     * @param errorMessage message explaining the reason for failure
     * @return an invalid result
     */
    public static ValidationResult failure(ParseError error, int position, String errorMessage) {
        return new ValidationResult(Objects.requireNonNull(error, "Error kind cannot be null"), position, errorMessage);
    }

    public boolean isValid() {
        return error == null;
    }

    /**
     * Returns the failed rule.
     *
     * @return the error kind, or null if valid
     */
    public ParseError getError() {
        return error;
    }

    /**
     * Returns the index of the token that triggered the failure.
     *
     * @return token index, or {@code -1} if valid or not tied to a single token
     */
    public int getPosition() {
        return position;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    /**
     * Throws the failure as an {@link ExpressionSyntaxException}; does nothing when valid.
     *
     * @throws ExpressionSyntaxException if this result is a failure
     */
    public void orThrow() {
        if (error != null) {
            throw new ExpressionSyntaxException(error, errorMessage);
        }
    }

    @Override
    public String toString() {
        return isValid() ? "ValidationResult[valid=true]"
                : "ValidationResult[valid=false, error=" + error + ", position=" + position + ", message=" + errorMessage + "]";
    }
}
