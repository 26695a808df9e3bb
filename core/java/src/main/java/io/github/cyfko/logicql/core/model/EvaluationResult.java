package io.github.cyfko.logicql.core.model;

import io.github.cyfko.logicql.core.exception.ExpressionSyntaxException;
import io.github.cyfko.logicql.core.exception.ParseError;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of evaluating an expression: either a boolean value or an error.
 * <p>
 * Exactly one of {@link #value()} and {@link #error()} is present.
 * </p>
 *
 * <pre>{@code
 * EvaluationResult result = engine.validateAndEvaluate(expression, env);
 * if (result.isSuccess()) {
 *     render(result.getValue());
 * } else {
 *     showError(result.getError().orElseThrow(), result.message());
 * }
 * }</pre>
 *
 * @param value   the computed value, null on failure
 * @param error   the failure kind, null on success
 * @param message human-readable failure description, null on success
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record EvaluationResult(Boolean value, ParseError error, String message) {

    public EvaluationResult {
        if ((value == null) == (error == null)) {
            throw new IllegalArgumentException("Exactly one of value and error must be set");
        }
    }

    public static EvaluationResult success(boolean value) {
        return new EvaluationResult(value, null, null);
    }

    public static EvaluationResult failure(ParseError error, String message) {
        return new EvaluationResult(null, Objects.requireNonNull(error, "error cannot be null"), message);
    }

    public static EvaluationResult failure(ExpressionSyntaxException e) {
        return failure(e.getError(), e.getMessage());
    }

    public boolean isSuccess() {
        return error == null;
    }

    /**
     * Returns the computed value.
     *
     * @return the boolean value
     * @throws NoSuchElementException if the evaluation failed
     */
    public boolean getValue() {
        if (value == null) {
            throw new NoSuchElementException("No value present, evaluation failed with " + error + ": " + message);
        }
        return value;
    }

    public Optional<ParseError> getError() {
        return Optional.ofNullable(error);
    }

    /**
     * Formats the outcome the way a result card shows it: {@code TRUE}, {@code FALSE} or the
     * error message.
     *
     * @return display text
     */
    public String display() {
        return isSuccess() ? String.valueOf(value).toUpperCase() : message;
    }
}
