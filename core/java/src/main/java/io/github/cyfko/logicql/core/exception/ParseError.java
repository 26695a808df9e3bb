package io.github.cyfko.logicql.core.exception;

/**
 * Kinds of failure an expression can be rejected with.
 * <p>
 * Every stage of the pipeline reports one of these kinds; none of them is ever
 * silently corrected.
 * </p>
 *
 * <table border="1">
 * <caption>Error kinds by stage</caption>
 * <thead><tr><th>Stage</th><th>Kinds</th></tr></thead>
 * <tbody>
 * <tr><td>Lexer</td><td>{@link #UNKNOWN_TOKEN}</td></tr>
 * <tr><td>Validator</td><td>{@link #EMPTY_EXPRESSION}, {@link #EXPRESSION_TOO_LONG}, {@link #MISSING_OPERATOR},
 *     {@link #DANGLING_OPERATOR}, {@link #INVALID_OPERATOR_PLACEMENT}, {@link #EMPTY_GROUP}</td></tr>
 * <tr><td>Converter</td><td>{@link #MISMATCHED_PARENTHESES}</td></tr>
 * <tr><td>Evaluator</td><td>{@link #INCOMPLETE_EXPRESSION}, {@link #UNKNOWN_OPERATOR}</td></tr>
 * </tbody>
 * </table>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum ParseError {

    EMPTY_EXPRESSION("Empty expression"),

    MISSING_OPERATOR("Missing operator between operands"),

    DANGLING_OPERATOR("Binary operator needs operands on both sides"),

    INVALID_OPERATOR_PLACEMENT("Operator is not allowed at this position"),

    MISMATCHED_PARENTHESES("Mismatched parentheses"),

    INCOMPLETE_EXPRESSION("Incomplete expression"),

    /** Postfix element that is not NOT, AND or OR. Unreachable with the closed vocabulary. */
    UNKNOWN_OPERATOR("Unknown operator"),

    /** A group {@code ()} containing nothing. */
    EMPTY_GROUP("Parentheses must contain an operand"),

    EXPRESSION_TOO_LONG("Expression too long"),

    /** Text the lexer cannot map to a token. */
    UNKNOWN_TOKEN("Unknown token");

    private final String defaultMessage;

    ParseError(String defaultMessage) {
        this.defaultMessage = defaultMessage;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }
}
