package io.github.cyfko.logicql.core.api;

import java.util.Objects;

/**
 * A single element of a boolean expression.
 * <p>
 * The vocabulary is closed: a token is exactly one of four cases.
 * </p>
 * <ul>
 *   <li>{@link Variable} - an operand, free ({@code A}, {@code B}, {@code C}) or constant ({@code TRUE}, {@code FALSE})</li>
 *   <li>{@link Operator} - one of {@code !}, {@code &&}, {@code ||}</li>
 *   <li>{@link LeftParen} / {@link RightParen} - grouping markers without payload</li>
 * </ul>
 *
 * <p>All cases are immutable records, so equality is structural:</p>
 * <pre>{@code
 * Token.variable(Operand.A).equals(new Token.Variable(Operand.A)); // true
 * Token.LEFT_PAREN.equals(new Token.LeftParen());                  // true
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public sealed interface Token permits Token.Variable, Token.Operator, Token.LeftParen, Token.RightParen {

    LeftParen LEFT_PAREN = new LeftParen();

    RightParen RIGHT_PAREN = new RightParen();

    /**
     * Returns the text shown for this token on a chip or in a rendered expression.
     *
     * @return the display label
     */
    String label();

    /**
     * Operand token.
     *
     * @param name the operand carried by this token
     */
    record Variable(Operand name) implements Token {
        public Variable {
            Objects.requireNonNull(name, "Variable name cannot be null");
        }

        @Override
        public String label() {
            return name.getLabel();
        }

        @Override
        public String toString() {
            return "Variable(" + name + ")";
        }
    }

    /**
     * Operator token.
     *
     * @param kind the logical operator
     */
    record Operator(Op kind) implements Token {
        public Operator {
            Objects.requireNonNull(kind, "Operator kind cannot be null");
        }

        @Override
        public String label() {
            return kind.getSymbol();
        }

        @Override
        public String toString() {
            return "Operator(" + kind + ")";
        }
    }

    /** Opening grouping marker. */
    record LeftParen() implements Token {
        @Override
        public String label() {
            return "(";
        }

        @Override
        public String toString() {
            return "LeftParen";
        }
    }

    /** Closing grouping marker. */
    record RightParen() implements Token {
        @Override
        public String label() {
            return ")";
        }

        @Override
        public String toString() {
            return "RightParen";
        }
    }

    static Variable variable(Operand name) {
        return new Variable(name);
    }

    static Operator operator(Op kind) {
        return new Operator(kind);
    }

    /**
     * Tells whether the token is an operator of the given kind.
     *
     * @param token the token to inspect, may be {@code null}
     * @param kind  the expected operator kind
     * @return {@code true} if {@code token} is {@code Operator(kind)}
     */
    static boolean isOperator(Token token, Op kind) {
        return token instanceof Operator operator && operator.kind() == kind;
    }

    /**
     * Tells whether the token is a binary operator ({@code &&} or {@code ||}).
     *
     * @param token the token to inspect, may be {@code null}
     * @return {@code true} for binary operator tokens
     */
    static boolean isBinaryOperator(Token token) {
        return token instanceof Operator operator && operator.kind().isBinary();
    }
}
