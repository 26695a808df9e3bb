package io.github.cyfko.logicql.core.api;

/**
 * Enumeration of the logical operators of the expression grammar.
 * <p>
 * Each operator defines its surface symbol, its precedence and its associativity.
 * </p>
 *
 * <table border="1">
 * <caption>Operator Reference</caption>
 * <thead>
 * <tr><th>Operator</th><th>Symbol</th><th>Precedence</th><th>Associativity</th><th>Arity</th></tr>
 * </thead>
 * <tbody>
 * <tr><td>NOT</td><td>!</td><td>3</td><td>Right</td><td>1</td></tr>
 * <tr><td>AND</td><td>&amp;&amp;</td><td>2</td><td>Left</td><td>2</td></tr>
 * <tr><td>OR</td><td>||</td><td>1</td><td>Left</td><td>2</td></tr>
 * </tbody>
 * </table>
 *
 * <p><strong>Example usage:</strong></p>
 * <pre>{@code
 * Op op = Op.fromString("&&");      // Op.AND
 * op.isBinary();                    // true
 * op.apply(true, false);            // false
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum Op {

    /** Negation operator: "!" */
    NOT("!", 3, Associativity.RIGHT),

    /** Conjunction operator: "&amp;&amp;" */
    AND("&&", 2, Associativity.LEFT),

    /** Disjunction operator: "||" */
    OR("||", 1, Associativity.LEFT);

    /**
     * Direction in which operators of equal precedence group.
     */
    public enum Associativity {
        LEFT,
        RIGHT
    }

    private final String symbol;
    private final int precedence;
    private final Associativity associativity;

    Op(String symbol, int precedence, Associativity associativity) {
        this.symbol = symbol;
        this.precedence = precedence;
        this.associativity = associativity;
    }

    /**
     * Returns the surface symbol of the operator ({@code !}, {@code &&} or {@code ||}).
     *
     * @return the operator symbol
     */
    public String getSymbol() {
        return symbol;
    }

    /**
     * Returns the binding strength of the operator; higher binds tighter.
     *
     * @return the precedence level
     */
    public int getPrecedence() {
        return precedence;
    }

    public Associativity getAssociativity() {
        return associativity;
    }

    public boolean isRightAssociative() {
        return associativity == Associativity.RIGHT;
    }

    /**
     * Indicates whether this operator takes two operands.
     *
     * @return {@code true} for {@link #AND} and {@link #OR}
     */
    public boolean isBinary() {
        return this != NOT;
    }

    /**
     * Decides whether {@code stacked}, sitting on top of the operator stack, must be
     * emitted before this operator is pushed.
     * <p>
     * Left-associative operators yield to operators of higher or equal precedence,
     * right-associative ones only to strictly higher precedence.
     * </p>
     *
     * @param stacked the operator currently on top of the stack
     * @return {@code true} if {@code stacked} must be popped first
     */
    public boolean yieldsTo(Op stacked) {
        return isRightAssociative()
                ? precedence < stacked.precedence
                : precedence <= stacked.precedence;
    }

    /**
     * Applies a binary operator to two already evaluated operands.
     *
     * @param left  the first operand (pushed earlier)
     * @param right the second operand (pushed last)
     * @return the combined value
     * @throws UnsupportedOperationException if called on {@link #NOT}
     */
    public boolean apply(boolean left, boolean right) {
        return switch (this) {
            case AND -> left & right;
            case OR -> left | right;
            case NOT -> throw new UnsupportedOperationException(name() + " is not a binary operator.");
        };
    }

    /**
     * Finds an operator by its symbol or name, ignoring case.
     *
     * @param value symbol or name to search for
     * @return matching operator
     * @throws IllegalArgumentException if nothing matches
     * @throws NullPointerException if {@code value} is {@code null}
     */
    public static Op fromString(String value) {
        String trimmed = value.trim();
        for (Op op : values()) {
            if (op.symbol.equals(trimmed)) return op;
            if (op.name().equalsIgnoreCase(trimmed)) return op;
        }
        throw new IllegalArgumentException("Unknown operator: '" + value + "'");
    }
}
