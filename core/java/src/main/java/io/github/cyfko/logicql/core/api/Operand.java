package io.github.cyfko.logicql.core.api;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Enumeration of the operands a {@link Token.Variable} can carry.
 * <p>
 * {@link #A}, {@link #B} and {@link #C} are free variables resolved against an
 * {@link Environment}. {@link #TRUE} and {@link #FALSE} occupy the same grammatical slot
 * but always evaluate to a fixed constant and are never looked up.
 * </p>
 *
 * <p><strong>Example usage:</strong></p>
 * <pre>{@code
 * Operand op = Operand.fromString("true");   // Operand.TRUE
 * op.isConstant();                           // true
 * op.constantValue();                        // true
 *
 * Operand.freeVariables();                   // [A, B, C]
 * }</pre>
 *
 * <p>Declaration order is the ascending order used for truth-table columns.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum Operand {

    /** Free variable {@code A}. */
    A(null),

    /** Free variable {@code B}. */
    B(null),

    /** Free variable {@code C}. */
    C(null),

    /** Constant operand, always {@code true}. */
    TRUE(Boolean.TRUE),

    /** Constant operand, always {@code false}. */
    FALSE(Boolean.FALSE);

    private static final List<Operand> FREE_VARIABLES = Arrays.stream(values())
            .filter(o -> !o.isConstant())
            .collect(Collectors.toUnmodifiableList());

    private final Boolean constant;

    Operand(Boolean constant) {
        this.constant = constant;
    }

    /**
     * Indicates whether this operand is a constant ({@code TRUE} or {@code FALSE}).
     *
     * @return {@code true} for constants, {@code false} for free variables
     */
    public boolean isConstant() {
        return constant != null;
    }

    /**
     * Returns the fixed value of a constant operand.
     *
     * @return the constant value
     * @throws UnsupportedOperationException if this operand is a free variable
     */
    public boolean constantValue() {
        if (constant == null)
            throw new UnsupportedOperationException("Free variable " + name() + " has no constant value.");
        return constant;
    }

    /**
     * Returns the label shown for this operand.
     *
     * @return the operand name
     */
    public String getLabel() {
        return name();
    }

    /**
     * Lists the free variables in ascending order.
     *
     * @return unmodifiable list of the non-constant operands
     */
    public static List<Operand> freeVariables() {
        return FREE_VARIABLES;
    }

    /**
     * Finds an operand by its name, ignoring case and surrounding whitespace.
     *
     * @param value operand name
     * @return matching operand
     * @throws IllegalArgumentException if no operand has this name
     * @throws NullPointerException if {@code value} is {@code null}
     */
    public static Operand fromString(String value) {
        String trimmed = value.trim();
        for (Operand operand : values()) {
            if (operand.name().equalsIgnoreCase(trimmed)) return operand;
        }
        throw new IllegalArgumentException("Unknown operand: '" + value + "'");
    }
}
