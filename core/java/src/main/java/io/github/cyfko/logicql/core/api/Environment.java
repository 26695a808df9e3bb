package io.github.cyfko.logicql.core.api;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Assignment of boolean values to the free variables {@code A}, {@code B} and {@code C}.
 * <p>
 * Variables without an explicit binding read as {@code false}. Constant operands
 * ({@link Operand#TRUE}, {@link Operand#FALSE}) cannot be bound and are never looked up:
 * evaluation resolves them without consulting the environment.
 * </p>
 *
 * <pre>{@code
 * Environment env = Environment.of(Map.of(Operand.A, true));
 * env.valueOf(Operand.A);                 // true
 * env.valueOf(Operand.B);                 // false (missing key)
 * env.toggle(Operand.B).valueOf(Operand.B); // true, env itself is unchanged
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface Environment {

    /**
     * Reads the value bound to a free variable.
     *
     * @param variable a free variable
     * @return the bound value, {@code false} when unbound
     * @throws IllegalArgumentException if {@code variable} is a constant operand
     */
    boolean valueOf(Operand variable);

    /**
     * Returns the explicit bindings of this environment.
     *
     * @return unmodifiable view of the bindings
     */
    Map<Operand, Boolean> bindings();

    /**
     * Returns a copy of this environment with one variable rebound.
     *
     * @param variable a free variable
     * @param value    the new value
     * @return a new environment
     * @throws IllegalArgumentException if {@code variable} is a constant operand
     */
    default Environment with(Operand variable, boolean value) {
        Map<Operand, Boolean> copy = new EnumMap<>(Operand.class);
        copy.putAll(bindings());
        copy.put(variable, value);
        return of(copy);
    }

    /**
     * Returns a copy of this environment with one variable flipped.
     *
     * @param variable a free variable
     * @return a new environment
     */
    default Environment toggle(Operand variable) {
        return with(variable, !valueOf(variable));
    }

    /**
     * Environment in which every free variable is {@code false}.
     *
     * @return an empty environment
     */
    static Environment none() {
        return MapEnvironment.EMPTY;
    }

    /**
     * Environment in which every free variable is {@code true}.
     *
     * @return a fully bound environment
     */
    static Environment all() {
        Map<Operand, Boolean> values = new EnumMap<>(Operand.class);
        for (Operand variable : Operand.freeVariables()) {
            values.put(variable, true);
        }
        return of(values);
    }

    /**
     * Creates an environment from explicit bindings.
     *
     * @param values the bindings, copied
     * @return a new environment
     * @throws IllegalArgumentException if a constant operand is bound
     * @throws NullPointerException if {@code values} or any value is {@code null}
     */
    static Environment of(Map<Operand, Boolean> values) {
        return new MapEnvironment(values);
    }

    /**
     * Default immutable implementation backed by an {@link EnumMap}.
     */
    final class MapEnvironment implements Environment {

        private static final MapEnvironment EMPTY = new MapEnvironment(Map.of());

        private final Map<Operand, Boolean> values;

        private MapEnvironment(Map<Operand, Boolean> values) {
            Objects.requireNonNull(values, "Environment values cannot be null");
            Map<Operand, Boolean> copy = new EnumMap<>(Operand.class);
            values.forEach((variable, value) -> {
                requireFree(variable);
                copy.put(variable, Objects.requireNonNull(value, "Value of " + variable + " cannot be null"));
            });
            this.values = Collections.unmodifiableMap(copy);
        }

        @Override
        public boolean valueOf(Operand variable) {
            requireFree(variable);
            return values.getOrDefault(variable, Boolean.FALSE);
        }

        @Override
        public Map<Operand, Boolean> bindings() {
            return values;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof MapEnvironment that)) return false;
            return values.equals(that.values);
        }

        @Override
        public int hashCode() {
            return values.hashCode();
        }

        @Override
        public String toString() {
            return "Environment" + values;
        }

        private static void requireFree(Operand variable) {
            Objects.requireNonNull(variable, "Variable cannot be null");
            if (variable.isConstant()) {
                throw new IllegalArgumentException(variable + " is a constant and cannot be bound");
            }
        }
    }
}
