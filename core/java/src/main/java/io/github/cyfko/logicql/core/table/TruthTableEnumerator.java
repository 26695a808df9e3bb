package io.github.cyfko.logicql.core.table;

import io.github.cyfko.logicql.core.api.Environment;
import io.github.cyfko.logicql.core.api.Operand;
import io.github.cyfko.logicql.core.model.EvaluationResult;
import io.github.cyfko.logicql.core.model.Expression;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiFunction;

/**
 * Enumerates every assignment of the free variables used by an expression and evaluates
 * the expression once per assignment.
 *
 * <h2>Algorithm</h2>
 * <pre>
 * vars = expression.usedVariables()        // ascending, n = vars.size()
 * if n == 0: return empty table
 * for mask in [0, 2^n):
 *   vars[i] = bit (n - 1 - i) of mask      // most significant bit first
 *   unused free variables = false
 *   row = pipeline(expression, assignment) // full validate + convert + evaluate
 * </pre>
 *
 * <p>
 * A failing evaluation produces a row carrying the error instead of aborting the table.
 * The pipeline is re-run for every row even when the failure does not depend on the
 * assignment.
 * </p>
 *
 * <p>
 * The variable list is derived from the expression, so the enumerator is not bound to the
 * three variables of the current vocabulary; masks are {@code long} values, which caps
 * tables at 62 variables.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class TruthTableEnumerator {

    private static final int MAX_VARIABLES = Long.SIZE - 2;

    private TruthTableEnumerator() {}

    /**
     * Builds the truth table of an expression.
     *
     * @param expression    the expression
     * @param pipeline      evaluation of the expression under one environment
     * @param errorSentinel text rendered for failed rows
     * @return the truth table, empty if the expression uses no free variable
     * @throws NullPointerException if an argument is null
     */
    public static TruthTable enumerate(Expression expression,
                                       BiFunction<Expression, Environment, EvaluationResult> pipeline,
                                       String errorSentinel) {
        Objects.requireNonNull(expression, "expression cannot be null");
        Objects.requireNonNull(pipeline, "pipeline cannot be null");

        List<Operand> variables = expression.usedVariables();
        int n = variables.size();
        if (n == 0) {
            return TruthTable.empty(errorSentinel);
        }
        if (n > MAX_VARIABLES) {
            throw new IllegalArgumentException("Too many variables for a truth table: " + n);
        }

        long total = 1L << n;
        List<TruthTableRow> rows = new ArrayList<>((int) Math.min(total, 1 << 16));
        for (long mask = 0; mask < total; mask++) {
            Map<Operand, Boolean> assignment = assignment(variables, mask);
            EvaluationResult result = pipeline.apply(expression, Environment.of(assignment));
            rows.add(result.isSuccess()
                    ? TruthTableRow.success(assignment, result.getValue())
                    : TruthTableRow.failure(assignment, result.error()));
        }
        return new TruthTable(variables, rows, errorSentinel);
    }

    /**
     * Maps list position {@code i} to bit {@code n - 1 - i} of {@code mask}.
     */
    static Map<Operand, Boolean> assignment(List<Operand> variables, long mask) {
        int n = variables.size();
        Map<Operand, Boolean> assignment = new LinkedHashMap<>(n * 2);
        for (int i = 0; i < n; i++) {
            assignment.put(variables.get(i), ((mask >> (n - 1 - i)) & 1L) == 1L);
        }
        return assignment;
    }
}
