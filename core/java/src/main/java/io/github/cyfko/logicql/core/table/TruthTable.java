package io.github.cyfko.logicql.core.table;

import io.github.cyfko.logicql.core.api.Operand;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Truth table of an expression over the free variables it uses.
 * <p>
 * Rows are ordered by assignment mask, most significant bit first: for variables
 * {@code [A, B]} the rows are {@code (F,F), (F,T), (T,F), (T,T)}.
 * A table built from an expression without free variables is empty.
 * </p>
 *
 * @param variables     the used variables, ascending; they are the table columns
 * @param rows          one row per assignment, {@code 2^variables.size()} rows unless empty
 * @param errorSentinel text rendered for failed rows
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record TruthTable(List<Operand> variables, List<TruthTableRow> rows, String errorSentinel) {

    public TruthTable {
        variables = List.copyOf(Objects.requireNonNull(variables, "variables cannot be null"));
        rows = List.copyOf(Objects.requireNonNull(rows, "rows cannot be null"));
        Objects.requireNonNull(errorSentinel, "errorSentinel cannot be null");
    }

    public static TruthTable empty(String errorSentinel) {
        return new TruthTable(List.of(), List.of(), errorSentinel);
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public int size() {
        return rows.size();
    }

    /**
     * Returns the mask of every row whose result is {@code true}.
     * <p>
     * The mask of a row is its index, so minterms read directly as the canonical
     * sum-of-products of the expression. Failed rows are never minterms.
     * </p>
     *
     * @return ascending row indices evaluating to {@code true}
     */
    public List<Integer> minterms() {
        List<Integer> terms = new ArrayList<>();
        for (int i = 0; i < rows.size(); i++) {
            if (Boolean.TRUE.equals(rows.get(i).result())) {
                terms.add(i);
            }
        }
        return terms;
    }

    /**
     * Renders the table as plain text: one header line with the variable names and
     * {@code RESULT}, then one line per row.
     *
     * <pre>
     * A      B      RESULT
     * false  false  false
     * false  true   false
     * true   false  false
     * true   true   true
     * </pre>
     *
     * @return the rendered table, or an empty string for an empty table
     */
    public String render() {
        if (isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (Operand variable : variables) {
            sb.append(cell(variable.getLabel()));
        }
        sb.append("RESULT").append('\n');
        for (TruthTableRow row : rows) {
            for (Operand variable : variables) {
                sb.append(cell(String.valueOf(row.assignment().get(variable))));
            }
            sb.append(row.resultText(errorSentinel)).append('\n');
        }
        return sb.toString();
    }

    private static String cell(String text) {
        return String.format("%-7s", text);
    }
}
