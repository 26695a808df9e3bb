package io.github.cyfko.logicql.core.table;

import io.github.cyfko.logicql.core.api.Operand;
import io.github.cyfko.logicql.core.exception.ParseError;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One row of a truth table: an assignment of the used variables and its outcome.
 * <p>
 * A row either holds a boolean {@code result} or, when the pipeline failed for this
 * assignment, the {@link ParseError} that stopped it.
 * </p>
 *
 * @param assignment values of the used variables, in column order
 * @param result     the expression value, null if the row failed
 * @param error      the failure kind, null if the row succeeded
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record TruthTableRow(Map<Operand, Boolean> assignment, Boolean result, ParseError error) {

    public TruthTableRow {
        Objects.requireNonNull(assignment, "assignment cannot be null");
        if ((result == null) == (error == null)) {
            throw new IllegalArgumentException("Exactly one of result and error must be set");
        }
        assignment = Collections.unmodifiableMap(new LinkedHashMap<>(assignment));
    }

    public static TruthTableRow success(Map<Operand, Boolean> assignment, boolean result) {
        return new TruthTableRow(assignment, result, null);
    }

    public static TruthTableRow failure(Map<Operand, Boolean> assignment, ParseError error) {
        return new TruthTableRow(assignment, null, error);
    }

    public boolean isError() {
        return error != null;
    }

    /**
     * Renders the outcome cell.
     *
     * @param errorSentinel text used for failed rows
     * @return {@code "true"}, {@code "false"} or the sentinel
     */
    public String resultText(String errorSentinel) {
        return isError() ? errorSentinel : String.valueOf(result);
    }
}
