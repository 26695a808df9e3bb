package io.github.cyfko.logicql.core.api;

import io.github.cyfko.logicql.core.exception.ExpressionSyntaxException;
import io.github.cyfko.logicql.core.model.EvaluationResult;
import io.github.cyfko.logicql.core.model.Expression;
import io.github.cyfko.logicql.core.table.TruthTable;
import io.github.cyfko.logicql.core.utils.ValidationResult;

import java.util.List;

/**
 * Entry point for validating, evaluating and tabulating boolean expressions built from
 * the fixed {@link TokenVocabulary}.
 *
 * <h2>Grammar</h2>
 * <table border="1">
 * <caption>Operator Reference</caption>
 * <thead>
 * <tr><th>Operator</th><th>Symbol</th><th>Precedence</th><th>Associativity</th><th>Example</th></tr>
 * </thead>
 * <tbody>
 * <tr><td>Parentheses</td><td>( )</td><td>Highest</td><td>N/A</td><td>(A || B) &amp;&amp; C</td></tr>
 * <tr><td>NOT</td><td>!</td><td>3</td><td>Right</td><td>!!A</td></tr>
 * <tr><td>AND</td><td>&amp;&amp;</td><td>2</td><td>Left</td><td>A &amp;&amp; B</td></tr>
 * <tr><td>OR</td><td>||</td><td>1</td><td>Left</td><td>A || B</td></tr>
 * </tbody>
 * </table>
 *
 * <h2>Grammar (EBNF)</h2>
 * <pre>
 * expression := term ('||' term)*
 * term       := factor ('&amp;&amp;' factor)*
 * factor     := '!'* (operand | '(' expression ')')
 * operand    := 'A' | 'B' | 'C' | 'TRUE' | 'FALSE'
 * </pre>
 *
 * <h2>Usage Examples</h2>
 * <pre>{@code
 * ExpressionEngine engine = LogicEngineFactory.create();
 *
 * Expression expr = Expression.parse("(A || B) && C");
 * EvaluationResult result = engine.validateAndEvaluate(expr,
 *         Environment.of(Map.of(Operand.B, true, Operand.C, true)));
 * result.getValue();                      // true
 *
 * TruthTable table = engine.buildTruthTable(expr);
 * table.size();                           // 8
 * }</pre>
 *
 * <h2>Error Detection</h2>
 * <p>
 * Malformed expressions never escape as exceptions from {@link #validateAndEvaluate}:
 * the failure kind is returned inside the {@link EvaluationResult}.
 * </p>
 * <pre>{@code
 * engine.validateAndEvaluate(Expression.empty(), env);            // EMPTY_EXPRESSION
 * engine.validateAndEvaluate(Expression.parse("A B"), env);       // MISSING_OPERATOR
 * engine.validateAndEvaluate(Expression.parse("&& A"), env);      // DANGLING_OPERATOR
 * engine.validateAndEvaluate(Expression.parse("(A"), env);        // MISMATCHED_PARENTHESES
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * Implementations keep no state between calls; every call is independent and idempotent.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface ExpressionEngine {

    /**
     * Validates, converts and evaluates an expression under an environment.
     *
     * @param expression  the token sequence
     * @param environment values of the free variables
     * @return the value, or the first error met
     * @throws NullPointerException if an argument is null
     */
    EvaluationResult validateAndEvaluate(Expression expression, Environment environment);

    /**
     * Builds the truth table of an expression over the free variables it uses.
     *
     * @param expression the token sequence
     * @return the table; empty when the expression uses no free variable
     * @throws NullPointerException if {@code expression} is null
     */
    TruthTable buildTruthTable(Expression expression);

    /**
     * Checks the structure of an expression without evaluating it.
     *
     * @param expression the token sequence
     * @return success or the first structural violation
     */
    ValidationResult validate(Expression expression);

    /**
     * Validates an expression and converts it to postfix order.
     *
     * @param expression the token sequence
     * @return the postfix tokens
     * @throws ExpressionSyntaxException if the expression is invalid
     */
    List<Token> toPostfix(Expression expression);

    /**
     * Returns the tokens a caller may assemble expressions from.
     *
     * @return the fixed vocabulary
     */
    default TokenVocabulary vocabulary() {
        return TokenVocabulary.standard();
    }
}
