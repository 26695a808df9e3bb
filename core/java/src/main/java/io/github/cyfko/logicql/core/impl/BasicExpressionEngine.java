package io.github.cyfko.logicql.core.impl;

import io.github.cyfko.logicql.core.api.Environment;
import io.github.cyfko.logicql.core.api.ExpressionEngine;
import io.github.cyfko.logicql.core.api.Token;
import io.github.cyfko.logicql.core.config.EnginePolicy;
import io.github.cyfko.logicql.core.exception.ExpressionSyntaxException;
import io.github.cyfko.logicql.core.model.EvaluationResult;
import io.github.cyfko.logicql.core.model.Expression;
import io.github.cyfko.logicql.core.parsing.PostfixConverter;
import io.github.cyfko.logicql.core.parsing.PostfixEvaluator;
import io.github.cyfko.logicql.core.parsing.TokenValidator;
import io.github.cyfko.logicql.core.table.TruthTable;
import io.github.cyfko.logicql.core.table.TruthTableEnumerator;
import io.github.cyfko.logicql.core.utils.ValidationResult;

import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Default {@link ExpressionEngine} running the three-phase pipeline on every call.
 *
 * <h2>Three-Phase Architecture</h2>
 * <ol>
 *   <li><strong>Phase 1</strong>: {@link TokenValidator} - adjacency rules, length limit</li>
 *   <li><strong>Phase 2</strong>: {@link PostfixConverter} - shunting-yard conversion, parenthesis balance</li>
 *   <li><strong>Phase 3</strong>: {@link PostfixEvaluator} - stack evaluation under the environment</li>
 * </ol>
 * <p>
 * Each phase short-circuits the next one on failure. Nothing is cached: the full token
 * sequence is re-parsed on every evaluation, including once per truth-table row.
 * </p>
 *
 * <h2>Usage examples</h2>
 * <pre>{@code
 * // Default configuration
 * ExpressionEngine engine = new BasicExpressionEngine();
 *
 * // Relaxed grouping rules
 * ExpressionEngine relaxed = new BasicExpressionEngine(EnginePolicy.relaxed());
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class BasicExpressionEngine implements ExpressionEngine {

    private static final Logger log = Logger.getLogger(BasicExpressionEngine.class.getName());

    private final EnginePolicy policy;

    /**
     * Default constructor using {@link EnginePolicy#defaults()}.
     */
    public BasicExpressionEngine() {
        this(EnginePolicy.defaults());
    }

    /**
     * Constructor with custom configuration.
     *
     * @param policy the engine policy
     * @throws IllegalArgumentException if policy is null
     */
    public BasicExpressionEngine(EnginePolicy policy) {
        if (policy == null) {
            throw new IllegalArgumentException("Engine policy is required");
        }
        this.policy = policy;
    }

    public EnginePolicy getPolicy() {
        return policy;
    }

    @Override
    public EvaluationResult validateAndEvaluate(Expression expression, Environment environment) {
        Objects.requireNonNull(expression, "expression cannot be null");
        Objects.requireNonNull(environment, "environment cannot be null");

        try {
            List<Token> postfix = toPostfix(expression);
            boolean value = PostfixEvaluator.evaluate(postfix, environment);

            log.fine(() -> String.format("Evaluated [%s] under %s: %s", expression, environment, value));
            return EvaluationResult.success(value);
        } catch (ExpressionSyntaxException e) {
            log.fine(() -> String.format("Rejected [%s]: %s (%s)", expression, e.getError(), e.getMessage()));
            return EvaluationResult.failure(e);
        }
    }

    @Override
    public TruthTable buildTruthTable(Expression expression) {
        Objects.requireNonNull(expression, "expression cannot be null");

        long start = System.nanoTime();
        TruthTable table = TruthTableEnumerator.enumerate(expression, this::validateAndEvaluate, policy.errorSentinel());
        long durationMs = (System.nanoTime() - start) / 1_000_000;

        log.info(() -> String.format(
                "Truth table for [%s] built over %s: %d rows in %d ms",
                expression, table.variables(), table.size(), durationMs
        ));
        return table;
    }

    @Override
    public ValidationResult validate(Expression expression) {
        Objects.requireNonNull(expression, "expression cannot be null");
        return TokenValidator.validate(expression.tokens(), policy);
    }

    @Override
    public List<Token> toPostfix(Expression expression) {
        Objects.requireNonNull(expression, "expression cannot be null");

        // Phase 1: structural validation
        TokenValidator.requireValid(expression.tokens(), policy);

        // Phase 2: postfix conversion
        List<Token> postfix = PostfixConverter.toPostfix(expression.tokens());

        log.finer(() -> String.format("Postfix of [%s]: %s", expression, postfix));
        return postfix;
    }

    @Override
    public String toString() {
        return "BasicExpressionEngine[" + policy.policyName() + "]";
    }
}
