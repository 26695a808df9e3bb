package io.github.cyfko.logicql.core;

import io.github.cyfko.logicql.core.api.ExpressionEngine;
import io.github.cyfko.logicql.core.config.EnginePolicy;
import io.github.cyfko.logicql.core.impl.BasicExpressionEngine;

import java.util.Objects;

/**
 * High-level facade creating {@link ExpressionEngine} instances.
 *
 * <p><strong>Complete Usage Example:</strong></p>
 * <pre>{@code
 * // 1. Create an engine
 * ExpressionEngine engine = LogicEngineFactory.create();
 *
 * // 2. Assemble an expression from the palette
 * Expression expr = Expression.empty()
 *     .append(Token.operator(Op.NOT))
 *     .append(Token.variable(Operand.A));
 *
 * // 3. Evaluate under the current inputs
 * EvaluationResult result = engine.validateAndEvaluate(expr, Environment.none());
 * result.display();                          // "TRUE"
 *
 * // 4. Tabulate
 * System.out.println(engine.buildTruthTable(expr).render());
 * }</pre>
 *
 * <p><strong>Best Practices:</strong></p>
 * <ul>
 *   <li>Reuse engine instances; they are stateless and thread-safe</li>
 *   <li>Use {@link EnginePolicy#strict()} for expressions coming from untrusted clients</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see ExpressionEngine
 * @see EnginePolicy
 */
public class LogicEngineFactory {

    private LogicEngineFactory() {}

    /**
     * Creates an engine with {@link EnginePolicy#defaults()}.
     *
     * @return a new engine
     */
    public static ExpressionEngine create() {
        return new BasicExpressionEngine();
    }

    /**
     * Creates an engine with the given policy.
     *
     * @param policy engine policy, must not be null
     * @return a new engine
     * @throws NullPointerException if policy is null
     */
    public static ExpressionEngine create(EnginePolicy policy) {
        Objects.requireNonNull(policy, "Engine policy cannot be null");
        return new BasicExpressionEngine(policy);
    }
}
