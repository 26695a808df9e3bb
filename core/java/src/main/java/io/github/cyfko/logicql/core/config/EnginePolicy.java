package io.github.cyfko.logicql.core.config;

/**
 * Configuration of the expression engine.
 *
 * <h2>Configurable Settings</h2>
 * <ul>
 *   <li><strong>maxTokenCount</strong>: Maximum number of tokens accepted in one expression (default: 1000)</li>
 *   <li><strong>strictGrouping</strong>: Rejects empty groups {@code ()} and operators directly
 *       followed by {@code )} or ending the expression during validation (default: enabled)</li>
 *   <li><strong>errorSentinel</strong>: Text shown in place of a result in truth-table rows
 *       whose evaluation failed (default: {@code "—"})</li>
 * </ul>
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * // Default
 * EnginePolicy policy = EnginePolicy.defaults();
 *
 * // Strict (untrusted input, small expressions)
 * EnginePolicy policy = EnginePolicy.strict();
 *
 * // Relaxed (grouping errors surface from later stages)
 * EnginePolicy policy = EnginePolicy.relaxed();
 *
 * // Custom
 * EnginePolicy policy = EnginePolicy.builder()
 *     .maxTokenCount(50)
 *     .errorSentinel("ERR")
 *     .build();
 * }</pre>
 *
 * @param policyName     name of the policy, shown in error messages
 * @param maxTokenCount  maximum number of tokens of an expression
 * @param strictGrouping whether the validator applies the grouping rules
 * @param errorSentinel  text rendered for failed truth-table rows
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record EnginePolicy(
    String policyName,
    int maxTokenCount,
    boolean strictGrouping,
    String errorSentinel
) {

    public static final String DEFAULT_ERROR_SENTINEL = "—";

    /**
     * Canonical constructor with validation.
     *
     * @throws IllegalArgumentException if any setting is invalid
     */
    public EnginePolicy {
        if (policyName == null || policyName.isBlank()) {
            throw new IllegalArgumentException("Policy name is required");
        }
        if (maxTokenCount <= 0) {
            throw new IllegalArgumentException("maxTokenCount must be positive, got: " + maxTokenCount);
        }
        if (errorSentinel == null || errorSentinel.isEmpty()) {
            throw new IllegalArgumentException("errorSentinel is required");
        }
    }

    /**
     * Default configuration.
     * <ul>
     *   <li>Max Token Count: 1000</li>
     *   <li>Strict Grouping: ENABLED</li>
     * </ul>
     *
     * @return default configuration
     */
    public static EnginePolicy defaults() {
        return new EnginePolicy(PolicyName.DEFAULT_POLICY.name(), 1000, true, DEFAULT_ERROR_SENTINEL);
    }

    /**
     * Strict configuration for untrusted input.
     * <ul>
     *   <li>Max Token Count: 200</li>
     *   <li>Strict Grouping: ENABLED</li>
     * </ul>
     *
     * @return strict configuration
     */
    public static EnginePolicy strict() {
        return new EnginePolicy(PolicyName.STRICT_POLICY.name(), 200, true, DEFAULT_ERROR_SENTINEL);
    }

    /**
     * Relaxed configuration.
     * <p>
     * Grouping rules are not checked by the validator; empty groups and operators before
     * {@code )} are reported by the converter or the evaluator instead.
     * </p>
     * <ul>
     *   <li>Max Token Count: 10000</li>
     *   <li>Strict Grouping: DISABLED</li>
     * </ul>
     *
     * @return relaxed configuration
     */
    public static EnginePolicy relaxed() {
        return new EnginePolicy(PolicyName.RELAXED_POLICY.name(), 10000, false, DEFAULT_ERROR_SENTINEL);
    }

    /**
     * Creates a custom configuration.
     * <p>
     * Builder parameters are initialized exactly as in {@link #defaults()}.
     * </p>
     *
     * @return the {@link Builder} instance
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String _policyName = PolicyName.CUSTOM_POLICY.name();
        private int _maxTokenCount = 1000;
        private boolean _strictGrouping = true;
        private String _errorSentinel = DEFAULT_ERROR_SENTINEL;

        private Builder() {}

        public EnginePolicy build() {
            return new EnginePolicy(_policyName, _maxTokenCount, _strictGrouping, _errorSentinel);
        }

        public Builder policyName(String policyName) { this._policyName = policyName; return this; }
        public Builder maxTokenCount(int maxTokenCount) { this._maxTokenCount = maxTokenCount; return this; }
        public Builder strictGrouping(boolean strictGrouping) { this._strictGrouping = strictGrouping; return this; }
        public Builder errorSentinel(String errorSentinel) { this._errorSentinel = errorSentinel; return this; }
    }

    public enum PolicyName {
        DEFAULT_POLICY,
        STRICT_POLICY,
        RELAXED_POLICY,
        CUSTOM_POLICY
    }
}
