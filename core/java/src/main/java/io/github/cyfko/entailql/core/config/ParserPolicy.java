package io.github.cyfko.entailql.core.config;

/**
 * Input limits applied by the premise compiler before a formula is scanned.
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * ParserPolicy policy = ParserPolicy.defaults(); // 5000 characters
 * ParserPolicy policy = ParserPolicy.strict();   // 1000 characters, for untrusted input
 * ParserPolicy policy = ParserPolicy.relaxed();  // 10000 characters
 *
 * ParserPolicy policy = ParserPolicy.builder()
 *     .maxExpressionLength(200)
 *     .build();
 * }</pre>
 *
 * @param policyName          name reported in length errors
 * @param maxExpressionLength maximum number of characters in a formula
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record ParserPolicy(String policyName, int maxExpressionLength) {

    public ParserPolicy {
        if (policyName == null || policyName.isBlank()) {
            throw new IllegalArgumentException("Policy name is required");
        }
        if (maxExpressionLength <= 0) {
            throw new IllegalArgumentException("maxExpressionLength must be positive, got: " + maxExpressionLength);
        }
    }

    public static ParserPolicy defaults() {
        return new ParserPolicy(PolicyName.DEFAULT_POLICY.name(), 5000);
    }

    public static ParserPolicy strict() {
        return new ParserPolicy(PolicyName.STRICT_POLICY.name(), 1000);
    }

    public static ParserPolicy relaxed() {
        return new ParserPolicy(PolicyName.RELAXED_POLICY.name(), 10000);
    }

    /**
     * Creates a builder initialised with the default limits.
     *
     * @return the {@link Builder} instance
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String _policyName = PolicyName.CUSTOM_POLICY.name();
        private int _maxExpressionLength = 5000;

        private Builder() {}

        public ParserPolicy build() {
            return new ParserPolicy(_policyName, _maxExpressionLength);
        }

        public Builder policyName(String policyName) { this._policyName = policyName; return this; }
        public Builder maxExpressionLength(int maxExpressionLength) { this._maxExpressionLength = maxExpressionLength; return this; }
    }

    public enum PolicyName {
        DEFAULT_POLICY,
        STRICT_POLICY,
        RELAXED_POLICY,
        CUSTOM_POLICY
    }
}
