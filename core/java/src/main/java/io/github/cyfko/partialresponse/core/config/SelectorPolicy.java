package io.github.cyfko.partialresponse.core.config;

/**
 * Robustness limits applied while parsing selectors coming from untrusted clients.
 *
 * <h2>Configurable Limits</h2>
 * <ul>
 *   <li><strong>maxSelectorLength</strong>: maximum number of characters of the raw selector (default: 2000)</li>
 *   <li><strong>maxDepth</strong>: maximum nesting depth introduced by {@code (} or {@code /} (default: 32,
 *       at most {@value #MAX_DEPTH_CEILING}). Bounds the recursion of the parser.</li>
 * </ul>
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * SelectorPolicy policy = SelectorPolicy.defaults();
 * SelectorPolicy policy = SelectorPolicy.strict();   // public APIs
 * SelectorPolicy policy = SelectorPolicy.relaxed();  // internal callers
 *
 * SelectorPolicy policy = SelectorPolicy.builder()
 *     .maxSelectorLength(300)
 *     .maxDepth(4)
 *     .build();
 * }</pre>
 *
 * <p>A selector exceeding a limit is reported as an ordinary parse error, never thrown.</p>
 *
 * @param policyName        name reported in limit violations
 * @param maxSelectorLength maximum character length of a selector
 * @param maxDepth          maximum nesting depth of a selector
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record SelectorPolicy(
    String policyName,
    int maxSelectorLength,
    int maxDepth
) {

    /**
     * Upper bound of {@code maxDepth}, keeping the parser's recursion within a default thread stack.
     */
    public static final int MAX_DEPTH_CEILING = 512;

    /**
     * @throws IllegalArgumentException if the name is blank, a limit is not positive, or {@code maxDepth} exceeds
     *                                  {@link #MAX_DEPTH_CEILING}
     */
    public SelectorPolicy {
        if (policyName == null || policyName.isBlank()) {
            throw new IllegalArgumentException("Policy name is required");
        }
        if (maxSelectorLength <= 0) {
            throw new IllegalArgumentException("maxSelectorLength must be positive, got: " + maxSelectorLength);
        }
        if (maxDepth <= 0 || maxDepth > MAX_DEPTH_CEILING) {
            throw new IllegalArgumentException(
                    "maxDepth must be between 1 and " + MAX_DEPTH_CEILING + ", got: " + maxDepth);
        }
    }

    public static SelectorPolicy defaults() {
        return new SelectorPolicy(PolicyName.DEFAULT_POLICY.name(), 2000, 32);
    }

    /**
     * Short selectors and shallow nesting, for endpoints exposed to external clients.
     *
     * @return strict configuration (500 characters, depth 8)
     */
    public static SelectorPolicy strict() {
        return new SelectorPolicy(PolicyName.STRICT_POLICY.name(), 500, 8);
    }

    /**
     * @return relaxed configuration (10000 characters, depth 128)
     */
    public static SelectorPolicy relaxed() {
        return new SelectorPolicy(PolicyName.RELAXED_POLICY.name(), 10000, 128);
    }

    /**
     * Starts a custom policy initialized with the default limits.
     *
     * @return the {@link Builder} instance
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String _policyName = PolicyName.CUSTOM_POLICY.name();
        private int _maxSelectorLength = 2000;
        private int _maxDepth = 32;

        private Builder() {}

        public SelectorPolicy build() {
            return new SelectorPolicy(_policyName, _maxSelectorLength, _maxDepth);
        }

        public Builder policyName(String policyName) { this._policyName = policyName; return this; }
        public Builder maxSelectorLength(int maxSelectorLength) { this._maxSelectorLength = maxSelectorLength; return this; }
        public Builder maxDepth(int maxDepth) { this._maxDepth = maxDepth; return this; }
    }

    public enum PolicyName {
        DEFAULT_POLICY,
        STRICT_POLICY,
        RELAXED_POLICY,
        CUSTOM_POLICY
    }
}
