package io.github.cyfko.partialresponse.core.config;

import java.util.Objects;

/**
 * Host-side configuration of partial responses.
 * <ul>
 *   <li><strong>ignoreCase</strong>: compare selected field names with serialized names case-insensitively
 *       (default: {@code false})</li>
 *   <li><strong>ignoreParseErrors</strong>: serialize the whole response when the selector is malformed instead
 *       of rejecting the request (default: {@code false})</li>
 *   <li><strong>selectorPolicy</strong>: parser limits (default: {@link SelectorPolicy#defaults()})</li>
 *   <li><strong>cachePolicy</strong>: parse result caching (default: {@link CachePolicy#defaults()})</li>
 * </ul>
 */
public final class PartialResponseConfig {

    private final boolean ignoreCase;
    private final boolean ignoreParseErrors;
    private final SelectorPolicy selectorPolicy;
    private final CachePolicy cachePolicy;

    private PartialResponseConfig(Builder builder) {
        this.ignoreCase = builder.ignoreCase;
        this.ignoreParseErrors = builder.ignoreParseErrors;
        this.selectorPolicy = builder.selectorPolicy;
        this.cachePolicy = builder.cachePolicy;
    }

    public static Builder builder() { return new Builder(); }

    public static PartialResponseConfig defaults() { return new Builder().build(); }

    public boolean isIgnoreCase() { return ignoreCase; }
    public boolean isIgnoreParseErrors() { return ignoreParseErrors; }
    public SelectorPolicy getSelectorPolicy() { return selectorPolicy; }
    public CachePolicy getCachePolicy() { return cachePolicy; }

    @Override
    public String toString() {
        return "PartialResponseConfig[ignoreCase=" + ignoreCase
                + ", ignoreParseErrors=" + ignoreParseErrors
                + ", selectorPolicy=" + selectorPolicy.policyName()
                + ", cachePolicy=" + cachePolicy + "]";
    }

    public static final class Builder {
        private boolean ignoreCase = false;
        private boolean ignoreParseErrors = false;
        private SelectorPolicy selectorPolicy = SelectorPolicy.defaults();
        private CachePolicy cachePolicy = CachePolicy.defaults();

        public Builder ignoreCase(boolean ignoreCase) {
            this.ignoreCase = ignoreCase;
            return this;
        }

        public Builder ignoreParseErrors(boolean ignoreParseErrors) {
            this.ignoreParseErrors = ignoreParseErrors;
            return this;
        }

        public Builder selectorPolicy(SelectorPolicy policy) {
            this.selectorPolicy = Objects.requireNonNull(policy, "selectorPolicy");
            return this;
        }

        public Builder cachePolicy(CachePolicy policy) {
            this.cachePolicy = Objects.requireNonNull(policy, "cachePolicy");
            return this;
        }

        public PartialResponseConfig build() { return new PartialResponseConfig(this); }
    }
}
