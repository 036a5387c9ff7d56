package io.github.cyfko.partialresponse.core.config;

/**
 * Caching of parse results, keyed by the raw selector string.
 * <p>
 * Clients tend to send the same handful of selectors over and over; since parse results are immutable
 * they can be served from a bounded LRU cache instead of being parsed again.
 * </p>
 *
 * <pre>{@code
 * CachePolicy.defaults();    // enabled, 1000 entries
 * CachePolicy.custom(200);   // enabled, 200 entries
 * CachePolicy.none();        // every selector is parsed
 * }</pre>
 *
 * @param cacheEnabled whether parse results are cached
 * @param cacheSize    maximum number of cached selectors
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record CachePolicy(
        boolean cacheEnabled,
        int cacheSize
) {

    public CachePolicy {
        if (cacheSize <= 0) {
            throw new IllegalArgumentException("cacheSize must be positive, got: " + cacheSize);
        }
    }

    public static CachePolicy defaults() {
        return new CachePolicy(true, 1000);
    }

    /**
     * @return a policy with caching disabled (the size is unused)
     */
    public static CachePolicy none() {
        return new CachePolicy(false, 1);
    }

    public static CachePolicy custom(int cacheSize) {
        return new CachePolicy(true, cacheSize);
    }
}
