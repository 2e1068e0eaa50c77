package io.github.cyfko.entailql.core.config;

/**
 * Configuration of the compiled-premise cache held by each
 * {@link io.github.cyfko.entailql.core.impl.BasicPremiseCompiler}.
 * <p>
 * Entries are keyed by the exact formula text. The cache belongs to the compiler instance;
 * nothing is shared between compilers.
 * </p>
 *
 * <pre>{@code
 * CachePolicy.defaults();   // enabled, 256 entries
 * CachePolicy.none();       // disabled
 * CachePolicy.custom(32);   // enabled, 32 entries
 * }</pre>
 *
 * @param cacheEnabled whether compiled premises are cached
 * @param cacheSize    maximum number of cached premises
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record CachePolicy(boolean cacheEnabled, int cacheSize) {

    public CachePolicy {
        if (cacheSize <= 0) {
            throw new IllegalArgumentException("cacheSize must be positive, got: " + cacheSize);
        }
    }

    public static CachePolicy defaults() {
        return new CachePolicy(true, 256);
    }

    /**
     * No cache: every call to {@code compile} scans and parses the formula again.
     *
     * @return a CachePolicy with caching disabled
     */
    public static CachePolicy none() {
        return new CachePolicy(false, 1);
    }

    public static CachePolicy custom(int cacheSize) {
        return new CachePolicy(true, cacheSize);
    }
}
