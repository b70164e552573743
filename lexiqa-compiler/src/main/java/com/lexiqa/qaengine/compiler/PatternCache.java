package com.lexiqa.qaengine.compiler;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;

import java.util.regex.Pattern;

/**
 * Bounded cache of compiled {@link Pattern}s keyed by source text and flags.
 *
 * <p>Profiles are recompiled on every hot reload and library snippets tend to be
 * copied into many profiles, so most patterns are seen more than once.
 * {@link Pattern} instances are immutable and can be shared freely.
 */
public final class PatternCache {

    public static final long DEFAULT_MAX_SIZE = 1_024;

    private final Cache<PatternKey, Pattern> cache;

    public PatternCache() {
        this(DEFAULT_MAX_SIZE);
    }

    public PatternCache(long maxSize) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive, got: " + maxSize);
        }
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxSize)
                .recordStats()
                .build();
    }

    /**
     * Returns the compiled pattern, compiling it on first use.
     *
     * @throws java.util.regex.PatternSyntaxException if the source does not compile
     */
    public Pattern get(String source, int flags) {
        return cache.get(new PatternKey(source, flags), key -> Pattern.compile(key.source(), key.flags()));
    }

    public CacheStats stats() {
        return cache.stats();
    }

    public long estimatedSize() {
        return cache.estimatedSize();
    }

    private record PatternKey(String source, int flags) {
    }
}
