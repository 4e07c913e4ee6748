package de.mirkosertic.newsclassifier.analysis;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;

/**
 * Memoizing wrapper around a {@link Stemmer}.
 *
 * <p>News text repeats a small working set of words, so caching the stem per word saves
 * running the rule steps again. The cache is bounded and thread-safe; since stemming is a pure
 * function, cached and computed stems are always identical.</p>
 */
public class CachingStemmer implements Stemmer {

    private final Stemmer delegate;
    private final Cache<String, String> cache;
    private final StemmerCacheStats stats;

    /**
     * @param delegate     the stemmer computing stems on a cache miss
     * @param maximumSize  the maximum number of cached words
     * @param stats        collector for cache metrics
     */
    public CachingStemmer(final Stemmer delegate, final long maximumSize, final StemmerCacheStats stats) {
        if (maximumSize <= 0) {
            throw new IllegalArgumentException("maximumSize must be positive: " + maximumSize);
        }
        this.delegate = delegate;
        this.stats = stats;
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .executor(Runnable::run)
                .evictionListener((String key, String value, RemovalCause cause) -> {
                    if (cause.wasEvicted()) {
                        stats.recordEviction();
                    }
                })
                .build();
    }

    @Override
    public String stem(final String word) {
        final String cached = cache.getIfPresent(word);
        if (cached != null) {
            stats.recordHit();
            return cached;
        }

        stats.recordMiss();
        final String stem = delegate.stem(word);
        cache.put(word, stem);
        stats.setCurrentSize(cache.estimatedSize());
        return stem;
    }

    public StemmerCacheStats getStats() {
        return stats;
    }

    /**
     * Runs pending maintenance such as evictions. Mainly useful for tests.
     */
    public void cleanUp() {
        cache.cleanUp();
        stats.setCurrentSize(cache.estimatedSize());
    }
}
