package de.mirkosertic.newsclassifier.analysis;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread-safe metrics collector for the stem cache.
 *
 * <p>Tracks cache hits, misses, evictions and the current size, and computes the hit rate.</p>
 */
public class StemmerCacheStats {

    private final AtomicLong cacheHits = new AtomicLong(0);
    private final AtomicLong cacheMisses = new AtomicLong(0);
    private final AtomicLong evictions = new AtomicLong(0);
    private final AtomicLong cacheSize = new AtomicLong(0);

    public void recordHit() {
        cacheHits.incrementAndGet();
    }

    public void recordMiss() {
        cacheMisses.incrementAndGet();
    }

    public void recordEviction() {
        evictions.incrementAndGet();
    }

    public void setCurrentSize(final long size) {
        cacheSize.set(size);
    }

    public long getTotalRequests() {
        return cacheHits.get() + cacheMisses.get();
    }

    public long getCacheHits() {
        return cacheHits.get();
    }

    public long getCacheMisses() {
        return cacheMisses.get();
    }

    public long getEvictions() {
        return evictions.get();
    }

    public long getCurrentSize() {
        return cacheSize.get();
    }

    /**
     * Hit rate as a percentage (0-100), or 0.0 if nothing was requested yet.
     */
    public double getHitRate() {
        final long total = getTotalRequests();
        if (total == 0) {
            return 0.0;
        }
        return (cacheHits.get() * 100.0) / total;
    }

    @Override
    public String toString() {
        return String.format(
                "StemmerCacheStats[total=%d, hits=%d, misses=%d, hitRate=%.1f%%, size=%d, evictions=%d]",
                getTotalRequests(),
                getCacheHits(),
                getCacheMisses(),
                getHitRate(),
                getCurrentSize(),
                getEvictions()
        );
    }
}
