package de.mirkosertic.newsclassifier.analysis;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class StemmerCacheStatsTest {

    @Test
    void testMetricsTracking() {
        final StemmerCacheStats stats = new StemmerCacheStats();

        assertThat(stats.getTotalRequests()).isEqualTo(0);
        assertThat(stats.getHitRate()).isEqualTo(0.0);

        stats.recordHit();
        stats.recordHit();
        stats.recordHit();
        stats.recordMiss();

        assertThat(stats.getTotalRequests()).isEqualTo(4);
        assertThat(stats.getCacheHits()).isEqualTo(3);
        assertThat(stats.getCacheMisses()).isEqualTo(1);
        assertThat(stats.getHitRate()).isEqualTo(75.0);

        stats.recordEviction();
        stats.setCurrentSize(42);

        assertThat(stats.getEvictions()).isEqualTo(1);
        assertThat(stats.getCurrentSize()).isEqualTo(42);
        assertThat(stats.toString()).contains("hits=3", "misses=1", "size=42", "evictions=1");
    }

    @Test
    void testConcurrentRecording() throws InterruptedException {
        final StemmerCacheStats stats = new StemmerCacheStats();
        final int threads = 8;
        final int perThread = 1_000;
        final CountDownLatch done = new CountDownLatch(threads);
        final ExecutorService executor = Executors.newFixedThreadPool(threads);

        for (int t = 0; t < threads; t++) {
            executor.submit(() -> {
                for (int i = 0; i < perThread; i++) {
                    stats.recordHit();
                    stats.recordMiss();
                }
                done.countDown();
            });
        }

        assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();

        assertThat(stats.getCacheHits()).isEqualTo(threads * perThread);
        assertThat(stats.getCacheMisses()).isEqualTo(threads * perThread);
        assertThat(stats.getHitRate()).isEqualTo(50.0);
    }
}
