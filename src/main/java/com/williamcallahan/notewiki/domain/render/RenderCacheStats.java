package com.williamcallahan.notewiki.domain.render;

/**
 * Snapshot of the rendered-note cache counters.
 */
public record RenderCacheStats(
    long hitCount,
    long missCount,
    long evictionCount,
    long size
) {
    public double hitRate() {
        long total = hitCount + missCount;
        return total == 0 ? 0.0 : (double) hitCount / total;
    }
}
