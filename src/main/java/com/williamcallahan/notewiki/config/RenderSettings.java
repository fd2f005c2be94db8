package com.williamcallahan.notewiki.config;

import java.time.Duration;
import java.util.Locale;

/**
 * Limits and cache sizing for note conversion.
 */
public class RenderSettings {

    private static final int MAX_INPUT_DEF = 2_000_000;
    private static final Duration TIME_BUDGET_DEF = Duration.ofSeconds(10);
    private static final long CACHE_SIZE_DEF = 500L;
    private static final Duration CACHE_TTL_DEF = Duration.ofMinutes(30);
    private static final int WORKER_THREADS_DEF = 4;
    private static final String MAX_INPUT_KEY = "app.render.max-input-length";
    private static final String TIME_BUDGET_KEY = "app.render.time-budget";
    private static final String CACHE_SIZE_KEY = "app.render.cache-max-size";
    private static final String CACHE_TTL_KEY = "app.render.cache-ttl";
    private static final String WORKER_THREADS_KEY = "app.render.worker-threads";
    private static final String POSITIVE_FMT = "%s must be greater than 0.";
    private static final String NON_NEG_FMT = "%s must be 0 or greater.";

    private int maxInputLength = MAX_INPUT_DEF;
    private Duration timeBudget = TIME_BUDGET_DEF;
    private long cacheMaxSize = CACHE_SIZE_DEF;
    private Duration cacheTtl = CACHE_TTL_DEF;
    private int workerThreads = WORKER_THREADS_DEF;

    /**
     * Creates render settings with defaults.
     */
    public RenderSettings() {}

    /**
     * Validates render settings.
     */
    public void validateConfiguration() {
        if (maxInputLength < 1) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, POSITIVE_FMT, MAX_INPUT_KEY));
        }
        requirePositiveDuration(TIME_BUDGET_KEY, timeBudget);
        requirePositiveDuration(CACHE_TTL_KEY, cacheTtl);
        if (cacheMaxSize < 0) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, NON_NEG_FMT, CACHE_SIZE_KEY));
        }
        if (workerThreads < 1) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, POSITIVE_FMT, WORKER_THREADS_KEY));
        }
    }

    /**
     * Returns the longest note source accepted, in characters.
     *
     * @return maximum source length
     */
    public int getMaxInputLength() {
        return maxInputLength;
    }

    public void setMaxInputLength(int maxInputLength) {
        this.maxInputLength = maxInputLength;
    }

    /**
     * Returns the wall-clock budget for converting one note.
     *
     * @return per-note time budget
     */
    public Duration getTimeBudget() {
        return timeBudget;
    }

    public void setTimeBudget(Duration timeBudget) {
        this.timeBudget = timeBudget;
    }

    public long getCacheMaxSize() {
        return cacheMaxSize;
    }

    public void setCacheMaxSize(long cacheMaxSize) {
        this.cacheMaxSize = cacheMaxSize;
    }

    public Duration getCacheTtl() {
        return cacheTtl;
    }

    public void setCacheTtl(Duration cacheTtl) {
        this.cacheTtl = cacheTtl;
    }

    /**
     * Returns the number of threads converting notes concurrently.
     *
     * @return worker thread count
     */
    public int getWorkerThreads() {
        return workerThreads;
    }

    public void setWorkerThreads(int workerThreads) {
        this.workerThreads = workerThreads;
    }

    private void requirePositiveDuration(String propertyKey, Duration duration) {
        if (duration == null || duration.isNegative() || duration.isZero()) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, POSITIVE_FMT, propertyKey));
        }
    }
}
