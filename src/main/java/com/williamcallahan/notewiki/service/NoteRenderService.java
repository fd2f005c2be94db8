package com.williamcallahan.notewiki.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.williamcallahan.notewiki.config.AppProperties;
import com.williamcallahan.notewiki.config.RenderSettings;
import com.williamcallahan.notewiki.domain.render.CorpusIndex;
import com.williamcallahan.notewiki.domain.render.RenderCacheStats;
import com.williamcallahan.notewiki.domain.render.RenderedNote;
import com.williamcallahan.notewiki.service.tex.RenderOptions;
import com.williamcallahan.notewiki.service.tex.TexProcessingException;
import com.williamcallahan.notewiki.service.tex.TexRenderPipeline;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Renders notes against the current corpus index with a per-note time budget and a cache.
 *
 * <p>Conversion runs on a small worker pool so the caller can stop waiting once the budget is
 * spent. A note that overruns fails on its own; nothing partial is cached or returned.</p>
 */
@Service
public class NoteRenderService {

    private static final Logger logger = LoggerFactory.getLogger(NoteRenderService.class);

    private final TexRenderPipeline pipeline = new TexRenderPipeline();
    private final CorpusIndexService corpusIndexService;
    private final ContentHasher contentHasher;
    private final Cache<String, RenderedNote> renderCache;
    private final RenderSettings renderSettings;
    private final RenderOptions renderOptions;
    private final ExecutorService renderExecutor;

    public NoteRenderService(CorpusIndexService corpusIndexService,
                             ContentHasher contentHasher,
                             Cache<String, RenderedNote> renderCache,
                             AppProperties appProperties) {
        this.corpusIndexService = corpusIndexService;
        this.contentHasher = contentHasher;
        this.renderCache = renderCache;
        this.renderSettings = appProperties.getRender();
        this.renderOptions = appProperties.getPage().toRenderOptions();
        this.renderExecutor = Executors.newFixedThreadPool(renderSettings.getWorkerThreads(), workerThreads());
    }

    /**
     * Renders one note, serving a cached result when the note source and corpus are unchanged.
     *
     * @param noteId note identifier
     * @param source note source text
     * @return the rendered note
     * @throws IllegalArgumentException if the source exceeds the configured maximum length
     * @throws RenderTimeoutException if conversion exceeds the time budget
     * @throws TexProcessingException if conversion fails unexpectedly
     */
    public RenderedNote render(String noteId, String source) {
        String text = source == null ? "" : source;
        if (text.length() > renderSettings.getMaxInputLength()) {
            throw new IllegalArgumentException("Note source exceeds maximum length: "
                + text.length() + " > " + renderSettings.getMaxInputLength());
        }
        CorpusIndex corpus = corpusIndexService.current();
        String cacheKey = contentHasher.renderKey(noteId, text, corpus.version());
        RenderedNote cached = renderCache.getIfPresent(cacheKey);
        if (cached != null) {
            logger.debug("Cache hit for note '{}'", noteId);
            return cached;
        }
        RenderedNote rendered = renderWithinBudget(noteId, text, corpus);
        renderCache.put(cacheKey, rendered);
        if (!rendered.isClean()) {
            logger.info("Note '{}' rendered with {} warning(s)", noteId, rendered.warnings().size());
        }
        return rendered;
    }

    private RenderedNote renderWithinBudget(String noteId, String text, CorpusIndex corpus) {
        Duration budget = renderSettings.getTimeBudget();
        Future<RenderedNote> future = renderExecutor.submit(() -> pipeline.render(text, corpus, renderOptions));
        try {
            return future.get(budget.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException interrupted) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new TexProcessingException("Rendering note '" + noteId + "' was interrupted", interrupted);
        } catch (ExecutionException executionException) {
            Throwable cause = executionException.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new TexProcessingException("Rendering note '" + noteId + "' failed",
                cause == null ? executionException : cause);
        } catch (TimeoutException timeoutException) {
            future.cancel(true);
            logger.warn("Rendering note '{}' exceeded its {}ms budget", noteId, budget.toMillis());
            throw new RenderTimeoutException(noteId, budget, timeoutException);
        }
    }

    /**
     * Gets cache statistics for monitoring.
     * @return cache statistics
     */
    public RenderCacheStats getCacheStats() {
        var stats = renderCache.stats();
        return new RenderCacheStats(
            stats.hitCount(),
            stats.missCount(),
            stats.evictionCount(),
            renderCache.estimatedSize()
        );
    }

    /**
     * Clears the rendered-note cache.
     */
    public void clearCache() {
        renderCache.invalidateAll();
        logger.info("Rendered note cache cleared");
    }

    @PreDestroy
    public void shutdown() {
        renderExecutor.shutdownNow();
    }

    private static ThreadFactory workerThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "note-render-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
