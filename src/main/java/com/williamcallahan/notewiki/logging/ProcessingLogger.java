package com.williamcallahan.notewiki.logging;

import com.williamcallahan.notewiki.domain.render.CorpusIndex;
import com.williamcallahan.notewiki.domain.render.RenderedNote;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Logging aspect for the rendering pipeline.
 * Logs note conversions, page assembly and corpus rebuilds with timing and outcome.
 */
@Aspect
@Component
public class ProcessingLogger {
    private static final Logger PIPELINE_LOG = LoggerFactory.getLogger("PIPELINE");

    // Thread-local storage for request tracking
    private static final ThreadLocal<String> REQUEST_ID = ThreadLocal.withInitial(() ->
        "REQ-" + System.currentTimeMillis() + "-" + Thread.currentThread().getId()
    );

    /**
     * Log note conversion
     */
    @Around("execution(* com.williamcallahan.notewiki.service.NoteRenderService.render(..))")
    public Object logNoteRendering(ProceedingJoinPoint joinPoint) throws Throwable {
        String requestId = REQUEST_ID.get();
        long startTime = System.currentTimeMillis();
        Object[] args = joinPoint.getArgs();

        PIPELINE_LOG.info("[{}] STEP 1: NOTE CONVERSION - Starting '{}'", requestId, args[0]);
        if (args.length > 1 && args[1] instanceof String source) {
            PIPELINE_LOG.debug("[{}] Source length: {}", requestId, source.length());
        }

        try {
            Object result = joinPoint.proceed();
            long duration = System.currentTimeMillis() - startTime;

            if (result instanceof RenderedNote note) {
                PIPELINE_LOG.info("[{}] STEP 1: NOTE CONVERSION - Completed in {}ms ({} links, {} headings, {} warnings)",
                    requestId, duration, note.forwardLinks().size(), note.headings().size(), note.warnings().size());
            }
            return result;
        } catch (Exception e) {
            PIPELINE_LOG.error("[{}] STEP 1: NOTE CONVERSION - Failed: {}", requestId, e.getMessage());
            throw e;
        } finally {
            REQUEST_ID.remove();
        }
    }

    /**
     * Log page assembly
     */
    @Around("execution(* com.williamcallahan.notewiki.service.NotePageRenderer.renderPage(..))")
    public Object logPageAssembly(ProceedingJoinPoint joinPoint) throws Throwable {
        String requestId = REQUEST_ID.get();
        long startTime = System.currentTimeMillis();

        PIPELINE_LOG.info("[{}] STEP 2: PAGE ASSEMBLY - Starting", requestId);

        try {
            Object result = joinPoint.proceed();
            PIPELINE_LOG.info("[{}] STEP 2: PAGE ASSEMBLY - Completed in {}ms",
                requestId, System.currentTimeMillis() - startTime);
            return result;
        } catch (Exception e) {
            PIPELINE_LOG.error("[{}] STEP 2: PAGE ASSEMBLY - Failed: {}", requestId, e.getMessage());
            throw e;
        } finally {
            REQUEST_ID.remove();
        }
    }

    /**
     * Log corpus index rebuilds
     */
    @Around("execution(* com.williamcallahan.notewiki.service.CorpusIndexService.replace(..))")
    public Object logCorpusRebuild(ProceedingJoinPoint joinPoint) throws Throwable {
        String requestId = REQUEST_ID.get();
        long startTime = System.currentTimeMillis();

        if (joinPoint.getArgs()[0] instanceof Map<?, ?> sources) {
            PIPELINE_LOG.info("[{}] CORPUS REBUILD - Indexing {} notes", requestId, sources.size());
        }

        try {
            Object result = joinPoint.proceed();
            if (result instanceof CorpusIndex index) {
                PIPELINE_LOG.info("[{}] CORPUS REBUILD - Published v{} in {}ms",
                    requestId, index.version(), System.currentTimeMillis() - startTime);
            }
            return result;
        } catch (Exception e) {
            PIPELINE_LOG.error("[{}] CORPUS REBUILD - Failed: {}", requestId, e.getMessage());
            throw e;
        } finally {
            REQUEST_ID.remove();
        }
    }
}
