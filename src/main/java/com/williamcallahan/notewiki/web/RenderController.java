package com.williamcallahan.notewiki.web;

import com.williamcallahan.notewiki.domain.errors.ApiResponse;
import com.williamcallahan.notewiki.domain.render.NoteRenderRequest;
import com.williamcallahan.notewiki.domain.render.RenderedNote;
import com.williamcallahan.notewiki.service.CorpusIndexService;
import com.williamcallahan.notewiki.service.NotePageRenderer;
import com.williamcallahan.notewiki.service.NoteRenderService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Locale;
import java.util.Map;

/**
 * REST controller for note rendering.
 * Renders a note to a body fragment with its metadata, or to a complete page.
 */
@RestController
@RequestMapping("/api/notes")
public class RenderController extends BaseController {

    private static final Logger logger = LoggerFactory.getLogger(RenderController.class);

    private final NoteRenderService noteRenderService;
    private final NotePageRenderer notePageRenderer;
    private final CorpusIndexService corpusIndexService;

    public RenderController(NoteRenderService noteRenderService,
                            NotePageRenderer notePageRenderer,
                            CorpusIndexService corpusIndexService,
                            ExceptionResponseBuilder exceptionBuilder) {
        super(exceptionBuilder);
        this.noteRenderService = noteRenderService;
        this.notePageRenderer = notePageRenderer;
        this.corpusIndexService = corpusIndexService;
    }

    /**
     * Renders a note to an HTML fragment.
     *
     * @param request A JSON object with the note id and source. Expected format:
     *                <pre>{@code
     *                  {
     *                    "noteId": "group-theory",
     *                    "content": "\\Title{Group theory} ..."
     *                  }
     *                }</pre>
     * @return the rendered note: html, metadata, macros, forward links, headings and warnings
     */
    @PostMapping(value = "/render",
                 consumes = MediaType.APPLICATION_JSON_VALUE,
                 produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> renderNote(@RequestBody NoteRenderRequest request) {
        if (request.noteId().isEmpty()) {
            return handleValidationException(new IllegalArgumentException("noteId is required"));
        }
        try {
            logger.debug("Rendering note '{}' of length {}", request.noteId(), request.content().length());
            RenderedNote rendered = noteRenderService.render(request.noteId(), request.content());
            return ResponseEntity.ok(rendered);
        } catch (RuntimeException renderFailure) {
            logger.error("Error rendering note '{}'", request.noteId(), renderFailure);
            return handleServiceException(renderFailure, "render note");
        }
    }

    /**
     * Renders a note to a standalone HTML page with its table of contents, linked notes and
     * backlinks. Failures are reported as JSON.
     *
     * @param request note id, source and optional display dates
     * @return the page as {@code text/html}
     */
    @PostMapping(value = "/page", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> renderPage(@RequestBody NoteRenderRequest request) {
        if (request.noteId().isEmpty()) {
            return asJson(handleValidationException(new IllegalArgumentException("noteId is required")));
        }
        try {
            RenderedNote rendered = noteRenderService.render(request.noteId(), request.content());
            String page = notePageRenderer.renderPage(request.noteId(), rendered, corpusIndexService.current(),
                request.createdDate(), request.modifiedDate());
            return ResponseEntity.ok().contentType(MediaType.TEXT_HTML).body(page);
        } catch (RuntimeException renderFailure) {
            logger.error("Error rendering page for note '{}'", request.noteId(), renderFailure);
            return asJson(handleServiceException(renderFailure, "render page"));
        }
    }

    /**
     * Retrieves statistics about the rendered-note cache.
     *
     * @return hit, miss and eviction counts, size and hit rate
     */
    @GetMapping("/cache/stats")
    public ResponseEntity<Map<String, Object>> getCacheStats() {
        var stats = noteRenderService.getCacheStats();
        return ResponseEntity.ok(Map.of(
            "hitCount", stats.hitCount(),
            "missCount", stats.missCount(),
            "evictionCount", stats.evictionCount(),
            "size", stats.size(),
            "hitRate", String.format(Locale.ROOT, "%.2f%%", stats.hitRate() * 100)
        ));
    }

    /**
     * Clears the rendered-note cache.
     *
     * @return A {@link ResponseEntity} with a status message.
     */
    @PostMapping("/cache/clear")
    public ResponseEntity<ApiResponse> clearCache() {
        noteRenderService.clearCache();
        logger.info("Rendered note cache cleared via API");
        return createSuccessResponse("Cache cleared successfully");
    }

    private static ResponseEntity<ApiResponse> asJson(ResponseEntity<ApiResponse> response) {
        return ResponseEntity.status(response.getStatusCode())
            .contentType(MediaType.APPLICATION_JSON)
            .body(response.getBody());
    }
}
