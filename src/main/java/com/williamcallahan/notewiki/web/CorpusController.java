package com.williamcallahan.notewiki.web;

import com.williamcallahan.notewiki.domain.render.CorpusIndex;
import com.williamcallahan.notewiki.domain.render.CorpusSummary;
import com.williamcallahan.notewiki.domain.render.CorpusUpdateRequest;
import com.williamcallahan.notewiki.service.CorpusIndexService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for the corpus index that link titles and backlinks are resolved against.
 */
@RestController
@RequestMapping("/api/corpus")
public class CorpusController extends BaseController {

    private static final Logger logger = LoggerFactory.getLogger(CorpusController.class);

    private final CorpusIndexService corpusIndexService;

    public CorpusController(CorpusIndexService corpusIndexService, ExceptionResponseBuilder exceptionBuilder) {
        super(exceptionBuilder);
        this.corpusIndexService = corpusIndexService;
    }

    /**
     * Replaces the corpus with the given notes and rebuilds the index.
     *
     * @param request note id to note source
     * @return summary of the published index
     */
    @PutMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> replaceCorpus(@RequestBody CorpusUpdateRequest request) {
        try {
            CorpusIndex index = corpusIndexService.replace(request.notes());
            return ResponseEntity.ok(CorpusSummary.of(index));
        } catch (RuntimeException indexFailure) {
            logger.error("Error rebuilding corpus index", indexFailure);
            return handleServiceException(indexFailure, "rebuild corpus index");
        }
    }

    /**
     * Returns the current index.
     */
    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<CorpusSummary> currentCorpus() {
        return ResponseEntity.ok(CorpusSummary.of(corpusIndexService.current()));
    }
}
