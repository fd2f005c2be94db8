package com.williamcallahan.notewiki.service;

import com.williamcallahan.notewiki.config.AppProperties;
import com.williamcallahan.notewiki.domain.render.CorpusIndex;
import com.williamcallahan.notewiki.service.tex.CorpusIndexBuilder;
import com.williamcallahan.notewiki.service.tex.TexRenderPipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the current corpus index. Replacing the corpus builds a complete new index before it is
 * published, so renders always see either the old or the new index in full. Publication never
 * moves to a lower version, so a slow rebuild cannot overwrite a newer one.
 */
@Service
public class CorpusIndexService {

    private static final Logger logger = LoggerFactory.getLogger(CorpusIndexService.class);

    private final CorpusIndexBuilder builder;
    private final AtomicReference<CorpusIndex> current = new AtomicReference<>(CorpusIndex.empty());
    private final AtomicLong versions = new AtomicLong();

    public CorpusIndexService(AppProperties appProperties) {
        this.builder = new CorpusIndexBuilder(new TexRenderPipeline(), appProperties.getPage().toRenderOptions());
    }

    /**
     * Returns the index renders should resolve links against.
     */
    public CorpusIndex current() {
        return current.get();
    }

    /**
     * Rebuilds the index from {@code sources} and publishes it.
     *
     * @param sources note identifier to note source
     * @return the published index
     */
    public CorpusIndex replace(Map<String, String> sources) {
        long version = versions.incrementAndGet();
        return publish(builder.build(sources, version));
    }

    CorpusIndex publish(CorpusIndex index) {
        CorpusIndex published = current.accumulateAndGet(index,
            (old, fresh) -> fresh.version() > old.version() ? fresh : old);
        if (published == index) {
            logger.info("Published corpus index v{}", index.version());
        } else {
            logger.debug("Corpus index v{} superseded by v{}", index.version(), published.version());
        }
        return published;
    }
}
