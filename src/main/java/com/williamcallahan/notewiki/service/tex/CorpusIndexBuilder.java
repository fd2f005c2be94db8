package com.williamcallahan.notewiki.service.tex;

import com.williamcallahan.notewiki.domain.render.CorpusIndex;
import com.williamcallahan.notewiki.domain.render.NoteMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Builds the corpus title and backlink indexes from note sources held in memory.
 *
 * <p>Titles come from each note's header; a note without a title is indexed under its identifier
 * read as words. Backlinks invert every note's forward links, which are found by converting the
 * note against the title index. Links to PDF files are not notes and never appear as backlink
 * targets.</p>
 */
public final class CorpusIndexBuilder {

    private static final Logger logger = LoggerFactory.getLogger(CorpusIndexBuilder.class);

    private final TexRenderPipeline pipeline;
    private final RenderOptions options;

    public CorpusIndexBuilder(TexRenderPipeline pipeline, RenderOptions options) {
        this.pipeline = Objects.requireNonNull(pipeline, "Pipeline cannot be null");
        this.options = Objects.requireNonNull(options, "Render options cannot be null");
    }

    /**
     * Builds the index for {@code sources}, a map of note identifier to note source.
     *
     * @param sources note sources keyed by identifier
     * @param version build number recorded in the index
     * @return the read-only corpus index
     */
    public CorpusIndex build(Map<String, String> sources, long version) {
        Map<String, String> titles = new HashMap<>();
        sources.forEach((noteId, source) -> titles.put(noteId, titleOf(noteId, source)));
        CorpusIndex titleIndex = new CorpusIndex(titles, Map.of(), version);

        Map<String, Set<String>> backlinks = new HashMap<>();
        sources.forEach((noteId, source) -> {
            for (String target : forwardLinksOf(noteId, source, titleIndex)) {
                if (!target.toLowerCase(Locale.ROOT).contains(".pdf")) {
                    backlinks.computeIfAbsent(target, key -> new TreeSet<>()).add(noteId);
                }
            }
        });
        logger.info("Built corpus index v{} with {} notes and {} linked targets",
            version, titles.size(), backlinks.size());
        return new CorpusIndex(titles, backlinks, version);
    }

    static String titleOf(String noteId, String source) {
        NoteMetadata metadata = MetadataExtractor.metadata(CommentStripper.strip(source == null ? "" : source));
        return NoteMetadata.UNTITLED.equals(metadata.title())
            ? CrossReferenceResolver.prettify(noteId)
            : metadata.title();
    }

    private List<String> forwardLinksOf(String noteId, String source, CorpusIndex titleIndex) {
        try {
            return pipeline.render(source, titleIndex, options).forwardLinks();
        } catch (TexProcessingException processingException) {
            logger.warn("Skipping links of note '{}': {}", noteId, processingException.getMessage());
            return Collections.emptyList();
        }
    }
}
