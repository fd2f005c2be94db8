package com.williamcallahan.notewiki.service.tex;

import com.williamcallahan.notewiki.domain.render.CorpusIndex;
import com.williamcallahan.notewiki.domain.render.Heading;
import com.williamcallahan.notewiki.domain.render.MacroTable;
import com.williamcallahan.notewiki.domain.render.NoteMetadata;
import com.williamcallahan.notewiki.domain.render.ProcessingWarning.WarningType;
import com.williamcallahan.notewiki.domain.render.RenderedNote;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts one note to HTML by running the passes in a fixed order.
 *
 * <p>The order matters: diagrams and verbatim code are rendered and stashed before escaping, math
 * is stashed after escaping and before any markup pass, see-also boxes are rendered before their
 * dash-list bodies could be taken for lists, lists are rendered before the
 * environments that may contain them, and every stash is restored in reverse order before
 * paragraphs are wrapped. Conversion is synchronous and touches no state outside its
 * {@link ConversionContext}, so notes may be converted in parallel against a shared
 * {@link CorpusIndex}.</p>
 */
public final class TexRenderPipeline {

    private static final Logger logger = LoggerFactory.getLogger(TexRenderPipeline.class);

    private static final List<RenderPass> PASSES = List.of(
        new RenderPass("diagrams", DiagramConverter::convertAndStash),
        new RenderPass("escape-html", (text, context) -> HtmlText.escapeText(text)),
        new RenderPass("stash-math", TexRenderPipeline::stashMath),
        new RenderPass("see-also", SeeAlsoRenderer::convert),
        new RenderPass("explicit-lists", ExplicitLists::convert),
        new RenderPass("implicit-lists", ImplicitListConverter::convert),
        new RenderPass("environments", TheoremEnvironments::convert),
        new RenderPass("sections", SectionConverter::convert),
        new RenderPass("inline", InlineFormatter::format),
        new RenderPass("citations", CitationConverter::convert),
        new RenderPass("footnotes", FootnoteConverter::convert),
        new RenderPass("footers", (text, context) ->
            text + FootnoteConverter.footer(context) + CitationConverter.referencesFooter(context)),
        new RenderPass("restore-math", (text, context) -> context.mathStash().restore(text)),
        new RenderPass("restore-blocks", (text, context) -> context.blockStash().restore(text)),
        new RenderPass("paragraphs", (text, context) -> ParagraphWrapper.wrap(text))
    );

    /**
     * Returns the passes in execution order.
     */
    public static List<RenderPass> passes() {
        return PASSES;
    }

    /**
     * Converts a complete note: comments are stripped, macro declarations collected and removed,
     * the header read, and the body run through every pass.
     *
     * @param source note source text
     * @param corpus read-only corpus index for link titles
     * @param options rendering settings
     * @return the rendered note
     * @throws TexProcessingException if a pass fails unexpectedly
     */
    public RenderedNote render(String source, CorpusIndex corpus, RenderOptions options) {
        long startTime = System.currentTimeMillis();
        ConversionContext context = new ConversionContext(corpus, options);
        try {
            String text = CommentStripper.strip(source == null ? "" : source);
            MacroTableBuilder.Extraction declarations = MacroTableBuilder.extract(text);
            declarations.warnings().forEach(warning ->
                context.warn(warning.type(), warning.message(), warning.position(), warning.context()));
            NoteMetadata metadata = MetadataExtractor.metadata(declarations.text());
            String body = MetadataExtractor.body(declarations.text());

            String html = runPasses(body, context);
            reportUnresolvedTokens(context);

            MacroTable macros = MacroTableBuilder.build(declarations.entries());
            long processingTime = System.currentTimeMillis() - startTime;
            logger.debug("Rendered note '{}' in {}ms with {} warning(s)",
                metadata.title(), processingTime, context.warnings().size());
            return new RenderedNote(html, metadata, macros, context.sortedForwardLinks(), headings(html),
                context.warnings(), processingTime);
        } catch (TexProcessingException processingException) {
            throw processingException;
        } catch (RuntimeException renderingException) {
            throw new TexProcessingException("Note conversion failed", renderingException);
        }
    }

    /**
     * Runs the passes over an already extracted body.
     */
    static String runPasses(String body, ConversionContext context) {
        String text = body;
        for (RenderPass pass : PASSES) {
            try {
                text = pass.apply(text, context);
            } catch (RuntimeException passException) {
                throw new TexProcessingException("Render pass '" + pass.name() + "' failed", passException);
            }
        }
        return text;
    }

    private static String stashMath(String text, ConversionContext context) {
        String stashed = text;
        for (RegionRecognizer recognizer : Recognizers.math()) {
            stashed = context.mathStash().stash(stashed, recognizer);
        }
        return stashed;
    }

    private static void reportUnresolvedTokens(ConversionContext context) {
        List<String> unresolved = new ArrayList<>(context.mathStash().unresolvedTokens());
        unresolved.addAll(context.blockStash().unresolvedTokens());
        for (String token : unresolved) {
            context.warn(WarningType.STASH_RESTORE_MISMATCH, "Placeholder has no recorded original", 0, token);
        }
    }

    /**
     * Reads the anchored h2 to h4 headings back out of the rendered body, so their titles carry
     * restored math and inline markup.
     */
    static List<Heading> headings(String html) {
        Document fragment = Jsoup.parseBodyFragment(html);
        fragment.outputSettings().prettyPrint(false);
        List<Heading> headings = new ArrayList<>();
        for (Element element : fragment.select("h2[id], h3[id], h4[id]")) {
            int level = element.tagName().charAt(1) - '0';
            headings.add(new Heading(level, element.html(), element.id()));
        }
        return headings;
    }
}
