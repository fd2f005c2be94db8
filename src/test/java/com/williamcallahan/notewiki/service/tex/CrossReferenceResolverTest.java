package com.williamcallahan.notewiki.service.tex;

import com.williamcallahan.notewiki.domain.render.CorpusIndex;
import com.williamcallahan.notewiki.domain.render.LinkTarget;
import com.williamcallahan.notewiki.domain.render.ProcessingWarning;
import com.williamcallahan.notewiki.domain.render.ProcessingWarning.WarningType;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;

class CrossReferenceResolverTest {

    private static final CorpusIndex CORPUS = new CorpusIndex(Map.of("a-b", "A & B"), Map.of(), 3L);

    @Test
    void displayText_prefersExplicitThenTitleThenIdentifier() {
        LinkTarget explicit = new LinkTarget("a-b", Optional.of("custom"), LinkTarget.Placement.AFTER);

        assertEquals("custom", CrossReferenceResolver.displayText(explicit, CORPUS));
        assertEquals("A &amp; B", CrossReferenceResolver.displayText(LinkTarget.bare("a-b"), CORPUS));
        assertEquals("Ring theory", CrossReferenceResolver.displayText(LinkTarget.bare("Ring-theory"), CORPUS));
    }

    @Test
    void resolve_unknownTargetStillLinksAndWarns() {
        ConversionContext context = new ConversionContext(CORPUS, RenderOptions.defaults());

        String link = CrossReferenceResolver.resolve(LinkTarget.bare(" missing-note "), context, 12);

        assertEquals("<a href=\"missing-note.html\">missing note</a>", link);
        assertEquals(List.of("missing-note"), context.sortedForwardLinks());
        ProcessingWarning warning = context.warnings().get(0);
        assertEquals(WarningType.UNKNOWN_TARGET, warning.type());
        assertEquals(12, warning.position());
    }

    @Test
    void resolve_pdfTargetIsNotAForwardLink() {
        ConversionContext context = new ConversionContext(CORPUS, RenderOptions.defaults());

        CrossReferenceResolver.resolve(LinkTarget.bare("slides.pdf"), context, 0);

        assertEquals(List.of(), context.sortedForwardLinks());
    }
}
