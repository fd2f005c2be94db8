package com.williamcallahan.notewiki.service.tex;

import com.williamcallahan.notewiki.domain.render.CorpusIndex;
import com.williamcallahan.notewiki.domain.render.ProcessingWarning.WarningType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FootnoteConverterTest {

    private ConversionContext context;

    @BeforeEach
    void setUp() {
        context = new ConversionContext(CorpusIndex.empty(), RenderOptions.defaults());
    }

    @Test
    void convert_numbersInlineAndKeyedFootnotesInReadingOrder() {
        String text = "x\\footnote{first} y[^n] z[^n]\n[^n]: named";

        String result = FootnoteConverter.convert(text, context);

        assertEquals("x<sup id=\"fnref-1\"><a href=\"#fn-1\">[1]</a></sup>"
            + " y<sup id=\"fnref-2\"><a href=\"#fn-2\">[2]</a></sup>"
            + " z<sup id=\"fnref-2-2\"><a href=\"#fn-2\">[2]</a></sup>\n", result);
        String footer = FootnoteConverter.footer(context);
        assertTrue(footer.contains("<li id=\"fn-1\">first <a href=\"#fnref-1\">↩</a></li>"));
        assertTrue(footer.contains("<li id=\"fn-2\">named <a href=\"#fnref-2\">↩</a></li>"));
        assertTrue(footer.indexOf("fn-1\"") < footer.indexOf("fn-2\""));
        assertTrue(context.warnings().isEmpty());
    }

    @Test
    void footer_referenceWithoutDefinition_warns() {
        FootnoteConverter.convert("see[^missing]", context);

        String footer = FootnoteConverter.footer(context);

        assertTrue(footer.contains("<li id=\"fn-1\">"));
        assertEquals(WarningType.UNDEFINED_FOOTNOTE, context.warnings().get(0).type());
    }

    @Test
    void footer_listsUnreferencedDefinitionsLast() {
        String result = FootnoteConverter.convert("[^lonely]: kept anyway\nbody[^a]\n[^a]: used", context);

        assertFalse(result.contains("kept anyway"));
        String footer = FootnoteConverter.footer(context);
        assertTrue(footer.indexOf("<li id=\"fn-1\">used") < footer.indexOf("<li id=\"fn-2\">kept anyway"), footer);
    }

    @Test
    void convert_identifiersDifferingOnlyInPunctuationGetDistinctAnchors() {
        String result = FootnoteConverter.convert("p[^a.b] q[^a-b]\n[^a.b]: dot\n[^a-b]: dash", context);

        assertTrue(result.contains("<sup id=\"fnref-1\"><a href=\"#fn-1\">[1]</a></sup>"), result);
        assertTrue(result.contains("<sup id=\"fnref-2\"><a href=\"#fn-2\">[2]</a></sup>"), result);
        String footer = FootnoteConverter.footer(context);
        assertTrue(footer.contains("<li id=\"fn-1\">dot "), footer);
        assertTrue(footer.contains("<li id=\"fn-2\">dash "), footer);
    }

    @Test
    void footer_withoutFootnotes_isEmpty() {
        assertEquals("plain", FootnoteConverter.convert("plain", context));
        assertEquals("", FootnoteConverter.footer(context));
    }

    @Test
    void convert_unclosedInlineFootnote_leavesMarkerAndWarns() {
        String result = FootnoteConverter.convert("a\\footnote{open", context);

        assertEquals("a\\footnote{open", result);
        assertEquals(WarningType.UNBALANCED_DELIMITER, context.warnings().get(0).type());
    }
}
