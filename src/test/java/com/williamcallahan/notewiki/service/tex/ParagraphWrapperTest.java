package com.williamcallahan.notewiki.service.tex;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ParagraphWrapperTest {

    @Test
    void wrap_joinsLinesUntilBlankLine() {
        assertEquals("<p>a b</p>\n\n<p>c</p>", ParagraphWrapper.wrap("a\nb\n\nc"));
    }

    @Test
    void wrap_blockLinesEndParagraphs() {
        assertEquals("<p>intro</p>\n<h2 id=\"x\">X</h2>\n<p>text</p>",
            ParagraphWrapper.wrap("intro\n<h2 id=\"x\">X</h2>\ntext"));
    }

    @Test
    void wrap_scriptBodyIsCopiedVerbatim() {
        String text = "<script type=\"text/tikz\">\n\\draw (0,0);\n\n</script>\nafter";

        assertEquals("<script type=\"text/tikz\">\n\\draw (0,0);\n\n</script>\n<p>after</p>", ParagraphWrapper.wrap(text));
    }

    @Test
    void wrap_tagSpanningLinesIsNotWrapped() {
        assertEquals("<div class=\"x\"\n  data-y=\"z\">\n<p>body</p>\n</div>",
            ParagraphWrapper.wrap("<div class=\"x\"\n  data-y=\"z\">\nbody\n</div>"));
    }
}
