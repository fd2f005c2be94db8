package com.williamcallahan.notewiki.service.tex;

import com.williamcallahan.notewiki.domain.render.CorpusIndex;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExplicitListsTest {

    private ConversionContext context;

    @BeforeEach
    void setUp() {
        context = new ConversionContext(CorpusIndex.empty(), RenderOptions.defaults());
    }

    @Test
    void convert_itemizeBecomesUnorderedList() {
        String result = ExplicitLists.convert("\\begin{itemize}\n\\item One\n\\item Two\n\\end{itemize}", context);

        assertEquals("\n<ul>\n<li>One</li>\n<li>Two</li>\n</ul>\n", result);
    }

    @Test
    void convert_enumerateWithNosepOption() {
        String result = ExplicitLists.convert("\\begin{enumerate}[nosep]\\item a\\item b\\end{enumerate}", context);

        assertEquals("\n<ol class=\"nosep\">\n<li>a</li>\n<li>b</li>\n</ol>\n", result);
    }

    @Test
    void convert_nestedListStaysInsideItsItem() {
        String result = ExplicitLists.convert(
            "\\begin{itemize}\\item A \\begin{enumerate}\\item x\\end{enumerate}\\item B\\end{itemize}", context);

        assertTrue(result.startsWith("\n<ul>\n<li>A \n<ol>\n<li>x</li>\n</ol></li>"));
        assertTrue(result.endsWith("<li>B</li>\n</ul>\n"));
    }

    @Test
    void items_labelIsBoldAndItemizeLookalikesAreNotSplit() {
        List<String> items = ExplicitLists.items("\\item[(a)] first \\itemsep \\item second");

        assertEquals(List.of("<strong>(a)</strong> first \\itemsep", "second"), items);
    }

    @Test
    void items_leadingTextIsKept() {
        assertEquals(List.of("intro", "one"), ExplicitLists.items("intro \\item one"));
    }
}
