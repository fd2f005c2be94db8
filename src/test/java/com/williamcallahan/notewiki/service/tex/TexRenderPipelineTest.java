package com.williamcallahan.notewiki.service.tex;

import com.williamcallahan.notewiki.domain.render.CorpusIndex;
import com.williamcallahan.notewiki.domain.render.Heading;
import com.williamcallahan.notewiki.domain.render.NoteMetadata;
import com.williamcallahan.notewiki.domain.render.ProcessingWarning;
import com.williamcallahan.notewiki.domain.render.ProcessingWarning.WarningType;
import com.williamcallahan.notewiki.domain.render.RenderedNote;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * End-to-end conversion of complete notes.
 */
class TexRenderPipelineTest {

    private static final String NOTE = String.join("\n",
        "\\documentclass{note}",
        "\\Title{Group \\texorpdfstring{$G$}{G} actions}",
        "\\Tags{algebra, groups}",
        "\\newcommand{\\act}{\\cdot} % shorthand for the action",
        "\\begin{document}",
        "\\NoteHeader",
        "\\section{Definition}",
        "Let $G$ act on $X$ with $g < h$.",
        "\\begin{definition}[Action]",
        "A map $G \\times X \\to X$.",
        "\\end{definition}",
        "\\section{Examples}",
        "- first",
        "- second",
        "See \\wref{orbit-stabilizer} and ((Serre, Linear Representations)).",
        "\\References",
        "\\end{document}");

    private final TexRenderPipeline pipeline = new TexRenderPipeline();

    private RenderedNote render(String source) {
        return pipeline.render(source, CorpusIndex.empty(), RenderOptions.defaults());
    }

    @Test
    void render_completeNote() {
        RenderedNote note = render(NOTE);

        assertEquals(new NoteMetadata("Group G actions", List.of("algebra", "groups")), note.metadata());
        assertEquals("\\cdot", note.macros().get("act").orElseThrow().body());
        assertEquals(List.of(new Heading(2, "Definition", "definition"), new Heading(2, "Examples", "examples")),
            note.headings());
        assertEquals(List.of("orbit-stabilizer"), note.forwardLinks());

        String html = note.html();
        assertTrue(html.contains("<p>Let $G$ act on $X$ with $g &lt; h$.</p>"), html);
        assertTrue(html.contains("<strong>Definition (Action).</strong> A map $G \\times X \\to X$."), html);
        assertTrue(html.contains("<ul>\n<li>first</li>\n<li>second</li>\n</ul>"), html);
        assertTrue(html.contains("<a href=\"orbit-stabilizer.html\">orbit stabilizer</a>"), html);
        assertTrue(html.contains("<sup><a href=\"#ref-1\">[1]</a></sup>"), html);
        assertTrue(html.contains("<li id=\"ref-1\">Serre, Linear Representations</li>"), html);
        assertFalse(html.contains("shorthand"));
        assertFalse(html.contains("\\newcommand"));
    }

    @Test
    void render_unknownLinkTargetIsTheOnlyWarning() {
        List<ProcessingWarning> warnings = render(NOTE).warnings();

        assertEquals(1, warnings.size());
        assertEquals(WarningType.UNKNOWN_TARGET, warnings.get(0).type());
    }

    @Test
    void render_noPlaceholderSurvives() {
        String html = render("Text $$x$$ \\[y\\] \\(z\\) \\verb|v| $w$\n```\ncode\n```\n- item $m$").html();

        assertEquals(html, RegionStash.stripTokens(html));
    }

    @Test
    void render_isDeterministic() {
        assertEquals(render(NOTE).html(), render(NOTE).html());
    }

    @Test
    void render_escapedAmpersandHeading_anchorHasNoEntityOrBackslash() {
        RenderedNote note = render("\\section*{A \\& B}");

        Heading heading = note.headings().get(0);
        assertEquals("A &amp; B", heading.title());
        assertEquals("a-b", heading.anchorId());
        assertFalse(heading.anchorId().contains("&"));
        assertFalse(heading.anchorId().contains("\\"));
    }

    @Test
    void render_mathIsNotTouchedByMarkupPasses() {
        String html = render("Product $a*b*c$ and *emphasis* with $\\textbf{x}$").html();

        assertTrue(html.contains("$a*b*c$"), html);
        assertTrue(html.contains("<em>emphasis</em>"), html);
        assertTrue(html.contains("$\\textbf{x}$"), html);
    }

    @Test
    void render_unbalancedCommandKeepsRemainingText() {
        RenderedNote note = render("\\textbf{never closed and more text");

        assertTrue(note.html().contains("more text"));
        assertEquals(WarningType.UNBALANCED_DELIMITER, note.warnings().get(0).type());
    }

    @Test
    void render_diagramSourceIsNotEscaped() {
        String html = render("\\begin{tikzpicture}\n\\node at (0,0) {$a<b$};\n\\end{tikzpicture}\nAfter").html();

        assertTrue(html.contains("<script type=\"text/tikz\">\\begin{tikzpicture}\n\\node at (0,0) {$a<b$};\n"
            + "\\end{tikzpicture}</script>"), html);
        assertTrue(html.contains("<p>After</p>"), html);
    }

    @Test
    void render_footnotesAreListedAfterBody() {
        String html = render("Text\\footnote{A remark.} continues.").html();

        assertTrue(html.contains("<sup id=\"fnref-1\"><a href=\"#fn-1\">[1]</a></sup>"), html);
        assertTrue(html.indexOf("continues") < html.indexOf("<div class=\"footnotes\">"), html);
    }

    @Test
    void render_seeAlsoDashListLinksEachItem() {
        RenderedNote note = render("Intro\n\\SeeAlso{\n- group-theory\n- ring-theory\n}\n");

        assertEquals(List.of("group-theory", "ring-theory"), note.forwardLinks());
        assertTrue(note.html().contains("<li><a href=\"group-theory.html\">group theory</a></li>"), note.html());
        assertFalse(note.html().contains("<ul>\n<li>group-theory"), note.html());
    }

    @Test
    void render_mathNestedInsideMathIsRestoredWhole() {
        RenderedNote note = render("A $\\text{see \\(x\\)}$ b");

        assertTrue(note.html().contains("$\\text{see \\(x\\)}$"), note.html());
        assertFalse(note.html().contains("ZQMATH"), note.html());
        assertTrue(note.warnings().isEmpty(), note.warnings().toString());
    }

    @Test
    void render_verbInsideFenceStaysLiteral() {
        RenderedNote note = render("```\nuse \\verb|x| here\n```\n");

        assertTrue(note.html().contains("<pre><code>use \\verb|x| here</code></pre>"), note.html());
    }

    @Test
    void render_emptySource() {
        RenderedNote note = render(null);

        assertEquals("", note.html());
        assertEquals(NoteMetadata.UNTITLED, note.metadata().title());
        assertTrue(note.isClean());
    }

    @Test
    void passes_runInDocumentedOrder() {
        List<String> names = TexRenderPipeline.passes().stream().map(RenderPass::name).toList();

        assertEquals(List.of("diagrams", "escape-html", "stash-math", "see-also", "explicit-lists", "implicit-lists",
            "environments", "sections", "inline", "citations", "footnotes", "footers", "restore-math",
            "restore-blocks", "paragraphs"), names);
    }

    @Test
    void headings_areReadInDocumentOrder() {
        List<Heading> headings = TexRenderPipeline.headings(
            "<h2 id=\"a\">A</h2><p>x</p><h3 id=\"b\">B <em>c</em></h3><h2>No id</h2><h4 id=\"d\">D</h4>");

        assertEquals(List.of(
            new Heading(2, "A", "a"),
            new Heading(3, "B <em>c</em>", "b"),
            new Heading(4, "D", "d")
        ), headings);
    }
}
