package com.williamcallahan.notewiki.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.notewiki.config.AppProperties;
import com.williamcallahan.notewiki.config.PageSettings;
import com.williamcallahan.notewiki.domain.render.CorpusIndex;
import com.williamcallahan.notewiki.domain.render.Heading;
import com.williamcallahan.notewiki.domain.render.MacroTable;
import com.williamcallahan.notewiki.domain.render.RenderedNote;
import com.williamcallahan.notewiki.service.tex.TexProcessingException;
import org.jsoup.nodes.DataNode;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Wraps a rendered note body in a standalone HTML page.
 *
 * <p>The page shell (head scripts, metadata, table of contents, link lists) is built as a jsoup
 * document. The rendered body is spliced in after serialization so that diagram scripts and math
 * reach the browser byte for byte.</p>
 */
@Service
public class NotePageRenderer {

    private static final String BODY_PLACEHOLDER = "@@NOTE_BODY@@";

    private final PageSettings pageSettings;
    private final ObjectMapper objectMapper;

    public NotePageRenderer(AppProperties appProperties, ObjectMapper objectMapper) {
        this.pageSettings = appProperties.getPage();
        this.objectMapper = objectMapper;
    }

    /**
     * Builds the page for one note.
     *
     * @param noteId note identifier, used for the PDF link
     * @param note the rendered note
     * @param corpus corpus index supplying link titles and backlinks
     * @param created optional creation date to display
     * @param modified optional modification date to display
     * @return complete HTML document
     */
    public String renderPage(String noteId, RenderedNote note, CorpusIndex corpus,
                             Optional<String> created, Optional<String> modified) {
        Document page = Document.createShell("");
        page.outputSettings().charset("UTF-8");
        Element head = page.head();
        head.appendElement("meta").attr("charset", "UTF-8");
        head.appendElement("meta").attr("name", "viewport").attr("content", "width=device-width, initial-scale=1.0");
        page.title(note.metadata().title() + " - " + pageSettings.getSiteName());
        head.appendElement("link").attr("rel", "stylesheet").attr("type", "text/css").attr("href", "style.css");
        head.appendElement("link").attr("rel", "stylesheet").attr("type", "text/css")
            .attr("href", pageSettings.getTikzjaxStylesheetUrl());
        head.appendElement("script").appendChild(new DataNode(mathJaxConfig(note.macros())));
        head.appendElement("script").attr("id", "MathJax-script").attr("async", "")
            .attr("src", pageSettings.getMathjaxUrl());
        head.appendElement("script").attr("src", pageSettings.getTikzjaxUrl());

        Element wrapper = page.body().appendElement("div").addClass("content-wrapper");
        appendNavigation(page.body(), noteId);
        wrapper.appendElement("h1").text(note.metadata().title());
        appendMetadata(wrapper, note, created, modified);

        Element content = wrapper.appendElement("div").addClass("content");
        appendTableOfContents(content, note.topLevelHeadings());
        content.appendText(BODY_PLACEHOLDER);

        appendLinkList(wrapper, "linked-notes", "Linked Notes", note.forwardLinks(), corpus);
        appendLinkList(wrapper, "backlinks", "Backlinks", corpus.backlinksOf(noteId), corpus);

        return "<!DOCTYPE html>\n" + page.outerHtml().replace(BODY_PLACEHOLDER, note.html());
    }

    String mathJaxConfig(MacroTable macros) {
        String macroJson;
        try {
            macroJson = objectMapper.writeValueAsString(macros).replace("</", "<\\/");
        } catch (JsonProcessingException jsonException) {
            throw new TexProcessingException("Failed to serialize macro table", jsonException);
        }
        return "\nwindow.MathJax = {\n"
            + "  tex: {\n"
            + "    inlineMath: [['$', '$'], ['\\\\(', '\\\\)']],\n"
            + "    displayMath: [['$$', '$$'], ['\\\\[', '\\\\]']],\n"
            + "    processEscapes: true,\n"
            + "    macros: " + macroJson + "\n"
            + "  },\n"
            + "  startup: { typeset: true }\n"
            + "};\n";
    }

    private void appendNavigation(Element body, String noteId) {
        Element nav = new Element("div").addClass("top-nav");
        nav.appendElement("a").attr("href", "../index.html").addClass("nav-link").text("Index");
        nav.appendElement("a").attr("href", pageSettings.getPdfBasePath() + noteId + ".pdf")
            .addClass("nav-btn").attr("title", "View PDF").text("PDF");
        body.prependChild(nav);
    }

    private void appendMetadata(Element wrapper, RenderedNote note, Optional<String> created, Optional<String> modified) {
        if (created.isEmpty() && modified.isEmpty() && !note.metadata().hasTags()) {
            return;
        }
        Element metadata = wrapper.appendElement("div").addClass("metadata");
        modified.ifPresent(date -> appendField(metadata, "Last modified:", date));
        created.ifPresent(date -> appendField(metadata, "Created:", date));
        if (note.metadata().hasTags()) {
            appendField(metadata, "Tags:", String.join(", ", note.metadata().tags()));
        }
    }

    private static void appendField(Element metadata, String label, String value) {
        metadata.appendElement("strong").text(label);
        metadata.appendText(" " + value);
        metadata.appendElement("br");
    }

    private void appendTableOfContents(Element content, List<Heading> headings) {
        if (headings.size() < pageSettings.getTocThreshold()) {
            return;
        }
        Element toc = content.appendElement("div").addClass("toc-compact");
        toc.appendElement("h3").text("Contents");
        Element list = toc.appendElement("ul");
        for (Heading heading : headings) {
            list.appendElement("li").appendElement("a").attr("href", "#" + heading.anchorId()).html(heading.title());
        }
    }

    private static void appendLinkList(Element wrapper, String cssClass, String title, Collection<String> noteIds,
                                       CorpusIndex corpus) {
        if (noteIds.isEmpty()) {
            return;
        }
        Element section = wrapper.appendElement("div").addClass(cssClass);
        section.appendElement("h2").text(title);
        Element list = section.appendElement("ul");
        for (String linkedId : noteIds) {
            list.appendElement("li").appendElement("a").attr("href", linkedId + ".html")
                .text(corpus.titleOf(linkedId).orElse(linkedId));
        }
    }
}
