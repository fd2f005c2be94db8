package com.williamcallahan.notewiki.web;

import com.williamcallahan.notewiki.domain.render.CorpusIndex;
import com.williamcallahan.notewiki.domain.render.Heading;
import com.williamcallahan.notewiki.domain.render.MacroEntry;
import com.williamcallahan.notewiki.domain.render.MacroTable;
import com.williamcallahan.notewiki.domain.render.NoteMetadata;
import com.williamcallahan.notewiki.domain.render.ProcessingWarning;
import com.williamcallahan.notewiki.domain.render.RenderCacheStats;
import com.williamcallahan.notewiki.domain.render.RenderedNote;
import com.williamcallahan.notewiki.service.CorpusIndexService;
import com.williamcallahan.notewiki.service.NotePageRenderer;
import com.williamcallahan.notewiki.service.NoteRenderService;
import com.williamcallahan.notewiki.service.RenderTimeoutException;
import com.williamcallahan.notewiki.service.tex.TexProcessingException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.contains;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = RenderController.class)
@Import(ExceptionResponseBuilder.class)
class RenderControllerTest {

    private static final String REQUEST = "{\"noteId\":\"groups\",\"content\":\"\\\\Title{Groups}\"}";

    @Autowired
    MockMvc mvc;

    @MockitoBean
    NoteRenderService noteRenderService;

    @MockitoBean
    NotePageRenderer notePageRenderer;

    @MockitoBean
    CorpusIndexService corpusIndexService;

    @Test
    void render_returnsNoteAsJson() throws Exception {
        given(noteRenderService.render("groups", "\\Title{Groups}")).willReturn(renderedNote());

        mvc.perform(post("/api/notes/render").contentType(MediaType.APPLICATION_JSON).content(REQUEST))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.html").value("<p>Body</p>"))
            .andExpect(jsonPath("$.metadata.title").value("Groups"))
            .andExpect(jsonPath("$.macros.R").value("\\mathbb{R}"))
            .andExpect(jsonPath("$.forwardLinks", contains("rings")))
            .andExpect(jsonPath("$.headings[0].anchorId").value("intro"))
            .andExpect(jsonPath("$.warnings[0].type").value("UNKNOWN_TARGET"));
    }

    @Test
    void render_blankNoteIdIsBadRequest() throws Exception {
        mvc.perform(post("/api/notes/render").contentType(MediaType.APPLICATION_JSON)
                .content("{\"noteId\":\"  \",\"content\":\"x\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.status").value("error"))
            .andExpect(jsonPath("$.message").value("noteId is required"));

        verify(noteRenderService, never()).render(anyString(), anyString());
    }

    @Test
    void render_oversizedSourceIsBadRequest() throws Exception {
        given(noteRenderService.render(anyString(), anyString()))
            .willThrow(new IllegalArgumentException("Note source exceeds maximum length: 9 > 8"));

        mvc.perform(post("/api/notes/render").contentType(MediaType.APPLICATION_JSON).content(REQUEST))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message", containsString("maximum length")))
            .andExpect(jsonPath("$.details").doesNotExist());
    }

    @Test
    void render_timeoutIsGatewayTimeout() throws Exception {
        given(noteRenderService.render(anyString(), anyString()))
            .willThrow(new RenderTimeoutException("groups", Duration.ofSeconds(10), new TimeoutException()));

        mvc.perform(post("/api/notes/render").contentType(MediaType.APPLICATION_JSON).content(REQUEST))
            .andExpect(status().isGatewayTimeout())
            .andExpect(jsonPath("$.message").value("Failed to render note"))
            .andExpect(jsonPath("$.details", containsString("RenderTimeoutException")));
    }

    @Test
    void render_pipelineFailureIsServerError() throws Exception {
        given(noteRenderService.render(anyString(), anyString()))
            .willThrow(new TexProcessingException("Render pass 'inline' failed", new IllegalStateException("boom")));

        mvc.perform(post("/api/notes/render").contentType(MediaType.APPLICATION_JSON).content(REQUEST))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.details", containsString("cause=IllegalStateException: boom")));
    }

    @Test
    void page_returnsHtml() throws Exception {
        RenderedNote rendered = renderedNote();
        CorpusIndex corpus = CorpusIndex.empty();
        given(noteRenderService.render("groups", "\\Title{Groups}")).willReturn(rendered);
        given(corpusIndexService.current()).willReturn(corpus);
        given(notePageRenderer.renderPage(eq("groups"), eq(rendered), eq(corpus), eq(Optional.of("2024-01-02")),
            eq(Optional.empty()))).willReturn("<!DOCTYPE html>\n<html></html>");

        mvc.perform(post("/api/notes/page").contentType(MediaType.APPLICATION_JSON)
                .content("{\"noteId\":\"groups\",\"content\":\"\\\\Title{Groups}\",\"created\":\"2024-01-02\"}"))
            .andExpect(status().isOk())
            .andExpect(content().contentTypeCompatibleWith(MediaType.TEXT_HTML))
            .andExpect(content().string(containsString("<!DOCTYPE html>")));
    }

    @Test
    void page_failureIsReportedAsJson() throws Exception {
        given(noteRenderService.render(anyString(), anyString()))
            .willThrow(new RenderTimeoutException("groups", Duration.ofSeconds(1), new TimeoutException()));

        mvc.perform(post("/api/notes/page").contentType(MediaType.APPLICATION_JSON).content(REQUEST))
            .andExpect(status().isGatewayTimeout())
            .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
            .andExpect(jsonPath("$.message").value("Failed to render page"));

        verify(notePageRenderer, never()).renderPage(anyString(), any(), any(), any(), any());
    }

    @Test
    void cacheStats_reportsCountersAndHitRate() throws Exception {
        given(noteRenderService.getCacheStats()).willReturn(new RenderCacheStats(3, 1, 0, 2));

        mvc.perform(get("/api/notes/cache/stats"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.hitCount").value(3))
            .andExpect(jsonPath("$.missCount").value(1))
            .andExpect(jsonPath("$.size").value(2))
            .andExpect(jsonPath("$.hitRate").value("75.00%"));
    }

    @Test
    void cacheClear_clearsAndConfirms() throws Exception {
        mvc.perform(post("/api/notes/cache/clear"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("success"))
            .andExpect(jsonPath("$.message").value("Cache cleared successfully"));

        verify(noteRenderService).clearCache();
    }

    private static RenderedNote renderedNote() {
        return new RenderedNote(
            "<p>Body</p>",
            new NoteMetadata("Groups", List.of("algebra")),
            MacroTable.merge(List.of(new MacroEntry("R", 0, "\\mathbb{R}"))),
            List.of("rings"),
            List.of(new Heading(2, "Intro", "intro")),
            List.of(ProcessingWarning.create("Link target 'rings' is not in the title index",
                ProcessingWarning.WarningType.UNKNOWN_TARGET, 4)),
            2L);
    }
}
