package com.williamcallahan.notewiki.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.williamcallahan.notewiki.config.AppProperties;
import com.williamcallahan.notewiki.domain.render.RenderCacheStats;
import com.williamcallahan.notewiki.domain.render.RenderedNote;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NoteRenderServiceTest {

    private static final String NOTE = "\\Title{Alpha}\n\\Tags{algebra}\nSee \\wref{beta}.";

    private AppProperties appProperties;
    private CorpusIndexService corpusIndexService;
    private NoteRenderService service;

    @BeforeEach
    void setUp() {
        appProperties = new AppProperties();
        appProperties.getRender().setMaxInputLength(10_000);
        corpusIndexService = new CorpusIndexService(appProperties);
        service = newService(appProperties);
    }

    @AfterEach
    void tearDown() {
        service.shutdown();
    }

    @Test
    void render_returnsMetadataAndLinks() {
        RenderedNote rendered = service.render("alpha", NOTE);

        assertEquals("Alpha", rendered.metadata().title());
        assertEquals(List.of("algebra"), rendered.metadata().tags());
        assertEquals(List.of("beta"), rendered.forwardLinks());
        assertTrue(rendered.html().contains("href=\"beta.html\""), rendered.html());
    }

    @Test
    void render_secondCallIsServedFromCache() {
        RenderedNote first = service.render("alpha", NOTE);
        RenderedNote second = service.render("alpha", NOTE);

        assertSame(first, second);
        RenderCacheStats stats = service.getCacheStats();
        assertEquals(1, stats.hitCount());
        assertEquals(1, stats.missCount());
        assertEquals(1, stats.size());
        assertEquals(0.5, stats.hitRate(), 1e-9);
    }

    @Test
    void render_newCorpusVersionMissesCache() {
        RenderedNote before = service.render("alpha", NOTE);
        corpusIndexService.replace(Map.of("beta", "\\Title{Beta}"));
        RenderedNote after = service.render("alpha", NOTE);

        assertNotSame(before, after);
        assertTrue(after.html().contains(">Beta</a>"), after.html());
        assertEquals(2, service.getCacheStats().missCount());
    }

    @Test
    void render_rejectsOversizedSource() {
        String oversized = "x".repeat(10_001);

        IllegalArgumentException failure = assertThrows(IllegalArgumentException.class,
            () -> service.render("big", oversized));
        assertTrue(failure.getMessage().contains("maximum length"));
        assertEquals(0, service.getCacheStats().size());
    }

    @Test
    void render_nullSourceRendersAsEmptyNote() {
        RenderedNote rendered = service.render("empty", null);

        assertEquals("Untitled", rendered.metadata().title());
        assertTrue(rendered.isClean());
    }

    @Test
    void render_overrunningBudgetFailsWithoutCaching() {
        AppProperties tight = new AppProperties();
        tight.getRender().setTimeBudget(Duration.ofNanos(1));
        NoteRenderService tightService = newService(tight);
        try {
            String slow = "Some $x_i$ text with \\textbf{bold} and a footnote\\footnote{n}.\n".repeat(2_000);

            RenderTimeoutException failure = assertThrows(RenderTimeoutException.class,
                () -> tightService.render("slow", slow));
            assertEquals("slow", failure.getNoteId());
            assertEquals(0, tightService.getCacheStats().size());
        } finally {
            tightService.shutdown();
        }
    }

    @Test
    void clearCache_dropsRenderedNotes() {
        service.render("alpha", NOTE);
        service.clearCache();

        assertEquals(0, service.getCacheStats().size());
    }

    private NoteRenderService newService(AppProperties properties) {
        Cache<String, RenderedNote> cache = Caffeine.newBuilder()
            .executor(Runnable::run)
            .maximumSize(100)
            .recordStats()
            .build();
        return new NoteRenderService(corpusIndexService, new ContentHasher(), cache, properties);
    }
}
