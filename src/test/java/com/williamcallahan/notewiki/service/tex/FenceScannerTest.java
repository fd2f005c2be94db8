package com.williamcallahan.notewiki.service.tex;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FenceScannerTest {

    @Test
    void findNext_readsInfoAndContent() {
        String text = "before\n```java\nint x;\nint y;\n```\nafter";

        FenceScanner.Fence fence = FenceScanner.findNext(text, 0).orElseThrow();

        assertEquals("java", fence.info());
        assertEquals("int x;\nint y;", fence.content());
        assertEquals(text.indexOf("```java"), fence.start());
        assertEquals("\nafter", text.substring(fence.end()));
    }

    @Test
    void findNext_closingMustMatchCharacterAndLength() {
        String text = "````\n```\nstill inside\n~~~~\n````";

        FenceScanner.Fence fence = FenceScanner.findNext(text, 0).orElseThrow();

        assertEquals("```\nstill inside\n~~~~", fence.content());
    }

    @Test
    void findNext_unclosedFence_isEmpty() {
        Optional<FenceScanner.Fence> fence = FenceScanner.findNext("```\nopen forever", 0);

        assertTrue(fence.isEmpty());
    }

    @Test
    void findNext_markerMidLineIsIgnored() {
        assertTrue(FenceScanner.findNext("text ```\nx\n```", 0).isEmpty());
        assertEquals(5, FenceScanner.findNext("text\n```\nx\n```", 0).orElseThrow().start());
    }

    @Test
    void scanFenceMarker_requiresThreeCharacters() {
        assertNull(FenceScanner.scanFenceMarker("``x", 0));
        assertEquals(4, FenceScanner.scanFenceMarker("~~~~", 0).length());
    }
}
