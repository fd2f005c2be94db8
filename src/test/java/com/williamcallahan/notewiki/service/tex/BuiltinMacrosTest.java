package com.williamcallahan.notewiki.service.tex;

import com.williamcallahan.notewiki.domain.render.MacroEntry;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;

class BuiltinMacrosTest {

    @Test
    void inferArity_usesHighestUnescapedParameter() {
        assertEquals(0, BuiltinMacros.inferArity("\\mathbb{R}"));
        assertEquals(1, BuiltinMacros.inferArity("\\left| #1 \\right|"));
        assertEquals(2, BuiltinMacros.inferArity("\\langle #1 | #2 \\rangle"));
        assertEquals(0, BuiltinMacros.inferArity("\\#1"));
    }

    @Test
    void entries_includeGeneratedFontShorthands() {
        Map<String, MacroEntry> byName = BuiltinMacros.entries().stream()
            .collect(Collectors.toMap(MacroEntry::name, Function.identity()));

        assertEquals("\\mathcal{A}", byName.get("cA").body());
        assertEquals("\\mathbb{Z}", byName.get("bbZ").body());
        assertEquals("\\mathfrak{p}", byName.get("fp").body());
        assertEquals(1, byName.get("abs").arity());
    }
}
