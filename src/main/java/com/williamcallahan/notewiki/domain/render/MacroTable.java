package com.williamcallahan.notewiki.domain.render;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Macro substitutions handed to the math renderer, keyed by name.
 */
public final class MacroTable {

    private final Map<String, MacroEntry> entries;

    private MacroTable(Map<String, MacroEntry> entries) {
        this.entries = Collections.unmodifiableMap(entries);
    }

    /**
     * Merges layers in order; an entry in a later layer replaces one of the same name.
     */
    @SafeVarargs
    public static MacroTable merge(Collection<MacroEntry>... layers) {
        Map<String, MacroEntry> merged = new LinkedHashMap<>();
        for (Collection<MacroEntry> layer : layers) {
            for (MacroEntry entry : layer) {
                merged.put(entry.name(), entry);
            }
        }
        return new MacroTable(merged);
    }

    public static MacroTable empty() {
        return new MacroTable(new LinkedHashMap<>());
    }

    public Optional<MacroEntry> get(String name) {
        return Optional.ofNullable(entries.get(name));
    }

    public int size() {
        return entries.size();
    }

    public Collection<MacroEntry> entries() {
        return entries.values();
    }

    /**
     * MathJax {@code tex.macros} shape: {@code "name": "body"} for plain substitutions and
     * {@code "name": ["body", arity]} for parameterized ones.
     */
    @JsonValue
    public Map<String, Object> toMathJaxMacros() {
        Map<String, Object> macros = new LinkedHashMap<>();
        for (MacroEntry entry : entries.values()) {
            macros.put(entry.name(), entry.arity() == 0 ? entry.body() : List.of(entry.body(), entry.arity()));
        }
        return macros;
    }
}
