package com.williamcallahan.notewiki.service.tex;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Numbers footnotes by first reference and keeps their definitions.
 *
 * <p>Footnotes written with an identifier ({@code [^id]}) are keyed by it; inline
 * {@code \footnote{...}} footnotes get a generated {@code auto-N} identifier.</p>
 */
public final class FootnoteRegistry {

    private final SequenceRegistry<String> order = new SequenceRegistry<>();
    private final Map<String, String> definitions = new LinkedHashMap<>();
    private final Map<String, Integer> referenceCounts = new HashMap<>();
    private int anonymousCount;

    /**
     * Records the definition text of footnote {@code id}; the first definition wins.
     */
    public void define(String id, String content) {
        definitions.putIfAbsent(id, content);
    }

    /**
     * Registers a reference to {@code id} and returns its number.
     */
    public int reference(String id) {
        referenceCounts.merge(id, 1, Integer::sum);
        return order.register(id);
    }

    /**
     * Registers an inline footnote under a generated identifier.
     *
     * @return the generated identifier
     */
    public String referenceAnonymous(String content) {
        anonymousCount++;
        String id = "auto-" + anonymousCount;
        define(id, content);
        reference(id);
        return id;
    }

    /**
     * Returns how many times {@code id} has been referenced so far.
     */
    public int referenceCount(String id) {
        return referenceCounts.getOrDefault(id, 0);
    }

    public int numberOf(String id) {
        return order.numberOf(id).orElseThrow(() -> new IllegalStateException("Footnote never referenced: " + id));
    }

    public Optional<String> definitionOf(String id) {
        return Optional.ofNullable(definitions.get(id));
    }

    /**
     * Returns referenced identifiers in number order.
     */
    public List<String> referencedIds() {
        return order.keys();
    }

    /**
     * Returns defined identifiers in definition order.
     */
    public List<String> definedIds() {
        return List.copyOf(definitions.keySet());
    }

    public boolean isEmpty() {
        return order.isEmpty();
    }
}
