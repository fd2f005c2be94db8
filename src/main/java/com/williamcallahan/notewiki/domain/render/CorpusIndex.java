package com.williamcallahan.notewiki.domain.render;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Corpus-wide, read-only lookup tables built once per batch before any note is converted.
 *
 * @param titles note identifier to display title
 * @param backlinks note identifier to the identifiers of notes linking to it
 * @param version monotonically increasing build number, part of render cache keys
 */
public record CorpusIndex(
    Map<String, String> titles,
    Map<String, Set<String>> backlinks,
    long version
) {

    public CorpusIndex {
        Objects.requireNonNull(titles, "Title index cannot be null");
        Objects.requireNonNull(backlinks, "Backlink index cannot be null");
        titles = Map.copyOf(titles);
        Map<String, Set<String>> frozen = new HashMap<>();
        backlinks.forEach((target, sources) -> frozen.put(target, Collections.unmodifiableSet(new TreeSet<>(sources))));
        backlinks = Collections.unmodifiableMap(frozen);
    }

    /**
     * An index with no notes.
     */
    public static CorpusIndex empty() {
        return new CorpusIndex(Map.of(), Map.of(), 0L);
    }

    /**
     * Looks up the display title of a note.
     */
    public Optional<String> titleOf(String noteId) {
        return Optional.ofNullable(titles.get(noteId));
    }

    /**
     * Returns the sorted identifiers of notes linking to {@code noteId}.
     */
    public Set<String> backlinksOf(String noteId) {
        return backlinks.getOrDefault(noteId, Set.of());
    }
}
