package com.williamcallahan.notewiki.domain.render;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Replaces the whole corpus: note identifier to note source.
 */
public record CorpusUpdateRequest(Map<String, String> notes) {

    @JsonCreator
    public static CorpusUpdateRequest create(@JsonProperty("notes") Map<String, String> notes) {
        return new CorpusUpdateRequest(notes == null ? Map.of() : notes);
    }

    public CorpusUpdateRequest {
        notes = Map.copyOf(notes);
    }
}
