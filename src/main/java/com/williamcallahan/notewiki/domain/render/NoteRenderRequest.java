package com.williamcallahan.notewiki.domain.render;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;
import java.util.Optional;

/**
 * Accepts one note source for rendering.
 *
 * @param noteId identifier of the note, used for its page name and as a cache key
 * @param content note source text
 * @param created optional creation date shown on the page
 * @param modified optional modification date shown on the page
 */
public record NoteRenderRequest(String noteId, String content, String created, String modified) {

    /**
     * Creates a request while normalizing missing fields.
     *
     * @return normalized render request
     */
    @JsonCreator
    public static NoteRenderRequest create(@JsonProperty("noteId") String noteId,
                                           @JsonProperty("content") String content,
                                           @JsonProperty("created") String created,
                                           @JsonProperty("modified") String modified) {
        return new NoteRenderRequest(noteId == null ? "" : noteId.strip(), content == null ? "" : content,
            created, modified);
    }

    public NoteRenderRequest {
        Objects.requireNonNull(noteId, "Note id cannot be null");
        Objects.requireNonNull(content, "Note content cannot be null");
    }

    public boolean isBlank() {
        return content.isBlank();
    }

    public Optional<String> createdDate() {
        return Optional.ofNullable(created).filter(date -> !date.isBlank());
    }

    public Optional<String> modifiedDate() {
        return Optional.ofNullable(modified).filter(date -> !date.isBlank());
    }
}
