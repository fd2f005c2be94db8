package com.williamcallahan.notewiki.domain.render;

import java.util.List;

/**
 * Header fields of a note.
 *
 * @param title display title with {@code \texorpdfstring} reduced to its plain branch
 * @param tags tags in source order, trimmed, blanks dropped
 */
public record NoteMetadata(String title, List<String> tags) {

    public static final String UNTITLED = "Untitled";

    public NoteMetadata {
        title = title == null || title.isBlank() ? UNTITLED : title;
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public static NoteMetadata untitled() {
        return new NoteMetadata(UNTITLED, List.of());
    }

    public boolean hasTags() {
        return !tags.isEmpty();
    }
}
