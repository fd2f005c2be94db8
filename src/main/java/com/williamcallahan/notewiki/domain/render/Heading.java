package com.williamcallahan.notewiki.domain.render;

import java.util.Objects;

/**
 * A section heading emitted by the section converter.
 *
 * @param level heading level, 2 to 4
 * @param title heading markup as written in the note
 * @param anchorId unique id attribute of the heading
 */
public record Heading(int level, String title, String anchorId) {

    public Heading {
        Objects.requireNonNull(title, "Heading title cannot be null");
        Objects.requireNonNull(anchorId, "Heading anchor cannot be null");
        if (level < 2 || level > 4) {
            throw new IllegalArgumentException("Heading level must be 2..4: " + level);
        }
    }
}
