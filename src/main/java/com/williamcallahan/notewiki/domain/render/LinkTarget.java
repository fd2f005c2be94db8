package com.williamcallahan.notewiki.domain.render;

import java.util.Objects;
import java.util.Optional;

/**
 * A cross-reference to another note.
 *
 * @param targetId identifier of the linked note
 * @param displayText link text written in the source, if any
 * @param displayPlacement where the explicit link text was written relative to the target
 */
public record LinkTarget(String targetId, Optional<String> displayText, Placement displayPlacement) {

    /**
     * Position of explicit link text in {@code \wref[before]{target}[after]}.
     */
    public enum Placement {
        BEFORE,
        AFTER,
        NONE
    }

    public LinkTarget {
        Objects.requireNonNull(targetId, "Link target cannot be null");
        displayText = displayText == null ? Optional.empty() : displayText.filter(text -> !text.isBlank());
        displayPlacement = displayText.isEmpty() ? Placement.NONE : Objects.requireNonNull(displayPlacement);
    }

    /**
     * A link without explicit text.
     */
    public static LinkTarget bare(String targetId) {
        return new LinkTarget(targetId, Optional.empty(), Placement.NONE);
    }
}
