package com.williamcallahan.notewiki.domain.render;

import java.util.List;
import java.util.Objects;

/**
 * Represents one converted note.
 *
 * @param html rendered body fragment
 * @param metadata title and tags from the note header
 * @param macros built-in and declared macros for the math renderer
 * @param forwardLinks sorted identifiers of the notes this note links to
 * @param headings section headings in document order, for the table of contents
 * @param warnings non-fatal problems met during conversion
 * @param processingTimeMs time taken to convert the note
 */
public record RenderedNote(
    String html,
    NoteMetadata metadata,
    MacroTable macros,
    List<String> forwardLinks,
    List<Heading> headings,
    List<ProcessingWarning> warnings,
    long processingTimeMs
) {

    public RenderedNote {
        Objects.requireNonNull(html, "HTML content cannot be null");
        Objects.requireNonNull(metadata, "Metadata cannot be null");
        Objects.requireNonNull(macros, "Macro table cannot be null");
        forwardLinks = List.copyOf(Objects.requireNonNull(forwardLinks, "Forward links cannot be null"));
        headings = List.copyOf(Objects.requireNonNull(headings, "Headings cannot be null"));
        warnings = List.copyOf(Objects.requireNonNull(warnings, "Warnings list cannot be null"));
    }

    /**
     * Checks if conversion completed without warnings.
     * @return true if no warnings were generated
     */
    public boolean isClean() {
        return warnings.isEmpty();
    }

    /**
     * Headings of level 2, the entries of a compact table of contents.
     */
    public List<Heading> topLevelHeadings() {
        return headings.stream().filter(heading -> heading.level() == 2).toList();
    }
}
