package com.williamcallahan.notewiki.domain.render;

import java.util.Objects;

/**
 * A region of a source text, copied out at scan time so it never dangles once the text is rewritten.
 *
 * @param start offset of the first character of the region (the opening delimiter when one exists)
 * @param end offset just past the region (past the closing delimiter when one exists)
 * @param content the enclosed content, without delimiters
 */
public record Span(int start, int end, String content) {

    public Span {
        Objects.requireNonNull(content, "Span content cannot be null");
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span bounds: " + start + ".." + end);
        }
    }

    /**
     * Returns the number of source characters covered by this span.
     */
    public int length() {
        return end - start;
    }
}
