package com.williamcallahan.notewiki.service.tex;

import com.williamcallahan.notewiki.domain.render.Span;

/**
 * Outcome of scanning for a balanced delimiter group.
 */
public sealed interface ScanResult permits ScanResult.Balanced, ScanResult.Unbalanced {

    /**
     * The group closed; {@code span.end()} is the index just past the closing delimiter.
     */
    record Balanced(Span span) implements ScanResult {}

    /**
     * The text ended (or no opening delimiter was present) before the depth returned to zero.
     *
     * @param openIndex index of the opening delimiter that never closed
     */
    record Unbalanced(int openIndex) implements ScanResult {}

    default boolean isBalanced() {
        return this instanceof Balanced;
    }
}
