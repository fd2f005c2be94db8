package com.williamcallahan.notewiki.domain.render;

/**
 * Represents a non-fatal problem met while converting a note.
 * The conversion degrades to literal passthrough and reports the problem here instead of failing.
 */
public record ProcessingWarning(
    String message,
    WarningType type,
    int position,
    String context
) {

    public ProcessingWarning {
        if (message == null || message.trim().isEmpty()) {
            throw new IllegalArgumentException("Warning message cannot be null or empty");
        }
        if (type == null) {
            throw new IllegalArgumentException("Warning type cannot be null");
        }
        if (position < 0) {
            throw new IllegalArgumentException("Warning position must be non-negative");
        }
        context = context == null ? "" : context;
    }

    /**
     * Creates a processing warning with minimal context.
     * @param message the warning message
     * @param type the warning type
     * @param position position in the text being processed by the pass that raised it
     * @return new ProcessingWarning instance
     */
    public static ProcessingWarning create(String message, WarningType type, int position) {
        return new ProcessingWarning(message, type, position, "");
    }

    /**
     * Warning types for categorization.
     */
    public enum WarningType {
        /**
         * A brace, bracket or environment begin marker that never closes.
         */
        UNBALANCED_DELIMITER,

        /**
         * A cross-reference target missing from the corpus title index.
         */
        UNKNOWN_TARGET,

        /**
         * A macro declaration without a usable arity or body.
         */
        MALFORMED_MACRO_DECLARATION,

        /**
         * A placeholder token with no recorded original.
         */
        STASH_RESTORE_MISMATCH,

        /**
         * A footnote reference without a definition.
         */
        UNDEFINED_FOOTNOTE
    }
}
