package com.williamcallahan.notewiki.service.tex;

/**
 * How a dispatch entry is written in the source.
 */
public enum DispatchKind {
    /** {@code \name[opt]{arg}} */
    COMMAND,
    /** {@code \begin{name}[opt] body \end{name}} */
    ENVIRONMENT
}
