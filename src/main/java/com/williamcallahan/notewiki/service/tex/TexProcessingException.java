package com.williamcallahan.notewiki.service.tex;

/**
 * Signals an unexpected failure inside the rendering pipeline. Malformed markup never raises
 * this; it degrades to literal text instead.
 */
public class TexProcessingException extends IllegalStateException {

    /**
     * Creates a processing exception with context and root cause.
     *
     * @param message failure summary
     * @param cause the underlying failure
     */
    public TexProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
