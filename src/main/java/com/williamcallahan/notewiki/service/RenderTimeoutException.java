package com.williamcallahan.notewiki.service;

import java.time.Duration;

/**
 * Signals that converting one note exceeded its wall-clock budget. No partial output is kept.
 */
public class RenderTimeoutException extends RuntimeException {

    private final String noteId;

    public RenderTimeoutException(String noteId, Duration budget, Throwable cause) {
        super("Rendering note '" + noteId + "' exceeded " + budget.toMillis() + "ms", cause);
        this.noteId = noteId;
    }

    public String getNoteId() {
        return noteId;
    }
}
