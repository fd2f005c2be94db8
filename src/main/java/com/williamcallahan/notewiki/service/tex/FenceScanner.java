package com.williamcallahan.notewiki.service.tex;

import java.util.Optional;

/**
 * Finds fenced code blocks: a run of three or more backticks or tildes at the start of a line,
 * an optional info string, and a closing run of the same character at least as long.
 */
final class FenceScanner {

    /** Minimum fence length for valid code fences. */
    static final int FENCE_MIN_LENGTH = 3;

    private static final char BACKTICK = '`';
    private static final char TILDE = '~';

    private FenceScanner() {}

    /**
     * Describes a detected fence marker at a position.
     *
     * @param character the fence character (backtick or tilde)
     * @param length number of consecutive fence characters
     */
    record FenceMarker(char character, int length) {}

    /**
     * A complete fenced block.
     *
     * @param start offset of the opening marker
     * @param end offset just past the closing marker
     * @param info info string after the opening marker, trimmed (e.g. {@code tikz}, {@code java})
     * @param content lines between the markers
     */
    record Fence(int start, int end, String info, String content) {}

    /**
     * Scans for a fence marker (3+ backticks or tildes) at the given position.
     *
     * @return fence marker if found, null otherwise
     */
    static FenceMarker scanFenceMarker(String text, int index) {
        if (text == null || index < 0 || index >= text.length()) {
            return null;
        }
        char markerChar = text.charAt(index);
        if (markerChar != BACKTICK && markerChar != TILDE) {
            return null;
        }
        int length = 0;
        while (index + length < text.length() && text.charAt(index + length) == markerChar) {
            length++;
        }
        return length >= FENCE_MIN_LENGTH ? new FenceMarker(markerChar, length) : null;
    }

    /**
     * Finds the next closed fence starting at or after {@code from}; an opening marker with no
     * closing marker is not a fence.
     */
    static Optional<Fence> findNext(String text, int from) {
        int lineStart = from;
        while (lineStart < text.length()) {
            int markerIndex = skipIndent(text, lineStart);
            boolean atLineStart = lineStart == 0 || text.charAt(lineStart - 1) == '\n';
            FenceMarker opening = atLineStart ? scanFenceMarker(text, markerIndex) : null;
            if (opening != null) {
                Optional<Fence> fence = closeFence(text, lineStart, markerIndex, opening);
                if (fence.isPresent()) {
                    return fence;
                }
            }
            int nextLine = text.indexOf('\n', lineStart);
            if (nextLine < 0) {
                return Optional.empty();
            }
            lineStart = nextLine + 1;
        }
        return Optional.empty();
    }

    private static Optional<Fence> closeFence(String text, int start, int markerIndex, FenceMarker opening) {
        int infoStart = markerIndex + opening.length();
        int infoEnd = text.indexOf('\n', infoStart);
        if (infoEnd < 0) {
            return Optional.empty();
        }
        String info = text.substring(infoStart, infoEnd).trim();
        if (opening.character() == BACKTICK && info.indexOf(BACKTICK) >= 0) {
            return Optional.empty();
        }
        int contentStart = infoEnd + 1;
        int lineStart = contentStart;
        while (lineStart <= text.length()) {
            int markerAt = skipIndent(text, lineStart);
            FenceMarker closing = scanFenceMarker(text, markerAt);
            if (closing != null && closing.character() == opening.character() && closing.length() >= opening.length()) {
                int afterMarker = markerAt + closing.length();
                int lineEnd = text.indexOf('\n', afterMarker);
                String rest = text.substring(afterMarker, lineEnd < 0 ? text.length() : lineEnd);
                if (rest.isBlank()) {
                    String content = lineStart > contentStart ? text.substring(contentStart, lineStart - 1) : "";
                    return Optional.of(new Fence(start, afterMarker, info, content));
                }
            }
            int nextLine = text.indexOf('\n', lineStart);
            if (nextLine < 0) {
                return Optional.empty();
            }
            lineStart = nextLine + 1;
        }
        return Optional.empty();
    }

    private static int skipIndent(String text, int lineStart) {
        int cursor = lineStart;
        while (cursor < text.length() && (text.charAt(cursor) == ' ' || text.charAt(cursor) == '\t')) {
            cursor++;
        }
        return cursor;
    }
}
