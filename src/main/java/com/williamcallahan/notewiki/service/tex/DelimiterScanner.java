package com.williamcallahan.notewiki.service.tex;

import com.williamcallahan.notewiki.domain.render.Span;

/**
 * Finds the extent of a balanced delimiter group, character by character.
 *
 * <p>A backslash consumes the character after it, so {@code \{} or {@code \]} inside a group
 * never changes the depth. Nesting depth is unbounded.</p>
 */
public final class DelimiterScanner {

    public static final char ESCAPE = '\\';

    private DelimiterScanner() {}

    /**
     * Scans a group opened at {@code openIndex}.
     *
     * @param text source text
     * @param openIndex index of the opening delimiter
     * @param open opening delimiter character
     * @param close closing delimiter character
     * @return the balanced span, or {@link ScanResult.Unbalanced} when the group never closes
     */
    public static ScanResult scan(String text, int openIndex, char open, char close) {
        if (text == null || openIndex < 0 || openIndex >= text.length() || text.charAt(openIndex) != open) {
            return new ScanResult.Unbalanced(Math.max(openIndex, 0));
        }
        int depth = 1;
        int cursor = openIndex + 1;
        while (cursor < text.length()) {
            char current = text.charAt(cursor);
            if (current == ESCAPE) {
                cursor += 2;
                continue;
            }
            if (current == open) {
                depth++;
            } else if (current == close) {
                depth--;
                if (depth == 0) {
                    String content = text.substring(openIndex + 1, cursor);
                    return new ScanResult.Balanced(new Span(openIndex, cursor + 1, content));
                }
            }
            cursor++;
        }
        return new ScanResult.Unbalanced(openIndex);
    }

    /**
     * Scans a {@code {...}} group.
     */
    public static ScanResult braces(String text, int openIndex) {
        return scan(text, openIndex, '{', '}');
    }

    /**
     * Scans a {@code [...]} group.
     */
    public static ScanResult brackets(String text, int openIndex) {
        return scan(text, openIndex, '[', ']');
    }

    /**
     * Returns the first index at or after {@code from} that is not whitespace.
     */
    public static int skipWhitespace(String text, int from) {
        int cursor = from;
        while (cursor < text.length() && Character.isWhitespace(text.charAt(cursor))) {
            cursor++;
        }
        return cursor;
    }

    /**
     * Checks whether the character at {@code index} is preceded by an unescaped backslash.
     *
     * <p>An even run of backslashes escapes itself, so {@code \\$} leaves the dollar unescaped.</p>
     */
    public static boolean isEscaped(String text, int index) {
        int backslashes = 0;
        int cursor = index - 1;
        while (cursor >= 0 && text.charAt(cursor) == ESCAPE) {
            backslashes++;
            cursor--;
        }
        return backslashes % 2 == 1;
    }
}
