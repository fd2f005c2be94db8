package com.williamcallahan.notewiki.service.tex;

/**
 * Removes TeX line comments: an unescaped {@code %} through the end of its line.
 * The line break itself is kept.
 */
public final class CommentStripper {

    private CommentStripper() {}

    public static String strip(String text) {
        if (text == null || text.indexOf('%') < 0) {
            return text;
        }
        StringBuilder output = new StringBuilder(text.length());
        int cursor = 0;
        while (cursor < text.length()) {
            int percent = text.indexOf('%', cursor);
            if (percent < 0) {
                output.append(text, cursor, text.length());
                break;
            }
            if (DelimiterScanner.isEscaped(text, percent)) {
                output.append(text, cursor, percent + 1);
                cursor = percent + 1;
                continue;
            }
            output.append(text, cursor, percent);
            int lineEnd = text.indexOf('\n', percent);
            cursor = lineEnd < 0 ? text.length() : lineEnd;
        }
        return output.toString();
    }
}
