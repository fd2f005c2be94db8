package com.williamcallahan.notewiki.service.tex;

/**
 * HTML escaping for note text.
 */
public final class HtmlText {

    private HtmlText() {}

    /**
     * Escapes {@code &}, {@code <} and {@code >}; quotes are left for the typographic quote pass.
     */
    public static String escapeText(String text) {
        if (text == null) return "";
        return text
            .replace("&", "&amp;")
            .replace("<", "&lt;")
            .replace(">", "&gt;");
    }

    /**
     * Escapes text for use inside an attribute value or verbatim block.
     */
    public static String escape(String text) {
        if (text == null) return "";
        return escapeText(text)
            .replace("\"", "&quot;")
            .replace("'", "&#39;");
    }
}
