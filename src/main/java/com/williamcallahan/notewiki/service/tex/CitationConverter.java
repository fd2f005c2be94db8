package com.williamcallahan.notewiki.service.tex;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Numbers {@code ((citation))} markers in order of first appearance and builds the references list.
 * A citation repeated verbatim keeps its first number.
 */
public final class CitationConverter {

    private static final Pattern CITATION = Pattern.compile("\\(\\((.+?)\\)\\)");

    private CitationConverter() {}

    /**
     * Replaces every citation with a superscript link to its reference entry.
     */
    public static String convert(String text, ConversionContext context) {
        if (text == null || !text.contains("((")) {
            return text;
        }
        Matcher matcher = CITATION.matcher(text);
        StringBuilder output = new StringBuilder(text.length());
        while (matcher.find()) {
            int number = context.citations().register(matcher.group(1).strip());
            String marker = "<sup><a href=\"#ref-" + number + "\">[" + number + "]</a></sup>";
            matcher.appendReplacement(output, Matcher.quoteReplacement(marker));
        }
        matcher.appendTail(output);
        return output.toString();
    }

    /**
     * Renders the references section, or an empty string when nothing was cited.
     */
    public static String referencesFooter(ConversionContext context) {
        List<String> citations = context.citations().keys();
        if (citations.isEmpty()) {
            return "";
        }
        StringBuilder html = new StringBuilder("\n<div class=\"references\">\n<h2>References</h2>\n<ol>\n");
        for (int index = 0; index < citations.size(); index++) {
            html.append("<li id=\"ref-").append(index + 1).append("\">").append(citations.get(index)).append("</li>\n");
        }
        return html.append("</ol>\n</div>").toString();
    }
}
