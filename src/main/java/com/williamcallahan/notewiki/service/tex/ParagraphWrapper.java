package com.williamcallahan.notewiki.service.tex;

import java.util.ArrayList;
import java.util.List;

/**
 * Wraps runs of bare text lines in {@code <p>} elements.
 *
 * <p>Lines starting with a block-level tag are passed through and end the current paragraph, as do
 * blank lines. Script, style and preformatted blocks are copied verbatim until they close.</p>
 */
public final class ParagraphWrapper {

    private static final String[] BLOCK_TAGS = {
        "<div", "<p", "<script", "<ul", "<ol", "<li", "<h1", "<h2", "<h3", "<h4", "<h5", "<h6",
        "<table", "<blockquote", "<section", "<header", "<footer", "<style", "<pre", "<hr", "<embed"
    };
    private static final String[] CLOSING_BLOCK_TAGS = {"</div", "</ul", "</ol", "</table", "</li", "</p>"};
    private static final String[][] VERBATIM_BLOCKS = {
        {"<script", "</script>"},
        {"<style", "</style>"},
        {"<pre", "</pre>"}
    };

    private ParagraphWrapper() {}

    public static String wrap(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        List<String> result = new ArrayList<>();
        List<String> paragraph = new ArrayList<>();
        String verbatimEnd = null;
        boolean insideTag = false;
        for (String line : text.split("\n", -1)) {
            String stripped = line.strip();
            if (verbatimEnd != null) {
                result.add(line);
                if (stripped.contains(verbatimEnd)) {
                    verbatimEnd = null;
                }
                continue;
            }
            String opensVerbatim = verbatimOpening(stripped);
            if (opensVerbatim != null) {
                flush(paragraph, result);
                result.add(line);
                if (!stripped.contains(opensVerbatim)) {
                    verbatimEnd = opensVerbatim;
                }
                continue;
            }
            boolean startsBlock = startsWithAny(stripped, BLOCK_TAGS);
            boolean endsBlock = startsWithAny(stripped, CLOSING_BLOCK_TAGS);
            if (startsBlock || endsBlock) {
                flush(paragraph, result);
                result.add(line);
                insideTag = startsBlock && (stripped.indexOf('>') < 0 || count(stripped, '<') > count(stripped, '>'));
            } else if (insideTag) {
                result.add(line);
                if (stripped.indexOf('>') >= 0) {
                    insideTag = false;
                }
            } else if (stripped.isEmpty()) {
                flush(paragraph, result);
                result.add(line);
            } else {
                paragraph.add(stripped);
            }
        }
        flush(paragraph, result);
        return String.join("\n", result);
    }

    private static String verbatimOpening(String stripped) {
        for (String[] block : VERBATIM_BLOCKS) {
            if (stripped.contains(block[0])) {
                return block[1];
            }
        }
        return null;
    }

    private static void flush(List<String> paragraph, List<String> result) {
        if (!paragraph.isEmpty()) {
            result.add("<p>" + String.join(" ", paragraph) + "</p>");
            paragraph.clear();
        }
    }

    private static boolean startsWithAny(String text, String[] prefixes) {
        for (String prefix : prefixes) {
            if (text.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    private static int count(String text, char character) {
        int count = 0;
        for (int index = 0; index < text.length(); index++) {
            if (text.charAt(index) == character) {
                count++;
            }
        }
        return count;
    }
}
