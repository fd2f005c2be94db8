package com.williamcallahan.notewiki.service.tex;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns runs of dash-prefixed lines into HTML lists.
 *
 * <p>A line {@code - text} starts or continues an unordered list and {@code - (ii) text} or
 * {@code - (2) text} an ordered one; switching between the two closes the open list. Lines
 * indented deeper than the first item, and lines starting with display math, continue the current
 * item. A blank line closes the list unless the next non-blank line is another dash item.</p>
 */
public final class ImplicitListConverter {

    private static final Pattern ORDERED_ITEM = Pattern.compile("^(\\s*)-\\s+\\(([ivxIVX0-9]+)\\)\\s+(.*)$");
    private static final Pattern UNORDERED_ITEM = Pattern.compile("^(\\s*)-\\s+(.*)$");
    private static final Pattern ANY_ITEM = Pattern.compile("^\\s*-\\s+");

    private ImplicitListConverter() {}

    public static String convert(String text, ConversionContext context) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String[] lines = text.split("\n", -1);
        ListState state = new ListState();
        List<String> result = new ArrayList<>(lines.length);
        for (int index = 0; index < lines.length; index++) {
            String line = lines[index];
            Matcher ordered = ORDERED_ITEM.matcher(line);
            Matcher unordered = UNORDERED_ITEM.matcher(line);
            if (ordered.matches()) {
                state.startItem(result, "ol", ordered.group(1).length(), ordered.group(3).strip());
            } else if (unordered.matches()) {
                state.startItem(result, "ul", unordered.group(1).length(), unordered.group(2).strip());
            } else if (!state.isOpen()) {
                result.add(line);
            } else if (!line.isBlank()) {
                int indent = line.length() - line.stripLeading().length();
                if (indent > state.baseIndent || context.isDisplayMathLine(line)) {
                    state.itemLines.add(line.strip());
                } else {
                    state.close(result);
                    result.add(line);
                }
            } else if (!nextNonBlankIsItem(lines, index + 1)) {
                state.close(result);
                result.add(line);
            }
        }
        state.close(result);
        return String.join("\n", result);
    }

    private static boolean nextNonBlankIsItem(String[] lines, int from) {
        for (int index = from; index < lines.length; index++) {
            if (!lines[index].isBlank()) {
                return ANY_ITEM.matcher(lines[index]).find();
            }
        }
        return false;
    }

    private static final class ListState {
        private String tag;
        private int baseIndent;
        private final List<String> itemLines = new ArrayList<>();

        boolean isOpen() {
            return tag != null;
        }

        void startItem(List<String> result, String itemTag, int indent, String content) {
            if (!itemTag.equals(tag)) {
                close(result);
                result.add("<" + itemTag + ">");
                tag = itemTag;
                baseIndent = indent;
            } else {
                flushItem(result);
            }
            itemLines.add(content);
        }

        void close(List<String> result) {
            if (tag == null) {
                return;
            }
            flushItem(result);
            result.add("</" + tag + ">");
            tag = null;
        }

        private void flushItem(List<String> result) {
            if (!itemLines.isEmpty()) {
                result.add("<li>" + String.join(" ", itemLines) + "</li>");
                itemLines.clear();
            }
        }
    }
}
