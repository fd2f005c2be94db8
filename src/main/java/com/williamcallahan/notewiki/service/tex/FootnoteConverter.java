package com.williamcallahan.notewiki.service.tex;

import com.williamcallahan.notewiki.domain.render.ProcessingWarning.WarningType;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Numbers footnotes and builds the footnote list with back-links.
 *
 * <p>Definitions written as {@code [^id]: text} lines are lifted out first. Then one forward scan
 * numbers inline {@code \footnote{...}} notes and {@code [^id]} references together, in reading
 * order; a repeated {@code [^id]} reuses its number. The list at the end links each entry back to
 * its first marker. HTML ids are built from the footnote number, so distinct identifiers never
 * share an anchor.</p>
 */
public final class FootnoteConverter {

    private static final Pattern DEFINITION = Pattern.compile("(?m)^\\[\\^([^\\]]+)\\]:[ \\t]*(.*)$\\n?");
    private static final Pattern REFERENCE = Pattern.compile("\\[\\^([^\\]\\s]+)\\](?!:)");
    private static final String FOOTNOTE = "\\footnote";

    private FootnoteConverter() {}

    public static String convert(String text, ConversionContext context) {
        if (text == null || (!text.contains(FOOTNOTE) && !text.contains("[^"))) {
            return text;
        }
        FootnoteRegistry footnotes = context.footnotes();
        Matcher definitions = DEFINITION.matcher(text);
        StringBuilder withoutDefinitions = new StringBuilder(text.length());
        while (definitions.find()) {
            footnotes.define(definitions.group(1).strip(), definitions.group(2).strip());
            definitions.appendReplacement(withoutDefinitions, "");
        }
        definitions.appendTail(withoutDefinitions);
        String source = withoutDefinitions.toString();

        StringBuilder output = new StringBuilder(source.length());
        Matcher reference = REFERENCE.matcher(source);
        int cursor = 0;
        while (cursor < source.length()) {
            int inline = nextInlineFootnote(source, cursor);
            int keyed = reference.find(cursor) ? reference.start() : -1;
            if (inline < 0 && keyed < 0) {
                output.append(source, cursor, source.length());
                break;
            }
            if (keyed < 0 || (inline >= 0 && inline < keyed)) {
                output.append(source, cursor, inline);
                cursor = appendInline(source, inline, output, context);
            } else {
                output.append(source, cursor, keyed);
                String id = reference.group(1);
                footnotes.reference(id);
                output.append(marker(id, footnotes));
                cursor = reference.end();
            }
        }
        return output.toString();
    }

    /**
     * Renders the footnote list, or an empty string when there are no footnotes. Definitions that
     * were never referenced are listed after the referenced ones.
     */
    public static String footer(ConversionContext context) {
        FootnoteRegistry footnotes = context.footnotes();
        for (String definedId : footnotes.definedIds()) {
            if (footnotes.referenceCount(definedId) == 0) {
                footnotes.reference(definedId);
            }
        }
        List<String> ids = footnotes.referencedIds();
        if (ids.isEmpty()) {
            return "";
        }
        StringBuilder html = new StringBuilder("\n<div class=\"footnotes\">\n<hr>\n<ol>");
        for (String id : ids) {
            String content = footnotes.definitionOf(id).orElseGet(() -> {
                context.warn(WarningType.UNDEFINED_FOOTNOTE, "Footnote [^" + id + "] has no definition", 0, id);
                return "";
            });
            int number = footnotes.numberOf(id);
            html.append("\n<li id=\"fn-").append(number).append("\">").append(content)
                .append(" <a href=\"#fnref-").append(number).append("\">↩</a></li>");
        }
        return html.append("\n</ol>\n</div>").toString();
    }

    private static int appendInline(String source, int start, StringBuilder output, ConversionContext context) {
        int afterMarker = start + FOOTNOTE.length();
        ScanResult scan = DelimiterScanner.braces(source, DelimiterScanner.skipWhitespace(source, afterMarker));
        if (!(scan instanceof ScanResult.Balanced balanced)) {
            context.warn(WarningType.UNBALANCED_DELIMITER, "\\footnote without a closed argument; left as text",
                start, source.substring(start, Math.min(source.length(), start + 40)));
            output.append(FOOTNOTE);
            return afterMarker;
        }
        String id = context.footnotes().referenceAnonymous(balanced.span().content().strip());
        output.append(marker(id, context.footnotes()));
        return balanced.span().end();
    }

    private static String marker(String id, FootnoteRegistry footnotes) {
        int number = footnotes.numberOf(id);
        int occurrence = footnotes.referenceCount(id);
        String markerId = occurrence <= 1 ? "fnref-" + number : "fnref-" + number + "-" + occurrence;
        return "<sup id=\"" + markerId + "\"><a href=\"#fn-" + number + "\">[" + number + "]</a></sup>";
    }

    private static int nextInlineFootnote(String source, int from) {
        int index = source.indexOf(FOOTNOTE, from);
        while (index >= 0) {
            int after = index + FOOTNOTE.length();
            if (after >= source.length() || !Character.isLetter(source.charAt(after))) {
                return index;
            }
            index = source.indexOf(FOOTNOTE, after);
        }
        return -1;
    }
}
