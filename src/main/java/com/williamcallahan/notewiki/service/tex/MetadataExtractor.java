package com.williamcallahan.notewiki.service.tex;

import com.williamcallahan.notewiki.domain.render.NoteMetadata;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the header of a note and cuts out its body.
 *
 * <p>A note is a small TeX document: {@code \Title{...}} and {@code \Tags{...}} in the preamble,
 * the content between {@code \NoteHeader} and {@code \References} or {@code \Footer}.</p>
 */
public final class MetadataExtractor {

    private static final String TITLE = "\\Title";
    private static final String TAGS = "\\Tags";
    private static final String TEX_OR_PDF = "\\texorpdfstring";
    private static final String END_DOCUMENT = "\\end{document}";

    private static final Pattern HEADER_TO_FOOTER =
        Pattern.compile("\\\\NoteHeader\\s*(.*?)(?=\\\\References(?![a-zA-Z])|\\\\Footer(?![a-zA-Z]))", Pattern.DOTALL);
    private static final Pattern HEADER = Pattern.compile("\\\\NoteHeader\\s*(.*)", Pattern.DOTALL);
    private static final Pattern BEGIN_DOCUMENT = Pattern.compile("\\\\begin\\{document\\}(.*)", Pattern.DOTALL);
    private static final Pattern LAYOUT_MARKERS =
        Pattern.compile("\\\\(?:NoteNavigation|NoteHeader|References|Footer)(?![a-zA-Z])");

    private MetadataExtractor() {}

    /**
     * Reads title and tags; a missing title becomes {@value NoteMetadata#UNTITLED}.
     */
    public static NoteMetadata metadata(String source) {
        if (source == null) {
            return NoteMetadata.untitled();
        }
        String title = firstArgument(source, TITLE);
        if (title != null) {
            title = texOrPdf(title, true).strip();
        }
        List<String> tags = new ArrayList<>();
        String rawTags = firstArgument(source, TAGS);
        if (rawTags != null) {
            for (String tag : rawTags.split(",")) {
                if (!tag.isBlank()) {
                    tags.add(tag.strip());
                }
            }
        }
        return new NoteMetadata(title, tags);
    }

    /**
     * Returns the note body, trying in turn: header to references/footer, header to the last
     * {@code \end{document}}, then {@code \begin{document}} to the last {@code \end{document}}.
     * Layout markers are removed from the result. Text with none of these markers is returned as is,
     * so fragments can be rendered without a document wrapper.
     */
    public static String body(String source) {
        if (source == null) {
            return "";
        }
        String body;
        Matcher bounded = HEADER_TO_FOOTER.matcher(source);
        Matcher header = HEADER.matcher(source);
        Matcher document = BEGIN_DOCUMENT.matcher(source);
        if (bounded.find()) {
            body = bounded.group(1);
        } else if (header.find()) {
            body = beforeLastEndDocument(header.group(1));
        } else if (document.find()) {
            body = beforeLastEndDocument(document.group(1));
        } else {
            body = source;
        }
        return LAYOUT_MARKERS.matcher(body).replaceAll("").strip();
    }

    /**
     * Replaces {@code \texorpdfstring{tex}{plain}} with one of its branches.
     *
     * @param preferPlain take the plain branch (page titles) instead of the TeX one (note body)
     */
    public static String texOrPdf(String text, boolean preferPlain) {
        if (text == null || !text.contains(TEX_OR_PDF)) {
            return text;
        }
        StringBuilder output = new StringBuilder(text.length());
        int cursor = 0;
        while (cursor < text.length()) {
            int marker = text.indexOf(TEX_OR_PDF, cursor);
            if (marker < 0) {
                output.append(text, cursor, text.length());
                break;
            }
            output.append(text, cursor, marker);
            int afterMarker = marker + TEX_OR_PDF.length();
            ScanResult tex = DelimiterScanner.braces(text, DelimiterScanner.skipWhitespace(text, afterMarker));
            if (!(tex instanceof ScanResult.Balanced balancedTex)) {
                output.append(text, marker, afterMarker);
                cursor = afterMarker;
                continue;
            }
            ScanResult plain = DelimiterScanner.braces(text,
                DelimiterScanner.skipWhitespace(text, balancedTex.span().end()));
            if (!(plain instanceof ScanResult.Balanced balancedPlain)) {
                output.append(text, marker, afterMarker);
                cursor = afterMarker;
                continue;
            }
            output.append(preferPlain ? balancedPlain.span().content() : balancedTex.span().content());
            cursor = balancedPlain.span().end();
        }
        return output.toString();
    }

    private static String firstArgument(String source, String command) {
        int index = source.indexOf(command);
        while (index >= 0) {
            int after = index + command.length();
            if (after >= source.length() || !Character.isLetter(source.charAt(after))) {
                ScanResult scan = DelimiterScanner.braces(source, DelimiterScanner.skipWhitespace(source, after));
                if (scan instanceof ScanResult.Balanced balanced) {
                    return balanced.span().content();
                }
            }
            index = source.indexOf(command, after);
        }
        return null;
    }

    private static String beforeLastEndDocument(String text) {
        int lastEnd = text.lastIndexOf(END_DOCUMENT);
        return lastEnd < 0 ? text : text.substring(0, lastEnd);
    }
}
