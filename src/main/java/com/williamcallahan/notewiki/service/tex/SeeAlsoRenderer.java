package com.williamcallahan.notewiki.service.tex;

import com.williamcallahan.notewiki.domain.render.LinkTarget;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders {@code \SeeAlso{...}} and {@code \prereq{...}} boxes.
 *
 * <p>A see-also body with dash lines becomes a bullet list (non-dash lines continue the previous
 * item); otherwise it is split at top-level commas. Items that already carry a link are kept,
 * items naming a {@code .pdf} file link to the PDF directory, and anything else is treated as a
 * note reference.</p>
 *
 * <p>Runs before the list passes, so a dash-list body is still raw dash lines when it is read.</p>
 */
final class SeeAlsoRenderer {

    private static final Pattern MARKDOWN_LINK = Pattern.compile("\\[.*?\\]\\(.*?\\)");
    private static final Pattern HTML_LINK = Pattern.compile("<a\\s+href", Pattern.CASE_INSENSITIVE);
    private static final Pattern LATEX_LINK = Pattern.compile("^\\s*\\\\(?:wref|href)(?![a-zA-Z])");
    private static final Pattern PDF_ITEM = Pattern.compile("^(.+?\\.pdf)(.*)$", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final String HEADER = "<strong>See also:</strong>";

    private static final DispatchTable TABLE = DispatchTable.builder()
        .add(DispatchEntry.command("SeeAlso", 1, 0, SeeAlsoRenderer::renderSeeAlso))
        .add(DispatchEntry.command("prereq", 1, 0, SeeAlsoRenderer::renderPrerequisites))
        .build();

    private SeeAlsoRenderer() {}

    /**
     * Renders every {@code \SeeAlso} and {@code \prereq} box in {@code text}. Links written inside
     * items are left for the inline pass.
     */
    static String convert(String text, ConversionContext context) {
        if (text == null || (!text.contains("\\SeeAlso") && !text.contains("\\prereq"))) {
            return text;
        }
        return new CommandDispatcher(TABLE, context).dispatch(text);
    }

    static String renderSeeAlso(Invocation invocation, CommandDispatcher dispatcher) {
        String content = invocation.argument(0);
        List<String> lines = new ArrayList<>();
        for (String line : content.split("\n")) {
            if (!line.isBlank()) {
                lines.add(line.strip());
            }
        }
        boolean dashList = lines.stream().anyMatch(line -> line.startsWith("-"));
        if (!dashList) {
            List<String> links = new ArrayList<>();
            for (String item : splitTopLevel(content)) {
                links.add(renderItem(item, invocation.position(), dispatcher));
            }
            return "<div class=\"see-also\">" + HEADER + " " + String.join(", ", links) + "</div>";
        }
        List<String> items = new ArrayList<>();
        for (String line : lines) {
            if (line.startsWith("-")) {
                items.add(line.substring(1).strip());
            } else if (items.isEmpty()) {
                items.add(line);
            } else {
                items.set(items.size() - 1, items.get(items.size() - 1) + " " + line);
            }
        }
        StringBuilder html = new StringBuilder("<div class=\"see-also\">").append(HEADER).append("\n<ul>\n");
        for (String item : items) {
            html.append("<li>").append(renderItem(item, invocation.position(), dispatcher)).append("</li>\n");
        }
        return html.append("</ul></div>").toString();
    }

    static String renderPrerequisites(Invocation invocation, CommandDispatcher dispatcher) {
        List<String> links = new ArrayList<>();
        for (String item : invocation.argument(0).split(",")) {
            if (!item.isBlank()) {
                links.add(CrossReferenceResolver.resolve(LinkTarget.bare(item.strip()), dispatcher.context(),
                    invocation.position()));
            }
        }
        return "<div class=\"prereq\"><strong>Prerequisites:</strong> " + String.join(", ", links) + "</div>";
    }

    /**
     * Renders one item by the linking heuristic.
     */
    static String renderItem(String rawItem, int position, CommandDispatcher dispatcher) {
        String item = rawItem.strip();
        if (item.startsWith("- ")) {
            item = item.substring(2).strip();
        }
        if (MARKDOWN_LINK.matcher(item).find() || HTML_LINK.matcher(item).find() || LATEX_LINK.matcher(item).find()) {
            return dispatcher.dispatch(item);
        }
        Matcher pdf = PDF_ITEM.matcher(item);
        if (pdf.matches()) {
            String filename = pdf.group(1).strip();
            String href = dispatcher.context().options().pdfBasePath() + filename;
            return "<a href=\"" + href + "\">" + filename + "</a>" + dispatcher.dispatch(pdf.group(2));
        }
        return CrossReferenceResolver.resolve(LinkTarget.bare(item), dispatcher.context(), position);
    }

    /**
     * Splits at commas outside parentheses, brackets and braces; blank parts are dropped.
     */
    static List<String> splitTopLevel(String content) {
        List<String> parts = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int parens = 0;
        int brackets = 0;
        int braces = 0;
        for (int index = 0; index < content.length(); index++) {
            char character = content.charAt(index);
            if (character == ',' && parens == 0 && brackets == 0 && braces == 0) {
                parts.add(current.toString().strip());
                current.setLength(0);
                continue;
            }
            current.append(character);
            switch (character) {
                case '(' -> parens++;
                case ')' -> parens = Math.max(0, parens - 1);
                case '[' -> brackets++;
                case ']' -> brackets = Math.max(0, brackets - 1);
                case '{' -> braces++;
                case '}' -> braces = Math.max(0, braces - 1);
                default -> {
                    // other characters do not affect nesting
                }
            }
        }
        parts.add(current.toString().strip());
        parts.removeIf(String::isEmpty);
        return parts;
    }
}
