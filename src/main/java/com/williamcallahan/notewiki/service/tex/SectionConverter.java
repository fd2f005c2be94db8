package com.williamcallahan.notewiki.service.tex;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders {@code \section}, {@code \subsection} and {@code \subsubsection} (starred or not) and
 * Markdown {@code ##}, {@code ###}, {@code ####} lines as headings with generated anchors.
 */
public final class SectionConverter {

    private static final Map<String, Integer> LEVELS = Map.of(
        "section", 2,
        "subsection", 3,
        "subsubsection", 4
    );
    private static final Pattern MARKDOWN_HEADING = Pattern.compile("(?m)^(#{2,4})[ \\t]+(.+?)[ \\t]*$");

    private static final DispatchTable TABLE = buildTable();

    private SectionConverter() {}

    public static String convert(String text, ConversionContext context) {
        String converted = new CommandDispatcher(TABLE, context).dispatch(text);
        if (converted == null || !converted.contains("##")) {
            return converted;
        }
        Matcher matcher = MARKDOWN_HEADING.matcher(converted);
        StringBuilder output = new StringBuilder(converted.length());
        while (matcher.find()) {
            String html = heading(matcher.group(1).length(), matcher.group(2), context);
            matcher.appendReplacement(output, Matcher.quoteReplacement(html));
        }
        matcher.appendTail(output);
        return output.toString();
    }

    private static DispatchTable buildTable() {
        DispatchTable.Builder builder = DispatchTable.builder();
        LEVELS.forEach((name, level) -> {
            DispatchEntry.Renderer renderer = (invocation, dispatcher) ->
                heading(level, invocation.argument(0), dispatcher.context());
            builder.add(DispatchEntry.command(name, 1, 1, renderer));
            builder.add(DispatchEntry.command(name + "*", 1, 1, renderer));
        });
        return builder.build();
    }

    private static String heading(int level, String rawTitle, ConversionContext context) {
        String title = MetadataExtractor.texOrPdf(rawTitle, false).strip();
        String anchorId = context.anchors().next(title);
        return "<h" + level + " id=\"" + anchorId + "\">" + title + "</h" + level + ">";
    }
}
