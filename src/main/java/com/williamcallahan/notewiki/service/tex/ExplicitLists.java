package com.williamcallahan.notewiki.service.tex;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders {@code itemize}, {@code enumerate} and {@code lst} environments from their
 * {@code \item} markers. Nested lists are rendered first, so an outer list only ever splits its
 * own items.
 */
public final class ExplicitLists {

    private static final Pattern ITEM = Pattern.compile("\\\\item(?![a-zA-Z])");
    private static final String NOSEP = "nosep";

    private static final DispatchTable TABLE = DispatchTable.builder()
        .add(DispatchEntry.environment("itemize", (invocation, dispatcher) -> render("ul", invocation)))
        .add(DispatchEntry.environment("enumerate", (invocation, dispatcher) -> render("ol", invocation)))
        .add(DispatchEntry.environment("lst", (invocation, dispatcher) -> render("ul", invocation)))
        .build();

    private ExplicitLists() {}

    /**
     * Renders every explicit list in {@code text}.
     */
    public static String convert(String text, ConversionContext context) {
        return new CommandDispatcher(TABLE, context).dispatch(text);
    }

    private static String render(String tag, Invocation invocation) {
        String cssClass = invocation.optionalArgument()
            .filter(option -> option.contains(NOSEP))
            .map(option -> " class=\"" + NOSEP + "\"")
            .orElse("");
        StringBuilder html = new StringBuilder("\n<").append(tag).append(cssClass).append(">\n");
        for (String item : items(invocation.body())) {
            html.append("<li>").append(item).append("</li>\n");
        }
        return html.append("</").append(tag).append(">\n").toString();
    }

    /**
     * Splits a list body at its {@code \item} markers; text before the first marker is dropped
     * when blank. An {@code \item[label]} label is kept in bold ahead of the item.
     */
    static List<String> items(String body) {
        List<String> items = new ArrayList<>();
        Matcher matcher = ITEM.matcher(body);
        int itemStart = -1;
        int leadingEnd = body.length();
        while (matcher.find()) {
            if (itemStart < 0) {
                leadingEnd = matcher.start();
            } else {
                addItem(items, body.substring(itemStart, matcher.start()));
            }
            itemStart = matcher.end();
        }
        String leading = body.substring(0, leadingEnd).strip();
        if (!leading.isEmpty()) {
            items.add(0, leading);
        }
        if (itemStart >= 0) {
            addItem(items, body.substring(itemStart));
        }
        return items;
    }

    private static void addItem(List<String> items, String raw) {
        String item = raw.strip();
        if (item.startsWith("[")) {
            ScanResult label = DelimiterScanner.brackets(item, 0);
            if (label instanceof ScanResult.Balanced balanced) {
                String rest = item.substring(balanced.span().end()).strip();
                item = "<strong>" + balanced.span().content().strip() + "</strong> " + rest;
            }
        }
        if (!item.isBlank()) {
            items.add(item.strip());
        }
    }
}
