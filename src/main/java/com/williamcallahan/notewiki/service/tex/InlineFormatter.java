package com.williamcallahan.notewiki.service.tex;

import java.util.Locale;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Inline markup: note links and other inline commands through the dispatcher, then the
 * Markdown-flavoured shortcuts authors mix in (links, PDF embeds, emphasis, quotes) and escaped
 * special characters.
 */
public final class InlineFormatter {

    private static final Pattern PDF_EMBED = Pattern.compile("!\\[\\[(.*?)\\]\\]");
    private static final Pattern MARKDOWN_LINK = Pattern.compile("(?<!!)\\[([^\\]\\^][^\\]]*)\\]\\(([^)\\s]+)\\)");
    private static final Pattern BOLD = Pattern.compile("\\*\\*([^*\\n]+)\\*\\*");
    private static final Pattern ITALIC = Pattern.compile("\\*([^*\\n]+?)\\*");
    private static final Pattern LABEL_UNSAFE = Pattern.compile("[^a-zA-Z0-9\\-_]");

    private static final DispatchTable TABLE = DispatchTable.builder()
        .add(DispatchEntry.commandWithTrailingOption("wref", 1, (invocation, dispatcher) ->
            CrossReferenceResolver.resolve(CrossReferenceResolver.fromInvocation(invocation),
                dispatcher.context(), invocation.position())))
        .add(DispatchEntry.command("href", 2, 0, (invocation, dispatcher) ->
            "<a href=\"" + invocation.argument(0).strip().replace("\\%", "%") + "\">"
                + dispatcher.dispatch(invocation.argument(1)) + "</a>"))
        .add(DispatchEntry.command("arxiv", 1, 0, (invocation, dispatcher) ->
            "<a href=\"https://arxiv.org/abs/" + invocation.argument(0).strip() + "\">arXiv:"
                + invocation.argument(0).strip() + "</a>"))
        .add(DispatchEntry.command("nlab", 1, 0, (invocation, dispatcher) ->
            "<a href=\"https://ncatlab.org/nlab/show/" + invocation.argument(0).strip()
                + "\" class=\"nlab-link\">nLab:" + invocation.argument(0).strip() + "</a>"))
        .add(wrapping("textbf", "<strong>", "</strong>"))
        .add(wrapping("defn", "<strong>", "</strong>"))
        .add(wrapping("emph", "<em>", "</em>"))
        .add(wrapping("textit", "<em>", "</em>"))
        .add(wrapping("texttt", "<code>", "</code>"))
        .add(wrapping("greyson", "<span style=\"color: #7f00ff;\">[[", "]]</span>"))
        .add(wrapping("todo", "<strong>[[<em>", "</em>]]</strong>"))
        .add(DispatchEntry.command("label", 1, 0, (invocation, dispatcher) ->
            "<a id=\"" + labelId(invocation.argument(0)) + "\" class=\"latex-label\"></a>"))
        .add(DispatchEntry.command("ref", 1, 0, (invocation, dispatcher) -> reference(invocation.argument(0))))
        .add(DispatchEntry.command("cref", 1, 0, (invocation, dispatcher) -> reference(invocation.argument(0))))
        .add(DispatchEntry.command("eqref", 1, 0, (invocation, dispatcher) -> "(" + reference(invocation.argument(0)) + ")"))
        .add(DispatchEntry.command("texorpdfstring", 2, 0, (invocation, dispatcher) ->
            dispatcher.dispatch(invocation.argument(0))))
        .add(DispatchEntry.command("IncomingLinks", 1, 0, (invocation, dispatcher) -> ""))
        .add(DispatchEntry.command("allformats", 1, 0, (invocation, dispatcher) -> ""))
        .add(DispatchEntry.command("textbackslash", 0, 0, (invocation, dispatcher) -> "&#92;"))
        .build();

    private InlineFormatter() {}

    /**
     * Runs every inline pass over {@code text}.
     */
    public static String format(String text, ConversionContext context) {
        String formatted = new CommandDispatcher(TABLE, context).dispatch(text);
        formatted = replaceAll(formatted, PDF_EMBED, match -> pdfEmbed(match, context.options().pdfBasePath()));
        formatted = replaceAll(formatted, MARKDOWN_LINK, match ->
            "<a href=\"" + match.group(2) + "\">" + match.group(1) + "</a>");
        formatted = replaceAll(formatted, BOLD, match -> "<strong>" + match.group(1) + "</strong>");
        formatted = replaceAll(formatted, ITALIC, match -> "<em>" + match.group(1) + "</em>");
        formatted = typographicQuotes(formatted);
        return specialCharacters(formatted);
    }

    /**
     * Converts TeX quotes outside of tags: {@code ``} and {@code ''} to double curly quotes,
     * single {@code `} and {@code '} to single ones.
     */
    static String typographicQuotes(String text) {
        if (text.indexOf('`') < 0 && text.indexOf('\'') < 0) {
            return text;
        }
        StringBuilder output = new StringBuilder(text.length());
        boolean insideTag = false;
        for (int index = 0; index < text.length(); index++) {
            char current = text.charAt(index);
            char next = index + 1 < text.length() ? text.charAt(index + 1) : '\0';
            if (current == '<') {
                insideTag = true;
            } else if (current == '>') {
                insideTag = false;
            }
            if (insideTag || (current != '`' && current != '\'')) {
                output.append(current);
            } else if (current == '`' && next == '`') {
                output.append('“');
                index++;
            } else if (current == '\'' && next == '\'') {
                output.append('”');
                index++;
            } else {
                output.append(current == '`' ? '‘' : '’');
            }
        }
        return output.toString();
    }

    /**
     * Unescapes {@code \&}, {@code \%}, {@code \#} and {@code \_}; the ampersand has already been
     * escaped to {@code &amp;} at this point.
     */
    static String specialCharacters(String text) {
        return text
            .replace("\\&amp;", "&amp;")
            .replace("\\%", "%")
            .replace("\\#", "#")
            .replace("\\_", "_");
    }

    private static String pdfEmbed(Matcher match, String pdfBasePath) {
        String link = match.group(1);
        if (!link.toLowerCase(Locale.ROOT).contains(".pdf")) {
            return match.group(0);
        }
        int hash = link.indexOf('#');
        String filename = (hash < 0 ? link : link.substring(0, hash)).strip();
        String parameters = hash < 0 ? "" : link.substring(hash);
        return "<embed src=\"" + pdfBasePath + filename + parameters
            + "\" type=\"application/pdf\" width=\"100%\" height=\"800px\" />";
    }

    private static DispatchEntry wrapping(String name, String open, String close) {
        return DispatchEntry.command(name, 1, 0, (invocation, dispatcher) ->
            open + dispatcher.dispatch(invocation.argument(0)) + close);
    }

    private static String reference(String label) {
        return "<a href=\"#" + labelId(label) + "\" class=\"latex-ref\">" + label + "</a>";
    }

    static String labelId(String label) {
        return LABEL_UNSAFE.matcher(label.strip()).replaceAll("-");
    }

    private static String replaceAll(String text, Pattern pattern, Function<Matcher, String> replacement) {
        Matcher matcher = pattern.matcher(text);
        StringBuilder output = new StringBuilder(text.length());
        while (matcher.find()) {
            matcher.appendReplacement(output, Matcher.quoteReplacement(replacement.apply(matcher)));
        }
        matcher.appendTail(output);
        return output.toString();
    }
}
