package com.williamcallahan.notewiki.service.tex;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders diagram source and verbatim code before anything else touches the note, then stashes
 * the rendered blocks so escaping and markup passes never see them.
 *
 * <p>Diagrams ({@code ```tikz} fences, {@code tkz}, {@code tikzcd}, {@code tikzpicture} and
 * {@code \tz[opt]{...}}) become {@code <script type="text/tikz">} blocks for TikZJax; verbatim
 * environments, other fences and {@code \verb|...|} become escaped {@code <pre><code>} or
 * {@code <code>} blocks.</p>
 */
public final class DiagramConverter {

    private static final String TIKZ_FENCE = "tikz";
    private static final String SCRIPT_START = "<script type=\"text/tikz\">";
    private static final String SCRIPT_END = "</script>";
    private static final Pattern WRAPPED_TIKZCD =
        Pattern.compile("\\\\\\[\\s*(\\\\begin\\{tikzcd\\}.*?\\\\end\\{tikzcd\\})\\s*\\\\\\]", Pattern.DOTALL);
    private static final Pattern LANGUAGE_OPTION = Pattern.compile("language\\s*=\\s*\\{?([A-Za-z0-9+#-]+)");

    private static final DispatchTable TABLE = DispatchTable.builder()
        .add(DispatchEntry.command("tz", 1, 1, (invocation, dispatcher) ->
            tikzScript(tikzPicture(invocation.optionalArgument().orElse(""), invocation.argument(0)),
                dispatcher.context().options().tikzPreamble())))
        .add(DispatchEntry.rawEnvironment("tkz", (invocation, dispatcher) ->
            tikzScript(tikzPicture(invocation.optionalArgument().orElse(""), invocation.body()),
                dispatcher.context().options().tikzPreamble())))
        .add(DispatchEntry.rawEnvironment("tikzcd", (invocation, dispatcher) ->
            tikzScript("\\begin{tikzcd}" + invocation.optionalArgument().map(option -> "[" + option + "]").orElse("")
                + invocation.body() + "\\end{tikzcd}", dispatcher.context().options().tikzPreamble())))
        .add(DispatchEntry.rawEnvironment("tikzpicture", (invocation, dispatcher) ->
            tikzScript(tikzPicture(invocation.optionalArgument().orElse(""), invocation.body()), "")))
        .add(new DispatchEntry("verbatim", DispatchKind.ENVIRONMENT, 0, 0, false, false,
            (invocation, dispatcher) -> codeBlock(Optional.empty(), trimNewlines(invocation.body()))))
        .add(DispatchEntry.rawEnvironment("lstlisting", (invocation, dispatcher) ->
            codeBlock(invocation.optionalArgument().flatMap(DiagramConverter::language), trimNewlines(invocation.body()))))
        .build();

    private DiagramConverter() {}

    /**
     * Renders every diagram and verbatim region of {@code text} and stashes the results in the
     * context's block stash. Fences and block environments go first, so a {@code \verb} written
     * inside them stays part of the listing.
     *
     * @return text in which each rendered block is a placeholder token
     */
    public static String convertAndStash(String text, ConversionContext context) {
        RegionStash blocks = context.blockStash();
        String converted = renderFences(text, context.options().tikzPreamble());
        converted = blocks.stash(converted, Recognizers.opaqueBlocks());
        converted = WRAPPED_TIKZCD.matcher(converted).replaceAll(match -> Matcher.quoteReplacement(match.group(1)));
        converted = new CommandDispatcher(TABLE, context).dispatch(converted);
        converted = blocks.stash(converted, Recognizers.opaqueBlocks());
        return blocks.stash(renderInlineVerbatim(converted), Recognizers.opaqueBlocks());
    }

    /**
     * Replaces {@code \verb<d>...<d>}, where {@code d} is any character other than a letter or
     * whitespace, with an escaped inline code element.
     */
    static String renderInlineVerbatim(String text) {
        String marker = "\\verb";
        if (text == null || !text.contains(marker)) {
            return text;
        }
        StringBuilder output = new StringBuilder(text.length());
        int cursor = 0;
        while (cursor < text.length()) {
            int start = text.indexOf(marker, cursor);
            if (start < 0) {
                output.append(text, cursor, text.length());
                break;
            }
            int delimiterIndex = start + marker.length();
            int close = -1;
            if (delimiterIndex < text.length() && !DelimiterScanner.isEscaped(text, start)) {
                char delimiter = text.charAt(delimiterIndex);
                if (!Character.isLetter(delimiter) && !Character.isWhitespace(delimiter)) {
                    close = text.indexOf(delimiter, delimiterIndex + 1);
                }
            }
            output.append(text, cursor, start);
            if (close < 0) {
                output.append(marker);
                cursor = delimiterIndex;
                continue;
            }
            output.append("<code class=\"verb\">")
                .append(HtmlText.escape(text.substring(delimiterIndex + 1, close)))
                .append("</code>");
            cursor = close + 1;
        }
        return output.toString();
    }

    /**
     * Replaces fenced blocks: {@code tikz} fences become diagrams, any other fence a code block.
     */
    static String renderFences(String text, String tikzPreamble) {
        if (text == null || (!text.contains("```") && !text.contains("~~~"))) {
            return text;
        }
        StringBuilder output = new StringBuilder(text.length());
        int cursor = 0;
        Optional<FenceScanner.Fence> fence = FenceScanner.findNext(text, cursor);
        while (fence.isPresent()) {
            FenceScanner.Fence found = fence.get();
            output.append(text, cursor, found.start());
            String info = found.info().toLowerCase(Locale.ROOT);
            if (TIKZ_FENCE.equals(info)) {
                output.append(tikzScript(found.content().strip(), tikzPreamble));
            } else {
                output.append(codeBlock(info.isEmpty() ? Optional.empty() : Optional.of(info), found.content()));
            }
            cursor = found.end();
            fence = FenceScanner.findNext(text, cursor);
        }
        output.append(text, cursor, text.length());
        return output.toString();
    }

    private static String tikzScript(String code, String preamble) {
        String prefix = preamble == null || preamble.isBlank() ? "" : preamble + "\n";
        return SCRIPT_START + prefix + code + SCRIPT_END;
    }

    private static String tikzPicture(String option, String body) {
        String options = option == null || option.isBlank() ? "" : "[" + option + "]";
        return "\\begin{tikzpicture}" + options + "\n" + body.strip() + "\n\\end{tikzpicture}";
    }

    private static String codeBlock(Optional<String> language, String code) {
        String languageClass = language
            .map(name -> " class=\"language-" + HtmlText.escape(name.toLowerCase(Locale.ROOT)) + "\"")
            .orElse("");
        return "<pre><code" + languageClass + ">" + HtmlText.escape(code) + "</code></pre>";
    }

    private static Optional<String> language(String options) {
        Matcher matcher = LANGUAGE_OPTION.matcher(options);
        return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
    }

    private static String trimNewlines(String body) {
        int start = 0;
        int end = body.length();
        while (start < end && (body.charAt(start) == '\n' || body.charAt(start) == '\r')) {
            start++;
        }
        while (end > start && Character.isWhitespace(body.charAt(end - 1))) {
            end--;
        }
        return body.substring(start, end);
    }
}
