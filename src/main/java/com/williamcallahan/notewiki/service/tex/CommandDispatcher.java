package com.williamcallahan.notewiki.service.tex;

import com.williamcallahan.notewiki.domain.render.ProcessingWarning.WarningType;
import com.williamcallahan.notewiki.domain.render.Span;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Replaces known commands and environments in a single left-to-right pass.
 *
 * <p>Output is written to a buffer behind an explicit cursor, so replaced text is never rescanned.
 * A marker whose arguments are malformed, or an environment with no matching end marker, is
 * emitted unchanged and scanning resumes right after the marker.</p>
 */
public final class CommandDispatcher {

    private static final String BEGIN = "begin";
    private static final String END = "end";

    private final DispatchTable table;
    private final ConversionContext context;

    public CommandDispatcher(DispatchTable table, ConversionContext context) {
        this.table = table;
        this.context = context;
    }

    /**
     * Returns the per-document state renderers may record into.
     */
    public ConversionContext context() {
        return context;
    }

    /**
     * Renders every known command and environment in {@code text}.
     */
    public String dispatch(String text) {
        if (text == null || text.indexOf('\\') < 0) {
            return text;
        }
        StringBuilder output = new StringBuilder(text.length() + 64);
        int cursor = 0;
        while (cursor < text.length()) {
            int markerIndex = text.indexOf('\\', cursor);
            if (markerIndex < 0) {
                output.append(text, cursor, text.length());
                break;
            }
            output.append(text, cursor, markerIndex);
            cursor = dispatchMarker(text, markerIndex, output);
        }
        return output.toString();
    }

    private int dispatchMarker(String text, int markerIndex, StringBuilder output) {
        int nameStart = markerIndex + 1;
        if (nameStart >= text.length() || !Character.isLetter(text.charAt(nameStart))) {
            int consumed = Math.min(markerIndex + 2, text.length());
            output.append(text, markerIndex, consumed);
            return consumed;
        }
        int nameEnd = nameStart;
        while (nameEnd < text.length() && Character.isLetter(text.charAt(nameEnd))) {
            nameEnd++;
        }
        String name = text.substring(nameStart, nameEnd);

        if (BEGIN.equals(name)) {
            return dispatchEnvironment(text, markerIndex, nameEnd, output);
        }

        Optional<DispatchEntry> entry = Optional.empty();
        int afterName = nameEnd;
        if (nameEnd < text.length() && text.charAt(nameEnd) == '*') {
            entry = table.lookup(DispatchKind.COMMAND, name + "*");
            if (entry.isPresent()) {
                afterName = nameEnd + 1;
            }
        }
        if (entry.isEmpty()) {
            entry = table.lookup(DispatchKind.COMMAND, name);
        }
        if (entry.isEmpty()) {
            output.append(text, markerIndex, nameEnd);
            return nameEnd;
        }
        return dispatchCommand(text, markerIndex, afterName, entry.get(), output);
    }

    private int dispatchCommand(String text, int markerIndex, int afterName, DispatchEntry entry, StringBuilder output) {
        ParsedArguments arguments = parseArguments(text, afterName, entry);
        if (arguments == null) {
            context.warn(WarningType.UNBALANCED_DELIMITER,
                "Malformed arguments for \\" + entry.name() + "; left as text", markerIndex, excerpt(text, markerIndex));
            output.append(text, markerIndex, afterName);
            return afterName;
        }
        Optional<String> trailing = Optional.empty();
        int cursor = arguments.end();
        if (entry.trailingOptional() && cursor < text.length() && text.charAt(cursor) == '[') {
            ScanResult scan = DelimiterScanner.brackets(text, cursor);
            if (scan instanceof ScanResult.Balanced balanced) {
                trailing = Optional.of(balanced.span().content());
                cursor = balanced.span().end();
            }
        }
        Invocation invocation = new Invocation(entry.name(), DispatchKind.COMMAND,
            arguments.optional(), arguments.required(), trailing, "", markerIndex);
        output.append(entry.renderer().render(invocation, this));
        return cursor;
    }

    private int dispatchEnvironment(String text, int markerIndex, int afterBegin, StringBuilder output) {
        int braceIndex = DelimiterScanner.skipWhitespace(text, afterBegin);
        ScanResult nameScan = DelimiterScanner.braces(text, braceIndex);
        if (!(nameScan instanceof ScanResult.Balanced balancedName)) {
            output.append(text, markerIndex, afterBegin);
            return afterBegin;
        }
        String name = balancedName.span().content().trim();
        int afterMarker = balancedName.span().end();
        Optional<DispatchEntry> lookup = table.lookup(DispatchKind.ENVIRONMENT, name);
        if (lookup.isEmpty()) {
            output.append(text, markerIndex, afterMarker);
            return afterMarker;
        }
        DispatchEntry entry = lookup.get();

        ParsedArguments arguments = parseEnvironmentArguments(text, afterMarker, entry);
        Optional<Span> body = arguments == null ? Optional.empty() : findEnvironmentBody(text, arguments.end(), name);
        if (body.isEmpty()) {
            context.warn(WarningType.UNBALANCED_DELIMITER,
                "\\begin{" + name + "} has no matching \\end{" + name + "}; left as text",
                markerIndex, excerpt(text, markerIndex));
            output.append(text, markerIndex, afterMarker);
            return afterMarker;
        }
        String content = body.get().content();
        if (entry.recursiveBody()) {
            content = dispatch(content);
        }
        Invocation invocation = new Invocation(name, DispatchKind.ENVIRONMENT,
            arguments.optional(), arguments.required(), Optional.empty(), content, markerIndex);
        output.append(entry.renderer().render(invocation, this));
        return body.get().end();
    }

    /**
     * Locates the body of environment {@code name} starting at {@code bodyStart}, counting nested
     * {@code \begin{name}} and {@code \end{name}} markers of the same name only.
     *
     * @return the body span, whose end is just past the matching end marker
     */
    static Optional<Span> findEnvironmentBody(String text, int bodyStart, String name) {
        String beginMarker = "\\begin{" + name + "}";
        String endMarker = "\\end{" + name + "}";
        int depth = 1;
        int cursor = bodyStart;
        while (cursor <= text.length()) {
            int nextEnd = text.indexOf(endMarker, cursor);
            if (nextEnd < 0) {
                return Optional.empty();
            }
            int nextBegin = text.indexOf(beginMarker, cursor);
            if (nextBegin >= 0 && nextBegin < nextEnd) {
                depth++;
                cursor = nextBegin + beginMarker.length();
                continue;
            }
            depth--;
            if (depth == 0) {
                return Optional.of(new Span(bodyStart, nextEnd + endMarker.length(), text.substring(bodyStart, nextEnd)));
            }
            cursor = nextEnd + endMarker.length();
        }
        return Optional.empty();
    }

    private ParsedArguments parseArguments(String text, int from, DispatchEntry entry) {
        int cursor = from;
        Optional<String> optional = Optional.empty();
        if (entry.optionalArgs() > 0) {
            int bracketIndex = DelimiterScanner.skipWhitespace(text, cursor);
            if (bracketIndex < text.length() && text.charAt(bracketIndex) == '[') {
                ScanResult scan = DelimiterScanner.brackets(text, bracketIndex);
                if (!(scan instanceof ScanResult.Balanced balanced)) {
                    return null;
                }
                optional = Optional.of(balanced.span().content());
                cursor = balanced.span().end();
            }
        }
        List<String> required = new ArrayList<>(entry.requiredArgs());
        for (int index = 0; index < entry.requiredArgs(); index++) {
            int braceIndex = DelimiterScanner.skipWhitespace(text, cursor);
            ScanResult scan = DelimiterScanner.braces(text, braceIndex);
            if (!(scan instanceof ScanResult.Balanced balanced)) {
                return null;
            }
            required.add(balanced.span().content());
            cursor = balanced.span().end();
        }
        return new ParsedArguments(optional, required, cursor);
    }

    private ParsedArguments parseEnvironmentArguments(String text, int from, DispatchEntry entry) {
        int cursor = from;
        List<String> required = new ArrayList<>(entry.requiredArgs());
        for (int index = 0; index < entry.requiredArgs(); index++) {
            ScanResult scan = DelimiterScanner.braces(text, cursor);
            if (!(scan instanceof ScanResult.Balanced balanced)) {
                return null;
            }
            required.add(balanced.span().content());
            cursor = balanced.span().end();
        }
        Optional<String> optional = Optional.empty();
        if (entry.optionalArgs() > 0 && cursor < text.length() && text.charAt(cursor) == '[') {
            ScanResult scan = DelimiterScanner.brackets(text, cursor);
            if (!(scan instanceof ScanResult.Balanced balanced)) {
                return null;
            }
            optional = Optional.of(balanced.span().content());
            cursor = balanced.span().end();
        }
        return new ParsedArguments(optional, required, cursor);
    }

    private static String excerpt(String text, int from) {
        return text.substring(from, Math.min(text.length(), from + 40));
    }

    private record ParsedArguments(Optional<String> optional, List<String> required, int end) {}
}
