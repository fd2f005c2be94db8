package com.williamcallahan.notewiki.service.tex;

import com.williamcallahan.notewiki.domain.render.MacroEntry;
import com.williamcallahan.notewiki.domain.render.MacroTable;
import com.williamcallahan.notewiki.domain.render.ProcessingWarning;
import com.williamcallahan.notewiki.domain.render.ProcessingWarning.WarningType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Collects macro declarations from a note and merges them over {@link BuiltinMacros}.
 *
 * <p>Recognized forms are {@code \newcommand}, {@code \renewcommand} and {@code \providecommand}
 * (optionally starred) with the name braced or bare, an optional {@code [n]} arity and an
 * optional {@code [default]}, followed by a balanced body; and {@code \DeclareMathOperator} /
 * {@code \DeclareMathOperator*}. Every declaration is removed from the returned text, and a
 * declaration without a usable name, arity or body is left out of the table with a warning.</p>
 */
public final class MacroTableBuilder {

    private static final Logger logger = LoggerFactory.getLogger(MacroTableBuilder.class);

    private static final Pattern DECLARATION = Pattern.compile(
        "\\\\(?:(?<command>(?:re|provide)?newcommand)|(?<operator>DeclareMathOperator))(?<star>\\*?)(?![a-zA-Z])");
    private static final Pattern MACRO_NAME = Pattern.compile("\\\\([a-zA-Z@]+)");
    private static final Pattern ARITY = Pattern.compile("\\s*(\\d)\\s*");

    private MacroTableBuilder() {}

    /**
     * Result of scanning one note for declarations.
     *
     * @param entries declared macros in source order; a later declaration of a name wins on merge
     * @param text the scanned text with every declaration removed
     * @param warnings malformed declarations that were skipped
     */
    public record Extraction(List<MacroEntry> entries, String text, List<ProcessingWarning> warnings) {
        public Extraction {
            entries = List.copyOf(entries);
            warnings = List.copyOf(warnings);
        }
    }

    /**
     * Extracts and removes every macro declaration in {@code source}.
     */
    public static Extraction extract(String source) {
        if (source == null || source.isEmpty()) {
            return new Extraction(List.of(), source == null ? "" : source, List.of());
        }
        List<MacroEntry> entries = new ArrayList<>();
        List<ProcessingWarning> warnings = new ArrayList<>();
        StringBuilder output = new StringBuilder(source.length());
        Matcher matcher = DECLARATION.matcher(source);
        int cursor = 0;
        while (matcher.find(cursor)) {
            output.append(source, cursor, matcher.start());
            boolean operator = matcher.group("operator") != null;
            Parsed parsed = operator
                ? parseOperator(source, matcher.end(), !matcher.group("star").isEmpty())
                : parseCommand(source, matcher.end());
            if (parsed.entry().isPresent()) {
                entries.add(parsed.entry().get());
            } else {
                String excerpt = source.substring(matcher.start(), Math.min(source.length(), parsed.end() + 1));
                logger.warn("Skipping malformed macro declaration at {}: {}", matcher.start(), parsed.problem());
                warnings.add(new ProcessingWarning("Malformed macro declaration: " + parsed.problem(),
                    WarningType.MALFORMED_MACRO_DECLARATION, matcher.start(), excerpt));
            }
            cursor = Math.max(parsed.end(), matcher.end());
        }
        output.append(source, cursor, source.length());
        return new Extraction(entries, output.toString(), warnings);
    }

    /**
     * Built-in shorthands overlaid with {@code declared}.
     */
    public static MacroTable build(List<MacroEntry> declared) {
        return MacroTable.merge(BuiltinMacros.entries(), declared);
    }

    private static Parsed parseCommand(String source, int from) {
        NameScan name = scanName(source, from);
        if (name.name().isEmpty()) {
            return Parsed.malformed(name.end(), "missing macro name");
        }
        int cursor = DelimiterScanner.skipWhitespace(source, name.end());
        int arity = 0;
        if (cursor < source.length() && source.charAt(cursor) == '[') {
            ScanResult arityScan = DelimiterScanner.brackets(source, cursor);
            if (!(arityScan instanceof ScanResult.Balanced balanced)) {
                return Parsed.malformed(cursor, "unterminated arity for \\" + name.name().get());
            }
            Matcher digits = ARITY.matcher(balanced.span().content());
            if (!digits.matches()) {
                return Parsed.malformed(balanced.span().end(), "arity of \\" + name.name().get() + " is not 0..9");
            }
            arity = Integer.parseInt(digits.group(1));
            cursor = DelimiterScanner.skipWhitespace(source, balanced.span().end());
            if (cursor < source.length() && source.charAt(cursor) == '[') {
                ScanResult defaultScan = DelimiterScanner.brackets(source, cursor);
                if (!(defaultScan instanceof ScanResult.Balanced balancedDefault)) {
                    return Parsed.malformed(cursor, "unterminated default argument for \\" + name.name().get());
                }
                cursor = DelimiterScanner.skipWhitespace(source, balancedDefault.span().end());
            }
        }
        ScanResult body = DelimiterScanner.braces(source, cursor);
        if (!(body instanceof ScanResult.Balanced balancedBody)) {
            return Parsed.malformed(cursor, "missing body for \\" + name.name().get());
        }
        MacroEntry entry = new MacroEntry(name.name().get(), arity, balancedBody.span().content());
        return new Parsed(Optional.of(entry), balancedBody.span().end(), "");
    }

    private static Parsed parseOperator(String source, int from, boolean starred) {
        NameScan name = scanName(source, from);
        if (name.name().isEmpty()) {
            return Parsed.malformed(name.end(), "missing operator name");
        }
        int cursor = DelimiterScanner.skipWhitespace(source, name.end());
        ScanResult body = DelimiterScanner.braces(source, cursor);
        if (!(body instanceof ScanResult.Balanced balancedBody)) {
            return Parsed.malformed(cursor, "missing text for operator \\" + name.name().get());
        }
        String expansion = (starred ? "\\operatorname*{" : "\\operatorname{") + balancedBody.span().content() + "}";
        return new Parsed(Optional.of(new MacroEntry(name.name().get(), 0, expansion)), balancedBody.span().end(), "");
    }

    private static NameScan scanName(String source, int from) {
        int cursor = DelimiterScanner.skipWhitespace(source, from);
        if (cursor >= source.length()) {
            return new NameScan(Optional.empty(), cursor);
        }
        if (source.charAt(cursor) == '{') {
            ScanResult scan = DelimiterScanner.braces(source, cursor);
            if (!(scan instanceof ScanResult.Balanced balanced)) {
                return new NameScan(Optional.empty(), cursor + 1);
            }
            Matcher matcher = MACRO_NAME.matcher(balanced.span().content().strip());
            return matcher.matches()
                ? new NameScan(Optional.of(matcher.group(1)), balanced.span().end())
                : new NameScan(Optional.empty(), balanced.span().end());
        }
        Matcher matcher = MACRO_NAME.matcher(source);
        if (matcher.find(cursor) && matcher.start() == cursor) {
            return new NameScan(Optional.of(matcher.group(1)), matcher.end());
        }
        return new NameScan(Optional.empty(), cursor);
    }

    private record NameScan(Optional<String> name, int end) {}

    private record Parsed(Optional<MacroEntry> entry, int end, String problem) {
        static Parsed malformed(int end, String problem) {
            return new Parsed(Optional.empty(), end, problem);
        }
    }
}
