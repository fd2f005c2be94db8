package com.williamcallahan.notewiki.service.tex;

import com.williamcallahan.notewiki.domain.render.MacroEntry;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Shorthand macros available in every note.
 *
 * <p>Font shorthands are generated over the alphabet ({@code \cA} is {@code \mathcal{A}},
 * {@code \bbR} is {@code \mathbb{R}}, ...); the rest is a fixed vocabulary of operators,
 * categories, arrows and delimiters.</p>
 */
public final class BuiltinMacros {

    private static final Pattern PARAMETER = Pattern.compile("(?<!\\\\)#(\\d)");

    /** Prefix to font command, applied to every uppercase letter. */
    private static final Map<String, String> UPPERCASE_FONTS = orderedMap(
        "c", "\\mathcal",
        "bb", "\\mathbb",
        "sf", "\\mathsf",
        "f", "\\mathfrak",
        "b", "\\mathbf",
        "s", "\\mathscr",
        "e", "\\mathcal"
    );

    /** Prefix to font command, applied to every lowercase letter. */
    private static final Map<String, String> LOWERCASE_FONTS = orderedMap("f", "\\mathfrak");

    private static final List<MacroEntry> ENTRIES = generate();

    private BuiltinMacros() {}

    /**
     * Returns the built-in entries; later duplicates have already replaced earlier ones.
     */
    public static List<MacroEntry> entries() {
        return ENTRIES;
    }

    /**
     * Returns the highest unescaped {@code #n} parameter referenced in {@code body}, or 0.
     */
    public static int inferArity(String body) {
        Matcher matcher = PARAMETER.matcher(body);
        int arity = 0;
        while (matcher.find()) {
            arity = Math.max(arity, Integer.parseInt(matcher.group(1)));
        }
        return arity;
    }

    private static List<MacroEntry> generate() {
        Map<String, String> bodies = new LinkedHashMap<>();
        for (char letter = 'A'; letter <= 'Z'; letter++) {
            for (Map.Entry<String, String> font : UPPERCASE_FONTS.entrySet()) {
                bodies.put(font.getKey() + letter, font.getValue() + "{" + letter + "}");
            }
        }
        for (char letter = 'a'; letter <= 'z'; letter++) {
            for (Map.Entry<String, String> font : LOWERCASE_FONTS.entrySet()) {
                bodies.put(font.getKey() + letter, font.getValue() + "{" + letter + "}");
            }
        }
        bodies.put("bar", "\\overline");

        // category theory
        bodies.put("undC", "\\underline{\\mathcal{C}}");
        for (String operator : List.of("Obj", "Hom", "Mor", "End", "Aut", "Tr", "eval", "colim", "Ext", "Tor",
            "Spec", "im", "coker", "Sk")) {
            bodies.put(operator, "\\operatorname{" + operator + "}");
        }
        bodies.put("id", "\\mathrm{id}");
        bodies.put("pt", "\\mathrm{pt}");

        bodies.put("A", "\\operatorname{Sk}");
        bodies.put("F", "\\mathcal{F}");
        bodies.put("U", "\\mathcal{U}");
        bodies.put("orev", "\\overline");
        bodies.put("fcj", "\\widehat");
        bodies.put("e", "\\varepsilon");
        bodies.put("glu", "\\mathrm{gl}");
        bodies.put("greyson", "\\bgroup\\color{violet}[[#1]]\\egroup");
        bodies.put("todo", "\\textbf{[[}\\textsl{#1}\\textbf{]]}");

        // delimiters
        bodies.put("bkt", "\\left\\langle #1 \\middle| #2 \\right\\rangle");
        bodies.put("pbkt", "\\left( #1 \\middle| #2 \\right)");
        bodies.put("abs", "\\left| #1 \\right|");
        bodies.put("norm", "\\left\\| #1 \\right\\|");
        bodies.put("set", "\\left\\{ #1 \\right\\}");
        bodies.put("bra", "\\left\\langle #1 \\right|");
        bodies.put("ket", "\\left| #1 \\right\\rangle");
        bodies.put("braket", "\\left\\langle #1 \\middle| #2 \\right\\rangle");

        for (String category : List.of("Set", "Grp", "Top", "Vec", "Hilb")) {
            bodies.put(category, "\\mathbf{" + category + "}");
        }

        bodies.put("coloneqq", "\\mathrel{\\vcenter{:}}=");
        bodies.put("coloneq", "\\mathrel{\\vcenter{:}}=");
        bodies.put("eqqcolon", "=\\mathrel{\\vcenter{:}}");
        bodies.put("endto", "\\to");

        // arrows
        bodies.put("to", "\\rightarrow");
        bodies.put("injto", "\\hookrightarrow");
        bodies.put("surjto", "\\twoheadrightarrow");
        bodies.put("longto", "\\longrightarrow");
        bodies.put("lto", "\\longrightarrow");
        bodies.put("mapsfrom", "\\mathrel{\\reflectbox{\\ensuremath{\\mapsto}}}");
        bodies.put("Ising", "\\mathsf{Ising}");

        // greek
        bodies.put("a", "\\alpha");
        bodies.put("b", "\\beta");
        bodies.put("d", "\\delta");
        bodies.put("g", "\\gamma");

        List<MacroEntry> entries = new ArrayList<>(bodies.size());
        bodies.forEach((name, body) -> entries.add(new MacroEntry(name, inferArity(body), body)));
        return List.copyOf(entries);
    }

    private static Map<String, String> orderedMap(String... keysAndValues) {
        Map<String, String> map = new LinkedHashMap<>();
        for (int index = 0; index + 1 < keysAndValues.length; index += 2) {
            map.put(keysAndValues[index], keysAndValues[index + 1]);
        }
        return map;
    }
}
