package com.williamcallahan.notewiki.service.tex;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Renders theorem-like environments as labeled boxes, plus {@code center}.
 *
 * <p>The label is the capitalized environment name with the bracket argument as a parenthetical
 * title: {@code \begin{lemma}[Yoneda]} gives "<strong>Lemma (Yoneda).</strong>". When the body opens
 * with a list the label gets its own paragraph; otherwise it runs into the body text.</p>
 */
public final class TheoremEnvironments {

    /** Environment names accepted bare and with a {@code framed} prefix. */
    public static final List<String> NAMES = List.of(
        "definition", "theorem", "lemma", "proposition", "corollary", "example", "remark", "idea",
        "construction", "claim", "step", "question", "warning", "exercise", "fact", "observation",
        "convention", "note", "notation", "axiom", "assumption", "algorithm", "postulate", "proof",
        "theoremalpha"
    );

    private static final String FRAMED = "framed";
    private static final String IDEA = "idea";

    private static final DispatchTable TABLE = buildTable();

    private TheoremEnvironments() {}

    /**
     * Renders every theorem-like and {@code center} environment in {@code text}.
     */
    public static String convert(String text, ConversionContext context) {
        return new CommandDispatcher(TABLE, context).dispatch(text);
    }

    private static DispatchTable buildTable() {
        DispatchTable.Builder builder = DispatchTable.builder();
        for (String name : NAMES) {
            builder.add(DispatchEntry.environment(name,
                (invocation, dispatcher) -> render(name, invocation.optionalArgument(), invocation.body())));
            builder.add(DispatchEntry.environment(FRAMED + name,
                (invocation, dispatcher) -> render(FRAMED + name, invocation.optionalArgument(), invocation.body())));
        }
        builder.add(DispatchEntry.environment("pf",
            (invocation, dispatcher) -> render("proof", invocation.optionalArgument(), invocation.body())));
        builder.add(DispatchEntry.environment("restatable", 2, (invocation, dispatcher) ->
            render(invocation.argument(0).strip(), invocation.optionalArgument(), invocation.body())));
        builder.add(DispatchEntry.environment("center", (invocation, dispatcher) ->
            "<div style=\"text-align: center;\">" + invocation.body() + "</div>"));
        return builder.build();
    }

    /**
     * Renders one box.
     *
     * @param name environment name as used for the CSS class, e.g. {@code framedtheorem}
     * @param option bracket argument, used as the parenthetical title
     * @param body already-rendered body
     */
    static String render(String name, Optional<String> option, String body) {
        String kind = displayName(name);
        Optional<String> title = option.map(TheoremEnvironments::unbrace).map(String::strip).filter(text -> !text.isEmpty());
        if (IDEA.equals(baseName(name)) && title.filter("Idea"::equals).isPresent()) {
            title = Optional.empty();
        }
        String label = "<strong>" + kind + title.map(text -> " (" + text + ")").orElse("") + ".</strong>";
        String content = body.strip();
        String placed = content.startsWith("<ul") || content.startsWith("<ol")
            ? "<p>" + label + "</p>\n" + content
            : label + " " + content;
        return "<div class=\"env-box " + name + "\">\n" + placed + "\n</div>";
    }

    private static String displayName(String name) {
        String base = baseName(name);
        if ("theoremalpha".equals(base)) {
            base = "theorem";
        }
        return base.isEmpty() ? base : base.substring(0, 1).toUpperCase(Locale.ROOT) + base.substring(1);
    }

    private static String baseName(String name) {
        return name.startsWith(FRAMED) ? name.substring(FRAMED.length()) : name;
    }

    private static String unbrace(String option) {
        String trimmed = option.strip();
        return trimmed.startsWith("{") && trimmed.endsWith("}") ? trimmed.substring(1, trimmed.length() - 1) : trimmed;
    }
}
