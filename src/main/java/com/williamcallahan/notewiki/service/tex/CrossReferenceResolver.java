package com.williamcallahan.notewiki.service.tex;

import com.williamcallahan.notewiki.domain.render.CorpusIndex;
import com.williamcallahan.notewiki.domain.render.LinkTarget;
import com.williamcallahan.notewiki.domain.render.ProcessingWarning.WarningType;

import java.util.Optional;

/**
 * Turns note references into links and records them as the note's forward links.
 */
public final class CrossReferenceResolver {

    private CrossReferenceResolver() {}

    /**
     * Chooses the link text: explicit text wherever it was written, else the target's title from the
     * corpus (escaped), else the identifier with hyphens read as spaces (casing kept as written).
     */
    public static String displayText(LinkTarget target, CorpusIndex corpus) {
        if (target.displayText().isPresent()) {
            return target.displayText().get();
        }
        return corpus.titleOf(target.targetId())
            .map(HtmlText::escapeText)
            .orElseGet(() -> prettify(target.targetId()));
    }

    /**
     * Renders {@code target} as a link to its page and adds it to the context's forward links.
     * A target missing from the corpus still links; it is only reported as a warning.
     */
    public static String resolve(LinkTarget target, ConversionContext context, int position) {
        String targetId = target.targetId().strip();
        LinkTarget normalized = new LinkTarget(targetId, target.displayText(), target.displayPlacement());
        if (context.corpus().titleOf(targetId).isEmpty()) {
            context.warn(WarningType.UNKNOWN_TARGET, "Link target '" + targetId + "' is not in the title index",
                position, targetId);
        }
        context.addForwardLink(targetId);
        return "<a href=\"" + targetId + ".html\">" + displayText(normalized, context.corpus()) + "</a>";
    }

    /**
     * Builds the target of {@code \wref[before]{target}[after]}; text before the target wins when
     * both are given.
     */
    public static LinkTarget fromInvocation(Invocation invocation) {
        Optional<String> before = invocation.optionalArgument().filter(text -> !text.isBlank());
        Optional<String> after = invocation.trailingArgument().filter(text -> !text.isBlank());
        if (before.isPresent()) {
            return new LinkTarget(invocation.argument(0), before, LinkTarget.Placement.BEFORE);
        }
        if (after.isPresent()) {
            return new LinkTarget(invocation.argument(0), after, LinkTarget.Placement.AFTER);
        }
        return LinkTarget.bare(invocation.argument(0));
    }

    static String prettify(String targetId) {
        return targetId.replace('-', ' ');
    }
}
