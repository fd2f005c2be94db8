package com.williamcallahan.notewiki.service.tex;

import com.williamcallahan.notewiki.domain.render.CorpusIndex;
import com.williamcallahan.notewiki.domain.render.ProcessingWarning;
import com.williamcallahan.notewiki.domain.render.ProcessingWarning.WarningType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Mutable state of one note conversion, created fresh per note and discarded afterwards.
 * Only the corpus index is shared, and it is read-only.
 */
public final class ConversionContext {

    private static final Logger logger = LoggerFactory.getLogger(ConversionContext.class);

    private final CorpusIndex corpus;
    private final RenderOptions options;
    private final RegionStash mathStash = new RegionStash("MATH");
    private final RegionStash blockStash = new RegionStash("BLOCK");
    private final SequenceRegistry<String> citations = new SequenceRegistry<>();
    private final FootnoteRegistry footnotes = new FootnoteRegistry();
    private final AnchorGenerator anchors = new AnchorGenerator();
    private final Set<String> forwardLinks = new TreeSet<>();
    private final List<ProcessingWarning> warnings = new ArrayList<>();

    public ConversionContext(CorpusIndex corpus, RenderOptions options) {
        this.corpus = Objects.requireNonNull(corpus, "Corpus index cannot be null");
        this.options = Objects.requireNonNull(options, "Render options cannot be null");
    }

    /**
     * Records a non-fatal problem.
     */
    public void warn(WarningType type, String message, int position, String context) {
        logger.debug("{} at {}: {}", type, position, message);
        warnings.add(new ProcessingWarning(message, type, Math.max(position, 0), context));
    }

    /**
     * Checks whether a line starts with a stashed display-math span.
     */
    public boolean isDisplayMathLine(String line) {
        String trimmed = line.strip();
        int tokenEnd = trimmed.indexOf(RegionStash.TOKEN_END);
        if (tokenEnd < 0) {
            return false;
        }
        String leading = trimmed.substring(0, tokenEnd + RegionStash.TOKEN_END.length());
        return mathStash.isToken(leading)
            && mathStash.originalOf(leading).map(ConversionContext::isDisplayMath).orElse(false);
    }

    private static boolean isDisplayMath(String original) {
        return original.startsWith("\\[") || original.startsWith("$$");
    }

    /**
     * Records a forward link; targets pointing at PDF files are not notes and are skipped.
     */
    public void addForwardLink(String targetId) {
        if (!targetId.toLowerCase(Locale.ROOT).contains(".pdf")) {
            forwardLinks.add(targetId);
        }
    }

    public CorpusIndex corpus() {
        return corpus;
    }

    public RenderOptions options() {
        return options;
    }

    public RegionStash mathStash() {
        return mathStash;
    }

    public RegionStash blockStash() {
        return blockStash;
    }

    public SequenceRegistry<String> citations() {
        return citations;
    }

    public FootnoteRegistry footnotes() {
        return footnotes;
    }

    public AnchorGenerator anchors() {
        return anchors;
    }

    public Set<String> forwardLinks() {
        return Set.copyOf(forwardLinks);
    }

    /**
     * Returns forward links in sorted order.
     */
    public List<String> sortedForwardLinks() {
        return List.copyOf(forwardLinks);
    }

    public List<ProcessingWarning> warnings() {
        return List.copyOf(warnings);
    }
}
