package com.williamcallahan.notewiki.service.tex;

import com.williamcallahan.notewiki.domain.render.Span;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Locates protected regions that a {@link RegionStash} should hide from later passes.
 *
 * <p>The returned span covers the whole region including its delimiters, and its content is the
 * raw text of that region, which is what the stash records for restoration.</p>
 */
public interface RegionRecognizer {

    /**
     * Short uppercase tag embedded in placeholder tokens, e.g. {@code MATH}.
     */
    String label();

    /**
     * Finds the next region starting at or after {@code from}.
     */
    Optional<Span> findNext(String text, int from);

    /**
     * Builds a recognizer backed by a regular expression; the whole match is the region.
     */
    static RegionRecognizer ofPattern(String label, Pattern pattern) {
        return new RegionRecognizer() {
            @Override
            public String label() {
                return label;
            }

            @Override
            public Optional<Span> findNext(String text, int from) {
                Matcher matcher = pattern.matcher(text);
                while (from <= text.length() && matcher.find(from)) {
                    if (matcher.end() > matcher.start()) {
                        return Optional.of(new Span(matcher.start(), matcher.end(), matcher.group()));
                    }
                    from = matcher.end() + 1;
                }
                return Optional.empty();
            }
        };
    }
}
