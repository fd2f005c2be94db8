package com.williamcallahan.notewiki.service.tex;

import com.williamcallahan.notewiki.domain.render.Span;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Recognizers for the protected regions of a note: mathematics and already-rendered opaque blocks.
 */
public final class Recognizers {

    private static final Pattern DOLLAR_DISPLAY = Pattern.compile("(?<!\\\\)\\$\\$.+?(?<!\\\\)\\$\\$", Pattern.DOTALL);
    private static final Pattern BRACKET_DISPLAY = Pattern.compile("(?<!\\\\)\\\\\\[.*?\\\\\\]", Pattern.DOTALL);
    private static final Pattern PAREN_INLINE = Pattern.compile("(?<!\\\\)\\\\\\(.*?\\\\\\)", Pattern.DOTALL);
    private static final Pattern OPAQUE_BLOCK = Pattern.compile(
        "<script\\b[^>]*>.*?</script>|<pre\\b[^>]*>.*?</pre>|<code class=\"verb\">.*?</code>", Pattern.DOTALL);

    private Recognizers() {}

    /**
     * {@code $$...$$} display math.
     */
    public static RegionRecognizer dollarDisplayMath() {
        return RegionRecognizer.ofPattern("MATH", DOLLAR_DISPLAY);
    }

    /**
     * {@code \[...\]} display math.
     */
    public static RegionRecognizer bracketDisplayMath() {
        return RegionRecognizer.ofPattern("MATH", BRACKET_DISPLAY);
    }

    /**
     * {@code \(...\)} inline math.
     */
    public static RegionRecognizer parenInlineMath() {
        return RegionRecognizer.ofPattern("MATH", PAREN_INLINE);
    }

    /**
     * {@code $...$} inline math whose opening dollar is unescaped and whose closing dollar is not
     * followed by a digit, so prices such as "$5 and $6" are left alone.
     */
    public static RegionRecognizer inlineDollarMath() {
        return new InlineDollarRecognizer();
    }

    /**
     * All math recognizers, display forms first so {@code $$} is never read as two inline spans.
     */
    public static List<RegionRecognizer> math() {
        return List.of(dollarDisplayMath(), bracketDisplayMath(), parenInlineMath(), inlineDollarMath());
    }

    /**
     * Rendered diagram scripts and verbatim code produced by {@link DiagramConverter}.
     */
    public static RegionRecognizer opaqueBlocks() {
        return RegionRecognizer.ofPattern("BLOCK", OPAQUE_BLOCK);
    }

    private static final class InlineDollarRecognizer implements RegionRecognizer {

        @Override
        public String label() {
            return "MATH";
        }

        @Override
        public Optional<Span> findNext(String text, int from) {
            int openIndex = nextUnescapedDollar(text, from);
            while (openIndex >= 0) {
                int closeIndex = nextUnescapedDollar(text, openIndex + 1);
                if (closeIndex < 0) {
                    return Optional.empty();
                }
                boolean empty = closeIndex == openIndex + 1;
                boolean digitFollows = closeIndex + 1 < text.length() && Character.isDigit(text.charAt(closeIndex + 1));
                if (!empty && !digitFollows) {
                    return Optional.of(new Span(openIndex, closeIndex + 1, text.substring(openIndex, closeIndex + 1)));
                }
                openIndex = empty ? nextUnescapedDollar(text, closeIndex + 1) : closeIndex;
            }
            return Optional.empty();
        }

        private static int nextUnescapedDollar(String text, int from) {
            int index = text.indexOf('$', from);
            while (index >= 0 && DelimiterScanner.isEscaped(text, index)) {
                index = text.indexOf('$', index + 1);
            }
            return index;
        }
    }
}
