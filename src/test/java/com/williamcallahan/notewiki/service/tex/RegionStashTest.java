package com.williamcallahan.notewiki.service.tex;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests placeholder stashing, restoration and spacing repair.
 */
class RegionStashTest {

    @Test
    void restore_insertsSpacesAroundInlineMathGluedToWords() {
        RegionStash stash = new RegionStash("MATH");

        String stashed = stash.stash("word$math$text", Recognizers.inlineDollarMath());

        assertFalse(stashed.contains("$"));
        assertEquals("word $math$ text", stash.restore(stashed));
    }

    @Test
    void restore_withWhitespaceBoundaries_returnsOriginalText() {
        List<String> inputs = List.of(
            "Let $x$ be given.",
            "Display: $$a + b$$ done",
            "Bracket \\[ y \\] and \\( z \\) here",
            "Prices $5 and $6 stay"
        );
        for (String input : inputs) {
            RegionStash stash = new RegionStash("MATH");
            String stashed = input;
            for (RegionRecognizer recognizer : Recognizers.math()) {
                stashed = stash.stash(stashed, recognizer);
            }
            assertEquals(input, stash.restore(stashed), input);
        }
    }

    @Test
    void stash_leavesDollarAmountsAlone() {
        RegionStash stash = new RegionStash("MATH");

        assertEquals("Prices $5 and $6 stay", stash.stash("Prices $5 and $6 stay", Recognizers.inlineDollarMath()));
        assertTrue(stash.tokens().isEmpty());
    }

    @Test
    void stash_escapedDollarIsNotMath() {
        RegionStash stash = new RegionStash("MATH");

        String stashed = stash.stash("costs \\$3 and $x$", Recognizers.inlineDollarMath());

        assertTrue(stashed.startsWith("costs \\$3 and "));
        assertEquals(1, stash.tokens().size());
        assertEquals("$x$", stash.tokens().values().iterator().next());
    }

    @Test
    void stash_tokensAreAlphanumeric() {
        RegionStash stash = new RegionStash("MATH");

        stash.stash("a $x$ b $$y$$", Recognizers.inlineDollarMath());

        for (String token : stash.tokens().keySet()) {
            assertTrue(token.chars().allMatch(Character::isLetterOrDigit), token);
        }
    }

    @Test
    void restore_unknownTokenIsLeftVerbatimAndReported() {
        RegionStash stash = new RegionStash("MATH");
        String stashed = stash.stash("see $x$ here", Recognizers.inlineDollarMath());
        String forged = stashed.replace("N0" + RegionStash.TOKEN_END, "N7" + RegionStash.TOKEN_END);

        String restored = stash.restore(forged);

        assertEquals(forged, restored);
        assertEquals(1, stash.unresolvedTokens().size());
    }

    @Test
    void restore_ignoresTokensOfAnotherStash() {
        RegionStash math = new RegionStash("MATH");
        RegionStash other = new RegionStash("MATH");
        String stashed = math.stash("a $x$ b", Recognizers.inlineDollarMath());

        assertEquals(stashed, other.restore(stashed));
        assertNotEquals(stashed, math.restore(stashed));
    }

    @Test
    void isToken_recognizesOnlyOwnTokens() {
        RegionStash stash = new RegionStash("BLOCK");
        String stashed = stash.stash("<pre>x</pre>", Recognizers.opaqueBlocks());

        assertTrue(stash.isToken(stashed));
        assertTrue(stash.isToken("  " + stashed + "\n"));
        assertFalse(stash.isToken("plain"));
        assertEquals("<pre>x</pre>", stash.originalOf(stashed).orElseThrow());
    }

    @Test
    void restore_regionEnclosingEarlierTokenComesBackWhole() {
        RegionStash stash = new RegionStash("MATH");
        String input = "A $\\text{see \\(x\\)}$ b";
        String stashed = input;
        for (RegionRecognizer recognizer : Recognizers.math()) {
            stashed = stash.stash(stashed, recognizer);
        }

        assertFalse(stashed.contains("$"));
        assertEquals(input, stash.restore(stashed));
        assertTrue(stash.unresolvedTokens().isEmpty());
    }

    @Test
    void stripTokens_removesPlaceholdersOfAnyStash() {
        RegionStash stash = new RegionStash("MATH");
        String stashed = stash.stash("Title $x$", Recognizers.inlineDollarMath());

        assertEquals("Title  ", RegionStash.stripTokens(stashed));
    }
}
