package com.williamcallahan.notewiki.service.tex;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests balanced group scanning with nesting and escapes.
 */
class DelimiterScannerTest {

    @Test
    void braces_nestedGroup_returnsOuterSpan() {
        String text = "\\textbf{a {b} c} tail";

        ScanResult result = DelimiterScanner.braces(text, 7);

        ScanResult.Balanced balanced = assertInstanceOf(ScanResult.Balanced.class, result);
        assertEquals("a {b} c", balanced.span().content());
        assertEquals(7, balanced.span().start());
        assertEquals(text.indexOf(" tail"), balanced.span().end());
    }

    @Test
    void braces_escapedBracesDoNotChangeDepth() {
        ScanResult result = DelimiterScanner.braces("{\\{ x \\}}", 0);

        ScanResult.Balanced balanced = assertInstanceOf(ScanResult.Balanced.class, result);
        assertEquals("\\{ x \\}", balanced.span().content());
    }

    @Test
    void braces_neverClosed_isUnbalancedAtOpening() {
        ScanResult result = DelimiterScanner.braces("x {a {b}", 2);

        ScanResult.Unbalanced unbalanced = assertInstanceOf(ScanResult.Unbalanced.class, result);
        assertEquals(2, unbalanced.openIndex());
    }

    @Test
    void brackets_wrongOpeningCharacter_isUnbalanced() {
        assertInstanceOf(ScanResult.Unbalanced.class, DelimiterScanner.brackets("{x}", 0));
    }

    @Test
    void balancedSpans_haveEqualUnescapedOpenAndCloseCounts() {
        List<String> inputs = List.of(
            "{}",
            "{a{b{c}d}e}",
            "{\\} {x} \\{}",
            "{{{{{{deep}}}}}}",
            "{$\\{a\\}$ and {b}}"
        );
        for (String input : inputs) {
            ScanResult result = DelimiterScanner.braces(input, 0);
            ScanResult.Balanced balanced = assertInstanceOf(ScanResult.Balanced.class, result, input);
            String covered = input.substring(balanced.span().start(), balanced.span().end());
            assertEquals(count(covered, '{'), count(covered, '}'), input);
        }
    }

    @Test
    void isEscaped_countsBackslashRuns() {
        assertTrue(DelimiterScanner.isEscaped("\\$", 1));
        assertFalse(DelimiterScanner.isEscaped("\\\\$", 2));
        assertTrue(DelimiterScanner.isEscaped("\\\\\\$", 3));
        assertFalse(DelimiterScanner.isEscaped("$", 0));
    }

    @Test
    void skipWhitespace_stopsAtFirstNonBlank() {
        assertEquals(3, DelimiterScanner.skipWhitespace("  \n{", 0));
        assertEquals(4, DelimiterScanner.skipWhitespace("abc ", 4));
    }

    private static int count(String text, char delimiter) {
        int count = 0;
        for (int index = 0; index < text.length(); index++) {
            if (text.charAt(index) == delimiter && !DelimiterScanner.isEscaped(text, index)) {
                count++;
            }
        }
        return count;
    }
}
