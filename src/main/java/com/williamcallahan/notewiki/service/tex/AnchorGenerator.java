package com.williamcallahan.notewiki.service.tex;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Derives unique heading ids from heading markup.
 */
public final class AnchorGenerator {

    private static final Pattern TAG = Pattern.compile("<[^>]+>");
    private static final Pattern ENTITY = Pattern.compile("&(?:[a-zA-Z]+|#\\d+);");
    private static final Pattern COMMAND = Pattern.compile("\\\\[a-zA-Z]+");
    private static final Pattern DISALLOWED = Pattern.compile("[^a-zA-Z0-9\\s-]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern HYPHEN_RUN = Pattern.compile("-{2,}");

    private final Set<String> issued = new HashSet<>();
    private int headingCount;

    /**
     * Returns a fresh id for the next heading.
     *
     * <p>Tags, entities, placeholders and backslash commands are dropped, then every character other
     * than letters, digits, whitespace and hyphens; the rest is lowercased and joined with hyphens.
     * An empty result falls back to {@code section-N} where N is the heading's position; a repeated
     * id gets a {@code -2}, {@code -3}, ... suffix.</p>
     */
    public String next(String title) {
        headingCount++;
        String base = slug(title);
        if (base.isEmpty()) {
            base = "section-" + headingCount;
        }
        String candidate = base;
        int suffix = 2;
        while (!issued.add(candidate)) {
            candidate = base + "-" + suffix++;
        }
        return candidate;
    }

    /**
     * Sanitizes {@code title} into an id fragment without uniqueness bookkeeping.
     */
    public static String slug(String title) {
        String cleaned = RegionStash.stripTokens(title);
        cleaned = TAG.matcher(cleaned).replaceAll("");
        cleaned = ENTITY.matcher(cleaned).replaceAll("");
        cleaned = COMMAND.matcher(cleaned).replaceAll("");
        cleaned = DISALLOWED.matcher(cleaned).replaceAll("");
        cleaned = WHITESPACE.matcher(cleaned.trim().toLowerCase(Locale.ROOT)).replaceAll("-");
        cleaned = HYPHEN_RUN.matcher(cleaned).replaceAll("-");
        return stripHyphens(cleaned);
    }

    private static String stripHyphens(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && value.charAt(start) == '-') {
            start++;
        }
        while (end > start && value.charAt(end - 1) == '-') {
            end--;
        }
        return value.substring(start, end);
    }
}
