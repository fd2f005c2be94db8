package com.williamcallahan.notewiki.service.tex;

import com.williamcallahan.notewiki.domain.render.Span;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Replaces protected regions with placeholder tokens and puts them back later.
 *
 * <p>Tokens are letters and digits only, carry a per-instance nonce and a terminator, so no
 * pass that runs between {@link #stash} and {@link #restore} can split or alter them, and two
 * stashes never mistake each other's tokens. One instance may be fed several recognizers in
 * sequence; a region that encloses a token minted earlier by the same instance is recorded with
 * that token expanded back to its source, so one restore brings back the full original. Separate
 * stashes layered on top of each other must be restored in reverse order.</p>
 */
public final class RegionStash {

    private static final Logger logger = LoggerFactory.getLogger(RegionStash.class);

    private static final String TOKEN_START = "ZQ";
    static final String TOKEN_END = "QZ";
    private static final String CLOSING_PUNCTUATION = ")]}.,;:!?";
    private static final Pattern ANY_TOKEN = Pattern.compile(TOKEN_START + "[A-Z]+N\\d+" + TOKEN_END);

    private final String name;
    private final Map<String, String> originals = new LinkedHashMap<>();
    private final List<String> unresolvedTokens = new ArrayList<>();
    private String nonce;

    /**
     * Creates an empty stash.
     *
     * @param name uppercase letters identifying what this stash protects, e.g. {@code MATH}
     */
    public RegionStash(String name) {
        this.name = name.toUpperCase(Locale.ROOT).replaceAll("[^A-Z]", "");
        this.nonce = newNonce();
    }

    /**
     * Replaces every non-overlapping region found by {@code recognizer} with a fresh token.
     *
     * @param text text to rewrite
     * @param recognizer finds the regions to protect
     * @return the rewritten text
     */
    public String stash(String text, RegionRecognizer recognizer) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        while (originals.isEmpty() && text.contains(tokenPrefix())) {
            nonce = newNonce();
        }
        StringBuilder output = new StringBuilder(text.length());
        int cursor = 0;
        Optional<Span> region = recognizer.findNext(text, cursor);
        while (region.isPresent()) {
            Span span = region.get();
            output.append(text, cursor, span.start());
            String token = mintToken();
            originals.put(token, expandOwnTokens(span.content()));
            output.append(token);
            cursor = span.end();
            region = cursor < text.length() ? recognizer.findNext(text, cursor) : Optional.empty();
        }
        output.append(text, cursor, text.length());
        logger.debug("Stashed {} {} region(s) so far", originals.size(), recognizer.label());
        return output.toString();
    }

    /**
     * Replaces every token of this stash with its original text, repairing the spacing around it.
     *
     * <p>A space is inserted before the original when the preceding character is a letter, digit or
     * closing punctuation and the original does not start with whitespace; a space is inserted after
     * it when the following character is a letter or digit and the original does not end with
     * whitespace. A token with no recorded original is left verbatim and reported through
     * {@link #unresolvedTokens()}.</p>
     *
     * @param text text containing tokens
     * @return the restored text
     */
    public String restore(String text) {
        if (text == null || text.isEmpty() || originals.isEmpty() && !text.contains(tokenPrefix())) {
            return text;
        }
        String prefix = tokenPrefix();
        StringBuilder output = new StringBuilder(text.length() + 64);
        int cursor = 0;
        int tokenStart = text.indexOf(prefix);
        while (tokenStart >= 0) {
            int tokenEnd = text.indexOf(TOKEN_END, tokenStart + prefix.length());
            if (tokenEnd < 0) {
                break;
            }
            tokenEnd += TOKEN_END.length();
            String token = text.substring(tokenStart, tokenEnd);
            output.append(text, cursor, tokenStart);
            String original = originals.get(token);
            if (original == null) {
                logger.warn("No recorded original for placeholder {}; leaving it in place", token);
                unresolvedTokens.add(token);
                output.append(token);
            } else {
                appendWithSpacing(output, original, tokenEnd < text.length() ? text.charAt(tokenEnd) : '\n');
            }
            cursor = tokenEnd;
            tokenStart = text.indexOf(prefix, cursor);
        }
        output.append(text, cursor, text.length());
        return output.toString();
    }

    private String expandOwnTokens(String content) {
        if (originals.isEmpty() || !content.contains(tokenPrefix())) {
            return content;
        }
        String expanded = content;
        for (Map.Entry<String, String> entry : originals.entrySet()) {
            expanded = expanded.replace(entry.getKey(), entry.getValue());
        }
        return expanded;
    }

    private static void appendWithSpacing(StringBuilder output, String original, char following) {
        if (output.length() > 0 && !original.isEmpty() && !Character.isWhitespace(original.charAt(0))) {
            char preceding = output.charAt(output.length() - 1);
            if (Character.isLetterOrDigit(preceding) || CLOSING_PUNCTUATION.indexOf(preceding) >= 0) {
                output.append(' ');
            }
        }
        output.append(original);
        if (Character.isLetterOrDigit(following)
            && !original.isEmpty()
            && !Character.isWhitespace(original.charAt(original.length() - 1))) {
            output.append(' ');
        }
    }

    /**
     * Returns the tokens minted so far, mapped to the original text, in minting order.
     */
    public Map<String, String> tokens() {
        return Collections.unmodifiableMap(originals);
    }

    /**
     * Returns tokens met during {@link #restore} that had no recorded original.
     */
    public List<String> unresolvedTokens() {
        return List.copyOf(unresolvedTokens);
    }

    /**
     * Checks whether {@code text} is exactly one token of this stash, ignoring surrounding whitespace.
     */
    public boolean isToken(String text) {
        return text != null && originals.containsKey(text.strip());
    }

    /**
     * Returns the original text recorded for {@code token}, if any.
     */
    public Optional<String> originalOf(String token) {
        return Optional.ofNullable(originals.get(token));
    }

    /**
     * Removes the tokens of every stash from {@code text}, for derived values such as anchor ids
     * that must not carry placeholders.
     */
    public static String stripTokens(String text) {
        return text == null ? "" : ANY_TOKEN.matcher(text).replaceAll(" ");
    }

    private String mintToken() {
        return tokenPrefix() + originals.size() + TOKEN_END;
    }

    private String tokenPrefix() {
        return TOKEN_START + name + nonce + "N";
    }

    private static String newNonce() {
        StringBuilder letters = new StringBuilder(8);
        for (char hex : UUID.randomUUID().toString().replace("-", "").substring(0, 8).toCharArray()) {
            letters.append((char) ('A' + Character.digit(hex, 16)));
        }
        return letters.toString();
    }
}
