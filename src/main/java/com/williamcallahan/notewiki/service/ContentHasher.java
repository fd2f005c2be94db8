package com.williamcallahan.notewiki.service;

import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

@Component
public class ContentHasher {

    /**
     * Generates SHA-256 hash for any text content.
     *
     * @param text The text to hash
     * @return Hexadecimal string representation of the hash
     */
    public String sha256(String text) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] hash = md.digest(text.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder();
            for (byte b : hash) sb.append(String.format("%02x", b));
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }

    /**
     * Builds the render cache key of a note. A new corpus version invalidates every earlier key,
     * since link titles may have changed.
     *
     * @param noteId note identifier
     * @param source note source text
     * @param corpusVersion version of the corpus index the note is rendered against
     * @return cache key
     */
    public String renderKey(String noteId, String source, long corpusVersion) {
        return noteId + "@" + corpusVersion + ":" + sha256(source);
    }
}
