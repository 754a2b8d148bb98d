package com.williamcallahan.contextaggregator.support;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * SHA-256 hashing for chunk fingerprints and request cache keys.
 */
@Component
public class ContentHasher {
    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");

    /**
     * Generates a SHA-256 hash for any text content.
     *
     * @param text the text to hash
     * @return lower-case hexadecimal digest
     */
    public String sha256(String text) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] hash = md.digest(text.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder(hash.length * 2);
            for (byte b : hash) sb.append(String.format("%02x", b));
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }

    /**
     * Fingerprints chunk content so that whitespace-only differences hash identically.
     *
     * @param content chunk text
     * @return hash of the trimmed content with whitespace runs collapsed to one space
     */
    public String fingerprint(String content) {
        return sha256(normalizeWhitespace(content));
    }

    /**
     * Trims text and collapses every whitespace run to a single space.
     *
     * @param text raw text, null treated as empty
     * @return normalized text
     */
    public static String normalizeWhitespace(String text) {
        if (text == null) {
            return "";
        }
        return WHITESPACE_RUN.matcher(text.trim()).replaceAll(" ");
    }
}
