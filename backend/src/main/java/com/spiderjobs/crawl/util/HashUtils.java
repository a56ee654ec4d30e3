package com.spiderjobs.crawl.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Locale;

public final class HashUtils {
    private HashUtils() {
    }

    public static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(value.getBytes(StandardCharsets.UTF_8));
            StringBuilder out = new StringBuilder();
            for (byte b : hash) {
                out.append(String.format("%02x", b));
            }
            return out.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }

    /**
     * Fingerprint of an already normalized URL.
     */
    public static String urlFingerprint(String normalizedUrl) {
        return sha256Hex(normalizedUrl);
    }

    /**
     * Fingerprint of a listing's business key. Fields are trimmed, whitespace collapsed and
     * lower-cased so cosmetic differences between pages do not defeat deduplication.
     */
    public static String contentFingerprint(String title, String company, String canonicalLink) {
        return sha256Hex(canonical(title) + "|" + canonical(company) + "|" + canonical(canonicalLink));
    }

    private static String canonical(String value) {
        if (value == null) {
            return "";
        }
        return value.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }
}
