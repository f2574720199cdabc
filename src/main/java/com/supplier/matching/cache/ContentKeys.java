package com.supplier.matching.cache;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 content keys for memoized features. A key covers both the input value and
 * the version of the function applied to it, so changing the rule set or the hash
 * algorithm never serves stale entries.
 */
public final class ContentKeys {

    private ContentKeys() {
    }

    /**
     * Key for a normalized name.
     *
     * @param rulesFingerprint fingerprint of the normalization rule set
     * @param rawName          name as supplied
     */
    public static String forName(String rulesFingerprint, String rawName) {
        return sha256("name\u0000" + rulesFingerprint + "\u0000" + rawName);
    }

    /**
     * Key for an image hash.
     *
     * @param hasherVersion version of the perceptual hasher
     * @param imageRef      image reference as supplied
     */
    public static String forImage(String hasherVersion, String imageRef) {
        return sha256("image\u0000" + hasherVersion + "\u0000" + imageRef);
    }

    static String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
