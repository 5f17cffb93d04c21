package org.abitware.newsfinder.session;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Locale;

/** Short fingerprints standing in for a query or source name in navigation payloads. */
public final class SessionKeys {

    /** Hex characters kept from the digest: a 32-bit fingerprint */
    public static final int KEY_LENGTH = 8;

    private SessionKeys() {}

    /** Lowercase, collapse whitespace runs to one space, trim. */
    public static String normalize(String payload) {
        if (payload == null) return "";
        return payload.toLowerCase(Locale.ROOT).replaceAll("\\s+", " ").trim();
    }

    /**
     * First {@value #KEY_LENGTH} hex characters of the SHA-1 of the normalized payload.
     * Different payloads can share a key.
     */
    public static String fingerprint(String payload) {
        try {
            MessageDigest sha1 = MessageDigest.getInstance("SHA-1");
            byte[] digest = sha1.digest(normalize(payload).getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder(KEY_LENGTH);
            for (int i = 0; sb.length() < KEY_LENGTH; i++) {
                sb.append(String.format("%02x", digest[i]));
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 not available", e);
        }
    }
}
