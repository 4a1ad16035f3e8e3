package com.prospect.linkedin.utils;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

/**
 * One-way key for an account email. Used wherever an account must be referenced without its plaintext.
 */
public final class IdentityHash {

    private static final int LOG_PREFIX_LENGTH = 8;

    private IdentityHash() {}

    public static String of(String email) {
        if (email == null) {
            throw new IllegalArgumentException("email must not be null");
        }
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] digest = md.digest(normalize(email).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public static String normalize(String email) {
        return email.trim().toLowerCase(Locale.ROOT);
    }

    /** First characters of a hash, safe to print. */
    public static String shorten(String hash) {
        if (hash == null) {
            return "null";
        }
        return hash.length() <= LOG_PREFIX_LENGTH ? hash : hash.substring(0, LOG_PREFIX_LENGTH);
    }
}
