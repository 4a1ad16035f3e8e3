package com.prospect.linkedin.utils;

import com.prospect.linkedin.exception.ConfigurationException;
import com.prospect.linkedin.exception.DecryptionException;
import com.prospect.linkedin.model.EncryptedValue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.HexFormat;

/**
 * AES-256-GCM for credential and session payloads.
 * <p>
 * The key is read once, when the bean is built. A missing or malformed key aborts startup.
 */
@Slf4j
@Component
public class AesGcmCipher {

    private static final String ALG = "AES/GCM/NoPadding";
    private static final int KEY_BYTES = 32;
    private static final int IV_BYTES = 12;
    private static final int TAG_BYTES = 16;
    private static final HexFormat HEX = HexFormat.of();

    private final SecretKey key;
    private final SecureRandom random = new SecureRandom();

    public AesGcmCipher(@Value("${linkedin.credential.key:}") String keyHex) {
        this.key = parseKey(keyHex);
        log.info("LinkedIn credential encryption initialized");
    }

    private static SecretKey parseKey(String keyHex) {
        if (keyHex == null || keyHex.isBlank()) {
            throw new ConfigurationException("linkedin.credential.key is not set");
        }
        String trimmed = keyHex.trim();
        if (trimmed.length() != KEY_BYTES * 2) {
            throw new ConfigurationException(
                    "linkedin.credential.key must be " + KEY_BYTES * 2 + " hex characters (" + KEY_BYTES + " bytes)");
        }
        try {
            return new SecretKeySpec(HEX.parseHex(trimmed), "AES");
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("linkedin.credential.key is not valid hex", e);
        }
    }

    public EncryptedValue encrypt(String plaintext) {
        byte[] iv = new byte[IV_BYTES];
        random.nextBytes(iv);
        try {
            Cipher c = Cipher.getInstance(ALG);
            c.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_BYTES * 8, iv));
            byte[] sealed = c.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));

            // JCE appends the tag to the ciphertext
            byte[] ct = Arrays.copyOfRange(sealed, 0, sealed.length - TAG_BYTES);
            byte[] tag = Arrays.copyOfRange(sealed, sealed.length - TAG_BYTES, sealed.length);

            return EncryptedValue.builder()
                    .ciphertext(HEX.formatHex(ct))
                    .iv(HEX.formatHex(iv))
                    .authTag(HEX.formatHex(tag))
                    .build();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES-GCM encryption failed", e);
        }
    }

    /**
     * @throws DecryptionException if any part was tampered with or is malformed
     */
    public String decrypt(EncryptedValue encrypted) {
        if (encrypted == null || encrypted.getCiphertext() == null
                || encrypted.getIv() == null || encrypted.getAuthTag() == null) {
            throw new DecryptionException("Encrypted value is incomplete");
        }
        byte[] ct;
        byte[] iv;
        byte[] tag;
        try {
            ct = HEX.parseHex(encrypted.getCiphertext());
            iv = HEX.parseHex(encrypted.getIv());
            tag = HEX.parseHex(encrypted.getAuthTag());
        } catch (IllegalArgumentException e) {
            throw new DecryptionException("Encrypted value is not valid hex", e);
        }
        if (iv.length != IV_BYTES || tag.length != TAG_BYTES) {
            throw new DecryptionException("Invalid nonce or authentication tag length");
        }

        byte[] sealed = new byte[ct.length + TAG_BYTES];
        System.arraycopy(ct, 0, sealed, 0, ct.length);
        System.arraycopy(tag, 0, sealed, ct.length, TAG_BYTES);

        try {
            Cipher c = Cipher.getInstance(ALG);
            c.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_BYTES * 8, iv));
            return new String(c.doFinal(sealed), StandardCharsets.UTF_8);
        } catch (AEADBadTagException e) {
            throw new DecryptionException("Authentication tag mismatch", e);
        } catch (GeneralSecurityException e) {
            throw new DecryptionException("AES-GCM decryption failed", e);
        }
    }
}
