package com.prospect.linkedin.service;

import com.prospect.linkedin.entity.LinkedInCredential;
import com.prospect.linkedin.exception.NoCredentialsException;
import com.prospect.linkedin.exception.ValidationException;
import com.prospect.linkedin.logservice.ScrapeFlowLogger;
import com.prospect.linkedin.model.DecryptedCredential;
import com.prospect.linkedin.model.EncryptedValue;
import com.prospect.linkedin.repository.LinkedInCredentialRepository;
import com.prospect.linkedin.session.SessionStore;
import com.prospect.linkedin.utils.AesGcmCipher;
import com.prospect.linkedin.utils.IdentityHash;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Stores LinkedIn logins encrypted at rest. Only ciphertext, nonce, tag and the identity hash reach the database.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CredentialVault {

    private final LinkedInCredentialRepository credentialRepository;
    private final AesGcmCipher cipher;
    private final ScrapeFlowLogger flowLogger;
    private final SessionStore sessionStore;
    private final Clock clock;

    /**
     * Encrypt and upsert the credential of a user. Re-linking reactivates a revoked credential;
     * linking a different email drops every session of the previous account.
     *
     * @return the stored credential row (still encrypted)
     */
    @Transactional
    public LinkedInCredential store(String userId, String email, String password) {
        if (isBlank(userId) || isBlank(email) || password == null) {
            throw new ValidationException("userId, email and password are required");
        }

        String normalizedEmail = IdentityHash.normalize(email);
        String emailHash = IdentityHash.of(email);
        EncryptedValue encEmail = cipher.encrypt(normalizedEmail);
        EncryptedValue encPassword = cipher.encrypt(password);
        Instant now = clock.instant();

        LinkedInCredential credential = credentialRepository.findByUserId(userId)
                .orElseGet(() -> LinkedInCredential.builder().userId(userId).build());

        String previousHash = credential.getEmailHash();
        if (previousHash != null && !previousHash.equals(emailHash)) {
            // sessions of the previously linked account must not be served under the new identity
            sessionStore.invalidate(previousHash);
            log.info("User {} re-linked to a different LinkedIn account, dropped sessions of {}",
                    userId, IdentityHash.shorten(previousHash));
        }

        credential.setEmailHash(emailHash);
        credential.setEncryptedEmail(encEmail.getCiphertext());
        credential.setEmailIv(encEmail.getIv());
        credential.setEmailAuthTag(encEmail.getAuthTag());
        credential.setEncryptedPassword(encPassword.getCiphertext());
        credential.setPasswordIv(encPassword.getIv());
        credential.setPasswordAuthTag(encPassword.getAuthTag());
        credential.setActive(true);
        credential.setLastValidatedAt(now);

        LinkedInCredential saved = credentialRepository.save(credential);
        flowLogger.logAuthAttempt(userId, emailHash, true, "Credentials stored");
        return saved;
    }

    /**
     * Decrypt the active credential of a user.
     *
     * @throws NoCredentialsException if the user has no active credential
     * @throws com.prospect.linkedin.exception.DecryptionException if either field fails tag verification
     */
    @Transactional(readOnly = true)
    public DecryptedCredential retrieve(String userId) {
        LinkedInCredential credential = findActive(userId)
                .orElseThrow(NoCredentialsException::new);

        String email = cipher.decrypt(new EncryptedValue(
                credential.getEncryptedEmail(), credential.getEmailIv(), credential.getEmailAuthTag()));
        String password = cipher.decrypt(new EncryptedValue(
                credential.getEncryptedPassword(), credential.getPasswordIv(), credential.getPasswordAuthTag()));

        return new DecryptedCredential(credential.getId(), email, password);
    }

    @Transactional(readOnly = true)
    public Optional<LinkedInCredential> findActive(String userId) {
        if (isBlank(userId)) {
            return Optional.empty();
        }
        return credentialRepository.findByUserIdAndActiveTrue(userId);
    }

    /**
     * Revoke without deleting and drop every cached session of the account.
     * Returns false when the user never linked an account.
     */
    @Transactional
    public boolean deactivate(String userId) {
        return credentialRepository.findByUserId(userId)
                .map(credential -> {
                    credential.setActive(false);
                    credentialRepository.save(credential);
                    sessionStore.invalidate(credential.getEmailHash());
                    log.info("Credentials deactivated for user {}", userId);
                    return true;
                })
                .orElse(false);
    }

    public String hash(String email) {
        return IdentityHash.of(email);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
