package com.prospect.linkedin.session;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.prospect.linkedin.entity.BrowserSession;
import com.prospect.linkedin.entity.LinkedInCredential;
import com.prospect.linkedin.exception.DecryptionException;
import com.prospect.linkedin.exception.NoCredentialsException;
import com.prospect.linkedin.model.EncryptedValue;
import com.prospect.linkedin.model.SessionPayload;
import com.prospect.linkedin.repository.BrowserSessionRepository;
import com.prospect.linkedin.repository.LinkedInCredentialRepository;
import com.prospect.linkedin.utils.AesGcmCipher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Durable tier. The cookie jar is serialized to JSON and sealed with AES-GCM before it is written.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JpaSessionStore implements SessionStore {

    private final BrowserSessionRepository sessionRepository;
    private final LinkedInCredentialRepository credentialRepository;
    private final AesGcmCipher cipher;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    @Transactional
    public void save(String identityHash, String credentialId, SessionPayload payload) {
        LinkedInCredential credential = credentialRepository.findById(credentialId)
                .orElseThrow(() -> new NoCredentialsException("Credential " + credentialId + " not found"));

        EncryptedValue sealed = cipher.encrypt(toJson(payload));

        // the new row becomes the only current session
        sessionRepository.invalidateAllForCredential(credential.getId());
        sessionRepository.save(BrowserSession.builder()
                .credential(credential)
                .encryptedCookies(sealed.getCiphertext())
                .encryptionIv(sealed.getIv())
                .encryptionAuthTag(sealed.getAuthTag())
                .userAgent(payload.getUserAgent())
                .createdAt(payload.getSavedAt() != null ? payload.getSavedAt() : clock.instant())
                .expiresAt(payload.getExpiresAt())
                .build());
    }

    @Override
    @Transactional
    public Optional<SessionPayload> load(String identityHash) {
        Instant now = clock.instant();
        Optional<BrowserSession> row = credentialRepository.findFirstByEmailHashOrderByUpdatedAtDesc(identityHash)
                .flatMap(c -> sessionRepository
                        .findFirstByCredential_IdAndValidTrueAndExpiresAtAfterOrderByCreatedAtDesc(c.getId(), now));
        if (row.isEmpty()) {
            return Optional.empty();
        }

        BrowserSession session = row.get();
        String json = cipher.decrypt(new EncryptedValue(
                session.getEncryptedCookies(), session.getEncryptionIv(), session.getEncryptionAuthTag()));
        SessionPayload payload = fromJson(json);
        if (payload.isExpired(now)) {
            return Optional.empty();
        }

        session.setLastUsedAt(now);
        sessionRepository.save(session);
        return Optional.of(payload);
    }

    @Override
    @Transactional
    public void invalidate(String identityHash) {
        // every user that linked this account, not just the most recent one
        for (LinkedInCredential c : credentialRepository.findAllByEmailHash(identityHash)) {
            int updated = sessionRepository.invalidateAllForCredential(c.getId());
            log.debug("Invalidated {} durable session(s) for credential {}", updated, c.getId());
        }
    }

    private String toJson(SessionPayload payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Session payload is not serializable", e);
        }
    }

    private SessionPayload fromJson(String json) {
        try {
            return objectMapper.readValue(json, SessionPayload.class);
        } catch (JsonProcessingException e) {
            throw new DecryptionException("Stored session payload is malformed", e);
        }
    }
}
