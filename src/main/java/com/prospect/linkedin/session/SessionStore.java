package com.prospect.linkedin.session;

import com.prospect.linkedin.model.SessionPayload;

import java.util.Optional;

/**
 * Keyed by identity hash. Implementations never return an expired payload.
 */
public interface SessionStore {

    void save(String identityHash, String credentialId, SessionPayload payload);

    Optional<SessionPayload> load(String identityHash);

    /**
     * Safe to call when nothing is stored.
     */
    void invalidate(String identityHash);
}
