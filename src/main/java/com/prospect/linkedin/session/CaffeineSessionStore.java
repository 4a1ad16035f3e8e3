package com.prospect.linkedin.session;

import com.github.benmanes.caffeine.cache.Cache;
import com.prospect.linkedin.model.SessionPayload;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Optional;

/**
 * In-process tier. Lost on restart.
 */
@Component
public class CaffeineSessionStore implements SessionStore {

    private final Cache<String, SessionPayload> cache;
    private final Clock clock;

    public CaffeineSessionStore(@Qualifier("sessionCache") Cache<String, SessionPayload> cache, Clock clock) {
        this.cache = cache;
        this.clock = clock;
    }

    @Override
    public void save(String identityHash, String credentialId, SessionPayload payload) {
        cache.put(identityHash, payload);
    }

    @Override
    public Optional<SessionPayload> load(String identityHash) {
        SessionPayload payload = cache.getIfPresent(identityHash);
        if (payload == null) {
            return Optional.empty();
        }
        if (payload.isExpired(clock.instant())) {
            cache.invalidate(identityHash);
            return Optional.empty();
        }
        return Optional.of(payload);
    }

    @Override
    public void invalidate(String identityHash) {
        cache.invalidate(identityHash);
    }
}
