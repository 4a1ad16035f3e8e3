package com.prospect.linkedin.session;

import com.prospect.linkedin.model.SessionPayload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Write-through to both tiers; read-through from the durable tier on an ephemeral miss.
 */
@Slf4j
@Primary
@Component
public class TieredSessionStore implements SessionStore {

    private final SessionStore ephemeral;
    private final SessionStore durable;

    public TieredSessionStore(CaffeineSessionStore ephemeral, JpaSessionStore durable) {
        this.ephemeral = ephemeral;
        this.durable = durable;
    }

    @Override
    public void save(String identityHash, String credentialId, SessionPayload payload) {
        durable.save(identityHash, credentialId, payload);
        ephemeral.save(identityHash, credentialId, payload);
    }

    @Override
    public Optional<SessionPayload> load(String identityHash) {
        Optional<SessionPayload> hot = ephemeral.load(identityHash);
        if (hot.isPresent()) {
            return hot;
        }

        Optional<SessionPayload> cold = durable.load(identityHash);
        cold.ifPresent(payload -> {
            log.debug("Repopulating ephemeral session tier from durable store");
            ephemeral.save(identityHash, null, payload);
        });
        return cold;
    }

    @Override
    public void invalidate(String identityHash) {
        ephemeral.invalidate(identityHash);
        durable.invalidate(identityHash);
    }
}
