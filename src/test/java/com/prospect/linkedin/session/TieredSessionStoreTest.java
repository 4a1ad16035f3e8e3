package com.prospect.linkedin.session;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.prospect.linkedin.model.SessionCookie;
import com.prospect.linkedin.model.SessionPayload;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TieredSessionStoreTest {

    private static final String HASH = "a".repeat(64);
    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");

    @Mock
    private JpaSessionStore durable;

    private CaffeineSessionStore ephemeral;
    private TieredSessionStore store;

    @BeforeEach
    void setUp() {
        ephemeral = new CaffeineSessionStore(Caffeine.newBuilder().build(), Clock.fixed(NOW, ZoneOffset.UTC));
        store = new TieredSessionStore(ephemeral, durable);
    }

    private static SessionPayload payloadExpiringAt(Instant expiresAt) {
        return SessionPayload.builder()
                .cookies(List.of(SessionCookie.builder().name("li_at").value("v").domain(".linkedin.com").build()))
                .userAgent("Mozilla/5.0")
                .savedAt(NOW.minusSeconds(60))
                .expiresAt(expiresAt)
                .build();
    }

    @Nested
    @DisplayName("save / load")
    class SaveLoad {

        @Test
        void writesThroughToBothTiers() {
            SessionPayload payload = payloadExpiringAt(NOW.plusSeconds(3600));

            store.save(HASH, "cred-1", payload);

            verify(durable).save(HASH, "cred-1", payload);
            assertThat(ephemeral.load(HASH)).contains(payload);
        }

        @Test
        void ephemeralHitSkipsDurableTier() {
            SessionPayload payload = payloadExpiringAt(NOW.plusSeconds(3600));
            store.save(HASH, "cred-1", payload);

            assertThat(store.load(HASH)).contains(payload);
            verify(durable, never()).load(anyString());
        }

        @Test
        void durableHitRepopulatesEphemeralTier() {
            SessionPayload payload = payloadExpiringAt(NOW.plusSeconds(3600));
            when(durable.load(HASH)).thenReturn(Optional.of(payload));

            assertThat(store.load(HASH)).contains(payload);
            assertThat(ephemeral.load(HASH)).contains(payload);

            store.load(HASH);
            verify(durable, times(1)).load(HASH);
        }

        @Test
        void expiredEphemeralEntryIsNeverReturned() {
            ephemeral.save(HASH, "cred-1", payloadExpiringAt(NOW.minusSeconds(1)));
            when(durable.load(HASH)).thenReturn(Optional.empty());

            assertThat(store.load(HASH)).isEmpty();
        }

        @Test
        void missInBothTiersIsEmpty() {
            when(durable.load(HASH)).thenReturn(Optional.empty());

            assertThat(store.load(HASH)).isEmpty();
        }
    }

    @Nested
    @DisplayName("invalidate")
    class Invalidate {

        @Test
        void clearsBothTiers() {
            store.save(HASH, "cred-1", payloadExpiringAt(NOW.plusSeconds(3600)));

            store.invalidate(HASH);

            assertThat(ephemeral.load(HASH)).isEmpty();
            verify(durable).invalidate(HASH);
        }

        @Test
        void repeatedInvalidateIsHarmless() {
            store.invalidate(HASH);
            store.invalidate(HASH);

            when(durable.load(HASH)).thenReturn(Optional.empty());
            assertThat(store.load(HASH)).isEmpty();
            verify(durable, times(2)).invalidate(HASH);
        }
    }
}
