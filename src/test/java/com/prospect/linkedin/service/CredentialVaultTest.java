package com.prospect.linkedin.service;

import com.prospect.linkedin.entity.LinkedInCredential;
import com.prospect.linkedin.exception.DecryptionException;
import com.prospect.linkedin.exception.NoCredentialsException;
import com.prospect.linkedin.exception.ValidationException;
import com.prospect.linkedin.logservice.ScrapeFlowLogger;
import com.prospect.linkedin.model.DecryptedCredential;
import com.prospect.linkedin.repository.LinkedInCredentialRepository;
import com.prospect.linkedin.session.SessionStore;
import com.prospect.linkedin.utils.AesGcmCipher;
import com.prospect.linkedin.utils.IdentityHash;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CredentialVaultTest {

    private static final String KEY = "000102030405060708090a0b0c0d0e0f101112131415161718191a1b1c1d1e1f";
    private static final String USER = "user-1";
    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");

    @Mock
    private LinkedInCredentialRepository credentialRepository;
    @Mock
    private ScrapeFlowLogger flowLogger;
    @Mock
    private SessionStore sessionStore;

    private CredentialVault vault;

    @BeforeEach
    void setUp() {
        vault = new CredentialVault(credentialRepository, new AesGcmCipher(KEY), flowLogger, sessionStore,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private LinkedInCredential storeAndCapture(String email, String password) {
        when(credentialRepository.findByUserId(USER)).thenReturn(Optional.empty());
        when(credentialRepository.save(any(LinkedInCredential.class))).thenAnswer(inv -> {
            LinkedInCredential c = inv.getArgument(0);
            c.setId("cred-1");
            return c;
        });
        vault.store(USER, email, password);

        ArgumentCaptor<LinkedInCredential> captor = ArgumentCaptor.forClass(LinkedInCredential.class);
        verify(credentialRepository).save(captor.capture());
        return captor.getValue();
    }

    @Nested
    @DisplayName("store")
    class Store {

        @Test
        void persistsOnlyCiphertextAndHash() {
            LinkedInCredential saved = storeAndCapture(" Jane@Example.com ", "s3cret!");

            assertThat(saved.getEmailHash()).isEqualTo(IdentityHash.of("jane@example.com"));
            assertThat(saved.getEncryptedEmail()).doesNotContain("jane");
            assertThat(saved.getEncryptedPassword()).isNotEqualTo("s3cret!");
            assertThat(saved.getEmailIv()).isNotEqualTo(saved.getPasswordIv());
            assertThat(saved.isActive()).isTrue();
            assertThat(saved.getLastValidatedAt()).isEqualTo(NOW);
        }

        @Test
        void relinkReactivatesExistingRow() {
            LinkedInCredential existing = LinkedInCredential.builder().id("cred-1").userId(USER).active(false).build();
            when(credentialRepository.findByUserId(USER)).thenReturn(Optional.of(existing));
            when(credentialRepository.save(existing)).thenReturn(existing);

            vault.store(USER, "jane@example.com", "pw");

            assertThat(existing.isActive()).isTrue();
            verify(credentialRepository).save(existing);
        }

        @Test
        @DisplayName("linking a different email drops the previous account's sessions before saving")
        void relinkToDifferentEmailInvalidatesPreviousSessions() {
            String oldHash = IdentityHash.of("old@x.com");
            LinkedInCredential existing = LinkedInCredential.builder()
                    .id("cred-1").userId(USER).emailHash(oldHash).active(true).build();
            when(credentialRepository.findByUserId(USER)).thenReturn(Optional.of(existing));
            when(credentialRepository.save(existing)).thenReturn(existing);

            vault.store(USER, "new@x.com", "pw");

            InOrder order = inOrder(sessionStore, credentialRepository);
            order.verify(sessionStore).invalidate(oldHash);
            order.verify(credentialRepository).save(existing);
            assertThat(existing.getEmailHash()).isEqualTo(IdentityHash.of("new@x.com"));
            verify(sessionStore, never()).invalidate(IdentityHash.of("new@x.com"));
        }

        @Test
        void relinkToSameEmailKeepsSessions() {
            LinkedInCredential existing = LinkedInCredential.builder()
                    .id("cred-1").userId(USER).emailHash(IdentityHash.of("jane@example.com")).active(true).build();
            when(credentialRepository.findByUserId(USER)).thenReturn(Optional.of(existing));
            when(credentialRepository.save(existing)).thenReturn(existing);

            vault.store(USER, " JANE@example.com", "rotated");

            verifyNoInteractions(sessionStore);
        }

        @Test
        void blankInputIsRejected() {
            assertThatThrownBy(() -> vault.store(USER, " ", "pw")).isInstanceOf(ValidationException.class);
            verifyNoInteractions(credentialRepository);
        }
    }

    @Nested
    @DisplayName("retrieve")
    class Retrieve {

        @Test
        void decryptsActiveCredential() {
            LinkedInCredential saved = storeAndCapture("jane@example.com", "s3cret!");
            when(credentialRepository.findByUserIdAndActiveTrue(USER)).thenReturn(Optional.of(saved));

            DecryptedCredential credential = vault.retrieve(USER);

            assertThat(credential.getCredentialId()).isEqualTo("cred-1");
            assertThat(credential.getEmail()).isEqualTo("jane@example.com");
            assertThat(credential.getPassword()).isEqualTo("s3cret!");
            assertThat(credential.toString()).doesNotContain("s3cret!");
        }

        @Test
        void missingCredentialThrows() {
            when(credentialRepository.findByUserIdAndActiveTrue(USER)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> vault.retrieve(USER)).isInstanceOf(NoCredentialsException.class);
        }

        @Test
        void tamperedPasswordThrows() {
            LinkedInCredential saved = storeAndCapture("jane@example.com", "s3cret!");
            String tag = saved.getPasswordAuthTag();
            saved.setPasswordAuthTag((tag.charAt(0) == '0' ? "1" : "0") + tag.substring(1));
            when(credentialRepository.findByUserIdAndActiveTrue(USER)).thenReturn(Optional.of(saved));

            assertThatThrownBy(() -> vault.retrieve(USER)).isInstanceOf(DecryptionException.class);
        }
    }

    @Nested
    @DisplayName("deactivate")
    class Deactivate {

        @Test
        void flipsInactiveAndDropsSessions() {
            LinkedInCredential existing = LinkedInCredential.builder()
                    .id("cred-1").userId(USER).emailHash("hash-1").active(true).build();
            when(credentialRepository.findByUserId(USER)).thenReturn(Optional.of(existing));

            assertThat(vault.deactivate(USER)).isTrue();
            assertThat(existing.isActive()).isFalse();
            verify(sessionStore).invalidate("hash-1");
        }

        @Test
        void unknownUserReturnsFalse() {
            when(credentialRepository.findByUserId(USER)).thenReturn(Optional.empty());

            assertThat(vault.deactivate(USER)).isFalse();
            verifyNoInteractions(sessionStore);
        }
    }

    @Test
    void hashMatchesIdentityHash() {
        assertThat(vault.hash(" A@B.com ")).isEqualTo(vault.hash("a@b.com"));
    }
}
