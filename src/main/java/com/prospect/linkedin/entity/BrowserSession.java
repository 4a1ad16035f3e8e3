package com.prospect.linkedin.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Durable copy of an authenticated cookie jar. Superseded rows are flagged invalid and kept.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@ToString(exclude = {"credential", "encryptedCookies"})
@Entity
@Table(name = "linkedin_user_session",
        indexes = {
                @Index(name = "idx_session_credential_valid", columnList = "credential_id,is_valid,expiresAt")
        })
public class BrowserSession {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(
            name = "credential_id",
            nullable = false,
            foreignKey = @ForeignKey(name = "fk_session_credential")
    )
    private LinkedInCredential credential;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String encryptedCookies;

    @Column(nullable = false, length = 24)
    private String encryptionIv;

    @Column(nullable = false, length = 32)
    private String encryptionAuthTag;

    @Column(length = 512)
    private String userAgent;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant expiresAt;

    private Instant lastUsedAt;

    @Column(name = "is_valid", nullable = false)
    @Builder.Default
    private boolean valid = true;
}
