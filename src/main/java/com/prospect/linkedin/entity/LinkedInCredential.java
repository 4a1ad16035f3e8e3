package com.prospect.linkedin.entity;

import jakarta.persistence.*;
import lombok.*;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.time.Instant;

/**
 * Encrypted LinkedIn login for one user. Email and password are sealed separately, each with its own nonce.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@ToString(exclude = {"encryptedEmail", "encryptedPassword"})
@Entity
@Table(name = "linkedin_user_credential",
        indexes = {
                @Index(name = "idx_credential_user", columnList = "userId", unique = true),
                @Index(name = "idx_credential_email_hash", columnList = "emailHash")
        })
@EntityListeners(AuditingEntityListener.class)
public class LinkedInCredential {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(nullable = false, unique = true, length = 128)
    private String userId;

    @Column(nullable = false, length = 64)
    private String emailHash;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String encryptedEmail;

    @Column(nullable = false, length = 24)
    private String emailIv;

    @Column(nullable = false, length = 32)
    private String emailAuthTag;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String encryptedPassword;

    @Column(nullable = false, length = 24)
    private String passwordIv;

    @Column(nullable = false, length = 32)
    private String passwordAuthTag;

    @Column(name = "is_active", nullable = false)
    @Builder.Default
    private boolean active = true;

    private Instant lastValidatedAt;

    @CreatedDate
    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @LastModifiedDate
    @Column(nullable = false)
    private Instant updatedAt;
}
