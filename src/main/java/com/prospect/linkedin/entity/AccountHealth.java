package com.prospect.linkedin.entity;

import jakarta.persistence.*;
import lombok.*;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.time.Instant;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@ToString
@Entity
@Table(name = "linkedin_account_health",
        indexes = {
                @Index(name = "idx_health_email_hash", columnList = "accountEmailHash", unique = true),
                @Index(name = "idx_health_user", columnList = "userId")
        })
@EntityListeners(AuditingEntityListener.class)
public class AccountHealth {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 64)
    private String accountEmailHash;

    @Column(nullable = false, length = 128)
    private String userId;

    @Builder.Default
    private int totalRequests = 0;

    @Builder.Default
    private int successfulRequests = 0;

    @Builder.Default
    private int failedRequests = 0;

    @Builder.Default
    private int checkpointCount = 0;

    @Builder.Default
    private int consecutiveFailures = 0;

    private Instant cooldownUntil;

    @Column(name = "is_active", nullable = false)
    @Builder.Default
    private boolean active = true;

    private Instant lastRequestAt;
    private Instant lastSuccessAt;
    private Instant lastFailureAt;
    private Instant lastCheckpointAt;

    @CreatedDate
    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @LastModifiedDate
    @Column(nullable = false)
    private Instant updatedAt;

    @Version
    private Integer version;

    public boolean isOnCooldown(Instant now) {
        return cooldownUntil != null && cooldownUntil.isAfter(now);
    }
}
