package com.prospect.linkedin.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * One scrape attempt. Rows are only ever inserted.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString
@Entity
@Table(name = "linkedin_request_log",
        indexes = {
                @Index(name = "idx_request_user_time", columnList = "userId,requestTime"),
                @Index(name = "idx_request_email_hash", columnList = "accountEmailHash")
        })
public class RequestLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, updatable = false, length = 128)
    private String userId;

    @Column(nullable = false, updatable = false, length = 64)
    private String accountEmailHash;

    @Column(nullable = false, updatable = false, length = 1024)
    private String profileUrl;

    @Column(nullable = false, updatable = false)
    private Instant requestTime;

    @Column(updatable = false)
    private Long responseTimeMs;

    @Column(nullable = false, updatable = false)
    private boolean success;

    @Column(nullable = false, updatable = false)
    private boolean checkpointTriggered;

    @Column(updatable = false, length = 2048)
    private String errorMessage;
}
