package com.prospect.linkedin.repository;

import com.prospect.linkedin.entity.BrowserSession;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

@Repository
public interface BrowserSessionRepository extends JpaRepository<BrowserSession, String> {

    /**
     * The current session of a credential: newest valid row that has not expired
     */
    Optional<BrowserSession> findFirstByCredential_IdAndValidTrueAndExpiresAtAfterOrderByCreatedAtDesc(
            String credentialId, Instant now);

    long countByCredential_IdAndValidTrue(String credentialId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update BrowserSession s set s.valid = false where s.credential.id = :credentialId and s.valid = true")
    int invalidateAllForCredential(@Param("credentialId") String credentialId);
}
