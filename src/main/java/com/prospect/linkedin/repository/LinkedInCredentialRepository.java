package com.prospect.linkedin.repository;

import com.prospect.linkedin.entity.LinkedInCredential;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface LinkedInCredentialRepository extends JpaRepository<LinkedInCredential, String> {

    Optional<LinkedInCredential> findByUserId(String userId);

    Optional<LinkedInCredential> findByUserIdAndActiveTrue(String userId);

    /**
     * Lookup by identity hash, most recently updated first in case several users linked the same account
     */
    Optional<LinkedInCredential> findFirstByEmailHashOrderByUpdatedAtDesc(String emailHash);

    List<LinkedInCredential> findAllByEmailHash(String emailHash);
}
