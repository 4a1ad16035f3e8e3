package com.prospect.linkedin.repository;

import com.prospect.linkedin.entity.RequestLog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface RequestLogRepository extends JpaRepository<RequestLog, Long> {

    /**
     * Latest attempt by a user, successful or not
     */
    Optional<RequestLog> findFirstByUserIdOrderByRequestTimeDesc(String userId);

    /**
     * Successful attempts since the given instant (inclusive)
     */
    long countByUserIdAndSuccessTrueAndRequestTimeGreaterThanEqual(String userId, Instant since);

    List<RequestLog> findByUserIdAndRequestTimeGreaterThanEqualOrderByRequestTimeDesc(String userId, Instant since);
}
