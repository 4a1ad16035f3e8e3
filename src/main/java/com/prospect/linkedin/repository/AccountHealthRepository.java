package com.prospect.linkedin.repository;

import com.prospect.linkedin.entity.AccountHealth;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface AccountHealthRepository extends JpaRepository<AccountHealth, Long> {

    Optional<AccountHealth> findByAccountEmailHash(String accountEmailHash);
}
