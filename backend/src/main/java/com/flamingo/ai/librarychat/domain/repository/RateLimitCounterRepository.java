package com.flamingo.ai.librarychat.domain.repository;

import com.flamingo.ai.librarychat.domain.entity.RateLimitCounter;
import jakarta.persistence.LockModeType;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for rate-limit counters. */
@Repository
public interface RateLimitCounterRepository extends JpaRepository<RateLimitCounter, String> {

  /** Loads a counter with a write lock so concurrent requests from one client serialise. */
  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT c FROM RateLimitCounter c WHERE c.id = :id")
  Optional<RateLimitCounter> findForUpdate(@Param("id") String id);
}
