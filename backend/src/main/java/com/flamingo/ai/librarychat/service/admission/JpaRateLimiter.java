package com.flamingo.ai.librarychat.service.admission;

import com.flamingo.ai.librarychat.domain.entity.RateLimitCounter;
import com.flamingo.ai.librarychat.domain.repository.RateLimitCounterRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionOperations;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * {@link RateLimiter} backed by one database row per (limit, client).
 *
 * <p>Existing rows are locked for the read-modify-write. Concurrent first requests from one client
 * race to insert the row; the losers retry in a new transaction and then find it.
 */
@Service
@Slf4j
public class JpaRateLimiter implements RateLimiter {

  static final int MAX_ATTEMPTS = 5;

  private final RateLimitCounterRepository repository;
  private final TransactionOperations transactions;
  private final Clock clock;

  @Autowired
  public JpaRateLimiter(
      RateLimitCounterRepository repository, PlatformTransactionManager transactionManager) {
    this(repository, new TransactionTemplate(transactionManager), Clock.systemUTC());
  }

  JpaRateLimiter(
      RateLimitCounterRepository repository, TransactionOperations transactions, Clock clock) {
    this.repository = repository;
    this.transactions = transactions;
    this.clock = clock;
  }

  @Override
  public boolean tryAcquire(String name, String clientKey, Duration window, int maxRequests) {
    String id = name + "_" + clientKey;
    for (int attempt = 1; ; attempt++) {
      try {
        Boolean allowed =
            transactions.execute(status -> acquire(id, name, clientKey, window, maxRequests));
        return Boolean.TRUE.equals(allowed);
      } catch (DataIntegrityViolationException | ConcurrencyFailureException e) {
        if (attempt >= MAX_ATTEMPTS) {
          throw e;
        }
        log.debug("Counter {} created concurrently, retrying (attempt {})", id, attempt);
      }
    }
  }

  private boolean acquire(
      String id, String name, String clientKey, Duration window, int maxRequests) {
    Instant now = clock.instant();

    RateLimitCounter counter =
        repository
            .findForUpdate(id)
            .orElseGet(
                () -> RateLimitCounter.builder().id(id).count(0).firstRequestAt(now).build());

    if (counter.getFirstRequestAt().plus(window).isBefore(now)) {
      counter.setCount(0);
      counter.setFirstRequestAt(now);
    }

    if (counter.getCount() >= maxRequests) {
      log.debug("Rate limit '{}' reached for {} ({} requests)", name, clientKey, maxRequests);
      return false;
    }

    counter.setCount(counter.getCount() + 1);
    // Flush here so a duplicate insert fails inside the attempt, not at commit.
    repository.saveAndFlush(counter);
    return true;
  }
}
