package com.flamingo.ai.librarychat.service.admission;

import java.time.Duration;

/** Counts requests per client within a rolling window. */
public interface RateLimiter {

  /**
   * Records one request and reports whether it is within the limit.
   *
   * @param name the limit's name, so separate limits do not share counters
   * @param clientKey the client identity, usually its IP address
   * @param window the window length, measured from the first request in the window
   * @param maxRequests requests allowed per window
   * @return true if the request is allowed
   */
  boolean tryAcquire(String name, String clientKey, Duration window, int maxRequests);
}
