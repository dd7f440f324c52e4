package com.flamingo.ai.librarychat.service.admission;

import com.flamingo.ai.librarychat.config.ChatProperties;
import com.flamingo.ai.librarychat.exception.CorsRejectedException;
import com.flamingo.ai.librarychat.exception.RateLimitExceededException;
import com.flamingo.ai.librarychat.service.chat.ValidatedRequest;
import com.flamingo.ai.librarychat.service.site.SitePolicy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Admission checks run before any retrieval or generation starts.
 *
 * <p>Origin policy applies to every request. The daily query limit applies to single-answer
 * requests only; comparison requests are metered separately.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AdmissionGate {

  private final OriginPolicy originPolicy;
  private final RateLimiter rateLimiter;
  private final ChatProperties chatProperties;

  /**
   * Admits a validated request or throws.
   *
   * @param origin the request's Origin header, may be null
   * @param clientIp the resolved client address
   * @throws CorsRejectedException if the origin is not allowed
   * @throws RateLimitExceededException if the client is over its daily limit
   */
  public void admit(String origin, String clientIp, ValidatedRequest request, SitePolicy policy) {
    if (!originPolicy.isAllowed(origin, policy.allowedFrontEndDomains())) {
      throw new CorsRejectedException(origin);
    }

    if (request.isComparison()) {
      log.debug("Comparison request from {} skips the daily query limit", clientIp);
      return;
    }

    ChatProperties.RateLimit rateLimit = chatProperties.getRateLimit();
    boolean allowed =
        rateLimiter.tryAcquire(
            rateLimit.getName(), clientIp, rateLimit.getWindow(), policy.queriesPerUserPerDay());
    if (!allowed) {
      throw new RateLimitExceededException(clientIp);
    }
  }
}
