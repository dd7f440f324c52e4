package com.flamingo.ai.librarychat.service.chat;

import com.flamingo.ai.librarychat.api.dto.response.StreamEvent;
import com.flamingo.ai.librarychat.service.site.SitePolicy;
import reactor.core.publisher.Flux;

/** Produces the event stream answering one admitted chat request. */
public interface ChatStreamService {

  /**
   * Streams the answer to a request that has passed validation and admission.
   *
   * <p>The returned stream never signals an error: failures are delivered as a terminal {@code
   * error} event. Every stream ends with exactly one terminal event.
   *
   * @param request the validated request
   * @param policy the active site's policy
   * @param clientIp the caller's address, stored with the answer
   * @return the events to send, in order
   */
  Flux<StreamEvent> streamAnswer(ValidatedRequest request, SitePolicy policy, String clientIp);
}
