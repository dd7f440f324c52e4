package com.flamingo.ai.librarychat.api.sse;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.librarychat.api.dto.response.StreamEvent;
import com.flamingo.ai.librarychat.service.admission.AdmissionGate;
import com.flamingo.ai.librarychat.service.admission.ClientIpResolver;
import com.flamingo.ai.librarychat.service.chat.ChatStreamService;
import com.flamingo.ai.librarychat.service.chat.RequestValidator;
import com.flamingo.ai.librarychat.service.chat.ValidatedRequest;
import com.flamingo.ai.librarychat.service.site.SiteConfigLoader;
import com.flamingo.ai.librarychat.service.site.SitePolicy;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;
import reactor.core.publisher.Flux;

/**
 * Chat endpoint. Rejections (bad body, origin, rate limit, site configuration) are plain JSON
 * errors; once admitted, the answer is streamed as server-sent events.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class ChatController {

  private final RequestValidator requestValidator;
  private final SiteConfigLoader siteConfigLoader;
  private final AdmissionGate admissionGate;
  private final ClientIpResolver clientIpResolver;
  private final ChatStreamService chatStreamService;
  private final ObjectMapper objectMapper;
  private final MeterRegistry meterRegistry;

  private final AtomicInteger activeConnections = new AtomicInteger(0);

  /**
   * Answers a question as a stream of server-sent events.
   *
   * @param body the raw JSON body; parsed here so malformed JSON gets the chat error shape
   * @param httpRequest the servlet request, for the Origin header and client address
   * @return the event stream
   */
  @PostMapping("/chat")
  public ResponseEntity<StreamingResponseBody> chat(
      @RequestBody(required = false) String body, HttpServletRequest httpRequest) {

    ValidatedRequest request = requestValidator.validate(body);
    SitePolicy policy = siteConfigLoader.load();
    String clientIp = clientIpResolver.resolve(httpRequest);
    admissionGate.admit(httpRequest.getHeader(HttpHeaders.ORIGIN), clientIp, request, policy);

    log.info(
        "Starting {} chat stream for {} on collection {}",
        request.isComparison() ? "comparison" : "single",
        clientIp,
        request.request().getCollection());
    Flux<StreamEvent> events = chatStreamService.streamAnswer(request, policy, clientIp);
    StreamingResponseBody responseBody = out -> stream(events, out);

    return ResponseEntity.ok()
        .contentType(MediaType.TEXT_EVENT_STREAM)
        .header(HttpHeaders.CACHE_CONTROL, "no-cache, no-transform")
        .header(HttpHeaders.CONNECTION, "keep-alive")
        .body(responseBody);
  }

  private void stream(Flux<StreamEvent> events, OutputStream out) {
    activeConnections.incrementAndGet();
    meterRegistry.gauge("sse.connections.active", activeConnections);

    try (SseEventEmitter emitter = new SseEventEmitter(out, objectMapper)) {
      events.doOnNext(emitter::send).blockLast();
      log.debug("Chat stream completed");
    } catch (UncheckedIOException e) {
      log.info("Client disconnected before the stream ended: {}", e.getMessage());
      meterRegistry.counter("sse.errors").increment();
    } finally {
      activeConnections.decrementAndGet();
    }
  }
}
