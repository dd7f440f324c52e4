package com.flamingo.ai.librarychat.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps failures raised before a chat stream opens to an HTTP status and an {@link ApiError} body.
 *
 * <p>Failures after the stream opens never reach this handler; they are delivered as terminal
 * stream events.
 */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(MalformedPayloadException.class)
  public ResponseEntity<ApiError> handleMalformedPayload(
      MalformedPayloadException ex, HttpServletRequest request) {

    incrementErrorCounter("malformed_payload");
    String errorId = generateErrorId();
    log.warn("Malformed chat payload [{}]: {}", errorId, ex.getMessage());

    return respond(
        HttpStatus.BAD_REQUEST, ApiError.MALFORMED_PAYLOAD, ex.getUserMessage(), errorId, request);
  }

  @ExceptionHandler(InvalidQuestionException.class)
  public ResponseEntity<ApiError> handleInvalidQuestion(
      InvalidQuestionException ex, HttpServletRequest request) {

    incrementErrorCounter("invalid_question");
    String errorId = generateErrorId();
    log.warn("Invalid question [{}]: {}", errorId, ex.getMessage());

    return respond(
        HttpStatus.BAD_REQUEST, ApiError.INVALID_QUESTION, ex.getUserMessage(), errorId, request);
  }

  @ExceptionHandler(InvalidCollectionException.class)
  public ResponseEntity<ApiError> handleInvalidCollection(
      InvalidCollectionException ex, HttpServletRequest request) {

    incrementErrorCounter("invalid_collection");
    String errorId = generateErrorId();
    log.warn("Invalid collection [{}]: {}", errorId, ex.getCollection());

    return respond(
        HttpStatus.BAD_REQUEST, ApiError.INVALID_COLLECTION, ex.getUserMessage(), errorId, request);
  }

  @ExceptionHandler(CorsRejectedException.class)
  public ResponseEntity<ApiError> handleCorsRejected(
      CorsRejectedException ex, HttpServletRequest request) {

    incrementErrorCounter("cors_rejected");
    String errorId = generateErrorId();
    log.warn("CORS blocked request [{}] from origin: {}", errorId, ex.getOrigin());

    return respond(
        HttpStatus.FORBIDDEN, ApiError.CORS_REJECTED, ex.getUserMessage(), errorId, request);
  }

  @ExceptionHandler(RateLimitExceededException.class)
  public ResponseEntity<ApiError> handleRateLimitExceeded(
      RateLimitExceededException ex, HttpServletRequest request) {

    incrementErrorCounter("rate_limited");
    String errorId = generateErrorId();
    log.info("Rate limit reached [{}] for {}", errorId, ex.getClientKey());

    return respond(
        HttpStatus.TOO_MANY_REQUESTS, ApiError.RATE_LIMITED, ex.getUserMessage(), errorId, request);
  }

  @ExceptionHandler(SiteConfigurationException.class)
  public ResponseEntity<ApiError> handleSiteConfiguration(
      SiteConfigurationException ex, HttpServletRequest request) {

    incrementErrorCounter("site_config");
    String errorId = generateErrorId();
    log.error("Site configuration error [{}]: {}", errorId, ex.getMessage(), ex);

    return respond(
        HttpStatus.INTERNAL_SERVER_ERROR,
        ApiError.SITE_CONFIG_ERROR,
        ex.getUserMessage(),
        errorId,
        request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("internal_error");
    String errorId = generateErrorId();
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);

    return respond(
        HttpStatus.INTERNAL_SERVER_ERROR,
        ApiError.INTERNAL_ERROR,
        "An unexpected error occurred. Please try again later.",
        errorId,
        request);
  }

  private ResponseEntity<ApiError> respond(
      HttpStatus status,
      String code,
      String message,
      String errorId,
      HttpServletRequest request) {
    return ResponseEntity.status(status)
        .contentType(MediaType.APPLICATION_JSON)
        .body(
            ApiError.builder()
                .error(message)
                .code(code)
                .errorId(errorId)
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  private void incrementErrorCounter(String errorType) {
    meterRegistry.counter("api_errors_total", "error_type", errorType).increment();
  }

  private String generateErrorId() {
    return UUID.randomUUID().toString().substring(0, 8);
  }
}
