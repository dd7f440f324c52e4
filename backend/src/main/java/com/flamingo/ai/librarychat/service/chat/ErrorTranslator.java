package com.flamingo.ai.librarychat.service.chat;

import com.flamingo.ai.librarychat.exception.IndexNotFoundException;
import dev.langchain4j.exception.HttpException;
import dev.langchain4j.exception.RateLimitException;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.Exceptions;

/**
 * Turns a failure from any pipeline stage into the message sent on the stream.
 *
 * <p>Full detail is logged here. Clients only ever receive one of the fixed messages, or the
 * failure's own message for generic errors.
 */
@Component
@Slf4j
public class ErrorTranslator {

  static final String INDEX_NOT_FOUND_MESSAGE =
      "The specified vector index does not exist. Please notify your administrator.";
  static final String QUOTA_MESSAGE =
      "The site has exceeded its current quota with OpenAI, please tell an admin to check the "
          + "plan and billing details.";
  static final String TIMEOUT_MESSAGE = "The answer took too long to generate. Please try again.";
  static final String GENERIC_MESSAGE = "Something went wrong";
  static final String UNKNOWN_MESSAGE = "An unknown error occurred";

  private static final String QUOTA_MARKER = "429";
  private static final int HTTP_TOO_MANY_REQUESTS = 429;

  private final MeterRegistry meterRegistry;
  private final boolean apiKeyPresent;

  public ErrorTranslator(
      MeterRegistry meterRegistry, @Value("${langchain4j.openai.api-key:}") String openAiApiKey) {
    this.meterRegistry = meterRegistry;
    this.apiKeyPresent = openAiApiKey != null && !openAiApiKey.isBlank();
  }

  public StreamFailure translate(Throwable failure) {
    Throwable error = unwrap(failure);
    log.error("Error in chat stream: {}", error.getMessage(), error);

    StreamFailure result = classify(error);
    meterRegistry.counter("chat.errors", "kind", result.kind().getMetricTag()).increment();
    return result;
  }

  private StreamFailure classify(Throwable error) {
    IndexNotFoundException indexNotFound = findCause(error, IndexNotFoundException.class);
    if (indexNotFound != null) {
      log.error("Vector index not found: {}", indexNotFound.getIndexName());
      return new StreamFailure(FailureKind.INDEX_NOT_FOUND, INDEX_NOT_FOUND_MESSAGE);
    }

    if (isQuotaFailure(error)) {
      log.warn("Provider quota exceeded. API key present: {}", apiKeyPresent);
      return new StreamFailure(FailureKind.PROVIDER_QUOTA_EXCEEDED, QUOTA_MESSAGE);
    }

    if (findCause(error, TimeoutException.class) != null) {
      return new StreamFailure(FailureKind.GENERIC_FAILURE, TIMEOUT_MESSAGE);
    }

    if (error instanceof Exception) {
      String message = error.getMessage();
      return new StreamFailure(
          FailureKind.GENERIC_FAILURE,
          message == null || message.isEmpty() ? GENERIC_MESSAGE : message);
    }

    return new StreamFailure(FailureKind.UNKNOWN_FAILURE, UNKNOWN_MESSAGE);
  }

  private static boolean isQuotaFailure(Throwable error) {
    if (findCause(error, RateLimitException.class) != null) {
      return true;
    }
    HttpException http = findCause(error, HttpException.class);
    if (http != null && http.statusCode() == HTTP_TOO_MANY_REQUESTS) {
      return true;
    }
    // Some provider errors arrive wrapped without a typed cause; only the status text survives.
    for (Throwable t = error; t != null; t = t.getCause()) {
      if (t.getMessage() != null && t.getMessage().contains(QUOTA_MARKER)) {
        return true;
      }
      if (t.getCause() == t) {
        break;
      }
    }
    return false;
  }

  /** Strips Reactor wrappers; of several failures from a joined stream, the first is kept. */
  private static Throwable unwrap(Throwable failure) {
    List<Throwable> failures = Exceptions.unwrapMultiple(failure);
    Throwable first = failures.isEmpty() ? failure : failures.get(0);
    return Exceptions.unwrap(first);
  }

  private static <T extends Throwable> T findCause(Throwable error, Class<T> type) {
    for (Throwable t = error; t != null; t = t.getCause()) {
      if (type.isInstance(t)) {
        return type.cast(t);
      }
      if (t.getCause() == t) {
        break;
      }
    }
    return null;
  }
}
