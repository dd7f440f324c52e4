package com.flamingo.ai.librarychat.service.chat;

import com.flamingo.ai.librarychat.api.dto.request.ChatRequest;
import com.flamingo.ai.librarychat.api.dto.request.ComparisonRequest;
import com.flamingo.ai.librarychat.api.dto.response.StreamEvent;
import com.flamingo.ai.librarychat.config.ChatProperties;
import com.flamingo.ai.librarychat.service.generation.GenerationExecutor;
import com.flamingo.ai.librarychat.service.generation.ModelSettings;
import com.flamingo.ai.librarychat.service.generation.PromptBuilder;
import com.flamingo.ai.librarychat.service.persistence.AnswerPersistenceService;
import com.flamingo.ai.librarychat.service.retrieval.FilterBuilder;
import com.flamingo.ai.librarychat.service.retrieval.RetrievalFilter;
import com.flamingo.ai.librarychat.service.retrieval.RetrievalHandle;
import com.flamingo.ai.librarychat.service.retrieval.SourceRetriever;
import com.flamingo.ai.librarychat.service.site.SitePolicy;
import com.google.common.annotations.VisibleForTesting;
import dev.langchain4j.data.message.ChatMessage;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Streams answers for single and comparison requests.
 *
 * <p>Single mode: {@code sourceDocs}, tokens, {@code docId} (non-private sessions only), {@code
 * done}. Comparison mode: tokens tagged "A"/"B" as they arrive, then {@code sourceDocs} once per
 * tag, then one untagged {@code done}. Any failure ends the stream with one {@code error} event.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChatStreamServiceImpl implements ChatStreamService {

  static final String SAVE_FAILED_MESSAGE = "Your answer was generated but could not be saved.";

  private final FilterBuilder filterBuilder;
  private final SourceRetriever sourceRetriever;
  private final PromptBuilder promptBuilder;
  private final GenerationExecutor generationExecutor;
  private final AnswerPersistenceService answerPersistenceService;
  private final ErrorTranslator errorTranslator;
  private final ChatProperties chatProperties;
  private final MeterRegistry meterRegistry;

  @Override
  public Flux<StreamEvent> streamAnswer(
      ValidatedRequest request, SitePolicy policy, String clientIp) {
    String mode = request.isComparison() ? "comparison" : "single";
    meterRegistry.counter("chat.streams", "mode", mode).increment();

    ChatRequest body = request.request();
    RetrievalFilter filter =
        filterBuilder.build(body.getCollection(), body.getMediaTypes(), policy);

    Flux<StreamEvent> events =
        request.isComparison()
            ? comparisonStream(request, filter)
            : singleStream(request, filter, clientIp);

    return withDeadline(events, chatProperties.getStream().getTimeout(), Schedulers.parallel())
        .onErrorResume(error -> Flux.just(errorTranslator.translate(error).toEvent()))
        .doFinally(signal -> log.debug("Stream processing ended ({}, {})", mode, signal));
  }

  /**
   * Fails {@code source} with a {@link java.util.concurrent.TimeoutException} once {@code timeout}
   * has elapsed since subscription, however often it emits.
   *
   * <p>Each item re-arms the timer for the time left, so the pending timer is cancelled as soon as
   * the stream ends.
   */
  @VisibleForTesting
  static <T> Flux<T> withDeadline(Flux<T> source, Duration timeout, Scheduler timer) {
    return Flux.defer(
        () -> {
          long deadline = timer.now(TimeUnit.NANOSECONDS) + timeout.toNanos();
          return source.timeout(timeLeft(deadline, timer), item -> timeLeft(deadline, timer));
        });
  }

  private static Mono<Long> timeLeft(long deadline, Scheduler timer) {
    return Mono.defer(
        () -> {
          long remaining = Math.max(0L, deadline - timer.now(TimeUnit.NANOSECONDS));
          return Mono.delay(Duration.ofNanos(remaining), timer);
        });
  }

  private Flux<StreamEvent> singleStream(
      ValidatedRequest request, RetrievalFilter filter, String clientIp) {
    ChatRequest body = request.request();
    int sourceCount =
        body.resolveSourceCount(chatProperties.getRetrieval().getDefaultSourceCount());
    RetrievalHandle retrieval =
        sourceRetriever.retrieve(request.sanitizedQuestion(), filter, sourceCount);

    ChatProperties.Generation generation = chatProperties.getGeneration();
    ModelSettings settings = new ModelSettings(generation.getModel(), generation.getTemperature());
    String history = PromptBuilder.formatHistory(body.historyTurns());
    StringBuilder fullAnswer = new StringBuilder();

    return retrieval
        .documents()
        .flatMapMany(
            sources -> {
              if (sources.isEmpty()) {
                log.warn(
                    "No sources found for collection {} with filter [{}] in index {}",
                    body.getCollection(),
                    filter,
                    chatProperties.getRetrieval().getIndexName());
              }
              List<ChatMessage> messages =
                  promptBuilder.build(request.sanitizedQuestion(), history, sources);
              return Flux.concat(
                  Flux.just(StreamEvent.sourceDocs(sources)),
                  generationExecutor.single(settings, messages, fullAnswer),
                  Flux.defer(() -> persist(request, fullAnswer, retrieval, clientIp)),
                  Flux.just(StreamEvent.done()));
            });
  }

  private Flux<StreamEvent> persist(
      ValidatedRequest request,
      StringBuilder fullAnswer,
      RetrievalHandle retrieval,
      String clientIp) {
    if (request.request().isPrivateSession()) {
      return Flux.empty();
    }
    return retrieval
        .documents()
        .publishOn(Schedulers.boundedElastic())
        .map(
            sources ->
                answerPersistenceService.save(
                    request, fullAnswer.toString(), sources, clientIp))
        .map(StreamEvent::docId)
        .onErrorResume(
            error -> {
              log.error("Failed to save answer: {}", error.getMessage(), error);
              meterRegistry.counter("answers.save.failures").increment();
              return Mono.just(StreamEvent.saveError(SAVE_FAILED_MESSAGE));
            })
        .flux();
  }

  private Flux<StreamEvent> comparisonStream(ValidatedRequest request, RetrievalFilter filter) {
    ComparisonRequest body = request.comparison();
    ChatProperties.Retrieval retrievalProps = chatProperties.getRetrieval();
    int sourceCount = body.resolveSourceCount(retrievalProps.getDefaultSourceCount());
    if (body.isUseExtraSources()) {
      sourceCount = Math.max(sourceCount, retrievalProps.getExtraSourceCount());
    }
    RetrievalHandle retrieval =
        sourceRetriever.retrieve(request.sanitizedQuestion(), filter, sourceCount);

    ModelSettings settingsA = settingsFor(body.getModelA(), body.getTemperatureA());
    ModelSettings settingsB = settingsFor(body.getModelB(), body.getTemperatureB());
    String history = PromptBuilder.formatHistory(body.historyTurns());
    log.debug(
        "Comparing {} and {} with {} sources",
        settingsA.modelName(),
        settingsB.modelName(),
        sourceCount);

    return retrieval
        .documents()
        .flatMapMany(
            sources -> {
              List<ChatMessage> messages =
                  promptBuilder.build(request.sanitizedQuestion(), history, sources);
              return Flux.concat(
                  generationExecutor.compare(settingsA, settingsB, messages),
                  Flux.just(
                      StreamEvent.sourceDocs(sources, GenerationExecutor.MODEL_A),
                      StreamEvent.sourceDocs(sources, GenerationExecutor.MODEL_B),
                      StreamEvent.done()));
            });
  }

  private ModelSettings settingsFor(String model, Double temperature) {
    ChatProperties.Generation defaults = chatProperties.getGeneration();
    return new ModelSettings(
        model != null && !model.isBlank() ? model : defaults.getModel(),
        temperature != null ? temperature : defaults.getTemperature());
  }
}
