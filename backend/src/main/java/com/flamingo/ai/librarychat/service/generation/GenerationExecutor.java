package com.flamingo.ai.librarychat.service.generation;

import com.flamingo.ai.librarychat.api.dto.response.StreamEvent;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.chat.response.StreamingChatResponseHandler;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;

/**
 * Drives language-model invocations and turns their tokens into stream events.
 *
 * <p>An invocation is not cancelled when its subscriber goes away; the provider call runs to
 * completion server-side.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GenerationExecutor {

  public static final String MODEL_A = "A";
  public static final String MODEL_B = "B";

  private final StreamingModelProvider modelProvider;
  private final MeterRegistry meterRegistry;

  /** One streaming invocation. Completes when the model reports its full response. */
  public Flux<String> invoke(ModelSettings settings, List<ChatMessage> messages) {
    return Flux.create(
        sink -> {
          StreamingChatModel model = modelProvider.modelFor(settings);
          model.chat(
              messages,
              new StreamingChatResponseHandler() {
                @Override
                public void onPartialResponse(String partialResponse) {
                  sink.next(partialResponse);
                }

                @Override
                public void onCompleteResponse(ChatResponse completeResponse) {
                  sink.complete();
                }

                @Override
                public void onError(Throwable error) {
                  sink.error(error);
                }
              });
        });
  }

  /**
   * Single mode: every token is forwarded and appended to {@code accumulator}.
   *
   * @param accumulator receives the full response text
   */
  public Flux<StreamEvent> single(
      ModelSettings settings, List<ChatMessage> messages, StringBuilder accumulator) {
    AtomicInteger tokenCount = new AtomicInteger();
    return invoke(settings, messages)
        .doOnNext(
            token -> {
              accumulator.append(token);
              tokenCount.incrementAndGet();
            })
        .map(StreamEvent::token)
        .doOnComplete(
            () -> {
              log.debug("{} finished after {} tokens", settings.modelName(), tokenCount.get());
              meterRegistry.counter("chat.tokens.generated").increment(tokenCount.get());
            });
  }

  /**
   * Comparison mode: both invocations run concurrently and their tokens are tagged "A" and "B".
   * Blank tokens are dropped. The result completes only after both sides finish; if either fails,
   * the error is delivered once both have terminated.
   */
  public Flux<StreamEvent> compare(
      ModelSettings settingsA, ModelSettings settingsB, List<ChatMessage> messages) {
    return Flux.mergeDelayError(
        32, tagged(settingsA, MODEL_A, messages), tagged(settingsB, MODEL_B, messages));
  }

  private Flux<StreamEvent> tagged(
      ModelSettings settings, String label, List<ChatMessage> messages) {
    return invoke(settings, messages)
        .filter(token -> !token.isBlank())
        .map(token -> StreamEvent.token(token, label))
        .doOnComplete(() -> log.debug("Model {} ({}) finished", label, settings.modelName()))
        .subscribeOn(Schedulers.boundedElastic());
  }
}
