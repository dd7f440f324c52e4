package com.flamingo.ai.librarychat.service.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.librarychat.domain.entity.Answer;
import com.flamingo.ai.librarychat.domain.entity.Answer.HistoryEntry;
import com.flamingo.ai.librarychat.domain.repository.AnswerRepository;
import com.flamingo.ai.librarychat.service.chat.ValidatedRequest;
import com.flamingo.ai.librarychat.service.retrieval.SourceDocument;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Stores finished answers from non-private sessions. */
@Service
@RequiredArgsConstructor
@Slf4j
public class AnswerPersistenceService {

  private final AnswerRepository answerRepository;
  private final ObjectMapper objectMapper;
  private final MeterRegistry meterRegistry;

  /**
   * Appends an answer record.
   *
   * @param request the validated request; its original, unescaped question is stored
   * @param fullAnswer the complete generated text
   * @param sources the passages shown with the answer
   * @param clientIp the caller's address
   * @return the new record's identifier
   */
  @Transactional
  public String save(
      ValidatedRequest request, String fullAnswer, List<SourceDocument> sources, String clientIp) {
    List<HistoryEntry> history =
        request.request().historyTurns().stream()
            .map(turn -> new HistoryEntry(turn.question(), turn.answer()))
            .toList();

    Answer answer =
        Answer.builder()
            .question(request.originalQuestion())
            .answer(fullAnswer)
            .collection(request.request().getCollection())
            .sources(serializeSources(sources))
            .likeCount(0)
            .history(history)
            .ip(clientIp)
            .build();

    Answer saved = answerRepository.save(answer);
    meterRegistry.counter("answers.saved").increment();
    log.debug(
        "Saved answer {} ({} sources, {} chars)",
        saved.getId(),
        sources.size(),
        fullAnswer.length());
    return saved.getId().toString();
  }

  private String serializeSources(List<SourceDocument> sources) {
    try {
      return objectMapper.writeValueAsString(sources);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize sources", e);
    }
  }
}
