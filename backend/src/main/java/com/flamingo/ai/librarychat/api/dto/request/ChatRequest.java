package com.flamingo.ai.librarychat.api.dto.request;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

/** Request body for {@code POST /chat}. */
@Data
@SuperBuilder
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ChatRequest {

  private String collection;

  private String question;

  /** Prior turns, each a two-element {@code [question, answer]} array. */
  @Builder.Default private List<List<String>> history = new ArrayList<>();

  private boolean privateSession;

  /** Media type name to enabled flag, e.g. {@code {"text": true, "audio": false}}. */
  @Builder.Default private Map<String, Boolean> mediaTypes = new LinkedHashMap<>();

  private Integer sourceCount;

  /** Returns the requested number of sources, or {@code fallback} when absent or not positive. */
  public int resolveSourceCount(int fallback) {
    return sourceCount != null && sourceCount > 0 ? sourceCount : fallback;
  }

  /** Returns the history as typed turns, skipping entries that are not question/answer pairs. */
  public List<HistoryTurn> historyTurns() {
    List<HistoryTurn> turns = new ArrayList<>();
    if (history == null) {
      return turns;
    }
    for (List<String> pair : history) {
      if (pair != null && pair.size() >= 2) {
        turns.add(new HistoryTurn(pair.get(0), pair.get(1)));
      }
    }
    return turns;
  }

  /** One prior exchange in the conversation. */
  public record HistoryTurn(String question, String answer) {}
}
