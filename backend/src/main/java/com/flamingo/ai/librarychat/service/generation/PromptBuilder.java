package com.flamingo.ai.librarychat.service.generation;

import com.flamingo.ai.librarychat.api.dto.request.ChatRequest.HistoryTurn;
import com.flamingo.ai.librarychat.service.retrieval.SourceDocument;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/** Builds the message list sent to the language model for one question. */
@Component
public class PromptBuilder {

  static final String NO_CONTEXT = "No passages from the library matched this question.";

  /**
   * Renders prior turns as "Human: q" / "Assistant: a" line pairs, all joined by newlines.
   *
   * @param history prior turns, oldest first
   * @return the rendered history, empty when there is none
   */
  public static String formatHistory(List<HistoryTurn> history) {
    return history.stream()
        .map(turn -> "Human: " + turn.question() + "\nAssistant: " + turn.answer())
        .collect(Collectors.joining("\n"));
  }

  public List<ChatMessage> build(
      String question, String formattedHistory, List<SourceDocument> sources) {
    List<ChatMessage> messages = new ArrayList<>();
    messages.add(SystemMessage.from(buildSystemPrompt(formattedHistory, sources)));
    messages.add(UserMessage.from(question));
    return messages;
  }

  private String buildSystemPrompt(String formattedHistory, List<SourceDocument> sources) {
    StringBuilder prompt = new StringBuilder();

    prompt.append(
        "You are a helpful assistant answering questions about the teachings in this library. "
            + "Base your answer on the passages below. If they do not contain the answer, say "
            + "so rather than guessing.\n\n");

    prompt.append("Passages:\n");
    if (sources.isEmpty()) {
      prompt.append(NO_CONTEXT);
    } else {
      for (int i = 0; i < sources.size(); i++) {
        SourceDocument source = sources.get(i);
        prompt.append("[").append(i + 1).append("]");
        Object title = source.metadata().get("title");
        if (title != null) {
          prompt.append(" ").append(title);
        }
        prompt.append("\n").append(source.pageContent()).append("\n\n");
      }
    }

    if (!formattedHistory.isEmpty()) {
      prompt.append("\n\nConversation so far:\n").append(formattedHistory);
    }

    return prompt.toString();
  }
}
