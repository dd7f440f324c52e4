package com.flamingo.ai.librarychat.service.generation;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.librarychat.api.dto.request.ChatRequest.HistoryTurn;
import com.flamingo.ai.librarychat.service.retrieval.SourceDocument;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("PromptBuilder")
class PromptBuilderTest {

  private final PromptBuilder promptBuilder = new PromptBuilder();

  @Test
  @DisplayName("Should render each turn as a Human/Assistant pair joined by newlines")
  void shouldFormatHistory() {
    String history =
        PromptBuilder.formatHistory(
            List.of(new HistoryTurn("Who?", "Yogananda."), new HistoryTurn("When?", "1946.")));

    assertThat(history)
        .isEqualTo("Human: Who?\nAssistant: Yogananda.\nHuman: When?\nAssistant: 1946.");
    assertThat(PromptBuilder.formatHistory(List.of())).isEmpty();
  }

  @Test
  @DisplayName("Should put passages and history in the system message and the question last")
  void shouldBuildMessages() {
    List<SourceDocument> sources =
        List.of(new SourceDocument("Be calmly active.", Map.of("title", "Sayings")));

    List<ChatMessage> messages =
        promptBuilder.build("How to act?", "Human: Hi\nAssistant: Hello", sources);

    assertThat(messages).hasSize(2);
    String system = ((SystemMessage) messages.get(0)).text();
    assertThat(system).contains("[1] Sayings").contains("Be calmly active.");
    assertThat(system).contains("Human: Hi\nAssistant: Hello");
    assertThat(((UserMessage) messages.get(1)).singleText()).isEqualTo("How to act?");
  }

  @Test
  @DisplayName("Should say so when no passages matched")
  void shouldHandleNoSources() {
    List<ChatMessage> messages = promptBuilder.build("How to act?", "", List.of());

    assertThat(((SystemMessage) messages.get(0)).text())
        .contains(PromptBuilder.NO_CONTEXT)
        .doesNotContain("Conversation so far");
  }
}
