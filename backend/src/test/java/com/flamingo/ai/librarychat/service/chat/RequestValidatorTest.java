package com.flamingo.ai.librarychat.service.chat;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.librarychat.api.dto.request.ComparisonRequest;
import com.flamingo.ai.librarychat.config.ChatProperties;
import com.flamingo.ai.librarychat.exception.InvalidCollectionException;
import com.flamingo.ai.librarychat.exception.InvalidQuestionException;
import com.flamingo.ai.librarychat.exception.MalformedPayloadException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("RequestValidator")
class RequestValidatorTest {

  private RequestValidator validator;

  @BeforeEach
  void setUp() {
    validator = new RequestValidator(new ObjectMapper(), new ChatProperties());
  }

  @Nested
  @DisplayName("payload parsing")
  class Parsing {

    @Test
    @DisplayName("Should reject a body that is not JSON")
    void shouldRejectInvalidJson() {
      assertThatThrownBy(() -> validator.validate("{not json"))
          .isInstanceOf(MalformedPayloadException.class)
          .extracting(e -> ((MalformedPayloadException) e).getUserMessage())
          .isEqualTo("Invalid JSON in request body");
    }

    @Test
    @DisplayName("Should reject an empty body")
    void shouldRejectEmptyBody() {
      assertThatThrownBy(() -> validator.validate(""))
          .isInstanceOf(MalformedPayloadException.class);
      assertThatThrownBy(() -> validator.validate(null))
          .isInstanceOf(MalformedPayloadException.class);
    }

    @Test
    @DisplayName("Should reject a JSON array")
    void shouldRejectNonObject() {
      assertThatThrownBy(() -> validator.validate("[1, 2]"))
          .isInstanceOf(MalformedPayloadException.class);
    }

    @Test
    @DisplayName("Should reject fields of the wrong type once question and collection pass")
    void shouldRejectBadFieldTypes() {
      String body =
          "{\"question\": \"Hi\", \"collection\": \"whole_library\", \"sourceCount\": \"many\"}";

      assertThatThrownBy(() -> validator.validate(body))
          .isInstanceOf(MalformedPayloadException.class);
    }
  }

  @Nested
  @DisplayName("question")
  class Question {

    @Test
    @DisplayName("Should reject a missing question")
    void shouldRejectMissingQuestion() {
      assertThatThrownBy(() -> validator.validate("{\"collection\": \"whole_library\"}"))
          .isInstanceOf(InvalidQuestionException.class)
          .extracting(e -> ((InvalidQuestionException) e).getUserMessage())
          .isEqualTo("Invalid question. Must be between 1 and 4000 characters.");
    }

    @Test
    @DisplayName("Should reject a non-string question")
    void shouldRejectNumericQuestion() {
      assertThatThrownBy(
              () -> validator.validate("{\"question\": 42, \"collection\": \"whole_library\"}"))
          .isInstanceOf(InvalidQuestionException.class);
    }

    @Test
    @DisplayName("Should reject an empty question")
    void shouldRejectEmptyQuestion() {
      assertThatThrownBy(
              () -> validator.validate("{\"question\": \"\", \"collection\": \"whole_library\"}"))
          .isInstanceOf(InvalidQuestionException.class);
    }

    @Test
    @DisplayName("Should accept exactly 4000 characters and reject 4001")
    void shouldEnforceMaximumLength() {
      String atLimit = "a".repeat(4000);
      String overLimit = "a".repeat(4001);

      assertThat(validator.validate(body(atLimit, "whole_library")).originalQuestion())
          .hasSize(4000);
      assertThatThrownBy(() -> validator.validate(body(overLimit, "whole_library")))
          .isInstanceOf(InvalidQuestionException.class);
    }

    @Test
    @DisplayName("Should check the question before the collection")
    void shouldValidateQuestionFirst() {
      assertThatThrownBy(() -> validator.validate(body("", "nonexistent")))
          .isInstanceOf(InvalidQuestionException.class);
    }
  }

  @Nested
  @DisplayName("collection")
  class Collection {

    @Test
    @DisplayName("Should reject an unknown collection")
    void shouldRejectUnknownCollection() {
      assertThatThrownBy(() -> validator.validate(body("What is karma?", "secret_stash")))
          .isInstanceOf(InvalidCollectionException.class)
          .extracting(e -> ((InvalidCollectionException) e).getUserMessage())
          .isEqualTo("Invalid collection provided");
    }

    @Test
    @DisplayName("Should reject a missing collection")
    void shouldRejectMissingCollection() {
      assertThatThrownBy(() -> validator.validate("{\"question\": \"What is karma?\"}"))
          .isInstanceOf(InvalidCollectionException.class);
    }
  }

  @Nested
  @DisplayName("sanitizing and binding")
  class Binding {

    @Test
    @DisplayName("Should escape HTML, trim, and collapse newlines in the sanitized question")
    void shouldSanitizeQuestion() {
      ValidatedRequest result =
          validator.validate(body("  <b>Why</b>\\nmeditate?\\r\\nNow  ", "master_swami"));

      assertThat(result.sanitizedQuestion())
          .isEqualTo("&lt;b&gt;Why&lt;&#x2F;b&gt; meditate? Now");
      assertThat(result.originalQuestion()).isEqualTo("  <b>Why</b>\nmeditate?\r\nNow  ");
    }

    @Test
    @DisplayName("Should escape slash, backslash and backtick")
    void shouldEscapePathAndTemplateCharacters() {
      assertThat(RequestValidator.sanitize("a/b\\c`d`")).isEqualTo("a&#x2F;b&#x5C;c&#96;d&#96;");
    }

    @Test
    @DisplayName("Should collapse any run of carriage returns and line feeds to one space")
    void shouldCollapseLineBreakRuns() {
      assertThat(RequestValidator.sanitize("one\rtwo\n\nthree\r\n\r\nfour"))
          .isEqualTo("one two three four");
    }

    @Test
    @DisplayName("Should bind a plain chat request with its history and media types")
    void shouldBindChatRequest() {
      String json =
          "{\"question\": \"What is karma?\", \"collection\": \"whole_library\","
              + " \"history\": [[\"Hi\", \"Hello\"]], \"privateSession\": true,"
              + " \"mediaTypes\": {\"text\": true, \"audio\": false}, \"sourceCount\": 6}";

      ValidatedRequest result = validator.validate(json);

      assertThat(result.isComparison()).isFalse();
      assertThat(result.request().isPrivateSession()).isTrue();
      assertThat(result.request().getMediaTypes()).containsEntry("text", true);
      assertThat(result.request().resolveSourceCount(4)).isEqualTo(6);
      assertThat(result.request().historyTurns()).hasSize(1);
      assertThat(result.request().historyTurns().get(0).answer()).isEqualTo("Hello");
    }

    @Test
    @DisplayName("Should bind a comparison request when modelA is present")
    void shouldBindComparisonRequest() {
      String json =
          "{\"question\": \"What is karma?\", \"collection\": \"whole_library\","
              + " \"modelA\": \"gpt-4o\", \"modelB\": \"gpt-4o-mini\","
              + " \"temperatureA\": 0.2, \"temperatureB\": 0.7, \"useExtraSources\": true}";

      ValidatedRequest result = validator.validate(json);

      assertThat(result.isComparison()).isTrue();
      ComparisonRequest comparison = result.comparison();
      assertThat(comparison.getModelB()).isEqualTo("gpt-4o-mini");
      assertThat(comparison.getTemperatureA()).isEqualTo(0.2);
      assertThat(comparison.isUseExtraSources()).isTrue();
    }

    @Test
    @DisplayName("Should default the source count when absent")
    void shouldDefaultSourceCount() {
      ValidatedRequest result = validator.validate(body("What is karma?", "whole_library"));

      assertThat(result.request().resolveSourceCount(4)).isEqualTo(4);
    }
  }

  private static String body(String question, String collection) {
    return "{\"question\": \"" + question + "\", \"collection\": \"" + collection + "\"}";
  }
}
