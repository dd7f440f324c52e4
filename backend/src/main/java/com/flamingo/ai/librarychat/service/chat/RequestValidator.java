package com.flamingo.ai.librarychat.service.chat;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.librarychat.api.dto.request.ChatRequest;
import com.flamingo.ai.librarychat.api.dto.request.ComparisonRequest;
import com.flamingo.ai.librarychat.config.ChatProperties;
import com.flamingo.ai.librarychat.exception.InvalidCollectionException;
import com.flamingo.ai.librarychat.exception.InvalidQuestionException;
import com.flamingo.ai.librarychat.exception.MalformedPayloadException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

/**
 * Parses and validates the raw {@code /chat} body.
 *
 * <p>The question and collection are checked on the JSON tree before the body is bound to a
 * request type, so no other field is trusted until both pass.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RequestValidator {

  private final ObjectMapper objectMapper;
  private final ChatProperties chatProperties;

  /**
   * Validates a raw request body.
   *
   * @param rawBody the request body as received
   * @return the parsed request with its sanitized and original question
   * @throws MalformedPayloadException if the body is not a JSON object of the expected shape
   * @throws InvalidQuestionException if the question is not a string of allowed length
   * @throws InvalidCollectionException if the collection is not configured
   */
  public ValidatedRequest validate(String rawBody) {
    JsonNode root = parse(rawBody);

    int minLength = chatProperties.getValidation().getMinQuestionLength();
    int maxLength = chatProperties.getValidation().getMaxQuestionLength();
    JsonNode questionNode = root.get("question");
    if (questionNode == null || !questionNode.isTextual()) {
      throw new InvalidQuestionException(minLength, maxLength);
    }
    String question = questionNode.asText();
    int length = question.codePointCount(0, question.length());
    if (length < minLength || length > maxLength) {
      throw new InvalidQuestionException(minLength, maxLength);
    }

    JsonNode collectionNode = root.get("collection");
    if (collectionNode == null
        || !collectionNode.isTextual()
        || !chatProperties.getCollections().contains(collectionNode.asText())) {
      throw new InvalidCollectionException(
          collectionNode != null ? collectionNode.toString() : "null");
    }

    ChatRequest request = bind(root);
    return new ValidatedRequest(request, sanitize(question), question);
  }

  /** Escapes HTML and the slash, backslash and backtick, trims, and collapses line breaks. */
  public static String sanitize(String question) {
    return HtmlUtils.htmlEscape(question.trim())
        .replace("/", "&#x2F;")
        .replace("\\", "&#x5C;")
        .replace("`", "&#96;")
        .replaceAll("[\\r\\n]+", " ");
  }

  private JsonNode parse(String rawBody) {
    JsonNode root;
    try {
      root = objectMapper.readTree(rawBody == null ? "" : rawBody);
    } catch (JsonProcessingException e) {
      log.error("Error parsing request body: {}", e.getOriginalMessage());
      log.debug("Raw request body: {}", rawBody);
      throw new MalformedPayloadException("Request body is not valid JSON", e);
    }
    if (root == null || !root.isObject()) {
      throw new MalformedPayloadException("Request body is not a JSON object", null);
    }
    return root;
  }

  private ChatRequest bind(JsonNode root) {
    Class<? extends ChatRequest> type =
        root.has("modelA") ? ComparisonRequest.class : ChatRequest.class;
    try {
      return objectMapper.treeToValue(root, type);
    } catch (JsonProcessingException e) {
      log.error("Request body does not match {}: {}", type.getSimpleName(), e.getOriginalMessage());
      throw new MalformedPayloadException("Request body has invalid field types", e);
    }
  }
}
