package com.flamingo.ai.librarychat.service.chat;

import com.flamingo.ai.librarychat.api.dto.request.ChatRequest;
import com.flamingo.ai.librarychat.api.dto.request.ComparisonRequest;

/**
 * A chat request that passed validation.
 *
 * @param request the parsed request; its {@code question} is the raw client text
 * @param sanitizedQuestion escaped, trimmed single-line question used for retrieval and generation
 * @param originalQuestion the question exactly as sent, kept only for the stored answer record
 */
public record ValidatedRequest(
    ChatRequest request, String sanitizedQuestion, String originalQuestion) {

  public boolean isComparison() {
    return request instanceof ComparisonRequest;
  }

  public ComparisonRequest comparison() {
    return (ComparisonRequest) request;
  }
}
