package com.flamingo.ai.librarychat.service.chat;

import com.flamingo.ai.librarychat.api.dto.response.StreamEvent;

/** A classified failure and the message the client is allowed to see. */
public record StreamFailure(FailureKind kind, String message) {

  public StreamEvent toEvent() {
    return StreamEvent.error(message);
  }
}
