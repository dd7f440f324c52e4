package com.flamingo.ai.librarychat.service.generation;

import dev.langchain4j.model.chat.StreamingChatModel;

/** Supplies a streaming chat model configured for the given settings. */
public interface StreamingModelProvider {

  StreamingChatModel modelFor(ModelSettings settings);
}
