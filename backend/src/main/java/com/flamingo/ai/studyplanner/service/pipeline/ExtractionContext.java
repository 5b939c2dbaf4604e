package com.flamingo.ai.studyplanner.service.pipeline;

import dev.langchain4j.memory.ChatMemory;
import dev.langchain4j.memory.chat.MessageWindowChatMemory;
import java.time.Instant;
import java.util.UUID;

/**
 * Disposable execution context of one external call.
 *
 * @param id globally unique; also the chat memory id
 */
public record ExtractionContext(String id, String agentType, Instant openedAt, ChatMemory memory) {

  static ExtractionContext open(String agentType, int memoryWindow) {
    String id = UUID.randomUUID().toString();
    ChatMemory memory = MessageWindowChatMemory.builder().id(id).maxMessages(memoryWindow).build();
    return new ExtractionContext(id, agentType, Instant.now(), memory);
  }
}
