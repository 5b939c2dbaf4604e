package com.flamingo.ai.studyplanner.service.pipeline;

import dev.langchain4j.memory.ChatMemory;

/** Builds an extraction agent bound to the given chat memory. */
public interface AgentFactory {

  /**
   * Creates a new agent instance. Implementations must not cache or share instances.
   *
   * @param agentType the AI service interface
   * @param memory the memory the agent may use; owned by the caller
   * @return a new agent
   */
  <A> A create(Class<A> agentType, ChatMemory memory);
}
