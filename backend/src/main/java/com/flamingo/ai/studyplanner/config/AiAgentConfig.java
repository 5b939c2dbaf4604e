package com.flamingo.ai.studyplanner.config;

import com.flamingo.ai.studyplanner.service.pipeline.AgentFactory;
import dev.langchain4j.memory.ChatMemory;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.service.AiServices;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the extraction agents using LangChain4j AI Services.
 *
 * <p>Agents are not singletons here: each external call gets a freshly built agent bound to its
 * own chat memory, so no conversation state can leak from one call into the next.
 */
@Configuration
public class AiAgentConfig {

  @Bean
  public AgentFactory agentFactory(ChatModel chatModel) {
    return new AgentFactory() {
      @Override
      public <A> A create(Class<A> agentType, ChatMemory memory) {
        return AiServices.builder(agentType).chatModel(chatModel).chatMemory(memory).build();
      }
    };
  }
}
