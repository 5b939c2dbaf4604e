package com.flamingo.ai.studyplanner.config;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for the extraction chat model. */
@Configuration
@Slf4j
public class LangChain4jConfig {

  @Value("${langchain4j.openai.api-key:}")
  private String openAiApiKey;

  @Value("${langchain4j.openai.chat-model.model-name:gpt-5-mini}")
  private String chatModelName;

  @Value("${langchain4j.openai.chat-model.max-completion-tokens:4096}")
  private int maxCompletionTokens;

  @Value("${langchain4j.openai.chat-model.timeout:120s}")
  private Duration requestTimeout;

  /**
   * JSON-mode chat model shared by every extraction agent.
   *
   * <p>The client's own retries are switched off: retrying is owned by the {@code extraction}
   * retry instance, so every attempt goes back through the rate limiter.
   */
  @Bean
  public ChatModel chatModel() {
    if (openAiApiKey == null || openAiApiKey.isBlank()) {
      throw new IllegalStateException(
          "OpenAI API key is required for document extraction. Set OPENAI_API_KEY.");
    }
    log.info("Extraction model {} (timeout {})", chatModelName, requestTimeout);

    return OpenAiChatModel.builder()
        .apiKey(openAiApiKey)
        .modelName(chatModelName)
        .maxCompletionTokens(maxCompletionTokens)
        .timeout(requestTimeout)
        .maxRetries(0)
        .responseFormat("json_object")
        .build();
  }
}
