package com.cario.scholar.app.config;

import com.cario.scholar.app.service.client.LlmTextService;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Text generation over Spring AI.
 *
 * <p>The {@link OpenAiChatModel} is autoconfigured from {@code spring.ai.openai.*}; any
 * OpenAI-compatible endpoint works through {@code spring.ai.openai.base-url}.
 */
@Configuration
public class ChatGptConfig {

  @Bean
  public ChatClient.Builder chatClientBuilder(OpenAiChatModel openAiChatModel) {
    return ChatClient.builder(openAiChatModel);
  }

  @Bean
  public LlmTextService llmTextService(
      ChatClient.Builder chatClientBuilder, EnrichmentProperties enrichment) {
    return new LlmTextService(
        chatClientBuilder,
        enrichment.getLlm().getModel(),
        enrichment.getLlm().isStructuredOutput());
  }
}
