package com.cario.scholar.app.service.client;

import java.util.List;
import java.util.Map;
import lombok.extern.log4j.Log4j2;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.ResponseFormat;

/**
 * Text generation over Spring AI's {@link ChatClient}.
 *
 * <p>Calls are stateless: one system instruction and one user message in, the model's text out.
 * When a JSON schema is given and structured output is enabled, the OpenAI {@code json_schema}
 * response format is requested.
 */
@Log4j2
public class LlmTextService {

  private final ChatClient chat;
  private final String model;
  private final boolean structuredOutput;

  public LlmTextService(ChatClient.Builder builder, String model, boolean structuredOutput) {
    this.chat = builder.build();
    this.model = model;
    this.structuredOutput = structuredOutput;
  }

  public String complete(String system, String user) {
    return complete(system, new UserMessage(user), null, null);
  }

  /**
   * @param schemaName name sent with the schema, ignored without a schema
   * @param schema JSON schema of the expected object, or null for free text
   */
  public String complete(
      String system, Message user, String schemaName, Map<String, Object> schema) {
    OpenAiChatOptions.Builder options = OpenAiChatOptions.builder().model(model).temperature(0.0);
    if (structuredOutput && schema != null) {
      options.responseFormat(
          ResponseFormat.builder()
              .type(ResponseFormat.Type.JSON_SCHEMA)
              .jsonSchema(
                  ResponseFormat.JsonSchema.builder()
                      .name(schemaName)
                      .schema(schema)
                      .strict(true)
                      .build())
              .build());
    }
    List<Message> messages = List.of(new SystemMessage(system), user);
    String content = chat.prompt().messages(messages).options(options.build()).call().content();
    log.debug("llm.response model={} chars={}", model, content == null ? 0 : content.length());
    return content;
  }
}
