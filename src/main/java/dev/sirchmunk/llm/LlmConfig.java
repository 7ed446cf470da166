package dev.sirchmunk.llm;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.openai.OpenAiStreamingChatModel;
import java.time.Duration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configures the LangChain4j chat models used by {@link LangChain4jLlmClient}. Any
 * OpenAI-compatible endpoint works (OpenAI, vLLM, Ollama's {@code /v1}).
 */
@Configuration
public class LlmConfig {

  /**
   * Non-streaming model for structured JSON calls.
   *
   * @param properties endpoint, model and timeout settings
   * @return a chat model bound to the configured endpoint
   */
  @Bean
  public ChatModel chatModel(LlmProperties properties) {
    return OpenAiChatModel.builder()
        .baseUrl(properties.getBaseUrl())
        .apiKey(apiKeyOrPlaceholder(properties))
        .modelName(properties.getModelName())
        .temperature(properties.getTemperature())
        .timeout(Duration.ofMillis(properties.getTimeoutMs()))
        .maxRetries(0)
        .build();
  }

  /**
   * Streaming model for the user-facing answer.
   *
   * @param properties endpoint, model and timeout settings
   * @return a streaming chat model bound to the configured endpoint
   */
  @Bean
  public StreamingChatModel streamingChatModel(LlmProperties properties) {
    return OpenAiStreamingChatModel.builder()
        .baseUrl(properties.getBaseUrl())
        .apiKey(apiKeyOrPlaceholder(properties))
        .modelName(properties.getModelName())
        .temperature(properties.getTemperature())
        .timeout(Duration.ofMillis(properties.getTimeoutMs()))
        .build();
  }

  // local OpenAI-compatible servers accept any key; the client refuses a blank one
  private static String apiKeyOrPlaceholder(LlmProperties properties) {
    String key = properties.getApiKey();
    return key == null || key.isBlank() ? "not-set" : key;
  }
}
