package dev.sirchmunk.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.ResponseFormat;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.chat.response.StreamingChatResponseHandler;
import dev.langchain4j.model.output.TokenUsage;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.function.Consumer;
import org.jspecify.annotations.Nullable;
import org.springframework.stereotype.Component;

/**
 * {@link LlmClient} over LangChain4j chat models. Structured calls request {@link
 * ResponseFormat#JSON} and bind the reply with Jackson.
 */
@Component
public class LangChain4jLlmClient implements LlmClient {

  private final ChatModel chatModel;
  private final StreamingChatModel streamingChatModel;
  private final ObjectMapper objectMapper;

  public LangChain4jLlmClient(
      ChatModel chatModel, StreamingChatModel streamingChatModel, ObjectMapper objectMapper) {
    this.chatModel = chatModel;
    this.streamingChatModel = streamingChatModel;
    this.objectMapper = objectMapper;
  }

  @Override
  public <T> LlmResponse<T> complete(String prompt, Class<T> responseType) {
    ChatRequest request =
        ChatRequest.builder()
            .messages(UserMessage.from(prompt))
            .responseFormat(ResponseFormat.JSON)
            .build();
    ChatResponse response;
    try {
      response = chatModel.chat(request);
    } catch (RuntimeException e) {
      throw new LlmException("LLM call failed: " + e.getMessage(), e);
    }
    String text = response.aiMessage() != null ? response.aiMessage().text() : null;
    if (text == null || text.isBlank()) {
      throw new LlmException("LLM returned an empty response");
    }
    try {
      T content = objectMapper.readValue(stripCodeFence(text), responseType);
      return usage(content, response.tokenUsage());
    } catch (JsonProcessingException e) {
      throw new LlmException(
          "Malformed structured output for " + responseType.getSimpleName(), e);
    }
  }

  @Override
  public LlmResponse<String> stream(String prompt, Consumer<String> onPartial) {
    CompletableFuture<ChatResponse> done = new CompletableFuture<>();
    StringBuilder text = new StringBuilder();
    streamingChatModel.chat(
        ChatRequest.builder().messages(UserMessage.from(prompt)).build(),
        new StreamingChatResponseHandler() {
          @Override
          public void onPartialResponse(String partialResponse) {
            text.append(partialResponse);
            onPartial.accept(partialResponse);
          }

          @Override
          public void onCompleteResponse(ChatResponse completeResponse) {
            done.complete(completeResponse);
          }

          @Override
          public void onError(Throwable error) {
            done.completeExceptionally(error);
          }
        });
    try {
      ChatResponse response = done.get();
      String full =
          response.aiMessage() != null && response.aiMessage().text() != null
              ? response.aiMessage().text()
              : text.toString();
      return usage(full, response.tokenUsage());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new LlmException("Interrupted while streaming", e);
    } catch (ExecutionException e) {
      throw new LlmException("Streaming LLM call failed: " + e.getCause().getMessage(), e);
    }
  }

  static String stripCodeFence(String text) {
    String trimmed = text.strip();
    if (trimmed.startsWith("```")) {
      int firstNewline = trimmed.indexOf('\n');
      int lastFence = trimmed.lastIndexOf("```");
      if (firstNewline > 0 && lastFence > firstNewline) {
        return trimmed.substring(firstNewline + 1, lastFence).strip();
      }
    }
    return trimmed;
  }

  private static <T> LlmResponse<T> usage(T content, @Nullable TokenUsage tokenUsage) {
    if (tokenUsage == null) {
      return new LlmResponse<>(content, 0, 0);
    }
    return new LlmResponse<>(
        content, orZero(tokenUsage.inputTokenCount()), orZero(tokenUsage.outputTokenCount()));
  }

  private static long orZero(@Nullable Integer count) {
    return count == null ? 0 : count;
  }
}
