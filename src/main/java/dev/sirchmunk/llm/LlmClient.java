package dev.sirchmunk.llm;

import java.util.function.Consumer;

/** Boundary to the LLM inference endpoint. */
public interface LlmClient {

  /**
   * Non-streaming structured call. The model is asked for a JSON object which is bound to {@code
   * responseType}.
   *
   * @throws LlmException on endpoint failure or malformed output
   */
  <T> LlmResponse<T> complete(String prompt, Class<T> responseType);

  /**
   * Streaming free-text call.
   *
   * @param onPartial receives each fragment as it arrives
   * @return the full text once the stream completes
   * @throws LlmException on endpoint failure
   */
  LlmResponse<String> stream(String prompt, Consumer<String> onPartial);
}
