package dev.sirchmunk.context;

/**
 * Aggregate LLM usage for one search.
 *
 * @param llmCalls number of completed LLM calls (streaming and structured)
 * @param inputTokens prompt tokens reported by the endpoint
 * @param outputTokens completion tokens reported by the endpoint
 */
public record TokenUsageSummary(int llmCalls, long inputTokens, long outputTokens) {

  public static final TokenUsageSummary EMPTY = new TokenUsageSummary(0, 0, 0);

  public long totalTokens() {
    return inputTokens + outputTokens;
  }
}
