package dev.sirchmunk.llm;

/**
 * Content returned by the LLM together with the token usage the endpoint reported for the call.
 *
 * @param content parsed structured result, or the full text for streaming calls
 * @param inputTokens prompt tokens, 0 when the endpoint reports none
 * @param outputTokens completion tokens, 0 when the endpoint reports none
 */
public record LlmResponse<T>(T content, long inputTokens, long outputTokens) {}
