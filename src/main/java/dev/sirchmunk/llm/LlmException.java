package dev.sirchmunk.llm;

/**
 * An LLM call failed: endpoint error, per-call timeout, or structured output that could not be
 * parsed. Callers degrade to heuristics instead of aborting the search.
 */
public class LlmException extends RuntimeException {

  public LlmException(String message) {
    super(message);
  }

  public LlmException(String message, Throwable cause) {
    super(message, cause);
  }
}
