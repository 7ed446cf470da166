package dev.sirchmunk.grep;

/** A single search-tool invocation ran past its per-call timeout and was killed. */
public class TextSearchTimeoutException extends RuntimeException {

  public TextSearchTimeoutException(String message) {
    super(message);
  }
}
