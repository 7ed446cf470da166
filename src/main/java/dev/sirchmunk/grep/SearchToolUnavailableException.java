package dev.sirchmunk.grep;

/** The external search tool could not be invoked. Fatal for the query. */
public class SearchToolUnavailableException extends RuntimeException {

  public SearchToolUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
