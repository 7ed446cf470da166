package dev.sirchmunk.context;

/**
 * Thrown at a suspension point when the owning search was cancelled by the caller or ran past its
 * per-query deadline. Work in progress is abandoned; nothing partial is persisted.
 */
public class SearchCancelledException extends RuntimeException {

  private final boolean timedOut;

  public SearchCancelledException(String message, boolean timedOut) {
    super(message);
    this.timedOut = timedOut;
  }

  public boolean isTimedOut() {
    return timedOut;
  }
}
