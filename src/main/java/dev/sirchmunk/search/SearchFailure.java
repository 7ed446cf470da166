package dev.sirchmunk.search;

/**
 * Why a search did not complete.
 *
 * @param kind failure category
 * @param reason human-readable explanation
 */
public record SearchFailure(SearchErrorKind kind, String reason) {

  public SearchFailure {
    if (kind == null) {
      throw new IllegalArgumentException("kind must not be null");
    }
    reason = reason == null ? kind.name() : reason;
  }
}
