package dev.sirchmunk.search;

/** Failure categories reported on a {@link SearchResult}. */
public enum SearchErrorKind {
  INPUT_ERROR,
  TOOL_UNAVAILABLE,
  TRANSIENT_IO,
  LLM_ERROR,
  STORE_CONFLICT,
  CANCELLED,
  /** An unexpected defect; details are in the log. */
  INTERNAL
}
