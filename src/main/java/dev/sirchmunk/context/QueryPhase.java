package dev.sirchmunk.context;

/** Coarse phases a single search moves through, reported to {@link SearchListener}s. */
public enum QueryPhase {
  REUSE_LOOKUP,
  FILENAME_SEARCH,
  KEYWORD_PLANNING,
  TEXT_SEARCH,
  RANKING,
  SAMPLING,
  CLUSTER_BUILDING,
  SUMMARIZING,
  PERSISTING,
  COMPLETED
}
