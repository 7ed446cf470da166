package dev.sirchmunk.context;

/**
 * Receives progress from a running search. All methods default to no-ops so callers implement only
 * what they display.
 *
 * <p>Callbacks run on worker threads; implementations must be thread-safe and must not block.
 */
public interface SearchListener {

  SearchListener NONE = new SearchListener() {};

  default void onPhase(QueryPhase phase, String detail) {}

  default void onFilesMatched(int fileCount) {}

  default void onProbe(int probesUsed) {}

  /** Streamed fragment of the final answer (DEEP mode only). */
  default void onPartialAnswer(String delta) {}
}
