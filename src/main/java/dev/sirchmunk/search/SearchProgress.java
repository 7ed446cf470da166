package dev.sirchmunk.search;

import dev.sirchmunk.context.QueryPhase;
import java.time.Instant;

/**
 * Immutable snapshot of a search's progress.
 *
 * <p>Created and updated by {@link SearchProgressTracker}; each update produces a new record.
 *
 * @param searchId the search
 * @param query the query text
 * @param mode mode the search runs in
 * @param status whether the search is still running
 * @param phase latest pipeline phase entered
 * @param filesMatched files matched by the latest keyword level
 * @param probesUsed sampling probes spent so far
 * @param startedAt when the search started
 */
public record SearchProgress(
    String searchId,
    String query,
    SearchMode mode,
    Status status,
    QueryPhase phase,
    int filesMatched,
    int probesUsed,
    Instant startedAt) {

  public enum Status {
    RUNNING,
    COMPLETED,
    PARTIAL,
    FAILED
  }

  SearchProgress withPhase(QueryPhase newPhase) {
    return new SearchProgress(
        searchId, query, mode, status, newPhase, filesMatched, probesUsed, startedAt);
  }

  SearchProgress withFilesMatched(int files) {
    return new SearchProgress(searchId, query, mode, status, phase, files, probesUsed, startedAt);
  }

  SearchProgress withProbes(int probes) {
    return new SearchProgress(
        searchId, query, mode, status, phase, filesMatched, probes, startedAt);
  }

  SearchProgress withStatus(Status newStatus) {
    return new SearchProgress(
        searchId, query, mode, newStatus, phase, filesMatched, probesUsed, startedAt);
  }
}
