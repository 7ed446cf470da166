package dev.sirchmunk.search;

import dev.sirchmunk.context.QueryPhase;
import dev.sirchmunk.context.SearchListener;
import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/**
 * Thread-safe in-memory tracker for search progress.
 *
 * <p>Keeps a {@link ConcurrentHashMap} of {@link SearchProgress} snapshots keyed by search id.
 * Each update atomically replaces the snapshot with a new immutable record via {@code
 * computeIfPresent()}. Finished searches stay visible until {@link #removeSearch} is called, so
 * callers can read the final state.
 */
@Component
public class SearchProgressTracker {

  private final ConcurrentHashMap<String, SearchProgress> searches = new ConcurrentHashMap<>();
  private final Clock clock;

  public SearchProgressTracker(Clock clock) {
    this.clock = clock;
  }

  public void startSearch(String searchId, String query, SearchMode mode) {
    searches.put(
        searchId,
        new SearchProgress(
            searchId,
            query,
            mode,
            SearchProgress.Status.RUNNING,
            QueryPhase.REUSE_LOOKUP,
            0,
            0,
            clock.instant()));
  }

  public void recordPhase(String searchId, QueryPhase phase) {
    searches.computeIfPresent(searchId, (id, progress) -> progress.withPhase(phase));
  }

  public void recordFilesMatched(String searchId, int files) {
    searches.computeIfPresent(searchId, (id, progress) -> progress.withFilesMatched(files));
  }

  /** Marks the search finished with {@code status}. */
  public void finishSearch(String searchId, SearchProgress.Status status) {
    searches.computeIfPresent(
        searchId,
        (id, progress) -> progress.withStatus(status).withPhase(QueryPhase.COMPLETED));
  }

  public Optional<SearchProgress> getProgress(String searchId) {
    return Optional.ofNullable(searches.get(searchId));
  }

  /** Searches still running, oldest first. */
  public List<SearchProgress> running() {
    return searches.values().stream()
        .filter(p -> p.status() == SearchProgress.Status.RUNNING)
        .sorted(Comparator.comparing(SearchProgress::startedAt))
        .toList();
  }

  public void removeSearch(String searchId) {
    searches.remove(searchId);
  }

  /**
   * Wraps a caller's listener so that every callback also updates the tracked snapshot. Probe
   * counts from several files accumulate.
   */
  public SearchListener listenerFor(String searchId, SearchListener delegate) {
    return new SearchListener() {
      @Override
      public void onPhase(QueryPhase phase, String detail) {
        recordPhase(searchId, phase);
        delegate.onPhase(phase, detail);
      }

      @Override
      public void onFilesMatched(int fileCount) {
        recordFilesMatched(searchId, fileCount);
        delegate.onFilesMatched(fileCount);
      }

      @Override
      public void onProbe(int probesUsed) {
        searches.computeIfPresent(
            searchId, (id, progress) -> progress.withProbes(progress.probesUsed() + 1));
        delegate.onProbe(probesUsed);
      }

      @Override
      public void onPartialAnswer(String delta) {
        delegate.onPartialAnswer(delta);
      }
    };
  }
}
