package dev.sirchmunk.search;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A search request.
 *
 * <p>Optional fields fall back to configuration when {@code null}:
 *
 * <ul>
 *   <li>{@code maxDepth} - {@code sirchmunk.retrieval.max-depth}
 *   <li>{@code topKFiles} - {@code sirchmunk.retrieval.top-k-files}
 *   <li>{@code timeout} - {@code sirchmunk.search.query-timeout-ms}
 * </ul>
 *
 * @param query natural-language query, or a file-name query or glob for FILENAME_ONLY
 * @param paths files or directories to search (must not be empty)
 * @param mode how much work the search may do
 * @param maxDepth maximum directory depth below each path
 * @param topKFiles maximum number of files considered
 * @param include file globs to include (empty = all)
 * @param exclude file globs to exclude
 * @param returnCluster whether the result carries the full cluster instead of only a summary
 * @param timeout per-query time budget
 */
public record SearchQuery(
    String query,
    List<Path> paths,
    SearchMode mode,
    @Nullable Integer maxDepth,
    @Nullable Integer topKFiles,
    List<String> include,
    List<String> exclude,
    boolean returnCluster,
    @Nullable Duration timeout) {

  public SearchQuery {
    if (query == null || query.isBlank()) {
      throw new IllegalArgumentException("Query must not be blank");
    }
    if (paths == null || paths.isEmpty()) {
      throw new IllegalArgumentException("At least one search path is required");
    }
    if (mode == null) {
      throw new IllegalArgumentException("mode must not be null");
    }
    if (maxDepth != null && maxDepth < 0) {
      throw new IllegalArgumentException("maxDepth must be >= 0, got: " + maxDepth);
    }
    if (topKFiles != null && topKFiles < 1) {
      throw new IllegalArgumentException("topKFiles must be >= 1, got: " + topKFiles);
    }
    if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
      throw new IllegalArgumentException("timeout must be positive, got: " + timeout);
    }
    paths = List.copyOf(paths);
    include = include == null ? List.of() : List.copyOf(include);
    exclude = exclude == null ? List.of() : List.copyOf(exclude);
  }

  /** Query with configured defaults, no globs, summary only. */
  public SearchQuery(String query, List<Path> paths, SearchMode mode) {
    this(query, paths, mode, null, null, List.of(), List.of(), false, null);
  }

  public SearchQuery withReturnCluster(boolean returnCluster) {
    return new SearchQuery(
        query, paths, mode, maxDepth, topKFiles, include, exclude, returnCluster, timeout);
  }

  public SearchQuery withTimeout(Duration timeout) {
    return new SearchQuery(
        query, paths, mode, maxDepth, topKFiles, include, exclude, returnCluster, timeout);
  }
}
