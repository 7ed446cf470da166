package dev.sirchmunk.retrieval;

import java.nio.file.Path;
import java.util.List;

/**
 * Input of {@link HybridRetriever#retrieve}.
 *
 * @param query natural-language query
 * @param paths files or directories to search
 * @param maxDepth maximum directory depth below each path
 * @param topKFiles maximum number of ranked files returned
 * @param keywordLevels number of keyword levels to plan
 * @param include file globs to include (empty = all)
 * @param exclude file globs to exclude
 */
public record RetrievalRequest(
    String query,
    List<Path> paths,
    int maxDepth,
    int topKFiles,
    int keywordLevels,
    List<String> include,
    List<String> exclude) {

  public RetrievalRequest {
    if (query == null || query.isBlank()) {
      throw new IllegalArgumentException("query must not be blank");
    }
    if (paths == null || paths.isEmpty()) {
      throw new IllegalArgumentException("At least one search path is required");
    }
    if (maxDepth < 0 || topKFiles < 1 || keywordLevels < 1) {
      throw new IllegalArgumentException(
          "maxDepth must be >= 0, topKFiles and keywordLevels >= 1");
    }
    paths = List.copyOf(paths);
    include = include == null ? List.of() : List.copyOf(include);
    exclude = exclude == null ? List.of() : List.copyOf(exclude);
  }
}
