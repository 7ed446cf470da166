package dev.sirchmunk.retrieval;

import java.util.List;

/**
 * Output of {@link HybridRetriever#retrieve}.
 *
 * @param files ranked files, best first, at most {@code topKFiles}
 * @param plan the keyword levels that were planned
 * @param winningLevel index of the level whose hits were ranked, -1 if nothing matched
 * @param scannedFiles number of files the scan produced
 */
public record RetrievalResult(
    List<RankedFile> files, List<KeywordLevel> plan, int winningLevel, int scannedFiles) {

  public RetrievalResult {
    files = List.copyOf(files);
    plan = List.copyOf(plan);
  }

  public static RetrievalResult empty(List<KeywordLevel> plan, int scannedFiles) {
    return new RetrievalResult(List.of(), plan, -1, scannedFiles);
  }

  public KeywordLevel winner() {
    return plan.get(winningLevel);
  }
}
