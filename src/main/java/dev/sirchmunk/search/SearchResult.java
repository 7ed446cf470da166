package dev.sirchmunk.search;

import dev.sirchmunk.cluster.KnowledgeCluster;
import dev.sirchmunk.context.TokenUsageSummary;
import dev.sirchmunk.evidence.EvidenceUnit;
import java.time.Duration;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Outcome of one search. Never thrown away on failure: a failed or timed-out search still carries
 * whatever files and evidence were gathered.
 *
 * @param searchId identifier used for progress and cancellation
 * @param query the query text
 * @param mode mode the search ran in
 * @param status how far the search got
 * @param answer formatted summary or generated answer; empty if nothing was found
 * @param clusterId id of the cluster produced or reused, if any
 * @param cluster the full cluster, only when requested
 * @param reused true if the answer came from an existing cluster without searching
 * @param files files considered, best first
 * @param evidence evidence gathered, best first
 * @param warnings degraded paths taken (skipped inputs, LLM fallbacks)
 * @param usage LLM token usage
 * @param failure why the search did not complete; null unless {@code status} is FAILED
 * @param elapsed wall time
 */
public record SearchResult(
    String searchId,
    String query,
    SearchMode mode,
    Status status,
    String answer,
    @Nullable String clusterId,
    @Nullable KnowledgeCluster cluster,
    boolean reused,
    List<FileHit> files,
    List<EvidenceUnit> evidence,
    List<String> warnings,
    TokenUsageSummary usage,
    @Nullable SearchFailure failure,
    Duration elapsed) {

  public SearchResult {
    answer = answer == null ? "" : answer;
    files = files == null ? List.of() : List.copyOf(files);
    evidence = evidence == null ? List.of() : List.copyOf(evidence);
    warnings = warnings == null ? List.of() : List.copyOf(warnings);
    usage = usage == null ? TokenUsageSummary.EMPTY : usage;
    if (status == Status.FAILED && failure == null) {
      throw new IllegalArgumentException("A failed result needs a failure");
    }
  }

  public boolean isPartial() {
    return status == Status.PARTIAL;
  }

  public enum Status {
    /** Ran to completion. */
    COMPLETED,
    /** The per-query time budget ran out; carries the best result gathered so far. */
    PARTIAL,
    /** Aborted; see {@link SearchResult#failure()}. */
    FAILED
  }
}
