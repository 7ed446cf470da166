package dev.sirchmunk.cluster;

import java.util.List;

/**
 * Outcome of a reuse lookup.
 *
 * @param outcome what the caller should do
 * @param candidates clusters above the similarity threshold, most similar first
 */
public record ReuseDecision(Outcome outcome, List<Candidate> candidates) {

  public ReuseDecision {
    candidates = candidates == null ? List.of() : List.copyOf(candidates);
    if (outcome == Outcome.REUSE && candidates.isEmpty()) {
      throw new IllegalArgumentException("REUSE needs a candidate");
    }
  }

  public static ReuseDecision none() {
    return new ReuseDecision(Outcome.NONE, List.of());
  }

  /** The cluster to reuse; only meaningful for {@link Outcome#REUSE}. */
  public Candidate best() {
    return candidates.get(0);
  }

  public enum Outcome {
    /** Exactly one cluster is clearly the most similar; return it. */
    REUSE,
    /** Nothing similar enough; run a fresh search. */
    NONE,
    /** Several clusters tie near the top; run a fresh search and merge near-duplicates after. */
    AMBIGUOUS
  }

  /**
   * @param clusterId candidate cluster
   * @param similarity cosine similarity between the query and the cluster's query history
   */
  public record Candidate(String clusterId, double similarity) {}
}
