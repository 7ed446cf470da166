package dev.sirchmunk.evidence;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Mutable state of one sampling run: bucket weights, visited marks, probe and token counters, the
 * round counter and the probes scored so far.
 *
 * <p>Each round draws up to {@code probes-per-round} buckets with probability proportional to
 * their weight. After a probe the sampled bucket's weight is multiplied by the visited decay and
 * unvisited neighbours within two buckets gain {@code neighborBoost * score / distance}. The run
 * stops when the probe or token budget is spent, every bucket has been visited, or the top-k
 * scores are identical at the end of two consecutive rounds.
 */
final class SamplingState {

  enum StopReason {
    NONE,
    BUDGET_EXHAUSTED,
    COVERED,
    CONVERGED
  }

  private static final Comparator<Probe> BEST_FIRST =
      Comparator.comparingDouble(Probe::score)
          .reversed()
          .thenComparingInt(p -> p.span().start());

  private final double[] weights;
  private final boolean[] visited;
  private final SamplingBudget budget;
  private final double neighborBoost;
  private final double visitedDecay;
  private final Map<TextSpan, Probe> probes = new LinkedHashMap<>();

  private int round;
  private int probesUsed;
  private int tokensUsed;
  private int stableRounds;
  private List<Double> lastTopScores = List.of();

  SamplingState(
      double[] prior,
      double floorWeight,
      SamplingBudget budget,
      double neighborBoost,
      double visitedDecay) {
    this.weights = new double[prior.length];
    for (int i = 0; i < prior.length; i++) {
      weights[i] = floorWeight + Math.max(0.0, prior[i]);
    }
    this.visited = new boolean[prior.length];
    this.budget = budget;
    this.neighborBoost = neighborBoost;
    this.visitedDecay = visitedDecay;
  }

  /**
   * Draws a bucket proportionally to the current weights.
   *
   * @return bucket index, or -1 if every weight is zero
   */
  int draw(Random random) {
    double total = 0.0;
    for (double w : weights) {
      total += w;
    }
    if (total <= 0.0) {
      return -1;
    }
    double target = random.nextDouble() * total;
    double cumulative = 0.0;
    for (int i = 0; i < weights.length; i++) {
      cumulative += weights[i];
      if (target < cumulative) {
        return i;
      }
    }
    return weights.length - 1;
  }

  boolean canProbe() {
    return probesUsed < budget.maxProbes() && tokensUsed < budget.maxTokens();
  }

  void record(int bucket, TextSpan span, double score, int tokens) {
    probesUsed++;
    tokensUsed += tokens;
    visited[bucket] = true;
    weights[bucket] *= visitedDecay;
    for (int distance = 1; distance <= 2; distance++) {
      boost(bucket - distance, score / distance);
      boost(bucket + distance, score / distance);
    }
    probes.merge(
        span, new Probe(bucket, span, score), (old, fresh) -> fresh.score() > old.score() ? fresh
            : old);
  }

  void endRound() {
    round++;
    List<Double> top = best(budget.topK()).stream().map(Probe::score).toList();
    if (!top.isEmpty() && top.equals(lastTopScores)) {
      stableRounds++;
    } else {
      stableRounds = 0;
    }
    lastTopScores = top;
  }

  StopReason stopReason() {
    if (!canProbe()) {
      return StopReason.BUDGET_EXHAUSTED;
    }
    boolean allVisited = true;
    for (boolean v : visited) {
      allVisited &= v;
    }
    if (allVisited) {
      return StopReason.COVERED;
    }
    if (stableRounds >= 1) {
      return StopReason.CONVERGED;
    }
    return StopReason.NONE;
  }

  /** Best probes with a positive score, highest first, ties by position. */
  List<Probe> best(int k) {
    List<Probe> sorted = new ArrayList<>();
    for (Probe probe : probes.values()) {
      if (probe.score() > 0.0) {
        sorted.add(probe);
      }
    }
    sorted.sort(BEST_FIRST);
    return sorted.size() > k ? sorted.subList(0, k) : sorted;
  }

  double weight(int bucket) {
    return weights[bucket];
  }

  int round() {
    return round;
  }

  int probesUsed() {
    return probesUsed;
  }

  int tokensUsed() {
    return tokensUsed;
  }

  private void boost(int bucket, double amount) {
    if (bucket >= 0 && bucket < weights.length && !visited[bucket]) {
      weights[bucket] += neighborBoost * amount;
    }
  }

  /** One scored probe. */
  record Probe(int bucket, TextSpan span, double score) {}
}
