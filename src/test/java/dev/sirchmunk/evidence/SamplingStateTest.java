package dev.sirchmunk.evidence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.util.Random;
import org.junit.jupiter.api.Test;

class SamplingStateTest {

  private static SamplingState state(int buckets, SamplingBudget budget) {
    return new SamplingState(new double[buckets], 0.05, budget, 0.6, 0.1);
  }

  @Test
  void unchangedTopScoresForTwoRoundsConverge() {
    SamplingState state = state(5, new SamplingBudget(100, 10_000, 1, false));

    state.record(2, new TextSpan(0, 10), 0.5, 3);
    state.endRound();
    assertThat(state.stopReason()).isEqualTo(SamplingState.StopReason.NONE);

    state.record(3, new TextSpan(20, 30), 0.2, 3);
    state.endRound();
    assertThat(state.stopReason()).isEqualTo(SamplingState.StopReason.CONVERGED);
    assertThat(state.round()).isEqualTo(2);
  }

  @Test
  void improvingTopScoresKeepSampling() {
    SamplingState state = state(5, new SamplingBudget(100, 10_000, 1, false));

    state.record(0, new TextSpan(0, 10), 0.2, 3);
    state.endRound();
    state.record(1, new TextSpan(20, 30), 0.4, 3);
    state.endRound();

    assertThat(state.stopReason()).isEqualTo(SamplingState.StopReason.NONE);
  }

  @Test
  void probeBudgetStopsTheRun() {
    SamplingState state = state(5, new SamplingBudget(1, 10_000, 3, false));

    state.record(0, new TextSpan(0, 10), 0.3, 3);

    assertThat(state.canProbe()).isFalse();
    assertThat(state.stopReason()).isEqualTo(SamplingState.StopReason.BUDGET_EXHAUSTED);
  }

  @Test
  void tokenBudgetStopsTheRun() {
    SamplingState state = state(5, new SamplingBudget(100, 10, 3, false));

    state.record(0, new TextSpan(0, 40), 0.3, 10);

    assertThat(state.stopReason()).isEqualTo(SamplingState.StopReason.BUDGET_EXHAUSTED);
    assertThat(state.tokensUsed()).isEqualTo(10);
  }

  @Test
  void visitingEveryBucketStopsTheRun() {
    SamplingState state = state(2, new SamplingBudget(100, 10_000, 3, false));

    state.record(0, new TextSpan(0, 10), 0.1, 1);
    state.record(1, new TextSpan(10, 20), 0.2, 1);

    assertThat(state.stopReason()).isEqualTo(SamplingState.StopReason.COVERED);
  }

  @Test
  void probeDecaysItsBucketAndBoostsUnvisitedNeighbours() {
    SamplingState state = state(6, new SamplingBudget(100, 10_000, 3, false));
    state.record(1, new TextSpan(0, 10), 0.0, 1);

    state.record(3, new TextSpan(30, 40), 1.0, 1);

    assertThat(state.weight(3)).isCloseTo(0.005, within(1e-9));
    assertThat(state.weight(2)).isCloseTo(0.65, within(1e-9));
    assertThat(state.weight(4)).isCloseTo(0.65, within(1e-9));
    assertThat(state.weight(5)).isCloseTo(0.35, within(1e-9));
    assertThat(state.weight(1)).isCloseTo(0.005, within(1e-9));
  }

  @Test
  void bestKeepsHighestScoringProbePerSpan() {
    SamplingState state = state(4, new SamplingBudget(100, 10_000, 2, false));
    TextSpan span = new TextSpan(0, 10);

    state.record(0, span, 0.2, 1);
    state.record(0, span, 0.7, 1);
    state.record(2, new TextSpan(40, 50), 0.0, 1);

    assertThat(state.best(5)).singleElement().satisfies(p -> assertThat(p.score()).isEqualTo(0.7));
  }

  @Test
  void drawFollowsTheWeights() {
    SamplingState state =
        new SamplingState(new double[] {0.0, 5.0, 0.0}, 0.0, SamplingBudget.none(), 0.6, 0.1);

    assertThat(state.draw(new Random(1))).isEqualTo(1);
  }

  @Test
  void drawWithNoWeightReturnsMinusOne() {
    SamplingState state =
        new SamplingState(new double[] {0.0, 0.0}, 0.0, SamplingBudget.none(), 0.6, 0.1);

    assertThat(state.draw(new Random(1))).isEqualTo(-1);
  }
}
