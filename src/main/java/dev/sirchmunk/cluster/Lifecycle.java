package dev.sirchmunk.cluster;

/**
 * Lifecycle states of a {@link KnowledgeCluster}.
 *
 * <p>Flow: {@code EMERGING → STABLE → CONTESTED → DEPRECATED}. Transitions only move forward,
 * except that {@code CONTESTED} may return to {@code STABLE} once reconciled. {@code DEPRECATED}
 * is terminal. Declaration order is the order of advancement.
 */
public enum Lifecycle {
  /** Created by a single successful search. */
  EMERGING,
  /** Corroborated by enough independent searches without contradiction. */
  STABLE,
  /** A later search produced conflicting evidence; needs reconciliation. */
  CONTESTED,
  /** Backing sources are gone or changed beyond repair, or explicitly retired. */
  DEPRECATED;

  /**
   * Whether a cluster in this state may move to {@code target}. Staying in the same state is
   * always allowed.
   */
  public boolean canTransitionTo(Lifecycle target) {
    if (target == this) {
      return true;
    }
    return switch (this) {
      case EMERGING -> target != EMERGING;
      case STABLE -> target == CONTESTED || target == DEPRECATED;
      case CONTESTED -> target == STABLE || target == DEPRECATED;
      case DEPRECATED -> false;
    };
  }

  /** The more advanced of two states. */
  public static Lifecycle mostAdvanced(Lifecycle a, Lifecycle b) {
    return a.ordinal() >= b.ordinal() ? a : b;
  }
}
