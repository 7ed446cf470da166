package dev.sirchmunk.cluster;

/**
 * A precondition or limitation attached to a cluster's knowledge.
 *
 * @param kind whether the statement must hold first or bounds where the knowledge applies
 * @param statement the constraint, in one sentence
 */
public record Constraint(Kind kind, String statement) {

  public Constraint {
    if (kind == null) {
      kind = Kind.LIMITATION;
    }
    if (statement == null || statement.isBlank()) {
      throw new IllegalArgumentException("statement must not be blank");
    }
  }

  public enum Kind {
    PRECONDITION,
    LIMITATION
  }
}
