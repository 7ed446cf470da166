package dev.sirchmunk.evidence;

import org.jspecify.annotations.Nullable;

/**
 * A located passage supporting an answer. Offsets are character offsets into the decoded
 * document, end exclusive. Never mutated; a refresh replaces the whole unit.
 *
 * @param sourcePath absolute path of the source file at capture time
 * @param start start offset, inclusive
 * @param end end offset, exclusive
 * @param text the passage
 * @param score relevance in [0, 1]
 * @param justification short reason given by the LLM judge, if one ran
 * @param degraded true if the LLM judgment failed and {@code score} is the lexical fallback
 */
public record EvidenceUnit(
    String sourcePath,
    int start,
    int end,
    String text,
    double score,
    @Nullable String justification,
    boolean degraded) {

  public EvidenceUnit {
    if (sourcePath == null || sourcePath.isBlank()) {
      throw new IllegalArgumentException("sourcePath must not be blank");
    }
    if (start < 0 || end <= start) {
      throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
    }
    if (score < 0.0 || score > 1.0 || Double.isNaN(score)) {
      throw new IllegalArgumentException("score must be in [0, 1], got: " + score);
    }
    text = text == null ? "" : text;
  }

  /** Same source file and intersecting offset ranges. */
  public boolean overlaps(EvidenceUnit other) {
    return sourcePath.equals(other.sourcePath) && start < other.end && other.start < end;
  }
}
