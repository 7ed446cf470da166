package dev.sirchmunk.retrieval;

import dev.sirchmunk.grep.MatchRecord;
import java.util.List;

/**
 * A candidate file with its retrieval score and the hits that produced it.
 *
 * @param candidate scanned file metadata
 * @param score non-negative relevance score; only comparable within one retrieval
 * @param matches merged hits in offset order
 */
public record RankedFile(FileCandidate candidate, double score, List<MatchRecord> matches) {

  public RankedFile {
    matches = matches == null ? List.of() : List.copyOf(matches);
  }
}
