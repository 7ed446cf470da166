package dev.sirchmunk.grep;

import java.nio.file.Path;
import java.util.List;

/**
 * One normalised hit reported by the external search tool.
 *
 * @param file file containing the hit
 * @param lineNumber 1-based line number
 * @param startOffset byte offset of the start of the matched line
 * @param endOffset exclusive byte offset of the end of the matched line
 * @param text the matched line, without trailing newline
 * @param submatches the exact substrings that matched a pattern, in line order
 * @param level keyword level whose patterns produced this hit
 */
public record MatchRecord(
    Path file,
    int lineNumber,
    long startOffset,
    long endOffset,
    String text,
    List<String> submatches,
    int level) {

  public MatchRecord {
    if (startOffset < 0 || endOffset < startOffset) {
      throw new IllegalArgumentException(
          "Invalid match range [" + startOffset + ", " + endOffset + ") in " + file);
    }
    submatches = submatches == null ? List.of() : List.copyOf(submatches);
  }

  boolean overlaps(MatchRecord other) {
    return file.equals(other.file)
        && startOffset < other.endOffset
        && other.startOffset < endOffset;
  }
}
