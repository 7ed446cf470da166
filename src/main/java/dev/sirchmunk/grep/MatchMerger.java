package dev.sirchmunk.grep;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Collapses duplicate hits: records from the same file whose offset ranges overlap become one
 * record spanning their union, carrying the longest text variant, the union of submatches and the
 * coarsest level.
 */
public final class MatchMerger {

  private static final Comparator<MatchRecord> BY_FILE_AND_OFFSET =
      Comparator.comparing((MatchRecord m) -> m.file().toString())
          .thenComparingLong(MatchRecord::startOffset)
          .thenComparingLong(MatchRecord::endOffset);

  private MatchMerger() {
    // utility class
  }

  /**
   * Interval-merges the given records.
   *
   * @param records hits in any order, possibly from several tasks
   * @return merged hits ordered by path, then start offset
   */
  public static List<MatchRecord> merge(List<MatchRecord> records) {
    if (records.isEmpty()) {
      return List.of();
    }
    List<MatchRecord> sorted = new ArrayList<>(records);
    sorted.sort(BY_FILE_AND_OFFSET);

    List<MatchRecord> merged = new ArrayList<>();
    MatchRecord current = sorted.get(0);
    for (int i = 1; i < sorted.size(); i++) {
      MatchRecord next = sorted.get(i);
      if (current.overlaps(next)) {
        current = combine(current, next);
      } else {
        merged.add(current);
        current = next;
      }
    }
    merged.add(current);
    return merged;
  }

  private static MatchRecord combine(MatchRecord a, MatchRecord b) {
    MatchRecord longest = b.text().length() > a.text().length() ? b : a;
    Set<String> submatches = new LinkedHashSet<>(a.submatches());
    submatches.addAll(b.submatches());
    return new MatchRecord(
        a.file(),
        Math.min(a.lineNumber(), b.lineNumber()),
        Math.min(a.startOffset(), b.startOffset()),
        Math.max(a.endOffset(), b.endOffset()),
        longest.text(),
        List.copyOf(submatches),
        Math.min(a.level(), b.level()));
  }
}
