package dev.sirchmunk.grep;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;

class MatchMergerTest {

  private static final Path A = Path.of("/docs/a.md");
  private static final Path B = Path.of("/docs/b.md");

  private static MatchRecord hit(Path file, long start, long end, String text, int level) {
    return new MatchRecord(file, 1, start, end, text, List.of(text.strip()), level);
  }

  @Test
  void emptyInputGivesEmptyOutput() {
    assertThat(MatchMerger.merge(List.of())).isEmpty();
  }

  @Test
  void overlappingHitsInOneFileCollapseToTheirUnion() {
    MatchRecord first = hit(A, 0, 10, "alpha", 1);
    MatchRecord second = hit(A, 5, 20, "alpha beta", 0);

    List<MatchRecord> merged = MatchMerger.merge(List.of(second, first));

    assertThat(merged).hasSize(1);
    MatchRecord union = merged.get(0);
    assertThat(union.startOffset()).isZero();
    assertThat(union.endOffset()).isEqualTo(20);
    assertThat(union.text()).isEqualTo("alpha beta");
    assertThat(union.level()).isZero();
    assertThat(union.submatches()).containsExactly("alpha", "alpha beta");
  }

  @Test
  void adjacentHitsStaySeparate() {
    List<MatchRecord> merged =
        MatchMerger.merge(List.of(hit(A, 0, 10, "one", 0), hit(A, 10, 20, "two", 0)));

    assertThat(merged).hasSize(2);
  }

  @Test
  void sameOffsetsInDifferentFilesStaySeparateAndOrderedByPath() {
    List<MatchRecord> merged =
        MatchMerger.merge(List.of(hit(B, 0, 10, "x", 0), hit(A, 0, 10, "x", 0)));

    assertThat(merged).extracting(MatchRecord::file).containsExactly(A, B);
  }

  @Test
  void chainOfOverlapsMergesTransitively() {
    List<MatchRecord> merged =
        MatchMerger.merge(
            List.of(hit(A, 0, 10, "a", 2), hit(A, 8, 15, "b", 1), hit(A, 14, 30, "c", 2)));

    assertThat(merged).hasSize(1);
    assertThat(merged.get(0).endOffset()).isEqualTo(30);
    assertThat(merged.get(0).level()).isEqualTo(1);
  }
}
