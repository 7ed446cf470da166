package dev.sirchmunk.retrieval;

import static org.assertj.core.api.Assertions.assertThat;

import dev.sirchmunk.grep.MatchRecord;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;

class TfIdfRankerTest {

  private static final RankingWeights WEIGHTS = new RankingWeights(1.2, 0.75, 2.5, 2.0);
  private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

  private static FileCandidate file(String name, long size, String title, Instant modified) {
    return new FileCandidate(
        Path.of("/corpus", name), size, FileType.of(Path.of(name)), title, modified);
  }

  private static List<MatchRecord> hits(FileCandidate file, String term, int count) {
    return IntStream.range(0, count)
        .mapToObj(
            i ->
                new MatchRecord(
                    file.path(), i + 1, i * 100L, i * 100L + 50, "line with " + term,
                    List.of(term), 0))
        .toList();
  }

  private static KeywordLevel level(String... terms) {
    Map<String, Double> weights = new LinkedHashMap<>();
    for (String term : terms) {
      weights.put(term, 1.0);
    }
    return new KeywordLevel(0, weights);
  }

  @Test
  void noHitsRanksNothing() {
    assertThat(TfIdfRanker.rank(List.of(), Map.of(), level("x"), WEIGHTS)).isEmpty();
  }

  @Test
  void denserMatchesRankHigherForEqualSizes() {
    FileCandidate sparse = file("a.md", 1000, null, T0);
    FileCandidate dense = file("b.md", 1000, null, T0);
    Map<Path, List<MatchRecord>> hits = new LinkedHashMap<>();
    hits.put(sparse.path(), hits(sparse, "retry", 1));
    hits.put(dense.path(), hits(dense, "retry", 5));

    List<RankedFile> ranked =
        TfIdfRanker.rank(List.of(sparse, dense), hits, level("retry"), WEIGHTS);

    assertThat(ranked).extracting(r -> r.candidate().fileName()).containsExactly("b.md", "a.md");
    assertThat(ranked.get(0).matches()).hasSize(5);
  }

  @Test
  void longerFileNeedsMoreHitsForTheSameScore() {
    FileCandidate small = file("small.md", 500, null, T0);
    FileCandidate large = file("large.md", 50_000, null, T0);
    Map<Path, List<MatchRecord>> hits = new LinkedHashMap<>();
    hits.put(small.path(), hits(small, "retry", 2));
    hits.put(large.path(), hits(large, "retry", 2));

    List<RankedFile> ranked =
        TfIdfRanker.rank(List.of(small, large), hits, level("retry"), WEIGHTS);

    assertThat(ranked.get(0).candidate()).isEqualTo(small);
    assertThat(ranked.get(0).score()).isGreaterThan(ranked.get(1).score());
  }

  @Test
  void fileNameAndTitleBoostTheScore() {
    FileCandidate plain = file("notes.md", 1000, null, T0);
    FileCandidate named = file("retry_guide.md", 1000, "Retry guide", T0);
    Map<Path, List<MatchRecord>> hits = new LinkedHashMap<>();
    hits.put(plain.path(), hits(plain, "retry", 1));
    hits.put(named.path(), hits(named, "retry", 1));

    List<RankedFile> ranked =
        TfIdfRanker.rank(List.of(plain, named), hits, level("retry"), WEIGHTS);

    assertThat(ranked.get(0).candidate()).isEqualTo(named);
  }

  @Test
  void tiesGoToTheNewerFileThenThePath() {
    FileCandidate older = file("a.md", 1000, null, T0);
    FileCandidate newer = file("b.md", 1000, null, T0.plusSeconds(60));
    FileCandidate sameAge = file("c.md", 1000, null, T0.plusSeconds(60));
    Map<Path, List<MatchRecord>> hits = new LinkedHashMap<>();
    hits.put(older.path(), hits(older, "retry", 1));
    hits.put(sameAge.path(), hits(sameAge, "retry", 1));
    hits.put(newer.path(), hits(newer, "retry", 1));

    List<RankedFile> ranked =
        TfIdfRanker.rank(List.of(older, newer, sameAge), hits, level("retry"), WEIGHTS);

    assertThat(ranked)
        .extracting(r -> r.candidate().fileName())
        .containsExactly("b.md", "c.md", "a.md");
  }

  @Test
  void hitsOutsideTheCorpusAreIgnored() {
    FileCandidate known = file("a.md", 1000, null, T0);
    Path stray = Path.of("/elsewhere/x.md");
    Map<Path, List<MatchRecord>> hits = new LinkedHashMap<>();
    hits.put(known.path(), hits(known, "retry", 1));
    hits.put(stray, List.of(new MatchRecord(stray, 1, 0, 10, "retry", List.of("retry"), 0)));

    List<RankedFile> ranked = TfIdfRanker.rank(List.of(known), hits, level("retry"), WEIGHTS);

    assertThat(ranked).singleElement().satisfies(r -> assertThat(r.candidate()).isEqualTo(known));
  }

  @Test
  void termFrequencyFallsBackToLineTextWithoutSubmatches() {
    MatchRecord record =
        new MatchRecord(Path.of("/a"), 1, 0, 40, "Retry, then retry again", List.of(), 0);

    Map<String, Integer> tf = TfIdfRanker.termFrequencies(List.of(record), List.of("retry"));

    assertThat(tf).containsEntry("retry", 2);
  }
}
