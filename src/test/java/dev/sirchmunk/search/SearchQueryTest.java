package dev.sirchmunk.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;

class SearchQueryTest {

  private static final List<Path> PATHS = List.of(Path.of("/docs"));

  @Test
  void shortConstructorLeavesDefaultsToConfiguration() {
    SearchQuery query = new SearchQuery("retry", PATHS, SearchMode.FAST);

    assertThat(query.maxDepth()).isNull();
    assertThat(query.topKFiles()).isNull();
    assertThat(query.timeout()).isNull();
    assertThat(query.include()).isEmpty();
    assertThat(query.returnCluster()).isFalse();
  }

  @Test
  void rejectsBlankQueryAndMissingPaths() {
    assertThatThrownBy(() -> new SearchQuery("  ", PATHS, SearchMode.FAST))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new SearchQuery("retry", List.of(), SearchMode.FAST))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void rejectsOutOfRangeOptions() {
    assertThatThrownBy(
            () ->
                new SearchQuery(
                    "retry", PATHS, SearchMode.DEEP, -1, null, List.of(), List.of(), false, null))
        .hasMessageContaining("maxDepth");
    assertThatThrownBy(
            () ->
                new SearchQuery(
                    "retry", PATHS, SearchMode.DEEP, null, 0, List.of(), List.of(), false, null))
        .hasMessageContaining("topKFiles");
    assertThatThrownBy(
            () -> new SearchQuery("retry", PATHS, SearchMode.DEEP).withTimeout(Duration.ZERO))
        .hasMessageContaining("timeout");
  }

  @Test
  void withersKeepOtherFields() {
    SearchQuery query =
        new SearchQuery("retry", PATHS, SearchMode.DEEP, 2, 5, List.of("*.md"), null, false, null)
            .withReturnCluster(true)
            .withTimeout(Duration.ofSeconds(30));

    assertThat(query.returnCluster()).isTrue();
    assertThat(query.timeout()).isEqualTo(Duration.ofSeconds(30));
    assertThat(query.maxDepth()).isEqualTo(2);
    assertThat(query.include()).containsExactly("*.md");
    assertThat(query.exclude()).isEmpty();
  }
}
