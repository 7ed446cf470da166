package dev.sirchmunk.retrieval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;

class PathScopeFilterTest {

  @Test
  void noPatternsAcceptsEverything() {
    PathScopeFilter filter = PathScopeFilter.of(List.of(), List.of());

    assertThat(filter.accepts(Path.of("docs/a.md"))).isTrue();
  }

  @Test
  void includeMatchesFileNameOrRelativePath() {
    PathScopeFilter filter = PathScopeFilter.of(List.of("*.md", "src/**"), List.of());

    assertThat(filter.accepts(Path.of("deep/nested/a.md"))).isTrue();
    assertThat(filter.accepts(Path.of("src/Main.java"))).isTrue();
    assertThat(filter.accepts(Path.of("lib/Main.java"))).isFalse();
  }

  @Test
  void excludeWinsOverInclude() {
    PathScopeFilter filter = PathScopeFilter.of(List.of("*.md"), List.of("drafts/**"));

    assertThat(filter.accepts(Path.of("drafts/a.md"))).isFalse();
    assertThat(filter.accepts(Path.of("final/a.md"))).isTrue();
  }

  @Test
  void blankPatternsAreIgnored() {
    PathScopeFilter filter = PathScopeFilter.of(List.of(" "), List.of(""));

    assertThat(filter.accepts(Path.of("a.txt"))).isTrue();
  }

  @Test
  void malformedGlobIsRejected() {
    assertThatThrownBy(() -> PathScopeFilter.of(List.of("[unclosed"), List.of()))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
