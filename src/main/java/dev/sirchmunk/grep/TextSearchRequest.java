package dev.sirchmunk.grep;

import java.nio.file.Path;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A single invocation of the external search tool.
 *
 * @param patterns literal terms; a line matches if any of them occurs
 * @param files files to search, never directories
 * @param caseSensitive whether matching respects case
 * @param encoding encoding hint passed to the tool ({@code null} lets the tool sniff it)
 * @param level keyword level the patterns belong to
 */
public record TextSearchRequest(
    List<String> patterns,
    List<Path> files,
    boolean caseSensitive,
    @Nullable String encoding,
    int level) {

  public TextSearchRequest {
    if (patterns == null || patterns.isEmpty()) {
      throw new IllegalArgumentException("At least one pattern is required");
    }
    if (patterns.stream().anyMatch(p -> p == null || p.isBlank())) {
      throw new IllegalArgumentException("Patterns must not be blank");
    }
    patterns = List.copyOf(patterns);
    files = files == null ? List.of() : List.copyOf(files);
  }
}
