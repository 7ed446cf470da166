package dev.sirchmunk.fixture;

import dev.sirchmunk.context.QueryContext;
import dev.sirchmunk.grep.MatchRecord;
import dev.sirchmunk.grep.TextSearchRequest;
import dev.sirchmunk.grep.TextSearchTool;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Stands in for ripgrep in tests: case-insensitive literal matching over whole lines, one {@link
 * MatchRecord} per matching line. Offsets assume one-byte characters.
 */
public final class InMemoryTextSearchTool implements TextSearchTool {

  @Override
  public List<MatchRecord> search(TextSearchRequest request, QueryContext context) {
    List<MatchRecord> hits = new ArrayList<>();
    for (Path file : request.files()) {
      hits.addAll(matches(file, request));
    }
    return hits;
  }

  private static List<MatchRecord> matches(Path file, TextSearchRequest request) {
    List<String> lines;
    try {
      lines = Files.readAllLines(file);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    List<MatchRecord> hits = new ArrayList<>();
    long offset = 0;
    for (int i = 0; i < lines.size(); i++) {
      String line = lines.get(i);
      String lower = line.toLowerCase(Locale.ROOT);
      List<String> found =
          request.patterns().stream()
              .filter(p -> lower.contains(p.toLowerCase(Locale.ROOT)))
              .toList();
      if (!found.isEmpty()) {
        hits.add(
            new MatchRecord(
                file, i + 1, offset, offset + line.length(), line, found, request.level()));
      }
      offset += line.length() + 1;
    }
    return hits;
  }
}
