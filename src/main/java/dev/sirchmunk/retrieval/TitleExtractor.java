package dev.sirchmunk.retrieval;

import java.io.BufferedReader;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.jspecify.annotations.Nullable;

/**
 * Static utility deriving a document title from the first meaningful line of a text file.
 * Markdown heading markers and YAML front-matter delimiters are skipped.
 */
public final class TitleExtractor {

  static final int MAX_TITLE_LENGTH = 120;
  private static final int MAX_LINES = 40;
  private static final int HEAD_BYTES = 8 * 1024;

  private TitleExtractor() {
    // utility class
  }

  /**
   * Extracts a title from the head of {@code file}.
   *
   * @param file file to inspect
   * @param type detected family; only plain-text families are read
   * @return the title, or {@code null} if the file has no meaningful text line
   * @throws IOException if the file cannot be read
   */
  public static @Nullable String extract(Path file, FileType type) throws IOException {
    if (!type.isPlainText()) {
      return null;
    }
    byte[] head;
    try (InputStream in = Files.newInputStream(file)) {
      head = in.readNBytes(HEAD_BYTES);
    }
    var decoder =
        StandardCharsets.UTF_8
            .newDecoder()
            .onMalformedInput(CodingErrorAction.REPLACE)
            .onUnmappableCharacter(CodingErrorAction.REPLACE);
    try (BufferedReader reader =
        new BufferedReader(
            new InputStreamReader(new ByteArrayInputStream(head), decoder))) {
      String line;
      int read = 0;
      while ((line = reader.readLine()) != null && read++ < MAX_LINES) {
        String title = clean(line);
        if (title != null) {
          return title;
        }
      }
    }
    return null;
  }

  static @Nullable String clean(String line) {
    String trimmed = line.strip();
    if (trimmed.isEmpty() || trimmed.equals("---") || trimmed.startsWith("#!")) {
      return null;
    }
    int hashes = 0;
    while (hashes < trimmed.length() && trimmed.charAt(hashes) == '#') {
      hashes++;
    }
    String title = trimmed.substring(hashes).strip();
    if (title.isEmpty() || title.chars().noneMatch(Character::isLetterOrDigit)) {
      return null;
    }
    return title.length() > MAX_TITLE_LENGTH ? title.substring(0, MAX_TITLE_LENGTH) : title;
  }
}
