package dev.sirchmunk.retrieval;

import java.nio.file.Path;
import java.time.Instant;
import org.jspecify.annotations.Nullable;

/**
 * A file found during a scan. Immutable and query-scoped.
 *
 * @param path absolute, normalised path
 * @param size size in bytes
 * @param type detected file family
 * @param title first meaningful line with Markdown heading markers stripped, if any
 * @param modified last modification time
 */
public record FileCandidate(
    Path path, long size, FileType type, @Nullable String title, Instant modified) {

  public FileCandidate {
    if (path == null) {
      throw new IllegalArgumentException("path must not be null");
    }
    if (size < 0) {
      throw new IllegalArgumentException("size must be >= 0, got: " + size);
    }
  }

  public String fileName() {
    Path name = path.getFileName();
    return name == null ? path.toString() : name.toString();
  }
}
