package dev.sirchmunk.retrieval;

import dev.sirchmunk.context.QueryContext;
import dev.sirchmunk.grep.SearchToolProperties;
import java.io.IOException;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Walks the requested search paths and collects the files a query may search.
 *
 * <p>Hidden files and directories (dot-names) are skipped, as are files matching the configured
 * default excludes or the request's exclude globs. A missing or unreadable root is skipped with a
 * warning on the query; if every root fails, {@link NoSearchableInputException} is thrown.
 */
@Component
public class FileScanner {

  private static final Logger log = LoggerFactory.getLogger(FileScanner.class);

  private final List<String> defaultExcludes;

  public FileScanner(SearchToolProperties searchToolProperties) {
    this.defaultExcludes = List.copyOf(searchToolProperties.getDefaultExcludes());
  }

  /**
   * Scans {@code roots}.
   *
   * @param roots files or directories to scan
   * @param maxDepth maximum directory depth below each root (0 = the root entry only)
   * @param include globs a file must match (empty = all)
   * @param exclude globs that reject a file
   * @param context owning query, receives warnings for skipped roots
   * @param readTitles whether to read each file's head for a title
   * @return candidates ordered by path, without duplicates
   * @throws NoSearchableInputException if no root is readable
   * @throws IllegalArgumentException if a glob is malformed
   */
  public List<FileCandidate> scan(
      List<Path> roots,
      int maxDepth,
      List<String> include,
      List<String> exclude,
      QueryContext context,
      boolean readTitles) {
    List<String> excludes = new ArrayList<>(defaultExcludes);
    excludes.addAll(exclude);
    PathScopeFilter filter = PathScopeFilter.of(include, excludes);

    Map<Path, FileCandidate> found = new LinkedHashMap<>();
    List<String> rejected = new ArrayList<>();
    for (Path root : roots) {
      Path normalised = root.toAbsolutePath().normalize();
      if (!Files.exists(normalised) || !Files.isReadable(normalised)) {
        context.warn("Skipping unreadable search path: " + root);
        rejected.add(root.toString());
        continue;
      }
      try {
        walk(normalised, maxDepth, filter, readTitles, found, context);
      } catch (IOException e) {
        context.warn("Skipping search path " + root + ": " + e.getMessage());
        rejected.add(root.toString());
      }
    }
    if (!roots.isEmpty() && rejected.size() == roots.size()) {
      throw new NoSearchableInputException(rejected);
    }

    List<FileCandidate> candidates = new ArrayList<>(found.values());
    candidates.sort(Comparator.comparing(c -> c.path().toString()));
    log.debug("Scanned {} roots: {} candidate files", roots.size(), candidates.size());
    return candidates;
  }

  private void walk(
      Path root,
      int maxDepth,
      PathScopeFilter filter,
      boolean readTitles,
      Map<Path, FileCandidate> found,
      QueryContext context)
      throws IOException {
    Path base = Files.isDirectory(root) ? root : root.getParent();
    Files.walkFileTree(
        root,
        EnumSet.of(FileVisitOption.FOLLOW_LINKS),
        maxDepth + 1,
        new SimpleFileVisitor<>() {
          @Override
          public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
            context.checkActive();
            if (!dir.equals(root) && isHidden(dir)) {
              return FileVisitResult.SKIP_SUBTREE;
            }
            return FileVisitResult.CONTINUE;
          }

          @Override
          public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
            if (!attrs.isRegularFile() || (!file.equals(root) && isHidden(file))) {
              return FileVisitResult.CONTINUE;
            }
            Path relative = base == null ? file.getFileName() : base.relativize(file);
            if (filter.accepts(relative)) {
              found.computeIfAbsent(file, f -> toCandidate(f, attrs, readTitles));
            }
            return FileVisitResult.CONTINUE;
          }

          @Override
          public FileVisitResult visitFileFailed(Path file, IOException exc) {
            log.debug("Cannot read {} during scan: {}", file, exc.getMessage());
            return FileVisitResult.CONTINUE;
          }
        });
  }

  private static FileCandidate toCandidate(
      Path file, BasicFileAttributes attrs, boolean readTitles) {
    FileType type = FileType.of(file);
    return new FileCandidate(
        file,
        attrs.size(),
        type,
        readTitles ? titleOf(file, type) : null,
        attrs.lastModifiedTime().toInstant());
  }

  private static @Nullable String titleOf(Path file, FileType type) {
    try {
      return TitleExtractor.extract(file, type);
    } catch (IOException e) {
      log.debug("No title for {}: {}", file, e.getMessage());
      return null;
    }
  }

  private static boolean isHidden(Path path) {
    Path name = path.getFileName();
    return name != null && name.toString().startsWith(".");
  }
}
