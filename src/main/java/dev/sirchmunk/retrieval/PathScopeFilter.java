package dev.sirchmunk.retrieval;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.List;

/**
 * Include/exclude glob filter applied to scanned files. Exclude patterns take priority over
 * include patterns; a pattern matches if it matches either the file name or the path relative to
 * the scan root.
 */
public final class PathScopeFilter {

  private final List<PathMatcher> includes;
  private final List<PathMatcher> excludes;

  private PathScopeFilter(List<PathMatcher> includes, List<PathMatcher> excludes) {
    this.includes = includes;
    this.excludes = excludes;
  }

  /**
   * Compiles the given globs.
   *
   * @throws IllegalArgumentException if a pattern is not a valid glob
   */
  public static PathScopeFilter of(List<String> include, List<String> exclude) {
    return new PathScopeFilter(compile(include), compile(exclude));
  }

  /**
   * Check whether a file passes the filter.
   *
   * <ol>
   *   <li>Reject if the name or relative path matches any exclude pattern
   *   <li>If include patterns exist, accept only if one of them matches
   *   <li>Otherwise accept
   * </ol>
   *
   * @param relativePath path of the file relative to its scan root
   * @return true if the file should be searched
   */
  public boolean accepts(Path relativePath) {
    Path name = relativePath.getFileName();
    for (PathMatcher exclude : excludes) {
      if (matches(exclude, relativePath, name)) {
        return false;
      }
    }
    if (includes.isEmpty()) {
      return true;
    }
    for (PathMatcher include : includes) {
      if (matches(include, relativePath, name)) {
        return true;
      }
    }
    return false;
  }

  private static boolean matches(PathMatcher matcher, Path relativePath, Path name) {
    return matcher.matches(relativePath) || (name != null && matcher.matches(name));
  }

  private static List<PathMatcher> compile(List<String> globs) {
    if (globs == null) {
      return List.of();
    }
    return globs.stream()
        .filter(glob -> glob != null && !glob.isBlank())
        .map(glob -> FileSystems.getDefault().getPathMatcher("glob:" + glob.strip()))
        .toList();
  }
}
