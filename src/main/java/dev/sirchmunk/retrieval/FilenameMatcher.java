package dev.sirchmunk.retrieval;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Pure file-name matching for FILENAME_ONLY searches. Never reads file contents.
 *
 * <p>A query containing glob characters ({@code * ? [ ]}) is used as a single case-insensitive
 * glob. Otherwise every query word becomes a case-insensitive {@code .*word.*} pattern; the score
 * is the fraction of words found in the name, scaled by how much of the name they cover.
 */
@Component
public class FilenameMatcher {

  private static final Comparator<FilenameMatch> ORDER =
      Comparator.comparingDouble(FilenameMatch::score)
          .reversed()
          .thenComparing(m -> m.candidate().path().toString());

  /**
   * Matches {@code query} against the candidates' file names.
   *
   * @param query file-name query or glob
   * @param candidates scanned files
   * @param topK maximum number of matches returned
   * @return matches, best first
   */
  public List<FilenameMatch> match(String query, List<FileCandidate> candidates, int topK) {
    String trimmed = query.strip();
    List<FilenameMatch> matches =
        isGlob(trimmed) ? matchGlob(trimmed, candidates) : matchWords(trimmed, candidates);
    return matches.stream().sorted(ORDER).limit(topK).toList();
  }

  static boolean isGlob(String query) {
    return query.chars().anyMatch(c -> c == '*' || c == '?' || c == '[' || c == ']');
  }

  private static List<FilenameMatch> matchGlob(String glob, List<FileCandidate> candidates) {
    PathMatcher matcher =
        FileSystems.getDefault().getPathMatcher("glob:" + glob.toLowerCase(Locale.ROOT));
    List<FilenameMatch> matches = new ArrayList<>();
    for (FileCandidate candidate : candidates) {
      if (matcher.matches(Path.of(candidate.fileName().toLowerCase(Locale.ROOT)))) {
        matches.add(new FilenameMatch(candidate, 1.0, glob));
      }
    }
    return matches;
  }

  private static List<FilenameMatch> matchWords(String query, List<FileCandidate> candidates) {
    List<String> words = QueryTerms.salient(query);
    if (words.isEmpty()) {
      return List.of();
    }
    List<Pattern> patterns =
        words.stream()
            .map(w -> Pattern.compile(".*" + Pattern.quote(w) + ".*", Pattern.CASE_INSENSITIVE))
            .toList();

    List<FilenameMatch> matches = new ArrayList<>();
    for (FileCandidate candidate : candidates) {
      String name = candidate.fileName();
      String stem = stem(name);
      int matched = 0;
      int coveredChars = 0;
      String firstPattern = null;
      for (int i = 0; i < words.size(); i++) {
        if (patterns.get(i).matcher(name).matches()) {
          matched++;
          coveredChars += words.get(i).length();
          if (firstPattern == null) {
            firstPattern = patterns.get(i).pattern();
          }
        }
      }
      if (matched == 0) {
        continue;
      }
      double fraction = (double) matched / words.size();
      double coverage = Math.min(1.0, (double) coveredChars / Math.max(1, stem.length()));
      matches.add(new FilenameMatch(candidate, fraction * (0.5 + 0.5 * coverage), firstPattern));
    }
    return matches;
  }

  private static String stem(String name) {
    int dot = name.lastIndexOf('.');
    return dot > 0 ? name.substring(0, dot) : name;
  }
}
