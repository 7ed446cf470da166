package dev.sirchmunk.retrieval;

import dev.sirchmunk.grep.MatchRecord;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Pure static utility scoring matched files against one keyword level.
 *
 * <p>For every term {@code t} of the level:
 *
 * <pre>
 *   idf(t)  = ln(1 + (N - df(t) + 0.5) / (df(t) + 0.5))
 *   body(t) = tf * (k1 + 1) / (tf + k1 * (1 - b + b * size / avgSize))
 *   bonus(t) = filenameWeight * inName(t) + titleWeight * inTitle(t)
 *   score   += weight(t) * idf(t) * (body(t) + bonus(t))
 * </pre>
 *
 * where {@code N} is the number of scanned files and {@code df} the number of matched files
 * containing the term. Longer files need more hits for the same score, so match density drives
 * rank. Ties are broken by newer modification time, then path order.
 */
public final class TfIdfRanker {

  /** Score descending, then newest first, then path ascending. */
  public static final Comparator<RankedFile> ORDER =
      Comparator.comparingDouble(RankedFile::score)
          .reversed()
          .thenComparing(
              (RankedFile r) -> r.candidate().modified(), Comparator.reverseOrder())
          .thenComparing(r -> r.candidate().path().toString());

  private TfIdfRanker() {
    // utility class
  }

  /**
   * Ranks the matched files.
   *
   * @param corpus every scanned file, used for {@code N} and the average size
   * @param hits merged hits per matched file; files absent from {@code corpus} are ignored
   * @param level the keyword level that produced the hits
   * @param weights ranking tunables
   * @return matched files in {@link #ORDER}
   */
  public static List<RankedFile> rank(
      List<FileCandidate> corpus,
      Map<Path, List<MatchRecord>> hits,
      KeywordLevel level,
      RankingWeights weights) {
    if (hits.isEmpty()) {
      return List.of();
    }
    Map<Path, FileCandidate> byPath = new HashMap<>();
    for (FileCandidate candidate : corpus) {
      byPath.put(candidate.path(), candidate);
    }
    double avgSize = corpus.stream().mapToLong(FileCandidate::size).average().orElse(1.0);
    if (avgSize <= 0) {
      avgSize = 1.0;
    }

    List<String> terms = level.terms();
    Map<Path, Map<String, Integer>> termFrequencies = new HashMap<>();
    Map<String, Integer> documentFrequencies = new HashMap<>();
    for (Map.Entry<Path, List<MatchRecord>> entry : hits.entrySet()) {
      if (!byPath.containsKey(entry.getKey())) {
        continue;
      }
      Map<String, Integer> tf = termFrequencies(entry.getValue(), terms);
      termFrequencies.put(entry.getKey(), tf);
      tf.forEach((term, count) -> {
        if (count > 0) {
          documentFrequencies.merge(term, 1, Integer::sum);
        }
      });
    }
    int n = Math.max(corpus.size(), termFrequencies.size());

    List<RankedFile> ranked = new ArrayList<>();
    for (Map.Entry<Path, Map<String, Integer>> entry : termFrequencies.entrySet()) {
      FileCandidate candidate = byPath.get(entry.getKey());
      double lengthRatio = candidate.size() / avgSize;
      String name = normalise(candidate.fileName());
      String title = candidate.title() == null ? "" : normalise(candidate.title());
      double score = 0.0;
      for (String term : terms) {
        int tf = entry.getValue().getOrDefault(term, 0);
        int df = documentFrequencies.getOrDefault(term, 0);
        double idf = Math.log(1.0 + (n - df + 0.5) / (df + 0.5));
        double body =
            tf == 0
                ? 0.0
                : tf * (weights.k1() + 1)
                    / (tf + weights.k1() * (1 - weights.b() + weights.b() * lengthRatio));
        String needle = normalise(term);
        double bonus =
            (name.contains(needle) ? weights.filenameWeight() : 0.0)
                + (title.contains(needle) ? weights.titleWeight() : 0.0);
        score += level.weight(term) * idf * (body + bonus);
      }
      ranked.add(new RankedFile(candidate, score, hits.get(entry.getKey())));
    }
    ranked.sort(ORDER);
    return ranked;
  }

  static Map<String, Integer> termFrequencies(List<MatchRecord> records, List<String> terms) {
    Map<String, Integer> tf = new HashMap<>();
    for (MatchRecord record : records) {
      if (!record.submatches().isEmpty()) {
        for (String submatch : record.submatches()) {
          String lower = submatch.toLowerCase(Locale.ROOT);
          for (String term : terms) {
            if (lower.equals(term.toLowerCase(Locale.ROOT))) {
              tf.merge(term, 1, Integer::sum);
            }
          }
        }
      } else {
        String line = record.text().toLowerCase(Locale.ROOT);
        for (String term : terms) {
          tf.merge(term, occurrences(line, term.toLowerCase(Locale.ROOT)), Integer::sum);
        }
      }
    }
    return tf;
  }

  private static int occurrences(String haystack, String needle) {
    if (needle.isEmpty()) {
      return 0;
    }
    int count = 0;
    int from = 0;
    while ((from = haystack.indexOf(needle, from)) >= 0) {
      count++;
      from += needle.length();
    }
    return count;
  }

  // file names use separators where queries use spaces
  private static String normalise(String text) {
    return text.toLowerCase(Locale.ROOT).replaceAll("[_\\-.]+", " ");
  }
}
