package dev.sirchmunk.evidence;

import dev.sirchmunk.retrieval.QueryTerms;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Static utility computing the prior relevance density of a document: for every bucket of {@code
 * bucketSize} characters, how closely its words approximate the query terms. Matching is
 * approximate (normalised edit distance), so inflected or misspelled forms still attract probes.
 * No LLM involved.
 */
final class FuzzyAnchor {

  /** Word similarity below this contributes nothing. */
  static final double MIN_SIMILARITY = 0.7;

  private FuzzyAnchor() {
    // utility class
  }

  /**
   * Density per bucket in [0, 1]: the mean over query terms of the best word similarity found in
   * the bucket. Multi-word terms are scored word by word.
   *
   * @param text document
   * @param terms lowercase query terms
   * @param bucketSize characters per bucket
   * @return one value per bucket, {@code ceil(text.length() / bucketSize)} entries
   */
  static double[] density(String text, List<String> terms, int bucketSize) {
    int buckets = Math.max(1, (text.length() + bucketSize - 1) / bucketSize);
    double[] density = new double[buckets];
    List<String> words = terms.stream().flatMap(t -> QueryTerms.tokens(t).stream()).distinct()
        .toList();
    if (words.isEmpty() || text.isEmpty()) {
      return density;
    }
    for (int b = 0; b < buckets; b++) {
      int from = b * bucketSize;
      int to = Math.min(text.length(), from + bucketSize);
      Set<String> bucketWords = new HashSet<>(QueryTerms.tokens(text.substring(from, to)));
      double sum = 0.0;
      for (String word : words) {
        sum += best(word, bucketWords);
      }
      density[b] = sum / words.size();
    }
    return density;
  }

  private static double best(String word, Set<String> candidates) {
    if (candidates.contains(word)) {
      return 1.0;
    }
    double best = 0.0;
    for (String candidate : candidates) {
      if (Math.abs(candidate.length() - word.length()) > word.length() / 2 + 1) {
        continue;
      }
      double sim = similarity(word, candidate);
      if (sim > best) {
        best = sim;
      }
    }
    return best >= MIN_SIMILARITY ? best : 0.0;
  }

  /** 1 - levenshtein(a, b) / max(|a|, |b|). */
  static double similarity(String a, String b) {
    int max = Math.max(a.length(), b.length());
    if (max == 0) {
      return 1.0;
    }
    int[] prev = new int[b.length() + 1];
    int[] curr = new int[b.length() + 1];
    for (int j = 0; j <= b.length(); j++) {
      prev[j] = j;
    }
    for (int i = 1; i <= a.length(); i++) {
      curr[0] = i;
      for (int j = 1; j <= b.length(); j++) {
        int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
        curr[j] = Math.min(Math.min(curr[j - 1] + 1, prev[j] + 1), prev[j - 1] + cost);
      }
      int[] swap = prev;
      prev = curr;
      curr = swap;
    }
    return 1.0 - (double) prev[b.length()] / max;
  }
}
