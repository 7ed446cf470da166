package dev.sirchmunk.evidence;

import dev.sirchmunk.retrieval.QueryTerms;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Cheap probe scoring by lexical overlap: mostly the share of query terms present, plus a small
 * bonus for repeated hits. Phrases count when they occur verbatim.
 */
final class LexicalScorer {

  private static final double COVERAGE_WEIGHT = 0.8;
  private static final double DENSITY_WEIGHT = 0.2;

  private LexicalScorer() {
    // utility class
  }

  /**
   * Scores {@code passage} against {@code terms}.
   *
   * @return score in [0, 1]; 0 when no term occurs or there are no terms
   */
  static double score(String passage, List<String> terms) {
    if (terms.isEmpty() || passage.isEmpty()) {
      return 0.0;
    }
    String lower = passage.toLowerCase(Locale.ROOT);
    Set<String> words = new HashSet<>(QueryTerms.tokens(passage));
    List<String> tokens = QueryTerms.tokens(passage);
    int present = 0;
    int hits = 0;
    for (String term : terms) {
      String t = term.toLowerCase(Locale.ROOT);
      boolean found = t.indexOf(' ') >= 0 ? lower.contains(t) : words.contains(t);
      if (found) {
        present++;
        hits += t.indexOf(' ') >= 0 ? 1 : (int) tokens.stream().filter(t::equals).count();
      }
    }
    double coverage = (double) present / terms.size();
    double density = Math.min(1.0, hits / (2.0 * terms.size()));
    return COVERAGE_WEIGHT * coverage + DENSITY_WEIGHT * density;
  }
}
