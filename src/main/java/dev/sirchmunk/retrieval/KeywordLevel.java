package dev.sirchmunk.retrieval;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One keyword set of a search plan. Level 0 is the coarsest. A file matches the level if it
 * contains any of its terms.
 *
 * @param index position in the plan, 0-based
 * @param weights term to importance weight (IDF-like, &gt; 0), in planner order
 */
public record KeywordLevel(int index, Map<String, Double> weights) {

  public KeywordLevel {
    if (index < 0) {
      throw new IllegalArgumentException("index must be >= 0, got: " + index);
    }
    if (weights == null || weights.isEmpty()) {
      throw new IllegalArgumentException("A keyword level needs at least one term");
    }
    weights = Collections.unmodifiableMap(new LinkedHashMap<>(weights));
  }

  public List<String> terms() {
    return List.copyOf(weights.keySet());
  }

  public double weight(String term) {
    return weights.getOrDefault(term, 1.0);
  }
}
