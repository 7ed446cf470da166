package dev.sirchmunk.retrieval;

import java.util.List;
import java.util.Map;

/**
 * Structured LLM reply for keyword planning.
 *
 * @param levels keyword sets ordered from most general to most specific
 */
record KeywordPlanResponse(List<Level> levels) {

  /** @param keywords term to estimated IDF weight */
  record Level(Map<String, Double> keywords) {}
}
