package dev.sirchmunk.retrieval;

import dev.sirchmunk.context.QueryContext;
import dev.sirchmunk.context.QueryPhase;
import dev.sirchmunk.llm.LlmException;
import dev.sirchmunk.llm.LlmGateway;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Turns a query into keyword levels of increasing specificity for priority-hit search.
 *
 * <p>The LLM is asked for the levels with per-term IDF estimates. When LLM planning is disabled,
 * fails, or returns nothing usable, a heuristic plan is built from the query itself: level 0 is
 * the OR of its salient terms, middle levels are consecutive n-grams, the last level is the exact
 * salient phrase. Identical levels are collapsed, so a plan may be shorter than requested.
 */
@Service
public class KeywordPlanner {

  private static final Logger log = LoggerFactory.getLogger(KeywordPlanner.class);

  private static final double MIN_WEIGHT = 0.1;
  private static final double MAX_WEIGHT = 10.0;

  private final LlmGateway llmGateway;

  public KeywordPlanner(LlmGateway llmGateway) {
    this.llmGateway = llmGateway;
  }

  /**
   * Plans keyword levels for {@code query}.
   *
   * @param query natural-language query
   * @param levels requested number of levels
   * @param useLlm whether to consult the LLM first
   * @param context owning query
   * @return at least one level, unless the query has no word characters
   */
  public List<KeywordLevel> plan(String query, int levels, boolean useLlm, QueryContext context) {
    context.phase(QueryPhase.KEYWORD_PLANNING, levels + " levels");
    if (useLlm) {
      try {
        KeywordPlanResponse response =
            llmGateway.complete(prompt(query, levels), KeywordPlanResponse.class, context);
        List<KeywordLevel> planned = fromResponse(response, levels);
        if (!planned.isEmpty()) {
          log.info("Keyword plan for '{}': {}", query, planned);
          return planned;
        }
        context.warn("LLM keyword plan was empty; using heuristic keywords");
      } catch (LlmException e) {
        context.warn("LLM keyword planning failed, using heuristic keywords: " + e.getMessage());
      }
    }
    List<KeywordLevel> heuristic = heuristicPlan(query, levels);
    log.info("Heuristic keyword plan for '{}': {}", query, heuristic);
    return heuristic;
  }

  /**
   * Builds a plan from the query text alone. Deterministic.
   *
   * @param query query text
   * @param levels requested number of levels
   * @return collapsed plan, empty if the query has no terms
   */
  static List<KeywordLevel> heuristicPlan(String query, int levels) {
    List<String> terms = QueryTerms.salient(query);
    if (terms.isEmpty()) {
      return List.of();
    }
    List<List<String>> sets = new ArrayList<>();
    sets.add(terms);
    for (int n = 2; n < levels && n < terms.size(); n++) {
      sets.add(ngrams(terms, n));
    }
    if (levels > 1) {
      sets.add(List.of(String.join(" ", terms)));
    }

    List<KeywordLevel> plan = new ArrayList<>();
    List<List<String>> seen = new ArrayList<>();
    for (List<String> set : sets) {
      if (seen.contains(set) || plan.size() == levels) {
        continue;
      }
      seen.add(set);
      Map<String, Double> weights = new LinkedHashMap<>();
      for (String term : set) {
        weights.put(term, 1.0);
      }
      plan.add(new KeywordLevel(plan.size(), weights));
    }
    return plan;
  }

  static List<KeywordLevel> fromResponse(KeywordPlanResponse response, int levels) {
    if (response == null || response.levels() == null) {
      return List.of();
    }
    List<KeywordLevel> plan = new ArrayList<>();
    for (KeywordPlanResponse.Level level : response.levels()) {
      if (plan.size() == levels) {
        break;
      }
      if (level == null || level.keywords() == null) {
        continue;
      }
      Map<String, Double> weights = new LinkedHashMap<>();
      level
          .keywords()
          .forEach(
              (term, weight) -> {
                if (term != null && !term.isBlank()) {
                  double w =
                      weight == null ? 1.0 : Math.max(MIN_WEIGHT, Math.min(MAX_WEIGHT, weight));
                  weights.putIfAbsent(term.strip().toLowerCase(Locale.ROOT), w);
                }
              });
      if (!weights.isEmpty()) {
        plan.add(new KeywordLevel(plan.size(), weights));
      }
    }
    return plan;
  }

  private static List<String> ngrams(List<String> terms, int n) {
    List<String> grams = new ArrayList<>();
    for (int i = 0; i + n <= terms.size(); i++) {
      grams.add(String.join(" ", terms.subList(i, i + n)));
    }
    return grams;
  }

  private static String prompt(String query, int levels) {
    return """
        You plan literal text searches over local files for the user query below.
        Produce exactly %d keyword sets, ordered from the most general (level 1) to the most \
        specific (level %d). Each set holds 1 to 6 keywords or short phrases that would appear \
        verbatim in a relevant document. Give each keyword an estimated IDF weight between 0.1 \
        (very common) and 10 (very rare).

        Reply with JSON only, in this shape:
        {"levels": [{"keywords": {"term": 2.5, "another term": 4.0}}]}

        Query: %s
        """
        .formatted(levels, levels, query);
  }
}
