package dev.sirchmunk.evidence;

import dev.sirchmunk.context.QueryContext;
import dev.sirchmunk.context.QueryPhase;
import dev.sirchmunk.llm.LlmException;
import dev.sirchmunk.llm.LlmGateway;
import dev.sirchmunk.retrieval.QueryTerms;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Random;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Locates the most query-relevant passages of a document with a bounded number of probes.
 *
 * <ol>
 *   <li>Fuzzy anchoring gives every bucket a prior density; a floor weight keeps every bucket
 *       reachable.
 *   <li>Rounds of importance sampling draw buckets by weight, grow a probe window around each to
 *       sentence boundaries and score it lexically. See {@link SamplingState} for the weight
 *       update and stopping conditions.
 *   <li>The best probes are merged when they overlap and grown to paragraph boundaries, capped at
 *       {@code roi-window} characters.
 *   <li>With LLM confirmation, each remaining passage is judged by the LLM. A failed judgment
 *       keeps the lexical score and marks the unit degraded.
 * </ol>
 *
 * <p>The random source is seeded from {@code sirchmunk.sampling.seed} and the source name, so a
 * document and query always produce the same evidence.
 */
@Service
public class EvidenceSampler {

  private static final Logger log = LoggerFactory.getLogger(EvidenceSampler.class);

  private static final double CHARS_PER_TOKEN = 4.0;
  private static final int MAX_JUDGED_CHARS = 4000;

  private final SamplingProperties properties;
  private final DocumentReader documentReader;
  private final LlmGateway llmGateway;

  public EvidenceSampler(
      SamplingProperties properties, DocumentReader documentReader, LlmGateway llmGateway) {
    this.properties = properties;
    this.documentReader = documentReader;
    this.llmGateway = llmGateway;
  }

  /**
   * Samples evidence from a file.
   *
   * @param query natural-language query
   * @param terms extra search terms (e.g. the winning keyword level), may be empty
   * @param file document to sample
   * @param budget probe, token and result limits
   * @param context owning query
   * @return at most {@code budget.topK()} units, best first; empty for an empty or unreadable
   *     document or a zero budget
   */
  public List<EvidenceUnit> sample(
      String query, List<String> terms, Path file, SamplingBudget budget, QueryContext context) {
    if (budget.isZero()) {
      return List.of();
    }
    return documentReader
        .read(file, context)
        .map(text -> sample(query, terms, file.toString(), text, budget, context))
        .orElse(List.of());
  }

  /**
   * Samples evidence from text already in memory.
   *
   * @param sourcePath recorded on every unit
   */
  public List<EvidenceUnit> sample(
      String query,
      List<String> terms,
      String sourcePath,
      String text,
      SamplingBudget budget,
      QueryContext context) {
    if (budget.isZero() || text.isBlank()) {
      return List.of();
    }
    context.checkActive();
    context.phase(QueryPhase.SAMPLING, sourcePath);

    List<String> allTerms = mergeTerms(query, terms);
    double[] prior = FuzzyAnchor.density(text, allTerms, properties.getBucketSize());
    SamplingState state =
        new SamplingState(
            prior,
            properties.getFloorWeight(),
            budget,
            properties.getNeighborBoost(),
            properties.getVisitedDecay());
    Random random = new Random(properties.getSeed() ^ sourcePath.hashCode());

    SamplingState.StopReason reason = SamplingState.StopReason.NONE;
    while (reason == SamplingState.StopReason.NONE) {
      for (int i = 0; i < properties.getProbesPerRound() && state.canProbe(); i++) {
        int bucket = state.draw(random);
        if (bucket < 0) {
          break;
        }
        TextSpan span = probeSpan(text, bucket);
        if (span.length() == 0) {
          state.record(bucket, span, 0.0, 1);
          continue;
        }
        String probe = text.substring(span.start(), span.end());
        double score = LexicalScorer.score(probe, allTerms);
        state.record(bucket, span, score, estimateTokens(probe));
        context.listener().onProbe(state.probesUsed());
      }
      state.endRound();
      context.checkActive();
      reason = state.stopReason();
    }
    log.debug(
        "Sampled {}: {} probes, {} tokens, {} rounds, stop={}",
        sourcePath,
        state.probesUsed(),
        state.tokensUsed(),
        state.round(),
        reason);

    List<TextSpan> regions = expand(text, state.best(budget.topK()));
    List<EvidenceUnit> units = new ArrayList<>();
    for (TextSpan region : regions) {
      String passage = text.substring(region.start(), region.end());
      double lexical = LexicalScorer.score(passage, allTerms);
      units.add(
          budget.llmConfirmation()
              ? judge(query, sourcePath, region, passage, lexical, context)
              : new EvidenceUnit(
                  sourcePath, region.start(), region.end(), passage, lexical, null, false));
    }
    units.sort(
        Comparator.comparingDouble(EvidenceUnit::score)
            .reversed()
            .thenComparingInt(EvidenceUnit::start));
    return units.size() > budget.topK() ? List.copyOf(units.subList(0, budget.topK())) : units;
  }

  private TextSpan probeSpan(String text, int bucket) {
    int center = bucket * properties.getBucketSize() + properties.getBucketSize() / 2;
    int half = properties.getProbeWindow() / 2;
    int start = Math.max(0, center - half);
    int end = Math.min(text.length(), center + half);
    return TextBoundaries.toSentences(text, start, end, properties.getProbeWindow() / 2);
  }

  private List<TextSpan> expand(String text, List<SamplingState.Probe> best) {
    List<TextSpan> spans = new ArrayList<>();
    for (SamplingState.Probe probe : best) {
      TextSpan grown =
          TextBoundaries.toParagraphs(
              text, probe.span().start(), probe.span().end(), properties.getRoiWindow());
      if (grown.length() > 0) {
        spans.add(grown);
      }
    }
    spans.sort(Comparator.comparingInt(TextSpan::start));
    List<TextSpan> merged = new ArrayList<>();
    for (TextSpan span : spans) {
      if (!merged.isEmpty() && merged.get(merged.size() - 1).overlaps(span)) {
        TextSpan last = merged.remove(merged.size() - 1);
        TextSpan union = last.union(span);
        merged.add(union.length() <= properties.getRoiWindow() ? union : longer(last, span));
      } else {
        merged.add(span);
      }
    }
    return merged;
  }

  private EvidenceUnit judge(
      String query,
      String sourcePath,
      TextSpan region,
      String passage,
      double lexical,
      QueryContext context) {
    try {
      RelevanceJudgment judgment =
          llmGateway.complete(judgePrompt(query, passage), RelevanceJudgment.class, context);
      double score = Double.isNaN(judgment.score()) ? lexical
          : Math.max(0.0, Math.min(1.0, judgment.score()));
      return new EvidenceUnit(
          sourcePath, region.start(), region.end(), passage, score, judgment.justification(),
          false);
    } catch (LlmException e) {
      context.warn(
          "Relevance scoring unavailable for " + sourcePath + ", using lexical score: "
              + e.getMessage());
      return new EvidenceUnit(
          sourcePath, region.start(), region.end(), passage, lexical, null, true);
    }
  }

  private static TextSpan longer(TextSpan a, TextSpan b) {
    return b.length() > a.length() ? b : a;
  }

  private static List<String> mergeTerms(String query, List<String> terms) {
    Set<String> merged = new LinkedHashSet<>(QueryTerms.salient(query));
    for (String term : terms) {
      if (term != null && !term.isBlank()) {
        merged.add(term.strip().toLowerCase(Locale.ROOT));
      }
    }
    return List.copyOf(merged);
  }

  private static int estimateTokens(String text) {
    return (int) Math.ceil(text.length() / CHARS_PER_TOKEN);
  }

  private static String judgePrompt(String query, String passage) {
    String clipped =
        passage.length() > MAX_JUDGED_CHARS ? passage.substring(0, MAX_JUDGED_CHARS) : passage;
    return """
        Rate how well the passage answers or supports the query.
        Reply with JSON only: {"score": <number between 0 and 1>, "justification": "<one sentence>"}

        Query: %s

        Passage:
        %s
        """
        .formatted(query, clipped);
  }
}
