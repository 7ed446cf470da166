package dev.sirchmunk.cluster;

import dev.sirchmunk.context.QueryContext;
import dev.sirchmunk.context.QueryPhase;
import dev.sirchmunk.evidence.EvidenceUnit;
import dev.sirchmunk.llm.LlmException;
import dev.sirchmunk.llm.LlmGateway;
import dev.sirchmunk.retrieval.ContentFingerprint;
import dev.sirchmunk.retrieval.QueryTerms;
import dev.sirchmunk.retrieval.RankedFile;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Turns sampled evidence into a {@link KnowledgeCluster} and, in DEEP mode, writes the final
 * answer.
 *
 * <p>With synthesis enabled the LLM names and describes the cluster and extracts patterns and
 * constraints; if it fails, or synthesis is off, the cluster is assembled from the evidence
 * itself. The cluster id depends only on the normalized query and the set of source files, so
 * rebuilding the same topic from the same files yields the same id.
 */
@Service
public class ClusterBuilder {

  private static final Logger log = LoggerFactory.getLogger(ClusterBuilder.class);

  static final int ID_HEX_CHARS = 12;
  private static final int MAX_NAME_WORDS = 6;
  private static final int MAX_SNIPPET_CHARS = 300;
  private static final int MAX_PROMPT_EVIDENCE_CHARS = 1500;
  private static final Pattern SHOULD_SAVE =
      Pattern.compile("(?im)^\\s*SHOULD_SAVE\\s*:\\s*(true|false|yes|no)\\s*$");

  private final LlmGateway llmGateway;
  private final SourceVerifier sourceVerifier;

  public ClusterBuilder(LlmGateway llmGateway, SourceVerifier sourceVerifier) {
    this.llmGateway = llmGateway;
    this.sourceVerifier = sourceVerifier;
  }

  /**
   * Builds an EMERGING cluster that is not yet persisted. The creating search counts as its first
   * corroboration, and the source files are fingerprinted as the capture-time baseline.
   *
   * @param query originating query
   * @param files ranked files the evidence came from, best first
   * @param evidence sampled evidence, best first; may be empty
   * @param synthesize whether to ask the LLM for a synthesis
   * @param context owning query
   */
  public KnowledgeCluster build(
      String query,
      List<RankedFile> files,
      List<EvidenceUnit> evidence,
      boolean synthesize,
      QueryContext context) {
    context.checkActive();
    context.phase(QueryPhase.CLUSTER_BUILDING, evidence.size() + " evidence units");
    List<String> sources = sourcePaths(files, evidence);
    String id = clusterId(query, sources);

    KnowledgeCluster cluster = null;
    if (synthesize && !evidence.isEmpty()) {
      try {
        ClusterSynthesis synthesis =
            llmGateway.complete(synthesisPrompt(query, evidence), ClusterSynthesis.class, context);
        cluster = fromSynthesis(id, synthesis, evidence);
      } catch (LlmException e) {
        context.warn("LLM cluster synthesis failed, using evidence snippets: " + e.getMessage());
      }
    }
    if (cluster == null) {
      cluster = heuristic(id, query, files, evidence);
    }
    cluster.setQueries(List.of(query.strip()));
    cluster.setCorroborations(1);

    ScanMetadata scan = sourceVerifier.verify(sources, ScanMetadata.empty());
    if (!scan.brokenReferences().isEmpty()) {
      context.warn("Evidence references missing files: " + scan.brokenReferences());
    }
    cluster.setScanMetadata(scan);
    log.info(
        "Built cluster {} '{}' from {} evidence units", id, cluster.getName(), evidence.size());
    return cluster;
  }

  /** Records the final answer on an unsaved cluster. */
  public void attachAnswer(KnowledgeCluster cluster, String answer) {
    if (answer != null && !answer.isBlank()) {
      List<String> results = new ArrayList<>(cluster.getSearchResults());
      results.add(answer);
      cluster.setSearchResults(results);
    }
  }

  /**
   * Streams a natural-language answer for {@code query} from the cluster through the query's
   * listener. The model also judges whether the cluster is worth keeping.
   *
   * @throws LlmException if the LLM call fails after retries
   */
  public Summary summarize(String query, KnowledgeCluster cluster, QueryContext context) {
    context.phase(QueryPhase.SUMMARIZING, cluster.getId());
    String raw = llmGateway.stream(summaryPrompt(query, cluster), context);
    return parseSummary(raw);
  }

  /**
   * Answer text and save verdict.
   *
   * @param text answer with the verdict line removed
   * @param shouldSave false if the model judged the cluster low quality
   */
  public record Summary(String text, boolean shouldSave) {}

  static Summary parseSummary(String raw) {
    String text = raw == null ? "" : raw;
    Matcher matcher = SHOULD_SAVE.matcher(text);
    boolean shouldSave = true;
    int cut = -1;
    while (matcher.find()) {
      String verdict = matcher.group(1).toLowerCase(Locale.ROOT);
      shouldSave = verdict.equals("true") || verdict.equals("yes");
      cut = matcher.start();
    }
    if (cut >= 0) {
      text = text.substring(0, cut);
    }
    return new Summary(text.strip(), shouldSave);
  }

  /** {@code "C"} followed by the first hex chars of SHA-256 over the query and sorted sources. */
  static String clusterId(String query, List<String> sources) {
    String normalized = String.join(" ", QueryTerms.tokens(query));
    String key = normalized + "|" + String.join("|", sources.stream().sorted().toList());
    return "C" + ContentFingerprint.sha256(key).substring(0, ID_HEX_CHARS);
  }

  static KnowledgeCluster heuristic(
      String id, String query, List<RankedFile> files, List<EvidenceUnit> evidence) {
    List<String> description = new ArrayList<>();
    description.add("Evidence for: " + query.strip());
    for (RankedFile file : files) {
      if (file.candidate().title() != null) {
        description.add(file.candidate().fileName() + ": " + file.candidate().title());
      }
    }
    List<String> snippets = evidence.stream().map(u -> snippet(u.text())).toList();
    double confidence =
        evidence.stream().mapToDouble(EvidenceUnit::score).average().orElse(0.0);
    return new KnowledgeCluster(
        id,
        name(query),
        ClusterText.of(description),
        ClusterText.of(snippets.isEmpty() ? List.of("") : snippets),
        evidence,
        confidence,
        AbstractionLevel.TECHNIQUE);
  }

  static KnowledgeCluster fromSynthesis(
      String id, ClusterSynthesis synthesis, List<EvidenceUnit> evidence) {
    double fallbackConfidence =
        evidence.stream().mapToDouble(EvidenceUnit::score).average().orElse(0.0);
    List<String> description =
        synthesis.description() == null
            ? List.of()
            : synthesis.description().stream().filter(d -> d != null && !d.isBlank()).toList();
    KnowledgeCluster cluster =
        new KnowledgeCluster(
            id,
            synthesis.name(),
            description.isEmpty() ? ClusterText.of("") : ClusterText.of(description),
            ClusterText.of(synthesis.content() == null ? "" : synthesis.content()),
            evidence,
            synthesis.confidence() == null ? fallbackConfidence : synthesis.confidence(),
            abstractionLevel(synthesis.abstractionLevel()));
    if (synthesis.patterns() != null) {
      cluster.setPatterns(
          synthesis.patterns().stream().filter(p -> p != null && !p.isBlank()).toList());
    }
    if (synthesis.constraints() != null) {
      List<Constraint> constraints = new ArrayList<>();
      for (ClusterSynthesis.Item item : synthesis.constraints()) {
        if (item == null || item.statement() == null || item.statement().isBlank()) {
          continue;
        }
        constraints.add(new Constraint(constraintKind(item.kind()), item.statement()));
      }
      cluster.setConstraints(constraints);
    }
    return cluster;
  }

  static String name(String query) {
    List<String> terms = QueryTerms.salient(query);
    if (terms.isEmpty()) {
      return query.strip();
    }
    StringBuilder name = new StringBuilder();
    for (String term : terms.subList(0, Math.min(MAX_NAME_WORDS, terms.size()))) {
      if (name.length() > 0) {
        name.append(' ');
      }
      name.append(Character.toUpperCase(term.charAt(0))).append(term.substring(1));
    }
    return name.toString();
  }

  private static List<String> sourcePaths(List<RankedFile> files, List<EvidenceUnit> evidence) {
    if (!evidence.isEmpty()) {
      return evidence.stream().map(EvidenceUnit::sourcePath).distinct().toList();
    }
    return files.stream().map(f -> f.candidate().path().toString()).distinct().toList();
  }

  private static AbstractionLevel abstractionLevel(String value) {
    if (value == null) {
      return AbstractionLevel.TECHNIQUE;
    }
    try {
      return AbstractionLevel.valueOf(value.strip().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      log.debug("Unknown abstraction level '{}', using TECHNIQUE", value);
      return AbstractionLevel.TECHNIQUE;
    }
  }

  private static Constraint.Kind constraintKind(String value) {
    return value != null && value.strip().equalsIgnoreCase("precondition")
        ? Constraint.Kind.PRECONDITION
        : Constraint.Kind.LIMITATION;
  }

  private static String snippet(String text) {
    String flat = text.strip().replaceAll("\\s+", " ");
    return flat.length() <= MAX_SNIPPET_CHARS ? flat : flat.substring(0, MAX_SNIPPET_CHARS) + "...";
  }

  private static String synthesisPrompt(String query, List<EvidenceUnit> evidence) {
    StringBuilder prompt = new StringBuilder();
    prompt
        .append("You organise search evidence into a reusable knowledge cluster.\n")
        .append("Query: ")
        .append(query)
        .append("\n\nEvidence:\n");
    int i = 1;
    for (EvidenceUnit unit : evidence) {
      String text = unit.text();
      if (text.length() > MAX_PROMPT_EVIDENCE_CHARS) {
        text = text.substring(0, MAX_PROMPT_EVIDENCE_CHARS);
      }
      prompt
          .append("[")
          .append(i++)
          .append("] ")
          .append(unit.sourcePath())
          .append("\n")
          .append(text)
          .append("\n\n");
    }
    prompt.append(
        "Reply with JSON: {\"name\": string, \"description\": [string], \"content\": string,"
            + " \"patterns\": [string], \"constraints\": [{\"kind\": \"PRECONDITION\"|"
            + "\"LIMITATION\", \"statement\": string}], \"confidence\": number between 0 and 1,"
            + " \"abstractionLevel\": \"TECHNIQUE\"|\"PRINCIPLE\"|\"PARADIGM\"|\"FOUNDATION\"|"
            + "\"PHILOSOPHY\"}. Use only what the evidence states.");
    return prompt.toString();
  }

  private static String summaryPrompt(String query, KnowledgeCluster cluster) {
    StringBuilder prompt = new StringBuilder();
    prompt
        .append("Answer the query using only the knowledge below. Cite source files.\n")
        .append("Query: ")
        .append(query)
        .append("\n\n## ")
        .append(cluster.getName())
        .append("\n")
        .append(cluster.getDescription().joined())
        .append("\n\n")
        .append(cluster.getContent().joined())
        .append("\n");
    for (EvidenceUnit unit : cluster.getEvidence()) {
      prompt.append("\n- ").append(unit.sourcePath()).append(": ").append(snippet(unit.text()));
    }
    prompt.append(
        "\n\nAfter the answer, on its own line, write SHOULD_SAVE: true if this knowledge is"
            + " accurate and worth keeping for future queries, otherwise SHOULD_SAVE: false.");
    return prompt.toString();
  }
}
