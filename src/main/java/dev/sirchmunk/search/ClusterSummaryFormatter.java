package dev.sirchmunk.search;

import dev.sirchmunk.cluster.Constraint;
import dev.sirchmunk.cluster.KnowledgeCluster;
import dev.sirchmunk.evidence.EvidenceUnit;
import dev.sirchmunk.retrieval.FilenameMatch;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Formats answers as readable text within a token budget.
 *
 * <p>Uses character-based token estimation (chars / 4). The answer is built from blocks (header,
 * then one block per evidence unit or file) that are accumulated until the budget is reached. If
 * even the first block exceeds the budget it is included but cut at the character level, so an
 * answer is never empty when there is something to show.
 */
@Component
public class ClusterSummaryFormatter {

  private static final double CHARS_PER_TOKEN = 4.0;

  private final int tokenBudget;

  public ClusterSummaryFormatter(SearchProperties properties) {
    this.tokenBudget = properties.getSummaryTokenBudget();
  }

  /** Summary of a cluster: name, description, content, patterns, constraints, then evidence. */
  public String format(KnowledgeCluster cluster) {
    List<String> blocks = new ArrayList<>();
    StringBuilder header = new StringBuilder();
    header.append("# ").append(cluster.getName()).append('\n');
    header
        .append("Cluster: ")
        .append(cluster.getId())
        .append(" | ")
        .append(cluster.getLifecycle())
        .append(String.format(Locale.US, " | confidence %.2f", cluster.getConfidence()))
        .append("\n\n");
    if (!cluster.getDescription().isBlank()) {
      header.append(cluster.getDescription().joined()).append("\n\n");
    }
    if (!cluster.getContent().isBlank()) {
      header.append(cluster.getContent().joined()).append("\n\n");
    }
    blocks.add(header.toString());
    if (!cluster.getPatterns().isEmpty()) {
      blocks.add("## Patterns\n- " + String.join("\n- ", cluster.getPatterns()) + "\n\n");
    }
    if (!cluster.getConstraints().isEmpty()) {
      StringBuilder constraints = new StringBuilder("## Constraints\n");
      for (Constraint constraint : cluster.getConstraints()) {
        constraints
            .append("- ")
            .append(constraint.kind())
            .append(": ")
            .append(constraint.statement())
            .append('\n');
      }
      blocks.add(constraints.append('\n').toString());
    }
    blocks.addAll(evidenceBlocks(cluster.getEvidence()));
    return truncate(blocks);
  }

  /** Best-effort answer from raw evidence, used when no cluster was built. */
  public String formatEvidence(String query, List<EvidenceUnit> evidence) {
    List<String> blocks = new ArrayList<>();
    blocks.add("# Evidence for: " + query + "\n\n");
    blocks.addAll(evidenceBlocks(evidence));
    return truncate(blocks);
  }

  /** Files only, used when sampling produced nothing. */
  public String formatFiles(String query, List<FileHit> files) {
    List<String> blocks = new ArrayList<>();
    blocks.add("# Files matching: " + query + "\n\n");
    int index = 1;
    for (FileHit file : files) {
      blocks.add(
          String.format(
              Locale.US,
              "[%d] %s (score %.3f)%s\n",
              index++,
              file.path(),
              file.score(),
              file.title() == null ? "" : " - " + file.title()));
    }
    return truncate(blocks);
  }

  /** Answer of a FILENAME_ONLY search. */
  public String formatFilenames(String query, List<FilenameMatch> matches) {
    if (matches.isEmpty()) {
      return "No file names match: " + query;
    }
    List<String> blocks = new ArrayList<>();
    blocks.add("# File names matching: " + query + "\n\n");
    int index = 1;
    for (FilenameMatch match : matches) {
      blocks.add(
          String.format(
              Locale.US,
              "[%d] %s (score %.2f)\n",
              index++,
              match.candidate().path(),
              match.score()));
    }
    return truncate(blocks);
  }

  public int getTokenBudget() {
    return tokenBudget;
  }

  int estimateTokens(String text) {
    return (int) Math.ceil(text.length() / CHARS_PER_TOKEN);
  }

  private static List<String> evidenceBlocks(List<EvidenceUnit> evidence) {
    List<String> blocks = new ArrayList<>();
    int index = 1;
    for (EvidenceUnit unit : evidence) {
      blocks.add(
          String.format(
              Locale.US,
              "## [%d] %s:%d-%d (score %.3f)%s\n%s\n\n---\n",
              index++,
              unit.sourcePath(),
              unit.start(),
              unit.end(),
              unit.score(),
              unit.justification() == null ? "" : "\n" + unit.justification(),
              unit.text().strip()));
    }
    return blocks;
  }

  private String truncate(List<String> blocks) {
    StringBuilder output = new StringBuilder();
    int estimatedTokens = 0;
    for (int i = 0; i < blocks.size(); i++) {
      String block = blocks.get(i);
      int blockTokens = estimateTokens(block);
      if (i == 0 && blockTokens > tokenBudget) {
        // first block alone exceeds the budget: cut at character level
        int maxChars = (int) (tokenBudget * CHARS_PER_TOKEN);
        output.append(block, 0, Math.min(maxChars, block.length()));
        break;
      }
      if (estimatedTokens + blockTokens > tokenBudget) {
        break;
      }
      output.append(block);
      estimatedTokens += blockTokens;
    }
    return output.toString().strip();
  }
}
