package dev.sirchmunk.cluster;

import dev.langchain4j.model.embedding.EmbeddingModel;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Embeds queries for cluster reuse. A cluster's embedding is computed from its whole query
 * history joined together, so it drifts toward the topic its queries share.
 */
@Component
public class QueryEmbedder {

  private static final Logger log = LoggerFactory.getLogger(QueryEmbedder.class);

  private final EmbeddingModel embeddingModel;

  public QueryEmbedder(EmbeddingModel embeddingModel) {
    this.embeddingModel = embeddingModel;
  }

  /**
   * Embeds one query.
   *
   * @return the vector, or empty if the model failed
   */
  public Optional<float[]> embed(String query) {
    try {
      return Optional.of(embeddingModel.embed(query).content().vector());
    } catch (RuntimeException e) {
      log.warn("Query embedding failed: {}", e.getMessage());
      return Optional.empty();
    }
  }

  /** Embeds a query history; empty history yields empty. */
  public Optional<float[]> embedHistory(List<String> queries) {
    if (queries.isEmpty()) {
      return Optional.empty();
    }
    return embed(String.join("\n", queries));
  }

  /**
   * Cosine similarity of two vectors.
   *
   * @return similarity in [-1, 1]; 0 if either vector is zero or the lengths differ
   */
  public static double cosine(float[] a, float[] b) {
    if (a.length != b.length || a.length == 0) {
      return 0.0;
    }
    double dot = 0.0;
    double normA = 0.0;
    double normB = 0.0;
    for (int i = 0; i < a.length; i++) {
      dot += (double) a[i] * b[i];
      normA += (double) a[i] * a[i];
      normB += (double) b[i] * b[i];
    }
    if (normA == 0.0 || normB == 0.0) {
      return 0.0;
    }
    return dot / (Math.sqrt(normA) * Math.sqrt(normB));
  }
}
