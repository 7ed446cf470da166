package dev.sirchmunk.fixture;

import dev.sirchmunk.cluster.AbstractionLevel;
import dev.sirchmunk.cluster.ClusterText;
import dev.sirchmunk.cluster.KnowledgeCluster;
import dev.sirchmunk.cluster.Lifecycle;
import dev.sirchmunk.evidence.EvidenceUnit;
import java.lang.reflect.Field;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Lightweight test builder for the {@link KnowledgeCluster} JPA entity. Provides sensible defaults
 * so tests only override what they care about. System fields the store normally owns (lifecycle,
 * hotness, corroborations, queries, embedding) are set by reflection.
 *
 * <pre>{@code
 * KnowledgeCluster cluster =
 *     new KnowledgeClusterBuilder().id("C1").lifecycle(Lifecycle.STABLE).build();
 * }</pre>
 */
public final class KnowledgeClusterBuilder {

  private String id = "C000000000001";
  private String name = "Retry Backoff";
  private ClusterText description = ClusterText.of("How retries back off");
  private ClusterText content = ClusterText.of("Retries use exponential backoff.");
  private List<EvidenceUnit> evidence = new ArrayList<>();
  private double confidence = 0.6;
  private AbstractionLevel abstractionLevel = AbstractionLevel.TECHNIQUE;
  private @Nullable Lifecycle lifecycle;
  private @Nullable Double hotness;
  private int corroborations = 1;
  private List<String> queries = List.of("how does retry backoff work");
  private float @Nullable [] queryEmbedding;

  /** Evidence unit with score 0.8 and no justification. */
  public static EvidenceUnit evidence(String path, int start, int end, String text) {
    return new EvidenceUnit(path, start, end, text, 0.8, null, false);
  }

  public KnowledgeClusterBuilder id(String id) {
    this.id = id;
    return this;
  }

  public KnowledgeClusterBuilder name(String name) {
    this.name = name;
    return this;
  }

  public KnowledgeClusterBuilder description(String description) {
    this.description = ClusterText.of(description);
    return this;
  }

  public KnowledgeClusterBuilder content(String content) {
    this.content = ClusterText.of(content);
    return this;
  }

  public KnowledgeClusterBuilder evidence(EvidenceUnit... units) {
    this.evidence = new ArrayList<>(List.of(units));
    return this;
  }

  public KnowledgeClusterBuilder confidence(double confidence) {
    this.confidence = confidence;
    return this;
  }

  public KnowledgeClusterBuilder abstractionLevel(AbstractionLevel abstractionLevel) {
    this.abstractionLevel = abstractionLevel;
    return this;
  }

  public KnowledgeClusterBuilder lifecycle(Lifecycle lifecycle) {
    this.lifecycle = lifecycle;
    return this;
  }

  public KnowledgeClusterBuilder hotness(double hotness) {
    this.hotness = hotness;
    return this;
  }

  public KnowledgeClusterBuilder corroborations(int corroborations) {
    this.corroborations = corroborations;
    return this;
  }

  public KnowledgeClusterBuilder queries(String... queries) {
    this.queries = List.of(queries);
    return this;
  }

  public KnowledgeClusterBuilder queryEmbedding(float... queryEmbedding) {
    this.queryEmbedding = queryEmbedding;
    return this;
  }

  public KnowledgeCluster build() {
    KnowledgeCluster cluster =
        new KnowledgeCluster(
            id, name, description, content, evidence, confidence, abstractionLevel);
    if (lifecycle != null) {
      setField(cluster, "lifecycle", lifecycle);
    }
    if (hotness != null) {
      setField(cluster, "hotness", hotness);
    }
    setField(cluster, "corroborations", corroborations);
    setField(cluster, "queries", new ArrayList<>(queries));
    if (queryEmbedding != null) {
      setField(cluster, "queryEmbedding", queryEmbedding.clone());
    }
    return cluster;
  }

  private static void setField(KnowledgeCluster cluster, String fieldName, Object value) {
    try {
      Field field = KnowledgeCluster.class.getDeclaredField(fieldName);
      field.setAccessible(true);
      field.set(cluster, value);
    } catch (ReflectiveOperationException e) {
      throw new IllegalStateException("Failed to set field " + fieldName, e);
    }
  }
}
