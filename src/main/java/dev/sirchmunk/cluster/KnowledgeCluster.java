package dev.sirchmunk.cluster;

import dev.sirchmunk.evidence.EvidenceUnit;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A unit of reusable knowledge distilled from one or more searches.
 *
 * <p>Fields fall into three groups, each with its own writer in {@link ClusterStore}:
 *
 * <ul>
 *   <li>curated: name, description, content, evidence, patterns, constraints, abstraction level.
 *       Written by the builder, by merge/split and by reflection-driven rewrites.
 *   <li>system: confidence, hotness, lifecycle, corroborations, queries, search results, related
 *       clusters, reuse embedding, timestamps. Written by reuse and maintenance.
 *   <li>scan-derived: {@link ScanMetadata}, written only by raw scans of the source files.
 * </ul>
 *
 * <p>All mutators are package-private, so only the store can change a cluster. Maps to the {@code
 * knowledge_clusters} table managed by Flyway migrations.
 *
 * @see Lifecycle
 * @see ClusterStore
 */
@Entity
@Table(name = "knowledge_clusters")
public class KnowledgeCluster {

  /** Hotness of a newly created cluster. */
  static final double INITIAL_HOTNESS = 0.5;

  @Id
  @Column(length = 64)
  private String id;

  @Column(nullable = false)
  private String name;

  @Convert(converter = JsonColumns.ClusterTextConverter.class)
  @Column(nullable = false)
  private ClusterText description;

  @Convert(converter = JsonColumns.ClusterTextConverter.class)
  @Column(nullable = false)
  private ClusterText content;

  @Convert(converter = JsonColumns.EvidenceListConverter.class)
  @Column(nullable = false)
  private List<EvidenceUnit> evidence = new ArrayList<>();

  @Convert(converter = JsonColumns.StringListConverter.class)
  @Column(nullable = false)
  private List<String> patterns = new ArrayList<>();

  @Convert(converter = JsonColumns.ConstraintListConverter.class)
  @Column(nullable = false)
  private List<Constraint> constraints = new ArrayList<>();

  @Enumerated(EnumType.STRING)
  @Column(name = "abstraction_level", nullable = false)
  private AbstractionLevel abstractionLevel = AbstractionLevel.TECHNIQUE;

  @Column(nullable = false)
  private double confidence;

  @Column(nullable = false)
  private double hotness = INITIAL_HOTNESS;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  private Lifecycle lifecycle = Lifecycle.EMERGING;

  @Column(nullable = false)
  private int corroborations;

  @Convert(converter = JsonColumns.StringListConverter.class)
  @Column(nullable = false)
  private List<String> queries = new ArrayList<>();

  @Convert(converter = JsonColumns.StringListConverter.class)
  @Column(name = "search_results", nullable = false)
  private List<String> searchResults = new ArrayList<>();

  @Convert(converter = JsonColumns.StringListConverter.class)
  @Column(name = "related_clusters", nullable = false)
  private List<String> relatedClusters = new ArrayList<>();

  @Convert(converter = JsonColumns.EmbeddingConverter.class)
  @Column(name = "query_embedding")
  private float @Nullable [] queryEmbedding;

  @Convert(converter = JsonColumns.ScanMetadataConverter.class)
  @Column(name = "scan_metadata", nullable = false)
  private ScanMetadata scanMetadata = ScanMetadata.empty();

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "last_modified", nullable = false)
  private Instant lastModified;

  @Column(name = "last_reused_at")
  private Instant lastReusedAt;

  @Version private @Nullable Long version;

  protected KnowledgeCluster() {
    // JPA requires no-arg constructor
  }

  /**
   * Creates an {@link Lifecycle#EMERGING} cluster with initial hotness and no corroborations.
   *
   * @param id stable identifier
   * @param name human-readable label
   * @param description one or more description lines
   * @param content synthesis or snippets
   * @param evidence supporting passages, best first
   * @param confidence initial confidence in [0, 1]
   * @param abstractionLevel how general the knowledge is
   */
  public KnowledgeCluster(
      String id,
      String name,
      ClusterText description,
      ClusterText content,
      List<EvidenceUnit> evidence,
      double confidence,
      AbstractionLevel abstractionLevel) {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("id must not be blank");
    }
    this.id = id;
    this.name = name == null || name.isBlank() ? id : name;
    this.description = description == null ? ClusterText.of("") : description;
    this.content = content == null ? ClusterText.of("") : content;
    this.evidence = new ArrayList<>(evidence == null ? List.of() : evidence);
    this.confidence = clamp(confidence);
    this.abstractionLevel =
        abstractionLevel == null ? AbstractionLevel.TECHNIQUE : abstractionLevel;
  }

  @PrePersist
  protected void onCreate() {
    if (createdAt == null) {
      createdAt = Instant.now();
    }
    if (lastModified == null) {
      lastModified = createdAt;
    }
  }

  public String getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public ClusterText getDescription() {
    return description;
  }

  public ClusterText getContent() {
    return content;
  }

  public List<EvidenceUnit> getEvidence() {
    return Collections.unmodifiableList(evidence);
  }

  public List<String> getPatterns() {
    return Collections.unmodifiableList(patterns);
  }

  public List<Constraint> getConstraints() {
    return Collections.unmodifiableList(constraints);
  }

  public AbstractionLevel getAbstractionLevel() {
    return abstractionLevel;
  }

  public double getConfidence() {
    return confidence;
  }

  public double getHotness() {
    return hotness;
  }

  public Lifecycle getLifecycle() {
    return lifecycle;
  }

  public int getCorroborations() {
    return corroborations;
  }

  public List<String> getQueries() {
    return Collections.unmodifiableList(queries);
  }

  public List<String> getSearchResults() {
    return Collections.unmodifiableList(searchResults);
  }

  public List<String> getRelatedClusters() {
    return Collections.unmodifiableList(relatedClusters);
  }

  public float @Nullable [] getQueryEmbedding() {
    return queryEmbedding == null ? null : queryEmbedding.clone();
  }

  public ScanMetadata getScanMetadata() {
    return scanMetadata;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getLastModified() {
    return lastModified;
  }

  public @Nullable Instant getLastReusedAt() {
    return lastReusedAt;
  }

  /** Optimistic-lock version; {@code null} until the cluster is first persisted. */
  public @Nullable Long getVersion() {
    return version;
  }

  /** Distinct source files referenced by the evidence, in evidence order. */
  public List<String> sourcePaths() {
    return evidence.stream().map(EvidenceUnit::sourcePath).distinct().toList();
  }

  // curated fields

  void setName(String name) {
    this.name = name;
  }

  void setDescription(ClusterText description) {
    this.description = description;
  }

  void setContent(ClusterText content) {
    this.content = content;
  }

  void setEvidence(List<EvidenceUnit> evidence) {
    this.evidence = new ArrayList<>(evidence);
  }

  void setPatterns(List<String> patterns) {
    this.patterns = new ArrayList<>(patterns);
  }

  void setConstraints(List<Constraint> constraints) {
    this.constraints = new ArrayList<>(constraints);
  }

  void setAbstractionLevel(AbstractionLevel abstractionLevel) {
    this.abstractionLevel = abstractionLevel;
  }

  // system fields

  void setConfidence(double confidence) {
    this.confidence = clamp(confidence);
  }

  void setHotness(double hotness) {
    this.hotness = clamp(hotness);
  }

  /**
   * Moves to {@code target}.
   *
   * @throws IllegalStateException if the lifecycle forbids the transition
   */
  void transitionTo(Lifecycle target) {
    if (!lifecycle.canTransitionTo(target)) {
      throw new IllegalStateException(
          "Cluster " + id + " cannot move from " + lifecycle + " to " + target);
    }
    this.lifecycle = target;
  }

  void setCorroborations(int corroborations) {
    this.corroborations = corroborations;
  }

  void setQueries(List<String> queries) {
    this.queries = new ArrayList<>(queries);
  }

  void setSearchResults(List<String> searchResults) {
    this.searchResults = new ArrayList<>(searchResults);
  }

  void setRelatedClusters(List<String> relatedClusters) {
    this.relatedClusters = new ArrayList<>(relatedClusters);
  }

  void setQueryEmbedding(float @Nullable [] queryEmbedding) {
    this.queryEmbedding = queryEmbedding == null ? null : queryEmbedding.clone();
  }

  void setCreatedAt(Instant createdAt) {
    this.createdAt = createdAt;
  }

  void setLastModified(Instant lastModified) {
    this.lastModified = lastModified;
  }

  void setLastReusedAt(Instant lastReusedAt) {
    this.lastReusedAt = lastReusedAt;
  }

  // scan-derived fields

  void setScanMetadata(ScanMetadata scanMetadata) {
    this.scanMetadata = scanMetadata;
  }

  private static double clamp(double value) {
    if (Double.isNaN(value)) {
      return 0.0;
    }
    return Math.max(0.0, Math.min(1.0, value));
  }
}
