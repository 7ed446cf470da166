package dev.sirchmunk.cluster;

import dev.sirchmunk.evidence.EvidenceUnit;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Supplier;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Persistent store of {@link KnowledgeCluster}s and the only writer of their fields.
 *
 * <p>Every write to a cluster runs under that cluster's lock inside one transaction, so
 * concurrent searches touching the same cluster are serialized and a reader never sees a half
 * applied update. Writes that touch several clusters (merge, split) take the locks in id order.
 *
 * <p>The store has an explicit open/closed state: it opens when the application context starts
 * and closes when it stops. Any call on a closed store throws {@link IllegalStateException}.
 */
@Service
public class ClusterStore {

  private static final Logger log = LoggerFactory.getLogger(ClusterStore.class);

  static final String MERGED_SUFFIX = " (merged)";

  /** Writers to the same cluster id always share a stripe; unrelated ids rarely do. */
  static final int LOCK_STRIPES = 64;

  private final KnowledgeClusterRepository repository;
  private final TransactionTemplate transactionTemplate;
  private final QueryEmbedder embedder;
  private final ClusterProperties properties;
  private final Clock clock;
  private final ReentrantLock[] stripes = new ReentrantLock[LOCK_STRIPES];

  private volatile boolean open;

  public ClusterStore(
      KnowledgeClusterRepository repository,
      PlatformTransactionManager transactionManager,
      QueryEmbedder embedder,
      ClusterProperties properties,
      Clock clock) {
    this.repository = repository;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
    this.embedder = embedder;
    this.properties = properties;
    this.clock = clock;
    for (int i = 0; i < stripes.length; i++) {
      stripes[i] = new ReentrantLock();
    }
  }

  @PostConstruct
  public void open() {
    open = true;
    log.info("Cluster store open");
  }

  @PreDestroy
  public void close() {
    open = false;
    log.info("Cluster store closed");
  }

  public boolean isOpen() {
    return open;
  }

  // ---- basic CRUD ----

  /**
   * Persists a new cluster. Computes its reuse embedding from its query history when it has none.
   *
   * @throws ClusterConflictException if a cluster with the same id already exists
   */
  public KnowledgeCluster insert(KnowledgeCluster cluster) {
    ensureOpen();
    return withLock(
        cluster.getId(),
        () -> {
          if (repository.existsById(cluster.getId())) {
            throw new ClusterConflictException("Cluster already exists: " + cluster.getId());
          }
          Instant now = clock.instant();
          cluster.setCreatedAt(now);
          cluster.setLastModified(now);
          if (cluster.getQueryEmbedding() == null) {
            embedder.embedHistory(cluster.getQueries()).ifPresent(cluster::setQueryEmbedding);
          }
          KnowledgeCluster saved = repository.save(cluster);
          log.info("Inserted cluster {} '{}'", saved.getId(), saved.getName());
          return saved;
        });
  }

  public Optional<KnowledgeCluster> get(String id) {
    ensureOpen();
    return repository.findById(id);
  }

  /**
   * Applies curated edits. Only non-null fields of {@code update} change.
   *
   * @throws IllegalArgumentException if the cluster does not exist
   */
  public KnowledgeCluster update(String id, CuratedUpdate update) {
    ensureOpen();
    return withLock(
        id,
        () -> {
          KnowledgeCluster cluster = require(id);
          if (update.name() != null) {
            cluster.setName(update.name());
          }
          if (update.description() != null) {
            cluster.setDescription(update.description());
          }
          if (update.content() != null) {
            cluster.setContent(update.content());
          }
          if (update.evidence() != null) {
            cluster.setEvidence(update.evidence());
          }
          if (update.patterns() != null) {
            cluster.setPatterns(update.patterns());
          }
          if (update.constraints() != null) {
            cluster.setConstraints(update.constraints());
          }
          if (update.abstractionLevel() != null) {
            cluster.setAbstractionLevel(update.abstractionLevel());
          }
          cluster.setLastModified(clock.instant());
          return repository.save(cluster);
        });
  }

  /**
   * Records the result of a raw scan of the cluster's sources. Touches only the scan-derived
   * metadata; curated fields and the last-modified timestamp stay as they are.
   *
   * @throws IllegalArgumentException if the cluster does not exist
   */
  public KnowledgeCluster applyScan(String id, ScanMetadata scan) {
    ensureOpen();
    return withLock(
        id,
        () -> {
          KnowledgeCluster cluster = require(id);
          cluster.setScanMetadata(scan);
          return repository.save(cluster);
        });
  }

  /** @return true if a cluster was removed */
  public boolean delete(String id) {
    ensureOpen();
    return withLock(
        id,
        () -> {
          if (!repository.existsById(id)) {
            return false;
          }
          repository.deleteById(id);
          log.info("Deleted cluster {}", id);
          return true;
        });
  }

  /**
   * Retires a cluster.
   *
   * @throws IllegalArgumentException if the cluster does not exist
   */
  public KnowledgeCluster deprecate(String id, String reason) {
    ensureOpen();
    return withLock(
        id,
        () -> {
          KnowledgeCluster cluster = require(id);
          cluster.transitionTo(Lifecycle.DEPRECATED);
          cluster.setLastModified(clock.instant());
          log.info("Deprecated cluster {}: {}", id, reason);
          return repository.save(cluster);
        });
  }

  /**
   * Lists clusters ordered by {@code order}, descending, ties by id.
   *
   * @param limit maximum number of clusters, at least 1
   */
  public List<KnowledgeCluster> list(int limit, ClusterSortOrder order) {
    ensureOpen();
    if (limit < 1) {
      throw new IllegalArgumentException("limit must be >= 1, got: " + limit);
    }
    Sort sort = Sort.by(Sort.Direction.DESC, order.property()).and(Sort.by("id"));
    return repository.findAll(PageRequest.of(0, limit, sort)).getContent();
  }

  /**
   * Finds clusters matching free text, best match first: exact id, then name prefix, then name
   * containing the text, then description, then content or patterns, then clusters sharing at
   * least half of the text's words. Within a rank, hotter clusters come first.
   */
  public List<KnowledgeCluster> find(String text, int limit) {
    ensureOpen();
    String needle = text == null ? "" : text.strip().toLowerCase(Locale.ROOT);
    if (needle.isEmpty() || limit < 1) {
      return List.of();
    }
    record Ranked(KnowledgeCluster cluster, int rank) {}
    return repository.findAll().stream()
        .map(c -> new Ranked(c, matchRank(c, needle)))
        .filter(r -> r.rank() >= 0)
        .sorted(
            Comparator.comparingInt(Ranked::rank)
                .thenComparing(r -> r.cluster().getHotness(), Comparator.reverseOrder())
                .thenComparing(r -> r.cluster().getId()))
        .limit(limit)
        .map(Ranked::cluster)
        .toList();
  }

  static int matchRank(KnowledgeCluster cluster, String needle) {
    String name = cluster.getName().toLowerCase(Locale.ROOT);
    if (cluster.getId().equalsIgnoreCase(needle)) {
      return 0;
    }
    if (name.startsWith(needle)) {
      return 1;
    }
    if (name.contains(needle)) {
      return 2;
    }
    String description = cluster.getDescription().joined().toLowerCase(Locale.ROOT);
    if (description.contains(needle)) {
      return 3;
    }
    String body =
        (cluster.getContent().joined() + "\n" + String.join("\n", cluster.getPatterns()))
            .toLowerCase(Locale.ROOT);
    if (body.contains(needle)) {
      return 4;
    }
    String[] words = needle.split("\\W+");
    String haystack = name + "\n" + description;
    long shared = Arrays.stream(words).filter(w -> w.length() > 1 && haystack.contains(w)).count();
    return words.length > 0 && shared * 2 >= words.length && shared > 0 ? 5 : -1;
  }

  // ---- reuse ----

  /**
   * Decides whether a query can be answered from an existing cluster by comparing the query's
   * embedding with each non-deprecated cluster's query-history embedding.
   */
  public ReuseDecision findReusable(String query) {
    ensureOpen();
    if (!properties.isReuseEnabled()) {
      return ReuseDecision.none();
    }
    Optional<float[]> queryVector = embedder.embed(query);
    if (queryVector.isEmpty()) {
      return ReuseDecision.none();
    }
    List<ReuseDecision.Candidate> candidates =
        repository.findByLifecycleNot(Lifecycle.DEPRECATED).stream()
            .filter(c -> c.getQueryEmbedding() != null)
            .map(
                c ->
                    new ReuseDecision.Candidate(
                        c.getId(), QueryEmbedder.cosine(queryVector.get(), c.getQueryEmbedding())))
            .filter(c -> c.similarity() >= properties.getSimilarityThreshold())
            .sorted(
                Comparator.comparingDouble(ReuseDecision.Candidate::similarity)
                    .reversed()
                    .thenComparing(ReuseDecision.Candidate::clusterId))
            .limit(properties.getReuseTopK())
            .toList();
    if (candidates.isEmpty()) {
      return ReuseDecision.none();
    }
    if (candidates.size() > 1
        && candidates.get(0).similarity() - candidates.get(1).similarity()
            <= properties.getTieBand()) {
      log.debug("Ambiguous reuse for '{}': {}", query, candidates);
      return new ReuseDecision(ReuseDecision.Outcome.AMBIGUOUS, candidates);
    }
    return new ReuseDecision(ReuseDecision.Outcome.REUSE, candidates);
  }

  /**
   * Records that {@code query} was answered from the cluster: raises hotness, nudges confidence
   * toward the similarity, appends the query to the bounded history and recomputes the reuse
   * embedding. A query not yet in the history counts as a corroboration and may promote an
   * EMERGING cluster to STABLE. Repeating a known query never adds a corroboration.
   *
   * @throws ClusterConflictException if the cluster was deprecated since the decision
   * @throws IllegalArgumentException if the cluster does not exist
   */
  public KnowledgeCluster recordReuse(String id, String query, double similarity) {
    ensureOpen();
    return withLock(
        id,
        () -> {
          KnowledgeCluster cluster = require(id);
          if (cluster.getLifecycle() == Lifecycle.DEPRECATED) {
            throw new ClusterConflictException("Cluster " + id + " is deprecated");
          }
          Instant now = clock.instant();
          cluster.setHotness(cluster.getHotness() + properties.getHotnessIncrement());
          double confidence = cluster.getConfidence();
          cluster.setConfidence(
              confidence + properties.getConfidenceNudge() * (similarity - confidence));
          if (appendQuery(cluster, query)) {
            cluster.setCorroborations(cluster.getCorroborations() + 1);
            promoteIfCorroborated(cluster);
          }
          cluster.setLastReusedAt(now);
          cluster.setLastModified(now);
          return repository.save(cluster);
        });
  }

  /**
   * Folds a freshly built cluster for the same topic into an existing one. Evidence from the same
   * file and an overlapping span but different text is a contradiction: the cluster becomes
   * CONTESTED and both passages are kept. A contradiction-free refresh reconciles a CONTESTED
   * cluster to STABLE, but only once it holds the corroborations a STABLE cluster needs.
   *
   * @throws ClusterConflictException if the existing cluster is deprecated
   * @throws IllegalArgumentException if the cluster does not exist
   */
  public KnowledgeCluster augment(String id, KnowledgeCluster fresh, String query) {
    ensureOpen();
    return withLock(
        id,
        () -> {
          KnowledgeCluster cluster = require(id);
          if (cluster.getLifecycle() == Lifecycle.DEPRECATED) {
            throw new ClusterConflictException("Cluster " + id + " is deprecated");
          }
          boolean contradicted = contradicts(cluster.getEvidence(), fresh.getEvidence());
          cluster.setConfidence(weightedConfidence(List.of(cluster, fresh)));
          cluster.setEvidence(unionEvidence(cluster.getEvidence(), fresh.getEvidence()));
          cluster.setDescription(
              ClusterText.union(cluster.getDescription(), fresh.getDescription()));
          cluster.setContent(ClusterText.union(cluster.getContent(), fresh.getContent()));
          cluster.setPatterns(union(cluster.getPatterns(), fresh.getPatterns()));
          cluster.setConstraints(union(cluster.getConstraints(), fresh.getConstraints()));
          cluster.setSearchResults(
              fifo(union(cluster.getSearchResults(), fresh.getSearchResults())));
          boolean newQuery = appendQuery(cluster, query);
          if (contradicted) {
            log.info("Cluster {} contested by query '{}'", id, query);
            cluster.transitionTo(Lifecycle.CONTESTED);
          } else {
            if (newQuery) {
              cluster.setCorroborations(cluster.getCorroborations() + 1);
            }
            if (cluster.getLifecycle() == Lifecycle.CONTESTED) {
              reconcileIfCorroborated(cluster, query);
            } else {
              promoteIfCorroborated(cluster);
            }
          }
          Instant now = clock.instant();
          cluster.setLastReusedAt(now);
          cluster.setLastModified(now);
          return repository.save(cluster);
        });
  }

  // ---- merge and split ----

  /**
   * Merges clusters into the first one. The result keeps the union of evidence, an
   * evidence-weighted confidence, the most advanced lifecycle and the summed corroborations; the
   * other clusters are removed.
   *
   * @param ids at least two distinct cluster ids; the first survives
   * @throws IllegalArgumentException if fewer than two ids are given or one is unknown
   * @throws ClusterConflictException if any cluster is deprecated
   */
  public KnowledgeCluster merge(List<String> ids) {
    ensureOpen();
    List<String> distinct = List.copyOf(new LinkedHashSet<>(ids));
    if (distinct.size() < 2) {
      throw new IllegalArgumentException("merge needs at least two distinct clusters");
    }
    return withLocks(
        distinct,
        () -> {
          List<KnowledgeCluster> clusters = distinct.stream().map(this::require).toList();
          for (KnowledgeCluster c : clusters) {
            if (c.getLifecycle() == Lifecycle.DEPRECATED) {
              throw new ClusterConflictException("Cannot merge deprecated cluster " + c.getId());
            }
          }
          KnowledgeCluster primary = clusters.get(0);
          List<KnowledgeCluster> others = clusters.subList(1, clusters.size());

          Lifecycle lifecycle = primary.getLifecycle();
          double hotness = 0.0;
          int corroborations = 0;
          List<EvidenceUnit> evidence = primary.getEvidence();
          ClusterText description = primary.getDescription();
          ClusterText content = primary.getContent();
          List<String> patterns = primary.getPatterns();
          List<Constraint> constraints = primary.getConstraints();
          List<String> queries = primary.getQueries();
          List<String> results = primary.getSearchResults();
          LinkedHashSet<String> related = new LinkedHashSet<>(primary.getRelatedClusters());
          for (KnowledgeCluster c : clusters) {
            hotness += c.getHotness();
            corroborations += c.getCorroborations();
            lifecycle = Lifecycle.mostAdvanced(lifecycle, c.getLifecycle());
          }
          for (KnowledgeCluster other : others) {
            evidence = unionEvidence(evidence, other.getEvidence());
            description = ClusterText.union(description, other.getDescription());
            content = ClusterText.union(content, other.getContent());
            patterns = union(patterns, other.getPatterns());
            constraints = union(constraints, other.getConstraints());
            queries = union(queries, other.getQueries());
            results = union(results, other.getSearchResults());
            related.addAll(other.getRelatedClusters());
          }
          related.removeAll(distinct);

          primary.setConfidence(weightedConfidence(clusters));
          primary.setHotness(hotness / clusters.size());
          primary.setCorroborations(corroborations);
          primary.transitionTo(lifecycle);
          primary.setEvidence(evidence);
          primary.setDescription(description);
          primary.setContent(content);
          primary.setPatterns(patterns);
          primary.setConstraints(constraints);
          primary.setQueries(fifo(queries));
          primary.setSearchResults(fifo(results));
          primary.setRelatedClusters(List.copyOf(related));
          if (!primary.getName().endsWith(MERGED_SUFFIX)) {
            primary.setName(primary.getName() + MERGED_SUFFIX);
          }
          embedder.embedHistory(primary.getQueries()).ifPresent(primary::setQueryEmbedding);
          primary.setLastModified(clock.instant());

          others.forEach(repository::delete);
          KnowledgeCluster saved = repository.save(primary);
          log.info(
              "Merged {} into cluster {}", distinct.subList(1, distinct.size()), saved.getId());
          return saved;
        });
  }

  /**
   * Splits a cluster by grouping its evidence with {@code criterion}. Each group becomes an
   * EMERGING child named after the parent and the group key, with id {@code <parent>_split<i>};
   * the parent is removed. Children start with an empty query history and a reuse embedding of
   * their own name and content, so they do not tie with each other on the parent's queries. A
   * cluster whose evidence falls into a single group is returned unchanged.
   *
   * @throws IllegalArgumentException if the cluster does not exist
   * @throws ClusterConflictException if the cluster is deprecated or a child id is already taken
   */
  public List<KnowledgeCluster> split(String id, Function<EvidenceUnit, String> criterion) {
    ensureOpen();
    return withLock(
        id,
        () -> {
          KnowledgeCluster parent = require(id);
          if (parent.getLifecycle() == Lifecycle.DEPRECATED) {
            throw new ClusterConflictException("Cannot split deprecated cluster " + id);
          }
          Map<String, List<EvidenceUnit>> groups = new LinkedHashMap<>();
          for (EvidenceUnit unit : parent.getEvidence()) {
            groups.computeIfAbsent(criterion.apply(unit), k -> new ArrayList<>()).add(unit);
          }
          if (groups.size() < 2) {
            return List.of(parent);
          }
          List<String> childIds = new ArrayList<>();
          for (int i = 0; i < groups.size(); i++) {
            String childId = id + "_split" + i;
            if (repository.existsById(childId)) {
              throw new ClusterConflictException("Split target already exists: " + childId);
            }
            childIds.add(childId);
          }
          Instant now = clock.instant();
          List<KnowledgeCluster> children = new ArrayList<>();
          int i = 0;
          for (Map.Entry<String, List<EvidenceUnit>> group : groups.entrySet()) {
            String childId = childIds.get(i++);
            KnowledgeCluster child =
                new KnowledgeCluster(
                    childId,
                    parent.getName() + " (" + group.getKey() + ")",
                    parent.getDescription(),
                    ClusterText.of(group.getValue().stream().map(EvidenceUnit::text).toList()),
                    group.getValue(),
                    parent.getConfidence(),
                    parent.getAbstractionLevel());
            child.setPatterns(parent.getPatterns());
            child.setConstraints(parent.getConstraints());
            child.setHotness(parent.getHotness());
            embedder
                .embedHistory(List.of(child.getName(), child.getContent().joined()))
                .ifPresent(child::setQueryEmbedding);
            child.setCorroborations(1);
            child.setRelatedClusters(childIds.stream().filter(c -> !c.equals(childId)).toList());
            child.setCreatedAt(now);
            child.setLastModified(now);
            children.add(child);
          }
          repository.delete(parent);
          repository.flush();
          List<KnowledgeCluster> saved = repository.saveAll(children);
          log.info("Split cluster {} into {}", id, childIds);
          return saved;
        });
  }

  // ---- maintenance ----

  /**
   * Multiplies the hotness of every cluster not reused since {@code since} by {@code factor}.
   *
   * @return number of clusters cooled
   */
  public int decayHotness(double factor, @Nullable Instant since) {
    ensureOpen();
    int cooled = 0;
    for (KnowledgeCluster candidate : repository.findByLifecycleNot(Lifecycle.DEPRECATED)) {
      boolean decayed =
          withLock(
              candidate.getId(),
              () -> {
                Optional<KnowledgeCluster> current = repository.findById(candidate.getId());
                if (current.isEmpty()) {
                  return false;
                }
                KnowledgeCluster cluster = current.get();
                Instant reused = cluster.getLastReusedAt();
                if (since != null && reused != null && !reused.isBefore(since)) {
                  return false;
                }
                cluster.setHotness(cluster.getHotness() * factor);
                repository.save(cluster);
                return true;
              });
      if (decayed) {
        cooled++;
      }
    }
    return cooled;
  }

  /** Ids of every cluster that is not deprecated. */
  public List<String> activeClusterIds() {
    ensureOpen();
    return repository.findByLifecycleNot(Lifecycle.DEPRECATED).stream()
        .map(KnowledgeCluster::getId)
        .sorted()
        .toList();
  }

  /** Distributions over the whole store. */
  public ClusterStats stats() {
    ensureOpen();
    List<KnowledgeCluster> all = repository.findAll();
    Map<Lifecycle, Long> lifecycles = new EnumMap<>(Lifecycle.class);
    for (Lifecycle l : Lifecycle.values()) {
      lifecycles.put(l, 0L);
    }
    int[] confidence = new int[ClusterStats.BINS];
    int[] hotness = new int[ClusterStats.BINS];
    double confidenceSum = 0.0;
    long withEmbedding = 0;
    for (KnowledgeCluster c : all) {
      lifecycles.merge(c.getLifecycle(), 1L, Long::sum);
      confidence[bin(c.getConfidence())]++;
      hotness[bin(c.getHotness())]++;
      confidenceSum += c.getConfidence();
      if (c.getQueryEmbedding() != null) {
        withEmbedding++;
      }
    }
    return new ClusterStats(
        all.size(),
        lifecycles,
        Arrays.stream(confidence).boxed().toList(),
        Arrays.stream(hotness).boxed().toList(),
        all.isEmpty() ? 0.0 : confidenceSum / all.size(),
        withEmbedding);
  }

  static int bin(double value) {
    return Math.min(ClusterStats.BINS - 1, (int) Math.floor(value * ClusterStats.BINS));
  }

  // ---- helpers ----

  private void ensureOpen() {
    if (!open) {
      throw new IllegalStateException("Cluster store is closed");
    }
  }

  private KnowledgeCluster require(String id) {
    return repository
        .findById(id)
        .orElseThrow(() -> new IllegalArgumentException("No cluster with id " + id));
  }

  private <T> T withLock(String id, Supplier<T> work) {
    ReentrantLock lock = stripes[stripe(id)];
    lock.lock();
    try {
      return transactionTemplate.execute(status -> work.get());
    } finally {
      lock.unlock();
    }
  }

  static int stripe(String id) {
    return Math.floorMod(id.hashCode(), LOCK_STRIPES);
  }

  private <T> T withLocks(List<String> ids, Supplier<T> work) {
    List<ReentrantLock> held = new ArrayList<>();
    try {
      // stripes in ascending order so two multi-id writers never wait on each other in a cycle
      for (int index : ids.stream().map(ClusterStore::stripe).distinct().sorted().toList()) {
        ReentrantLock lock = stripes[index];
        lock.lock();
        held.add(lock);
      }
      return transactionTemplate.execute(status -> work.get());
    } finally {
      for (int i = held.size() - 1; i >= 0; i--) {
        held.get(i).unlock();
      }
    }
  }

  /**
   * Appends a query to the bounded history and refreshes the embedding.
   *
   * @return true if the query was not already in the history
   */
  private boolean appendQuery(KnowledgeCluster cluster, String query) {
    String normalized = query.strip();
    boolean known =
        cluster.getQueries().stream().anyMatch(q -> q.strip().equalsIgnoreCase(normalized));
    List<String> queries = new ArrayList<>(cluster.getQueries());
    queries.removeIf(q -> q.strip().equalsIgnoreCase(normalized));
    queries.add(normalized);
    cluster.setQueries(fifo(queries));
    embedder.embedHistory(cluster.getQueries()).ifPresent(cluster::setQueryEmbedding);
    return !known;
  }

  private void promoteIfCorroborated(KnowledgeCluster cluster) {
    if (cluster.getLifecycle() == Lifecycle.EMERGING
        && cluster.getCorroborations() >= properties.getCorroborationCount()) {
      log.info(
          "Cluster {} promoted to STABLE after {} corroborations",
          cluster.getId(),
          cluster.getCorroborations());
      cluster.transitionTo(Lifecycle.STABLE);
    }
  }

  private void reconcileIfCorroborated(KnowledgeCluster cluster, String query) {
    if (cluster.getCorroborations() < properties.getCorroborationCount()) {
      log.info(
          "Cluster {} stays CONTESTED: {} of {} corroborations",
          cluster.getId(),
          cluster.getCorroborations(),
          properties.getCorroborationCount());
      return;
    }
    log.info("Cluster {} reconciled by query '{}'", cluster.getId(), query);
    cluster.transitionTo(Lifecycle.STABLE);
  }

  private <T> List<T> fifo(List<T> values) {
    int max = properties.getMaxQueries();
    return values.size() <= max ? values : values.subList(values.size() - max, values.size());
  }

  static boolean contradicts(List<EvidenceUnit> existing, List<EvidenceUnit> incoming) {
    for (EvidenceUnit in : incoming) {
      for (EvidenceUnit old : existing) {
        if (old.overlaps(in) && !normalize(old.text()).equals(normalize(in.text()))) {
          return true;
        }
      }
    }
    return false;
  }

  /** Keeps every existing unit and adds incoming units that are not the same span. */
  static List<EvidenceUnit> unionEvidence(
      List<EvidenceUnit> existing, List<EvidenceUnit> incoming) {
    List<EvidenceUnit> merged = new ArrayList<>(existing);
    for (EvidenceUnit in : incoming) {
      boolean duplicate =
          merged.stream()
              .anyMatch(
                  u ->
                      u.sourcePath().equals(in.sourcePath())
                          && u.start() == in.start()
                          && u.end() == in.end());
      if (!duplicate) {
        merged.add(in);
      }
    }
    return merged;
  }

  /** Mean confidence weighted by evidence count; a cluster without evidence weighs 1. */
  static double weightedConfidence(List<KnowledgeCluster> clusters) {
    double sum = 0.0;
    double weights = 0.0;
    for (KnowledgeCluster c : clusters) {
      int weight = Math.max(1, c.getEvidence().size());
      sum += c.getConfidence() * weight;
      weights += weight;
    }
    return weights == 0.0 ? 0.0 : sum / weights;
  }

  private static <T> List<T> union(List<T> a, List<T> b) {
    LinkedHashSet<T> set = new LinkedHashSet<>(a);
    set.addAll(b);
    return List.copyOf(set);
  }

  private static String normalize(String text) {
    return text.strip().replaceAll("\\s+", " ");
  }
}
