package dev.sirchmunk.search;

import dev.sirchmunk.cluster.ClusterBuilder;
import dev.sirchmunk.cluster.ClusterConflictException;
import dev.sirchmunk.cluster.ClusterSortOrder;
import dev.sirchmunk.cluster.ClusterStore;
import dev.sirchmunk.cluster.KnowledgeCluster;
import dev.sirchmunk.cluster.ReuseDecision;
import dev.sirchmunk.context.QueryContext;
import dev.sirchmunk.context.QueryPhase;
import dev.sirchmunk.context.SearchCancelledException;
import dev.sirchmunk.context.SearchListener;
import dev.sirchmunk.evidence.EvidenceSampler;
import dev.sirchmunk.evidence.EvidenceUnit;
import dev.sirchmunk.evidence.SamplingBudget;
import dev.sirchmunk.evidence.SamplingProperties;
import dev.sirchmunk.grep.SearchToolUnavailableException;
import dev.sirchmunk.grep.TextSearchTimeoutException;
import dev.sirchmunk.llm.LlmException;
import dev.sirchmunk.retrieval.FileCandidate;
import dev.sirchmunk.retrieval.FileScanner;
import dev.sirchmunk.retrieval.FilenameMatch;
import dev.sirchmunk.retrieval.FilenameMatcher;
import dev.sirchmunk.retrieval.HybridRetriever;
import dev.sirchmunk.retrieval.NoSearchableInputException;
import dev.sirchmunk.retrieval.RankedFile;
import dev.sirchmunk.retrieval.RetrievalProperties;
import dev.sirchmunk.retrieval.RetrievalRequest;
import dev.sirchmunk.retrieval.RetrievalResult;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Public entry point of the engine. Sequences cluster reuse, hybrid retrieval, evidence sampling
 * and cluster building for each query according to its {@link SearchMode}.
 *
 * <p>This is the only place failures are mapped: every exception raised below becomes a {@link
 * SearchFailure} on the returned result. A search that runs out of time returns what it gathered,
 * marked {@link SearchResult.Status#PARTIAL}; a cluster under construction at that moment is
 * discarded, never persisted.
 */
@Service
public class SearchOrchestrator {

  private static final Logger log = LoggerFactory.getLogger(SearchOrchestrator.class);

  private final FileScanner fileScanner;
  private final FilenameMatcher filenameMatcher;
  private final HybridRetriever hybridRetriever;
  private final EvidenceSampler evidenceSampler;
  private final ClusterBuilder clusterBuilder;
  private final ClusterStore clusterStore;
  private final ClusterSummaryFormatter formatter;
  private final SearchProgressTracker progressTracker;
  private final SearchProperties searchProperties;
  private final RetrievalProperties retrievalProperties;
  private final SamplingProperties samplingProperties;
  private final ExecutorService searchExecutor;
  private final Clock clock;
  private final ConcurrentHashMap<String, QueryContext> activeSearches = new ConcurrentHashMap<>();

  public SearchOrchestrator(
      FileScanner fileScanner,
      FilenameMatcher filenameMatcher,
      HybridRetriever hybridRetriever,
      EvidenceSampler evidenceSampler,
      ClusterBuilder clusterBuilder,
      ClusterStore clusterStore,
      ClusterSummaryFormatter formatter,
      SearchProgressTracker progressTracker,
      SearchProperties searchProperties,
      RetrievalProperties retrievalProperties,
      SamplingProperties samplingProperties,
      @Qualifier("searchExecutor") ExecutorService searchExecutor,
      Clock clock) {
    this.fileScanner = fileScanner;
    this.filenameMatcher = filenameMatcher;
    this.hybridRetriever = hybridRetriever;
    this.evidenceSampler = evidenceSampler;
    this.clusterBuilder = clusterBuilder;
    this.clusterStore = clusterStore;
    this.formatter = formatter;
    this.progressTracker = progressTracker;
    this.searchProperties = searchProperties;
    this.retrievalProperties = retrievalProperties;
    this.samplingProperties = samplingProperties;
    this.searchExecutor = searchExecutor;
    this.clock = clock;
  }

  /** Runs a search on the calling thread. Never throws. */
  public SearchResult search(SearchQuery query) {
    return search(query, SearchListener.NONE);
  }

  /**
   * Runs a search on the calling thread, reporting progress to {@code listener}.
   *
   * @return the result; failures are reported on it, never thrown
   */
  public SearchResult search(SearchQuery query, SearchListener listener) {
    String searchId = UUID.randomUUID().toString();
    try {
      return run(searchId, query, listener);
    } finally {
      progressTracker.removeSearch(searchId);
    }
  }

  /**
   * Starts a search on the search pool. At most {@code sirchmunk.search.max-concurrent-queries}
   * searches run at once; the rest queue.
   *
   * <p>The final progress snapshot stays readable until {@link #forget} is called.
   *
   * @return the search id, usable with {@link #cancel} and {@link #progress}, and the result
   */
  public SearchHandle submit(SearchQuery query, SearchListener listener) {
    String searchId = UUID.randomUUID().toString();
    progressTracker.startSearch(searchId, query.query(), query.mode());
    CompletableFuture<SearchResult> result =
        CompletableFuture.supplyAsync(() -> run(searchId, query, listener), searchExecutor);
    return new SearchHandle(searchId, result);
  }

  /**
   * Cancels a running search. Its in-flight search-tool and LLM calls are aborted and it returns
   * a CANCELLED failure.
   *
   * @return false if no search with that id is running
   */
  public boolean cancel(String searchId) {
    QueryContext context = activeSearches.get(searchId);
    if (context == null) {
      return false;
    }
    context.cancel("cancelled by caller");
    return true;
  }

  public Optional<SearchProgress> progress(String searchId) {
    return progressTracker.getProgress(searchId);
  }

  /** Drops the progress snapshot of a finished submitted search. */
  public void forget(String searchId) {
    if (!activeSearches.containsKey(searchId)) {
      progressTracker.removeSearch(searchId);
    }
  }

  public Optional<KnowledgeCluster> getCluster(String id) {
    return clusterStore.get(id);
  }

  /** Clusters ordered by {@code sortBy}, descending. */
  public List<KnowledgeCluster> listClusters(int limit, ClusterSortOrder sortBy) {
    return clusterStore.list(limit, sortBy);
  }

  // ---- pipeline ----

  private SearchResult run(String searchId, SearchQuery query, SearchListener listener) {
    Instant started = clock.instant();
    Duration timeout =
        query.timeout() != null
            ? query.timeout()
            : Duration.ofMillis(searchProperties.getQueryTimeoutMs());
    if (progressTracker.getProgress(searchId).isEmpty()) {
      progressTracker.startSearch(searchId, query.query(), query.mode());
    }
    QueryContext context =
        QueryContext.create(
            searchId, timeout, clock, progressTracker.listenerFor(searchId, listener));
    activeSearches.put(searchId, context);
    CompletableFuture<Void> watchdog =
        CompletableFuture.runAsync(
            context::expire,
            CompletableFuture.delayedExecutor(timeout.toMillis(), TimeUnit.MILLISECONDS));
    Attempt attempt = new Attempt(searchId, query, started);
    log.info("Search {} started: '{}' ({})", searchId, query.query(), query.mode());
    try {
      SearchResult result =
          query.mode() == SearchMode.FILENAME_ONLY
              ? filenameOnly(query, context, attempt)
              : fullSearch(query, context, attempt);
      progressTracker.finishSearch(searchId, SearchProgress.Status.COMPLETED);
      log.info(
          "Search {} completed in {} ms ({} files, cluster {})",
          searchId,
          result.elapsed().toMillis(),
          result.files().size(),
          result.clusterId());
      return result;
    } catch (SearchCancelledException e) {
      if (e.isTimedOut()) {
        context.warn("Per-query time budget exhausted; returning partial result");
        progressTracker.finishSearch(searchId, SearchProgress.Status.PARTIAL);
        return attempt.partial(context);
      }
      progressTracker.finishSearch(searchId, SearchProgress.Status.FAILED);
      return attempt.failed(context, new SearchFailure(SearchErrorKind.CANCELLED, e.getMessage()));
    } catch (RuntimeException e) {
      SearchFailure failure = classify(e);
      if (failure.kind() == SearchErrorKind.INTERNAL) {
        log.error("Search {} failed unexpectedly", searchId, e);
      } else {
        log.error("Search {} failed: {} {}", searchId, failure.kind(), failure.reason());
      }
      progressTracker.finishSearch(searchId, SearchProgress.Status.FAILED);
      return attempt.failed(context, failure);
    } finally {
      watchdog.cancel(false);
      activeSearches.remove(searchId);
    }
  }

  private SearchResult filenameOnly(SearchQuery query, QueryContext context, Attempt attempt) {
    context.phase(QueryPhase.FILENAME_SEARCH, query.query());
    List<FileCandidate> candidates =
        fileScanner.scan(
            query.paths(), maxDepth(query), query.include(), query.exclude(), context, false);
    List<FilenameMatch> matches = filenameMatcher.match(query.query(), candidates, topK(query));
    context.listener().onFilesMatched(matches.size());
    attempt.files =
        matches.stream()
            .map(m -> new FileHit(m.candidate().path(), m.score(), m.candidate().title()))
            .toList();
    return attempt.completed(context, formatter.formatFilenames(query.query(), matches));
  }

  private SearchResult fullSearch(SearchQuery query, QueryContext context, Attempt attempt) {
    context.phase(QueryPhase.REUSE_LOOKUP, query.query());
    ReuseDecision decision = clusterStore.findReusable(query.query());
    if (decision.outcome() == ReuseDecision.Outcome.REUSE) {
      Optional<SearchResult> reused = reuse(query, context, attempt, decision.best());
      if (reused.isPresent()) {
        return reused.get();
      }
    } else if (decision.outcome() == ReuseDecision.Outcome.AMBIGUOUS) {
      context.warn("Ambiguous cluster reuse between " + clusterIds(decision) + "; searching");
    }

    RetrievalResult retrieval =
        hybridRetriever.retrieve(
            new RetrievalRequest(
                query.query(),
                query.paths(),
                maxDepth(query),
                topK(query),
                retrievalProperties.getKeywordLevels(),
                query.include(),
                query.exclude()),
            context);
    attempt.files =
        retrieval.files().stream()
            .map(f -> new FileHit(f.candidate().path(), f.score(), f.candidate().title()))
            .toList();
    if (retrieval.files().isEmpty()) {
      return attempt.completed(context, "No relevant files found for: " + query.query());
    }

    boolean deep = query.mode() == SearchMode.DEEP;
    SamplingBudget budget =
        deep ? samplingProperties.deepBudget() : samplingProperties.fastBudget();
    List<String> terms = retrieval.winner().terms();
    List<EvidenceUnit> evidence = new ArrayList<>();
    for (RankedFile file : retrieval.files()) {
      context.checkActive();
      evidence.addAll(
          evidenceSampler.sample(
              query.query(), terms, file.candidate().path(), budget, context));
      evidence.sort(Comparator.comparingDouble(EvidenceUnit::score).reversed());
      attempt.evidence = List.copyOf(evidence);
    }

    KnowledgeCluster cluster =
        clusterBuilder.build(query.query(), retrieval.files(), evidence, deep, context);
    String answer;
    boolean shouldSave;
    if (deep) {
      String fallback = formatter.format(cluster);
      try {
        ClusterBuilder.Summary summary = clusterBuilder.summarize(query.query(), cluster, context);
        answer = summary.text().isBlank() ? fallback : summary.text();
        shouldSave = summary.shouldSave();
      } catch (LlmException e) {
        context.warn("LLM answer failed, returning formatted cluster: " + e.getMessage());
        answer = fallback;
        shouldSave = !evidence.isEmpty();
      }
    } else {
      answer = formatter.format(cluster);
      shouldSave = !evidence.isEmpty();
    }
    attempt.answer = answer;
    clusterBuilder.attachAnswer(cluster, answer);

    // a cancelled search must not persist its cluster
    context.checkActive();
    KnowledgeCluster result = cluster;
    if (shouldSave) {
      context.phase(QueryPhase.PERSISTING, cluster.getId());
      result = persist(cluster, query.query(), decision, context);
    } else {
      log.info("Cluster {} judged not worth keeping; not persisted", cluster.getId());
    }
    attempt.cluster = result;
    return attempt.completed(context, answer);
  }

  private Optional<SearchResult> reuse(
      SearchQuery query, QueryContext context, Attempt attempt, ReuseDecision.Candidate best) {
    try {
      KnowledgeCluster cluster =
          clusterStore.recordReuse(best.clusterId(), query.query(), best.similarity());
      log.info(
          "Search {} reused cluster {} (similarity {})",
          context.searchId(),
          cluster.getId(),
          String.format(Locale.US, "%.3f", best.similarity()));
      List<String> results = cluster.getSearchResults();
      String answer =
          query.mode() == SearchMode.DEEP && !results.isEmpty()
              ? results.get(results.size() - 1)
              : formatter.format(cluster);
      attempt.cluster = cluster;
      attempt.reused = true;
      attempt.evidence = cluster.getEvidence();
      return Optional.of(attempt.completed(context, answer));
    } catch (ClusterConflictException | IllegalArgumentException e) {
      context.warn("Cluster " + best.clusterId() + " no longer reusable: " + e.getMessage());
      return Optional.empty();
    }
  }

  private KnowledgeCluster persist(
      KnowledgeCluster cluster, String query, ReuseDecision decision, QueryContext context) {
    KnowledgeCluster saved;
    try {
      saved = clusterStore.insert(cluster);
    } catch (ClusterConflictException e) {
      try {
        saved = clusterStore.augment(cluster.getId(), cluster, query);
        log.info("Augmented existing cluster {}", saved.getId());
      } catch (ClusterConflictException deprecated) {
        context.warn("Cluster " + cluster.getId() + " not saved: " + deprecated.getMessage());
        return cluster;
      }
    }
    if (decision.outcome() != ReuseDecision.Outcome.AMBIGUOUS) {
      return saved;
    }
    List<String> duplicates = nearDuplicates(saved, decision);
    if (duplicates.isEmpty()) {
      return saved;
    }
    List<String> ids = new ArrayList<>();
    ids.add(saved.getId());
    ids.addAll(duplicates);
    try {
      KnowledgeCluster merged = clusterStore.merge(ids);
      log.info("Merged near-duplicate clusters {} into {}", duplicates, merged.getId());
      return merged;
    } catch (ClusterConflictException | IllegalArgumentException e) {
      context.warn("Near-duplicate merge skipped: " + e.getMessage());
      return saved;
    }
  }

  /** Ambiguous candidates sharing at least one evidence source file with the new cluster. */
  private List<String> nearDuplicates(KnowledgeCluster saved, ReuseDecision decision) {
    Set<String> sources = new HashSet<>(saved.sourcePaths());
    List<String> duplicates = new ArrayList<>();
    for (ReuseDecision.Candidate candidate : decision.candidates()) {
      if (candidate.clusterId().equals(saved.getId())) {
        continue;
      }
      clusterStore
          .get(candidate.clusterId())
          .filter(c -> c.sourcePaths().stream().anyMatch(sources::contains))
          .ifPresent(c -> duplicates.add(c.getId()));
    }
    return duplicates;
  }

  static SearchFailure classify(RuntimeException e) {
    String reason = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    SearchErrorKind kind;
    if (e instanceof IllegalArgumentException || e instanceof NoSearchableInputException) {
      kind = SearchErrorKind.INPUT_ERROR;
    } else if (e instanceof SearchToolUnavailableException) {
      kind = SearchErrorKind.TOOL_UNAVAILABLE;
    } else if (e instanceof TextSearchTimeoutException || e instanceof UncheckedIOException) {
      kind = SearchErrorKind.TRANSIENT_IO;
    } else if (e instanceof LlmException) {
      kind = SearchErrorKind.LLM_ERROR;
    } else if (e instanceof ClusterConflictException) {
      kind = SearchErrorKind.STORE_CONFLICT;
    } else {
      kind = SearchErrorKind.INTERNAL;
    }
    return new SearchFailure(kind, reason);
  }

  private int maxDepth(SearchQuery query) {
    return query.maxDepth() != null ? query.maxDepth() : retrievalProperties.getMaxDepth();
  }

  private int topK(SearchQuery query) {
    return query.topKFiles() != null ? query.topKFiles() : retrievalProperties.getTopKFiles();
  }

  private static List<String> clusterIds(ReuseDecision decision) {
    return decision.candidates().stream().map(ReuseDecision.Candidate::clusterId).toList();
  }

  /**
   * Handle of a submitted search.
   *
   * @param searchId id for {@link #cancel} and {@link #progress}
   * @param result completes with the result; never completes exceptionally
   */
  public record SearchHandle(String searchId, CompletableFuture<SearchResult> result) {}

  /** What a search has gathered so far; turned into a result however the search ends. */
  private final class Attempt {

    private final String searchId;
    private final SearchQuery query;
    private final Instant started;
    private List<FileHit> files = List.of();
    private List<EvidenceUnit> evidence = List.of();
    private @Nullable String answer;
    private @Nullable KnowledgeCluster cluster;
    private boolean reused;

    private Attempt(String searchId, SearchQuery query, Instant started) {
      this.searchId = searchId;
      this.query = query;
      this.started = started;
    }

    SearchResult completed(QueryContext context, String finalAnswer) {
      return build(context, SearchResult.Status.COMPLETED, finalAnswer, null);
    }

    /** Best result gathered so far. A cluster that was never persisted is left out. */
    SearchResult partial(QueryContext context) {
      cluster = null;
      String best;
      if (answer != null) {
        best = answer;
      } else if (!evidence.isEmpty()) {
        best = formatter.formatEvidence(query.query(), evidence);
      } else if (!files.isEmpty()) {
        best = formatter.formatFiles(query.query(), files);
      } else {
        best = "";
      }
      return build(context, SearchResult.Status.PARTIAL, best, null);
    }

    SearchResult failed(QueryContext context, SearchFailure failure) {
      cluster = null;
      return build(context, SearchResult.Status.FAILED, answer, failure);
    }

    private SearchResult build(
        QueryContext context,
        SearchResult.Status status,
        @Nullable String text,
        @Nullable SearchFailure failure) {
      return new SearchResult(
          searchId,
          query.query(),
          query.mode(),
          status,
          text,
          cluster == null ? null : cluster.getId(),
          cluster != null && query.returnCluster() ? cluster : null,
          reused,
          files,
          evidence,
          context.warnings(),
          context.usage(),
          failure,
          Duration.between(started, clock.instant()));
    }
  }
}
