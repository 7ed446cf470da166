package dev.sirchmunk.retrieval;

import dev.sirchmunk.context.QueryContext;
import dev.sirchmunk.context.QueryPhase;
import dev.sirchmunk.grep.MatchRecord;
import dev.sirchmunk.grep.TextSearchDispatcher;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Indexless candidate retrieval: scan the paths, plan keyword levels, run priority-hit search and
 * rank the winning level's files.
 *
 * <p>Priority-hit search tries the levels in plan order and stops at the first level whose hits
 * cover at least {@code min-hits} distinct files; later levels are never dispatched. If no level
 * reaches the threshold, the level that matched the most files wins (the earlier one on a tie).
 * Files with identical content are reported once, keeping the better-ranked copy.
 */
@Service
public class HybridRetriever {

  private static final Logger log = LoggerFactory.getLogger(HybridRetriever.class);

  private final FileScanner fileScanner;
  private final KeywordPlanner keywordPlanner;
  private final TextSearchDispatcher dispatcher;
  private final RetrievalProperties properties;

  public HybridRetriever(
      FileScanner fileScanner,
      KeywordPlanner keywordPlanner,
      TextSearchDispatcher dispatcher,
      RetrievalProperties properties) {
    this.fileScanner = fileScanner;
    this.keywordPlanner = keywordPlanner;
    this.dispatcher = dispatcher;
    this.properties = properties;
  }

  /**
   * Retrieves the files most relevant to the request's query.
   *
   * @param request query, paths and limits
   * @param context owning query
   * @return ranked files with the plan that produced them
   * @throws NoSearchableInputException if no path is readable
   * @throws dev.sirchmunk.grep.SearchToolUnavailableException if the search tool cannot run
   */
  public RetrievalResult retrieve(RetrievalRequest request, QueryContext context) {
    context.checkActive();
    List<FileCandidate> corpus =
        fileScanner.scan(
            request.paths(),
            request.maxDepth(),
            request.include(),
            request.exclude(),
            context,
            true);
    if (corpus.isEmpty()) {
      context.warn("No searchable files under " + request.paths());
      return RetrievalResult.empty(List.of(), 0);
    }

    List<KeywordLevel> plan =
        keywordPlanner.plan(
            request.query(),
            request.keywordLevels(),
            properties.isLlmKeywordPlanning(),
            context);
    if (plan.isEmpty()) {
      context.warn("Query has no searchable terms: " + request.query());
      return RetrievalResult.empty(plan, corpus.size());
    }

    List<Path> files = corpus.stream().map(FileCandidate::path).toList();
    LevelHits winner = null;
    LevelHits best = null;
    for (KeywordLevel level : plan) {
      context.phase(QueryPhase.TEXT_SEARCH, "level " + level.index() + " " + level.terms());
      List<MatchRecord> hits = dispatcher.dispatch(level.terms(), files, level.index(), context);
      LevelHits attempt = new LevelHits(level, groupByFile(hits));
      context.listener().onFilesMatched(attempt.byFile().size());
      log.info(
          "Level {} {} matched {} files", level.index(), level.terms(), attempt.byFile().size());
      if (attempt.byFile().size() >= properties.getMinHits()) {
        winner = attempt;
        break;
      }
      if (best == null || attempt.byFile().size() > best.byFile().size()) {
        best = attempt;
      }
    }
    if (winner == null) {
      winner = best;
    }
    if (winner == null || winner.byFile().isEmpty()) {
      log.info("No level matched any file for '{}'", request.query());
      return RetrievalResult.empty(plan, corpus.size());
    }

    context.phase(QueryPhase.RANKING, winner.byFile().size() + " files");
    List<RankedFile> ranked =
        TfIdfRanker.rank(
            corpus, winner.byFile(), winner.level(), RankingWeights.from(properties));
    List<RankedFile> top = dropDuplicateContent(ranked, request.topKFiles());
    return new RetrievalResult(top, plan, winner.level().index(), corpus.size());
  }

  private static Map<Path, List<MatchRecord>> groupByFile(List<MatchRecord> hits) {
    Map<Path, List<MatchRecord>> byFile = new LinkedHashMap<>();
    for (MatchRecord hit : hits) {
      byFile.computeIfAbsent(hit.file().toAbsolutePath().normalize(), p -> new ArrayList<>())
          .add(hit);
    }
    return byFile;
  }

  private static List<RankedFile> dropDuplicateContent(List<RankedFile> ranked, int limit) {
    Set<String> seen = new HashSet<>();
    List<RankedFile> unique = new ArrayList<>();
    for (RankedFile file : ranked) {
      if (unique.size() == limit) {
        break;
      }
      String fingerprint = fingerprint(file.candidate().path());
      if (fingerprint == null || seen.add(fingerprint)) {
        unique.add(file);
      } else {
        log.debug("Dropping duplicate content {}", file.candidate().path());
      }
    }
    return unique;
  }

  private static @Nullable String fingerprint(Path file) {
    try {
      return ContentFingerprint.ofFile(file);
    } catch (IOException e) {
      log.debug("Cannot fingerprint {}: {}", file, e.getMessage());
      return null;
    }
  }

  private record LevelHits(KeywordLevel level, Map<Path, List<MatchRecord>> byFile) {}
}
