package dev.sirchmunk.grep;

import dev.sirchmunk.context.QueryContext;
import dev.sirchmunk.context.SearchCancelledException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

/**
 * Fans one keyword level out over the candidate files: the files are split into chunks of {@code
 * files-per-task}, each chunk becomes one search-tool invocation on the bounded {@code
 * searchToolExecutor}, and the hits of all chunks are interval-merged.
 *
 * <p>A chunk whose invocation keeps timing out after the retry bound is skipped with a warning on
 * the query. {@link SearchToolUnavailableException} is fatal and propagates.
 */
@Service
public class TextSearchDispatcher {

  private static final Logger log = LoggerFactory.getLogger(TextSearchDispatcher.class);

  private final TextSearchTool tool;
  private final ExecutorService executor;
  private final SearchToolProperties properties;
  private final RetryTemplate retryTemplate;

  public TextSearchDispatcher(
      TextSearchTool tool,
      @Qualifier("searchToolExecutor") ExecutorService executor,
      SearchToolProperties properties) {
    this.tool = tool;
    this.executor = executor;
    this.properties = properties;
    this.retryTemplate =
        properties.getRetry().toTemplate(List.of(TextSearchTimeoutException.class));
  }

  /**
   * Searches {@code files} for any of {@code patterns}.
   *
   * @param patterns literal terms of one keyword level
   * @param files candidate files
   * @param level keyword level, recorded on every hit
   * @param context owning query
   * @return merged hits ordered by path, then offset
   */
  public List<MatchRecord> dispatch(
      List<String> patterns, List<Path> files, int level, QueryContext context) {
    if (patterns.isEmpty() || files.isEmpty()) {
      return List.of();
    }
    context.checkActive();

    List<List<Path>> chunks = partition(files, properties.getFilesPerTask());
    List<Future<List<MatchRecord>>> futures = new ArrayList<>(chunks.size());
    for (List<Path> chunk : chunks) {
      TextSearchRequest request = new TextSearchRequest(patterns, chunk, false, null, level);
      futures.add(executor.submit(() -> runWithRetry(request, context)));
    }
    log.debug("Level {}: dispatched {} tasks over {} files", level, chunks.size(), files.size());

    List<MatchRecord> hits = new ArrayList<>();
    try (QueryContext.Registration ignored =
        context.onCancel(() -> futures.forEach(f -> f.cancel(true)))) {
      for (int i = 0; i < futures.size(); i++) {
        hits.addAll(await(futures.get(i), chunks.get(i), level, context));
      }
    }
    return MatchMerger.merge(hits);
  }

  private List<MatchRecord> runWithRetry(TextSearchRequest request, QueryContext context) {
    return retryTemplate.execute(
        retryContext -> {
          if (retryContext.getRetryCount() > 0) {
            log.debug(
                "Retrying level {} task (attempt {})",
                request.level(),
                retryContext.getRetryCount() + 1);
          }
          return tool.search(request, context);
        });
  }

  private List<MatchRecord> await(
      Future<List<MatchRecord>> future, List<Path> chunk, int level, QueryContext context) {
    try {
      return future.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      context.cancel("interrupted");
      throw new SearchCancelledException("Search " + context.searchId() + " interrupted", false);
    } catch (CancellationException e) {
      context.checkActive();
      throw e;
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof TextSearchTimeoutException) {
        context.warn(
            "Skipped "
                + chunk.size()
                + " files at level "
                + level
                + " after repeated search tool timeouts");
        return List.of();
      }
      if (cause instanceof RuntimeException runtime) {
        throw runtime;
      }
      throw new IllegalStateException("Search task failed", cause);
    }
  }

  static List<List<Path>> partition(List<Path> files, int size) {
    List<List<Path>> chunks = new ArrayList<>();
    for (int from = 0; from < files.size(); from += size) {
      chunks.add(List.copyOf(files.subList(from, Math.min(files.size(), from + size))));
    }
    return chunks;
  }
}
