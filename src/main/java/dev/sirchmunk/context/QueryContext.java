package dev.sirchmunk.context;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Query-scoped state shared by every component taking part in one search: cancellation flag and
 * per-query deadline, cancel hooks for in-flight external calls, warnings destined for the
 * result, LLM usage accounting, and the caller's progress listener.
 *
 * <p>Created by the orchestrator for each search and discarded when it completes. Nothing in here
 * is shared between searches.
 */
public final class QueryContext {

  private static final Logger log = LoggerFactory.getLogger(QueryContext.class);

  private final String searchId;
  private final Clock clock;
  private final @Nullable Instant deadline;
  private final SearchListener listener;

  private final AtomicBoolean cancelled = new AtomicBoolean(false);
  private volatile boolean timedOut;
  private final List<Runnable> cancelHooks = new CopyOnWriteArrayList<>();
  private final List<String> warnings = new CopyOnWriteArrayList<>();

  private final AtomicInteger llmCalls = new AtomicInteger();
  private final AtomicLong inputTokens = new AtomicLong();
  private final AtomicLong outputTokens = new AtomicLong();

  private QueryContext(
      String searchId, Clock clock, @Nullable Instant deadline, SearchListener listener) {
    this.searchId = searchId;
    this.clock = clock;
    this.deadline = deadline;
    this.listener = listener;
  }

  /**
   * Creates a context for one search.
   *
   * @param searchId identifier used for progress tracking and cancellation by id
   * @param timeout per-query time budget; {@code null} means no deadline
   * @param clock time source
   * @param listener progress receiver
   * @return a fresh, active context
   */
  public static QueryContext create(
      String searchId, @Nullable Duration timeout, Clock clock, SearchListener listener) {
    Instant deadline = timeout != null ? clock.instant().plus(timeout) : null;
    return new QueryContext(searchId, clock, deadline, listener);
  }

  /** Context without deadline or listener, used by background jobs and tests. */
  public static QueryContext unbounded() {
    return new QueryContext(
        UUID.randomUUID().toString(), Clock.systemUTC(), null, SearchListener.NONE);
  }

  public String searchId() {
    return searchId;
  }

  public SearchListener listener() {
    return listener;
  }

  /**
   * Cancels the search: flags the context and runs every registered hook (destroying processes,
   * cancelling futures). Idempotent.
   *
   * @param reason human-readable reason, logged once
   */
  public void cancel(String reason) {
    if (!cancelled.compareAndSet(false, true)) {
      return;
    }
    log.info("Search {} cancelled: {}", searchId, reason);
    for (Runnable hook : cancelHooks) {
      try {
        hook.run();
      } catch (RuntimeException e) {
        log.warn("Cancel hook failed for search {}: {}", searchId, e.getMessage());
      }
    }
  }

  /** Marks the context as timed out and cancels it. */
  public void expire() {
    timedOut = true;
    cancel("per-query time budget exhausted");
  }

  public boolean isCancelled() {
    if (!cancelled.get() && deadline != null && !clock.instant().isBefore(deadline)) {
      expire();
    }
    return cancelled.get();
  }

  public boolean isTimedOut() {
    return timedOut;
  }

  /**
   * Suspension-point check. Every external call site calls this before and after blocking.
   *
   * @throws SearchCancelledException if the search was cancelled or its deadline passed
   */
  public void checkActive() {
    if (isCancelled()) {
      throw new SearchCancelledException(
          timedOut ? "Search " + searchId + " timed out" : "Search " + searchId + " cancelled",
          timedOut);
    }
  }

  /**
   * Registers a hook run on cancellation. If the context is already cancelled the hook runs
   * immediately.
   *
   * @param hook action aborting an in-flight call
   * @return handle removing the hook once the call has finished
   */
  public Registration onCancel(Runnable hook) {
    cancelHooks.add(hook);
    if (cancelled.get()) {
      hook.run();
    }
    return () -> cancelHooks.remove(hook);
  }

  /** Time left before the per-query deadline; {@code null} when unbounded. */
  public @Nullable Duration remaining() {
    if (deadline == null) {
      return null;
    }
    Duration left = Duration.between(clock.instant(), deadline);
    return left.isNegative() ? Duration.ZERO : left;
  }

  public void warn(String message) {
    log.warn("[{}] {}", searchId, message);
    warnings.add(message);
  }

  public List<String> warnings() {
    return List.copyOf(warnings);
  }

  public void phase(QueryPhase phase, String detail) {
    log.debug("[{}] {} {}", searchId, phase, detail);
    listener.onPhase(phase, detail);
  }

  public void recordLlmUsage(long input, long output) {
    llmCalls.incrementAndGet();
    inputTokens.addAndGet(input);
    outputTokens.addAndGet(output);
  }

  public TokenUsageSummary usage() {
    return new TokenUsageSummary(llmCalls.get(), inputTokens.get(), outputTokens.get());
  }

  /** Removes a cancel hook. */
  @FunctionalInterface
  public interface Registration extends AutoCloseable {
    @Override
    void close();
  }
}
