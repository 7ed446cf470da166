package dev.sirchmunk.llm;

import dev.sirchmunk.context.QueryContext;
import dev.sirchmunk.context.SearchCancelledException;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

/**
 * Query-aware front of the {@link LlmClient}: every call runs on {@code llmExecutor} under the
 * per-call timeout, is retried with backoff, is aborted when the query is cancelled, and adds its
 * token usage to the query's tally.
 *
 * <p>After the retry bound the last {@link LlmException} propagates; callers decide how to
 * degrade.
 */
@Service
public class LlmGateway {

  private static final Logger log = LoggerFactory.getLogger(LlmGateway.class);

  private final LlmClient client;
  private final ExecutorService executor;
  private final LlmProperties properties;
  private final RetryTemplate retryTemplate;

  public LlmGateway(
      LlmClient client,
      @Qualifier("llmExecutor") ExecutorService executor,
      LlmProperties properties) {
    this.client = client;
    this.executor = executor;
    this.properties = properties;
    this.retryTemplate = properties.getRetry().toTemplate(List.of(LlmException.class));
  }

  /**
   * Structured call bound to {@code responseType}.
   *
   * @throws LlmException after the retry bound
   * @throws SearchCancelledException if the query is cancelled meanwhile
   */
  public <T> T complete(String prompt, Class<T> responseType, QueryContext context) {
    LlmResponse<T> response =
        withRetry(() -> client.complete(prompt, responseType), responseType.getSimpleName(),
            context);
    return response.content();
  }

  /**
   * Streaming call; fragments are forwarded to the query's listener.
   *
   * @return the full answer text
   */
  public String stream(String prompt, QueryContext context) {
    LlmResponse<String> response =
        withRetry(
            () -> client.stream(prompt, delta -> context.listener().onPartialAnswer(delta)),
            "stream",
            context);
    return response.content();
  }

  private <T> LlmResponse<T> withRetry(
      Supplier<LlmResponse<T>> call, String label, QueryContext context) {
    LlmResponse<T> response =
        retryTemplate.execute(
            retryContext -> {
              if (retryContext.getRetryCount() > 0) {
                log.debug("Retrying LLM call {} (attempt {})", label,
                    retryContext.getRetryCount() + 1);
              }
              return callOnce(call, context);
            });
    context.recordLlmUsage(response.inputTokens(), response.outputTokens());
    return response;
  }

  private <T> LlmResponse<T> callOnce(Supplier<LlmResponse<T>> call, QueryContext context) {
    context.checkActive();
    Future<LlmResponse<T>> future = executor.submit(call::get);
    try (QueryContext.Registration ignored = context.onCancel(() -> future.cancel(true))) {
      return future.get(properties.getTimeoutMs(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      throw new LlmException("LLM call exceeded " + properties.getTimeoutMs() + " ms", e);
    } catch (CancellationException e) {
      context.checkActive();
      throw new LlmException("LLM call cancelled", e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      future.cancel(true);
      context.cancel("interrupted");
      throw new SearchCancelledException("Search " + context.searchId() + " interrupted", false);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof LlmException llmException) {
        throw llmException;
      }
      throw new LlmException("LLM call failed: " + cause.getMessage(), cause);
    }
  }
}
