package dev.sirchmunk.search;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for the search entry point, bound from {@code sirchmunk.search.*}.
 *
 * <ul>
 *   <li>{@code query-timeout-ms} - per-query time budget when the query sets none (default
 *       120000)
 *   <li>{@code summary-token-budget} - estimated tokens allowed in a formatted answer (default
 *       2000)
 *   <li>{@code max-concurrent-queries} - searches submitted asynchronously that run at once
 *       (default 4)
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "sirchmunk.search")
public class SearchProperties {

  private long queryTimeoutMs = 120_000;
  private int summaryTokenBudget = 2000;
  private int maxConcurrentQueries = 4;

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (queryTimeoutMs < 1000) {
      throw new IllegalStateException(
          "sirchmunk.search.query-timeout-ms must be >= 1000, got: " + queryTimeoutMs);
    }
    if (summaryTokenBudget < 100) {
      throw new IllegalStateException(
          "sirchmunk.search.summary-token-budget must be >= 100, got: " + summaryTokenBudget);
    }
    if (maxConcurrentQueries < 1) {
      throw new IllegalStateException(
          "sirchmunk.search.max-concurrent-queries must be >= 1, got: " + maxConcurrentQueries);
    }
  }

  public long getQueryTimeoutMs() {
    return queryTimeoutMs;
  }

  public void setQueryTimeoutMs(long queryTimeoutMs) {
    this.queryTimeoutMs = queryTimeoutMs;
  }

  public int getSummaryTokenBudget() {
    return summaryTokenBudget;
  }

  public void setSummaryTokenBudget(int summaryTokenBudget) {
    this.summaryTokenBudget = summaryTokenBudget;
  }

  public int getMaxConcurrentQueries() {
    return maxConcurrentQueries;
  }

  public void setMaxConcurrentQueries(int maxConcurrentQueries) {
    this.maxConcurrentQueries = maxConcurrentQueries;
  }
}
