package dev.sirchmunk.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

/**
 * Worker pools for the I/O-bound fan-out. Each pool is fixed-size with an unbounded queue, so work
 * beyond the concurrency limit waits instead of being rejected.
 *
 * <ul>
 *   <li>{@code searchToolExecutor} - external search-tool invocations
 *   <li>{@code llmExecutor} - LLM calls (per-call timeouts are enforced on its futures)
 *   <li>{@code searchExecutor} - whole searches submitted asynchronously
 * </ul>
 */
@Configuration
public class ExecutorConfig {

  @Bean(destroyMethod = "shutdownNow")
  public ExecutorService searchToolExecutor(
      @Value("${sirchmunk.search-tool.concurrency:10}") int concurrency) {
    return Executors.newFixedThreadPool(concurrency, new CustomizableThreadFactory("search-tool-"));
  }

  @Bean(destroyMethod = "shutdownNow")
  public ExecutorService llmExecutor(@Value("${sirchmunk.llm.concurrency:8}") int concurrency) {
    return Executors.newFixedThreadPool(concurrency, new CustomizableThreadFactory("llm-"));
  }

  @Bean(destroyMethod = "shutdownNow")
  public ExecutorService searchExecutor(
      @Value("${sirchmunk.search.max-concurrent-queries:4}") int maxConcurrentQueries) {
    return Executors.newFixedThreadPool(
        maxConcurrentQueries, new CustomizableThreadFactory("search-"));
  }
}
