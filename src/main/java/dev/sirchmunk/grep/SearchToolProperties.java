package dev.sirchmunk.grep;

import dev.sirchmunk.config.RetrySettings;
import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for the external search tool, bound from {@code
 * sirchmunk.search-tool.*}.
 *
 * <ul>
 *   <li>{@code executable} - ripgrep-compatible binary ({@code rg} or {@code rga}; default {@code
 *       rg})
 *   <li>{@code concurrency} - maximum concurrent invocations; excess tasks queue (default 10)
 *   <li>{@code files-per-task} - files handed to a single invocation (default 64)
 *   <li>{@code call-timeout-ms} - per-invocation timeout (default 60000)
 *   <li>{@code default-excludes} - file-name globs never searched
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "sirchmunk.search-tool")
public class SearchToolProperties {

  private String executable = "rg";
  private int concurrency = 10;
  private int filesPerTask = 64;
  private long callTimeoutMs = 60_000;
  private RetrySettings retry = RetrySettings.defaults();
  private List<String> defaultExcludes = new ArrayList<>(List.of("*.pyc", "*.log"));

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (executable == null || executable.isBlank()) {
      throw new IllegalStateException("sirchmunk.search-tool.executable must not be blank");
    }
    if (concurrency < 1 || concurrency > 256) {
      throw new IllegalStateException(
          "sirchmunk.search-tool.concurrency must be in [1, 256], got: " + concurrency);
    }
    if (filesPerTask < 1) {
      throw new IllegalStateException(
          "sirchmunk.search-tool.files-per-task must be >= 1, got: " + filesPerTask);
    }
    if (callTimeoutMs < 100) {
      throw new IllegalStateException(
          "sirchmunk.search-tool.call-timeout-ms must be >= 100, got: " + callTimeoutMs);
    }
    retry.validate("sirchmunk.search-tool.retry");
  }

  public String getExecutable() {
    return executable;
  }

  public void setExecutable(String executable) {
    this.executable = executable;
  }

  public int getConcurrency() {
    return concurrency;
  }

  public void setConcurrency(int concurrency) {
    this.concurrency = concurrency;
  }

  public int getFilesPerTask() {
    return filesPerTask;
  }

  public void setFilesPerTask(int filesPerTask) {
    this.filesPerTask = filesPerTask;
  }

  public long getCallTimeoutMs() {
    return callTimeoutMs;
  }

  public void setCallTimeoutMs(long callTimeoutMs) {
    this.callTimeoutMs = callTimeoutMs;
  }

  public RetrySettings getRetry() {
    return retry;
  }

  public void setRetry(RetrySettings retry) {
    this.retry = retry;
  }

  public List<String> getDefaultExcludes() {
    return defaultExcludes;
  }

  public void setDefaultExcludes(List<String> defaultExcludes) {
    this.defaultExcludes = defaultExcludes;
  }
}
