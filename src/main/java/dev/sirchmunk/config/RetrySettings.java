package dev.sirchmunk.config;

import java.util.List;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.retry.support.RetryTemplateBuilder;

/**
 * Bounded exponential-backoff policy shared by the external-call boundaries (search tool, file
 * reads, LLM).
 *
 * @param maxAttempts total attempts including the first one
 * @param delayMs initial backoff delay
 * @param multiplier backoff multiplier between attempts
 */
public record RetrySettings(
    @DefaultValue("3") int maxAttempts,
    @DefaultValue("200") long delayMs,
    @DefaultValue("2.0") double multiplier) {

  private static final long MAX_DELAY_MS = 10_000;

  public static RetrySettings defaults() {
    return new RetrySettings(3, 200, 2.0);
  }

  /** Throws if any value is out of range; {@code prefix} is the property path of these settings. */
  public void validate(String prefix) {
    if (maxAttempts < 1 || maxAttempts > 10) {
      throw new IllegalStateException(
          prefix + ".max-attempts must be in [1, 10], got: " + maxAttempts);
    }
    if (delayMs < 0) {
      throw new IllegalStateException(prefix + ".delay-ms must be >= 0, got: " + delayMs);
    }
    if (multiplier < 1.0) {
      throw new IllegalStateException(
          prefix + ".multiplier must be >= 1.0, got: " + multiplier);
    }
  }

  /**
   * Builds a {@link RetryTemplate} retrying only on the given exception types.
   *
   * @param retryOn exception types considered transient
   * @return a template applying this policy
   */
  public RetryTemplate toTemplate(List<Class<? extends Throwable>> retryOn) {
    RetryTemplateBuilder builder = RetryTemplate.builder().maxAttempts(maxAttempts);
    long initial = Math.max(1, delayMs);
    if (multiplier > 1.0) {
      builder.exponentialBackoff(initial, multiplier, Math.max(MAX_DELAY_MS, initial + 1));
    } else {
      builder.fixedBackoff(initial);
    }
    return builder
        .retryOn(retryOn)
        .traversingCauses()
        .build();
  }
}
