package dev.sirchmunk.llm;

import dev.sirchmunk.config.RetrySettings;
import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Connection and call policy for the OpenAI-compatible chat endpoint, bound from {@code
 * sirchmunk.llm.*}.
 */
@Configuration
@ConfigurationProperties(prefix = "sirchmunk.llm")
public class LlmProperties {

  private String baseUrl = "https://api.openai.com/v1";
  private String apiKey = "";
  private String modelName = "gpt-4o-mini";
  private double temperature = 0.0;
  private long timeoutMs = 60_000;
  private int concurrency = 8;
  private RetrySettings retry = RetrySettings.defaults();

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (baseUrl == null || baseUrl.isBlank()) {
      throw new IllegalStateException("sirchmunk.llm.base-url must not be blank");
    }
    if (modelName == null || modelName.isBlank()) {
      throw new IllegalStateException("sirchmunk.llm.model-name must not be blank");
    }
    if (temperature < 0.0 || temperature > 2.0) {
      throw new IllegalStateException(
          "sirchmunk.llm.temperature must be in [0.0, 2.0], got: " + temperature);
    }
    if (timeoutMs < 100) {
      throw new IllegalStateException(
          "sirchmunk.llm.timeout-ms must be >= 100, got: " + timeoutMs);
    }
    if (concurrency < 1) {
      throw new IllegalStateException(
          "sirchmunk.llm.concurrency must be >= 1, got: " + concurrency);
    }
    retry.validate("sirchmunk.llm.retry");
  }

  public String getBaseUrl() {
    return baseUrl;
  }

  public void setBaseUrl(String baseUrl) {
    this.baseUrl = baseUrl;
  }

  public String getApiKey() {
    return apiKey;
  }

  public void setApiKey(String apiKey) {
    this.apiKey = apiKey;
  }

  public String getModelName() {
    return modelName;
  }

  public void setModelName(String modelName) {
    this.modelName = modelName;
  }

  public double getTemperature() {
    return temperature;
  }

  public void setTemperature(double temperature) {
    this.temperature = temperature;
  }

  public long getTimeoutMs() {
    return timeoutMs;
  }

  public void setTimeoutMs(long timeoutMs) {
    this.timeoutMs = timeoutMs;
  }

  public int getConcurrency() {
    return concurrency;
  }

  public void setConcurrency(int concurrency) {
    this.concurrency = concurrency;
  }

  public RetrySettings getRetry() {
    return retry;
  }

  public void setRetry(RetrySettings retry) {
    this.retry = retry;
  }
}
