package dev.sirchmunk.evidence;

import dev.sirchmunk.config.RetrySettings;
import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for Monte-Carlo evidence sampling, bound from {@code
 * sirchmunk.sampling.*}. Sizes are in characters.
 */
@Configuration
@ConfigurationProperties(prefix = "sirchmunk.sampling")
public class SamplingProperties {

  private int bucketSize = 500;
  private int probeWindow = 500;
  private double floorWeight = 0.05;
  private double neighborBoost = 0.6;
  private double visitedDecay = 0.1;
  private int probesPerRound = 4;
  private int fastMaxProbes = 12;
  private int deepMaxProbes = 24;
  private int maxTokens = 20_000;
  private int topK = 5;
  private int roiWindow = 2000;
  private long seed = 42;
  private RetrySettings readRetry = RetrySettings.defaults();

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (bucketSize < 50) {
      throw new IllegalStateException(
          "sirchmunk.sampling.bucket-size must be >= 50, got: " + bucketSize);
    }
    if (probeWindow < 50) {
      throw new IllegalStateException(
          "sirchmunk.sampling.probe-window must be >= 50, got: " + probeWindow);
    }
    if (floorWeight <= 0.0 || floorWeight > 1.0) {
      throw new IllegalStateException(
          "sirchmunk.sampling.floor-weight must be in (0.0, 1.0], got: " + floorWeight);
    }
    if (visitedDecay < 0.0 || visitedDecay >= 1.0) {
      throw new IllegalStateException(
          "sirchmunk.sampling.visited-decay must be in [0.0, 1.0), got: " + visitedDecay);
    }
    if (neighborBoost < 0.0) {
      throw new IllegalStateException(
          "sirchmunk.sampling.neighbor-boost must be >= 0, got: " + neighborBoost);
    }
    if (probesPerRound < 1 || fastMaxProbes < 0 || deepMaxProbes < 0 || maxTokens < 0) {
      throw new IllegalStateException("sirchmunk.sampling probe and token limits out of range");
    }
    if (topK < 1) {
      throw new IllegalStateException("sirchmunk.sampling.top-k must be >= 1, got: " + topK);
    }
    if (roiWindow < probeWindow) {
      throw new IllegalStateException(
          "sirchmunk.sampling.roi-window must be >= probe-window, got: " + roiWindow);
    }
    readRetry.validate("sirchmunk.sampling.read-retry");
  }

  /** Heuristic-only budget. */
  public SamplingBudget fastBudget() {
    return new SamplingBudget(fastMaxProbes, maxTokens, topK, false);
  }

  /** Budget with LLM confirmation of the final candidates. */
  public SamplingBudget deepBudget() {
    return new SamplingBudget(deepMaxProbes, maxTokens, topK, true);
  }

  public int getBucketSize() {
    return bucketSize;
  }

  public void setBucketSize(int bucketSize) {
    this.bucketSize = bucketSize;
  }

  public int getProbeWindow() {
    return probeWindow;
  }

  public void setProbeWindow(int probeWindow) {
    this.probeWindow = probeWindow;
  }

  public double getFloorWeight() {
    return floorWeight;
  }

  public void setFloorWeight(double floorWeight) {
    this.floorWeight = floorWeight;
  }

  public double getNeighborBoost() {
    return neighborBoost;
  }

  public void setNeighborBoost(double neighborBoost) {
    this.neighborBoost = neighborBoost;
  }

  public double getVisitedDecay() {
    return visitedDecay;
  }

  public void setVisitedDecay(double visitedDecay) {
    this.visitedDecay = visitedDecay;
  }

  public int getProbesPerRound() {
    return probesPerRound;
  }

  public void setProbesPerRound(int probesPerRound) {
    this.probesPerRound = probesPerRound;
  }

  public int getFastMaxProbes() {
    return fastMaxProbes;
  }

  public void setFastMaxProbes(int fastMaxProbes) {
    this.fastMaxProbes = fastMaxProbes;
  }

  public int getDeepMaxProbes() {
    return deepMaxProbes;
  }

  public void setDeepMaxProbes(int deepMaxProbes) {
    this.deepMaxProbes = deepMaxProbes;
  }

  public int getMaxTokens() {
    return maxTokens;
  }

  public void setMaxTokens(int maxTokens) {
    this.maxTokens = maxTokens;
  }

  public int getTopK() {
    return topK;
  }

  public void setTopK(int topK) {
    this.topK = topK;
  }

  public int getRoiWindow() {
    return roiWindow;
  }

  public void setRoiWindow(int roiWindow) {
    this.roiWindow = roiWindow;
  }

  public long getSeed() {
    return seed;
  }

  public void setSeed(long seed) {
    this.seed = seed;
  }

  public RetrySettings getReadRetry() {
    return readRetry;
  }

  public void setReadRetry(RetrySettings readRetry) {
    this.readRetry = readRetry;
  }
}
