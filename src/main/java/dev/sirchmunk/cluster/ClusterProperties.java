package dev.sirchmunk.cluster;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for cluster reuse, lifecycle and maintenance, bound from {@code
 * sirchmunk.cluster.*}.
 *
 * <ul>
 *   <li>{@code similarity-threshold} - minimum cosine similarity between a query and a cluster's
 *       query history for reuse (default 0.85)
 *   <li>{@code tie-band} - candidates this close to the best one make reuse ambiguous (0.02)
 *   <li>{@code corroboration-count} - corroborating searches needed for EMERGING to become
 *       STABLE; the creating search counts as the first (default 3)
 *   <li>{@code hotness-decay} - factor applied per maintenance cycle to clusters not reused since
 *       the previous cycle (0.95)
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "sirchmunk.cluster")
public class ClusterProperties {

  private boolean reuseEnabled = true;
  private double similarityThreshold = 0.85;
  private int reuseTopK = 3;
  private double tieBand = 0.02;
  private int corroborationCount = 3;
  private int maxQueries = 5;
  private double hotnessIncrement = 0.1;
  private double confidenceNudge = 0.2;
  private double hotnessDecay = 0.95;
  private long maintenanceIntervalMs = 3_600_000;
  private boolean maintenanceEnabled = true;

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (similarityThreshold <= 0.0 || similarityThreshold > 1.0) {
      throw new IllegalStateException(
          "sirchmunk.cluster.similarity-threshold must be in (0.0, 1.0], got: "
              + similarityThreshold);
    }
    if (reuseTopK < 1) {
      throw new IllegalStateException(
          "sirchmunk.cluster.reuse-top-k must be >= 1, got: " + reuseTopK);
    }
    if (tieBand < 0.0 || tieBand > 0.5) {
      throw new IllegalStateException(
          "sirchmunk.cluster.tie-band must be in [0.0, 0.5], got: " + tieBand);
    }
    if (corroborationCount < 1) {
      throw new IllegalStateException(
          "sirchmunk.cluster.corroboration-count must be >= 1, got: " + corroborationCount);
    }
    if (maxQueries < 1) {
      throw new IllegalStateException(
          "sirchmunk.cluster.max-queries must be >= 1, got: " + maxQueries);
    }
    if (hotnessIncrement < 0.0 || hotnessIncrement > 1.0) {
      throw new IllegalStateException(
          "sirchmunk.cluster.hotness-increment must be in [0.0, 1.0], got: " + hotnessIncrement);
    }
    if (confidenceNudge < 0.0 || confidenceNudge > 1.0) {
      throw new IllegalStateException(
          "sirchmunk.cluster.confidence-nudge must be in [0.0, 1.0], got: " + confidenceNudge);
    }
    if (hotnessDecay <= 0.0 || hotnessDecay > 1.0) {
      throw new IllegalStateException(
          "sirchmunk.cluster.hotness-decay must be in (0.0, 1.0], got: " + hotnessDecay);
    }
    if (maintenanceIntervalMs < 1000) {
      throw new IllegalStateException(
          "sirchmunk.cluster.maintenance-interval-ms must be >= 1000, got: "
              + maintenanceIntervalMs);
    }
  }

  public boolean isReuseEnabled() {
    return reuseEnabled;
  }

  public void setReuseEnabled(boolean reuseEnabled) {
    this.reuseEnabled = reuseEnabled;
  }

  public double getSimilarityThreshold() {
    return similarityThreshold;
  }

  public void setSimilarityThreshold(double similarityThreshold) {
    this.similarityThreshold = similarityThreshold;
  }

  public int getReuseTopK() {
    return reuseTopK;
  }

  public void setReuseTopK(int reuseTopK) {
    this.reuseTopK = reuseTopK;
  }

  public double getTieBand() {
    return tieBand;
  }

  public void setTieBand(double tieBand) {
    this.tieBand = tieBand;
  }

  public int getCorroborationCount() {
    return corroborationCount;
  }

  public void setCorroborationCount(int corroborationCount) {
    this.corroborationCount = corroborationCount;
  }

  public int getMaxQueries() {
    return maxQueries;
  }

  public void setMaxQueries(int maxQueries) {
    this.maxQueries = maxQueries;
  }

  public double getHotnessIncrement() {
    return hotnessIncrement;
  }

  public void setHotnessIncrement(double hotnessIncrement) {
    this.hotnessIncrement = hotnessIncrement;
  }

  public double getConfidenceNudge() {
    return confidenceNudge;
  }

  public void setConfidenceNudge(double confidenceNudge) {
    this.confidenceNudge = confidenceNudge;
  }

  public double getHotnessDecay() {
    return hotnessDecay;
  }

  public void setHotnessDecay(double hotnessDecay) {
    this.hotnessDecay = hotnessDecay;
  }

  public long getMaintenanceIntervalMs() {
    return maintenanceIntervalMs;
  }

  public void setMaintenanceIntervalMs(long maintenanceIntervalMs) {
    this.maintenanceIntervalMs = maintenanceIntervalMs;
  }

  public boolean isMaintenanceEnabled() {
    return maintenanceEnabled;
  }

  public void setMaintenanceEnabled(boolean maintenanceEnabled) {
    this.maintenanceEnabled = maintenanceEnabled;
  }
}
