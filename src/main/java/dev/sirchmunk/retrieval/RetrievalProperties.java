package dev.sirchmunk.retrieval;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for keyword planning and candidate ranking, bound from {@code
 * sirchmunk.retrieval.*}.
 *
 * <ul>
 *   <li>{@code keyword-levels} - levels requested from the planner (default 3)
 *   <li>{@code min-hits} - distinct files a level must hit to win priority-hit search (default 1)
 *   <li>{@code max-depth} / {@code top-k-files} - request defaults (5 / 3)
 *   <li>{@code bm25-k1}, {@code bm25-b} - term saturation and length normalisation
 *   <li>{@code filename-weight}, {@code title-weight} - multipliers for hits in the file name or
 *       detected title
 *   <li>{@code llm-keyword-planning} - ask the LLM for keyword levels before falling back to the
 *       heuristic planner (default true)
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "sirchmunk.retrieval")
public class RetrievalProperties {

  private int keywordLevels = 3;
  private int minHits = 1;
  private int maxDepth = 5;
  private int topKFiles = 3;
  private double bm25K1 = 1.2;
  private double bm25B = 0.75;
  private double filenameWeight = 2.5;
  private double titleWeight = 2.0;
  private boolean llmKeywordPlanning = true;

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (keywordLevels < 1 || keywordLevels > 10) {
      throw new IllegalStateException(
          "sirchmunk.retrieval.keyword-levels must be in [1, 10], got: " + keywordLevels);
    }
    if (minHits < 1) {
      throw new IllegalStateException(
          "sirchmunk.retrieval.min-hits must be >= 1, got: " + minHits);
    }
    if (maxDepth < 0) {
      throw new IllegalStateException(
          "sirchmunk.retrieval.max-depth must be >= 0, got: " + maxDepth);
    }
    if (topKFiles < 1) {
      throw new IllegalStateException(
          "sirchmunk.retrieval.top-k-files must be >= 1, got: " + topKFiles);
    }
    if (bm25K1 <= 0.0) {
      throw new IllegalStateException(
          "sirchmunk.retrieval.bm25-k1 must be > 0, got: " + bm25K1);
    }
    if (bm25B < 0.0 || bm25B > 1.0) {
      throw new IllegalStateException(
          "sirchmunk.retrieval.bm25-b must be in [0.0, 1.0], got: " + bm25B);
    }
    if (filenameWeight < 0.0 || titleWeight < 0.0) {
      throw new IllegalStateException(
          "sirchmunk.retrieval filename-weight and title-weight must be >= 0");
    }
  }

  public int getKeywordLevels() {
    return keywordLevels;
  }

  public void setKeywordLevels(int keywordLevels) {
    this.keywordLevels = keywordLevels;
  }

  public int getMinHits() {
    return minHits;
  }

  public void setMinHits(int minHits) {
    this.minHits = minHits;
  }

  public int getMaxDepth() {
    return maxDepth;
  }

  public void setMaxDepth(int maxDepth) {
    this.maxDepth = maxDepth;
  }

  public int getTopKFiles() {
    return topKFiles;
  }

  public void setTopKFiles(int topKFiles) {
    this.topKFiles = topKFiles;
  }

  public double getBm25K1() {
    return bm25K1;
  }

  public void setBm25K1(double bm25K1) {
    this.bm25K1 = bm25K1;
  }

  public double getBm25B() {
    return bm25B;
  }

  public void setBm25B(double bm25B) {
    this.bm25B = bm25B;
  }

  public double getFilenameWeight() {
    return filenameWeight;
  }

  public void setFilenameWeight(double filenameWeight) {
    this.filenameWeight = filenameWeight;
  }

  public double getTitleWeight() {
    return titleWeight;
  }

  public void setTitleWeight(double titleWeight) {
    this.titleWeight = titleWeight;
  }

  public boolean isLlmKeywordPlanning() {
    return llmKeywordPlanning;
  }

  public void setLlmKeywordPlanning(boolean llmKeywordPlanning) {
    this.llmKeywordPlanning = llmKeywordPlanning;
  }
}
