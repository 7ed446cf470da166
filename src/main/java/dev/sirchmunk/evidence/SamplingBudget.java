package dev.sirchmunk.evidence;

/**
 * Limits for one {@link EvidenceSampler#sample} call.
 *
 * @param maxProbes probes allowed; 0 yields no evidence
 * @param maxTokens estimated tokens of probe text allowed (chars / 4)
 * @param topK maximum evidence units returned
 * @param llmConfirmation whether the final candidates are judged by the LLM
 */
public record SamplingBudget(int maxProbes, int maxTokens, int topK, boolean llmConfirmation) {

  public SamplingBudget {
    if (maxProbes < 0 || maxTokens < 0 || topK < 0) {
      throw new IllegalArgumentException("Sampling budget values must be >= 0");
    }
  }

  public static SamplingBudget none() {
    return new SamplingBudget(0, 0, 0, false);
  }

  public boolean isZero() {
    return maxProbes == 0 || maxTokens == 0 || topK == 0;
  }
}
