package dev.sirchmunk.retrieval;

/**
 * Tunables of {@link TfIdfRanker}.
 *
 * @param k1 term-frequency saturation
 * @param b length normalisation strength, 0 disables it
 * @param filenameWeight multiplier for a term found in the file name
 * @param titleWeight multiplier for a term found in the detected title
 */
public record RankingWeights(double k1, double b, double filenameWeight, double titleWeight) {

  public static RankingWeights from(RetrievalProperties properties) {
    return new RankingWeights(
        properties.getBm25K1(),
        properties.getBm25B(),
        properties.getFilenameWeight(),
        properties.getTitleWeight());
  }
}
