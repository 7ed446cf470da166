package dev.sirchmunk.cluster;

import java.util.List;
import java.util.Map;

/**
 * Aggregate distributions over the whole store.
 *
 * @param total number of clusters
 * @param lifecycleCounts clusters per lifecycle state, every state present
 * @param confidenceHistogram 10 bins over [0, 1]; bin {@code i} holds [i/10, (i+1)/10), the last
 *     bin includes 1.0
 * @param hotnessHistogram same binning for hotness
 * @param averageConfidence mean confidence, 0 for an empty store
 * @param withEmbedding clusters that carry a reuse embedding
 */
public record ClusterStats(
    long total,
    Map<Lifecycle, Long> lifecycleCounts,
    List<Integer> confidenceHistogram,
    List<Integer> hotnessHistogram,
    double averageConfidence,
    long withEmbedding) {

  public static final int BINS = 10;

  public ClusterStats {
    lifecycleCounts = Map.copyOf(lifecycleCounts);
    confidenceHistogram = List.copyOf(confidenceHistogram);
    hotnessHistogram = List.copyOf(hotnessHistogram);
  }
}
