package dev.sirchmunk.cluster;

import java.util.List;

/**
 * Structured LLM reply describing a cluster built from evidence.
 *
 * @param name short label
 * @param description one to three sentences
 * @param content synthesis of what the evidence says about the query
 * @param patterns recurring patterns or rules found in the evidence
 * @param constraints preconditions and limitations
 * @param confidence 0 to 1
 * @param abstractionLevel one of the {@link AbstractionLevel} names
 */
record ClusterSynthesis(
    String name,
    List<String> description,
    String content,
    List<String> patterns,
    List<Item> constraints,
    Double confidence,
    String abstractionLevel) {

  /**
   * @param kind PRECONDITION or LIMITATION
   * @param statement the constraint
   */
  record Item(String kind, String statement) {}
}
