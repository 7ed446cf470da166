package dev.sirchmunk.evidence;

/**
 * Structured LLM reply when confirming a candidate passage.
 *
 * @param score relevance of the passage to the query in [0, 1]
 * @param justification one-sentence reason
 */
public record RelevanceJudgment(double score, String justification) {}
