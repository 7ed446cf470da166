package dev.sirchmunk.search;

/** How much work a search may do. */
public enum SearchMode {
  /** Keyword retrieval, lexical evidence sampling, formatted answer. No LLM relevance judging. */
  FAST,
  /** Full pipeline: LLM-confirmed sampling, LLM cluster synthesis and a streamed answer. */
  DEEP,
  /** File-name and path matching only. Never reads contents, never calls the LLM. */
  FILENAME_ONLY
}
