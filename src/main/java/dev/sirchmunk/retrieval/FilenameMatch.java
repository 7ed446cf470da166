package dev.sirchmunk.retrieval;

/**
 * A file whose name matched a FILENAME_ONLY query.
 *
 * @param candidate scanned file metadata
 * @param score match strength in (0, 1]
 * @param matchedPattern the first pattern that matched, e.g. {@code .*test.*}
 */
public record FilenameMatch(FileCandidate candidate, double score, String matchedPattern) {}
