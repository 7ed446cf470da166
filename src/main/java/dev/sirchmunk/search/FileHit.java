package dev.sirchmunk.search;

import java.nio.file.Path;
import org.jspecify.annotations.Nullable;

/**
 * A file reported on a search result.
 *
 * @param path absolute path
 * @param score ranking score for content searches, match score for file-name searches
 * @param title detected title, if any
 */
public record FileHit(Path path, double score, @Nullable String title) {}
