package dev.sirchmunk.grep;

import dev.sirchmunk.context.QueryContext;
import java.util.List;

/**
 * Narrow boundary to the external line-oriented content search utility.
 *
 * <p>"No matches" is an empty list, never an exception.
 */
public interface TextSearchTool {

  /**
   * Runs one search.
   *
   * @param request patterns and files
   * @param context owning query, used to abort the call on cancellation
   * @return normalised hits in tool output order
   * @throws SearchToolUnavailableException if the tool cannot be started at all
   * @throws TextSearchTimeoutException if the call exceeded its per-call timeout
   */
  List<MatchRecord> search(TextSearchRequest request, QueryContext context);
}
