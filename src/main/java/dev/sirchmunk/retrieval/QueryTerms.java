package dev.sirchmunk.retrieval;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/** Static utility splitting free text into lowercase terms and dropping English stopwords. */
public final class QueryTerms {

  private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}_]+");

  private static final Set<String> STOPWORDS =
      Set.of(
          "a", "about", "after", "all", "also", "an", "and", "any", "are", "as", "at", "be",
          "been", "before", "being", "between", "both", "but", "by", "can", "could", "did",
          "do", "does", "doing", "during", "each", "explain", "find", "for", "from", "get",
          "had", "has", "have", "having", "he", "her", "here", "his", "how", "i", "if", "in",
          "into", "is", "it", "its", "just", "me", "more", "most", "my", "no", "not", "of",
          "on", "once", "only", "or", "other", "our", "out", "over", "please", "same", "she",
          "should", "show", "so", "some", "such", "tell", "than", "that", "the", "their",
          "them", "then", "there", "these", "they", "this", "those", "through", "to", "too",
          "under", "until", "up", "use", "used", "very", "was", "we", "were", "what", "when",
          "where", "which", "while", "who", "whom", "why", "will", "with", "would", "you",
          "your");

  private QueryTerms() {
    // utility class
  }

  /**
   * All lowercase word tokens of {@code text}, in order, duplicates kept.
   *
   * @param text any text
   * @return tokens, empty for blank input
   */
  public static List<String> tokens(String text) {
    List<String> tokens = new ArrayList<>();
    if (text == null) {
      return tokens;
    }
    for (String token : NON_WORD.split(text.toLowerCase(Locale.ROOT))) {
      if (!token.isEmpty()) {
        tokens.add(token);
      }
    }
    return tokens;
  }

  /**
   * Distinct content-bearing terms of {@code text} in first-occurrence order. Falls back to all
   * distinct tokens when every token is a stopword.
   *
   * @param text query text
   * @return salient terms, empty only if {@code text} has no word characters
   */
  public static List<String> salient(String text) {
    List<String> tokens = tokens(text);
    Set<String> salient = new LinkedHashSet<>();
    for (String token : tokens) {
      if (token.length() > 1 && !STOPWORDS.contains(token)) {
        salient.add(token);
      }
    }
    if (salient.isEmpty()) {
      salient.addAll(tokens);
    }
    return List.copyOf(salient);
  }

  public static boolean isStopword(String token) {
    return STOPWORDS.contains(token);
  }
}
