package dev.sirchmunk.cluster;

import java.util.LinkedHashSet;
import java.util.List;

/**
 * Description or content of a cluster: either one block of text or several lines.
 *
 * <p>Stored as a JSON string or a JSON array respectively.
 */
public sealed interface ClusterText permits ClusterText.Scalar, ClusterText.Multi {

  /** Lines of the text; a scalar is one line. */
  List<String> lines();

  /** The text joined with newlines. */
  default String joined() {
    return String.join("\n", lines());
  }

  default boolean isBlank() {
    return lines().stream().allMatch(String::isBlank);
  }

  static ClusterText of(String text) {
    return new Scalar(text);
  }

  static ClusterText of(List<String> lines) {
    return lines.size() == 1 ? new Scalar(lines.get(0)) : new Multi(lines);
  }

  /** Merges two texts, dropping repeated lines. */
  static ClusterText union(ClusterText a, ClusterText b) {
    LinkedHashSet<String> lines = new LinkedHashSet<>(a.lines());
    lines.addAll(b.lines());
    lines.removeIf(String::isBlank);
    return lines.isEmpty() ? new Scalar("") : of(List.copyOf(lines));
  }

  /** A single block of text. */
  record Scalar(String text) implements ClusterText {
    public Scalar {
      text = text == null ? "" : text;
    }

    @Override
    public List<String> lines() {
      return List.of(text);
    }
  }

  /** Several lines, kept in order. */
  record Multi(List<String> texts) implements ClusterText {
    public Multi {
      texts = texts == null ? List.of() : List.copyOf(texts);
    }

    @Override
    public List<String> lines() {
      return texts;
    }
  }
}
