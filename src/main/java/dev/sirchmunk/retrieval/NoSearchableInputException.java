package dev.sirchmunk.retrieval;

import java.util.List;

/** Every requested search path was missing or unreadable. */
public class NoSearchableInputException extends RuntimeException {

  private final List<String> rejectedPaths;

  public NoSearchableInputException(List<String> rejectedPaths) {
    super("None of the search paths is readable: " + String.join(", ", rejectedPaths));
    this.rejectedPaths = List.copyOf(rejectedPaths);
  }

  public List<String> getRejectedPaths() {
    return rejectedPaths;
  }
}
