package dev.sirchmunk.evidence;

/** Half-open character range {@code [start, end)}. */
record TextSpan(int start, int end) {

  TextSpan {
    if (start < 0 || end < start) {
      throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
    }
  }

  int length() {
    return end - start;
  }

  boolean overlaps(TextSpan other) {
    return start < other.end && other.start < end;
  }

  TextSpan union(TextSpan other) {
    return new TextSpan(Math.min(start, other.start), Math.max(end, other.end));
  }
}
