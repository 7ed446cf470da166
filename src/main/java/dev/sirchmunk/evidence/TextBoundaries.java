package dev.sirchmunk.evidence;

/**
 * Static utility growing character ranges outward to sentence or paragraph boundaries so that
 * probes and evidence never start or end mid-sentence.
 *
 * <p>A sentence ends after {@code . ! ?} followed by whitespace, or at a line break. A paragraph
 * ends at a blank line. Growth on each side stops after {@code maxGrowth} characters; the range
 * is then cut at the nearest whitespace instead.
 */
final class TextBoundaries {

  private TextBoundaries() {
    // utility class
  }

  static TextSpan toSentences(String text, int start, int end, int maxGrowth) {
    int s = clamp(start, text);
    int e = Math.max(s, clamp(end, text));
    int newStart = s;
    int limit = Math.max(0, s - maxGrowth);
    while (newStart > limit && !isSentenceStart(text, newStart)) {
      newStart--;
    }
    if (newStart == limit && !isSentenceStart(text, newStart)) {
      newStart = wordStart(text, s, limit);
    }
    int newEnd = e;
    int endLimit = Math.min(text.length(), e + maxGrowth);
    while (newEnd < endLimit && !isSentenceEnd(text, newEnd)) {
      newEnd++;
    }
    if (newEnd == endLimit && !isSentenceEnd(text, newEnd)) {
      newEnd = wordEnd(text, e, endLimit);
    }
    return trim(text, newStart, newEnd);
  }

  static TextSpan toParagraphs(String text, int start, int end, int maxLength) {
    int s = clamp(start, text);
    int e = Math.max(s, clamp(end, text));
    if (e - s >= maxLength) {
      return trim(text, s, e);
    }
    int slack = maxLength - (e - s);
    int newStart = s;
    int startLimit = Math.max(0, s - slack / 2);
    while (newStart > startLimit && !isParagraphStart(text, newStart)) {
      newStart--;
    }
    if (!isParagraphStart(text, newStart)) {
      newStart = sentenceStartWithin(text, newStart, s);
    }
    int endLimit = Math.min(text.length(), e + (maxLength - (e - newStart)));
    int newEnd = e;
    while (newEnd < endLimit && !isParagraphEnd(text, newEnd)) {
      newEnd++;
    }
    if (!isParagraphEnd(text, newEnd)) {
      newEnd = sentenceEndWithin(text, e, newEnd);
    }
    return trim(text, newStart, newEnd);
  }

  static boolean isSentenceStart(String text, int pos) {
    if (pos <= 0) {
      return true;
    }
    char prev = text.charAt(pos - 1);
    if (prev == '\n') {
      return true;
    }
    return Character.isWhitespace(prev) && pos >= 2 && isTerminator(text.charAt(pos - 2));
  }

  static boolean isSentenceEnd(String text, int pos) {
    if (pos >= text.length()) {
      return true;
    }
    char c = text.charAt(pos);
    if (c == '\n') {
      return true;
    }
    return pos > 0 && isTerminator(text.charAt(pos - 1)) && Character.isWhitespace(c);
  }

  static boolean isParagraphStart(String text, int pos) {
    return pos <= 0 || (pos >= 2 && text.charAt(pos - 1) == '\n' && text.charAt(pos - 2) == '\n');
  }

  static boolean isParagraphEnd(String text, int pos) {
    return pos >= text.length()
        || (pos + 1 < text.length() && text.charAt(pos) == '\n' && text.charAt(pos + 1) == '\n');
  }

  // earliest sentence start in [from, limit], else limit
  private static int sentenceStartWithin(String text, int from, int limit) {
    for (int pos = from; pos <= limit; pos++) {
      if (isSentenceStart(text, pos)) {
        return pos;
      }
    }
    return limit;
  }

  // latest sentence end in [from, limit], else from
  private static int sentenceEndWithin(String text, int from, int limit) {
    for (int pos = limit; pos >= from; pos--) {
      if (isSentenceEnd(text, pos)) {
        return pos;
      }
    }
    return from;
  }

  private static boolean isTerminator(char c) {
    return c == '.' || c == '!' || c == '?';
  }

  private static int wordStart(String text, int pos, int limit) {
    int p = pos;
    while (p > limit && !Character.isWhitespace(text.charAt(p - 1))) {
      p--;
    }
    return p;
  }

  private static int wordEnd(String text, int pos, int limit) {
    int p = pos;
    while (p < limit && !Character.isWhitespace(text.charAt(p))) {
      p++;
    }
    return p;
  }

  private static TextSpan trim(String text, int start, int end) {
    int s = start;
    int e = end;
    while (s < e && Character.isWhitespace(text.charAt(s))) {
      s++;
    }
    while (e > s && Character.isWhitespace(text.charAt(e - 1))) {
      e--;
    }
    return new TextSpan(s, e);
  }

  private static int clamp(int pos, String text) {
    return Math.max(0, Math.min(pos, text.length()));
  }
}
