package dev.sirchmunk.retrieval;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

/** Coarse file family detected from the extension during a scan. */
public enum FileType {
  MARKDOWN,
  TEXT,
  CODE,
  DATA,
  DOCUMENT,
  OTHER;

  private static final Map<String, FileType> BY_EXTENSION =
      Map.ofEntries(
          Map.entry("md", MARKDOWN),
          Map.entry("markdown", MARKDOWN),
          Map.entry("mdx", MARKDOWN),
          Map.entry("rst", MARKDOWN),
          Map.entry("txt", TEXT),
          Map.entry("text", TEXT),
          Map.entry("adoc", TEXT),
          Map.entry("tex", TEXT),
          Map.entry("html", TEXT),
          Map.entry("htm", TEXT),
          Map.entry("java", CODE),
          Map.entry("kt", CODE),
          Map.entry("py", CODE),
          Map.entry("js", CODE),
          Map.entry("ts", CODE),
          Map.entry("go", CODE),
          Map.entry("rs", CODE),
          Map.entry("c", CODE),
          Map.entry("h", CODE),
          Map.entry("cpp", CODE),
          Map.entry("cs", CODE),
          Map.entry("rb", CODE),
          Map.entry("sh", CODE),
          Map.entry("sql", CODE),
          Map.entry("json", DATA),
          Map.entry("jsonl", DATA),
          Map.entry("yaml", DATA),
          Map.entry("yml", DATA),
          Map.entry("toml", DATA),
          Map.entry("xml", DATA),
          Map.entry("csv", DATA),
          Map.entry("tsv", DATA),
          Map.entry("pdf", DOCUMENT),
          Map.entry("docx", DOCUMENT),
          Map.entry("pptx", DOCUMENT),
          Map.entry("xlsx", DOCUMENT),
          Map.entry("epub", DOCUMENT));

  /**
   * Detects the family of a file from its extension.
   *
   * @param path any file path
   * @return the family, {@link #OTHER} if the extension is unknown or missing
   */
  public static FileType of(Path path) {
    Path fileName = path.getFileName();
    if (fileName == null) {
      return OTHER;
    }
    String name = fileName.toString();
    int dot = name.lastIndexOf('.');
    if (dot < 0 || dot == name.length() - 1) {
      return OTHER;
    }
    return BY_EXTENSION.getOrDefault(name.substring(dot + 1).toLowerCase(Locale.ROOT), OTHER);
  }

  /** Whether the raw bytes are readable as text without an extraction step. */
  public boolean isPlainText() {
    return this == MARKDOWN || this == TEXT || this == CODE || this == DATA;
  }
}
