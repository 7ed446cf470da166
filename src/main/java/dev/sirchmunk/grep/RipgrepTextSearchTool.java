package dev.sirchmunk.grep;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.sirchmunk.context.QueryContext;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * {@link TextSearchTool} backed by ripgrep (or ripgrep-all) in {@code --json} mode.
 *
 * <p>Exit code 1 means "no matches". Exit code 2 means some files could not be read; hits found
 * in the other files are still returned. The process is killed when the per-call timeout elapses
 * or when the owning query is cancelled.
 */
@Component
public class RipgrepTextSearchTool implements TextSearchTool {

  private static final Logger log = LoggerFactory.getLogger(RipgrepTextSearchTool.class);

  private final SearchToolProperties properties;
  private final ObjectMapper objectMapper;

  public RipgrepTextSearchTool(SearchToolProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;
  }

  @Override
  public List<MatchRecord> search(TextSearchRequest request, QueryContext context) {
    if (request.files().isEmpty()) {
      return List.of();
    }
    context.checkActive();

    List<String> command = buildCommand(request);
    Process process;
    try {
      process =
          new ProcessBuilder(command).redirectError(ProcessBuilder.Redirect.DISCARD).start();
    } catch (IOException e) {
      throw new SearchToolUnavailableException(
          "Cannot run '"
              + properties.getExecutable()
              + "'. Install ripgrep (https://github.com/BurntSushi/ripgrep) or set"
              + " sirchmunk.search-tool.executable",
          e);
    }

    AtomicBoolean timedOut = new AtomicBoolean(false);
    CompletableFuture.delayedExecutor(properties.getCallTimeoutMs(), TimeUnit.MILLISECONDS)
        .execute(
            () -> {
              if (process.isAlive()) {
                timedOut.set(true);
                process.destroyForcibly();
              }
            });

    List<MatchRecord> matches = new ArrayList<>();
    try (QueryContext.Registration ignored = context.onCancel(process::destroyForcibly);
        BufferedReader reader =
            new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
      String line;
      while ((line = reader.readLine()) != null) {
        MatchRecord match = parseLine(line, request.level());
        if (match != null) {
          matches.add(match);
        }
      }
      int exit = process.waitFor();
      if (timedOut.get()) {
        throw new TextSearchTimeoutException(
            "Search tool exceeded " + properties.getCallTimeoutMs() + " ms");
      }
      context.checkActive();
      if (exit == 2) {
        log.warn("Search tool reported unreadable files (exit 2); keeping {} hits", matches.size());
      } else if (exit > 2) {
        log.warn("Search tool exited with code {}", exit);
      }
    } catch (IOException e) {
      if (timedOut.get()) {
        throw new TextSearchTimeoutException(
            "Search tool exceeded " + properties.getCallTimeoutMs() + " ms");
      }
      context.checkActive();
      throw new SearchToolUnavailableException("Failed reading search tool output", e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      process.destroyForcibly();
      context.cancel("interrupted");
      context.checkActive();
    }
    log.debug("Level {} task over {} files: {} hits", request.level(), request.files().size(),
        matches.size());
    return matches;
  }

  List<String> buildCommand(TextSearchRequest request) {
    List<String> command = new ArrayList<>();
    command.add(properties.getExecutable());
    command.add("--json");
    command.add("--no-config");
    command.add("--fixed-strings");
    command.add(request.caseSensitive() ? "--case-sensitive" : "--ignore-case");
    if (request.encoding() != null) {
      command.add("--encoding");
      command.add(request.encoding());
    }
    for (String pattern : request.patterns()) {
      command.add("-e");
      command.add(pattern);
    }
    command.add("--");
    for (Path file : request.files()) {
      command.add(file.toString());
    }
    return command;
  }

  /** Parses one line of {@code --json} output; non-match messages yield {@code null}. */
  @Nullable MatchRecord parseLine(String line, int level) {
    if (line.isBlank()) {
      return null;
    }
    JsonNode node;
    try {
      node = objectMapper.readTree(line);
    } catch (IOException e) {
      log.debug("Skipping unparsable search tool output: {}", e.getMessage());
      return null;
    }
    if (!"match".equals(node.path("type").asText())) {
      return null;
    }
    JsonNode data = node.path("data");
    String path = data.path("path").path("text").asText(null);
    String text = data.path("lines").path("text").asText(null);
    if (path == null || text == null) {
      // non-UTF-8 paths or lines arrive base64-encoded under "bytes"
      return null;
    }
    long start = data.path("absolute_offset").asLong(0);
    long end = start + text.getBytes(StandardCharsets.UTF_8).length;
    List<String> submatches = new ArrayList<>();
    for (JsonNode sub : data.path("submatches")) {
      String matched = sub.path("match").path("text").asText(null);
      if (matched != null) {
        submatches.add(matched);
      }
    }
    return new MatchRecord(
        Path.of(path),
        data.path("line_number").asInt(0),
        start,
        end,
        stripNewline(text),
        submatches,
        level);
  }

  private static String stripNewline(String text) {
    int end = text.length();
    while (end > 0 && (text.charAt(end - 1) == '\n' || text.charAt(end - 1) == '\r')) {
      end--;
    }
    return text.substring(0, end);
  }
}
