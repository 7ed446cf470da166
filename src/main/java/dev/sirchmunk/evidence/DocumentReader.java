package dev.sirchmunk.evidence;

import dev.sirchmunk.context.QueryContext;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;

/**
 * Reads a document as text, decoding UTF-8 leniently. Transient read failures (file being
 * rewritten, permission flips) are retried with backoff; after the retry bound the file is
 * skipped with a warning on the query.
 */
@Component
public class DocumentReader {

  private final RetryTemplate retryTemplate;

  public DocumentReader(SamplingProperties properties) {
    this.retryTemplate =
        properties.getReadRetry().toTemplate(List.of(UncheckedIOException.class));
  }

  /**
   * Reads {@code file}.
   *
   * @return the decoded text, or empty if the file could not be read after retries
   */
  public Optional<String> read(Path file, QueryContext context) {
    try {
      return Optional.of(retryTemplate.execute(retryContext -> readOnce(file)));
    } catch (UncheckedIOException e) {
      context.warn("Skipped unreadable file " + file + ": " + e.getCause().getMessage());
      return Optional.empty();
    }
  }

  private static String readOnce(Path file) {
    try {
      byte[] bytes = Files.readAllBytes(file);
      return StandardCharsets.UTF_8
          .newDecoder()
          .onMalformedInput(CodingErrorAction.REPLACE)
          .onUnmappableCharacter(CodingErrorAction.REPLACE)
          .decode(ByteBuffer.wrap(bytes))
          .toString();
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }
}
