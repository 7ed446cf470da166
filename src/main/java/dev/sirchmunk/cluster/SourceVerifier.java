package dev.sirchmunk.cluster;

import dev.sirchmunk.retrieval.ContentFingerprint;
import dev.sirchmunk.retrieval.FileType;
import dev.sirchmunk.retrieval.TitleExtractor;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Raw scan of a cluster's source files. Produces {@link ScanMetadata} only; it never sees the
 * curated fields.
 *
 * <p>The first fingerprint recorded for a path is its baseline. A file whose fingerprint later
 * differs from the baseline stays a broken reference until the cluster is rebuilt.
 */
@Component
public class SourceVerifier {

  private static final Logger log = LoggerFactory.getLogger(SourceVerifier.class);

  private final Clock clock;

  public SourceVerifier(Clock clock) {
    this.clock = clock;
  }

  /**
   * Scans {@code sourcePaths} against the previous scan.
   *
   * @param sourcePaths evidence source files, primary first
   * @param previous last scan, {@link ScanMetadata#empty()} at capture time
   */
  public ScanMetadata verify(List<String> sourcePaths, ScanMetadata previous) {
    Map<String, String> fingerprints = new LinkedHashMap<>();
    List<String> broken = new ArrayList<>();
    String title = null;
    for (String source : sourcePaths) {
      Path path = Path.of(source);
      String baseline = previous.fingerprints().get(source);
      if (!Files.isRegularFile(path)) {
        log.warn("Evidence source missing: {}", source);
        broken.add(source);
        if (baseline != null) {
          fingerprints.put(source, baseline);
        }
        continue;
      }
      try {
        String current = ContentFingerprint.ofFile(path);
        fingerprints.put(source, baseline != null ? baseline : current);
        if (baseline != null && !baseline.equals(current)) {
          log.warn("Evidence source changed since capture: {}", source);
          broken.add(source);
        }
        if (title == null) {
          title = TitleExtractor.extract(path, FileType.of(path));
        }
      } catch (IOException e) {
        log.warn("Evidence source unreadable: {} ({})", source, e.getMessage());
        broken.add(source);
      }
    }
    return new ScanMetadata(
        fingerprints, broken, title, describe(sourcePaths.size(), broken.size()), clock.instant());
  }

  /** True if the cluster has sources and every one of them is broken. */
  public static boolean allBroken(ScanMetadata scan, List<String> sourcePaths) {
    return !sourcePaths.isEmpty() && scan.brokenReferences().containsAll(sourcePaths);
  }

  private static @Nullable String describe(int total, int broken) {
    if (total == 0) {
      return null;
    }
    return (total - broken) + " of " + total + " source files intact";
  }
}
