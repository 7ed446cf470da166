package dev.sirchmunk.cluster;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.jspecify.annotations.Nullable;

/**
 * Facts derived from raw scans of a cluster's source files. Kept apart from the curated fields so
 * that a re-scan can never overwrite what searches and the LLM learned.
 *
 * @param fingerprints source path to content fingerprint at the last scan
 * @param brokenReferences evidence source paths found missing or changed
 * @param derivedTitle title detected in the primary source file
 * @param derivedDescription description text derived from the scan, never copied to the curated
 *     description
 * @param lastScanAt when the scan ran
 */
public record ScanMetadata(
    Map<String, String> fingerprints,
    List<String> brokenReferences,
    @Nullable String derivedTitle,
    @Nullable String derivedDescription,
    @Nullable Instant lastScanAt) {

  public ScanMetadata {
    fingerprints =
        fingerprints == null
            ? Map.of()
            : Collections.unmodifiableMap(new TreeMap<>(fingerprints));
    brokenReferences = brokenReferences == null ? List.of() : List.copyOf(brokenReferences);
  }

  public static ScanMetadata empty() {
    return new ScanMetadata(Map.of(), List.of(), null, null, null);
  }
}
