package dev.sirchmunk.cluster;

import static org.assertj.core.api.Assertions.assertThat;

import dev.sirchmunk.retrieval.ContentFingerprint;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SourceVerifierTest {

  private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

  @TempDir Path dir;

  private SourceVerifier verifier;

  @BeforeEach
  void setUp() {
    verifier = new SourceVerifier(Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void firstScanRecordsBaselineAndTitle() throws IOException {
    Path doc = Files.writeString(dir.resolve("retry.md"), "# Retry Policy\n\nDelays double.\n");

    ScanMetadata scan = verifier.verify(List.of(doc.toString()), ScanMetadata.empty());

    assertThat(scan.fingerprints()).containsEntry(doc.toString(), ContentFingerprint.ofFile(doc));
    assertThat(scan.brokenReferences()).isEmpty();
    assertThat(scan.derivedTitle()).isEqualTo("Retry Policy");
    assertThat(scan.derivedDescription()).isEqualTo("1 of 1 source files intact");
    assertThat(scan.lastScanAt()).isEqualTo(NOW);
  }

  @Test
  void changedFileKeepsBaselineAndIsBroken() throws IOException {
    Path doc = Files.writeString(dir.resolve("retry.md"), "three attempts");
    ScanMetadata baseline = verifier.verify(List.of(doc.toString()), ScanMetadata.empty());
    Files.writeString(doc, "five attempts, longer now");

    ScanMetadata rescan = verifier.verify(List.of(doc.toString()), baseline);

    assertThat(rescan.brokenReferences()).containsExactly(doc.toString());
    assertThat(rescan.fingerprints()).isEqualTo(baseline.fingerprints());
  }

  @Test
  void intactFileStaysClean() throws IOException {
    Path doc = Files.writeString(dir.resolve("retry.md"), "three attempts");
    ScanMetadata baseline = verifier.verify(List.of(doc.toString()), ScanMetadata.empty());

    ScanMetadata rescan = verifier.verify(List.of(doc.toString()), baseline);

    assertThat(rescan.brokenReferences()).isEmpty();
  }

  @Test
  void missingFileIsBrokenAndKeepsItsBaseline() {
    String gone = dir.resolve("gone.md").toString();
    ScanMetadata previous =
        new ScanMetadata(Map.of(gone, "abc"), List.of(), null, null, NOW.minusSeconds(60));

    ScanMetadata scan = verifier.verify(List.of(gone), previous);

    assertThat(scan.brokenReferences()).containsExactly(gone);
    assertThat(scan.fingerprints()).containsEntry(gone, "abc");
    assertThat(scan.derivedDescription()).isEqualTo("0 of 1 source files intact");
  }

  @Test
  void allBrokenNeedsEverySourceBroken() {
    ScanMetadata scan = new ScanMetadata(Map.of(), List.of("/a.md"), null, null, NOW);

    assertThat(SourceVerifier.allBroken(scan, List.of("/a.md"))).isTrue();
    assertThat(SourceVerifier.allBroken(scan, List.of("/a.md", "/b.md"))).isFalse();
    assertThat(SourceVerifier.allBroken(scan, List.of())).isFalse();
  }
}
