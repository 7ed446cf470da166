package dev.sirchmunk.cluster;

import static dev.sirchmunk.fixture.KnowledgeClusterBuilder.evidence;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.when;

import dev.sirchmunk.evidence.EvidenceUnit;
import dev.sirchmunk.fixture.KnowledgeClusterBuilder;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

@DataJpaTest
@Import({ClusterStore.class, ClusterProperties.class, ClusterStoreTest.FixedClock.class})
class ClusterStoreTest {

  static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

  @TestConfiguration
  static class FixedClock {
    @Bean
    Clock clock() {
      return Clock.fixed(NOW, ZoneOffset.UTC);
    }
  }

  @Autowired ClusterStore store;
  @Autowired TestEntityManager entityManager;
  @MockBean QueryEmbedder embedder;

  @Test
  void insertStampsTimestampsAndRoundTripsJsonColumns() {
    EvidenceUnit unit = evidence("/docs/retry.md", 10, 60, "exponential backoff");
    KnowledgeCluster cluster =
        new KnowledgeClusterBuilder().id("C1").evidence(unit).queryEmbedding(1f, 0f).build();
    cluster.setPatterns(List.of("double the delay"));
    cluster.setConstraints(List.of(new Constraint(Constraint.Kind.LIMITATION, "max 3 tries")));
    cluster.setScanMetadata(
        new ScanMetadata(Map.of("/docs/retry.md", "abc"), List.of(), "Retry", null, NOW));

    store.insert(cluster);
    entityManager.flush();
    entityManager.clear();

    KnowledgeCluster loaded = store.get("C1").orElseThrow();
    assertThat(loaded.getCreatedAt()).isEqualTo(NOW);
    assertThat(loaded.getLastModified()).isEqualTo(NOW);
    assertThat(loaded.getEvidence()).containsExactly(unit);
    assertThat(loaded.getPatterns()).containsExactly("double the delay");
    assertThat(loaded.getConstraints())
        .containsExactly(new Constraint(Constraint.Kind.LIMITATION, "max 3 tries"));
    assertThat(loaded.getQueryEmbedding()).containsExactly(1f, 0f);
    assertThat(loaded.getScanMetadata().fingerprints()).containsEntry("/docs/retry.md", "abc");
    assertThat(loaded.getLifecycle()).isEqualTo(Lifecycle.EMERGING);
    assertThat(loaded.getVersion()).isNotNull();
  }

  @Test
  void insertComputesEmbeddingFromQueryHistory() {
    when(embedder.embedHistory(anyList())).thenReturn(Optional.of(new float[] {0.6f, 0.8f}));

    KnowledgeCluster saved = store.insert(new KnowledgeClusterBuilder().id("C1").build());

    assertThat(saved.getQueryEmbedding()).containsExactly(0.6f, 0.8f);
  }

  @Test
  void insertUnderExistingIdConflicts() {
    store.insert(new KnowledgeClusterBuilder().id("C1").build());

    assertThatThrownBy(() -> store.insert(new KnowledgeClusterBuilder().id("C1").build()))
        .isInstanceOf(ClusterConflictException.class)
        .hasMessageContaining("C1");
  }

  @Test
  void reuseOfKnownQueryDoesNotAddCorroboration() {
    store.insert(new KnowledgeClusterBuilder().id("C1").queries("retry backoff").build());

    store.recordReuse("C1", "retry backoff", 0.9);
    KnowledgeCluster cluster = store.recordReuse("C1", "  Retry Backoff ", 0.9);

    assertThat(cluster.getCorroborations()).isEqualTo(1);
    assertThat(cluster.getQueries()).hasSize(1);
    assertThat(cluster.getLifecycle()).isEqualTo(Lifecycle.EMERGING);
  }

  @Test
  void reuseRaisesHotnessAndNudgesConfidence() {
    store.insert(new KnowledgeClusterBuilder().id("C1").confidence(0.6).hotness(0.5).build());

    KnowledgeCluster cluster = store.recordReuse("C1", "new question", 0.9);

    assertThat(cluster.getHotness()).isCloseTo(0.6, within(1e-9));
    assertThat(cluster.getConfidence()).isCloseTo(0.66, within(1e-9));
    assertThat(cluster.getLastReusedAt()).isEqualTo(NOW);
  }

  @Test
  void promotesToStableExactlyAtCorroborationCount() {
    store.insert(new KnowledgeClusterBuilder().id("C1").queries("first").build());

    KnowledgeCluster second = store.recordReuse("C1", "second", 0.9);
    assertThat(second.getCorroborations()).isEqualTo(2);
    assertThat(second.getLifecycle()).isEqualTo(Lifecycle.EMERGING);

    KnowledgeCluster third = store.recordReuse("C1", "third", 0.9);
    assertThat(third.getCorroborations()).isEqualTo(3);
    assertThat(third.getLifecycle()).isEqualTo(Lifecycle.STABLE);
  }

  @Test
  void queryHistoryIsBoundedFifo() {
    store.insert(new KnowledgeClusterBuilder().id("C1").queries("q0").build());

    for (int i = 1; i <= 6; i++) {
      store.recordReuse("C1", "q" + i, 0.9);
    }

    assertThat(store.get("C1").orElseThrow().getQueries())
        .containsExactly("q2", "q3", "q4", "q5", "q6");
  }

  @Test
  void deprecatedClusterIsTerminal() {
    store.insert(new KnowledgeClusterBuilder().id("C1").build());
    store.deprecate("C1", "sources removed");

    assertThatThrownBy(() -> store.recordReuse("C1", "again", 0.9))
        .isInstanceOf(ClusterConflictException.class);
    assertThatThrownBy(
            () -> store.augment("C1", new KnowledgeClusterBuilder().id("C2").build(), "again"))
        .isInstanceOf(ClusterConflictException.class);
    assertThat(store.get("C1").orElseThrow().getLifecycle()).isEqualTo(Lifecycle.DEPRECATED);
  }

  @Test
  void applyScanLeavesCuratedFieldsAndLastModifiedAlone() {
    KnowledgeCluster inserted =
        store.insert(new KnowledgeClusterBuilder().id("C1").description("curated").build());
    Instant modified = inserted.getLastModified();

    KnowledgeCluster scanned =
        store.applyScan(
            "C1",
            new ScanMetadata(
                Map.of("/a.md", "f1"), List.of("/b.md"), "Title", "derived text", NOW));

    assertThat(scanned.getDescription().joined()).isEqualTo("curated");
    assertThat(scanned.getLastModified()).isEqualTo(modified);
    assertThat(scanned.getScanMetadata().derivedDescription()).isEqualTo("derived text");
    assertThat(scanned.getScanMetadata().brokenReferences()).containsExactly("/b.md");
  }

  @Test
  void updateChangesOnlyGivenFields() {
    store.insert(new KnowledgeClusterBuilder().id("C1").name("Old").content("body").build());

    KnowledgeCluster updated = store.update("C1", CuratedUpdate.name("New"));

    assertThat(updated.getName()).isEqualTo("New");
    assertThat(updated.getContent().joined()).isEqualTo("body");
  }

  @Test
  void updateOfUnknownClusterFails() {
    assertThatThrownBy(() -> store.update("missing", CuratedUpdate.name("x")))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void deleteReportsWhetherAnythingWasRemoved() {
    store.insert(new KnowledgeClusterBuilder().id("C1").build());

    assertThat(store.delete("C1")).isTrue();
    assertThat(store.delete("C1")).isFalse();
    assertThat(store.get("C1")).isEmpty();
  }

  @Test
  void overlappingDifferentEvidenceContestsCluster() {
    store.insert(
        new KnowledgeClusterBuilder()
            .id("C1")
            .evidence(evidence("/a.md", 0, 100, "retries three times"))
            .build());
    KnowledgeCluster fresh =
        new KnowledgeClusterBuilder()
            .id("C1")
            .evidence(evidence("/a.md", 50, 150, "retries five times"))
            .build();

    KnowledgeCluster contested = store.augment("C1", fresh, "how many retries");

    assertThat(contested.getLifecycle()).isEqualTo(Lifecycle.CONTESTED);
    assertThat(contested.getEvidence()).hasSize(2);
    assertThat(contested.getCorroborations()).isEqualTo(1);
  }

  @Test
  void contradictionFreeAugmentReconcilesContestedCluster() {
    store.insert(
        new KnowledgeClusterBuilder()
            .id("C1")
            .lifecycle(Lifecycle.CONTESTED)
            .corroborations(2)
            .evidence(evidence("/a.md", 0, 100, "retries three times"))
            .build());
    KnowledgeCluster fresh =
        new KnowledgeClusterBuilder()
            .id("C1")
            .evidence(
                evidence("/a.md", 0, 100, "retries  three times"),
                evidence("/a.md", 400, 500, "delay doubles"))
            .build();

    KnowledgeCluster reconciled = store.augment("C1", fresh, "retry delay");

    assertThat(reconciled.getLifecycle()).isEqualTo(Lifecycle.STABLE);
    assertThat(reconciled.getEvidence()).hasSize(2);
    assertThat(reconciled.getQueries()).contains("retry delay");
  }

  @Test
  void contestedClusterReconcilesOnlyWithEnoughCorroborations() {
    store.insert(
        new KnowledgeClusterBuilder()
            .id("C1")
            .queries("q1")
            .evidence(evidence("/a.md", 0, 100, "retries three times"))
            .build());
    KnowledgeCluster conflicting =
        new KnowledgeClusterBuilder()
            .id("C1")
            .evidence(evidence("/a.md", 50, 150, "retries five times"))
            .build();
    KnowledgeCluster clean =
        new KnowledgeClusterBuilder()
            .id("C1")
            .evidence(evidence("/a.md", 400, 500, "delay doubles"))
            .build();

    KnowledgeCluster contested = store.augment("C1", conflicting, "q1");
    assertThat(contested.getLifecycle()).isEqualTo(Lifecycle.CONTESTED);
    assertThat(contested.getCorroborations()).isEqualTo(1);

    KnowledgeCluster repeated = store.augment("C1", clean, "q1");
    assertThat(repeated.getLifecycle()).isEqualTo(Lifecycle.CONTESTED);
    assertThat(repeated.getCorroborations()).isEqualTo(1);

    KnowledgeCluster oneShort = store.augment("C1", clean, "q2");
    assertThat(oneShort.getCorroborations()).isEqualTo(2);
    assertThat(oneShort.getLifecycle()).isEqualTo(Lifecycle.CONTESTED);

    KnowledgeCluster enough = store.augment("C1", clean, "q3");
    assertThat(enough.getCorroborations()).isEqualTo(3);
    assertThat(enough.getLifecycle()).isEqualTo(Lifecycle.STABLE);
  }

  @Test
  void mergeKeepsMostAdvancedLifecycleAndRemovesOthers() {
    store.insert(
        new KnowledgeClusterBuilder()
            .id("C1")
            .name("Retry")
            .lifecycle(Lifecycle.STABLE)
            .hotness(0.8)
            .confidence(0.9)
            .corroborations(3)
            .evidence(evidence("/a.md", 0, 10, "a"))
            .build());
    store.insert(
        new KnowledgeClusterBuilder()
            .id("C2")
            .name("Backoff")
            .hotness(0.4)
            .confidence(0.5)
            .corroborations(1)
            .queries("backoff")
            .evidence(evidence("/b.md", 0, 10, "b"))
            .build());

    KnowledgeCluster merged = store.merge(List.of("C1", "C2"));

    assertThat(merged.getId()).isEqualTo("C1");
    assertThat(merged.getName()).isEqualTo("Retry" + ClusterStore.MERGED_SUFFIX);
    assertThat(merged.getLifecycle()).isEqualTo(Lifecycle.STABLE);
    assertThat(merged.getHotness()).isCloseTo(0.6, within(1e-9));
    assertThat(merged.getConfidence()).isCloseTo(0.7, within(1e-9));
    assertThat(merged.getCorroborations()).isEqualTo(4);
    assertThat(merged.sourcePaths()).containsExactly("/a.md", "/b.md");
    assertThat(store.get("C2")).isEmpty();
  }

  @Test
  void mergeRejectsDeprecatedOrSingleCluster() {
    store.insert(new KnowledgeClusterBuilder().id("C1").build());
    store.insert(new KnowledgeClusterBuilder().id("C2").build());
    store.deprecate("C2", "gone");

    assertThatThrownBy(() -> store.merge(List.of("C1", "C2")))
        .isInstanceOf(ClusterConflictException.class);
    assertThatThrownBy(() -> store.merge(List.of("C1", "C1")))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void splitGroupsEvidenceIntoLinkedChildren() {
    store.insert(
        new KnowledgeClusterBuilder()
            .id("C1")
            .name("Mixed")
            .evidence(
                evidence("/a.md", 0, 10, "a1"),
                evidence("/b.md", 0, 10, "b1"),
                evidence("/a.md", 20, 30, "a2"))
            .build());

    List<KnowledgeCluster> children = store.split("C1", EvidenceUnit::sourcePath);

    assertThat(children)
        .extracting(KnowledgeCluster::getId)
        .containsExactly("C1_split0", "C1_split1");
    assertThat(children.get(0).getEvidence()).hasSize(2);
    assertThat(children.get(0).getName()).isEqualTo("Mixed (/a.md)");
    assertThat(children.get(0).getRelatedClusters()).containsExactly("C1_split1");
    assertThat(children.get(1).getLifecycle()).isEqualTo(Lifecycle.EMERGING);
    assertThat(store.get("C1")).isEmpty();
  }

  @Test
  void splitChildrenGetTheirOwnReuseEmbedding() {
    when(embedder.embedHistory(anyList()))
        .thenAnswer(
            invocation -> {
              List<String> texts = invocation.getArgument(0);
              return Optional.of(
                  texts.get(0).contains("/a.md") ? new float[] {1f, 0f} : new float[] {0f, 1f});
            });
    when(embedder.embed("retry")).thenReturn(Optional.of(new float[] {1f, 0f}));
    store.insert(
        new KnowledgeClusterBuilder()
            .id("P")
            .name("Retry")
            .queries("retry")
            .queryEmbedding(0.7f, 0.7f)
            .evidence(evidence("/a.md", 0, 10, "a1"), evidence("/b.md", 0, 10, "b1"))
            .build());

    List<KnowledgeCluster> children = store.split("P", EvidenceUnit::sourcePath);

    assertThat(children.get(0).getQueryEmbedding()).containsExactly(1f, 0f);
    assertThat(children.get(1).getQueryEmbedding()).containsExactly(0f, 1f);
    assertThat(children).allSatisfy(c -> assertThat(c.getQueries()).isEmpty());
    ReuseDecision decision = store.findReusable("retry");
    assertThat(decision.outcome()).isEqualTo(ReuseDecision.Outcome.REUSE);
    assertThat(decision.best().clusterId()).isEqualTo("P_split0");
  }

  @Test
  void deprecatedClusterCannotBeSplit() {
    store.insert(
        new KnowledgeClusterBuilder()
            .id("P")
            .evidence(evidence("/a.md", 0, 10, "a1"), evidence("/b.md", 0, 10, "b1"))
            .build());
    store.deprecate("P", "sources gone");

    assertThatThrownBy(() -> store.split("P", EvidenceUnit::sourcePath))
        .isInstanceOf(ClusterConflictException.class)
        .hasMessageContaining("deprecated");
    assertThat(store.get("P").orElseThrow().getLifecycle()).isEqualTo(Lifecycle.DEPRECATED);
    assertThat(store.get("P_split0")).isEmpty();
  }

  @Test
  void mergeOfIdsSharingALockStripeCompletes() {
    assertThat(ClusterStore.stripe("Aa")).isEqualTo(ClusterStore.stripe("BB"));
    store.insert(
        new KnowledgeClusterBuilder().id("Aa").evidence(evidence("/a.md", 0, 5, "a")).build());
    store.insert(
        new KnowledgeClusterBuilder().id("BB").evidence(evidence("/b.md", 0, 5, "b")).build());

    KnowledgeCluster merged = store.merge(List.of("Aa", "BB"));

    assertThat(merged.getId()).isEqualTo("Aa");
    assertThat(store.get("BB")).isEmpty();
  }

  @Test
  void lockStripesStayWithinTheFixedPool() {
    for (String id : List.of("C1", "Cffffffffffff", "", "P_split0", "\u00e9t\u00e9")) {
      assertThat(ClusterStore.stripe(id))
          .isBetween(0, ClusterStore.LOCK_STRIPES - 1)
          .isEqualTo(ClusterStore.stripe(new String(id)));
    }
  }

  @Test
  void splitWithSingleGroupReturnsClusterUnchanged() {
    store.insert(
        new KnowledgeClusterBuilder()
            .id("C1")
            .evidence(evidence("/a.md", 0, 10, "a1"), evidence("/a.md", 20, 30, "a2"))
            .build());

    List<KnowledgeCluster> result = store.split("C1", EvidenceUnit::sourcePath);

    assertThat(result).extracting(KnowledgeCluster::getId).containsExactly("C1");
    assertThat(store.get("C1")).isPresent();
  }

  @Test
  void findRanksNameBeforeDescription() {
    store.insert(
        new KnowledgeClusterBuilder()
            .id("C1")
            .name("Connection Pool")
            .description("mentions retry on checkout")
            .hotness(0.9)
            .build());
    store.insert(
        new KnowledgeClusterBuilder().id("C2").name("Retry Backoff").hotness(0.1).build());

    assertThat(store.find("retry", 10))
        .extracting(KnowledgeCluster::getId)
        .containsExactly("C2", "C1");
    assertThat(store.find("c1", 10)).extracting(KnowledgeCluster::getId).containsExactly("C1");
    assertThat(store.find("  ", 10)).isEmpty();
  }

  @Test
  void listOrdersByHotnessDescending() {
    store.insert(new KnowledgeClusterBuilder().id("C1").hotness(0.2).build());
    store.insert(new KnowledgeClusterBuilder().id("C2").hotness(0.9).build());
    store.insert(new KnowledgeClusterBuilder().id("C3").hotness(0.5).build());

    assertThat(store.list(2, ClusterSortOrder.HOTNESS))
        .extracting(KnowledgeCluster::getId)
        .containsExactly("C2", "C3");
    assertThatThrownBy(() -> store.list(0, ClusterSortOrder.HOTNESS))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void reuseDecisionDependsOnSimilarityGap() {
    when(embedder.embed("retry")).thenReturn(Optional.of(new float[] {1f, 0f}));
    store.insert(new KnowledgeClusterBuilder().id("C1").queryEmbedding(1f, 0f).build());
    store.insert(new KnowledgeClusterBuilder().id("C2").queryEmbedding(0f, 1f).build());

    ReuseDecision single = store.findReusable("retry");
    assertThat(single.outcome()).isEqualTo(ReuseDecision.Outcome.REUSE);
    assertThat(single.best().clusterId()).isEqualTo("C1");

    store.insert(new KnowledgeClusterBuilder().id("C3").queryEmbedding(0.99f, 0.141f).build());
    ReuseDecision tied = store.findReusable("retry");
    assertThat(tied.outcome()).isEqualTo(ReuseDecision.Outcome.AMBIGUOUS);
    assertThat(tied.candidates())
        .extracting(ReuseDecision.Candidate::clusterId)
        .containsExactly("C1", "C3");
  }

  @Test
  void deprecatedClustersAreNeverReused() {
    when(embedder.embed("retry")).thenReturn(Optional.of(new float[] {1f, 0f}));
    store.insert(new KnowledgeClusterBuilder().id("C1").queryEmbedding(1f, 0f).build());
    store.deprecate("C1", "stale");

    assertThat(store.findReusable("retry").outcome()).isEqualTo(ReuseDecision.Outcome.NONE);
    assertThat(store.activeClusterIds()).isEmpty();
  }

  @Test
  void decayCoolsOnlyClustersNotReusedSince() {
    store.insert(new KnowledgeClusterBuilder().id("C1").hotness(0.8).build());
    store.insert(new KnowledgeClusterBuilder().id("C2").hotness(0.8).build());
    store.recordReuse("C2", "fresh question", 0.8);

    int cooled = store.decayHotness(0.5, NOW);

    assertThat(cooled).isEqualTo(1);
    assertThat(store.get("C1").orElseThrow().getHotness()).isCloseTo(0.4, within(1e-9));
    assertThat(store.get("C2").orElseThrow().getHotness()).isCloseTo(0.9, within(1e-9));
  }

  @Test
  void statsBinsConfidenceAndCountsLifecycles() {
    store.insert(new KnowledgeClusterBuilder().id("C1").confidence(1.0).build());
    store.insert(
        new KnowledgeClusterBuilder()
            .id("C2")
            .confidence(0.25)
            .lifecycle(Lifecycle.STABLE)
            .queryEmbedding(1f)
            .build());

    ClusterStats stats = store.stats();

    assertThat(stats.total()).isEqualTo(2);
    assertThat(stats.lifecycleCounts())
        .containsEntry(Lifecycle.EMERGING, 1L)
        .containsEntry(Lifecycle.STABLE, 1L)
        .containsEntry(Lifecycle.DEPRECATED, 0L);
    assertThat(stats.confidenceHistogram().get(9)).isEqualTo(1);
    assertThat(stats.confidenceHistogram().get(2)).isEqualTo(1);
    assertThat(stats.averageConfidence()).isCloseTo(0.625, within(1e-9));
    assertThat(stats.withEmbedding()).isEqualTo(1);
  }

  @Test
  void closedStoreRejectsCalls() {
    store.close();
    try {
      assertThat(store.isOpen()).isFalse();
      assertThatThrownBy(() -> store.get("C1"))
          .isInstanceOf(IllegalStateException.class)
          .hasMessageContaining("closed");
    } finally {
      store.open();
    }
  }

  @Test
  void contradictionNeedsOverlapAndDifferentText() {
    List<EvidenceUnit> existing = List.of(evidence("/a.md", 0, 100, "same  text"));

    assertThat(ClusterStore.contradicts(existing, List.of(evidence("/a.md", 10, 50, "other"))))
        .isTrue();
    List<EvidenceUnit> reworded = List.of(evidence("/a.md", 0, 100, "same text"));
    assertThat(ClusterStore.contradicts(existing, reworded)).isFalse();
    assertThat(ClusterStore.contradicts(existing, List.of(evidence("/a.md", 100, 150, "other"))))
        .isFalse();
    assertThat(ClusterStore.contradicts(existing, List.of(evidence("/b.md", 0, 100, "other"))))
        .isFalse();
  }

  @Test
  void binPutsOneInLastBin() {
    assertThat(ClusterStore.bin(0.0)).isZero();
    assertThat(ClusterStore.bin(0.99)).isEqualTo(9);
    assertThat(ClusterStore.bin(1.0)).isEqualTo(9);
  }
}
