package dev.sirchmunk.cluster;

import java.time.Clock;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Background upkeep of the cluster store, run on a fixed delay and never from a live search.
 *
 * <p>Each cycle cools clusters not reused since the previous cycle, re-scans every live
 * cluster's source files into its scan metadata, and deprecates clusters whose every source is
 * missing or changed.
 */
@Component
@ConditionalOnProperty(
    prefix = "sirchmunk.cluster",
    name = "maintenance-enabled",
    havingValue = "true",
    matchIfMissing = true)
public class ClusterMaintenanceJob {

  private static final Logger log = LoggerFactory.getLogger(ClusterMaintenanceJob.class);

  private final ClusterStore store;
  private final SourceVerifier sourceVerifier;
  private final ClusterProperties properties;
  private final Clock clock;

  private volatile Instant lastRun;

  public ClusterMaintenanceJob(
      ClusterStore store,
      SourceVerifier sourceVerifier,
      ClusterProperties properties,
      Clock clock) {
    this.store = store;
    this.sourceVerifier = sourceVerifier;
    this.properties = properties;
    this.clock = clock;
    this.lastRun = clock.instant();
  }

  @Scheduled(
      initialDelayString = "${sirchmunk.cluster.maintenance-interval-ms:3600000}",
      fixedDelayString = "${sirchmunk.cluster.maintenance-interval-ms:3600000}")
  void scheduled() {
    if (!store.isOpen()) {
      return;
    }
    try {
      runOnce();
    } catch (RuntimeException e) {
      log.error("Cluster maintenance failed: {}", e.getMessage(), e);
    }
  }

  /** Runs one maintenance cycle now. */
  public MaintenanceReport runOnce() {
    Instant since = lastRun;
    lastRun = clock.instant();
    int cooled = store.decayHotness(properties.getHotnessDecay(), since);

    int verified = 0;
    int deprecated = 0;
    for (String id : store.activeClusterIds()) {
      KnowledgeCluster cluster = store.get(id).orElse(null);
      if (cluster == null) {
        continue;
      }
      ScanMetadata scan = sourceVerifier.verify(cluster.sourcePaths(), cluster.getScanMetadata());
      store.applyScan(id, scan);
      verified++;
      if (SourceVerifier.allBroken(scan, cluster.sourcePaths())) {
        store.deprecate(id, "all evidence sources missing or changed");
        deprecated++;
      }
    }
    MaintenanceReport report = new MaintenanceReport(cooled, verified, deprecated);
    log.info("Cluster maintenance: {}", report);
    return report;
  }
}
